package agents.dataagent.catalog;

import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A renderable UI description: either a catalog component supplied by the runtime or an
 * artifact synthesized for one prompt.
 *
 * <p>The type tag is preserved exactly as received; {@link #getVisualizationType()} resolves it
 * against the visualization vocabulary, including legacy aliases.</p>
 */
public final class Artifact {

  public static final String DYNAMIC_CATEGORY = "dynamic";

  private final String id;
  private final String name;
  private final String type;
  private final String description;
  private final String category;
  private final List<String> keywords;
  private final ArtifactProps props;
  private final JsonObject extras;

  public Artifact(String id, String name, String type, String description, String category,
                  List<String> keywords, ArtifactProps props, JsonObject extras) {
    this.id = id;
    this.name = name;
    this.type = type;
    this.description = description;
    this.category = category;
    Set<String> unique = new LinkedHashSet<>();
    if (keywords != null) {
      keywords.stream().filter(Objects::nonNull).forEach(unique::add);
    }
    this.keywords = Collections.unmodifiableList(new ArrayList<>(unique));
    this.props = props == null ? ArtifactProps.fromJson(type, null) : props;
    this.extras = extras == null ? new JsonObject() : extras;
  }

  /**
   * Mint a synthesized artifact. Its name is {@code Dynamic<TypeName>}, its category {@code dynamic}.
   */
  public static Artifact synthesized(String id, VisualizationType type, String description, ArtifactProps props) {
    return new Artifact(id, "Dynamic" + type.getTypeName(), type.getTag(), description,
      DYNAMIC_CATEGORY, Collections.emptyList(), props, null);
  }

  /**
   * Id of a synthesized artifact: {@code dynamic_<type>_<epochMillis>} with an optional position suffix.
   */
  public static String dynamicId(VisualizationType type, long epochMillis, Integer position) {
    String id = "dynamic_" + type.getTag() + "_" + epochMillis;
    return position == null ? id : id + "_" + position;
  }

  public static Artifact fromJson(JsonObject json) {
    JsonObject source = json == null ? new JsonObject() : json.copy();
    Object rawId = source.remove("id");
    String type = ArtifactConfig.takeString(source, "type");
    String name = ArtifactConfig.takeString(source, "name");
    String description = ArtifactConfig.takeString(source, "description");
    String category = ArtifactConfig.takeString(source, "category");

    List<String> keywords = new ArrayList<>();
    if (source.getValue("keywords") instanceof JsonArray) {
      for (Object keyword : (JsonArray) source.remove("keywords")) {
        if (keyword != null) {
          keywords.add(String.valueOf(keyword));
        }
      }
    }

    JsonObject rawProps = null;
    if (source.getValue("props") instanceof JsonObject) {
      rawProps = (JsonObject) source.remove("props");
    }

    return new Artifact(rawId == null ? null : String.valueOf(rawId), name, type, description, category,
      keywords, ArtifactProps.fromJson(type, rawProps), source);
  }

  public String getId() { return id; }
  public String getName() { return name; }
  public String getType() { return type; }
  public String getDescription() { return description; }
  public String getCategory() { return category; }
  public List<String> getKeywords() { return keywords; }
  public ArtifactProps getProps() { return props; }

  public VisualizationType getVisualizationType() {
    return VisualizationType.fromTag(type);
  }

  public boolean isContainer() {
    return getVisualizationType() == VisualizationType.CONTAINER;
  }

  public Artifact withProps(ArtifactProps newProps) {
    return new Artifact(id, name, type, description, category, keywords, newProps, extras);
  }

  public JsonObject toJson() {
    JsonObject json = extras.copy();
    ArtifactConfig.putIfPresent(json, "id", id);
    ArtifactConfig.putIfPresent(json, "name", name);
    ArtifactConfig.putIfPresent(json, "type", type);
    ArtifactConfig.putIfPresent(json, "description", description);
    ArtifactConfig.putIfPresent(json, "category", category);
    json.put("keywords", new JsonArray(new ArrayList<>(keywords)));
    json.put("props", props.toJson());
    return json;
  }

  @Override
  public String toString() {
    return "Artifact{id='" + id + "', name='" + name + "', type='" + type + "'}";
  }
}
