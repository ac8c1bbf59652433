package agents.dataagent.catalog;

import io.vertx.core.json.JsonObject;

/**
 * Props of an artifact: the data-fetch query, display strings and the typed config.
 * Keys the agent does not interpret are carried in the extras.
 */
public final class ArtifactProps {

  private final String query;
  private final String title;
  private final String description;
  private final ArtifactConfig config;
  private final JsonObject extras;

  public ArtifactProps(String query, String title, String description, ArtifactConfig config, JsonObject extras) {
    this.query = query;
    this.title = title;
    this.description = description;
    this.config = config == null ? new ArtifactConfig.FreeformConfig(new JsonObject()) : config;
    this.extras = extras == null ? new JsonObject() : extras;
  }

  public static ArtifactProps fromJson(String typeTag, JsonObject json) {
    JsonObject source = json == null ? new JsonObject() : json.copy();
    String query = ArtifactConfig.takeString(source, "query");
    String title = ArtifactConfig.takeString(source, "title");
    String description = ArtifactConfig.takeString(source, "description");
    JsonObject rawConfig = null;
    if (source.getValue("config") instanceof JsonObject) {
      rawConfig = (JsonObject) source.remove("config");
    }
    return new ArtifactProps(query, title, description, ArtifactConfig.fromJson(typeTag, rawConfig), source);
  }

  public String getQuery() { return query; }
  public String getTitle() { return title; }
  public String getDescription() { return description; }
  public ArtifactConfig getConfig() { return config; }

  public JsonObject getExtras() {
    return extras.copy();
  }

  public boolean hasQuery() {
    return query != null && !query.trim().isEmpty();
  }

  public ArtifactProps withQuery(String newQuery) {
    return new ArtifactProps(newQuery, title, description, config, extras);
  }

  public JsonObject toJson() {
    JsonObject json = extras.copy();
    ArtifactConfig.putIfPresent(json, "query", query);
    ArtifactConfig.putIfPresent(json, "title", title);
    ArtifactConfig.putIfPresent(json, "description", description);
    JsonObject configJson = config.toJson();
    if (config.getType() != null || !configJson.isEmpty()) {
      json.put("config", configJson);
    }
    return json;
  }
}
