package agents.dataagent.catalog;

import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Rendering configuration of an artifact, one variant per visualization type.
 *
 * <p>Every variant keeps the keys it does not model in {@link #getExtras()} and writes them back
 * in {@link #toJson()}, so configuration coming from the catalog or the completion backend
 * survives a round trip untouched.</p>
 */
public abstract class ArtifactConfig {

  private final JsonObject extras;

  protected ArtifactConfig(JsonObject extras) {
    this.extras = extras == null ? new JsonObject() : extras;
  }

  /**
   * Visualization type this variant belongs to, or null for free-form configuration.
   */
  public abstract VisualizationType getType();

  protected abstract void writeFields(JsonObject json);

  public JsonObject getExtras() {
    return extras.copy();
  }

  public JsonObject toJson() {
    JsonObject json = extras.copy();
    writeFields(json);
    return json;
  }

  /**
   * Parse the config object of an artifact whose type tag is {@code typeTag}.
   * Unknown tags yield a {@link FreeformConfig}.
   */
  public static ArtifactConfig fromJson(String typeTag, JsonObject json) {
    JsonObject source = json == null ? new JsonObject() : json.copy();
    VisualizationType type = VisualizationType.fromTag(typeTag);
    if (type == null) {
      return new FreeformConfig(source);
    }
    switch (type) {
      case SINGLE_METRIC:
        return MetricConfig.parse(source);
      case TIME_SERIES:
      case CATEGORICAL_COMPARISON:
        return AxisChartConfig.parse(type, source);
      case PROPORTION:
        return ProportionConfig.parse(source);
      case TABULAR:
        return TabularConfig.parse(source);
      case CONTAINER:
        return ContainerConfig.parse(source);
      default:
        return new FreeformConfig(source);
    }
  }

  /**
   * Empty configuration of the given type.
   */
  public static ArtifactConfig empty(VisualizationType type) {
    return fromJson(type == null ? null : type.getTag(), new JsonObject());
  }

  /* ---------- field extraction helpers; a value of the wrong shape stays in the extras ---------- */

  static String takeString(JsonObject source, String key) {
    Object value = source.getValue(key);
    if (value instanceof String) {
      source.remove(key);
      return (String) value;
    }
    return null;
  }

  static Integer takeInteger(JsonObject source, String key) {
    Object value = source.getValue(key);
    if (value instanceof Number) {
      source.remove(key);
      return ((Number) value).intValue();
    }
    return null;
  }

  static List<String> takeStrings(JsonObject source, String key) {
    Object value = source.getValue(key);
    if (!(value instanceof JsonArray)) {
      return null;
    }
    JsonArray array = (JsonArray) value;
    List<String> strings = new ArrayList<>();
    for (Object item : array) {
      if (!(item instanceof String)) {
        return null;
      }
      strings.add((String) item);
    }
    source.remove(key);
    return Collections.unmodifiableList(strings);
  }

  static void putIfPresent(JsonObject json, String key, Object value) {
    if (value instanceof List) {
      json.put(key, new JsonArray(new ArrayList<>((List<?>) value)));
    } else if (value != null) {
      json.put(key, value);
    }
  }

  /** single-metric: a KPI card. */
  public static final class MetricConfig extends ArtifactConfig {
    private final String formatter;
    private final String gradient;
    private final String icon;

    public MetricConfig(String formatter, String gradient, String icon, JsonObject extras) {
      super(extras);
      this.formatter = formatter;
      this.gradient = gradient;
      this.icon = icon;
    }

    static MetricConfig parse(JsonObject source) {
      return new MetricConfig(takeString(source, "formatter"), takeString(source, "gradient"),
        takeString(source, "icon"), source);
    }

    @Override
    public VisualizationType getType() { return VisualizationType.SINGLE_METRIC; }

    public String getFormatter() { return formatter; }
    public String getGradient() { return gradient; }
    public String getIcon() { return icon; }

    @Override
    protected void writeFields(JsonObject json) {
      putIfPresent(json, "formatter", formatter);
      putIfPresent(json, "gradient", gradient);
      putIfPresent(json, "icon", icon);
    }
  }

  /** time-series and categorical-comparison: charts with an x and a y axis. */
  public static final class AxisChartConfig extends ArtifactConfig {
    private final VisualizationType type;
    private final String xKey;
    private final String yKey;
    private final List<String> colors;
    private final Integer height;

    public AxisChartConfig(VisualizationType type, String xKey, String yKey, List<String> colors,
                           Integer height, JsonObject extras) {
      super(extras);
      if (type != VisualizationType.TIME_SERIES && type != VisualizationType.CATEGORICAL_COMPARISON) {
        throw new IllegalArgumentException("Axis chart config cannot describe " + type);
      }
      this.type = type;
      this.xKey = xKey;
      this.yKey = yKey;
      this.colors = colors;
      this.height = height;
    }

    static AxisChartConfig parse(VisualizationType type, JsonObject source) {
      return new AxisChartConfig(type, takeString(source, "xKey"), takeString(source, "yKey"),
        takeStrings(source, "colors"), takeInteger(source, "height"), source);
    }

    @Override
    public VisualizationType getType() { return type; }

    public String getXKey() { return xKey; }
    public String getYKey() { return yKey; }
    public List<String> getColors() { return colors; }
    public Integer getHeight() { return height; }

    @Override
    protected void writeFields(JsonObject json) {
      putIfPresent(json, "xKey", xKey);
      putIfPresent(json, "yKey", yKey);
      putIfPresent(json, "colors", colors);
      putIfPresent(json, "height", height);
    }
  }

  /** proportion: pie and donut charts. */
  public static final class ProportionConfig extends ArtifactConfig {
    private final String nameKey;
    private final String valueKey;
    private final List<String> colors;
    private final Integer height;

    public ProportionConfig(String nameKey, String valueKey, List<String> colors, Integer height, JsonObject extras) {
      super(extras);
      this.nameKey = nameKey;
      this.valueKey = valueKey;
      this.colors = colors;
      this.height = height;
    }

    static ProportionConfig parse(JsonObject source) {
      return new ProportionConfig(takeString(source, "nameKey"), takeString(source, "valueKey"),
        takeStrings(source, "colors"), takeInteger(source, "height"), source);
    }

    @Override
    public VisualizationType getType() { return VisualizationType.PROPORTION; }

    public String getNameKey() { return nameKey; }
    public String getValueKey() { return valueKey; }
    public List<String> getColors() { return colors; }
    public Integer getHeight() { return height; }

    @Override
    protected void writeFields(JsonObject json) {
      putIfPresent(json, "nameKey", nameKey);
      putIfPresent(json, "valueKey", valueKey);
      putIfPresent(json, "colors", colors);
      putIfPresent(json, "height", height);
    }
  }

  /** tabular: a paged data table. Columns are kept as given (names or column descriptors). */
  public static final class TabularConfig extends ArtifactConfig {
    private final JsonArray columns;
    private final Integer pageSize;

    public TabularConfig(JsonArray columns, Integer pageSize, JsonObject extras) {
      super(extras);
      this.columns = columns;
      this.pageSize = pageSize;
    }

    static TabularConfig parse(JsonObject source) {
      JsonArray columns = null;
      if (source.getValue("columns") instanceof JsonArray) {
        columns = (JsonArray) source.remove("columns");
      }
      return new TabularConfig(columns, takeInteger(source, "pageSize"), source);
    }

    @Override
    public VisualizationType getType() { return VisualizationType.TABULAR; }

    public JsonArray getColumns() { return columns == null ? null : columns.copy(); }
    public Integer getPageSize() { return pageSize; }

    @Override
    protected void writeFields(JsonObject json) {
      putIfPresent(json, "columns", columns == null ? null : columns.copy());
      putIfPresent(json, "pageSize", pageSize);
    }
  }

  /**
   * container: an ordered group of child artifacts. Children are never containers themselves;
   * a nested container is replaced by its own children.
   */
  public static final class ContainerConfig extends ArtifactConfig {
    public static final String DEFAULT_LAYOUT = "grid";

    private final List<Artifact> components;
    private final String layout;

    public ContainerConfig(List<Artifact> components, String layout, JsonObject extras) {
      super(extras);
      this.components = Collections.unmodifiableList(flatten(components));
      this.layout = layout == null ? DEFAULT_LAYOUT : layout;
    }

    public static ContainerConfig of(List<Artifact> components) {
      return new ContainerConfig(components, DEFAULT_LAYOUT, null);
    }

    static ContainerConfig parse(JsonObject source) {
      List<Artifact> children = new ArrayList<>();
      Object rawComponents = source.getValue("components");
      if (rawComponents instanceof JsonArray) {
        source.remove("components");
        for (Object child : (JsonArray) rawComponents) {
          if (child instanceof JsonObject) {
            children.add(Artifact.fromJson((JsonObject) child));
          }
        }
      }
      return new ContainerConfig(children, takeString(source, "layout"), source);
    }

    private static List<Artifact> flatten(List<Artifact> components) {
      List<Artifact> flat = new ArrayList<>();
      if (components == null) {
        return flat;
      }
      for (Artifact child : components) {
        if (child == null) {
          continue;
        }
        if (child.isContainer()) {
          ArtifactConfig nested = child.getProps().getConfig();
          if (nested instanceof ContainerConfig) {
            flat.addAll(((ContainerConfig) nested).getComponents());
          }
        } else {
          flat.add(child);
        }
      }
      return flat;
    }

    @Override
    public VisualizationType getType() { return VisualizationType.CONTAINER; }

    public List<Artifact> getComponents() { return components; }
    public String getLayout() { return layout; }

    @Override
    protected void writeFields(JsonObject json) {
      JsonArray children = new JsonArray();
      components.forEach(child -> children.add(child.toJson()));
      json.put("components", children);
      json.put("layout", layout);
    }
  }

  /** Configuration of catalog artifacts outside the visualization vocabulary (forms, pages, dashboards). */
  public static final class FreeformConfig extends ArtifactConfig {

    public FreeformConfig(JsonObject values) {
      super(values);
    }

    @Override
    public VisualizationType getType() { return null; }

    @Override
    protected void writeFields(JsonObject json) {
    }
  }
}
