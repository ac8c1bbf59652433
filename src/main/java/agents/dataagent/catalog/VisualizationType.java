package agents.dataagent.catalog;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Visualization vocabulary of generated artifacts.
 * Each type has a wire tag and accepts the legacy component names older runtimes still send.
 */
public enum VisualizationType {
  SINGLE_METRIC("single-metric", "SingleMetric", "KPICard"),
  TIME_SERIES("time-series", "TimeSeries", "LineChart"),
  CATEGORICAL_COMPARISON("categorical-comparison", "CategoricalComparison", "BarChart"),
  PROPORTION("proportion", "Proportion", "PieChart", "DonutChart"),
  TABULAR("tabular", "Tabular", "DataTable", "data-table", "table"),
  CONTAINER("container", "Container", "MultiComponentContainer");

  private final String tag;
  private final String typeName;
  private final List<String> aliases;

  VisualizationType(String tag, String typeName, String... aliases) {
    this.tag = tag;
    this.typeName = typeName;
    this.aliases = Collections.unmodifiableList(Arrays.asList(aliases));
  }

  public String getTag() {
    return tag;
  }

  /** PascalCase name used for synthesized artifact names. */
  public String getTypeName() {
    return typeName;
  }

  public List<String> getAliases() {
    return aliases;
  }

  /**
   * Resolve a wire tag or legacy alias, ignoring case. Returns null for tags outside the vocabulary.
   */
  public static VisualizationType fromTag(String value) {
    if (value == null) {
      return null;
    }
    String candidate = value.trim();
    for (VisualizationType type : values()) {
      if (type.tag.equalsIgnoreCase(candidate) || type.typeName.equalsIgnoreCase(candidate)) {
        return type;
      }
      for (String alias : type.aliases) {
        if (alias.equalsIgnoreCase(candidate)) {
          return type;
        }
      }
    }
    return null;
  }

  /**
   * Tags a classifier or generator may ask for: everything except the container.
   */
  public static List<VisualizationType> leafTypes() {
    return Arrays.asList(SINGLE_METRIC, TIME_SERIES, CATEGORICAL_COMPARISON, PROPORTION, TABULAR);
  }
}
