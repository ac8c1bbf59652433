package agents.dataagent.candidates;

import agents.dataagent.catalog.Artifact;
import agents.dataagent.catalog.VisualizationType;
import io.vertx.core.json.JsonObject;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Builds the embedded text and stored metadata of catalog artifacts.
 *
 * <p>The text is {@code name: description} followed by intent keywords for the artifact's kind,
 * so a prompt such as "show me all products" lands near tables and "add a supplier" near
 * creation forms.</p>
 */
public final class CandidateDocuments {

  public static final String COMPONENT_DATA_KEY = "componentData";

  static final String TABLE_KEYWORDS = "view, display, show, get, fetch, retrieve, see, browse, list, table, grid, records, rows, data, information, dataset, collection";
  static final String EDIT_FORM_KEYWORDS = "update, edit, modify, change, revise, alter, correct";
  static final String CREATE_FORM_KEYWORDS = "create, add, insert, new, submit, input, fill, enter";
  static final String DASHBOARD_KEYWORDS = "analytics, metrics, overview, summary, insights, statistics, monitoring, kpi, performance";
  static final String CHART_KEYWORDS = "visualize, plot, chart, graph, analyze, trends, visual";
  static final String PAGE_KEYWORDS = "details, view, information, profile, page";

  private CandidateDocuments() {
  }

  public static CandidateDocument forArtifact(Artifact artifact) {
    return new CandidateDocument(artifact.getId(), documentText(artifact), null, metadata(artifact));
  }

  public static List<CandidateDocument> forArtifacts(List<Artifact> artifacts) {
    List<CandidateDocument> documents = new ArrayList<>();
    for (Artifact artifact : artifacts) {
      if (artifact.getId() != null) {
        documents.add(forArtifact(artifact));
      }
    }
    return documents;
  }

  public static String documentText(Artifact artifact) {
    StringBuilder text = new StringBuilder()
      .append(nullToEmpty(artifact.getName()))
      .append(": ")
      .append(nullToEmpty(artifact.getDescription()));

    String keywords = intentKeywords(artifact);
    if (keywords != null) {
      text.append(" Keywords: ").append(keywords);
    }
    if (!artifact.getKeywords().isEmpty()) {
      text.append(" Tags: ").append(String.join(", ", artifact.getKeywords()));
    }
    return text.toString();
  }

  static String intentKeywords(Artifact artifact) {
    String type = nullToEmpty(artifact.getType()).toLowerCase(Locale.ROOT);
    String name = nullToEmpty(artifact.getName()).toLowerCase(Locale.ROOT);
    VisualizationType visualization = artifact.getVisualizationType();

    if (visualization == VisualizationType.TABULAR) {
      return TABLE_KEYWORDS;
    }
    if ("form".equals(type)) {
      return name.contains("update") || name.contains("edit") ? EDIT_FORM_KEYWORDS : CREATE_FORM_KEYWORDS;
    }
    if ("dashboard".equals(type) || visualization == VisualizationType.SINGLE_METRIC) {
      return DASHBOARD_KEYWORDS;
    }
    if ("chart".equals(type) || "graph".equals(type)
      || visualization == VisualizationType.TIME_SERIES
      || visualization == VisualizationType.CATEGORICAL_COMPARISON
      || visualization == VisualizationType.PROPORTION) {
      return CHART_KEYWORDS;
    }
    if ("page".equals(type)) {
      return PAGE_KEYWORDS;
    }
    return null;
  }

  /**
   * Scalar metadata stored next to the embedding; {@value #COMPONENT_DATA_KEY} carries the full artifact.
   */
  public static JsonObject metadata(Artifact artifact) {
    return new JsonObject()
      .put("name", nullToEmpty(artifact.getName()))
      .put("type", nullToEmpty(artifact.getType()))
      .put("description", nullToEmpty(artifact.getDescription()))
      .put("props", artifact.getProps().toJson().encode())
      .put(COMPONENT_DATA_KEY, artifact.toJson().encode());
  }

  private static String nullToEmpty(String value) {
    return value == null ? "" : value;
  }
}
