package agents.dataagent.intent;

import agents.dataagent.catalog.VisualizationType;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Outcome of prompt classification. Visualizations are only ever present for analytical prompts.
 */
public final class ClassificationResult {

  private final QuestionType questionType;
  private final List<VisualizationType> visualizations;
  private final boolean needsMultiple;
  private final String reasoning;

  public ClassificationResult(QuestionType questionType, List<VisualizationType> visualizations,
                              boolean needsMultiple, String reasoning) {
    this.questionType = questionType;
    this.visualizations = questionType == QuestionType.ANALYTICAL && visualizations != null
      ? Collections.unmodifiableList(new ArrayList<>(visualizations))
      : Collections.emptyList();
    this.needsMultiple = needsMultiple;
    this.reasoning = reasoning;
  }

  /**
   * Used whenever classification cannot be obtained: attempt an analytical resolution.
   */
  public static ClassificationResult fallback(String reason) {
    return new ClassificationResult(QuestionType.ANALYTICAL, Collections.emptyList(), false, reason);
  }

  public QuestionType getQuestionType() { return questionType; }
  public List<VisualizationType> getVisualizations() { return visualizations; }
  public boolean isNeedsMultiple() { return needsMultiple; }
  public String getReasoning() { return reasoning; }

  public JsonObject toJson() {
    JsonArray types = new JsonArray();
    visualizations.forEach(type -> types.add(type.getTag()));
    return new JsonObject()
      .put("questionType", questionType.getWireName())
      .put("visualizations", types)
      .put("needsMultiple", needsMultiple)
      .put("reasoning", reasoning);
  }
}
