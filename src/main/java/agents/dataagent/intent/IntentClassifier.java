package agents.dataagent.intent;

import agents.dataagent.catalog.VisualizationType;
import agents.dataagent.schema.SchemaDescriptor;
import agents.dataagent.services.CompletionService;
import agents.dataagent.services.LogUtil;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

import java.util.ArrayList;
import java.util.List;

/**
 * Classifies a prompt as analytical, data modification or general, and for analytical prompts
 * names the visualization types that answer it.
 *
 * <p>Never fails: any backend error or unusable reply yields
 * {@link ClassificationResult#fallback(String)}.</p>
 */
public class IntentClassifier {

  private static final String SYSTEM_PROMPT = """
      You are an expert data analyst who classifies user questions about a database before they are answered.

      Database Schema:
      %s

      Classify the user's question into exactly one questionType:
      - "analytical": the user wants to see, measure, compare or explore data (totals, trends, breakdowns, lists)
      - "data_modification": the user wants to create, add, edit, update or delete records
      - "general": greetings, help requests or questions unrelated to the data

      For analytical questions, list the visualizations that together answer the question, in display order.
      Allowed visualization tags:
      - "single-metric": one number (total, average, count, percentage)
      - "time-series": values over time, trends
      - "categorical-comparison": comparing categories, rankings, distributions
      - "proportion": shares of a whole, composition
      - "tabular": detailed lists of records with several attributes

      Set needsMultiple to true when the question asks for more than one view
      (for example "show total orders and list them").
      Leave visualizations empty when any visualization could answer it.

      Respond with a JSON object:
      {
        "questionType": "analytical" | "data_modification" | "general",
        "visualizations": ["single-metric", ...],
        "needsMultiple": boolean,
        "reasoning": "brief explanation"
      }
      """;

  private final Vertx vertx;
  private final CompletionService completion;
  private final SchemaDescriptor schema;

  public IntentClassifier(Vertx vertx, CompletionService completion, SchemaDescriptor schema) {
    this.vertx = vertx;
    this.completion = completion;
    this.schema = schema;
  }

  public Future<ClassificationResult> classify(String prompt) {
    Promise<ClassificationResult> promise = Promise.promise();
    String systemPrompt = String.format(SYSTEM_PROMPT, schema.describe());
    String userPrompt = "User question: \"" + prompt + "\"\n\nClassify this question.";

    completion.completeJson(systemPrompt, userPrompt, 0.1, 500).onComplete(ar -> {
      if (ar.failed()) {
        LogUtil.logError(vertx, "Classification failed; treating prompt as analytical", ar.cause(),
          "IntentClassifier", "Classify", "Fallback");
        promise.complete(ClassificationResult.fallback("Classification unavailable: " + ar.cause().getMessage()));
        return;
      }
      ClassificationResult result = parse(ar.result());
      LogUtil.logDetail(vertx, "Classified prompt as " + result.getQuestionType().getWireName()
        + " " + result.getVisualizations() + " needsMultiple=" + result.isNeedsMultiple(),
        "IntentClassifier", "Classify", "Result");
      promise.complete(result);
    });
    return promise.future();
  }

  /**
   * Validate a classification reply. Unknown visualization tags are dropped; an unknown
   * question type makes the whole reply unusable.
   */
  static ClassificationResult parse(JsonObject reply) {
    if (reply == null) {
      return ClassificationResult.fallback("Empty classification");
    }
    Object rawType = reply.getValue("questionType");
    QuestionType questionType = rawType instanceof String ? QuestionType.fromWireName((String) rawType) : null;
    if (questionType == null) {
      return ClassificationResult.fallback("Unrecognized question type: " + rawType);
    }

    List<VisualizationType> visualizations = new ArrayList<>();
    Object rawVisualizations = reply.getValue("visualizations");
    if (rawVisualizations instanceof JsonArray) {
      for (Object tag : (JsonArray) rawVisualizations) {
        VisualizationType type = tag instanceof String ? VisualizationType.fromTag((String) tag) : null;
        if (type != null && type != VisualizationType.CONTAINER) {
          visualizations.add(type);
        }
      }
    }

    boolean needsMultiple = Boolean.TRUE.equals(reply.getValue("needsMultiple"));
    String reasoning = reply.getValue("reasoning") instanceof String ? reply.getString("reasoning") : "";
    return new ClassificationResult(questionType, visualizations,
      questionType == QuestionType.ANALYTICAL && needsMultiple, reasoning);
  }
}
