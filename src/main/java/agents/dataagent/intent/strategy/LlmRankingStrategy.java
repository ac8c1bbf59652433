package agents.dataagent.intent.strategy;

import agents.dataagent.catalog.Artifact;
import agents.dataagent.catalog.CatalogSnapshot;
import agents.dataagent.intent.ResolutionMethod;
import agents.dataagent.intent.ResolutionResult;
import agents.dataagent.services.CompletionService;
import agents.dataagent.services.LogUtil;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

import java.util.List;

/**
 * Ranks the whole in-memory catalog with the completion backend and accepts its best pick when
 * the reported confidence is at least {@value #MIN_CONFIDENCE}.
 */
public class LlmRankingStrategy implements ResolutionStrategy {

  public static final int MIN_CONFIDENCE = 30;

  private static final String SYSTEM_PROMPT = """
      You are an expert AI assistant specialized in matching user requests to the most appropriate data visualization components.

      Available Components (%d total):
      %s

      Matching guidelines:
      1. Understand the intent: a single metric, a trend over time, a comparison, a proportion or a detailed list.
      2. Match the component type to that intent.
      3. Match the user's terms against names, descriptions and keywords, considering synonyms
         (e.g. "sales" = "revenue", "items" = "products").
      4. Prefer specific components over generic ones.

      Respond with a JSON object:
      {
        "componentIndex": <1-based index of the best component, or null if confidence < %d>,
        "componentId": "<id of the best component>",
        "reasoning": "why this component was chosen",
        "confidence": <0-100>,
        "alternativeMatches": [{"index": <n>, "id": "<id>", "score": <0-100>, "reason": "..."}]
      }

      Return at most 2 alternative matches. Return null for componentIndex if no reasonable match exists.
      """;

  private final Vertx vertx;
  private final CompletionService completion;

  public LlmRankingStrategy(Vertx vertx, CompletionService completion) {
    this.vertx = vertx;
    this.completion = completion;
  }

  @Override
  public String name() {
    return "llm-ranking";
  }

  @Override
  public Future<MatchOutcome> resolve(String prompt, ResolutionContext context) {
    CatalogSnapshot catalog = context.getCatalog();
    if (catalog.isEmpty()) {
      return Future.succeededFuture(MatchOutcome.noMatch("No components available in the catalog"));
    }

    String systemPrompt = String.format(SYSTEM_PROMPT, catalog.size(), listing(catalog.getArtifacts()), MIN_CONFIDENCE);
    String userPrompt = "User request: \"" + prompt + "\"\n\n"
      + "Find the best matching component and explain your reasoning with a confidence score.";

    return completion.completeJson(systemPrompt, userPrompt, 0.2, 800)
      .map(reply -> select(reply, catalog))
      .otherwise(err -> {
        LogUtil.logError(vertx, "Catalog ranking failed", err, "LlmRankingStrategy", "Match", "Error");
        return MatchOutcome.noMatch("Catalog ranking unavailable: " + err.getMessage());
      });
  }

  MatchOutcome select(JsonObject reply, CatalogSnapshot catalog) {
    int confidence = number(reply.getValue("confidence"));
    String reasoning = reply.getValue("reasoning") instanceof String ? reply.getString("reasoning") : "No reasoning provided";

    Artifact artifact = null;
    Object componentId = reply.getValue("componentId");
    if (componentId != null) {
      artifact = catalog.findById(String.valueOf(componentId));
    }
    if (artifact == null && reply.getValue("componentIndex") != null) {
      artifact = catalog.atPosition(number(reply.getValue("componentIndex")));
    }

    logAlternatives(reply.getValue("alternativeMatches"), catalog);

    if (artifact == null || confidence < MIN_CONFIDENCE) {
      LogUtil.logDetail(vertx, "No catalog match (confidence " + confidence + ")", "LlmRankingStrategy", "Match", "None");
      return MatchOutcome.noMatch(reasoning);
    }

    LogUtil.logDetail(vertx, "Ranked catalog match: " + artifact.getName() + " (" + confidence + ")",
      "LlmRankingStrategy", "Match", "Selected");
    return MatchOutcome.matched(ResolutionResult.builder(ResolutionMethod.LLM_RANKING)
      .artifact(artifact)
      .reasoning(reasoning)
      .confidence(confidence)
      .build());
  }

  static String listing(List<Artifact> artifacts) {
    StringBuilder text = new StringBuilder();
    for (int i = 0; i < artifacts.size(); i++) {
      Artifact artifact = artifacts.get(i);
      if (i > 0) {
        text.append("\n\n");
      }
      text.append(i + 1).append(". ID: ").append(artifact.getId())
        .append("\n   Name: ").append(artifact.getName())
        .append("\n   Type: ").append(artifact.getType())
        .append("\n   Category: ").append(artifact.getCategory() == null ? "general" : artifact.getCategory())
        .append("\n   Description: ").append(artifact.getDescription() == null ? "No description" : artifact.getDescription())
        .append("\n   Keywords: ").append(String.join(", ", artifact.getKeywords()));
    }
    return text.toString();
  }

  private void logAlternatives(Object alternatives, CatalogSnapshot catalog) {
    if (!(alternatives instanceof JsonArray)) {
      return;
    }
    JsonArray list = (JsonArray) alternatives;
    for (int i = 0; i < Math.min(2, list.size()); i++) {
      if (list.getValue(i) instanceof JsonObject) {
        JsonObject alt = list.getJsonObject(i);
        Artifact candidate = catalog.atPosition(number(alt.getValue("index")));
        LogUtil.logDebug(vertx, "Alternative: " + (candidate == null ? alt.getValue("id") : candidate.getName())
          + " (" + number(alt.getValue("score")) + ") " + alt.getValue("reason"), "LlmRankingStrategy", "Match", "Alternative");
      }
    }
  }

  private static int number(Object value) {
    if (value instanceof Number) {
      return ((Number) value).intValue();
    }
    if (value instanceof String) {
      try {
        return (int) Math.round(Double.parseDouble(((String) value).trim()));
      } catch (NumberFormatException e) {
        return 0;
      }
    }
    return 0;
  }
}
