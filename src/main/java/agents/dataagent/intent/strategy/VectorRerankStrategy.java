package agents.dataagent.intent.strategy;

import agents.dataagent.candidates.CandidateMatch;
import agents.dataagent.candidates.CandidateStore;
import agents.dataagent.candidates.EmbeddingService;
import agents.dataagent.catalog.Artifact;
import agents.dataagent.intent.ResolutionMethod;
import agents.dataagent.intent.ResolutionResult;
import agents.dataagent.services.CompletionService;
import agents.dataagent.services.LogUtil;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.json.JsonObject;

import java.util.ArrayList;
import java.util.List;

/**
 * Retrieves the nearest catalog entries from the candidate store and lets the completion backend
 * pick one of exactly those candidates.
 *
 * <p>A missing collection, a retrieval error or an empty result is a no-match, so the next
 * strategy in the chain gets its turn. If the re-rank call fails or picks outside the candidate
 * list, the nearest neighbour is used.</p>
 */
public class VectorRerankStrategy implements ResolutionStrategy {

  private static final String RERANK_PROMPT = """
      You are an AI assistant that selects the best matching component from a ranked list.

      User request: "%s"

      Top %d candidates (ordered by vector similarity):
      %s

      Analyze the user's intent and select the component that BEST matches their request.

      Rules:
      - If user wants to VIEW/SEE/DISPLAY/GET/SHOW data -> select data-table components
      - If user wants to CREATE/ADD/INSERT data -> select form components (not update forms)
      - If user wants to EDIT/UPDATE/MODIFY data -> select update/edit form components
      - If user wants analytics/insights -> select dashboard/chart components

      Respond with a JSON object:
      {
        "componentIndex": <number 1-%d>,
        "reasoning": "<brief explanation>"
      }
      """;

  private final Vertx vertx;
  private final CandidateStore store;
  private final EmbeddingService embeddings;
  private final CompletionService completion;

  public VectorRerankStrategy(Vertx vertx, CandidateStore store, EmbeddingService embeddings, CompletionService completion) {
    this.vertx = vertx;
    this.store = store;
    this.embeddings = embeddings;
    this.completion = completion;
  }

  @Override
  public String name() {
    return "vector-search";
  }

  @Override
  public Future<MatchOutcome> resolve(String prompt, ResolutionContext context) {
    String collection = context.getCollectionName();

    return store.exists(collection)
      .compose(exists -> {
        if (!exists) {
          return Future.succeededFuture(MatchOutcome.noMatch("Candidate collection \"" + collection + "\" does not exist."));
        }
        return retrieve(prompt, collection, context.getTopK())
          .compose(candidates -> candidates.isEmpty()
            ? Future.succeededFuture(MatchOutcome.noMatch("No matching components found in the candidate store"))
            : rerank(prompt, candidates));
      })
      .otherwise(err -> {
        LogUtil.logError(vertx, "Vector retrieval failed; falling back", err, "VectorRerankStrategy", "Match", "Error");
        return MatchOutcome.noMatch("Candidate store unavailable: " + err.getMessage());
      });
  }

  private Future<List<Artifact>> retrieve(String prompt, String collection, int topK) {
    return embeddings.embed(prompt)
      .compose(vector -> store.query(collection, vector, topK))
      .map(matches -> {
        List<Artifact> candidates = new ArrayList<>();
        for (CandidateMatch match : matches) {
          Artifact artifact = match.toArtifact();
          if (artifact != null) {
            candidates.add(artifact);
          }
        }
        LogUtil.logDetail(vertx, "Vector search returned " + candidates.size() + " candidates from " + collection,
          "VectorRerankStrategy", "Match", "Retrieve");
        return candidates;
      });
  }

  private Future<MatchOutcome> rerank(String prompt, List<Artifact> candidates) {
    String systemPrompt = String.format(RERANK_PROMPT, prompt, candidates.size(), listing(candidates), candidates.size());

    return completion.completeJson(systemPrompt, "Select the best component", 0.1, 500)
      .map(reply -> pick(reply, candidates))
      .otherwise(err -> {
        LogUtil.logError(vertx, "Re-rank failed; using nearest neighbour", err, "VectorRerankStrategy", "Match", "Rerank");
        return new Pick(candidates.get(0), "Selected based on semantic similarity");
      })
      .map(pick -> MatchOutcome.matched(ResolutionResult.builder(ResolutionMethod.VECTOR_SEARCH)
        .artifact(pick.artifact)
        .reasoning("Vector search found " + candidates.size() + " candidates. " + pick.reasoning)
        .build()));
  }

  static Pick pick(JsonObject reply, List<Artifact> candidates) {
    Object rawIndex = reply.getValue("componentIndex");
    int index = rawIndex instanceof Number ? ((Number) rawIndex).intValue() - 1 : -1;
    Artifact chosen = index >= 0 && index < candidates.size() ? candidates.get(index) : candidates.get(0);
    String reasoning = reply.getValue("reasoning") instanceof String
      ? reply.getString("reasoning")
      : "Selected based on semantic similarity";
    return new Pick(chosen, reasoning);
  }

  static String listing(List<Artifact> candidates) {
    StringBuilder text = new StringBuilder();
    for (int i = 0; i < candidates.size(); i++) {
      Artifact artifact = candidates.get(i);
      if (i > 0) {
        text.append('\n');
      }
      text.append(i + 1).append(". ").append(artifact.getName())
        .append(" (").append(artifact.getType()).append("): ")
        .append(artifact.getDescription());
    }
    return text.toString();
  }

  static final class Pick {
    final Artifact artifact;
    final String reasoning;

    Pick(Artifact artifact, String reasoning) {
      this.artifact = artifact;
      this.reasoning = reasoning;
    }
  }
}
