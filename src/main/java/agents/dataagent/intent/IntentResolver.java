package agents.dataagent.intent;

import agents.dataagent.candidates.CandidateStore;
import agents.dataagent.candidates.EmbeddingService;
import agents.dataagent.catalog.Artifact;
import agents.dataagent.catalog.CatalogHolder;
import agents.dataagent.catalog.CatalogSnapshot;
import agents.dataagent.catalog.VisualizationType;
import agents.dataagent.config.AgentConfig;
import agents.dataagent.intent.strategy.LlmRankingStrategy;
import agents.dataagent.intent.strategy.MatchOutcome;
import agents.dataagent.intent.strategy.ResolutionContext;
import agents.dataagent.intent.strategy.ResolutionStrategy;
import agents.dataagent.intent.strategy.SynthesisStrategy;
import agents.dataagent.intent.strategy.VectorRerankStrategy;
import agents.dataagent.schema.SchemaDescriptor;
import agents.dataagent.services.CompletionService;
import agents.dataagent.services.LogUtil;
import io.vertx.core.Future;
import io.vertx.core.Vertx;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Turns a prompt into at most one artifact.
 *
 * <p>In classify mode the prompt is classified first:</p>
 * <ul>
 *   <li>general: no artifact,</li>
 *   <li>data modification: catalog ranking only, no synthesis,</li>
 *   <li>analytical: one generated artifact (free or constrained type) or a generated container.</li>
 * </ul>
 * <p>In match mode the configured match chain runs directly, followed by free synthesis.
 * Catalog matches with a query have their props adapted to the prompt.</p>
 *
 * <p>Each call works on the catalog snapshot current when it started.</p>
 */
public class IntentResolver {

  private final Vertx vertx;
  private final AgentConfig.ResolutionMode mode;
  private final CatalogHolder catalog;
  private final IntentClassifier classifier;
  private final ArtifactSynthesizer synthesizer;
  private final PropsValidator propsValidator;
  private final List<ResolutionStrategy> matchChain;
  private final List<ResolutionStrategy> modificationChain;
  private final String collectionName;
  private final int topK;

  /**
   * @param matchChain        strategies for match mode, synthesis fallback included
   * @param modificationChain strategies for data-modification prompts
   */
  public IntentResolver(Vertx vertx, AgentConfig.ResolutionMode mode, CatalogHolder catalog,
                        IntentClassifier classifier, ArtifactSynthesizer synthesizer, PropsValidator propsValidator,
                        List<ResolutionStrategy> matchChain, List<ResolutionStrategy> modificationChain,
                        String collectionName, int topK) {
    this.vertx = vertx;
    this.mode = mode;
    this.catalog = catalog;
    this.classifier = classifier;
    this.synthesizer = synthesizer;
    this.propsValidator = propsValidator;
    this.matchChain = Collections.unmodifiableList(new ArrayList<>(matchChain));
    this.modificationChain = Collections.unmodifiableList(new ArrayList<>(modificationChain));
    this.collectionName = collectionName;
    this.topK = topK;
  }

  /**
   * Wire the resolver for a configuration. Vector retrieval joins the chain only when vector
   * matching is configured and both a candidate store and an embedding service are given.
   */
  public static IntentResolver create(Vertx vertx, AgentConfig config, CatalogHolder catalog, CompletionService completion,
                                      SchemaDescriptor schema, CandidateStore store, EmbeddingService embeddings) {
    int limit = config.getDefaultQueryLimit();
    ArtifactSynthesizer synthesizer = new ArtifactSynthesizer(vertx, completion, schema, limit);

    List<ResolutionStrategy> catalogChain = new ArrayList<>();
    if (config.getMatchingMethod() == AgentConfig.MatchingMethod.VECTOR && store != null && embeddings != null) {
      catalogChain.add(new VectorRerankStrategy(vertx, store, embeddings, completion));
    }
    catalogChain.add(new LlmRankingStrategy(vertx, completion));

    List<ResolutionStrategy> matchChain = new ArrayList<>(catalogChain);
    matchChain.add(new SynthesisStrategy(synthesizer));

    List<ResolutionStrategy> modificationChain = new ArrayList<>();
    modificationChain.add(new LlmRankingStrategy(vertx, completion));

    return new IntentResolver(vertx, config.getResolutionMode(), catalog,
      new IntentClassifier(vertx, completion, schema), synthesizer,
      new PropsValidator(vertx, completion, schema, limit),
      matchChain, modificationChain, config.getCandidateCollectionName(), config.getVectorTopK());
  }

  public Future<ResolutionResult> resolve(String prompt) {
    if (prompt == null || prompt.trim().isEmpty()) {
      return Future.failedFuture(new IllegalArgumentException("Prompt cannot be empty"));
    }
    CatalogSnapshot snapshot = catalog.current();
    long start = System.currentTimeMillis();

    Future<ResolutionResult> resolution = mode == AgentConfig.ResolutionMode.MATCH
      ? runChain(matchChain, prompt, new ResolutionContext(snapshot, collectionName, topK, null))
      : classifier.classify(prompt).compose(classification -> route(prompt, snapshot, classification));

    return resolution.onSuccess(result -> LogUtil.logInfo(vertx,
      "Resolved prompt via " + result.getMethod().getTag()
        + (result.hasArtifact() ? " -> " + result.getArtifact().getName() : " -> no artifact")
        + " (catalog v" + snapshot.getVersion() + "; " + (System.currentTimeMillis() - start) + "ms)",
      "IntentResolver", "Resolve", "Complete"));
  }

  private Future<ResolutionResult> route(String prompt, CatalogSnapshot snapshot, ClassificationResult classification) {
    switch (classification.getQuestionType()) {
      case GENERAL:
        return Future.succeededFuture(ResolutionResult.builder(ResolutionMethod.CLASSIFICATION_GENERAL)
          .reasoning(classification.getReasoning() == null || classification.getReasoning().isEmpty()
            ? "General question; no visualization needed" : classification.getReasoning())
          .classification(classification)
          .build());

      case DATA_MODIFICATION:
        return runChain(modificationChain, prompt, new ResolutionContext(snapshot, collectionName, topK, classification))
          .map(result -> result.toBuilder().classification(classification).build());

      case ANALYTICAL:
      default:
        return synthesize(prompt, classification);
    }
  }

  private Future<ResolutionResult> synthesize(String prompt, ClassificationResult classification) {
    List<VisualizationType> types = classification.getVisualizations();

    if (types.isEmpty()) {
      return synthesizer.synthesizeOne(prompt, null)
        .map(synthesis -> fromSynthesis(synthesis, ResolutionMethod.GENERATED, classification));
    }
    if (types.size() == 1 && !classification.isNeedsMultiple()) {
      return synthesizer.synthesizeOne(prompt, types.get(0))
        .map(synthesis -> fromSynthesis(synthesis, ResolutionMethod.GENERATED, classification));
    }
    return synthesizer.synthesizeMany(prompt, types)
      .map(synthesis -> fromSynthesis(synthesis, ResolutionMethod.GENERATED_MULTI, classification));
  }

  private static ResolutionResult fromSynthesis(ArtifactSynthesizer.Synthesis synthesis, ResolutionMethod method,
                                                ClassificationResult classification) {
    return ResolutionResult.builder(synthesis.getArtifact() == null ? ResolutionMethod.NONE : method)
      .artifact(synthesis.getArtifact())
      .reasoning(synthesis.getReasoning())
      .classification(classification)
      .build();
  }

  /**
   * Try each strategy in order; the first match wins and is then props-validated when it came from the catalog.
   */
  private Future<ResolutionResult> runChain(List<ResolutionStrategy> chain, String prompt, ResolutionContext context) {
    Future<MatchOutcome> outcome = Future.succeededFuture(MatchOutcome.noMatch("No resolution strategy configured"));
    for (ResolutionStrategy strategy : chain) {
      outcome = outcome.compose(previous -> {
        if (previous.isMatch()) {
          return Future.succeededFuture(previous);
        }
        LogUtil.logDebug(vertx, "Trying strategy " + strategy.name(), "IntentResolver", "Match", "Strategy");
        return strategy.resolve(prompt, context);
      });
    }

    return outcome.compose(last -> {
      if (!last.isMatch()) {
        return Future.succeededFuture(ResolutionResult.empty(ResolutionMethod.NONE, last.getReason()));
      }
      ResolutionResult matched = last.getResult();
      if (matched.getMethod().isCatalogMatch() && matched.getArtifact().getProps().hasQuery()) {
        return adaptProps(prompt, matched);
      }
      return Future.succeededFuture(matched);
    });
  }

  private Future<ResolutionResult> adaptProps(String prompt, ResolutionResult matched) {
    Artifact artifact = matched.getArtifact();
    String originalQuery = artifact.getProps().getQuery();

    return propsValidator.validate(prompt, artifact).map(validation -> {
      String finalQuery = validation.getProps().getQuery();
      return matched.toBuilder()
        .artifact(artifact.withProps(validation.getProps()))
        .propsModified(validation.isModified())
        .propsModifications(validation.getModifications())
        .queryModified(!Objects.equals(originalQuery, finalQuery))
        .queryReasoning(validation.getReasoning())
        .build();
    });
  }
}
