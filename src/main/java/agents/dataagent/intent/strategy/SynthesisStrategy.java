package agents.dataagent.intent.strategy;

import agents.dataagent.intent.ArtifactSynthesizer;
import agents.dataagent.intent.ResolutionMethod;
import agents.dataagent.intent.ResolutionResult;
import io.vertx.core.Future;

/**
 * Last link of a match chain: generate an artifact of any type when nothing in the catalog fits.
 */
public class SynthesisStrategy implements ResolutionStrategy {

  // A generated artifact answers the prompt it was generated for
  private static final int GENERATED_CONFIDENCE = 100;

  private final ArtifactSynthesizer synthesizer;

  public SynthesisStrategy(ArtifactSynthesizer synthesizer) {
    this.synthesizer = synthesizer;
  }

  @Override
  public String name() {
    return "llm-generated";
  }

  @Override
  public Future<MatchOutcome> resolve(String prompt, ResolutionContext context) {
    return synthesizer.synthesizeOne(prompt, null).map(synthesis -> synthesis.getArtifact() == null
      ? MatchOutcome.noMatch(synthesis.getReasoning())
      : MatchOutcome.matched(ResolutionResult.builder(ResolutionMethod.LLM_GENERATED)
          .artifact(synthesis.getArtifact())
          .reasoning(synthesis.getReasoning())
          .confidence(GENERATED_CONFIDENCE)
          .build()));
  }
}
