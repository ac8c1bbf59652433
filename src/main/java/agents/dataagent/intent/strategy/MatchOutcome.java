package agents.dataagent.intent.strategy;

import agents.dataagent.intent.ResolutionResult;

/**
 * Result of one strategy: a resolution carrying an artifact, or no match with the reason.
 */
public final class MatchOutcome {

  private final ResolutionResult result;
  private final String reason;

  private MatchOutcome(ResolutionResult result, String reason) {
    this.result = result;
    this.reason = reason;
  }

  public static MatchOutcome matched(ResolutionResult result) {
    if (result == null || !result.hasArtifact()) {
      throw new IllegalArgumentException("A match must carry an artifact");
    }
    return new MatchOutcome(result, result.getReasoning());
  }

  public static MatchOutcome noMatch(String reason) {
    return new MatchOutcome(null, reason);
  }

  public boolean isMatch() {
    return result != null;
  }

  public ResolutionResult getResult() {
    return result;
  }

  public String getReason() {
    return reason;
  }
}
