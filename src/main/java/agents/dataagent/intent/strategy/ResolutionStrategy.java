package agents.dataagent.intent.strategy;

import io.vertx.core.Future;

/**
 * One way of finding an artifact for a prompt. The resolver tries strategies in order and stops at
 * the first one that matches.
 *
 * <p>Implementations report "nothing found" (including backend errors they can absorb) as
 * {@link MatchOutcome#noMatch(String)} rather than as a failed future.</p>
 */
public interface ResolutionStrategy {

  String name();

  Future<MatchOutcome> resolve(String prompt, ResolutionContext context);
}
