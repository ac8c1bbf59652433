package agents.dataagent.services;

import io.vertx.core.Future;
import io.vertx.core.json.JsonObject;

/**
 * Chat-completion capability used by the resolver. Responses are requested in JSON-object mode
 * and returned already parsed.
 */
public interface CompletionService {

  /**
   * Run one system + user exchange and parse the reply as a JSON object.
   * Fails when the backend is unreachable or the reply holds no JSON object.
   */
  Future<JsonObject> completeJson(String systemPrompt, String userPrompt, double temperature, int maxTokens);
}
