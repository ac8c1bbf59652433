package agents.dataagent.intent;

import agents.dataagent.services.CompletionService;
import io.vertx.core.Future;
import io.vertx.core.json.JsonObject;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Completion backend for tests. Replies are chosen by a marker found in the system prompt;
 * a marker mapped to null makes that call fail.
 */
public class ScriptedCompletion implements CompletionService {

  public static final String CLASSIFY = "classifies user questions";
  public static final String SYNTHESIZE_ONE = "generates appropriate visualizations";
  public static final String SYNTHESIZE_MANY = "builds a small dashboard";
  public static final String RANK = "matching user requests";
  public static final String RERANK = "selects the best matching component";
  public static final String VALIDATE_PROPS = "validates and modifies component props";

  private final Map<String, JsonObject> replies = new LinkedHashMap<>();
  private final List<String> systemPrompts = new ArrayList<>();
  private final List<String> userPrompts = new ArrayList<>();

  public ScriptedCompletion reply(String marker, JsonObject reply) {
    replies.put(marker, reply);
    return this;
  }

  public ScriptedCompletion fail(String marker) {
    replies.put(marker, null);
    return this;
  }

  public List<String> getSystemPrompts() {
    return systemPrompts;
  }

  public List<String> getUserPrompts() {
    return userPrompts;
  }

  /**
   * Number of calls whose system prompt carried {@code marker}.
   */
  public int calls(String marker) {
    int count = 0;
    for (String prompt : systemPrompts) {
      if (prompt.contains(marker)) {
        count++;
      }
    }
    return count;
  }

  @Override
  public Future<JsonObject> completeJson(String systemPrompt, String userPrompt, double temperature, int maxTokens) {
    systemPrompts.add(systemPrompt);
    userPrompts.add(userPrompt);
    for (Map.Entry<String, JsonObject> entry : replies.entrySet()) {
      if (systemPrompt.contains(entry.getKey())) {
        return entry.getValue() == null
          ? Future.failedFuture("completion backend unavailable")
          : Future.succeededFuture(entry.getValue().copy());
      }
    }
    return Future.failedFuture("No scripted reply for prompt");
  }
}
