package agents.dataagent.db;

import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

/**
 * Outcome of one query: rows on success, an error message otherwise.
 */
public final class QueryResult {

  private final boolean success;
  private final JsonArray data;
  private final String errors;

  private QueryResult(boolean success, JsonArray data, String errors) {
    this.success = success;
    this.data = data;
    this.errors = errors;
  }

  public static QueryResult success(JsonArray rows) {
    return new QueryResult(true, rows == null ? new JsonArray() : rows, null);
  }

  public static QueryResult failure(String errors) {
    return new QueryResult(false, null, errors == null ? "Unknown error" : errors);
  }

  public boolean isSuccess() { return success; }
  public JsonArray getData() { return data; }
  public String getErrors() { return errors; }

  /**
   * Wire payload for a data response: the rows themselves, or {@code {"error": ...}}.
   */
  public Object toPayload() {
    return success ? data : new JsonObject().put("error", errors);
  }
}
