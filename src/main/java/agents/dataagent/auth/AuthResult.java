package agents.dataagent.auth;

import io.vertx.core.json.JsonObject;

/**
 * Outcome of a login or token check, sent back as the response payload.
 */
public final class AuthResult {

  private final boolean success;
  private final String message;
  private final String username;

  private AuthResult(boolean success, String message, String username) {
    this.success = success;
    this.message = message;
    this.username = username;
  }

  public static AuthResult accepted(String username) {
    return new AuthResult(true, "Authentication successful", username);
  }

  public static AuthResult rejected(String message) {
    return new AuthResult(false, message, null);
  }

  public boolean isSuccess() { return success; }
  public String getMessage() { return message; }
  public String getUsername() { return username; }

  public JsonObject toJson() {
    JsonObject json = new JsonObject().put("success", success).put("message", message);
    if (username != null) {
      json.put("username", username);
    }
    return json;
  }
}
