package agents.dataagent.auth;

import agents.dataagent.services.LogUtil;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonObject;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Base64;

/**
 * Checks base64-encoded JSON credentials ({@code {"username", "password"}}) against the credential store.
 *
 * <p>The incoming password field is compared with the SHA-1 hex digest of the stored password.</p>
 */
public class CredentialValidator {

  private final Vertx vertx;
  private final CredentialStore store;

  public CredentialValidator(Vertx vertx, CredentialStore store) {
    this.vertx = vertx;
    this.store = store;
  }

  /**
   * Validate the credentials and record the requester's endpoint id on the user.
   */
  public Future<AuthResult> login(String encodedCredentials, String sessionId) {
    return validate(encodedCredentials).compose(result -> {
      if (!result.isSuccess() || sessionId == null) {
        return Future.succeededFuture(result);
      }
      return store.recordSessionId(result.getUsername(), sessionId)
        .map(stored -> stored ? result : AuthResult.rejected("Failed to store user session"));
    }).onSuccess(result -> LogUtil.logInfo(vertx,
      "Login " + (result.isSuccess() ? "accepted for " + result.getUsername() : "rejected: " + result.getMessage()),
      "CredentialValidator", "Auth", "Login"));
  }

  /**
   * Validate a token (the same encoded credentials) without recording a session.
   */
  public Future<AuthResult> verify(String token) {
    return validate(token);
  }

  Future<AuthResult> validate(String encodedCredentials) {
    JsonObject credentials;
    try {
      credentials = decodeCredentials(encodedCredentials);
    } catch (IllegalArgumentException e) {
      return Future.succeededFuture(AuthResult.rejected(e.getMessage()));
    }

    String username = credentials.getValue("username") instanceof String ? credentials.getString("username") : null;
    String password = credentials.getValue("password") instanceof String ? credentials.getString("password") : null;
    if (username == null || username.isEmpty() || password == null || password.isEmpty()) {
      return Future.succeededFuture(AuthResult.rejected("Username and password are required"));
    }

    return store.findByUsername(username).map(found -> {
      if (found.isEmpty()) {
        return AuthResult.rejected("Invalid username");
      }
      // FIXME: only the stored side is hashed; confirm the credential format with the runtime before changing
      if (!sha1Hex(found.get().getPassword()).equals(password)) {
        return AuthResult.rejected("Invalid password");
      }
      return AuthResult.accepted(found.get().getUsername());
    });
  }

  static JsonObject decodeCredentials(String encoded) {
    if (encoded == null || encoded.isBlank()) {
      throw new IllegalArgumentException("Credentials are required");
    }
    try {
      String decoded = new String(Base64.getDecoder().decode(encoded.trim()), StandardCharsets.UTF_8);
      return new JsonObject(decoded);
    } catch (IllegalArgumentException | DecodeException | ClassCastException e) {
      throw new IllegalArgumentException("Failed to decode base64 data: " + e.getMessage(), e);
    }
  }

  static String sha1Hex(String value) {
    try {
      byte[] digest = MessageDigest.getInstance("SHA-1").digest(value == null ? new byte[0] : value.getBytes(StandardCharsets.UTF_8));
      StringBuilder hex = new StringBuilder(digest.length * 2);
      for (byte b : digest) {
        hex.append(String.format("%02x", b));
      }
      return hex.toString();
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-1 not available", e);
    }
  }
}
