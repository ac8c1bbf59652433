package agents.dataagent.auth;

import io.vertx.core.Future;

import java.util.Optional;

public interface CredentialStore {

  Future<Optional<UserRecord>> findByUsername(String username);

  /**
   * Remember a session id for the user. Resolves false when the user does not exist or cannot be saved.
   */
  Future<Boolean> recordSessionId(String username, String sessionId);
}
