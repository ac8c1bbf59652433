package agents.dataagent.auth;

import agents.dataagent.config.Env;
import agents.dataagent.services.LogUtil;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

import java.util.Optional;

/**
 * Users persisted in a JSON file ({@code {"users": [...]}}), re-read on every lookup.
 */
public class FileCredentialStore implements CredentialStore {

  public static final String DEFAULT_USERS_FILE = "data/auth/users.json";

  private final Vertx vertx;
  private final String path;

  public FileCredentialStore(Vertx vertx, String path) {
    this.vertx = vertx;
    this.path = path;
  }

  public static FileCredentialStore fromEnvironment(Vertx vertx) {
    return new FileCredentialStore(vertx, Env.get("USERS_FILE", DEFAULT_USERS_FILE));
  }

  @Override
  public Future<Optional<UserRecord>> findByUsername(String username) {
    return load().map(users -> {
      for (Object entry : users.getJsonArray("users", new JsonArray())) {
        if (entry instanceof JsonObject && username.equals(((JsonObject) entry).getString("username"))) {
          return Optional.of(UserRecord.fromJson((JsonObject) entry));
        }
      }
      return Optional.<UserRecord>empty();
    });
  }

  @Override
  public Future<Boolean> recordSessionId(String username, String sessionId) {
    return load().compose(users -> {
      JsonArray list = users.getJsonArray("users", new JsonArray());
      for (int i = 0; i < list.size(); i++) {
        Object entry = list.getValue(i);
        if (entry instanceof JsonObject && username.equals(((JsonObject) entry).getString("username"))) {
          UserRecord current = UserRecord.fromJson((JsonObject) entry);
          if (current.getUserIds().contains(sessionId)) {
            return Future.succeededFuture(true);
          }
          list.set(i, current.withUserId(sessionId).toJson());
          return vertx.fileSystem().writeFile(path, Buffer.buffer(users.encodePrettily()))
            .map(v -> true);
        }
      }
      return Future.succeededFuture(false);
    }).otherwise(err -> {
      LogUtil.logError(vertx, "Failed to record session for " + username, err, "FileCredentialStore", "Auth", "Save");
      return false;
    });
  }

  private Future<JsonObject> load() {
    return vertx.fileSystem().readFile(path)
      .map(Buffer::toJsonObject)
      .recover(err -> Future.failedFuture(new IllegalStateException("Failed to load users: " + err.getMessage(), err)));
  }
}
