package agents.dataagent.auth;

import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One entry of the users file: {@code {username, password, userids[]}}.
 */
public final class UserRecord {

  private final String username;
  private final String password;
  private final List<String> userIds;

  public UserRecord(String username, String password, List<String> userIds) {
    this.username = username;
    this.password = password;
    this.userIds = Collections.unmodifiableList(new ArrayList<>(userIds == null ? List.of() : userIds));
  }

  public String getUsername() { return username; }
  public String getPassword() { return password; }
  public List<String> getUserIds() { return userIds; }

  public UserRecord withUserId(String userId) {
    if (userIds.contains(userId)) {
      return this;
    }
    List<String> ids = new ArrayList<>(userIds);
    ids.add(userId);
    return new UserRecord(username, password, ids);
  }

  public static UserRecord fromJson(JsonObject json) {
    List<String> ids = new ArrayList<>();
    JsonArray raw = json.getJsonArray("userids");
    if (raw != null) {
      for (Object id : raw) {
        if (id != null) {
          ids.add(String.valueOf(id));
        }
      }
    }
    return new UserRecord(json.getString("username"), json.getString("password"), ids);
  }

  public JsonObject toJson() {
    return new JsonObject()
      .put("username", username)
      .put("password", password)
      .put("userids", new JsonArray(new ArrayList<>(userIds)));
  }
}
