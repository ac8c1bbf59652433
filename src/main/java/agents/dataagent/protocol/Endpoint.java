package agents.dataagent.protocol;

import io.vertx.core.json.JsonObject;

import java.util.Objects;

/**
 * One side of an envelope exchange: an optional role plus an optional endpoint id.
 */
public final class Endpoint {

  public static final Endpoint NONE = new Endpoint(null, null);

  private final EndpointRole role;
  private final String id;

  public Endpoint(EndpointRole role, String id) {
    this.role = role;
    this.id = id;
  }

  public static Endpoint of(EndpointRole role) {
    return new Endpoint(role, null);
  }

  public EndpointRole getRole() {
    return role;
  }

  public String getId() {
    return id;
  }

  public JsonObject toJson() {
    JsonObject json = new JsonObject();
    if (role != null) {
      json.put("type", role.getWireName());
    }
    if (id != null) {
      json.put("id", id);
    }
    return json;
  }

  /**
   * Accepts the object form ({"type": ..., "id": ...}) and the bare role string older hosts send.
   */
  public static Endpoint fromJson(Object value) {
    if (value instanceof JsonObject) {
      JsonObject json = (JsonObject) value;
      return new Endpoint(EndpointRole.fromWireName(json.getString("type")), json.getString("id"));
    }
    if (value instanceof String) {
      return new Endpoint(EndpointRole.fromWireName((String) value), null);
    }
    return NONE;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Endpoint)) return false;
    Endpoint other = (Endpoint) o;
    return role == other.role && Objects.equals(id, other.id);
  }

  @Override
  public int hashCode() {
    return Objects.hash(role, id);
  }

  @Override
  public String toString() {
    return "Endpoint{role=" + role + ", id='" + id + "'}";
  }
}
