package agents.dataagent.protocol;

/**
 * Roles a session endpoint can take on the orchestration host.
 */
public enum EndpointRole {
  ADMIN("admin"),
  DATA_AGENT("data_agent"),
  RUNTIME("runtime");

  private final String wireName;

  EndpointRole(String wireName) {
    this.wireName = wireName;
  }

  public String getWireName() {
    return wireName;
  }

  /**
   * Resolve a wire name, or null for absent / unknown roles.
   */
  public static EndpointRole fromWireName(String value) {
    if (value == null) {
      return null;
    }
    for (EndpointRole role : values()) {
      if (role.wireName.equalsIgnoreCase(value)) {
        return role;
      }
    }
    return null;
  }
}
