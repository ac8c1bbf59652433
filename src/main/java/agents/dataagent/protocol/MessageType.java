package agents.dataagent.protocol;

/**
 * Envelope types understood by the data agent and the response type each one is answered with.
 */
public enum MessageType {
  DATA_REQ("data_req", "data_res"),
  WAREHOUSE_DATA_REQ("warehouse_data_req", "warehouse_data_res"),
  USER_PROMPT_REQ("user_prompt_req", "user_prompt_res"),
  COMPONENT_LIST_UPDATE("component_list_update", "component_list_update_res"),
  AUTH_LOGIN_REQ("auth_login_req", "auth_login_res"),
  AUTH_VERIFY_REQ("auth_verify_req", "auth_verify_res"),
  // Sent by the agent; the host answers on the same id
  COMPONENT_LIST_REQ("component_list_req", "component_list_res");

  private final String wireName;
  private final String responseType;

  MessageType(String wireName, String responseType) {
    this.wireName = wireName;
    this.responseType = responseType;
  }

  public String getWireName() {
    return wireName;
  }

  public String getResponseType() {
    return responseType;
  }

  /**
   * Resolve a wire type, or null when the agent has no handler for it.
   */
  public static MessageType fromWireName(String value) {
    for (MessageType type : values()) {
      if (type.wireName.equals(value)) {
        return type;
      }
    }
    return null;
  }
}
