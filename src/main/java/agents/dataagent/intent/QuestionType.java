package agents.dataagent.intent;

/**
 * What kind of answer a prompt asks for.
 */
public enum QuestionType {
  ANALYTICAL("analytical"),
  DATA_MODIFICATION("data_modification"),
  GENERAL("general");

  private final String wireName;

  QuestionType(String wireName) {
    this.wireName = wireName;
  }

  public String getWireName() {
    return wireName;
  }

  /**
   * Null for anything outside the three known values.
   */
  public static QuestionType fromWireName(String value) {
    if (value == null) {
      return null;
    }
    String normalized = value.trim().toLowerCase().replace('-', '_').replace(' ', '_');
    for (QuestionType type : values()) {
      if (type.wireName.equals(normalized)) {
        return type;
      }
    }
    return null;
  }
}
