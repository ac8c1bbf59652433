package agents.dataagent.config;

/**
 * Configuration lookup shared by all services.
 * Checks System.getProperty() first (values loaded from .env.local by dotenv) and then System.getenv().
 */
public final class Env {

  private Env() {
  }

  /**
   * Get an optional value, or null when it is not set or blank.
   */
  public static String get(String key) {
    String value = System.getProperty(key);
    if (value == null || value.trim().isEmpty()) {
      value = System.getenv(key);
    }
    if (value == null || value.trim().isEmpty()) {
      return null;
    }
    return value.trim();
  }

  public static String get(String key, String defaultValue) {
    String value = get(key);
    return value != null ? value : defaultValue;
  }

  /**
   * Get required value or throw.
   */
  public static String getRequired(String key) {
    String value = get(key);
    if (value == null) {
      throw new IllegalStateException(
        "Required configuration '" + key + "' is not set. " +
        "Please ensure .env.local file contains all required data agent configuration."
      );
    }
    return value;
  }

  public static int getInt(String key, int defaultValue) {
    String value = get(key);
    if (value == null) {
      return defaultValue;
    }
    try {
      return Integer.parseInt(value);
    } catch (NumberFormatException e) {
      throw new IllegalStateException("Invalid " + key + " value: '" + value + "'. Must be a whole number.", e);
    }
  }

  public static long getLong(String key, long defaultValue) {
    String value = get(key);
    if (value == null) {
      return defaultValue;
    }
    try {
      return Long.parseLong(value);
    } catch (NumberFormatException e) {
      throw new IllegalStateException("Invalid " + key + " value: '" + value + "'. Must be a whole number.", e);
    }
  }

  public static boolean getBoolean(String key, boolean defaultValue) {
    String value = get(key);
    if (value == null) {
      return defaultValue;
    }
    return "true".equalsIgnoreCase(value) || "1".equals(value) || "yes".equalsIgnoreCase(value);
  }
}
