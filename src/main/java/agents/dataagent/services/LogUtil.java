package agents.dataagent.services;

import agents.dataagent.Driver;
import io.vertx.core.Vertx;

/**
 * Structured logging helpers on top of the <code>log</code> event-bus address.
 * Lines are gated by {@link Driver#logLevel} and formatted for the CSV sink in {@link Logger}.
 */
public final class LogUtil {

    // Log levels matching Driver.logLevel
    public static final int ERROR = 0;
    public static final int INFO = 1;
    public static final int DETAIL = 2;
    public static final int DEBUG = 3;
    public static final int DATA = 4;

    private LogUtil() {
    }

    public static void logError(Vertx vertx, String message, String component, String category, String subcategory) {
        publish(vertx, message, ERROR, component, category, subcategory);
    }

    /**
     * Log an error with its cause; the stack trace follows at debug level.
     */
    public static void logError(Vertx vertx, String message, Throwable throwable, String component, String category, String subcategory) {
        String cause = throwable == null ? "unknown cause" : String.valueOf(throwable.getMessage());
        publish(vertx, message + ": " + cause, ERROR, component, category, subcategory);

        if (throwable != null && Driver.logLevel >= DEBUG) {
            StringBuilder stackTrace = new StringBuilder();
            for (StackTraceElement element : throwable.getStackTrace()) {
                stackTrace.append(" at ").append(element.toString());
            }
            publish(vertx, "Stack trace:" + stackTrace, DEBUG, component, category, subcategory);
        }
    }

    public static void logInfo(Vertx vertx, String message, String component, String category, String subcategory) {
        publish(vertx, message, INFO, component, category, subcategory);
    }

    public static void logDetail(Vertx vertx, String message, String component, String category, String subcategory) {
        publish(vertx, message, DETAIL, component, category, subcategory);
    }

    public static void logDebug(Vertx vertx, String message, String component, String category, String subcategory) {
        publish(vertx, message, DEBUG, component, category, subcategory);
    }

    public static void logData(Vertx vertx, String message, String component, String category, String subcategory) {
        publish(vertx, message, DATA, component, category, subcategory);
    }

    /**
     * Format a line for the CSV sink. Commas and line breaks inside the message are replaced.
     */
    static String formatLogMessage(String message, int level, String component, String category, String subcategory) {
        String cleanMessage = String.valueOf(message)
            .replace(",", ";")
            .replace("\r", " ")
            .replace("\n", " ");
        return cleanMessage + "," + level + "," + component + "," + category + "," + subcategory;
    }

    private static void publish(Vertx vertx, String message, int level, String component, String category, String subcategory) {
        if (vertx == null || Driver.logLevel < level) {
            return;
        }
        vertx.eventBus().publish(Logger.LOG_ADDRESS, formatLogMessage(message, level, component, category, subcategory));
    }
}
