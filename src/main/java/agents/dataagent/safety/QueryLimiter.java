package agents.dataagent.safety;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Row-limit guarantee for generated data-fetch queries.
 *
 * <p>Only read-shaped statements are touched: a statement starting with SELECT, or a WITH
 * clause whose main statement (after the {@code name AS (...)} list) is a SELECT. INSERT,
 * UPDATE, DELETE and DDL pass through unchanged, with or without a leading WITH, as does any
 * read that already has a LIMIT clause.</p>
 */
public final class QueryLimiter {

  public static final int DEFAULT_LIMIT = 50;

  private static final Pattern SELECT_START = Pattern.compile("^\\s*SELECT\\b", Pattern.CASE_INSENSITIVE);
  private static final Pattern WITH_START = Pattern.compile("^\\s*WITH\\b", Pattern.CASE_INSENSITIVE);
  private static final Pattern HAS_LIMIT = Pattern.compile("\\bLIMIT\\s+\\d+", Pattern.CASE_INSENSITIVE);

  private QueryLimiter() {
  }

  public static String ensureQueryLimit(String query) {
    return ensureQueryLimit(query, DEFAULT_LIMIT);
  }

  /**
   * Append {@code LIMIT defaultLimit} to a read query that has none, ahead of a trailing semicolon.
   * Idempotent.
   */
  public static String ensureQueryLimit(String query, int defaultLimit) {
    if (query == null || query.trim().isEmpty()) {
      return query;
    }

    String trimmed = query.trim();
    if (!isReadQuery(trimmed) || hasLimit(trimmed)) {
      return query;
    }

    boolean terminated = trimmed.endsWith(";");
    String body = terminated ? trimmed.substring(0, trimmed.length() - 1).trim() : trimmed;

    return body + " LIMIT " + defaultLimit + (terminated ? ";" : "");
  }

  public static boolean isReadQuery(String query) {
    if (query == null) {
      return false;
    }
    if (SELECT_START.matcher(query).find()) {
      return true;
    }
    Matcher with = WITH_START.matcher(query);
    if (!with.find()) {
      return false;
    }
    String main = mainStatement(query, with.end());
    return main != null && SELECT_START.matcher(main).find();
  }

  /**
   * Text after the CTE list that starts at {@code from}, or null when the list is malformed.
   * A parenthesised group right after AS (or MATERIALIZED) is a CTE body; any other group is a
   * column list. Quoted text is skipped.
   */
  private static String mainStatement(String query, int from) {
    int depth = 0;
    boolean bodyOpen = false;
    String lastWord = "";
    int i = from;
    int n = query.length();
    while (i < n) {
      char c = query.charAt(i);
      if (c == '\'' || c == '"') {
        int close = query.indexOf(c, i + 1);
        if (close < 0) {
          return null;
        }
        i = close + 1;
        if (depth == 0) {
          lastWord = "";
        }
        continue;
      }
      if (c == '(') {
        if (depth == 0) {
          bodyOpen = "AS".equals(lastWord) || "MATERIALIZED".equals(lastWord);
        }
        depth++;
        i++;
        continue;
      }
      if (c == ')') {
        depth--;
        i++;
        if (depth < 0) {
          return null;
        }
        if (depth == 0) {
          lastWord = "";
          if (bodyOpen) {
            bodyOpen = false;
            int next = skipWhitespace(query, i);
            if (next >= n) {
              return null;
            }
            if (query.charAt(next) == ',') {
              i = next + 1;
              continue;
            }
            return stripOpeningParens(query.substring(next));
          }
        }
        continue;
      }
      if (depth == 0 && (Character.isLetterOrDigit(c) || c == '_')) {
        int end = i;
        while (end < n && (Character.isLetterOrDigit(query.charAt(end)) || query.charAt(end) == '_')) {
          end++;
        }
        lastWord = query.substring(i, end).toUpperCase();
        i = end;
        continue;
      }
      i++;
    }
    return null;
  }

  private static int skipWhitespace(String text, int from) {
    int i = from;
    while (i < text.length() && Character.isWhitespace(text.charAt(i))) {
      i++;
    }
    return i;
  }

  private static String stripOpeningParens(String text) {
    int i = skipWhitespace(text, 0);
    while (i < text.length() && text.charAt(i) == '(') {
      i = skipWhitespace(text, i + 1);
    }
    return text.substring(i);
  }

  public static boolean hasLimit(String query) {
    return query != null && HAS_LIMIT.matcher(query).find();
  }
}
