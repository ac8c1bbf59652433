package agents.dataagent.db;

import agents.dataagent.config.Env;
import agents.dataagent.services.LogUtil;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

import java.math.BigDecimal;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Properties;

/**
 * Direct JDBC connections, one per query, run on the worker pool.
 * The driver is picked by DriverManager from the JDBC URL (PostgreSQL for the row store,
 * Snowflake for the warehouse).
 */
public class JdbcQueryExecutor implements QueryExecutor {

  private final Vertx vertx;
  private final String name;
  private final String jdbcUrl;
  private final String user;
  private final String password;

  public JdbcQueryExecutor(Vertx vertx, String name, String jdbcUrl, String user, String password) {
    this.vertx = vertx;
    this.name = name;
    this.jdbcUrl = jdbcUrl;
    this.user = user;
    this.password = password;
  }

  /**
   * Row store executor from DATABASE_URL, DB_USER and DB_PASSWORD.
   */
  public static JdbcQueryExecutor rowStore(Vertx vertx) {
    return new JdbcQueryExecutor(vertx, "rowstore",
      Env.getRequired("DATABASE_URL"), Env.get("DB_USER"), Env.get("DB_PASSWORD"));
  }

  /**
   * Warehouse executor from WAREHOUSE_JDBC_URL, WAREHOUSE_USER and WAREHOUSE_PASSWORD.
   */
  public static JdbcQueryExecutor warehouse(Vertx vertx) {
    return new JdbcQueryExecutor(vertx, "warehouse",
      Env.getRequired("WAREHOUSE_JDBC_URL"), Env.get("WAREHOUSE_USER"), Env.get("WAREHOUSE_PASSWORD"));
  }

  public String getName() {
    return name;
  }

  @Override
  public Future<QueryResult> execute(String sql) {
    String cleanSql = stripTrailingSemicolon(sql);
    long start = System.currentTimeMillis();

    return vertx.<QueryResult>executeBlocking(() -> {
      try (Connection conn = getConnection();
           Statement stmt = conn.createStatement()) {
        if (!stmt.execute(cleanSql)) {
          return QueryResult.success(new JsonArray().add(new JsonObject().put("updated", stmt.getUpdateCount())));
        }
        try (ResultSet rs = stmt.getResultSet()) {
          return QueryResult.success(resultSetToJson(rs));
        }
      } catch (SQLException e) {
        LogUtil.logError(vertx, "Query failed on " + name + ": " + e.getMessage(), "JdbcQueryExecutor", "Query", "Error");
        return QueryResult.failure(e.getMessage());
      }
    }, false).onSuccess(result -> {
      if (result.isSuccess()) {
        LogUtil.logDetail(vertx, "Query on " + name + " returned " + result.getData().size() + " rows in "
          + (System.currentTimeMillis() - start) + "ms", "JdbcQueryExecutor", "Query", "Complete");
      }
    });
  }

  private Connection getConnection() throws SQLException {
    Properties props = new Properties();
    if (user != null) {
      props.setProperty("user", user);
    }
    if (password != null) {
      props.setProperty("password", password);
    }
    return DriverManager.getConnection(jdbcUrl, props);
  }

  /**
   * JDBC drivers reject a trailing semicolon.
   */
  static String stripTrailingSemicolon(String sql) {
    String trimmed = sql.trim();
    while (trimmed.endsWith(";")) {
      trimmed = trimmed.substring(0, trimmed.length() - 1).trim();
    }
    return trimmed;
  }

  static JsonArray resultSetToJson(ResultSet rs) throws SQLException {
    JsonArray results = new JsonArray();
    ResultSetMetaData metaData = rs.getMetaData();
    int columnCount = metaData.getColumnCount();

    while (rs.next()) {
      JsonObject row = new JsonObject();
      for (int i = 1; i <= columnCount; i++) {
        String columnName = metaData.getColumnLabel(i);
        Object value = rs.getObject(i);

        if (value == null) {
          row.putNull(columnName);
        } else if (value instanceof BigDecimal) {
          row.put(columnName, ((BigDecimal) value).doubleValue());
        } else if (value instanceof Integer || value instanceof Long || value instanceof Double
          || value instanceof Float || value instanceof Short) {
          row.put(columnName, value);
        } else if (value instanceof Number) {
          row.put(columnName, ((Number) value).doubleValue());
        } else if (value instanceof Boolean) {
          row.put(columnName, (Boolean) value);
        } else {
          row.put(columnName, value.toString());
        }
      }
      results.add(row);
    }
    return results;
  }
}
