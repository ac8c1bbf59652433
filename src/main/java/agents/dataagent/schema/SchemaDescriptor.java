package agents.dataagent.schema;

import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Renders the static data-source schema into documentation for classification, ranking and
 * generation prompts.
 *
 * <p>Schema JSON layout:</p>
 * <pre>
 * {
 *   "database": "...", "schema": "...", "description": "...",
 *   "tables": [{"name", "fullName", "description", "rowCount",
 *               "columns": [{"name", "type", "nullable", "description", "isPrimaryKey",
 *                            "isForeignKey", "references": {"table", "column"},
 *                            "sampleValues": [...], "statistics": {"min", "max", "distinct"}}]}],
 *   "relationships": [{"from", "to", "type", "keys": [...]}]
 * }
 * </pre>
 */
public class SchemaDescriptor {

  public static final String DEFAULT_RESOURCE = "schema/data-source-schema.json";

  private static final String RULE = "=".repeat(80);

  private final JsonObject schema;
  private volatile String fullDocumentation;
  private volatile String conciseDocumentation;

  public SchemaDescriptor(JsonObject schema) {
    this.schema = schema == null ? new JsonObject() : schema;
  }

  /**
   * Load a schema definition bundled on the classpath.
   */
  public static SchemaDescriptor fromClasspath(String resource) {
    try (InputStream in = SchemaDescriptor.class.getClassLoader().getResourceAsStream(resource)) {
      if (in == null) {
        throw new IllegalStateException("Schema resource not found on classpath: " + resource);
      }
      return new SchemaDescriptor(new JsonObject(new String(in.readAllBytes(), StandardCharsets.UTF_8)));
    } catch (IOException e) {
      throw new IllegalStateException("Failed to read schema resource " + resource, e);
    }
  }

  public JsonObject getSchema() {
    return schema.copy();
  }

  public int tableCount() {
    return schema.getJsonArray("tables", new JsonArray()).size();
  }

  /**
   * Full documentation: every table with columns, keys, sample values, statistics and the relationships.
   */
  public String describe() {
    if (fullDocumentation == null) {
      fullDocumentation = renderFull();
    }
    return fullDocumentation;
  }

  /**
   * One line per table, for prompts that only need names and types.
   */
  public String describeConcise() {
    if (conciseDocumentation == null) {
      conciseDocumentation = renderConcise();
    }
    return conciseDocumentation;
  }

  private String renderFull() {
    List<String> lines = new ArrayList<>();

    lines.add("Database: " + schema.getString("database", "unknown"));
    lines.add("Schema: " + schema.getString("schema", "unknown"));
    lines.add("Description: " + schema.getString("description", ""));
    lines.add("");
    lines.add(RULE);
    lines.add("");

    for (JsonObject table : objects(schema.getJsonArray("tables"))) {
      lines.add("TABLE: " + table.getString("fullName", table.getString("name")));
      lines.add("Description: " + table.getString("description", ""));
      Long rowCount = table.getLong("rowCount");
      if (rowCount != null) {
        lines.add("Row Count: ~" + String.format("%,d", rowCount));
      }
      lines.add("");
      lines.add("Columns:");

      for (JsonObject column : objects(table.getJsonArray("columns"))) {
        lines.add(describeColumn(column));

        JsonArray samples = column.getJsonArray("sampleValues");
        if (samples != null && !samples.isEmpty()) {
          List<String> values = new ArrayList<>();
          samples.forEach(v -> values.add(String.valueOf(v)));
          lines.add("    Sample values: [" + String.join(", ", values) + "]");
        }

        JsonObject stats = column.getJsonObject("statistics");
        if (stats != null) {
          if (stats.containsKey("min") && stats.containsKey("max")) {
            lines.add("    Range: " + stats.getValue("min") + " to " + stats.getValue("max"));
          }
          if (stats.containsKey("distinct")) {
            lines.add("    Distinct values: " + String.format("%,d", stats.getLong("distinct")));
          }
        }
      }
      lines.add("");
    }

    lines.add(RULE);
    lines.add("");
    lines.add("TABLE RELATIONSHIPS:");
    lines.add("");
    for (JsonObject rel : objects(schema.getJsonArray("relationships"))) {
      List<String> keys = new ArrayList<>();
      rel.getJsonArray("keys", new JsonArray()).forEach(k -> keys.add(String.valueOf(k)));
      lines.add(rel.getString("from") + " -> " + rel.getString("to")
        + " (" + rel.getString("type", "many-to-one") + "): " + String.join(" = ", keys));
    }

    return String.join("\n", lines);
  }

  private String describeColumn(JsonObject column) {
    StringBuilder line = new StringBuilder("  - ")
      .append(column.getString("name"))
      .append(": ")
      .append(column.getString("type", "UNKNOWN"));

    if (column.getBoolean("isPrimaryKey", false)) {
      line.append(" (PRIMARY KEY)");
    }
    JsonObject references = column.getJsonObject("references");
    if (column.getBoolean("isForeignKey", false) && references != null) {
      line.append(" (FK -> ").append(references.getString("table")).append('.')
        .append(references.getString("column")).append(')');
    }
    if (!column.getBoolean("nullable", true)) {
      line.append(" NOT NULL");
    }
    String description = column.getString("description");
    if (description != null && !description.isEmpty()) {
      line.append(" - ").append(description);
    }
    return line.toString();
  }

  private String renderConcise() {
    List<String> lines = new ArrayList<>();
    lines.add("Database: " + schema.getString("schema", "unknown"));
    lines.add("");

    for (JsonObject table : objects(schema.getJsonArray("tables"))) {
      List<String> columns = new ArrayList<>();
      for (JsonObject column : objects(table.getJsonArray("columns"))) {
        String desc = column.getString("name") + ":" + column.getString("type", "UNKNOWN");
        if (column.getBoolean("isPrimaryKey", false)) desc += "(PK)";
        if (column.getBoolean("isForeignKey", false)) desc += "(FK)";
        columns.add(desc);
      }
      lines.add(table.getString("name") + ": " + String.join(", ", columns));
    }
    return String.join("\n", lines);
  }

  private static List<JsonObject> objects(JsonArray array) {
    List<JsonObject> result = new ArrayList<>();
    if (array == null) {
      return result;
    }
    for (int i = 0; i < array.size(); i++) {
      Object value = array.getValue(i);
      if (value instanceof JsonObject) {
        result.add((JsonObject) value);
      }
    }
    return result;
  }
}
