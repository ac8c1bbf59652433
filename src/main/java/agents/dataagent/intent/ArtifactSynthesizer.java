package agents.dataagent.intent;

import agents.dataagent.catalog.Artifact;
import agents.dataagent.catalog.ArtifactConfig;
import agents.dataagent.catalog.ArtifactProps;
import agents.dataagent.catalog.VisualizationType;
import agents.dataagent.safety.QueryLimiter;
import agents.dataagent.schema.SchemaDescriptor;
import agents.dataagent.services.CompletionService;
import agents.dataagent.services.LogUtil;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

import java.util.ArrayList;
import java.util.List;
import java.util.function.LongSupplier;

/**
 * Mints new artifacts for analytical prompts: one artifact of a free or constrained type, or
 * several artifacts of requested types grouped into a container.
 *
 * <p>Every generated query passes the row-limit guarantee. Backend failures produce an
 * empty {@link Synthesis}, never a failed future.</p>
 */
public class ArtifactSynthesizer {

  private static final String VOCABULARY = """
      - "single-metric": one number (total, average, count, min, max, percentage).
        Query returns a single row with the column alias "value". Config: formatter (currency|number|percentage), gradient, icon
      - "time-series": trends over time. Config: xKey, yKey, colors, height
      - "categorical-comparison": comparing categories, rankings, distributions. Config: xKey, yKey, colors, height
      - "proportion": shares of a whole, composition. Config: nameKey, valueKey, colors, height
      - "tabular": detailed lists with several attributes. Config: columns, pageSize
      """;

  private static final String SINGLE_PROMPT = """
      You are an expert data analyst AI that generates appropriate visualizations and SQL queries for user questions.

      Database Schema:
      %s

      Visualization types:
      %s
      %s

      Query rules:
      - Use the exact table and column names from the schema
      - Add appropriate filters, aggregations and sorting
      - ALWAYS include a LIMIT clause (default: %d rows) to prevent large result sets

      Respond with a JSON object:
      {
        "componentType": "<visualization tag>",
        "query": "SQL query string",
        "title": "Component title",
        "description": "Component description",
        "config": { },
        "reasoning": "why this visualization and query were chosen",
        "canGenerate": boolean
      }

      Only set canGenerate to true if you can confidently generate a query.
      If the question is vague, ambiguous or unrelated to the available data, set canGenerate to false.
      """;

  private static final String MULTI_PROMPT = """
      You are an expert data analyst AI that builds a small dashboard answering one user question.

      Database Schema:
      %s

      Visualization types:
      %s
      Generate exactly one component for each of these visualization types, in this order: %s

      Query rules:
      - Use the exact table and column names from the schema
      - ALWAYS include a LIMIT clause (default: %d rows) in every query

      Respond with a JSON object:
      {
        "containerTitle": "Dashboard title",
        "containerDescription": "What the dashboard shows",
        "components": [
          {"componentType": "<visualization tag>", "query": "SQL", "title": "...", "description": "...", "config": { }}
        ],
        "reasoning": "brief explanation",
        "canGenerate": boolean
      }
      """;

  private final Vertx vertx;
  private final CompletionService completion;
  private final SchemaDescriptor schema;
  private final int queryLimit;
  private final LongSupplier clock;

  public ArtifactSynthesizer(Vertx vertx, CompletionService completion, SchemaDescriptor schema, int queryLimit) {
    this(vertx, completion, schema, queryLimit, System::currentTimeMillis);
  }

  ArtifactSynthesizer(Vertx vertx, CompletionService completion, SchemaDescriptor schema, int queryLimit,
                      LongSupplier clock) {
    this.vertx = vertx;
    this.completion = completion;
    this.schema = schema;
    this.queryLimit = queryLimit;
    this.clock = clock;
  }

  /**
   * Generate one artifact.
   *
   * @param constraint required visualization type, or null to let the backend choose
   */
  public Future<Synthesis> synthesizeOne(String prompt, VisualizationType constraint) {
    String typeRule = constraint == null
      ? "Choose the visualization type that best answers the question."
      : "The componentType MUST be \"" + constraint.getTag() + "\".";
    String systemPrompt = String.format(SINGLE_PROMPT, schema.describe(), VOCABULARY, typeRule, queryLimit);
    String userPrompt = "User question: \"" + prompt + "\"\n\n"
      + "Analyze this question and generate the appropriate visualization with SQL query.";

    return completion.completeJson(systemPrompt, userPrompt, 0.2, 2000)
      .map(reply -> {
        if (!Boolean.TRUE.equals(reply.getValue("canGenerate"))) {
          return Synthesis.none(text(reply, "reasoning", "Unable to generate component for this question"));
        }
        Artifact artifact = buildChild(reply, constraint, null);
        if (artifact == null) {
          return Synthesis.none("Generated component has an unusable type: " + reply.getValue("componentType"));
        }
        return new Synthesis(artifact, text(reply, "reasoning", "Generated dynamic component based on analytical question"));
      })
      .otherwise(err -> {
        LogUtil.logError(vertx, "Error generating analytical component", err, "ArtifactSynthesizer", "Generate", "Single");
        return Synthesis.none("Error occurred while generating component");
      });
  }

  /**
   * Generate one artifact per requested type and wrap them in a container (layout grid).
   * A type the backend produced nothing usable for is left out; no children means no artifact.
   */
  public Future<Synthesis> synthesizeMany(String prompt, List<VisualizationType> types) {
    List<String> tags = new ArrayList<>();
    types.forEach(type -> tags.add(type.getTag()));
    String systemPrompt = String.format(MULTI_PROMPT, schema.describe(), VOCABULARY, String.join(", ", tags), queryLimit);
    String userPrompt = "User question: \"" + prompt + "\"\n\n"
      + "Generate the components for these visualization types: " + String.join(", ", tags);

    return completion.completeJson(systemPrompt, userPrompt, 0.2, 3000)
      .map(reply -> assembleContainer(reply, types))
      .otherwise(err -> {
        LogUtil.logError(vertx, "Error generating multi-component dashboard", err, "ArtifactSynthesizer", "Generate", "Multi");
        return Synthesis.none("Error occurred while generating components");
      });
  }

  private Synthesis assembleContainer(JsonObject reply, List<VisualizationType> types) {
    if (!Boolean.TRUE.equals(reply.getValue("canGenerate"))) {
      return Synthesis.none(text(reply, "reasoning", "Unable to generate components for this question"));
    }

    List<JsonObject> drafts = new ArrayList<>();
    Object rawComponents = reply.getValue("components");
    if (rawComponents instanceof JsonArray) {
      for (Object item : (JsonArray) rawComponents) {
        drafts.add(item instanceof JsonObject ? (JsonObject) item : null);
      }
    }

    boolean[] used = new boolean[drafts.size()];
    List<Artifact> children = new ArrayList<>();
    for (int position = 0; position < types.size(); position++) {
      VisualizationType type = types.get(position);
      int chosen = pickDraft(drafts, used, type, position);
      if (chosen < 0) {
        LogUtil.logDetail(vertx, "No generated component for " + type.getTag() + "; omitted",
          "ArtifactSynthesizer", "Generate", "Multi");
        continue;
      }
      used[chosen] = true;
      Artifact child = buildChild(drafts.get(chosen), type, children.size() + 1);
      if (child != null) {
        children.add(child);
      }
    }

    if (children.isEmpty()) {
      return Synthesis.none(text(reply, "reasoning", "No components could be generated"));
    }

    String title = text(reply, "containerTitle", null);
    String description = text(reply, "containerDescription", null);
    ArtifactProps props = new ArtifactProps(null, title, description,
      ArtifactConfig.ContainerConfig.of(children), null);
    Artifact container = Artifact.synthesized(
      Artifact.dynamicId(VisualizationType.CONTAINER, clock.getAsLong(), null),
      VisualizationType.CONTAINER, description, props);

    return new Synthesis(container, text(reply, "reasoning", "Generated " + children.size() + " components"));
  }

  /**
   * First unused draft of the wanted type; otherwise the draft at the same position when its type is unreadable.
   */
  private static int pickDraft(List<JsonObject> drafts, boolean[] used, VisualizationType type, int position) {
    for (int i = 0; i < drafts.size(); i++) {
      JsonObject draft = drafts.get(i);
      if (!used[i] && draft != null && VisualizationType.fromTag(draft.getString("componentType")) == type) {
        return i;
      }
    }
    if (position < drafts.size() && !used[position] && drafts.get(position) != null) {
      Object rawType = drafts.get(position).getValue("componentType");
      if (!(rawType instanceof String) || VisualizationType.fromTag((String) rawType) == null) {
        return position;
      }
    }
    return -1;
  }

  /**
   * Build one synthesized leaf artifact. A constraint overrides the type the backend reported.
   */
  private Artifact buildChild(JsonObject draft, VisualizationType constraint, Integer position) {
    VisualizationType type = constraint;
    if (type == null) {
      Object rawType = draft.getValue("componentType");
      type = rawType instanceof String ? VisualizationType.fromTag((String) rawType) : null;
    }
    if (type == null || type == VisualizationType.CONTAINER) {
      return null;
    }

    String query = draft.getValue("query") instanceof String
      ? QueryLimiter.ensureQueryLimit(draft.getString("query"), queryLimit)
      : null;
    String title = text(draft, "title", null);
    String description = text(draft, "description", null);
    JsonObject config = draft.getValue("config") instanceof JsonObject ? draft.getJsonObject("config") : new JsonObject();

    ArtifactProps props = new ArtifactProps(query, title, description, ArtifactConfig.fromJson(type.getTag(), config), null);
    return Artifact.synthesized(Artifact.dynamicId(type, clock.getAsLong(), position), type, description, props);
  }

  private static String text(JsonObject json, String key, String fallback) {
    Object value = json.getValue(key);
    return value instanceof String && !((String) value).isBlank() ? (String) value : fallback;
  }

  /**
   * A synthesized artifact with the backend's reasoning; the artifact is null when nothing could be generated.
   */
  public static final class Synthesis {
    private final Artifact artifact;
    private final String reasoning;

    public Synthesis(Artifact artifact, String reasoning) {
      this.artifact = artifact;
      this.reasoning = reasoning;
    }

    public static Synthesis none(String reasoning) {
      return new Synthesis(null, reasoning);
    }

    public Artifact getArtifact() { return artifact; }
    public String getReasoning() { return reasoning; }
  }
}
