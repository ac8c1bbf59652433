package agents.dataagent.intent;

import agents.dataagent.catalog.Artifact;
import agents.dataagent.catalog.ArtifactProps;
import agents.dataagent.safety.QueryLimiter;
import agents.dataagent.schema.SchemaDescriptor;
import agents.dataagent.services.CompletionService;
import agents.dataagent.services.LogUtil;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Adapts the props of a matched catalog artifact (query, title, description, config) to the
 * prompt that selected it.
 *
 * <p>The returned query is always re-limited, including on failure, where the original props
 * come back with only their query bounded.</p>
 */
public class PropsValidator {

  private static final String SYSTEM_PROMPT = """
      You are an AI assistant that validates and modifies component props based on user requests.

      Given:
      - A user's natural language request
      - Component name: %s
      - Component type: %s
      - Component description: %s
      - Current component props: query (SQL to fetch data), title, description and a config object

      Database Schema:
      %s

      Modify the props only where the user's request needs it:
      1. Query: change filters, time ranges, limits or aggregations when the user asks for different data.
         Use the exact table and column names from the schema and keep the column aliases the component expects.
         ALWAYS include a LIMIT clause (default: %d rows).
      2. Title and description: reflect the specific request, concise and descriptive.
      3. Config: only change what the user explicitly asks for.

      Respond with a JSON object:
      {
        "props": { "query": "...", "title": "...", "description": "...", "config": { } },
        "isModified": boolean,
        "reasoning": "brief explanation of changes",
        "modifications": ["list of specific changes made"]
      }

      Return the COMPLETE props object, not just the modified fields.
      """;

  private final Vertx vertx;
  private final CompletionService completion;
  private final SchemaDescriptor schema;
  private final int queryLimit;

  public PropsValidator(Vertx vertx, CompletionService completion, SchemaDescriptor schema, int queryLimit) {
    this.vertx = vertx;
    this.completion = completion;
    this.schema = schema;
    this.queryLimit = queryLimit;
  }

  public Future<Validation> validate(String prompt, Artifact artifact) {
    ArtifactProps original = artifact.getProps();
    String systemPrompt = String.format(SYSTEM_PROMPT,
      artifact.getName(), artifact.getType(),
      artifact.getDescription() == null ? "No description" : artifact.getDescription(),
      schema.describe(), queryLimit);
    String userPrompt = "User request: \"" + prompt + "\"\n\n"
      + "Current props:\n" + original.toJson().encodePrettily() + "\n\n"
      + "Component type: " + artifact.getType() + "\n\n"
      + "Analyze the user's request and modify the props accordingly. Return the complete modified props object.";

    return completion.completeJson(systemPrompt, userPrompt, 0.2, 2500)
      .map(reply -> interpret(reply, artifact))
      .otherwise(err -> {
        LogUtil.logError(vertx, "Props validation failed for " + artifact.getId() + "; keeping original props", err,
          "PropsValidator", "Validate", "Fallback");
        ArtifactProps fallback = original.getQuery() == null
          ? original
          : original.withQuery(QueryLimiter.ensureQueryLimit(original.getQuery(), queryLimit));
        return Validation.unchanged(fallback, "Error occurred during validation, using original props");
      });
  }

  private Validation interpret(JsonObject reply, Artifact artifact) {
    ArtifactProps props = reply.getValue("props") instanceof JsonObject
      ? ArtifactProps.fromJson(artifact.getType(), reply.getJsonObject("props"))
      : artifact.getProps();
    if (props.getQuery() != null) {
      props = props.withQuery(QueryLimiter.ensureQueryLimit(props.getQuery(), queryLimit));
    }

    List<String> modifications = new ArrayList<>();
    Object rawModifications = reply.getValue("modifications");
    if (rawModifications instanceof JsonArray) {
      for (Object item : (JsonArray) rawModifications) {
        if (item != null) {
          modifications.add(String.valueOf(item));
        }
      }
    }
    String reasoning = reply.getValue("reasoning") instanceof String ? reply.getString("reasoning") : "No modifications needed";
    return new Validation(props, Boolean.TRUE.equals(reply.getValue("isModified")), reasoning, modifications);
  }

  /**
   * Props after validation with the backend's account of what changed.
   */
  public static final class Validation {
    private final ArtifactProps props;
    private final boolean modified;
    private final String reasoning;
    private final List<String> modifications;

    public Validation(ArtifactProps props, boolean modified, String reasoning, List<String> modifications) {
      this.props = props;
      this.modified = modified;
      this.reasoning = reasoning;
      this.modifications = Collections.unmodifiableList(new ArrayList<>(modifications));
    }

    public static Validation unchanged(ArtifactProps props, String reasoning) {
      return new Validation(props, false, reasoning, Collections.emptyList());
    }

    public ArtifactProps getProps() { return props; }
    public boolean isModified() { return modified; }
    public String getReasoning() { return reasoning; }
    public List<String> getModifications() { return modifications; }
  }
}
