package agents.dataagent.intent;

import agents.dataagent.catalog.Artifact;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Outcome of resolving one prompt: at most one artifact plus the diagnostics the runtime shows
 * next to it.
 */
public final class ResolutionResult {

  private final Artifact artifact;
  private final String reasoning;
  private final ResolutionMethod method;
  private final boolean queryModified;
  private final String queryReasoning;
  private final boolean propsModified;
  private final List<String> propsModifications;
  private final Integer confidence;
  private final ClassificationResult classification;

  private ResolutionResult(Builder builder) {
    this.artifact = builder.artifact;
    this.reasoning = builder.reasoning;
    this.method = builder.method;
    this.queryModified = builder.queryModified;
    this.queryReasoning = builder.queryReasoning;
    this.propsModified = builder.propsModified;
    this.propsModifications = Collections.unmodifiableList(new ArrayList<>(builder.propsModifications));
    this.confidence = builder.confidence;
    this.classification = builder.classification;
  }

  public static Builder builder(ResolutionMethod method) {
    return new Builder(method);
  }

  public static ResolutionResult empty(ResolutionMethod method, String reasoning) {
    return builder(method).reasoning(reasoning).build();
  }

  public Artifact getArtifact() { return artifact; }
  public boolean hasArtifact() { return artifact != null; }
  public String getReasoning() { return reasoning; }
  public ResolutionMethod getMethod() { return method; }
  public boolean isQueryModified() { return queryModified; }
  public String getQueryReasoning() { return queryReasoning; }
  public boolean isPropsModified() { return propsModified; }
  public List<String> getPropsModifications() { return propsModifications; }
  public Integer getConfidence() { return confidence; }
  public ClassificationResult getClassification() { return classification; }

  public Builder toBuilder() {
    return new Builder(method)
      .artifact(artifact)
      .reasoning(reasoning)
      .queryModified(queryModified)
      .queryReasoning(queryReasoning)
      .propsModified(propsModified)
      .propsModifications(propsModifications)
      .confidence(confidence)
      .classification(classification);
  }

  /**
   * Payload of a <code>user_prompt_res</code> envelope.
   */
  public JsonObject toPayload() {
    JsonObject payload = new JsonObject()
      .put("component", artifact == null ? null : artifact.toJson())
      .put("reasoning", reasoning)
      .put("method", method.getTag())
      .put("queryModified", queryModified)
      .put("queryReasoning", queryReasoning)
      .put("propsModified", propsModified)
      .put("propsModifications", new JsonArray(new ArrayList<>(propsModifications)));
    if (confidence != null) {
      payload.put("confidence", confidence);
    }
    if (classification != null) {
      payload.put("classification", classification.toJson());
    }
    return payload;
  }

  public static class Builder {
    private final ResolutionMethod method;
    private Artifact artifact;
    private String reasoning = "";
    private boolean queryModified;
    private String queryReasoning = "";
    private boolean propsModified;
    private List<String> propsModifications = Collections.emptyList();
    private Integer confidence;
    private ClassificationResult classification;

    Builder(ResolutionMethod method) {
      this.method = method;
    }

    public Builder artifact(Artifact artifact) { this.artifact = artifact; return this; }
    public Builder reasoning(String reasoning) { this.reasoning = reasoning == null ? "" : reasoning; return this; }
    public Builder queryModified(boolean queryModified) { this.queryModified = queryModified; return this; }
    public Builder queryReasoning(String queryReasoning) { this.queryReasoning = queryReasoning == null ? "" : queryReasoning; return this; }
    public Builder propsModified(boolean propsModified) { this.propsModified = propsModified; return this; }
    public Builder propsModifications(List<String> propsModifications) {
      this.propsModifications = propsModifications == null ? Collections.emptyList() : propsModifications;
      return this;
    }
    public Builder confidence(Integer confidence) { this.confidence = confidence; return this; }
    public Builder classification(ClassificationResult classification) { this.classification = classification; return this; }

    public ResolutionResult build() {
      return new ResolutionResult(this);
    }
  }
}
