package agents.dataagent.intent;

/**
 * How a resolution result was produced. Reported to the runtime as the <code>method</code> field.
 */
public enum ResolutionMethod {
  CLASSIFICATION_GENERAL("classification-general"),
  GENERATED("generated"),
  GENERATED_MULTI("generated-multi"),
  LLM_RANKING("llm-ranking"),
  LLM_GENERATED("llm-generated"),
  VECTOR_SEARCH("vector-search"),
  NONE("none");

  private final String tag;

  ResolutionMethod(String tag) {
    this.tag = tag;
  }

  public String getTag() {
    return tag;
  }

  /** Methods that select an existing catalog artifact rather than minting one. */
  public boolean isCatalogMatch() {
    return this == LLM_RANKING || this == VECTOR_SEARCH;
  }
}
