package agents.dataagent.config;

import io.vertx.core.json.JsonObject;

/**
 * Session and resolution settings of the data agent.
 * Built from the environment at startup, or through {@link #builder()} in tests.
 */
public class AgentConfig {

  public static final long DEFAULT_RECONNECT_INTERVAL_MS = 5000;
  public static final int DEFAULT_MAX_RECONNECT_ATTEMPTS = 10;
  public static final long DEFAULT_REQUEST_TIMEOUT_MS = 30_000;
  public static final int DEFAULT_MAX_MESSAGE_SIZE = 1_048_576;
  public static final int DEFAULT_QUERY_LIMIT = 50;
  public static final int DEFAULT_TOP_K = 5;

  /** Where a matched artifact is looked up. */
  public enum MatchingMethod {
    VECTOR, LLM;

    static MatchingMethod parse(String value) {
      return "llm".equalsIgnoreCase(value) || "groq".equalsIgnoreCase(value) ? LLM : VECTOR;
    }
  }

  /** Whether prompts are classified before matching. */
  public enum ResolutionMode {
    CLASSIFY, MATCH;

    static ResolutionMode parse(String value) {
      return "match".equalsIgnoreCase(value) ? MATCH : CLASSIFY;
    }
  }

  private final String websocketUrl;
  private final String userId;
  private final String projectId;
  private final String agentType;
  private final long reconnectIntervalMs;
  private final int maxReconnectAttempts;
  private final long requestTimeoutMs;
  private final int maxMessageSize;
  private final int defaultQueryLimit;
  private final MatchingMethod matchingMethod;
  private final ResolutionMode resolutionMode;
  private final int vectorTopK;
  private final boolean vectorForceRecreate;
  private final boolean catalogFetchOnConnect;

  private AgentConfig(Builder builder) {
    this.websocketUrl = builder.websocketUrl;
    this.userId = builder.userId;
    this.projectId = builder.projectId;
    this.agentType = builder.agentType;
    this.reconnectIntervalMs = builder.reconnectIntervalMs;
    this.maxReconnectAttempts = builder.maxReconnectAttempts;
    this.requestTimeoutMs = builder.requestTimeoutMs;
    this.maxMessageSize = builder.maxMessageSize;
    this.defaultQueryLimit = builder.defaultQueryLimit;
    this.matchingMethod = builder.matchingMethod;
    this.resolutionMode = builder.resolutionMode;
    this.vectorTopK = builder.vectorTopK;
    this.vectorForceRecreate = builder.vectorForceRecreate;
    this.catalogFetchOnConnect = builder.catalogFetchOnConnect;
  }

  /**
   * Load settings from .env.local / the process environment. WEBSOCKET_URL is required.
   */
  public static AgentConfig fromEnvironment() {
    return builder()
      .websocketUrl(Env.getRequired("WEBSOCKET_URL"))
      .userId(Env.get("USER_ID", "user123"))
      .projectId(Env.get("PROJECT_ID", ""))
      .agentType(Env.get("AGENT_TYPE", "data-agent"))
      .reconnectIntervalMs(Env.getLong("RECONNECT_INTERVAL_MS", DEFAULT_RECONNECT_INTERVAL_MS))
      .maxReconnectAttempts(Env.getInt("MAX_RECONNECT_ATTEMPTS", DEFAULT_MAX_RECONNECT_ATTEMPTS))
      .requestTimeoutMs(Env.getLong("REQUEST_TIMEOUT_MS", DEFAULT_REQUEST_TIMEOUT_MS))
      .maxMessageSize(Env.getInt("MAX_MESSAGE_SIZE_BYTES", DEFAULT_MAX_MESSAGE_SIZE))
      .defaultQueryLimit(Env.getInt("DEFAULT_QUERY_LIMIT", DEFAULT_QUERY_LIMIT))
      .matchingMethod(MatchingMethod.parse(Env.get("COMPONENT_MATCHING_METHOD", "vector")))
      .resolutionMode(ResolutionMode.parse(Env.get("RESOLUTION_MODE", "classify")))
      .vectorTopK(Env.getInt("VECTOR_TOP_K", DEFAULT_TOP_K))
      .vectorForceRecreate(Env.getBoolean("VECTOR_FORCE_RECREATE", false))
      .catalogFetchOnConnect(Env.getBoolean("CATALOG_FETCH_ON_CONNECT", false))
      .build();
  }

  public static Builder builder() {
    return new Builder();
  }

  public String getWebsocketUrl() { return websocketUrl; }
  public String getUserId() { return userId; }
  public String getProjectId() { return projectId; }
  public String getAgentType() { return agentType; }
  public long getReconnectIntervalMs() { return reconnectIntervalMs; }
  public int getMaxReconnectAttempts() { return maxReconnectAttempts; }
  public long getRequestTimeoutMs() { return requestTimeoutMs; }
  public int getMaxMessageSize() { return maxMessageSize; }
  public int getDefaultQueryLimit() { return defaultQueryLimit; }
  public MatchingMethod getMatchingMethod() { return matchingMethod; }
  public ResolutionMode getResolutionMode() { return resolutionMode; }
  public int getVectorTopK() { return vectorTopK; }
  public boolean isVectorForceRecreate() { return vectorForceRecreate; }
  public boolean isCatalogFetchOnConnect() { return catalogFetchOnConnect; }

  /**
   * Name of the candidate collection holding this project's components.
   */
  public String getCandidateCollectionName() {
    return projectId + "_components";
  }

  /**
   * Candidate synchronization is active only when matching goes through the vector store.
   */
  public boolean isCandidateSyncEnabled() {
    return matchingMethod == MatchingMethod.VECTOR;
  }

  /**
   * Configuration summary for logs and the status endpoint (no secrets).
   */
  public JsonObject toJson() {
    return new JsonObject()
      .put("websocketUrl", websocketUrl)
      .put("userId", userId)
      .put("projectId", projectId)
      .put("agentType", agentType)
      .put("reconnectIntervalMs", reconnectIntervalMs)
      .put("maxReconnectAttempts", maxReconnectAttempts)
      .put("requestTimeoutMs", requestTimeoutMs)
      .put("maxMessageSize", maxMessageSize)
      .put("defaultQueryLimit", defaultQueryLimit)
      .put("matchingMethod", matchingMethod.name().toLowerCase())
      .put("resolutionMode", resolutionMode.name().toLowerCase())
      .put("vectorTopK", vectorTopK)
      .put("vectorForceRecreate", vectorForceRecreate)
      .put("catalogFetchOnConnect", catalogFetchOnConnect);
  }

  public static class Builder {
    private String websocketUrl;
    private String userId = "user123";
    private String projectId = "";
    private String agentType = "data-agent";
    private long reconnectIntervalMs = DEFAULT_RECONNECT_INTERVAL_MS;
    private int maxReconnectAttempts = DEFAULT_MAX_RECONNECT_ATTEMPTS;
    private long requestTimeoutMs = DEFAULT_REQUEST_TIMEOUT_MS;
    private int maxMessageSize = DEFAULT_MAX_MESSAGE_SIZE;
    private int defaultQueryLimit = DEFAULT_QUERY_LIMIT;
    private MatchingMethod matchingMethod = MatchingMethod.VECTOR;
    private ResolutionMode resolutionMode = ResolutionMode.CLASSIFY;
    private int vectorTopK = DEFAULT_TOP_K;
    private boolean vectorForceRecreate = false;
    private boolean catalogFetchOnConnect = false;

    public Builder websocketUrl(String websocketUrl) { this.websocketUrl = websocketUrl; return this; }
    public Builder userId(String userId) { this.userId = userId; return this; }
    public Builder projectId(String projectId) { this.projectId = projectId; return this; }
    public Builder agentType(String agentType) { this.agentType = agentType; return this; }
    public Builder reconnectIntervalMs(long reconnectIntervalMs) { this.reconnectIntervalMs = reconnectIntervalMs; return this; }
    public Builder maxReconnectAttempts(int maxReconnectAttempts) { this.maxReconnectAttempts = maxReconnectAttempts; return this; }
    public Builder requestTimeoutMs(long requestTimeoutMs) { this.requestTimeoutMs = requestTimeoutMs; return this; }
    public Builder maxMessageSize(int maxMessageSize) { this.maxMessageSize = maxMessageSize; return this; }
    public Builder defaultQueryLimit(int defaultQueryLimit) { this.defaultQueryLimit = defaultQueryLimit; return this; }
    public Builder matchingMethod(MatchingMethod matchingMethod) { this.matchingMethod = matchingMethod; return this; }
    public Builder resolutionMode(ResolutionMode resolutionMode) { this.resolutionMode = resolutionMode; return this; }
    public Builder vectorTopK(int vectorTopK) { this.vectorTopK = vectorTopK; return this; }
    public Builder vectorForceRecreate(boolean vectorForceRecreate) { this.vectorForceRecreate = vectorForceRecreate; return this; }
    public Builder catalogFetchOnConnect(boolean catalogFetchOnConnect) { this.catalogFetchOnConnect = catalogFetchOnConnect; return this; }

    public AgentConfig build() {
      if (websocketUrl == null || websocketUrl.isBlank()) {
        throw new IllegalStateException("WEBSOCKET_URL is not defined");
      }
      if (maxReconnectAttempts < 0) {
        throw new IllegalStateException("MAX_RECONNECT_ATTEMPTS must not be negative");
      }
      if (maxMessageSize <= 0) {
        throw new IllegalStateException("MAX_MESSAGE_SIZE_BYTES must be positive");
      }
      return new AgentConfig(this);
    }
  }
}
