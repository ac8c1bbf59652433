package agents.dataagent;

import agents.dataagent.apis.StatusApi;
import agents.dataagent.auth.CredentialValidator;
import agents.dataagent.auth.FileCredentialStore;
import agents.dataagent.candidates.CandidateStore;
import agents.dataagent.candidates.CandidateStoreSync;
import agents.dataagent.candidates.ChromaCandidateStore;
import agents.dataagent.candidates.EmbeddingService;
import agents.dataagent.candidates.InMemoryCandidateStore;
import agents.dataagent.candidates.OpenAiEmbeddingService;
import agents.dataagent.catalog.CatalogHolder;
import agents.dataagent.config.AgentConfig;
import agents.dataagent.config.Env;
import agents.dataagent.db.JdbcQueryExecutor;
import agents.dataagent.db.QueryExecutor;
import agents.dataagent.db.QueryResult;
import agents.dataagent.intent.IntentResolver;
import agents.dataagent.protocol.MessageType;
import agents.dataagent.schema.SchemaDescriptor;
import agents.dataagent.services.LlmAPIService;
import agents.dataagent.services.Logger;
import agents.dataagent.session.DataAgentSession;
import agents.dataagent.session.handlers.CatalogUpdateHandler;
import agents.dataagent.session.handlers.DataRequestHandler;
import agents.dataagent.session.handlers.EnvelopeHandler;
import agents.dataagent.session.handlers.LoginRequestHandler;
import agents.dataagent.session.handlers.PromptRequestHandler;
import agents.dataagent.session.handlers.TokenVerifyRequestHandler;
import io.github.cdimascio.dotenv.Dotenv;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.VertxOptions;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

public class Driver {
  public static int logLevel = 3; // 0=errors, 1=info, 2=detail, 3=debug, 4=data
  public static Vertx vertx = Vertx.vertx(new VertxOptions()
      .setWorkerPoolSize(4)
      .setEventLoopPoolSize(1)
  );

  private static final String DATA_PATH = "./data";
  public static final String AGENT_DATA_PATH = DATA_PATH + "/agent";

  // Emergency log buffer - captures logs before Logger is ready
  private static final int EMERGENCY_BUFFER_SIZE = 500;
  private static final List<String> emergencyLogBuffer = Collections.synchronizedList(new LinkedList<>());
  private static boolean loggerReady = false;
  private static final long SHUTDOWN_TIMEOUT_SECONDS = 2;
  private static volatile DataAgentSession activeSession;

  /**
   * Captures log lines to the emergency buffer until the Logger is deployed, then publishes them directly.
   * Keeps the last EMERGENCY_BUFFER_SIZE entries.
   */
  public static void captureOrPublishLog(String message) {
    if (!loggerReady) {
      synchronized (emergencyLogBuffer) {
        if (emergencyLogBuffer.size() >= EMERGENCY_BUFFER_SIZE) {
          emergencyLogBuffer.remove(0);
        }
        emergencyLogBuffer.add(message);
      }
    } else {
      vertx.eventBus().publish(Logger.LOG_ADDRESS, message);
    }
  }

  private static void flushEmergencyBuffer() {
    synchronized (emergencyLogBuffer) {
      for (String entry : emergencyLogBuffer) {
        vertx.eventBus().publish(Logger.LOG_ADDRESS, entry);
      }
      emergencyLogBuffer.clear();
    }
  }

  public static void main(String[] args) {
    captureOrPublishLog("=== Data Agent Starting ===,1,Driver,System,System");
    captureOrPublishLog("Java version: " + System.getProperty("java.version") + ",2,Driver,System,System");
    captureOrPublishLog("Working directory: " + System.getProperty("user.dir") + ",2,Driver,System,System");
    captureOrPublishLog("Agent path: " + AGENT_DATA_PATH + ",2,Driver,System,System");

    // Deploy Logger FIRST before anything else
    System.out.println("Deploying Logger as first component...");
    vertx.deployVerticle(new Logger(), res -> {
      if (res.succeeded()) {
        loggerReady = true;
        flushEmergencyBuffer();
        captureOrPublishLog("Logger ready - emergency buffer flushed,2,Logger,System,System");
        loadEnvironmentAndStart();
      } else {
        System.err.println("FATAL: Logger deployment failed: " + res.cause().getMessage());
        System.err.println("Cannot continue without logging capability");
        System.exit(1);
      }
    });

    Runtime.getRuntime().addShutdownHook(new Thread(() -> {
      DataAgentSession session = activeSession;
      if (session != null) {
        try {
          session.shutdown().toCompletionStage().toCompletableFuture().get(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (Exception e) {
          System.err.println("Disconnect on shutdown did not complete: " + e.getMessage());
        }
      }
      vertx.eventBus().publish(Logger.FLUSH_ADDRESS, "shutdown");
    }));
  }

  private static void loadEnvironmentAndStart() {
    try {
      Dotenv.configure()
          .filename(".env.local")
          .systemProperties()  // Load as system properties so they're accessible via System.getProperty()
          .ignoreIfMissing()
          .load();
      captureOrPublishLog("Loaded environment configuration from .env.local,3,Driver,StartUp,Config");
    } catch (Exception e) {
      // Not fatal - the OS environment may carry everything
      captureOrPublishLog("Could not load .env.local file: " + e.getMessage() + ",1,Driver,StartUp,Config");
    }

    Integer configuredLevel = null;
    try {
      configuredLevel = Env.getInt("LOG_LEVEL", logLevel);
    } catch (IllegalStateException e) {
      captureOrPublishLog(e.getMessage() + ",0,Driver,StartUp,Config");
    }
    if (configuredLevel != null) {
      logLevel = configuredLevel;
    }

    try {
      new Driver().doIt();
    } catch (IllegalStateException e) {
      captureOrPublishLog("Fatal configuration error: " + e.getMessage() + ",0,Driver,StartUp,Config");
      System.err.println("Fatal configuration error: " + e.getMessage());
      vertx.eventBus().publish(Logger.FLUSH_ADDRESS, "config-error");
      vertx.setTimer(1000, id -> vertx.close().onComplete(v -> System.exit(1)));
    }
  }

  private void doIt() {
    AgentConfig config = AgentConfig.fromEnvironment();
    if (logLevel >= 1) captureOrPublishLog("Configuration: " + config.toJson().encode().replace(",", ";") + ",1,Driver,StartUp,Config");

    // Completion backend is required for prompt resolution
    if (!LlmAPIService.getInstance().setupService(vertx)) {
      throw new IllegalStateException("LLM API service could not be set up; check LLM_API_KEY");
    }

    SchemaDescriptor schema = SchemaDescriptor.fromClasspath(SchemaDescriptor.DEFAULT_RESOURCE);
    if (logLevel >= 2) captureOrPublishLog("Schema loaded with " + schema.tableCount() + " tables,2,Driver,StartUp,Schema");

    CatalogHolder catalog = new CatalogHolder();
    EmbeddingService embeddings = null;
    CandidateStore store = null;
    CandidateStoreSync sync = null;
    if (config.isCandidateSyncEnabled()) {
      if (OpenAiEmbeddingService.getInstance().setupService(vertx)) {
        embeddings = OpenAiEmbeddingService.getInstance();
        store = candidateStore();
        sync = new CandidateStoreSync(vertx, store, embeddings);
      } else {
        captureOrPublishLog("Embedding service unavailable - vector matching disabled; ranking the catalog directly,0,Driver,StartUp,Vector");
      }
    }

    IntentResolver resolver = IntentResolver.create(vertx, config, catalog, LlmAPIService.getInstance(), schema, store, embeddings);
    CredentialValidator credentials = new CredentialValidator(vertx, FileCredentialStore.fromEnvironment(vertx));

    Map<MessageType, EnvelopeHandler> handlers = new EnumMap<>(MessageType.class);
    handlers.put(MessageType.DATA_REQ, new DataRequestHandler(vertx,
      executor("DATABASE_URL", () -> JdbcQueryExecutor.rowStore(vertx)), MessageType.DATA_REQ));
    handlers.put(MessageType.WAREHOUSE_DATA_REQ, new DataRequestHandler(vertx,
      executor("WAREHOUSE_JDBC_URL", () -> JdbcQueryExecutor.warehouse(vertx)), MessageType.WAREHOUSE_DATA_REQ));
    handlers.put(MessageType.USER_PROMPT_REQ, new PromptRequestHandler(resolver));
    handlers.put(MessageType.AUTH_LOGIN_REQ, new LoginRequestHandler(credentials));
    handlers.put(MessageType.AUTH_VERIFY_REQ, new TokenVerifyRequestHandler(credentials));

    CatalogUpdateHandler catalogUpdates = new CatalogUpdateHandler(vertx, catalog, sync, config);
    DataAgentSession session = new DataAgentSession(config, catalog, catalogUpdates, handlers);
    activeSession = session;

    Future.all(
      vertx.deployVerticle(session),
      vertx.deployVerticle(new StatusApi())
    ).onSuccess(v -> {
      System.out.println("Data agent connected to " + config.getWebsocketUrl());
      if (logLevel >= 1) captureOrPublishLog("Data agent started,1,Driver,StartUp,System");
    }).onFailure(err -> {
      System.err.println("Data agent failed to start: " + err.getMessage());
      captureOrPublishLog("Data agent failed to start: " + err.getMessage() + ",0,Driver,StartUp,System");
    });
  }

  private CandidateStore candidateStore() {
    String chromaHost = Env.get("CHROMA_HOST");
    if (chromaHost == null) {
      if (logLevel >= 1) captureOrPublishLog("CHROMA_HOST not set - using the in-memory candidate store,1,Driver,StartUp,Vector");
      return new InMemoryCandidateStore();
    }
    if (logLevel >= 1) captureOrPublishLog("Using Chroma candidate store at " + chromaHost + ",1,Driver,StartUp,Vector");
    return new ChromaCandidateStore(vertx, chromaHost);
  }

  /**
   * Executor for a data source, or one that answers every query with a configuration error when the URL is missing.
   */
  private QueryExecutor executor(String urlKey, Supplier<QueryExecutor> factory) {
    if (Env.get(urlKey) == null) {
      captureOrPublishLog(urlKey + " not set - requests for this data source will be answered with an error,1,Driver,StartUp,Database");
      return sql -> Future.succeededFuture(QueryResult.failure("Data source is not configured (" + urlKey + ")"));
    }
    return factory.get();
  }
}
