package agents.dataagent.session;

import agents.dataagent.catalog.CatalogHolder;
import agents.dataagent.catalog.CatalogSnapshot;
import agents.dataagent.config.AgentConfig;
import agents.dataagent.protocol.Envelope;
import agents.dataagent.protocol.EnvelopeDecodeException;
import agents.dataagent.protocol.MessageType;
import agents.dataagent.safety.MessageSizeGuard;
import agents.dataagent.services.LogUtil;
import agents.dataagent.session.handlers.CatalogUpdateHandler;
import agents.dataagent.session.handlers.EnvelopeHandler;
import io.vertx.core.AbstractVerticle;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.eventbus.MessageConsumer;
import io.vertx.core.http.WebSocket;
import io.vertx.core.http.WebSocketClient;
import io.vertx.core.http.WebSocketClientOptions;
import io.vertx.core.http.WebSocketConnectOptions;
import io.vertx.core.json.JsonObject;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.EnumMap;
import java.util.Map;

/**
 * The agent's single connection to the host.
 *
 * <p>Inbound frames are decoded and either complete a locally initiated request (same id) or are
 * dispatched by type to an {@link EnvelopeHandler}. Every outbound frame passes the size guard.
 * Unexpected closes are retried under a {@link ReconnectPolicy}; running out of attempts is
 * published on {@value #RECONNECT_EXHAUSTED_ADDRESS}.</p>
 *
 * <p>All session state is confined to this verticle's event loop.</p>
 */
public class DataAgentSession extends AbstractVerticle {

  public static final String STATUS_ADDRESS = "session.status";
  public static final String RECONNECT_EXHAUSTED_ADDRESS = "session.reconnect.exhausted";

  // Catalog updates arrive as one message and can be far larger than what the agent sends
  private static final int MAX_INBOUND_MESSAGE_SIZE = 64 * 1024 * 1024;

  private final AgentConfig config;
  private final CatalogHolder catalog;
  private final CatalogUpdateHandler catalogUpdates;
  private final Map<MessageType, EnvelopeHandler> handlers = new EnumMap<>(MessageType.class);
  private final MessageSizeGuard sizeGuard;
  private final ReconnectPolicy reconnectPolicy;

  private WebSocketClient client;
  private WebSocket socket;
  private PendingRequests pending;
  private MessageConsumer<JsonObject> statusConsumer;
  private long reconnectTimerId = -1;
  private boolean catalogRequested;

  /**
   * @param handlers handlers per inbound type; the catalog update handler is registered on its own
   */
  public DataAgentSession(AgentConfig config, CatalogHolder catalog, CatalogUpdateHandler catalogUpdates,
                          Map<MessageType, EnvelopeHandler> handlers) {
    this.config = config;
    this.catalog = catalog;
    this.catalogUpdates = catalogUpdates;
    this.handlers.putAll(handlers);
    this.handlers.put(MessageType.COMPONENT_LIST_UPDATE, catalogUpdates);
    this.sizeGuard = new MessageSizeGuard(config.getMaxMessageSize());
    this.reconnectPolicy = new ReconnectPolicy(config.getReconnectIntervalMs(), config.getMaxReconnectAttempts());
  }

  @Override
  public void start(Promise<Void> startPromise) {
    pending = new PendingRequests(vertx);
    client = vertx.createWebSocketClient(new WebSocketClientOptions()
      .setMaxMessageSize(MAX_INBOUND_MESSAGE_SIZE));
    statusConsumer = vertx.eventBus().consumer(STATUS_ADDRESS, message -> message.reply(status()));

    LogUtil.logInfo(vertx, "Starting data agent session " + config.toJson().encode(), "DataAgentSession", "StartUp", "Config");
    connect().onComplete(ar -> {
      if (ar.succeeded()) {
        startPromise.complete();
      } else {
        startPromise.fail(ar.cause());
      }
    });
  }

  @Override
  public void stop(Promise<Void> stopPromise) {
    if (statusConsumer != null) {
      statusConsumer.unregister();
    }
    disconnect().onComplete(ar -> client.close().onComplete(v -> stopPromise.complete()));
  }

  /**
   * Open the channel. Resolves when the channel is open; the reconnect counter is reset then.
   */
  public Future<Void> connect() {
    String url = connectionUrl(config);
    WebSocketConnectOptions options;
    try {
      options = connectOptions(url);
    } catch (IllegalArgumentException e) {
      return Future.failedFuture(e);
    }

    LogUtil.logDetail(vertx, "Connecting to " + url, "DataAgentSession", "Connection", "Connect");
    return client.connect(options).onSuccess(ws -> {
      socket = ws;
      reconnectPolicy.reset();
      ws.textMessageHandler(this::onFrame);
      ws.exceptionHandler(err -> LogUtil.logError(vertx, "WebSocket error", err, "DataAgentSession", "Connection", "Error"));
      ws.closeHandler(v -> onClosed(ws));
      LogUtil.logInfo(vertx, "Connected to host as " + config.getAgentType(), "DataAgentSession", "Connection", "Open");
      afterConnect();
    }).onFailure(err -> LogUtil.logError(vertx, "Connection to " + url + " failed", err, "DataAgentSession", "Connection", "Error"))
      .mapEmpty();
  }

  /**
   * Stop reconnecting and close the channel. Safe to call more than once.
   */
  public Future<Void> disconnect() {
    reconnectPolicy.disable();
    if (reconnectTimerId >= 0) {
      vertx.cancelTimer(reconnectTimerId);
      reconnectTimerId = -1;
    }
    WebSocket current = socket;
    if (current == null || current.isClosed()) {
      return Future.succeededFuture();
    }
    LogUtil.logInfo(vertx, "Disconnecting from host", "DataAgentSession", "Connection", "Close");
    return current.close();
  }

  /**
   * {@link #disconnect()} on the session's own context; callable from any thread, such as a JVM shutdown hook.
   */
  public Future<Void> shutdown() {
    if (context == null) {
      return Future.succeededFuture();
    }
    Promise<Void> done = Promise.promise();
    context.runOnContext(v -> disconnect().onComplete(done));
    return done.future();
  }

  public boolean isConnected() {
    return socket != null && !socket.isClosed();
  }

  /**
   * Send an envelope. Oversized envelopes are replaced by a diagnostic on the same id.
   */
  public Future<Void> send(Envelope envelope) {
    if (!isConnected()) {
      LogUtil.logError(vertx, "Cannot send " + envelope.getType() + " " + envelope.getId() + ": WebSocket is not connected",
        "DataAgentSession", "Send", "Disconnected");
      return Future.failedFuture(new IllegalStateException("WebSocket is not connected"));
    }

    String frame = envelope.encode();
    MessageSizeGuard.SizeCheck check = sizeGuard.validate(frame);
    if (!check.isValid()) {
      LogUtil.logError(vertx, "Outbound " + envelope.getType() + " " + envelope.getId() + " is " + check.getSize()
        + " bytes (max " + check.getMaxSize() + "); sending size error instead", "DataAgentSession", "Send", "Oversize");
      frame = sizeGuard.oversizeReplacement(envelope, check).encode();
    }
    LogUtil.logData(vertx, "Sending " + frame, "DataAgentSession", "Send", "Frame");
    return socket.writeTextMessage(frame);
  }

  /**
   * Send a locally initiated request and wait for the envelope that comes back on its id.
   */
  public Future<Envelope> request(Envelope envelope, long timeoutMs) {
    if (!isConnected()) {
      return Future.failedFuture(new IllegalStateException("WebSocket is not connected"));
    }
    Future<Envelope> reply = pending.register(envelope.getId(), timeoutMs);
    send(envelope).onFailure(err -> pending.fail(envelope.getId(), err));
    return reply;
  }

  /**
   * Ask the host for the catalog and install the answer as a catalog update would.
   */
  public Future<CatalogSnapshot> requestCatalog() {
    Envelope request = Envelope.outbound("component-list-" + System.currentTimeMillis(),
      MessageType.COMPONENT_LIST_REQ.getWireName(), new JsonObject());
    return request(request, config.getRequestTimeoutMs())
      .map(reply -> catalogUpdates.install(reply.getPayload()));
  }

  public JsonObject status() {
    CatalogSnapshot snapshot = catalog.current();
    return new JsonObject()
      .put("connected", isConnected())
      .put("reconnectAttempts", reconnectPolicy.getAttempts())
      .put("reconnectEnabled", reconnectPolicy.isEnabled())
      .put("pendingRequests", pending == null ? 0 : pending.size())
      .put("catalogVersion", snapshot.getVersion())
      .put("catalogSize", snapshot.size());
  }

  private void afterConnect() {
    if (config.isCatalogFetchOnConnect() && !catalogRequested) {
      catalogRequested = true;
      requestCatalog().onComplete(ar -> {
        if (ar.succeeded()) {
          LogUtil.logInfo(vertx, "Fetched catalog with " + ar.result().size() + " components", "DataAgentSession", "Catalog", "Fetch");
        } else {
          LogUtil.logError(vertx, "Catalog fetch failed", ar.cause(), "DataAgentSession", "Catalog", "Fetch");
        }
      });
    }
  }

  void onFrame(String frame) {
    Envelope envelope;
    try {
      envelope = Envelope.decode(frame);
    } catch (EnvelopeDecodeException e) {
      LogUtil.logError(vertx, "Dropping malformed frame: " + e.getMessage(), "DataAgentSession", "Receive", "Decode");
      return;
    }

    if (pending.complete(envelope)) {
      LogUtil.logDebug(vertx, "Reply received for " + envelope.getId(), "DataAgentSession", "Receive", "Correlated");
      return;
    }

    MessageType type = MessageType.fromWireName(envelope.getType());
    EnvelopeHandler handler = type == null ? null : handlers.get(type);
    if (handler == null) {
      LogUtil.logDetail(vertx, "Ignoring message type " + envelope.getType() + " (" + envelope.getId() + ")",
        "DataAgentSession", "Receive", "Unknown");
      return;
    }

    LogUtil.logDetail(vertx, "Received " + envelope.getType() + " " + envelope.getReplyId(), "DataAgentSession", "Receive", "Dispatch");
    Future<Envelope> response;
    try {
      response = handler.handle(envelope);
    } catch (RuntimeException e) {
      response = Future.failedFuture(e);
    }

    response
      .recover(err -> {
        LogUtil.logError(vertx, "Handler for " + envelope.getType() + " failed", err, "DataAgentSession", "Dispatch", "Error");
        String message = err.getMessage() == null ? "Unknown error" : err.getMessage();
        return Future.succeededFuture(envelope.reply(type.getResponseType(), new JsonObject().put("error", message)));
      })
      .compose(this::send)
      .onFailure(err -> LogUtil.logError(vertx, "Could not answer " + envelope.getType() + " " + envelope.getReplyId(), err,
        "DataAgentSession", "Send", "Error"));
  }

  private void onClosed(WebSocket closed) {
    if (closed != socket) {
      return;
    }
    int rejected = pending.rejectAll("WebSocket disconnected");
    LogUtil.logInfo(vertx, "Connection closed" + (rejected > 0 ? "; rejected " + rejected + " pending requests" : ""),
      "DataAgentSession", "Connection", "Closed");
    scheduleReconnect();
  }

  private void scheduleReconnect() {
    if (!reconnectPolicy.isEnabled()) {
      return;
    }
    if (!reconnectPolicy.nextAttempt()) {
      LogUtil.logError(vertx, "Giving up after " + reconnectPolicy.getMaxAttempts() + " reconnect attempts",
        "DataAgentSession", "Connection", "Exhausted");
      vertx.eventBus().publish(RECONNECT_EXHAUSTED_ADDRESS, new JsonObject()
        .put("attempts", reconnectPolicy.getAttempts())
        .put("url", config.getWebsocketUrl()));
      return;
    }

    LogUtil.logInfo(vertx, "Reconnecting in " + reconnectPolicy.getDelayMs() + "ms (attempt "
      + reconnectPolicy.getAttempts() + "/" + reconnectPolicy.getMaxAttempts() + ")", "DataAgentSession", "Connection", "Reconnect");
    reconnectTimerId = vertx.setTimer(reconnectPolicy.getDelayMs(), id -> {
      reconnectTimerId = -1;
      if (reconnectPolicy.isEnabled()) {
        connect().onFailure(err -> scheduleReconnect());
      }
    });
  }

  /**
   * Host URL with the agent's identity as query parameters.
   */
  static String connectionUrl(AgentConfig config) {
    String base = config.getWebsocketUrl();
    return base + (base.contains("?") ? "&" : "?")
      + "userId=" + encode(config.getUserId())
      + "&projectId=" + encode(config.getProjectId())
      + "&type=" + encode(config.getAgentType());
  }

  static WebSocketConnectOptions connectOptions(String url) {
    URI uri = URI.create(url);
    String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase();
    if (!scheme.equals("ws") && !scheme.equals("wss")) {
      throw new IllegalArgumentException("WebSocket URL must start with ws:// or wss://: " + url);
    }
    boolean ssl = scheme.equals("wss");
    String path = uri.getRawPath() == null || uri.getRawPath().isEmpty() ? "/" : uri.getRawPath();

    WebSocketConnectOptions options = new WebSocketConnectOptions();
    options.setHost(uri.getHost());
    options.setPort(uri.getPort() > 0 ? uri.getPort() : (ssl ? 443 : 80));
    options.setSsl(ssl);
    options.setURI(uri.getRawQuery() == null ? path : path + "?" + uri.getRawQuery());
    return options;
  }

  private static String encode(String value) {
    return URLEncoder.encode(value == null ? "" : value, StandardCharsets.UTF_8);
  }
}
