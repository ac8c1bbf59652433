package agents.dataagent.session;

import agents.dataagent.catalog.CatalogHolder;
import agents.dataagent.config.AgentConfig;
import agents.dataagent.db.QueryExecutor;
import agents.dataagent.db.QueryResult;
import agents.dataagent.protocol.Envelope;
import agents.dataagent.protocol.MessageType;
import agents.dataagent.session.handlers.CatalogUpdateHandler;
import agents.dataagent.session.handlers.DataRequestHandler;
import agents.dataagent.session.handlers.EnvelopeHandler;
import io.vertx.core.Future;
import io.vertx.core.Handler;
import io.vertx.core.Vertx;
import io.vertx.core.http.HttpServer;
import io.vertx.core.http.ServerWebSocket;
import io.vertx.core.http.WebSocketConnectOptions;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import io.vertx.junit5.Checkpoint;
import io.vertx.junit5.VertxExtension;
import io.vertx.junit5.VertxTestContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs the session against a loopback host.
 */
@ExtendWith(VertxExtension.class)
class DataAgentSessionTest {

  private CatalogHolder catalog;
  private QueryExecutor executor;

  @BeforeEach
  void setUp() {
    catalog = new CatalogHolder();
    executor = sql -> Future.succeededFuture(QueryResult.success(new JsonArray().add(new JsonObject().put("sql", sql))));
  }

  private static Future<HttpServer> startHost(Vertx vertx, Handler<ServerWebSocket> handler) {
    return vertx.createHttpServer().webSocketHandler(handler).listen(0, "localhost");
  }

  /**
   * Write frames once the agent side has finished its handshake bookkeeping.
   */
  private static void sendLater(Vertx vertx, ServerWebSocket ws, String... frames) {
    vertx.setTimer(100, t -> {
      for (String frame : frames) {
        ws.writeTextMessage(frame);
      }
    });
  }

  private static AgentConfig.Builder config(HttpServer host) {
    return AgentConfig.builder()
      .websocketUrl("ws://localhost:" + host.actualPort() + "/ws")
      .userId("u1")
      .projectId("p1")
      .matchingMethod(AgentConfig.MatchingMethod.LLM)
      .reconnectIntervalMs(50)
      .maxReconnectAttempts(1);
  }

  private DataAgentSession session(Vertx vertx, AgentConfig config) {
    Map<MessageType, EnvelopeHandler> handlers = new EnumMap<>(MessageType.class);
    handlers.put(MessageType.DATA_REQ, new DataRequestHandler(vertx, executor, MessageType.DATA_REQ));
    return new DataAgentSession(config, catalog, new CatalogUpdateHandler(vertx, catalog, null, config), handlers);
  }

  private static String dataRequest(String id, Object query) {
    return new JsonObject()
      .put("id", id)
      .put("type", "data_req")
      .put("from", new JsonObject().put("type", "runtime").put("id", "rt-1"))
      .put("to", new JsonObject().put("type", "data_agent"))
      .put("payload", new JsonObject().put("query", query))
      .encode();
  }

  @Test
  void testRequestIsAnsweredOnSameId(Vertx vertx, VertxTestContext testContext) {
    AtomicReference<String> handshakeQuery = new AtomicReference<>();

    startHost(vertx, ws -> {
      handshakeQuery.set(ws.query());
      ws.textMessageHandler(frame -> testContext.verify(() -> {
        JsonObject response = new JsonObject(frame);
        assertEquals("r1", response.getString("id"));
        assertEquals("data_res", response.getString("type"));
        assertEquals("data_agent", response.getJsonObject("from").getString("type"));
        assertEquals("rt-1", response.getJsonObject("to").getString("id"));
        assertEquals("SELECT 1", response.getJsonArray("payload").getJsonObject(0).getString("sql"));
        assertEquals("userId=u1&projectId=p1&type=data-agent", handshakeQuery.get());
        testContext.completeNow();
      }));
      sendLater(vertx, ws, dataRequest("r1", "SELECT 1"));
    }).compose(host -> vertx.deployVerticle(session(vertx, config(host).build())))
      .onFailure(testContext::failNow);
  }

  @Test
  void testMalformedFramesAreDropped(Vertx vertx, VertxTestContext testContext) {
    Checkpoint answered = testContext.checkpoint();

    startHost(vertx, ws -> {
      ws.textMessageHandler(frame -> testContext.verify(() -> {
        // only the well-formed request is answered
        assertEquals("r2", new JsonObject(frame).getString("id"));
        answered.flag();
      }));
      sendLater(vertx, ws, "not json", "{\"id\":\"r0\"}", "{\"id\":\"rx\",\"type\":\"unheard_of\"}",
        dataRequest("r2", "SELECT 2"));
    }).compose(host -> vertx.deployVerticle(session(vertx, config(host).build())))
      .onFailure(testContext::failNow);
  }

  @Test
  void testInvalidQueryGetsErrorPayload(Vertx vertx, VertxTestContext testContext) {
    startHost(vertx, ws -> {
      ws.textMessageHandler(frame -> testContext.verify(() -> {
        assertEquals("Invalid query", new JsonObject(frame).getJsonObject("payload").getString("error"));
        testContext.completeNow();
      }));
      sendLater(vertx, ws, dataRequest("r3", 42));
    }).compose(host -> vertx.deployVerticle(session(vertx, config(host).build())))
      .onFailure(testContext::failNow);
  }

  @Test
  void testFailingHandlerIsAnsweredWithError(Vertx vertx, VertxTestContext testContext) {
    executor = sql -> Future.failedFuture(new IllegalStateException("pool exhausted"));

    startHost(vertx, ws -> {
      ws.textMessageHandler(frame -> testContext.verify(() -> {
        JsonObject response = new JsonObject(frame);
        assertEquals("r4", response.getString("id"));
        assertEquals("data_res", response.getString("type"));
        assertEquals("pool exhausted", response.getJsonObject("payload").getString("error"));
        testContext.completeNow();
      }));
      sendLater(vertx, ws, dataRequest("r4", "SELECT 4"));
    }).compose(host -> vertx.deployVerticle(session(vertx, config(host).build())))
      .onFailure(testContext::failNow);
  }

  @Test
  void testOversizeResponseIsReplaced(Vertx vertx, VertxTestContext testContext) {
    StringBuilder wide = new StringBuilder();
    for (int i = 0; i < 500; i++) {
      wide.append("x");
    }
    executor = sql -> Future.succeededFuture(QueryResult.success(new JsonArray().add(new JsonObject().put("v", wide.toString()))));

    startHost(vertx, ws -> {
      ws.textMessageHandler(frame -> testContext.verify(() -> {
        JsonObject response = new JsonObject(frame);
        assertEquals("r5", response.getString("id"));
        assertEquals("data_res", response.getString("type"));
        JsonObject payload = response.getJsonObject("payload");
        assertTrue(payload.getString("error").contains("exceeds maximum allowed message size (300 bytes)"));
        assertEquals(300, payload.getInteger("maxSize"));
        testContext.completeNow();
      }));
      sendLater(vertx, ws, dataRequest("r5", "SELECT v FROM wide"));
    }).compose(host -> vertx.deployVerticle(session(vertx, config(host).maxMessageSize(300).build())))
      .onFailure(testContext::failNow);
  }

  @Test
  void testCatalogIsFetchedOnConnect(Vertx vertx, VertxTestContext testContext) {
    startHost(vertx, ws -> ws.textMessageHandler(frame -> {
      JsonObject message = new JsonObject(frame);
      if ("component_list_req".equals(message.getString("type"))) {
        ws.writeTextMessage(new JsonObject()
          .put("id", message.getString("id"))
          .put("type", "component_list_res")
          .put("payload", new JsonObject().put("components", new JsonArray()
            .add(new JsonObject().put("id", "a").put("name", "A").put("type", "data-table"))
            .add(new JsonObject().put("id", "b").put("name", "B").put("type", "KPICard"))))
          .encode());
        // frames are handled in order, so the catalog is installed before this is answered
        ws.writeTextMessage(dataRequest("after-catalog", "SELECT 1"));
      } else {
        testContext.verify(() -> {
          assertEquals("after-catalog", message.getString("id"));
          assertEquals(2, catalog.current().size());
          assertEquals(1L, catalog.current().getVersion());
          testContext.completeNow();
        });
      }
    })).compose(host -> vertx.deployVerticle(session(vertx, config(host).catalogFetchOnConnect(true).build())))
      .onFailure(testContext::failNow);
  }

  @Test
  void testCatalogUpdateIsAcknowledged(Vertx vertx, VertxTestContext testContext) {
    startHost(vertx, ws -> {
      ws.textMessageHandler(frame -> testContext.verify(() -> {
        JsonObject response = new JsonObject(frame);
        assertEquals("u-1", response.getString("id"));
        assertEquals("component_list_update_res", response.getString("type"));
        assertTrue(response.getJsonObject("payload").getBoolean("success"));
        assertEquals(1, response.getJsonObject("payload").getInteger("count"));
        assertEquals("orders", catalog.current().findById("orders").getName());
        testContext.completeNow();
      }));
      sendLater(vertx, ws, new JsonObject()
        .put("id", "u-1")
        .put("type", "component_list_update")
        .put("from", "admin")
        .put("payload", new JsonArray().add(new JsonObject().put("id", "orders").put("name", "orders").put("type", "tabular")))
        .encode());
    }).compose(host -> vertx.deployVerticle(session(vertx, config(host).build())))
      .onFailure(testContext::failNow);
  }

  @Test
  void testStatusIsServedOnEventBus(Vertx vertx, VertxTestContext testContext) {
    startHost(vertx, ws -> { })
      .compose(host -> vertx.deployVerticle(session(vertx, config(host).build())))
      .compose(id -> vertx.eventBus().<JsonObject>request(DataAgentSession.STATUS_ADDRESS, null))
      .onComplete(testContext.succeeding(reply -> testContext.verify(() -> {
        JsonObject status = reply.body();
        assertTrue(status.getBoolean("connected"));
        assertTrue(status.getBoolean("reconnectEnabled"));
        assertEquals(0, status.getInteger("reconnectAttempts"));
        assertEquals(0, status.getInteger("pendingRequests"));
        assertEquals(0L, status.getLong("catalogVersion"));
        testContext.completeNow();
      })));
  }

  @Test
  void testReconnectExhaustionIsPublished(Vertx vertx, VertxTestContext testContext) {
    AtomicReference<ServerWebSocket> hostSide = new AtomicReference<>();

    vertx.eventBus().<JsonObject>consumer(DataAgentSession.RECONNECT_EXHAUSTED_ADDRESS, message -> testContext.verify(() -> {
      assertEquals(1, message.body().getInteger("attempts"));
      testContext.completeNow();
    }));

    startHost(vertx, hostSide::set)
      .compose(host -> vertx.deployVerticle(session(vertx, config(host).build()))
        // take the host down, then drop the open connection
        .compose(id -> host.close())
        .onComplete(ar -> {
          ServerWebSocket ws = hostSide.get();
          if (ws != null && !ws.isClosed()) {
            ws.close();
          }
        }))
      .onFailure(testContext::failNow);
  }

  @Test
  void testShutdownFromOutsideThreadRejectsPendingRequests(Vertx vertx, VertxTestContext testContext) {
    Checkpoint rejected = testContext.checkpoint();
    Checkpoint stopped = testContext.checkpoint();

    startHost(vertx, ws -> { }).onComplete(testContext.succeeding(host -> {
      DataAgentSession session = session(vertx, config(host).build());
      vertx.deployVerticle(session).onComplete(testContext.succeeding(id -> {
        session.request(Envelope.outbound("never-answered", MessageType.COMPONENT_LIST_REQ.getWireName(), new JsonObject()), 60_000)
          .onComplete(testContext.failing(err -> testContext.verify(() -> {
            assertEquals("WebSocket disconnected", err.getMessage());
            rejected.flag();
          })));

        new Thread(() -> session.shutdown().onComplete(testContext.succeeding(v -> testContext.verify(() -> {
          JsonObject status = session.status();
          assertFalse(status.getBoolean("reconnectEnabled"));
          stopped.flag();
        })))).start();
      }));
    }));
  }

  @Test
  void testStartFailsWhenHostIsUnreachable(Vertx vertx, VertxTestContext testContext) {
    startHost(vertx, ws -> { })
      .compose(host -> {
        AgentConfig config = config(host).build();
        return host.close().compose(v -> vertx.deployVerticle(session(vertx, config)));
      })
      .onComplete(testContext.failing(err -> testContext.completeNow()));
  }

  @Test
  void testConnectionUrlAndOptions() {
    AgentConfig config = AgentConfig.builder()
      .websocketUrl("wss://host.example.com/agents?region=eu")
      .userId("user 1")
      .projectId("p&1")
      .build();

    String url = DataAgentSession.connectionUrl(config);
    assertEquals("wss://host.example.com/agents?region=eu&userId=user+1&projectId=p%261&type=data-agent", url);

    WebSocketConnectOptions options = DataAgentSession.connectOptions(url);
    assertEquals("host.example.com", options.getHost());
    assertEquals(443, options.getPort());
    assertTrue(options.isSsl());
    assertEquals("/agents?region=eu&userId=user+1&projectId=p%261&type=data-agent", options.getURI());

    assertThrows(IllegalArgumentException.class, () -> DataAgentSession.connectOptions("http://host/ws"));
  }
}
