package agents.dataagent.session.handlers;

import agents.dataagent.candidates.CandidateStoreSync;
import agents.dataagent.candidates.InMemoryCandidateStore;
import agents.dataagent.candidates.KeywordEmbeddings;
import agents.dataagent.catalog.CatalogHolder;
import agents.dataagent.config.AgentConfig;
import agents.dataagent.db.QueryResult;
import agents.dataagent.intent.IntentResolver;
import agents.dataagent.protocol.EndpointRole;
import agents.dataagent.protocol.Envelope;
import agents.dataagent.protocol.EnvelopeDecodeException;
import agents.dataagent.protocol.MessageType;
import agents.dataagent.schema.SchemaDescriptor;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import io.vertx.junit5.VertxExtension;
import io.vertx.junit5.VertxTestContext;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

@ExtendWith(VertxExtension.class)
class HandlersTest {

  private static Envelope request(String type, JsonObject payload) throws EnvelopeDecodeException {
    return Envelope.fromJson(new JsonObject()
      .put("id", "req-1")
      .put("type", type)
      .put("from", new JsonObject().put("type", "admin").put("id", "admin-9"))
      .put("to", new JsonObject().put("type", "data_agent"))
      .put("payload", payload));
  }

  @Test
  void testWarehouseRequestIsAnsweredWithWarehouseType(Vertx vertx, VertxTestContext testContext) throws Exception {
    AtomicReference<String> executed = new AtomicReference<>();
    DataRequestHandler handler = new DataRequestHandler(vertx, sql -> {
      executed.set(sql);
      return Future.succeededFuture(QueryResult.failure("warehouse offline"));
    }, MessageType.WAREHOUSE_DATA_REQ);

    handler.handle(request("warehouse_data_req", new JsonObject().put("query", "SELECT * FROM big_table")))
      .onComplete(testContext.succeeding(reply -> testContext.verify(() -> {
        assertEquals("warehouse_data_res", reply.getType());
        assertEquals("req-1", reply.getId());
        assertEquals("warehouse offline", ((JsonObject) reply.getPayload()).getString("error"));
        // raw data requests run exactly as sent
        assertEquals("SELECT * FROM big_table", executed.get());
        testContext.completeNow();
      })));
  }

  @Test
  void testBlankQueryIsInvalid(Vertx vertx, VertxTestContext testContext) throws Exception {
    DataRequestHandler handler = new DataRequestHandler(vertx,
      sql -> Future.failedFuture("must not run"), MessageType.DATA_REQ);

    handler.handle(request("data_req", new JsonObject().put("query", "  ")))
      .onComplete(testContext.succeeding(reply -> testContext.verify(() -> {
        assertEquals(new JsonObject().put("error", "Invalid query"), reply.getPayload());
        testContext.completeNow();
      })));
  }

  @Test
  void testPromptErrorsGoToRuntime(Vertx vertx, VertxTestContext testContext) throws Exception {
    AgentConfig config = AgentConfig.builder().websocketUrl("ws://h/ws").matchingMethod(AgentConfig.MatchingMethod.LLM).build();
    IntentResolver resolver = IntentResolver.create(vertx, config, new CatalogHolder(),
      (system, user, temperature, maxTokens) -> Future.failedFuture("unused"),
      new SchemaDescriptor(new JsonObject()), null, null);

    new PromptRequestHandler(resolver).handle(request("user_prompt_req", new JsonObject()))
      .onComplete(testContext.succeeding(reply -> testContext.verify(() -> {
        assertEquals("user_prompt_res", reply.getType());
        assertEquals(EndpointRole.RUNTIME, reply.getTo().getRole());
        assertEquals("admin-9", reply.getTo().getId());
        assertEquals(EndpointRole.DATA_AGENT, reply.getFrom().getRole());
        assertEquals("Prompt cannot be empty", ((JsonObject) reply.getPayload()).getString("error"));
        testContext.completeNow();
      })));
  }

  @Test
  void testCatalogUpdateStartsCandidateSync(Vertx vertx, VertxTestContext testContext) throws Exception {
    AgentConfig config = AgentConfig.builder().websocketUrl("ws://h/ws").projectId("acme").build();
    InMemoryCandidateStore store = new InMemoryCandidateStore();
    CatalogHolder catalog = new CatalogHolder();
    CatalogUpdateHandler handler = new CatalogUpdateHandler(vertx, catalog,
      new CandidateStoreSync(vertx, store, new KeywordEmbeddings("orders")), config);

    handler.handle(request("component_list_update", new JsonObject().put("components", new JsonArray()
        .add(new JsonObject().put("id", "orders").put("name", "Orders").put("type", "tabular"))
        .add("not a component"))))
      .onComplete(testContext.succeeding(reply -> testContext.verify(() -> {
        JsonObject payload = (JsonObject) reply.getPayload();
        assertTrue(payload.getBoolean("success"));
        assertEquals(1, payload.getInteger("count"));
        assertEquals(1L, payload.getLong("version"));
        assertEquals(1, catalog.current().size());
        vertx.setTimer(100, t -> store.count("acme_components").onComplete(testContext.succeeding(count -> testContext.verify(() -> {
          assertEquals(1, count);
          testContext.completeNow();
        }))));
      })));
  }

  @Test
  void testMalformedCatalogUpdateFails(Vertx vertx, VertxTestContext testContext) throws Exception {
    AgentConfig config = AgentConfig.builder().websocketUrl("ws://h/ws").build();
    CatalogHolder catalog = new CatalogHolder();

    new CatalogUpdateHandler(vertx, catalog, null, config).handle(request("component_list_update", new JsonObject()))
      .onComplete(testContext.failing(err -> testContext.verify(() -> {
        assertTrue(err instanceof IllegalArgumentException);
        assertEquals(0L, catalog.current().getVersion());
        testContext.completeNow();
      })));
  }
}
