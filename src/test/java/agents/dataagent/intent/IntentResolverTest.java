package agents.dataagent.intent;

import agents.dataagent.catalog.Artifact;
import agents.dataagent.catalog.ArtifactConfig;
import agents.dataagent.catalog.CatalogHolder;
import agents.dataagent.catalog.CatalogSnapshot;
import agents.dataagent.catalog.VisualizationType;
import agents.dataagent.config.AgentConfig;
import agents.dataagent.schema.SchemaDescriptor;
import io.vertx.core.Vertx;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import io.vertx.junit5.VertxExtension;
import io.vertx.junit5.VertxTestContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@ExtendWith(VertxExtension.class)
class IntentResolverTest {

  private static final SchemaDescriptor SCHEMA = SchemaDescriptor.fromClasspath(SchemaDescriptor.DEFAULT_RESOURCE);

  private CatalogHolder catalog;
  private ScriptedCompletion completion;

  @BeforeEach
  void setUp() {
    catalog = new CatalogHolder();
    catalog.replace(CatalogSnapshot.parsePayload(new JsonArray()
      .add(new JsonObject().put("id", "orders-table").put("name", "OrdersTable").put("type", "data-table")
        .put("description", "All orders")
        .put("props", new JsonObject().put("query", "SELECT * FROM orders LIMIT 50").put("title", "Orders")))
      .add(new JsonObject().put("id", "create-order").put("name", "CreateOrderForm").put("type", "form")
        .put("description", "Add a new order"))));
    completion = new ScriptedCompletion();
  }

  private IntentResolver resolver(Vertx vertx, AgentConfig.ResolutionMode mode) {
    AgentConfig config = AgentConfig.builder()
      .websocketUrl("ws://localhost:9000/ws")
      .projectId("p")
      .matchingMethod(AgentConfig.MatchingMethod.LLM)
      .resolutionMode(mode)
      .build();
    return IntentResolver.create(vertx, config, catalog, completion, SCHEMA, null, null);
  }

  private static JsonObject classification(String type, boolean needsMultiple, String... visualizations) {
    JsonArray tags = new JsonArray();
    for (String tag : visualizations) {
      tags.add(tag);
    }
    return new JsonObject().put("questionType", type).put("visualizations", tags)
      .put("needsMultiple", needsMultiple).put("reasoning", "");
  }

  @Test
  void testSingleMetricPromptIsGeneratedWithLimit(Vertx vertx, VertxTestContext testContext) {
    completion
      .reply(ScriptedCompletion.CLASSIFY, classification("analytical", false, "single-metric"))
      .reply(ScriptedCompletion.SYNTHESIZE_ONE, new JsonObject()
        .put("componentType", "single-metric")
        .put("query", "SELECT SUM(revenue_generated) AS value FROM supply_chain_data")
        .put("title", "Total Revenue")
        .put("canGenerate", true));

    resolver(vertx, AgentConfig.ResolutionMode.CLASSIFY).resolve("Show me total revenue")
      .onComplete(testContext.succeeding(result -> testContext.verify(() -> {
        assertEquals(ResolutionMethod.GENERATED, result.getMethod());
        Artifact artifact = result.getArtifact();
        assertEquals(VisualizationType.SINGLE_METRIC, artifact.getVisualizationType());
        assertTrue(artifact.getProps().getQuery().endsWith(" LIMIT 50"));
        assertEquals(QuestionType.ANALYTICAL, result.getClassification().getQuestionType());

        JsonObject payload = result.toPayload();
        assertEquals("generated", payload.getString("method"));
        assertEquals("single-metric", payload.getJsonObject("classification").getJsonArray("visualizations").getString(0));
        assertEquals(0, completion.calls(ScriptedCompletion.RANK));
        testContext.completeNow();
      })));
  }

  @Test
  void testMultiViewPromptYieldsContainer(Vertx vertx, VertxTestContext testContext) {
    completion
      .reply(ScriptedCompletion.CLASSIFY, classification("analytical", true, "single-metric", "tabular"))
      .reply(ScriptedCompletion.SYNTHESIZE_MANY, new JsonObject()
        .put("canGenerate", true)
        .put("containerTitle", "Orders overview")
        .put("components", new JsonArray()
          .add(new JsonObject().put("componentType", "single-metric").put("query", "SELECT COUNT(*) AS value FROM orders"))
          .add(new JsonObject().put("componentType", "tabular").put("query", "SELECT * FROM orders"))));

    resolver(vertx, AgentConfig.ResolutionMode.CLASSIFY).resolve("Show total orders and list them")
      .onComplete(testContext.succeeding(result -> testContext.verify(() -> {
        assertEquals(ResolutionMethod.GENERATED_MULTI, result.getMethod());
        assertTrue(result.getArtifact().isContainer());
        List<Artifact> children = ((ArtifactConfig.ContainerConfig) result.getArtifact().getProps().getConfig()).getComponents();
        assertEquals(2, children.size());
        assertEquals(VisualizationType.SINGLE_METRIC, children.get(0).getVisualizationType());
        assertEquals(VisualizationType.TABULAR, children.get(1).getVisualizationType());
        for (Artifact child : children) {
          assertTrue(child.getProps().getQuery().endsWith(" LIMIT 50"));
        }
        testContext.completeNow();
      })));
  }

  @Test
  void testGeneralQuestionHasNoArtifact(Vertx vertx, VertxTestContext testContext) {
    completion.reply(ScriptedCompletion.CLASSIFY, classification("general", false));

    resolver(vertx, AgentConfig.ResolutionMode.CLASSIFY).resolve("hello, what can you do?")
      .onComplete(testContext.succeeding(result -> testContext.verify(() -> {
        assertEquals(ResolutionMethod.CLASSIFICATION_GENERAL, result.getMethod());
        assertFalse(result.hasArtifact());
        assertEquals("General question; no visualization needed", result.getReasoning());
        assertNull(result.toPayload().getValue("component"));
        assertEquals(1, completion.getSystemPrompts().size());
        testContext.completeNow();
      })));
  }

  @Test
  void testDataModificationRanksCatalogWithoutSynthesis(Vertx vertx, VertxTestContext testContext) {
    completion
      .reply(ScriptedCompletion.CLASSIFY, classification("data_modification", false))
      .reply(ScriptedCompletion.RANK, new JsonObject()
        .put("componentId", "create-order").put("confidence", 90).put("reasoning", "creation form"));

    resolver(vertx, AgentConfig.ResolutionMode.CLASSIFY).resolve("add a new order")
      .onComplete(testContext.succeeding(result -> testContext.verify(() -> {
        assertEquals(ResolutionMethod.LLM_RANKING, result.getMethod());
        assertEquals("create-order", result.getArtifact().getId());
        assertEquals(QuestionType.DATA_MODIFICATION, result.getClassification().getQuestionType());
        assertFalse(result.isQueryModified());
        assertEquals(0, completion.calls(ScriptedCompletion.VALIDATE_PROPS));
        testContext.completeNow();
      })));
  }

  @Test
  void testUnmatchedDataModificationIsNotSynthesized(Vertx vertx, VertxTestContext testContext) {
    completion
      .reply(ScriptedCompletion.CLASSIFY, classification("data_modification", false))
      .reply(ScriptedCompletion.RANK, new JsonObject().put("componentIndex", 1).put("confidence", 10));

    resolver(vertx, AgentConfig.ResolutionMode.CLASSIFY).resolve("delete the warehouse")
      .onComplete(testContext.succeeding(result -> testContext.verify(() -> {
        assertEquals(ResolutionMethod.NONE, result.getMethod());
        assertFalse(result.hasArtifact());
        assertEquals(0, completion.calls(ScriptedCompletion.SYNTHESIZE_ONE));
        testContext.completeNow();
      })));
  }

  @Test
  void testMatchModeAdaptsCatalogQuery(Vertx vertx, VertxTestContext testContext) {
    completion
      .reply(ScriptedCompletion.RANK, new JsonObject()
        .put("componentId", "orders-table").put("confidence", 80).put("reasoning", "orders list"))
      .reply(ScriptedCompletion.VALIDATE_PROPS, new JsonObject()
        .put("props", new JsonObject().put("query", "SELECT * FROM orders WHERE status = 'late'").put("title", "Late orders"))
        .put("isModified", true)
        .put("reasoning", "filtered to late orders")
        .put("modifications", new JsonArray().add("added status filter")));

    resolver(vertx, AgentConfig.ResolutionMode.MATCH).resolve("show late orders")
      .onComplete(testContext.succeeding(result -> testContext.verify(() -> {
        assertEquals(ResolutionMethod.LLM_RANKING, result.getMethod());
        assertEquals("orders-table", result.getArtifact().getId());
        assertEquals("SELECT * FROM orders WHERE status = 'late' LIMIT 50", result.getArtifact().getProps().getQuery());
        assertTrue(result.isQueryModified());
        assertTrue(result.isPropsModified());
        assertEquals("filtered to late orders", result.getQueryReasoning());
        assertNull(result.getClassification());
        assertEquals(0, completion.calls(ScriptedCompletion.CLASSIFY));
        // the catalog itself is untouched
        assertEquals("SELECT * FROM orders LIMIT 50",
          catalog.current().findById("orders-table").getProps().getQuery());
        testContext.completeNow();
      })));
  }

  @Test
  void testFailedPropsValidationStillLimitsCatalogQuery(Vertx vertx, VertxTestContext testContext) {
    catalog.replace(CatalogSnapshot.parsePayload(new JsonArray()
      .add(new JsonObject().put("id", "all-orders").put("name", "AllOrders").put("type", "data-table")
        .put("description", "Every order")
        .put("props", new JsonObject().put("query", "SELECT * FROM orders").put("title", "Orders")))));
    completion
      .reply(ScriptedCompletion.RANK, new JsonObject()
        .put("componentId", "all-orders").put("confidence", 90).put("reasoning", "orders list"))
      .fail(ScriptedCompletion.VALIDATE_PROPS);

    resolver(vertx, AgentConfig.ResolutionMode.MATCH).resolve("show all orders")
      .onComplete(testContext.succeeding(result -> testContext.verify(() -> {
        assertEquals(ResolutionMethod.LLM_RANKING, result.getMethod());
        assertEquals("SELECT * FROM orders LIMIT 50", result.getArtifact().getProps().getQuery());
        assertEquals("Orders", result.getArtifact().getProps().getTitle());
        assertFalse(result.isPropsModified());
        assertTrue(result.getPropsModifications().isEmpty());
        assertEquals(1, completion.calls(ScriptedCompletion.VALIDATE_PROPS));
        testContext.completeNow();
      })));
  }

  @Test
  void testMatchModeFallsBackToSynthesis(Vertx vertx, VertxTestContext testContext) {
    completion
      .reply(ScriptedCompletion.RANK, new JsonObject().put("componentIndex", null).put("confidence", 5))
      .reply(ScriptedCompletion.SYNTHESIZE_ONE, new JsonObject()
        .put("componentType", "time-series")
        .put("query", "SELECT date, SUM(revenue) AS revenue FROM orders GROUP BY date")
        .put("canGenerate", true));

    resolver(vertx, AgentConfig.ResolutionMode.MATCH).resolve("revenue trend")
      .onComplete(testContext.succeeding(result -> testContext.verify(() -> {
        assertEquals(ResolutionMethod.LLM_GENERATED, result.getMethod());
        assertEquals(Artifact.DYNAMIC_CATEGORY, result.getArtifact().getCategory());
        assertEquals(0, completion.calls(ScriptedCompletion.VALIDATE_PROPS));
        testContext.completeNow();
      })));
  }

  @Test
  void testBlankPromptIsRejected(Vertx vertx, VertxTestContext testContext) {
    resolver(vertx, AgentConfig.ResolutionMode.CLASSIFY).resolve("   ")
      .onComplete(testContext.failing(err -> testContext.verify(() -> {
        assertTrue(err instanceof IllegalArgumentException);
        assertEquals("Prompt cannot be empty", err.getMessage());
        assertTrue(completion.getSystemPrompts().isEmpty());
        testContext.completeNow();
      })));
  }
}
