package agents.dataagent.intent.strategy;

import agents.dataagent.catalog.CatalogHolder;
import agents.dataagent.catalog.CatalogSnapshot;
import agents.dataagent.intent.ResolutionMethod;
import agents.dataagent.intent.ScriptedCompletion;
import io.vertx.core.Vertx;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import io.vertx.junit5.VertxExtension;
import io.vertx.junit5.VertxTestContext;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import static org.junit.jupiter.api.Assertions.*;

@ExtendWith(VertxExtension.class)
class LlmRankingStrategyTest {

  private static final CatalogSnapshot CATALOG = new CatalogHolder().replace(CatalogSnapshot.parsePayload(new JsonArray()
    .add(new JsonObject().put("id", "revenue-kpi").put("name", "RevenueCard").put("type", "KPICard")
      .put("description", "Total revenue").put("keywords", new JsonArray().add("revenue").add("sales")))
    .add(new JsonObject().put("id", "orders-table").put("name", "OrdersTable").put("type", "data-table")
      .put("description", "All orders"))));

  private static ResolutionContext context(CatalogSnapshot catalog) {
    return new ResolutionContext(catalog, "p_components", 5, null);
  }

  @Test
  void testIdWinsOverIndex() {
    LlmRankingStrategy strategy = new LlmRankingStrategy(null, new ScriptedCompletion());

    MatchOutcome outcome = strategy.select(new JsonObject()
      .put("componentId", "orders-table").put("componentIndex", 1).put("confidence", 85).put("reasoning", "list"), CATALOG);

    assertTrue(outcome.isMatch());
    assertEquals("orders-table", outcome.getResult().getArtifact().getId());
    assertEquals(ResolutionMethod.LLM_RANKING, outcome.getResult().getMethod());
    assertEquals(85, outcome.getResult().getConfidence());
  }

  @Test
  void testIndexIsUsedWhenIdIsUnknown() {
    LlmRankingStrategy strategy = new LlmRankingStrategy(null, new ScriptedCompletion());

    MatchOutcome outcome = strategy.select(new JsonObject()
      .put("componentId", "nope").put("componentIndex", "1").put("confidence", "72.4"), CATALOG);

    assertEquals("revenue-kpi", outcome.getResult().getArtifact().getId());
    assertEquals("No reasoning provided", outcome.getResult().getReasoning());
  }

  @Test
  void testConfidenceThreshold() {
    LlmRankingStrategy strategy = new LlmRankingStrategy(null, new ScriptedCompletion());

    assertFalse(strategy.select(new JsonObject().put("componentIndex", 1).put("confidence", 29), CATALOG).isMatch());
    assertTrue(strategy.select(new JsonObject().put("componentIndex", 1).put("confidence", 30), CATALOG).isMatch());
    assertFalse(strategy.select(new JsonObject().put("componentIndex", 7).put("confidence", 99), CATALOG).isMatch());
  }

  @Test
  void testListingNumbersFromOne() {
    String listing = LlmRankingStrategy.listing(CATALOG.getArtifacts());

    assertTrue(listing.startsWith("1. ID: revenue-kpi"));
    assertTrue(listing.contains("2. ID: orders-table"));
    assertTrue(listing.contains("Keywords: revenue, sales"));
  }

  @Test
  void testEmptyCatalogIsNoMatchWithoutBackendCall(Vertx vertx, VertxTestContext testContext) {
    ScriptedCompletion completion = new ScriptedCompletion();
    new LlmRankingStrategy(vertx, completion).resolve("show orders", context(CatalogSnapshot.EMPTY))
      .onComplete(testContext.succeeding(outcome -> testContext.verify(() -> {
        assertFalse(outcome.isMatch());
        assertTrue(completion.getSystemPrompts().isEmpty());
        testContext.completeNow();
      })));
  }

  @Test
  void testBackendFailureIsNoMatch(Vertx vertx, VertxTestContext testContext) {
    ScriptedCompletion completion = new ScriptedCompletion().fail(ScriptedCompletion.RANK);
    new LlmRankingStrategy(vertx, completion).resolve("show orders", context(CATALOG))
      .onComplete(testContext.succeeding(outcome -> testContext.verify(() -> {
        assertFalse(outcome.isMatch());
        assertTrue(outcome.getReason().startsWith("Catalog ranking unavailable"));
        testContext.completeNow();
      })));
  }
}
