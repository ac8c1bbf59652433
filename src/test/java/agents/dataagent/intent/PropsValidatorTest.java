package agents.dataagent.intent;

import agents.dataagent.catalog.Artifact;
import agents.dataagent.schema.SchemaDescriptor;
import io.vertx.core.Vertx;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import io.vertx.junit5.VertxExtension;
import io.vertx.junit5.VertxTestContext;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import static org.junit.jupiter.api.Assertions.*;

@ExtendWith(VertxExtension.class)
class PropsValidatorTest {

  private static final Artifact ORDERS_TABLE = Artifact.fromJson(new JsonObject()
    .put("id", "orders-table").put("name", "OrdersTable").put("type", "data-table")
    .put("description", "All orders")
    .put("props", new JsonObject()
      .put("query", "SELECT * FROM orders LIMIT 50")
      .put("title", "Orders")
      .put("config", new JsonObject().put("pageSize", 10))));

  private static PropsValidator validator(Vertx vertx, ScriptedCompletion completion) {
    return new PropsValidator(vertx, completion, new SchemaDescriptor(new JsonObject()), 50);
  }

  @Test
  void testModifiedQueryIsLimited(Vertx vertx, VertxTestContext testContext) {
    ScriptedCompletion completion = new ScriptedCompletion().reply(ScriptedCompletion.VALIDATE_PROPS, new JsonObject()
      .put("props", new JsonObject()
        .put("query", "SELECT * FROM orders WHERE status = 'late'")
        .put("title", "Late orders")
        .put("config", new JsonObject().put("pageSize", 10)))
      .put("isModified", true)
      .put("reasoning", "filtered to late orders")
      .put("modifications", new JsonArray().add("added status filter").add("changed title")));

    validator(vertx, completion).validate("show late orders", ORDERS_TABLE)
      .onComplete(testContext.succeeding(validation -> testContext.verify(() -> {
        assertTrue(validation.isModified());
        assertEquals("SELECT * FROM orders WHERE status = 'late' LIMIT 50", validation.getProps().getQuery());
        assertEquals("Late orders", validation.getProps().getTitle());
        assertEquals(2, validation.getModifications().size());
        assertEquals("filtered to late orders", validation.getReasoning());
        assertTrue(completion.getUserPrompts().get(0).contains("\"show late orders\""));
        testContext.completeNow();
      })));
  }

  @Test
  void testFailureKeepsOriginalProps(Vertx vertx, VertxTestContext testContext) {
    ScriptedCompletion completion = new ScriptedCompletion().fail(ScriptedCompletion.VALIDATE_PROPS);

    validator(vertx, completion).validate("show orders", ORDERS_TABLE)
      .onComplete(testContext.succeeding(validation -> testContext.verify(() -> {
        assertFalse(validation.isModified());
        assertEquals("SELECT * FROM orders LIMIT 50", validation.getProps().getQuery());
        assertEquals("Orders", validation.getProps().getTitle());
        assertTrue(validation.getModifications().isEmpty());
        testContext.completeNow();
      })));
  }

  @Test
  void testReplyWithoutPropsKeepsOriginal(Vertx vertx, VertxTestContext testContext) {
    ScriptedCompletion completion = new ScriptedCompletion().reply(ScriptedCompletion.VALIDATE_PROPS,
      new JsonObject().put("isModified", false));

    validator(vertx, completion).validate("show orders", ORDERS_TABLE)
      .onComplete(testContext.succeeding(validation -> testContext.verify(() -> {
        assertFalse(validation.isModified());
        assertEquals("SELECT * FROM orders LIMIT 50", validation.getProps().getQuery());
        assertEquals("No modifications needed", validation.getReasoning());
        testContext.completeNow();
      })));
  }
}
