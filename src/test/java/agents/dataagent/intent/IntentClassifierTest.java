package agents.dataagent.intent;

import agents.dataagent.catalog.VisualizationType;
import agents.dataagent.schema.SchemaDescriptor;
import io.vertx.core.Vertx;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import io.vertx.junit5.VertxExtension;
import io.vertx.junit5.VertxTestContext;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

@ExtendWith(VertxExtension.class)
class IntentClassifierTest {

  @Test
  void testAnalyticalReplyKeepsKnownTypesInOrder() {
    ClassificationResult result = IntentClassifier.parse(new JsonObject()
      .put("questionType", "analytical")
      .put("visualizations", new JsonArray().add("single-metric").add("heatmap").add("tabular").add("container"))
      .put("needsMultiple", true)
      .put("reasoning", "total plus list"));

    assertEquals(QuestionType.ANALYTICAL, result.getQuestionType());
    assertEquals(Arrays.asList(VisualizationType.SINGLE_METRIC, VisualizationType.TABULAR), result.getVisualizations());
    assertTrue(result.isNeedsMultiple());
    assertEquals("total plus list", result.getReasoning());
  }

  @Test
  void testNonAnalyticalCarriesNoVisualizations() {
    ClassificationResult result = IntentClassifier.parse(new JsonObject()
      .put("questionType", "data_modification")
      .put("visualizations", new JsonArray().add("tabular"))
      .put("needsMultiple", true));

    assertEquals(QuestionType.DATA_MODIFICATION, result.getQuestionType());
    assertTrue(result.getVisualizations().isEmpty());
    assertFalse(result.isNeedsMultiple());
  }

  @Test
  void testUnknownQuestionTypeFallsBackToAnalytical() {
    ClassificationResult result = IntentClassifier.parse(new JsonObject().put("questionType", "smalltalk"));

    assertEquals(QuestionType.ANALYTICAL, result.getQuestionType());
    assertTrue(result.getVisualizations().isEmpty());
    assertFalse(result.isNeedsMultiple());
    assertEquals(QuestionType.ANALYTICAL, IntentClassifier.parse(null).getQuestionType());
  }

  @Test
  void testQuestionTypeSpellings() {
    assertEquals(QuestionType.DATA_MODIFICATION, QuestionType.fromWireName("Data-Modification"));
    assertEquals(QuestionType.GENERAL, QuestionType.fromWireName(" general "));
    assertNull(QuestionType.fromWireName("other"));
  }

  @Test
  void testBackendFailureYieldsFallback(Vertx vertx, VertxTestContext testContext) {
    ScriptedCompletion completion = new ScriptedCompletion().fail(ScriptedCompletion.CLASSIFY);
    IntentClassifier classifier = new IntentClassifier(vertx, completion, new SchemaDescriptor(new JsonObject()));

    classifier.classify("hello there").onComplete(testContext.succeeding(result -> testContext.verify(() -> {
      assertEquals(QuestionType.ANALYTICAL, result.getQuestionType());
      assertTrue(result.getReasoning().startsWith("Classification unavailable"));
      assertTrue(completion.getUserPrompts().get(0).contains("\"hello there\""));
      testContext.completeNow();
    })));
  }
}
