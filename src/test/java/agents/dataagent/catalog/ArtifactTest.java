package agents.dataagent.catalog;

import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ArtifactTest {

  @Test
  void testUnknownFieldsSurviveParsing() {
    JsonObject wire = new JsonObject()
      .put("id", 42)
      .put("name", "RevenueCard")
      .put("type", "KPICard")
      .put("keywords", new JsonArray().add("revenue").add("revenue").add("total"))
      .put("owner", "team-a")
      .put("props", new JsonObject()
        .put("query", "SELECT SUM(revenue_generated) AS value FROM supply_chain_data")
        .put("theme", "dark")
        .put("config", new JsonObject().put("formatter", "currency").put("animate", true)));

    Artifact artifact = Artifact.fromJson(wire);

    assertEquals("42", artifact.getId());
    assertEquals(VisualizationType.SINGLE_METRIC, artifact.getVisualizationType());
    assertEquals(Arrays.asList("revenue", "total"), artifact.getKeywords());
    ArtifactConfig.MetricConfig config = (ArtifactConfig.MetricConfig) artifact.getProps().getConfig();
    assertEquals("currency", config.getFormatter());

    JsonObject back = artifact.toJson();
    assertEquals("team-a", back.getString("owner"));
    assertEquals("dark", back.getJsonObject("props").getString("theme"));
    assertEquals(true, back.getJsonObject("props").getJsonObject("config").getBoolean("animate"));
    assertEquals("currency", back.getJsonObject("props").getJsonObject("config").getString("formatter"));
  }

  @Test
  void testFormsKeepFreeformConfig() {
    Artifact form = Artifact.fromJson(new JsonObject()
      .put("id", "f1").put("name", "CreateOrderForm").put("type", "form")
      .put("props", new JsonObject().put("config", new JsonObject().put("fields", new JsonArray().add("sku")))));

    assertNull(form.getVisualizationType());
    assertTrue(form.getProps().getConfig() instanceof ArtifactConfig.FreeformConfig);
    assertEquals("sku", form.toJson().getJsonObject("props").getJsonObject("config").getJsonArray("fields").getString(0));
  }

  @Test
  void testNestedContainersAreFlattened() {
    Artifact metric = Artifact.synthesized("m", VisualizationType.SINGLE_METRIC, "total",
      new ArtifactProps("SELECT 1 AS value LIMIT 50", "Total", "total", ArtifactConfig.empty(VisualizationType.SINGLE_METRIC), null));
    Artifact table = Artifact.synthesized("t", VisualizationType.TABULAR, "rows",
      new ArtifactProps("SELECT * FROM t LIMIT 50", "Rows", "rows", ArtifactConfig.empty(VisualizationType.TABULAR), null));
    Artifact inner = Artifact.synthesized("inner", VisualizationType.CONTAINER, null,
      new ArtifactProps(null, null, null, ArtifactConfig.ContainerConfig.of(List.of(table)), null));

    ArtifactConfig.ContainerConfig outer = ArtifactConfig.ContainerConfig.of(List.of(metric, inner));

    assertEquals(2, outer.getComponents().size());
    assertEquals("t", outer.getComponents().get(1).getId());
    assertEquals("grid", outer.toJson().getString("layout"));
  }

  @Test
  void testSynthesizedNamingAndIds() {
    Artifact artifact = Artifact.synthesized(Artifact.dynamicId(VisualizationType.TIME_SERIES, 1700000000000L, 2),
      VisualizationType.TIME_SERIES, "trend", new ArtifactProps(null, null, null, null, null));

    assertEquals("dynamic_time-series_1700000000000_2", artifact.getId());
    assertEquals("DynamicTimeSeries", artifact.getName());
    assertEquals("time-series", artifact.getType());
    assertEquals(Artifact.DYNAMIC_CATEGORY, artifact.getCategory());
  }

  @Test
  void testVisualizationAliases() {
    assertEquals(VisualizationType.TABULAR, VisualizationType.fromTag("data-table"));
    assertEquals(VisualizationType.PROPORTION, VisualizationType.fromTag("DonutChart"));
    assertEquals(VisualizationType.CATEGORICAL_COMPARISON, VisualizationType.fromTag("Categorical-Comparison"));
    assertNull(VisualizationType.fromTag("heatmap"));
  }
}
