package agents.dataagent.candidates;

import agents.dataagent.config.Env;
import agents.dataagent.services.LogUtil;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.client.HttpRequest;
import io.vertx.ext.web.client.HttpResponse;
import io.vertx.ext.web.client.WebClient;
import io.vertx.ext.web.client.WebClientOptions;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Embedding client for any OpenAI-compatible <code>/v1/embeddings</code> endpoint.
 * This is a singleton service (not a verticle), set up once by the Driver.
 */
public class OpenAiEmbeddingService implements EmbeddingService {
  private static OpenAiEmbeddingService instance;

  private Vertx vertx;
  private WebClient webClient;

  private String apiUrl;
  private String path;
  private String modelName;
  private String apiKey;
  private int timeoutMs;

  private OpenAiEmbeddingService() {
  }

  public static synchronized OpenAiEmbeddingService getInstance() {
    if (instance == null) {
      instance = new OpenAiEmbeddingService();
    }
    return instance;
  }

  /**
   * Load EMBEDDING_* configuration and create the HTTP client.
   * @return false when configuration is missing; the service then fails every call
   */
  public boolean setupService(Vertx vertx) {
    this.vertx = vertx;
    try {
      this.apiUrl = Env.getRequired("EMBEDDING_API_URL");
      this.path = Env.get("EMBEDDING_PATH", "/v1/embeddings");
      this.modelName = Env.getRequired("EMBEDDING_MODEL_NAME");
      this.apiKey = Env.get("EMBEDDING_API_KEY");
      this.timeoutMs = Env.getInt("EMBEDDING_REQUEST_TIMEOUT_MS", 30_000);
    } catch (IllegalStateException e) {
      LogUtil.logError(vertx, e.getMessage(), "OpenAiEmbeddingService", "Configuration", "Error");
      LogUtil.logError(vertx, "Embedding service disabled due to missing configuration",
        "OpenAiEmbeddingService", "Configuration", "Error");
      return false;
    }

    this.webClient = WebClient.create(vertx, new WebClientOptions()
      .setUserAgent("Data-Agent/1.0")
      .setConnectTimeout(5000));

    LogUtil.logInfo(vertx, "OpenAiEmbeddingService initialized with " + apiUrl + path + " model " + modelName,
      "OpenAiEmbeddingService", "StartUp", "System");
    return true;
  }

  public boolean isInitialized() {
    return webClient != null;
  }

  @Override
  public Future<float[]> embed(String text) {
    return embedAll(Collections.singletonList(text)).map(vectors -> vectors.get(0));
  }

  @Override
  public Future<List<float[]>> embedAll(List<String> texts) {
    if (!isInitialized()) {
      return Future.failedFuture("OpenAiEmbeddingService not properly initialized - check EMBEDDING configuration in .env.local");
    }
    if (texts.isEmpty()) {
      return Future.succeededFuture(Collections.emptyList());
    }

    JsonObject body = new JsonObject()
      .put("model", modelName)
      .put("input", new JsonArray(new ArrayList<>(texts)));

    HttpRequest<Buffer> request = webClient.postAbs(apiUrl + path)
      .timeout(timeoutMs)
      .putHeader("Content-Type", "application/json");
    if (apiKey != null) {
      request.putHeader("Authorization", "Bearer " + apiKey);
    }

    LogUtil.logDebug(vertx, "Embedding " + texts.size() + " texts", "OpenAiEmbeddingService", "API", "Request");

    return request.sendJsonObject(body).map(response -> parseResponse(response, texts.size()));
  }

  static List<float[]> parseResponse(HttpResponse<Buffer> response, int expected) {
    if (response.statusCode() != 200) {
      throw new IllegalStateException("Embedding API error (" + response.statusCode() + "): " + response.bodyAsString());
    }
    return parseData(response.bodyAsJsonObject(), expected);
  }

  /**
   * Vectors of an embeddings response, ordered by their <code>index</code>.
   */
  static List<float[]> parseData(JsonObject body, int expected) {
    JsonArray data = body.getJsonArray("data", new JsonArray());
    float[][] ordered = new float[expected][];
    for (int i = 0; i < data.size(); i++) {
      JsonObject item = data.getJsonObject(i);
      int index = item.getInteger("index", i);
      JsonArray values = item.getJsonArray("embedding", new JsonArray());
      float[] vector = new float[values.size()];
      for (int j = 0; j < values.size(); j++) {
        vector[j] = values.getNumber(j).floatValue();
      }
      if (index >= 0 && index < expected) {
        ordered[index] = vector;
      }
    }

    List<float[]> vectors = new ArrayList<>();
    for (int i = 0; i < expected; i++) {
      if (ordered[i] == null) {
        throw new IllegalStateException("Embedding API returned no vector for input " + i);
      }
      vectors.add(ordered[i]);
    }
    return vectors;
  }
}
