package agents.dataagent.candidates;

import agents.dataagent.services.LogUtil;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.client.HttpResponse;
import io.vertx.ext.web.client.WebClient;
import io.vertx.ext.web.client.WebClientOptions;

import java.util.ArrayList;
import java.util.List;

/**
 * Candidate store backed by a Chroma server through its REST API (v1).
 * Collections are created in cosine space; the caller supplies embeddings.
 */
public class ChromaCandidateStore implements CandidateStore {

  private static final String API = "/api/v1/collections";

  private final Vertx vertx;
  private final WebClient webClient;
  private final String baseUrl;

  public ChromaCandidateStore(Vertx vertx, String baseUrl) {
    this.vertx = vertx;
    this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    this.webClient = WebClient.create(vertx, new WebClientOptions()
      .setUserAgent("Data-Agent/1.0")
      .setConnectTimeout(5000));
  }

  @Override
  public Future<Boolean> exists(String collection) {
    return webClient.getAbs(baseUrl + API)
      .send()
      .map(response -> {
        JsonArray collections = new JsonArray(expectSuccess(response, "list collections"));
        for (Object entry : collections) {
          if (entry instanceof JsonObject && collection.equals(((JsonObject) entry).getString("name"))) {
            return true;
          }
        }
        return false;
      })
      .recover(err -> {
        LogUtil.logError(vertx, "Error checking if collection exists", err,
          "ChromaCandidateStore", "Collection", "Exists");
        return Future.succeededFuture(false);
      });
  }

  @Override
  public Future<Integer> count(String collection) {
    return collectionId(collection)
      .compose(id -> webClient.getAbs(baseUrl + API + "/" + id + "/count").send())
      .map(response -> Integer.parseInt(expectSuccess(response, "count").toString().trim()))
      .recover(err -> {
        LogUtil.logError(vertx, "Error getting collection count for " + collection, err,
          "ChromaCandidateStore", "Collection", "Count");
        return Future.succeededFuture(0);
      });
  }

  @Override
  public Future<Void> upsert(String collection, List<CandidateDocument> documents) {
    if (documents.isEmpty()) {
      return getOrCreate(collection).mapEmpty();
    }

    JsonArray ids = new JsonArray();
    JsonArray embeddings = new JsonArray();
    JsonArray texts = new JsonArray();
    JsonArray metadatas = new JsonArray();
    for (CandidateDocument document : documents) {
      if (document.getEmbedding() == null) {
        return Future.failedFuture("Document " + document.getId() + " has no embedding");
      }
      ids.add(document.getId());
      embeddings.add(toJson(document.getEmbedding()));
      texts.add(document.getText());
      metadatas.add(document.getMetadata());
    }

    JsonObject body = new JsonObject()
      .put("ids", ids)
      .put("embeddings", embeddings)
      .put("documents", texts)
      .put("metadatas", metadatas);

    return getOrCreate(collection)
      .compose(id -> webClient.postAbs(baseUrl + API + "/" + id + "/upsert").sendJsonObject(body))
      .map(response -> {
        expectSuccess(response, "upsert");
        LogUtil.logInfo(vertx, "Upserted " + documents.size() + " documents into " + collection,
          "ChromaCandidateStore", "Collection", "Upsert");
        return (Void) null;
      });
  }

  @Override
  public Future<List<CandidateMatch>> query(String collection, float[] embedding, int topK) {
    JsonObject body = new JsonObject()
      .put("query_embeddings", new JsonArray().add(toJson(embedding)))
      .put("n_results", topK)
      .put("include", new JsonArray().add("metadatas").add("distances"));

    return collectionId(collection)
      .compose(id -> webClient.postAbs(baseUrl + API + "/" + id + "/query").sendJsonObject(body))
      .map(response -> parseQueryResult(new JsonObject(expectSuccess(response, "query"))));
  }

  @Override
  public Future<Void> delete(String collection) {
    return webClient.deleteAbs(baseUrl + API + "/" + collection)
      .send()
      .map(response -> {
        expectSuccess(response, "delete");
        LogUtil.logInfo(vertx, "Deleted collection " + collection, "ChromaCandidateStore", "Collection", "Delete");
        return (Void) null;
      });
  }

  private Future<String> collectionId(String collection) {
    return webClient.getAbs(baseUrl + API + "/" + collection)
      .send()
      .map(response -> new JsonObject(expectSuccess(response, "get collection " + collection)).getString("id"));
  }

  private Future<String> getOrCreate(String collection) {
    JsonObject body = new JsonObject()
      .put("name", collection)
      .put("metadata", new JsonObject().put("hnsw:space", "cosine"))
      .put("get_or_create", true);
    return webClient.postAbs(baseUrl + API)
      .sendJsonObject(body)
      .map(response -> new JsonObject(expectSuccess(response, "create collection " + collection)).getString("id"));
  }

  static List<CandidateMatch> parseQueryResult(JsonObject result) {
    List<CandidateMatch> matches = new ArrayList<>();
    JsonArray ids = firstRow(result.getJsonArray("ids"));
    JsonArray distances = firstRow(result.getJsonArray("distances"));
    JsonArray metadatas = firstRow(result.getJsonArray("metadatas"));
    if (ids == null) {
      return matches;
    }
    for (int i = 0; i < ids.size(); i++) {
      double distance = distances != null && i < distances.size() && distances.getValue(i) instanceof Number
        ? distances.getDouble(i) : Double.NaN;
      JsonObject metadata = metadatas != null && i < metadatas.size() && metadatas.getValue(i) instanceof JsonObject
        ? metadatas.getJsonObject(i) : new JsonObject();
      matches.add(new CandidateMatch(ids.getString(i), distance, metadata));
    }
    return matches;
  }

  private static JsonArray firstRow(JsonArray rows) {
    if (rows == null || rows.isEmpty() || !(rows.getValue(0) instanceof JsonArray)) {
      return null;
    }
    return rows.getJsonArray(0);
  }

  private static Buffer expectSuccess(HttpResponse<Buffer> response, String operation) {
    if (response.statusCode() < 200 || response.statusCode() >= 300) {
      throw new IllegalStateException("Chroma " + operation + " failed (" + response.statusCode() + "): "
        + response.bodyAsString());
    }
    Buffer body = response.body();
    return body == null ? Buffer.buffer("null") : body;
  }

  private static JsonArray toJson(float[] vector) {
    JsonArray array = new JsonArray();
    for (float value : vector) {
      array.add(value);
    }
    return array;
  }
}
