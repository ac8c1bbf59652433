package agents.dataagent.candidates;

import io.vertx.core.Future;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local candidate store with exact cosine search.
 * Used when no Chroma host is configured, and by tests.
 */
public class InMemoryCandidateStore implements CandidateStore {

  private final Map<String, Map<String, CandidateDocument>> collections = new ConcurrentHashMap<>();

  @Override
  public Future<Boolean> exists(String collection) {
    return Future.succeededFuture(collections.containsKey(collection));
  }

  @Override
  public Future<Integer> count(String collection) {
    Map<String, CandidateDocument> documents = collections.get(collection);
    return Future.succeededFuture(documents == null ? 0 : documents.size());
  }

  @Override
  public Future<Void> upsert(String collection, List<CandidateDocument> documents) {
    for (CandidateDocument document : documents) {
      if (document.getEmbedding() == null) {
        return Future.failedFuture("Document " + document.getId() + " has no embedding");
      }
    }
    Map<String, CandidateDocument> target =
      collections.computeIfAbsent(collection, name -> Collections.synchronizedMap(new LinkedHashMap<>()));
    documents.forEach(document -> target.put(document.getId(), document));
    return Future.succeededFuture();
  }

  @Override
  public Future<List<CandidateMatch>> query(String collection, float[] embedding, int topK) {
    Map<String, CandidateDocument> documents = collections.get(collection);
    if (documents == null) {
      return Future.failedFuture("Collection " + collection + " does not exist");
    }

    List<CandidateMatch> matches = new ArrayList<>();
    synchronized (documents) {
      for (CandidateDocument document : documents.values()) {
        double distance = 1.0 - cosineSimilarity(embedding, document.getEmbedding());
        matches.add(new CandidateMatch(document.getId(), distance, document.getMetadata()));
      }
    }
    matches.sort(Comparator.comparingDouble(CandidateMatch::getDistance));
    return Future.succeededFuture(new ArrayList<>(matches.subList(0, Math.min(Math.max(topK, 0), matches.size()))));
  }

  @Override
  public Future<Void> delete(String collection) {
    collections.remove(collection);
    return Future.succeededFuture();
  }

  static double cosineSimilarity(float[] a, float[] b) {
    if (a == null || b == null || a.length != b.length || a.length == 0) {
      return 0.0;
    }
    double dot = 0;
    double normA = 0;
    double normB = 0;
    for (int i = 0; i < a.length; i++) {
      dot += a[i] * b[i];
      normA += a[i] * a[i];
      normB += b[i] * b[i];
    }
    if (normA == 0 || normB == 0) {
      return 0.0;
    }
    return dot / (Math.sqrt(normA) * Math.sqrt(normB));
  }
}
