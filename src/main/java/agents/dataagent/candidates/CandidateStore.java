package agents.dataagent.candidates;

import io.vertx.core.Future;

import java.util.List;

/**
 * Named collections of embedded candidate documents.
 * Embeddings are computed by the caller; the store only indexes and searches them.
 */
public interface CandidateStore {

  Future<Boolean> exists(String collection);

  /**
   * Number of documents in the collection; 0 when it does not exist.
   */
  Future<Integer> count(String collection);

  /**
   * Insert or replace documents by id, creating the collection when needed.
   */
  Future<Void> upsert(String collection, List<CandidateDocument> documents);

  /**
   * Nearest documents to {@code embedding}, closest first.
   */
  Future<List<CandidateMatch>> query(String collection, float[] embedding, int topK);

  Future<Void> delete(String collection);
}
