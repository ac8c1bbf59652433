package agents.dataagent.candidates;

import agents.dataagent.catalog.CatalogSnapshot;
import agents.dataagent.services.LogUtil;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.json.JsonObject;

import java.util.ArrayList;
import java.util.List;

/**
 * Mirrors catalog snapshots into the candidate store.
 *
 * <p>The collection is reused when it exists and deleted first only when forced. Failures are
 * reported on the log and on {@value #SYNC_FAILED_ADDRESS}; they never reach the catalog update
 * that triggered the sync.</p>
 */
public class CandidateStoreSync {

  public static final String SYNC_FAILED_ADDRESS = "candidates.sync.failed";

  private final Vertx vertx;
  private final CandidateStore store;
  private final EmbeddingService embeddings;

  public CandidateStoreSync(Vertx vertx, CandidateStore store, EmbeddingService embeddings) {
    this.vertx = vertx;
    this.store = store;
    this.embeddings = embeddings;
  }

  /**
   * Embed and upsert every artifact of the snapshot.
   *
   * @return number of documents in the collection afterwards
   */
  public Future<Integer> synchronize(String collection, CatalogSnapshot snapshot, boolean forceRecreate) {
    List<CandidateDocument> documents = CandidateDocuments.forArtifacts(snapshot.getArtifacts());

    Future<Void> prepared = forceRecreate
      ? store.exists(collection).compose(exists -> exists ? store.delete(collection) : Future.<Void>succeededFuture())
      : Future.<Void>succeededFuture();

    return prepared
      .compose(v -> embed(documents))
      .compose(embedded -> store.upsert(collection, embedded))
      .compose(v -> store.count(collection))
      .onSuccess(count -> LogUtil.logInfo(vertx,
        "Synchronized catalog v" + snapshot.getVersion() + " into " + collection + " (" + documents.size()
          + " upserted; " + count + " stored)", "CandidateStoreSync", "Sync", "Complete"));
  }

  /**
   * Run {@link #synchronize} without waiting for it. Failures go to the log and the failure address.
   */
  public void synchronizeDetached(String collection, CatalogSnapshot snapshot, boolean forceRecreate) {
    synchronize(collection, snapshot, forceRecreate).onFailure(err -> {
      LogUtil.logError(vertx, "Candidate sync of catalog v" + snapshot.getVersion() + " failed", err,
        "CandidateStoreSync", "Sync", "Failed");
      vertx.eventBus().publish(SYNC_FAILED_ADDRESS, new JsonObject()
        .put("collection", collection)
        .put("catalogVersion", snapshot.getVersion())
        .put("error", String.valueOf(err.getMessage())));
    });
  }

  private Future<List<CandidateDocument>> embed(List<CandidateDocument> documents) {
    List<String> texts = new ArrayList<>();
    documents.forEach(document -> texts.add(document.getText()));

    return embeddings.embedAll(texts).map(vectors -> {
      List<CandidateDocument> embedded = new ArrayList<>();
      for (int i = 0; i < documents.size(); i++) {
        embedded.add(documents.get(i).withEmbedding(vectors.get(i)));
      }
      return embedded;
    });
  }
}
