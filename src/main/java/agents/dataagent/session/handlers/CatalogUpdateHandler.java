package agents.dataagent.session.handlers;

import agents.dataagent.candidates.CandidateStoreSync;
import agents.dataagent.catalog.CatalogHolder;
import agents.dataagent.catalog.CatalogSnapshot;
import agents.dataagent.config.AgentConfig;
import agents.dataagent.protocol.Envelope;
import agents.dataagent.protocol.MessageType;
import agents.dataagent.services.LogUtil;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.json.JsonObject;

/**
 * Replaces the catalog with the announced one and, when vector matching is on, starts a
 * candidate store sync that the update does not wait for.
 */
public class CatalogUpdateHandler implements EnvelopeHandler {

  private final Vertx vertx;
  private final CatalogHolder catalog;
  private final CandidateStoreSync sync;
  private final AgentConfig config;

  /**
   * @param sync candidate sync, or null when no candidate store is in use
   */
  public CatalogUpdateHandler(Vertx vertx, CatalogHolder catalog, CandidateStoreSync sync, AgentConfig config) {
    this.vertx = vertx;
    this.catalog = catalog;
    this.sync = sync;
    this.config = config;
  }

  @Override
  public Future<Envelope> handle(Envelope request) {
    CatalogSnapshot installed;
    try {
      installed = install(request.getPayload());
    } catch (IllegalArgumentException e) {
      return Future.failedFuture(e);
    }
    return Future.succeededFuture(request.reply(MessageType.COMPONENT_LIST_UPDATE.getResponseType(), new JsonObject()
      .put("success", true)
      .put("count", installed.size())
      .put("version", installed.getVersion())));
  }

  /**
   * Install a catalog payload (array, or object with {@code components}).
   *
   * @throws IllegalArgumentException if the payload has neither shape
   */
  public CatalogSnapshot install(Object payload) {
    CatalogSnapshot installed = catalog.replace(CatalogSnapshot.parsePayload(payload));
    LogUtil.logInfo(vertx, "Catalog v" + installed.getVersion() + " installed with " + installed.size() + " components",
      "CatalogUpdateHandler", "Catalog", "Replace");

    if (sync != null && config.isCandidateSyncEnabled()) {
      sync.synchronizeDetached(config.getCandidateCollectionName(), installed, config.isVectorForceRecreate());
    }
    return installed;
  }
}
