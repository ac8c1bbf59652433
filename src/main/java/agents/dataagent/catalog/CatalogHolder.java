package agents.dataagent.catalog;

import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Owner of the current catalog snapshot. Updates replace the catalog wholesale and bump the version.
 */
public class CatalogHolder {

  private final AtomicReference<CatalogSnapshot> current = new AtomicReference<>(CatalogSnapshot.EMPTY);

  public CatalogSnapshot current() {
    return current.get();
  }

  /**
   * Install a new snapshot holding exactly {@code artifacts}.
   *
   * @return the snapshot that was installed
   */
  public CatalogSnapshot replace(List<Artifact> artifacts) {
    return current.updateAndGet(previous -> new CatalogSnapshot(previous.getVersion() + 1, artifacts));
  }
}
