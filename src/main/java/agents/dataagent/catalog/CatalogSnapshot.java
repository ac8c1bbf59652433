package agents.dataagent.catalog;

import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Immutable, versioned view of the component catalog.
 * A resolution captures one snapshot at its start and uses it for every step.
 */
public final class CatalogSnapshot {

  public static final CatalogSnapshot EMPTY = new CatalogSnapshot(0, Collections.emptyList());

  private final long version;
  private final List<Artifact> artifacts;

  public CatalogSnapshot(long version, List<Artifact> artifacts) {
    this.version = version;
    this.artifacts = Collections.unmodifiableList(new ArrayList<>(artifacts));
  }

  public long getVersion() {
    return version;
  }

  public List<Artifact> getArtifacts() {
    return artifacts;
  }

  public int size() {
    return artifacts.size();
  }

  public boolean isEmpty() {
    return artifacts.isEmpty();
  }

  public Artifact findById(String id) {
    if (id == null) {
      return null;
    }
    for (Artifact artifact : artifacts) {
      if (id.equals(artifact.getId())) {
        return artifact;
      }
    }
    return null;
  }

  /**
   * Artifact at a 1-based position, or null when out of range.
   */
  public Artifact atPosition(int position) {
    if (position < 1 || position > artifacts.size()) {
      return null;
    }
    return artifacts.get(position - 1);
  }

  /**
   * Parse a catalog payload: a bare array of components, or an object carrying them under
   * {@code components}. Entries that are not objects are skipped.
   */
  public static List<Artifact> parsePayload(Object payload) {
    JsonArray components = null;
    if (payload instanceof JsonArray) {
      components = (JsonArray) payload;
    } else if (payload instanceof JsonObject) {
      components = ((JsonObject) payload).getJsonArray("components");
    }
    if (components == null) {
      throw new IllegalArgumentException("Catalog payload must be an array of components or an object with 'components'");
    }

    List<Artifact> artifacts = new ArrayList<>();
    for (Object entry : components) {
      if (entry instanceof JsonObject) {
        artifacts.add(Artifact.fromJson((JsonObject) entry));
      }
    }
    return artifacts;
  }
}
