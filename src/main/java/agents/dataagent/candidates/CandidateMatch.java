package agents.dataagent.candidates;

import agents.dataagent.catalog.Artifact;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonObject;

/**
 * A query hit: document id, distance to the query (smaller is closer) and stored metadata.
 */
public final class CandidateMatch {

  private final String id;
  private final double distance;
  private final JsonObject metadata;

  public CandidateMatch(String id, double distance, JsonObject metadata) {
    this.id = id;
    this.distance = distance;
    this.metadata = metadata == null ? new JsonObject() : metadata;
  }

  public String getId() { return id; }
  public double getDistance() { return distance; }
  public JsonObject getMetadata() { return metadata; }

  /**
   * The artifact serialized into the metadata at upsert time, or null when it is missing or unreadable.
   */
  public Artifact toArtifact() {
    String serialized = metadata.getString(CandidateDocuments.COMPONENT_DATA_KEY);
    if (serialized == null) {
      return null;
    }
    try {
      return Artifact.fromJson(new JsonObject(serialized));
    } catch (DecodeException | ClassCastException e) {
      return null;
    }
  }
}
