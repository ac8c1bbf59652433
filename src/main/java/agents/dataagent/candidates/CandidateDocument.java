package agents.dataagent.candidates;

import io.vertx.core.json.JsonObject;

/**
 * One entry of a candidate collection: the artifact id, the text that was embedded,
 * its embedding and the metadata returned with query hits.
 */
public final class CandidateDocument {

  private final String id;
  private final String text;
  private final float[] embedding;
  private final JsonObject metadata;

  public CandidateDocument(String id, String text, float[] embedding, JsonObject metadata) {
    this.id = id;
    this.text = text;
    this.embedding = embedding;
    this.metadata = metadata == null ? new JsonObject() : metadata;
  }

  public String getId() { return id; }
  public String getText() { return text; }
  public float[] getEmbedding() { return embedding; }
  public JsonObject getMetadata() { return metadata; }

  public CandidateDocument withEmbedding(float[] vector) {
    return new CandidateDocument(id, text, vector, metadata);
  }
}
