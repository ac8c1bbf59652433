package agents.dataagent.protocol;

import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonObject;

/**
 * A typed, correlated message exchanged over the session.
 *
 * <p>Wire form:</p>
 * <pre>
 * {"id": "...", "type": "user_prompt_req", "from": {"type": "runtime", "id": "..."}, "to": {...}, "payload": ...}
 * </pre>
 * The payload is handler defined: a JSON object, array, string, number, boolean or null.
 */
public final class Envelope {

  public static final String UNKNOWN_ID = "unknown";

  private final String id;
  private final String type;
  private final Endpoint from;
  private final Endpoint to;
  private final Object payload;

  public Envelope(String id, String type, Endpoint from, Endpoint to, Object payload) {
    this.id = id;
    this.type = type;
    this.from = from == null ? Endpoint.NONE : from;
    this.to = to == null ? Endpoint.NONE : to;
    this.payload = payload;
  }

  /**
   * Envelope originating from this agent with no explicit recipient.
   */
  public static Envelope outbound(String id, String type, Object payload) {
    return new Envelope(id, type, Endpoint.of(EndpointRole.DATA_AGENT), Endpoint.NONE, payload);
  }

  public String getId() { return id; }
  public String getType() { return type; }
  public Endpoint getFrom() { return from; }
  public Endpoint getTo() { return to; }
  public Object getPayload() { return payload; }

  /**
   * Id to answer with; envelopes that arrived without one are answered as "unknown".
   */
  public String getReplyId() {
    return id == null || id.isEmpty() ? UNKNOWN_ID : id;
  }

  /**
   * Payload as an object, or an empty object when the payload has another shape.
   */
  public JsonObject payloadObject() {
    return payload instanceof JsonObject ? (JsonObject) payload : new JsonObject();
  }

  /**
   * Build the response to this envelope: same id, from/to swapped, this agent stamped as sender.
   */
  public Envelope reply(String responseType, Object responsePayload) {
    Endpoint sender = to.getRole() == null ? new Endpoint(EndpointRole.DATA_AGENT, to.getId()) : to;
    return new Envelope(getReplyId(), responseType, sender, from, responsePayload);
  }

  /**
   * Same addressing with a different payload.
   */
  public Envelope withPayload(Object newPayload) {
    return new Envelope(id, type, from, to, newPayload);
  }

  public JsonObject toJson() {
    JsonObject json = new JsonObject()
      .put("id", id)
      .put("type", type)
      .put("from", from.toJson())
      .put("to", to.toJson());
    json.put("payload", payload);
    return json;
  }

  public String encode() {
    return toJson().encode();
  }

  /**
   * Decode a text frame.
   *
   * @throws EnvelopeDecodeException if the frame is not a JSON object or carries no type
   */
  public static Envelope decode(String frame) throws EnvelopeDecodeException {
    if (frame == null || frame.isBlank()) {
      throw new EnvelopeDecodeException("Empty frame");
    }
    JsonObject json;
    try {
      json = new JsonObject(frame);
    } catch (DecodeException | ClassCastException e) {
      throw new EnvelopeDecodeException("Frame is not a JSON object", e);
    }
    return fromJson(json);
  }

  public static Envelope fromJson(JsonObject json) throws EnvelopeDecodeException {
    Object rawType = json.getValue("type");
    if (!(rawType instanceof String) || ((String) rawType).isBlank()) {
      throw new EnvelopeDecodeException("Envelope has no type");
    }
    Object rawId = json.getValue("id");
    String id = rawId == null ? null : String.valueOf(rawId);
    return new Envelope(
      id,
      (String) rawType,
      Endpoint.fromJson(json.getValue("from")),
      Endpoint.fromJson(json.getValue("to")),
      json.getValue("payload")
    );
  }

  @Override
  public String toString() {
    return "Envelope{id='" + id + "', type='" + type + "', from=" + from + ", to=" + to + "}";
  }
}
