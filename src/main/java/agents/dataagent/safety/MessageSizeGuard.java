package agents.dataagent.safety;

import agents.dataagent.protocol.Envelope;
import io.vertx.core.json.JsonObject;

import java.nio.charset.StandardCharsets;

/**
 * Measures serialized messages against the transport ceiling and builds the diagnostic
 * replacement for responses that are too large to send.
 */
public class MessageSizeGuard {

  public static final int DEFAULT_MAX_SIZE = 1_048_576;

  private final int maxSize;

  public MessageSizeGuard() {
    this(DEFAULT_MAX_SIZE);
  }

  public MessageSizeGuard(int maxSize) {
    this.maxSize = maxSize;
  }

  public int getMaxSize() {
    return maxSize;
  }

  /**
   * UTF-8 byte length of the serialized text.
   */
  public static int sizeInBytes(String serialized) {
    return serialized == null ? 0 : serialized.getBytes(StandardCharsets.UTF_8).length;
  }

  public SizeCheck validate(String serialized) {
    int size = sizeInBytes(serialized);
    return new SizeCheck(size <= maxSize, size, maxSize);
  }

  public SizeCheck validate(JsonObject message) {
    return validate(message.encode());
  }

  /**
   * Same id, type and addressing as the original, with a payload describing the condition.
   */
  public Envelope oversizeReplacement(Envelope original, SizeCheck check) {
    JsonObject payload = new JsonObject()
      .put("error", "Response size (" + check.getSize() + " bytes) exceeds maximum allowed message size ("
        + check.getMaxSize() + " bytes). Please add a LIMIT to your query or narrow the request.")
      .put("size", check.getSize())
      .put("maxSize", check.getMaxSize());
    return original.withPayload(payload);
  }

  /**
   * Outcome of a size check.
   */
  public static final class SizeCheck {
    private final boolean valid;
    private final int size;
    private final int maxSize;

    public SizeCheck(boolean valid, int size, int maxSize) {
      this.valid = valid;
      this.size = size;
      this.maxSize = maxSize;
    }

    public boolean isValid() { return valid; }
    public int getSize() { return size; }
    public int getMaxSize() { return maxSize; }

    public JsonObject toJson() {
      return new JsonObject().put("isValid", valid).put("size", size).put("maxSize", maxSize);
    }
  }
}
