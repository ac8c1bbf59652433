package agents.dataagent.protocol;

/**
 * Raised when an inbound frame cannot be turned into an {@link Envelope}.
 */
public class EnvelopeDecodeException extends Exception {

  public EnvelopeDecodeException(String message) {
    super(message);
  }

  public EnvelopeDecodeException(String message, Throwable cause) {
    super(message, cause);
  }
}
