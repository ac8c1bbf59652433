package agents.dataagent.session;

/**
 * A locally initiated request got no reply before its deadline.
 */
public class RequestTimeoutException extends RuntimeException {

  public RequestTimeoutException(String message) {
    super(message);
  }
}
