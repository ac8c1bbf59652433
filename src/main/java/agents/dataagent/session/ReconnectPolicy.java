package agents.dataagent.session;

/**
 * Bounded reconnect bookkeeping. Not thread-safe; owned by the session's event loop.
 */
public class ReconnectPolicy {

  private final long delayMs;
  private final int maxAttempts;
  private int attempts;
  private boolean enabled = true;

  public ReconnectPolicy(long delayMs, int maxAttempts) {
    this.delayMs = delayMs;
    this.maxAttempts = maxAttempts;
  }

  /**
   * Count one more attempt after an unexpected close.
   *
   * @return true when an attempt should be scheduled, false when disabled or out of attempts
   */
  public boolean nextAttempt() {
    if (!enabled || attempts >= maxAttempts) {
      return false;
    }
    attempts++;
    return true;
  }

  public boolean isExhausted() {
    return attempts >= maxAttempts;
  }

  public void reset() {
    attempts = 0;
  }

  public void disable() {
    enabled = false;
  }

  public void enable() {
    enabled = true;
  }

  public boolean isEnabled() { return enabled; }
  public int getAttempts() { return attempts; }
  public int getMaxAttempts() { return maxAttempts; }
  public long getDelayMs() { return delayMs; }
}
