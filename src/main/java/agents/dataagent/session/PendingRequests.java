package agents.dataagent.session;

import agents.dataagent.protocol.Envelope;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Correlation table for locally initiated requests: id to pending promise plus its deadline timer.
 * Touched only from the session's event loop.
 */
public class PendingRequests {

  private final Vertx vertx;
  private final Map<String, Pending> pending = new HashMap<>();

  public PendingRequests(Vertx vertx) {
    this.vertx = vertx;
  }

  /**
   * Register an id; the returned future fails with a timeout after {@code timeoutMs}.
   */
  public Future<Envelope> register(String id, long timeoutMs) {
    if (pending.containsKey(id)) {
      return Future.failedFuture(new IllegalStateException("Request " + id + " is already pending"));
    }
    Promise<Envelope> promise = Promise.promise();
    long timerId = vertx.setTimer(timeoutMs, t -> {
      if (pending.remove(id) != null) {
        promise.tryFail(new RequestTimeoutException("WebSocket timeout after " + timeoutMs + "ms"));
      }
    });
    pending.put(id, new Pending(promise, timerId));
    return promise.future();
  }

  public boolean contains(String id) {
    return id != null && pending.containsKey(id);
  }

  /**
   * Complete the request with this envelope's id.
   *
   * @return false when nothing was pending for it
   */
  public boolean complete(Envelope envelope) {
    Pending entry = envelope.getId() == null ? null : pending.remove(envelope.getId());
    if (entry == null) {
      return false;
    }
    vertx.cancelTimer(entry.timerId);
    entry.promise.tryComplete(envelope);
    return true;
  }

  /**
   * Fail one request without waiting for its deadline.
   */
  public void fail(String id, Throwable cause) {
    Pending entry = pending.remove(id);
    if (entry != null) {
      vertx.cancelTimer(entry.timerId);
      entry.promise.tryFail(cause);
    }
  }

  public int rejectAll(String reason) {
    List<Pending> entries = new ArrayList<>(pending.values());
    pending.clear();
    for (Pending entry : entries) {
      vertx.cancelTimer(entry.timerId);
      entry.promise.tryFail(new IllegalStateException(reason));
    }
    return entries.size();
  }

  public int size() {
    return pending.size();
  }

  private static final class Pending {
    final Promise<Envelope> promise;
    final long timerId;

    Pending(Promise<Envelope> promise, long timerId) {
      this.promise = promise;
      this.timerId = timerId;
    }
  }
}
