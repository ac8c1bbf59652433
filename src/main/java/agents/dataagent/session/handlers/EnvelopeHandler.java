package agents.dataagent.session.handlers;

import agents.dataagent.protocol.Envelope;
import io.vertx.core.Future;

/**
 * Answers one inbound envelope type. The returned envelope is sent back on the same id;
 * a failed future is turned into an error payload by the session.
 */
public interface EnvelopeHandler {

  Future<Envelope> handle(Envelope request);
}
