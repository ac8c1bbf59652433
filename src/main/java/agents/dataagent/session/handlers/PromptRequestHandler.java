package agents.dataagent.session.handlers;

import agents.dataagent.intent.IntentResolver;
import agents.dataagent.protocol.Endpoint;
import agents.dataagent.protocol.EndpointRole;
import agents.dataagent.protocol.Envelope;
import agents.dataagent.protocol.MessageType;
import io.vertx.core.Future;
import io.vertx.core.json.JsonObject;

/**
 * Resolves a prompt to an artifact. Answers go to the runtime endpoint that asked.
 */
public class PromptRequestHandler implements EnvelopeHandler {

  private static final String RESPONSE_TYPE = MessageType.USER_PROMPT_REQ.getResponseType();

  private final IntentResolver resolver;

  public PromptRequestHandler(IntentResolver resolver) {
    this.resolver = resolver;
  }

  @Override
  public Future<Envelope> handle(Envelope request) {
    Object rawPrompt = request.payloadObject().getValue("prompt");
    String prompt = rawPrompt instanceof String ? (String) rawPrompt : "";

    return resolver.resolve(prompt)
      .map(result -> respond(request, result.toPayload()))
      .recover(err -> Future.succeededFuture(respond(request,
        new JsonObject().put("error", err.getMessage() == null ? "Unknown error" : err.getMessage()))));
  }

  static Envelope respond(Envelope request, Object payload) {
    return new Envelope(request.getReplyId(), RESPONSE_TYPE,
      Endpoint.of(EndpointRole.DATA_AGENT),
      new Endpoint(EndpointRole.RUNTIME, request.getFrom().getId()),
      payload);
  }
}
