package agents.dataagent.session.handlers;

import agents.dataagent.auth.CredentialValidator;
import agents.dataagent.protocol.Envelope;
import agents.dataagent.protocol.MessageType;
import io.vertx.core.Future;

public class TokenVerifyRequestHandler implements EnvelopeHandler {

  private final CredentialValidator validator;

  public TokenVerifyRequestHandler(CredentialValidator validator) {
    this.validator = validator;
  }

  @Override
  public Future<Envelope> handle(Envelope request) {
    Object token = request.payloadObject().getValue("token");
    return validator.verify(token instanceof String ? (String) token : null)
      .map(result -> request.reply(MessageType.AUTH_VERIFY_REQ.getResponseType(), result.toJson()));
  }
}
