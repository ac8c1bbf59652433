package agents.dataagent.session.handlers;

import agents.dataagent.auth.CredentialValidator;
import agents.dataagent.protocol.Envelope;
import agents.dataagent.protocol.MessageType;
import io.vertx.core.Future;

/**
 * Checks the base64 {@code login_data} credentials and records the requester's endpoint id for the user.
 */
public class LoginRequestHandler implements EnvelopeHandler {

  private final CredentialValidator validator;

  public LoginRequestHandler(CredentialValidator validator) {
    this.validator = validator;
  }

  @Override
  public Future<Envelope> handle(Envelope request) {
    Object loginData = request.payloadObject().getValue("login_data");
    return validator.login(loginData instanceof String ? (String) loginData : null, request.getFrom().getId())
      .map(result -> request.reply(MessageType.AUTH_LOGIN_REQ.getResponseType(), result.toJson()));
  }
}
