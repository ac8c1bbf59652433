package agents.dataagent.session.handlers;

import agents.dataagent.db.QueryExecutor;
import agents.dataagent.protocol.Envelope;
import agents.dataagent.protocol.MessageType;
import agents.dataagent.services.LogUtil;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.json.JsonObject;

/**
 * Runs the raw query of a data request on one data source and answers with its rows.
 * Used for both the row store and the warehouse.
 */
public class DataRequestHandler implements EnvelopeHandler {

  private final Vertx vertx;
  private final QueryExecutor executor;
  private final MessageType requestType;

  public DataRequestHandler(Vertx vertx, QueryExecutor executor, MessageType requestType) {
    this.vertx = vertx;
    this.executor = executor;
    this.requestType = requestType;
  }

  @Override
  public Future<Envelope> handle(Envelope request) {
    Object rawQuery = request.payloadObject().getValue("query");
    if (!(rawQuery instanceof String) || ((String) rawQuery).trim().isEmpty()) {
      return Future.succeededFuture(request.reply(requestType.getResponseType(), new JsonObject().put("error", "Invalid query")));
    }
    String query = (String) rawQuery;
    LogUtil.logDebug(vertx, "Executing " + requestType.getWireName() + " " + request.getReplyId() + ": " + query,
      "DataRequestHandler", "Query", "Execute");

    return executor.execute(query)
      .map(result -> request.reply(requestType.getResponseType(), result.toPayload()));
  }
}
