package agents.dataagent.apis;

import agents.dataagent.config.Env;
import agents.dataagent.services.LogUtil;
import agents.dataagent.session.DataAgentSession;
import io.vertx.core.AbstractVerticle;
import io.vertx.core.Promise;
import io.vertx.core.http.HttpServer;
import io.vertx.core.http.HttpServerOptions;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.RoutingContext;

/**
 * Verticle serving the agent's health and session status over HTTP.
 */
public class StatusApi extends AbstractVerticle {

  public static final int DEFAULT_PORT = 8089;

  private static final long startTime = System.currentTimeMillis();

  private final int port;
  private HttpServer server;

  public StatusApi() {
    this(Env.getInt("STATUS_PORT", DEFAULT_PORT));
  }

  public StatusApi(int port) {
    this.port = port;
  }

  @Override
  public void start(Promise<Void> startPromise) {
    Router router = Router.router(vertx);
    setRouter(router);

    server = vertx.createHttpServer(new HttpServerOptions().setPort(port).setHost("0.0.0.0"));
    server.requestHandler(router)
      .listen()
      .onSuccess(s -> {
        LogUtil.logInfo(vertx, "Status API listening on port " + s.actualPort(), "StatusApi", "StartUp", "Http");
        startPromise.complete();
      })
      .onFailure(err -> {
        LogUtil.logError(vertx, "Status API failed to start on port " + port, err, "StatusApi", "StartUp", "Http");
        startPromise.fail(err);
      });
  }

  @Override
  public void stop(Promise<Void> stopPromise) {
    if (server == null) {
      stopPromise.complete();
      return;
    }
    server.close().onComplete(ar -> stopPromise.complete());
  }

  public int actualPort() {
    return server == null ? -1 : server.actualPort();
  }

  private void setRouter(Router router) {
    router.get("/health").handler(ctx -> {
      Runtime runtime = Runtime.getRuntime();
      long usedMemory = runtime.totalMemory() - runtime.freeMemory();
      respond(ctx, 200, new JsonObject()
        .put("status", "healthy")
        .put("service", "data-agent")
        .put("timestamp", System.currentTimeMillis())
        .put("uptime", System.currentTimeMillis() - startTime)
        .put("memory", new JsonObject()
          .put("usedMB", usedMemory / 1048576)
          .put("maxMB", runtime.maxMemory() / 1048576)));
    });

    router.get("/agent/v1/status").handler(ctx ->
      vertx.eventBus().<JsonObject>request(DataAgentSession.STATUS_ADDRESS, new JsonObject())
        .onSuccess(reply -> respond(ctx, 200, reply.body()))
        .onFailure(err -> respond(ctx, 503, new JsonObject()
          .put("error", "Session not available")
          .put("message", err.getMessage())
          .put("timestamp", System.currentTimeMillis()))));
  }

  private static void respond(RoutingContext ctx, int statusCode, JsonObject body) {
    ctx.response()
      .putHeader("content-type", "application/json")
      .setStatusCode(statusCode)
      .end(body.encode());
  }
}
