package agents.dataagent.services;

import agents.dataagent.Driver;
import io.vertx.core.AbstractVerticle;
import io.vertx.core.AsyncResult;
import io.vertx.core.Future;
import io.vertx.core.Handler;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.file.AsyncFile;
import io.vertx.core.file.OpenOptions;

import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.LinkedList;
import java.util.List;

/**
 * Event-bus backed CSV log sink for the data agent.
 *
 * <p>Every component publishes lines of the form
 * <code>message,level,Class,Category,Subcategory</code> to the <code>log</code>
 * address. This verticle:</p>
 * <ul>
 *   <li>buffers the lines and appends them to <code>logs/current.csv</code> every 20&nbsp;seconds,</li>
 *   <li>rotates the file once a day into a timestamped CSV,</li>
 *   <li>keeps the latest {@value #MAX_HISTORIC_FILES} rotated files,</li>
 *   <li>flushes immediately on <code>saveAllDataToFiles_OnTermination</code>.</li>
 * </ul>
 */
public class Logger extends AbstractVerticle {

  public static final String LOG_ADDRESS = "log";
  public static final String FLUSH_ADDRESS = "saveAllDataToFiles_OnTermination";

  /* ---------- configuration ---------- */

  private static final long FLUSH_INTERVAL_MS  = 20_000;
  private static final long ROTATE_INTERVAL_MS = 86_400_000L;
  private static final int  MAX_HISTORIC_FILES = 12;
  private static final String HEADER = "Message,Level,Class,Category,Subcategory,SequenceReceived,EpochTimeMillis\n";
  private static final DateTimeFormatter FILE_STAMP =
          DateTimeFormatter.ofPattern("yyyyMMdd_HHmm").withZone(ZoneId.of("UTC"));

  /* ---------- state ---------- */

  private final LinkedList<String> buffer = new LinkedList<>();
  private final String logsDir;
  private final String currentFile;
  private int sequenceCounter = 0;
  private long currentBlockStart;
  private long flushTimerId = -1;

  public Logger() {
    this(Driver.AGENT_DATA_PATH + "/logs");
  }

  public Logger(String logsDir) {
    this.logsDir = logsDir;
    this.currentFile = logsDir + "/current.csv";
  }

  @Override
  public void start(io.vertx.core.Promise<Void> startPromise) {
    vertx.fileSystem().mkdirs(logsDir)
      .compose(v -> vertx.fileSystem().writeFile(currentFile, Buffer.buffer(HEADER)))
      .onSuccess(v -> {
        currentBlockStart = System.currentTimeMillis();
        setupConsumers();
        scheduleFlush();
        vertx.eventBus().publish("logger.ready", "true");
        startPromise.complete();
      })
      .onFailure(err -> {
        // Without a writable log directory there is nowhere to report this but stderr
        System.err.println("Logger could not prepare " + logsDir + ": " + err.getMessage());
        startPromise.fail(err);
      });
  }

  @Override
  public void stop(io.vertx.core.Promise<Void> stopPromise) {
    if (flushTimerId >= 0) {
      vertx.cancelTimer(flushTimerId);
    }
    flushBuffer(ar -> stopPromise.complete());
  }

  /** Number of lines waiting for the next flush. */
  int pendingLines() {
    return buffer.size();
  }

  private void setupConsumers() {
    vertx.eventBus().<String>consumer(LOG_ADDRESS, msg -> {
      sequenceCounter++;
      buffer.add(msg.body() + "," + sequenceCounter + "," + System.currentTimeMillis() + "\n");
    });

    vertx.eventBus().consumer(FLUSH_ADDRESS, m -> flushBuffer(ar -> {
      if (m.replyAddress() != null) {
        m.reply(ar.succeeded());
      }
    }));
  }

  private void scheduleFlush() {
    flushTimerId = vertx.setPeriodic(FLUSH_INTERVAL_MS, id -> {
      long now = System.currentTimeMillis();
      if (now - currentBlockStart >= ROTATE_INTERVAL_MS) {
        rotate(now, r -> flushBuffer(null));
      } else {
        flushBuffer(null);
      }
    });
  }

  private void flushBuffer(Handler<AsyncResult<Void>> handler) {
    if (buffer.isEmpty()) {
      if (handler != null) handler.handle(Future.succeededFuture());
      return;
    }

    StringBuilder sb = new StringBuilder();
    buffer.forEach(sb::append);
    buffer.clear();

    vertx.fileSystem().open(currentFile, new OpenOptions().setAppend(true)).onComplete(openRes -> {
      if (openRes.succeeded()) {
        AsyncFile file = openRes.result();
        file.write(Buffer.buffer(sb.toString())).onComplete(wr -> {
          file.close();
          if (handler != null) handler.handle(wr.mapEmpty());
        });
      } else if (handler != null) {
        handler.handle(openRes.mapEmpty());
      }
    });
  }

  private void rotate(long now, Handler<AsyncResult<Void>> after) {
    String rotatedPath = logsDir + "/" + FILE_STAMP.format(Instant.ofEpochMilli(currentBlockStart)) + ".csv";

    flushBuffer(flush -> {
      if (flush.failed()) {
        after.handle(flush);
        return;
      }
      vertx.fileSystem().move(currentFile, rotatedPath)
        .compose(v -> {
          currentBlockStart = now;
          return vertx.fileSystem().writeFile(currentFile, Buffer.buffer(HEADER));
        })
        .onComplete(ar -> {
          if (ar.succeeded()) {
            cleanupOld();
          }
          after.handle(ar.mapEmpty());
        });
    });
  }

  private void cleanupOld() {
    vertx.fileSystem().readDir(logsDir, ".*\\.csv").onSuccess(files -> {
      List<String> history = files.stream()
              .filter(p -> !p.endsWith("current.csv"))
              .sorted()
              .toList();

      int excess = history.size() - MAX_HISTORIC_FILES;
      if (excess > 0) {
        history.subList(0, excess).forEach(p -> vertx.fileSystem().delete(p));
      }
    });
  }
}
