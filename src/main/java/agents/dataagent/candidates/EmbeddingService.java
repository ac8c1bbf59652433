package agents.dataagent.candidates;

import io.vertx.core.Future;

import java.util.List;

/**
 * Turns text into embedding vectors for the candidate store.
 */
public interface EmbeddingService {

  Future<float[]> embed(String text);

  /**
   * Embed a batch; the result is in the order of {@code texts}.
   */
  Future<List<float[]>> embedAll(List<String> texts);
}
