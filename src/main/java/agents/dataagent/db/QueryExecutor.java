package agents.dataagent.db;

import io.vertx.core.Future;

/**
 * Runs raw SQL against one data source.
 * Implementations report SQL errors in the {@link QueryResult}; the future only fails on programming errors.
 */
public interface QueryExecutor {

  Future<QueryResult> execute(String sql);
}
