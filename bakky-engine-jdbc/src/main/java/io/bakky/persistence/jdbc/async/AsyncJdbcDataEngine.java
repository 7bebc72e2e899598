package io.bakky.persistence.jdbc.async;

import io.bakky.persistence.exec.WriteResult;
import io.bakky.persistence.jdbc.ConflictPolicy;
import io.bakky.persistence.jdbc.JdbcDataEngine;
import io.bakky.persistence.jdbc.ReadShape;
import io.bakky.persistence.jdbc.UpsertOptions;
import io.bakky.persistence.jdbc.UpsertResult;
import io.bakky.persistence.rowset.RowSet;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Non-blocking facade over {@link JdbcDataEngine}: same operations and result contract,
 * executed on the workers of an {@link AsyncConnectionManager} under its deadline.
 * A write whose deadline expires before commit rolls back.
 */
public final class AsyncJdbcDataEngine {
  private final JdbcDataEngine engine;
  private final AsyncConnectionManager async;

  public AsyncJdbcDataEngine(JdbcDataEngine engine, AsyncConnectionManager async) {
    this.engine = Objects.requireNonNull(engine, "engine");
    this.async = Objects.requireNonNull(async, "async");
    if (engine.connections() != async.connections()) {
      throw new IllegalArgumentException("engine and async manager must share one ConnectionManager");
    }
  }

  public JdbcDataEngine blocking() { return engine; }

  public CompletableFuture<WriteResult> insert(String table, RowSet rows, ConflictPolicy policy) {
    return async.submit(g -> engine.insert(table, rows, policy, g), async.defaultTimeout());
  }

  public CompletableFuture<UpsertResult> upsert(String table, RowSet rows, UpsertOptions options) {
    return async.submit(g -> engine.upsert(table, rows, options, g), async.defaultTimeout());
  }

  public <R> CompletableFuture<R> read(String sql, List<?> params, ReadShape<R> shape) {
    return read(sql, params, shape, async.defaultTimeout());
  }

  public <R> CompletableFuture<R> read(String sql, List<?> params, ReadShape<R> shape, Duration timeout) {
    return async.submit(g -> engine.read(sql, params, shape, g), timeout);
  }

  public CompletableFuture<WriteResult> delete(String table, Map<String, ?> conditions) {
    return async.submit(g -> engine.delete(table, conditions, g), async.defaultTimeout());
  }

  public CompletableFuture<WriteResult> update(String table, Map<String, ?> values, Map<String, ?> conditions) {
    return async.submit(g -> engine.update(table, values, conditions, g), async.defaultTimeout());
  }

  public CompletableFuture<WriteResult> execute(String sql, List<?> params) {
    return async.submit(g -> engine.execute(sql, params, g), async.defaultTimeout());
  }
}
