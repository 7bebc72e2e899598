package io.bakky.persistence.jdbc.async;

import io.bakky.persistence.jdbc.ConnectionManager;
import io.bakky.persistence.jdbc.SqlWork;
import io.bakky.persistence.jdbc.TransactionGuard;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Asynchronous counterpart of {@link ConnectionManager}.\n
 *
 * Acquisition, execution and release all run on the worker; the returned future completes after the
 * connection has been released.\n
 *
 * A deadline fails the future with {@link TimeoutException} and expires the work's {@link TransactionGuard}:
 * the statement in flight is cancelled and a transaction that was still running rolls back instead of
 * committing. Work that reached its commit before the deadline completes normally. The worker still
 * releases its connection when the blocked call returns.
 */
public final class AsyncConnectionManager implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(AsyncConnectionManager.class);

  private final ConnectionManager connections;
  private final ExecutorService executor;
  private final boolean ownsExecutor;
  private final Duration defaultTimeout;

  public AsyncConnectionManager(ConnectionManager connections, ExecutorService executor, Duration defaultTimeout) {
    this(connections, executor, false, defaultTimeout);
  }

  private AsyncConnectionManager(ConnectionManager connections, ExecutorService executor, boolean ownsExecutor,
                                 Duration defaultTimeout) {
    this.connections = Objects.requireNonNull(connections, "connections");
    this.executor = Objects.requireNonNull(executor, "executor");
    this.ownsExecutor = ownsExecutor;
    this.defaultTimeout = defaultTimeout == null ? Duration.ZERO : defaultTimeout;
  }

  /** Manager with its own fixed worker pool, shut down by {@link #close()}. */
  public static AsyncConnectionManager withWorkers(ConnectionManager connections, int workers, Duration defaultTimeout) {
    if (workers <= 0) throw new IllegalArgumentException("workers must be > 0");
    ExecutorService pool = Executors.newFixedThreadPool(workers, new WorkerThreads(connections.id()));
    return new AsyncConnectionManager(connections, pool, true, defaultTimeout);
  }

  public ConnectionManager connections() { return connections; }

  public <T> CompletableFuture<T> withConnection(SqlWork<T> work) {
    return withConnection(work, defaultTimeout);
  }

  public <T> CompletableFuture<T> withConnection(SqlWork<T> work, Duration timeout) {
    Objects.requireNonNull(work, "work");
    return submit(guard -> {
      try {
        return connections.withConnection(work, guard);
      } catch (SQLException e) {
        throw new CompletionException(e);
      }
    }, timeout);
  }

  public <T> CompletableFuture<T> inTransaction(SqlWork<T> work) {
    return inTransaction(work, defaultTimeout);
  }

  public <T> CompletableFuture<T> inTransaction(SqlWork<T> work, Duration timeout) {
    Objects.requireNonNull(work, "work");
    return submit(guard -> {
      try {
        return connections.inTransaction(work, guard);
      } catch (SQLException e) {
        throw new CompletionException(e);
      }
    }, timeout);
  }

  /** Runs blocking work on the same workers under a deadline guard (used by the async data engine). */
  public <T> CompletableFuture<T> submit(Function<TransactionGuard, T> work, Duration timeout) {
    Objects.requireNonNull(work, "work");
    TransactionGuard guard = TransactionGuard.within(timeout);
    CompletableFuture<T> running = CompletableFuture.supplyAsync(() -> {
      try {
        return work.apply(guard);
      } finally {
        // past this point the deadline can no longer fail the caller
        guard.beginCommit();
      }
    }, executor);
    if (!guard.bounded()) return running;

    CompletableFuture<T> out = new CompletableFuture<>();
    running.whenComplete((v, e) -> {
      if (e != null) out.completeExceptionally(e);
      else out.complete(v);
    });
    long millis = timeout.toMillis();
    CompletableFuture.delayedExecutor(millis, TimeUnit.MILLISECONDS).execute(() -> {
      if (guard.expire()) {
        log.warn("bakky.jdbc_async op=DEADLINE handleId={} timeoutMs={}", connections.id(), millis);
        out.completeExceptionally(new TimeoutException("Deadline of " + millis + " ms expired on handle " + connections.id()));
      }
    });
    return out;
  }

  public Duration defaultTimeout() { return defaultTimeout; }

  @Override
  public void close() {
    if (!ownsExecutor) return;
    executor.shutdown();
    try {
      if (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
        log.warn("bakky.jdbc_async op=SHUTDOWN handleId={} forced=true", connections.id());
        executor.shutdownNow();
      }
    } catch (InterruptedException e) {
      executor.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }

  private static final class WorkerThreads implements ThreadFactory {
    private final String prefix;
    private final AtomicInteger n = new AtomicInteger();

    WorkerThreads(String handleId) {
      this.prefix = "bakky-jdbc-" + handleId + "-";
    }

    @Override
    public Thread newThread(Runnable r) {
      Thread t = new Thread(r, prefix + n.incrementAndGet());
      t.setDaemon(true);
      return t;
    }
  }
}
