package io.bakky.persistence.jdbc;

import io.bakky.persistence.error.QueryException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Deadline shared by the caller that waits and the worker that runs one unit of work.\n
 *
 * Exactly one side wins: either the worker reaches {@link #beginCommit()} first and the work completes,
 * or {@link #expire()} fires first, the running statement is cancelled and the worker can no longer commit.
 */
public final class TransactionGuard {
  private static final Logger log = LoggerFactory.getLogger(TransactionGuard.class);

  private enum State { RUNNING, FINISHING, EXPIRED }

  private final AtomicReference<State> state = new AtomicReference<>(State.RUNNING);
  private final AtomicReference<Statement> active = new AtomicReference<>();
  private final long deadlineNanos;
  private final boolean bounded;

  private TransactionGuard(long deadlineNanos, boolean bounded) {
    this.deadlineNanos = deadlineNanos;
    this.bounded = bounded;
  }

  /** Guard that never expires. */
  public static TransactionGuard none() {
    return new TransactionGuard(0L, false);
  }

  /** Guard expiring {@code timeout} from now; zero, negative or null means no deadline. */
  public static TransactionGuard within(Duration timeout) {
    if (timeout == null || timeout.isZero() || timeout.isNegative()) return none();
    return new TransactionGuard(System.nanoTime() + timeout.toNanos(), true);
  }

  public boolean bounded() { return bounded; }

  public boolean expired() { return state.get() == State.EXPIRED; }

  /**
   * Marks the deadline as passed and cancels the statement in flight.
   *
   * @return false when the worker already started to finish; its outcome then stands
   */
  public boolean expire() {
    if (!state.compareAndSet(State.RUNNING, State.EXPIRED)) return false;
    Statement s = active.getAndSet(null);
    if (s != null) {
      try {
        s.cancel();
        log.debug("bakky.jdbc op=CANCEL reason=deadline");
      } catch (SQLException e) {
        log.warn("bakky.jdbc op=CANCEL reason=deadline failed: {}", e.getMessage());
      }
    }
    return true;
  }

  /**
   * Claims the right to commit.
   *
   * @return false when the deadline already expired; the caller must roll back
   */
  public boolean beginCommit() {
    return state.compareAndSet(State.RUNNING, State.FINISHING) || state.get() == State.FINISHING;
  }

  /** @throws QueryException when the deadline has already expired */
  public void checkOpen(String op) {
    if (expired()) throw new QueryException(op + " abandoned: deadline expired");
  }

  /** Statement to cancel if the deadline fires while it runs. */
  public void track(Statement s) {
    active.set(s);
    if (expired() && active.compareAndSet(s, null)) {
      try {
        s.cancel();
      } catch (SQLException e) {
        log.warn("bakky.jdbc op=CANCEL reason=deadline failed: {}", e.getMessage());
      }
    }
  }

  /**
   * Query timeout for the next statement: the configured seconds, capped by what is left of the deadline.
   * Zero means unbounded.
   */
  public int queryTimeoutSeconds(int configuredSeconds) {
    if (!bounded) return configuredSeconds;
    long leftNanos = deadlineNanos - System.nanoTime();
    int left = (int) Math.max(1, (leftNanos + 999_999_999L) / 1_000_000_000L);
    return configuredSeconds > 0 ? Math.min(configuredSeconds, left) : left;
  }
}
