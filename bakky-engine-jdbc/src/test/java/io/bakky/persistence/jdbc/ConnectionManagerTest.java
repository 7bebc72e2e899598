package io.bakky.persistence.jdbc;

import io.bakky.persistence.error.ConnectionException;
import io.bakky.persistence.error.QueryException;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class ConnectionManagerTest {

  @Test
  void inTransaction_commitsAndReleases() throws Exception {
    FakeDataSource ds = new FakeDataSource();
    ConnectionManager cm = new ConnectionManager("pg", ds, null);

    String out = cm.inTransaction(c -> "done");

    assertEquals("done", out);
    assertEquals(1, ds.commits.get());
    assertEquals(0, ds.rollbacks.get());
    assertEquals(1, ds.closed.get());
    assertEquals(List.of(false), ds.autoCommitModes);
  }

  @Test
  void inTransaction_rollsBackOnceAndReleasesOnFailure() {
    FakeDataSource ds = new FakeDataSource();
    ConnectionManager cm = new ConnectionManager("pg", ds, "app");

    SQLException ex = assertThrows(SQLException.class, () -> cm.inTransaction(c -> {
      throw new SQLException("boom", "42P01");
    }));

    assertEquals("boom", ex.getMessage());
    assertEquals(0, ds.commits.get());
    assertEquals(1, ds.rollbacks.get());
    assertEquals(1, ds.closed.get());
  }

  @Test
  void inTransaction_runtimeFailureAlsoRollsBack() {
    FakeDataSource ds = new FakeDataSource();
    ConnectionManager cm = new ConnectionManager("pg", ds, null);

    assertThrows(IllegalStateException.class, () -> cm.inTransaction(c -> {
      throw new IllegalStateException("bad row");
    }));
    assertEquals(1, ds.rollbacks.get());
    assertEquals(1, ds.closed.get());
  }

  @Test
  void withConnection_isAutocommitAndReleased() throws Exception {
    FakeDataSource ds = new FakeDataSource();
    ConnectionManager cm = new ConnectionManager("pg", ds, null);

    assertThrows(SQLException.class, () -> cm.withConnection(c -> {
      throw new SQLException("read failed");
    }));
    cm.withConnection(c -> null);

    assertEquals(List.of(true, true), ds.autoCommitModes);
    assertEquals(2, ds.closed.get());
    assertEquals(0, ds.rollbacks.get());
  }

  @Test
  void handshakeFailureIsConnectionException() {
    FakeDataSource ds = new FakeDataSource();
    ds.failOnAcquire = new SQLException("password authentication failed", "28P01");
    ConnectionManager cm = new ConnectionManager("pg", ds, null);

    ConnectionException ex = assertThrows(ConnectionException.class, cm::acquire);
    assertTrue(ex.getMessage().contains("password authentication failed"));
  }

  @Test
  void scopedConnection_rollsBackUnfinishedTransactionOnClose() {
    FakeDataSource ds = new FakeDataSource();
    ConnectionManager cm = new ConnectionManager("pg", ds, null);

    try (ScopedConnection sc = cm.acquire(true)) {
      assertTrue(sc.transactional());
    }
    assertEquals(1, ds.rollbacks.get());
    assertEquals(1, ds.closed.get());
  }

  @Test
  void handleExposesSchemaAsNamespace() {
    ConnectionManager cm = new ConnectionManager("pg", new FakeDataSource(), null);
    assertEquals("public", cm.namespace());
    assertEquals("pg", cm.id());
  }

  @Test
  void releaseFailureAfterCommitKeepsTheCommittedResult() throws Exception {
    FakeDataSource ds = new FakeDataSource();
    ds.failOnClose = new SQLException("connection reset", "08006");
    ConnectionManager cm = new ConnectionManager("pg", ds, null);

    long n = cm.inTransaction(c -> 1L);

    assertEquals(1L, n);
    assertEquals(1, ds.commits.get());
    assertEquals(1, ds.closed.get());
  }

  @Test
  void releaseFailureOnFailingTransactionIsSuppressed() {
    FakeDataSource ds = new FakeDataSource();
    ds.failOnClose = new SQLException("connection reset", "08006");
    ConnectionManager cm = new ConnectionManager("pg", ds, null);

    SQLException ex = assertThrows(SQLException.class, () -> cm.inTransaction(c -> {
      throw new SQLException("boom", "42P01");
    }));

    assertEquals("boom", ex.getMessage());
    assertEquals(1, ds.rollbacks.get());
  }

  @Test
  void scopedConnection_releaseFailureOfUnfinishedTransactionRaises() {
    FakeDataSource ds = new FakeDataSource();
    ds.failOnClose = new SQLException("connection reset", "08006");
    ConnectionManager cm = new ConnectionManager("pg", ds, null);

    ScopedConnection sc = cm.acquire(true);
    assertThrows(ConnectionException.class, sc::close);
    assertEquals(1, ds.rollbacks.get());
  }

  @Test
  void expiredGuardRefusesWork() {
    FakeDataSource ds = new FakeDataSource();
    ConnectionManager cm = new ConnectionManager("pg", ds, null);
    TransactionGuard guard = TransactionGuard.within(Duration.ofSeconds(30));
    assertTrue(guard.expire());

    assertThrows(QueryException.class, () -> cm.inTransaction(c -> "never", guard));
    assertEquals(0, ds.acquired.get());
  }

  @Test
  void guardThatExpiresDuringWorkRollsBackInsteadOfCommitting() {
    FakeDataSource ds = new FakeDataSource();
    ConnectionManager cm = new ConnectionManager("pg", ds, null);
    TransactionGuard guard = TransactionGuard.within(Duration.ofSeconds(30));

    assertThrows(QueryException.class, () -> cm.inTransaction(c -> guard.expire(), guard));

    assertEquals(0, ds.commits.get());
    assertEquals(1, ds.rollbacks.get());
    assertEquals(1, ds.closed.get());
  }
}
