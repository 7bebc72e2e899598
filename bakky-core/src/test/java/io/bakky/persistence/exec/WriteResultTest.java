package io.bakky.persistence.exec;

import io.bakky.persistence.error.ConflictException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class WriteResultTest {
  @Test
  void failedResult_rethrowsTypedError() {
    WriteResult r = WriteResult.failed(new ConflictException("duplicate key"));
    assertFalse(r.success());
    assertEquals(0, r.rowCount());
    assertTrue(r.failure().isPresent());
    assertThrows(ConflictException.class, r::orThrow);
  }

  @Test
  void okResult_passesThrough() {
    WriteResult r = WriteResult.ok(3);
    assertSame(r, r.orThrow());
    assertEquals(3, r.rowCount());
  }

  @Test
  void inconsistentResultsAreRejected() {
    assertThrows(IllegalArgumentException.class, () -> new WriteResult(true, 1, new ConflictException("x")));
    assertThrows(IllegalArgumentException.class, () -> new WriteResult(false, 0, null));
  }
}
