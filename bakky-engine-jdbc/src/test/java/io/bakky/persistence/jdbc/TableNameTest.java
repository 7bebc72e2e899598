package io.bakky.persistence.jdbc;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class TableNameTest {
  @Test
  void splitsOnFirstDotOnly() {
    TableName t = TableName.parse("sat_1.readings.raw");
    assertEquals("sat_1", t.schema());
    assertEquals("readings.raw", t.table());
  }

  @Test
  void bareNameUsesDefaultSchema() {
    assertEquals(new TableName("public", "t"), TableName.parse("t"));
    assertEquals(new TableName("app", "t"), TableName.parse(" t ", "app"));
    assertEquals(new TableName("public", "t"), TableName.parse("t", null));
  }

  @Test
  void blankPartsAreRejected() {
    assertThrows(IllegalArgumentException.class, () -> TableName.parse(".t"));
    assertThrows(IllegalArgumentException.class, () -> TableName.parse("s."));
  }
}
