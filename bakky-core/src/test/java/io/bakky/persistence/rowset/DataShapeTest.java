package io.bakky.persistence.rowset;

import io.bakky.persistence.error.UnsupportedShapeException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class DataShapeTest {
  @Test
  void resolvesNamesAndAliasesIgnoringCase() {
    assertEquals(DataShape.COLUMNS, DataShape.of("DICT"));
    assertEquals(DataShape.FRAME, DataShape.of("polars"));
    assertEquals(DataShape.FRAME, DataShape.of(" Frame "));
    assertEquals(DataShape.RECORDS, DataShape.of("list"));
  }

  @Test
  void unknownShapeRaises() {
    UnsupportedShapeException ex = assertThrows(UnsupportedShapeException.class, () -> DataShape.of("arrow"));
    assertEquals("arrow", ex.shape());
    assertThrows(UnsupportedShapeException.class, () -> DataShape.of(null));
  }
}
