package io.bakky.persistence.rowset;

import io.bakky.persistence.error.ValidationException;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class RowSetTest {

  @Test
  void columnMap_expandsToRowsInColumnOrder() {
    Map<String, List<Object>> cols = new LinkedHashMap<>();
    cols.put("name", List.of("a", "b"));
    cols.put("score", List.of(1, 2));
    RowSet rs = RowSet.ofColumns(cols);

    assertEquals(DataShape.COLUMNS, rs.shape());
    assertEquals(2, rs.size());
    assertEquals(List.of("name", "score"), rs.columns());
    assertEquals(Map.of("name", "b", "score", 2), rs.rows().get(1));

    RowBatch b = rs.toBatch();
    assertEquals(List.of("name", "score"), b.columns());
    assertEquals(List.of("a", 1), b.rows().get(0));
  }

  @Test
  void columnMap_rejectsRaggedColumns() {
    Map<String, List<Object>> cols = new LinkedHashMap<>();
    cols.put("name", List.of("a", "b"));
    cols.put("score", List.of(1));
    assertThrows(ValidationException.class, () -> RowSet.ofColumns(cols));
  }

  @Test
  void frame_rejectsRowOfWrongWidth() {
    ValidationException ex = assertThrows(ValidationException.class,
        () -> RowSet.ofFrame(List.of("a", "b"), List.of(List.of(1, 2), List.of(3))));
    assertTrue(ex.getMessage().contains("row 1"));
  }

  @Test
  void frame_rejectsDuplicateColumns() {
    assertThrows(ValidationException.class, () -> RowSet.ofFrame(List.of("a", "a"), List.of()));
  }

  @Test
  void frame_keepsNullValues() {
    RowSet.Frame f = RowSet.ofFrame(List.of("a", "b"), List.of(Arrays.asList(1, null)));
    assertNull(f.rows().get(0).get("b"));
    assertEquals(Arrays.asList((Object) null), f.column("b"));
  }

  @Test
  void records_heterogeneousColumnsFailOnBatch() {
    RowSet rs = RowSet.of(Map.of("name", "a", "score", 1), Map.of("name", "b"));
    assertEquals(2, rs.size());
    ValidationException ex = assertThrows(ValidationException.class, rs::toBatch);
    assertEquals("validation", ex.kind());
  }

  @Test
  void records_sameColumnsInDifferentOrderAreAligned() {
    Map<String, Object> r1 = new LinkedHashMap<>();
    r1.put("a", 1);
    r1.put("b", 2);
    Map<String, Object> r2 = new LinkedHashMap<>();
    r2.put("b", 20);
    r2.put("a", 10);

    RowBatch b = RowSet.ofRecords(List.of(r1, r2)).toBatch();
    assertEquals(List.of("a", "b"), b.columns());
    assertEquals(List.of(10, 20), b.rows().get(1));
  }

  @Test
  void records_allowNullValues() {
    Map<String, Object> r = new HashMap<>();
    r.put("a", null);
    RowBatch b = RowSet.ofRecords(List.of(r)).toBatch();
    assertNull(b.rows().get(0).get(0));
  }

  @Test
  void emptySetsHaveNoColumns() {
    assertTrue(RowSet.ofRecords(List.of()).isEmpty());
    assertEquals(List.of(), RowSet.ofRecords(List.of()).columns());
    assertTrue(RowSet.ofColumns(Map.of()).toBatch().isEmpty());
  }
}
