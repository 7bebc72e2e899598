package io.bakky.persistence.jdbc;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * What a batched insert does when a row hits a unique key.\n
 *
 * - {@link Fail}: plain insert, the conflict fails the batch\n
 * - {@link UpdateExcluded}: {@code ON CONFLICT (keys) DO UPDATE SET c = EXCLUDED.c} for non-key columns\n
 * - {@link UpdateWith}: same target, caller-supplied {@code column = expression} assignments instead\n
 */
public sealed interface ConflictPolicy permits ConflictPolicy.Fail, ConflictPolicy.UpdateExcluded, ConflictPolicy.UpdateWith {

  static ConflictPolicy fail() {
    return Fail.INSTANCE;
  }

  /** An empty key list means no conflict handling, like the plain insert. */
  static ConflictPolicy updateOnConflict(List<String> uniqueColumns) {
    if (uniqueColumns == null || uniqueColumns.isEmpty()) return fail();
    return new UpdateExcluded(uniqueColumns);
  }

  /**
   * Expressions are raw SQL (e.g. {@code "score + EXCLUDED.score"}); only the assigned column names are quoted.
   * A null or empty map falls back to {@link #updateOnConflict(List)}.
   */
  static ConflictPolicy updateOnConflict(List<String> uniqueColumns, Map<String, String> assignments) {
    if (assignments == null || assignments.isEmpty()) return updateOnConflict(uniqueColumns);
    if (uniqueColumns == null || uniqueColumns.isEmpty()) return fail();
    return new UpdateWith(uniqueColumns, assignments);
  }

  final class Fail implements ConflictPolicy {
    static final Fail INSTANCE = new Fail();

    private Fail() {}

    @Override public String toString() { return "Fail"; }
  }

  record UpdateExcluded(List<String> uniqueColumns) implements ConflictPolicy {
    public UpdateExcluded {
      uniqueColumns = List.copyOf(uniqueColumns);
    }
  }

  record UpdateWith(List<String> uniqueColumns, Map<String, String> assignments) implements ConflictPolicy {
    public UpdateWith {
      uniqueColumns = List.copyOf(uniqueColumns);
      Objects.requireNonNull(assignments, "assignments");
      assignments = Collections.unmodifiableMap(new LinkedHashMap<>(assignments));
    }
  }
}
