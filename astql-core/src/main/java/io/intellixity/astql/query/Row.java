package io.intellixity.astql.query;

import java.util.*;

/**
 * One insert row: assignments kept sorted by field name so every renderer sees the same column order.
 */
public record Row(List<Assignment> assignments) {
  public Row {
    assignments = sorted(assignments);
  }

  public static Row of(Map<String, ?> values) {
    return new Row(assignmentsOf(values));
  }

  public List<String> fields() {
    List<String> out = new ArrayList<>(assignments.size());
    for (Assignment a : assignments) out.add(a.field());
    return out;
  }

  /** Value for {@code field}, or null when the row has no such column. */
  public Value get(String field) {
    for (Assignment a : assignments) {
      if (a.field().equals(field)) return a.value();
    }
    return null;
  }

  public boolean isEmpty() { return assignments.isEmpty(); }

  static List<Assignment> assignmentsOf(Map<String, ?> values) {
    if (values == null || values.isEmpty()) return List.of();
    List<Assignment> out = new ArrayList<>(values.size());
    for (var e : values.entrySet()) {
      out.add(new Assignment(Objects.requireNonNull(e.getKey(), "field"), Value.of(e.getValue())));
    }
    return out;
  }

  /** Sort by field name; a repeated field keeps its last value. */
  static List<Assignment> sorted(List<Assignment> assignments) {
    if (assignments == null || assignments.isEmpty()) return List.of();
    TreeMap<String, Assignment> byField = new TreeMap<>();
    for (Assignment a : assignments) {
      Objects.requireNonNull(a, "assignment");
      byField.put(a.field(), a);
    }
    return List.copyOf(byField.values());
  }
}
