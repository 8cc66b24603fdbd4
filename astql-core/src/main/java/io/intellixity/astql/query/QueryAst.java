package io.intellixity.astql.query;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;

import java.util.*;

/**
 * Backend-agnostic description of a single data operation.
 * <p>
 * Instances are deeply immutable: every collection is copied on construction and every {@link Value} is immutable,
 * so one AST can be handed to any number of renderers on any number of threads. Construct through
 * {@link QueryBuilder} (validated) or the canonical constructor (renderers validate again).
 */
@JsonSerialize(using = QueryAstJsonSerializer.class)
@JsonDeserialize(using = QueryAstJsonDeserializer.class)
public record QueryAst(
    Operation operation,
    String target,
    List<SelectField> fields,
    List<Condition> conditions,
    List<Join> joins,
    List<SortField> ordering,
    List<String> grouping,
    List<Condition> having,
    Integer limit,
    Integer offset,
    List<Row> values,
    List<Assignment> updates,
    List<String> returning,
    List<Hint> hints
) {
  public QueryAst {
    Objects.requireNonNull(operation, "operation");
    fields = copy(fields);
    conditions = copy(conditions);
    joins = copy(joins);
    ordering = copy(ordering);
    grouping = copy(grouping);
    having = copy(having);
    values = copy(values);
    updates = Row.sorted(updates);
    returning = copy(returning);
    hints = copy(hints);
  }

  /** Re-open as a builder; changes to the builder never reach this instance. */
  public QueryBuilder toBuilder() {
    return QueryBuilder.from(this);
  }

  public boolean hasConditions() { return !conditions.isEmpty(); }

  /** Value assigned to {@code field} by the update set, or null. */
  public Value update(String field) {
    for (Assignment a : updates) {
      if (a.field().equals(field)) return a.value();
    }
    return null;
  }

  private static <T> List<T> copy(List<T> in) {
    return (in == null) ? List.of() : List.copyOf(in);
  }
}
