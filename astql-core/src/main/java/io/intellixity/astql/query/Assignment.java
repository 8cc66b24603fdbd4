package io.intellixity.astql.query;

import java.util.Objects;

/** A {@code field = value} pair inside an insert row or an update set. */
public record Assignment(String field, Value value) {
  public Assignment {
    Objects.requireNonNull(field, "field");
    value = (value == null) ? Value.NULL : value;
  }
}
