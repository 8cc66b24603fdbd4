package io.intellixity.astql.query;

import java.util.Objects;

/**
 * One predicate in a flat condition chain.
 * <p>
 * {@code logical} joins this condition to the one that follows it; on the last condition it is ignored.
 * {@code paramName} is the key the value is bound under by parameterized renderers.
 */
public record Condition(String field, Operator operator, Value value, Logical logical, String paramName) {
  public Condition {
    Objects.requireNonNull(field, "field");
    Objects.requireNonNull(operator, "operator");
    value = (value == null) ? Value.NULL : value;
    logical = (logical == null) ? Logical.AND : logical;
    paramName = (paramName == null || paramName.isBlank()) ? paramNameFor(field) : paramName;
  }

  public static Condition of(String field, Operator operator, Object value) {
    return new Condition(field, operator, Value.of(value), Logical.AND, paramNameFor(field));
  }

  public Condition withLogical(Logical logical) {
    return new Condition(field, operator, value, logical, paramName);
  }

  public Condition withParamName(String paramName) {
    return new Condition(field, operator, value, logical, paramName);
  }

  /** {@code "u.id"} becomes {@code "u_id"}. */
  public static String paramNameFor(String field) {
    return field.replace('.', '_');
  }
}
