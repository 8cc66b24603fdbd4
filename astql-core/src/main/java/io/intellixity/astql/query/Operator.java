package io.intellixity.astql.query;

public enum Operator {
  EQ(Arity.BINARY),
  NE(Arity.BINARY),
  GT(Arity.BINARY),
  GE(Arity.BINARY),
  LT(Arity.BINARY),
  LE(Arity.BINARY),

  IN(Arity.LIST),
  NOT_IN(Arity.LIST),

  LIKE(Arity.BINARY),
  REGEX(Arity.BINARY),

  IS_NULL(Arity.UNARY),
  IS_NOT_NULL(Arity.UNARY),

  BETWEEN(Arity.PAIR),

  // Document-store oriented
  EXISTS(Arity.UNARY);

  /** How many operands the condition value carries. */
  public enum Arity {
    /** No value is read. */
    UNARY,
    /** One scalar (or pattern) value. */
    BINARY,
    /** A {@link Value.ListValue}. */
    LIST,
    /** Exactly two bounds: a {@link Value.PairValue} or a two-element {@link Value.ListValue}. */
    PAIR
  }

  private final Arity arity;

  Operator(Arity arity) {
    this.arity = arity;
  }

  public Arity arity() {
    return arity;
  }

  public boolean usesValue() {
    return arity != Arity.UNARY;
  }
}
