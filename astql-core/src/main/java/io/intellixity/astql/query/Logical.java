package io.intellixity.astql.query;

/** Connector stored on a {@link Condition}; it joins that condition to the <em>next</em> one in the chain. */
public enum Logical {
  AND,
  OR
}
