package io.intellixity.astql.query;

import java.util.Objects;

/**
 * Join against another table; {@code condition} is raw predicate text copied verbatim by SQL renderers.
 * Never build it from user input.
 */
public record Join(String joinType, String target, String condition) {
  public Join {
    Objects.requireNonNull(target, "target");
    joinType = (joinType == null || joinType.isBlank()) ? "INNER" : joinType.trim().toUpperCase();
  }
}
