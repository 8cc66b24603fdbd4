package io.intellixity.astql.query;

import java.util.Objects;

/**
 * Base for every typed failure raised while building, validating or rendering a {@link QueryAst}.
 * <p>
 * Nothing in this library retries; callers decide whether to surface, retry or translate.
 */
public class AstqlException extends RuntimeException {
  private final ErrorKind kind;

  public AstqlException(ErrorKind kind, String message) {
    super(message);
    this.kind = Objects.requireNonNull(kind, "kind");
  }

  public AstqlException(ErrorKind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = Objects.requireNonNull(kind, "kind");
  }

  public ErrorKind kind() { return kind; }
}
