package io.intellixity.astql.query;

/**
 * Raised when a {@link QueryAst} violates a structural invariant.
 * <p>
 * Thrown by {@link QueryValidator} from {@link QueryBuilder#build()} and again by every renderer as a safety net.
 */
public final class QueryValidationException extends AstqlException {
  public QueryValidationException(ErrorKind kind, String message) {
    super(kind, message);
  }
}
