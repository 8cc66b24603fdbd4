package io.intellixity.astql.query;

import java.util.Objects;

/**
 * Structural validation for {@link QueryAst}.
 * <p>
 * Checks, in order:
 * <ul>
 *   <li>target is non-blank</li>
 *   <li>INSERT carries at least one row</li>
 *   <li>UPDATE carries at least one assignment</li>
 * </ul>
 * The first violation is thrown as {@link QueryValidationException}; errors are not aggregated.
 */
public final class QueryValidator {
  private QueryValidator() {}

  public static void validate(QueryAst ast) {
    Objects.requireNonNull(ast, "ast");

    if (ast.target() == null || ast.target().isBlank()) {
      throw new QueryValidationException(ErrorKind.MISSING_TARGET, "target (table/collection) is required");
    }

    switch (ast.operation()) {
      case INSERT -> {
        if (ast.values().isEmpty()) {
          throw new QueryValidationException(ErrorKind.MISSING_INSERT_VALUES,
              "INSERT into '" + ast.target() + "' requires at least one row");
        }
      }
      case UPDATE -> {
        if (ast.updates().isEmpty()) {
          throw new QueryValidationException(ErrorKind.MISSING_UPDATE_FIELDS,
              "UPDATE of '" + ast.target() + "' requires at least one field to set");
        }
      }
      default -> {
        // SELECT/COUNT may project everything; DELETE needs nothing beyond a target.
      }
    }
  }

  /** Non-throwing form. */
  public static boolean isValid(QueryAst ast) {
    try {
      validate(ast);
      return true;
    } catch (QueryValidationException e) {
      return false;
    }
  }
}
