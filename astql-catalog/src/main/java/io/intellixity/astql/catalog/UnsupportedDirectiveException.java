package io.intellixity.astql.catalog;

import io.intellixity.astql.query.AstqlException;
import io.intellixity.astql.query.ErrorKind;

/** An {@code astql} tag directive the catalog does not implement, e.g. {@code relation:orders}. */
public final class UnsupportedDirectiveException extends AstqlException {
  private final String field;
  private final String directive;

  public UnsupportedDirectiveException(String field, String directive) {
    super(ErrorKind.UNSUPPORTED_DIRECTIVE, "Unsupported astql directive '" + directive + "' on field '" + field + "'");
    this.field = field;
    this.directive = directive;
  }

  public String field() { return field; }
  public String directive() { return directive; }
}
