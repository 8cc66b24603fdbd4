package io.intellixity.astql.spi;

import io.intellixity.astql.query.AstqlException;
import io.intellixity.astql.query.ErrorKind;

/** A valid AST that a particular renderer cannot express. */
public final class RenderException extends AstqlException {
  private final String rendererId;

  public RenderException(String rendererId, ErrorKind kind, String message) {
    super(kind, "[" + rendererId + "] " + message);
    this.rendererId = rendererId;
  }

  public String rendererId() { return rendererId; }
}
