package io.intellixity.astql.query;

/** Failure categories shared by the validator, the renderers and the catalog. */
public enum ErrorKind {
  MISSING_TARGET,
  MISSING_INSERT_VALUES,
  MISSING_UPDATE_FIELDS,

  UNSUPPORTED_OPERATOR,
  UNSUPPORTED_OPERATION,
  UNSUPPORTED_CLAUSE,
  MALFORMED_BETWEEN,
  MALFORMED_ROW,
  MALFORMED_VALUE,
  PARAM_COLLISION,

  UNSUPPORTED_DIRECTIVE
}
