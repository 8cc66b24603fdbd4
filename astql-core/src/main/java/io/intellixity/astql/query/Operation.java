package io.intellixity.astql.query;

public enum Operation {
  SELECT,
  INSERT,
  UPDATE,
  DELETE,
  COUNT,
  /** Reserved: no builder entry point and no bundled renderer handles it. */
  AGGREGATE
}
