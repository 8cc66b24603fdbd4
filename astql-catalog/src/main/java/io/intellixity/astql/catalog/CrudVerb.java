package io.intellixity.astql.catalog;

import java.util.Locale;

public enum CrudVerb {
  GET,
  LIST,
  CREATE,
  UPDATE,
  DELETE,
  COUNT;

  /** Lower-case name, e.g. {@code "list"}. */
  public String key() {
    return name().toLowerCase(Locale.ROOT);
  }
}
