package io.intellixity.astql.query;

import java.util.Objects;

/** Projection entry; {@code alias} is null when absent. */
public record SelectField(String name, String alias) {
  public SelectField {
    Objects.requireNonNull(name, "name");
    if (alias != null && alias.isBlank()) alias = null;
  }

  public static SelectField of(String name) { return new SelectField(name, null); }

  public boolean hasAlias() { return alias != null; }
}
