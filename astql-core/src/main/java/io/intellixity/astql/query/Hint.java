package io.intellixity.astql.query;

import java.util.Objects;

/** Opaque provider-specific directive; the core never interprets it. */
public record Hint(String provider, String type, String value) {
  public Hint {
    Objects.requireNonNull(provider, "provider");
    Objects.requireNonNull(type, "type");
  }
}
