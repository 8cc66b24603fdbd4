package io.intellixity.astql.catalog;

import java.util.ArrayList;
import java.util.List;

/**
 * One comma-separated entry of an {@code astql} field tag.
 * <pre>
 * astql:"index:btree,unique,security:tenant"
 * </pre>
 */
public record TagDirective(Type type, String argument, String raw) {
  public enum Type {
    /** {@code index:<kind>} */
    INDEX,
    /** {@code unique} */
    UNIQUE,
    /** {@code security:tenant} */
    TENANT,
    /** Anything else, including {@code relation:<name>}. */
    UNSUPPORTED
  }

  static List<TagDirective> parse(String tag) {
    if (tag == null || tag.isBlank()) return List.of();
    List<TagDirective> out = new ArrayList<>();
    for (String part : tag.split(",")) {
      String p = part.trim();
      if (p.isEmpty()) continue;
      out.add(parseOne(p));
    }
    return out;
  }

  private static TagDirective parseOne(String p) {
    if (p.equals("unique")) return new TagDirective(Type.UNIQUE, null, p);
    if (p.equals("security:tenant")) return new TagDirective(Type.TENANT, null, p);
    if (p.startsWith("index:")) {
      String kind = p.substring("index:".length()).trim();
      if (!kind.isEmpty()) return new TagDirective(Type.INDEX, kind, p);
    }
    return new TagDirective(Type.UNSUPPORTED, null, p);
  }
}
