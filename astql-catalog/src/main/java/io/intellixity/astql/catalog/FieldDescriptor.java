package io.intellixity.astql.catalog;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One persisted field of an entity.
 *
 * @param name     declared field name
 * @param jsonName wire name; {@code "-"} hides the field from generated queries
 * @param dbColumn explicit column, wins over {@code jsonName}
 * @param tags     struct-tag style metadata; {@code db} overrides the column, {@code astql} carries directives
 */
public record FieldDescriptor(String name, String jsonName, String dbColumn, Map<String, String> tags) {
  public static final String DB_TAG = "db";
  public static final String ASTQL_TAG = "astql";

  public FieldDescriptor {
    Objects.requireNonNull(name, "name");
    tags = (tags == null) ? Map.of() : Map.copyOf(tags);
  }

  public static FieldDescriptor of(String name) {
    return new FieldDescriptor(name, null, null, Map.of());
  }

  public FieldDescriptor withTag(String key, String value) {
    Map<String, String> m = new HashMap<>(tags);
    m.put(key, value);
    return new FieldDescriptor(name, jsonName, dbColumn, m);
  }

  public boolean skipped() { return "-".equals(jsonName); }

  /** Column name: name, then jsonName, then dbColumn, then the {@code db} tag; each later one wins when set. */
  public String column() {
    String col = name;
    if (usable(jsonName)) col = jsonName;
    if (dbColumn != null && !dbColumn.isBlank()) col = dbColumn;
    String dbTag = tags.get(DB_TAG);
    if (usable(dbTag)) col = dbTag;
    return col;
  }

  /** True when any spelling of this field (name, json, column, db tag) equals {@code s}. */
  public boolean answersTo(String s) {
    return name.equals(s) || s.equals(jsonName) || s.equals(dbColumn) || s.equals(tags.get(DB_TAG));
  }

  private static boolean usable(String s) {
    return s != null && !s.isBlank() && !"-".equals(s);
  }
}
