package io.intellixity.astql.catalog;

import java.util.Objects;

/**
 * Column names and limits the default ASTs are built around.
 *
 * @param strictDirectives when true an unknown {@code astql} tag directive fails generation; when false it is kept
 *                         as an {@code astql/unsupported} hint and logged
 */
public record CatalogConventions(
    String identityColumn,
    String createdAtColumn,
    String softDeleteColumn,
    String softDeleteParam,
    String tenantParam,
    int listPageSize,
    boolean strictDirectives
) {
  public CatalogConventions {
    Objects.requireNonNull(identityColumn, "identityColumn");
    Objects.requireNonNull(createdAtColumn, "createdAtColumn");
    Objects.requireNonNull(softDeleteColumn, "softDeleteColumn");
    Objects.requireNonNull(softDeleteParam, "softDeleteParam");
    Objects.requireNonNull(tenantParam, "tenantParam");
    if (listPageSize < 0) throw new IllegalArgumentException("listPageSize must be >= 0");
  }

  public static CatalogConventions defaults() {
    return new CatalogConventions("id", "created_at", "deleted_at", "deleted_check", "tenant_id", 100, true);
  }

  public CatalogConventions withStrictDirectives(boolean strict) {
    return new CatalogConventions(identityColumn, createdAtColumn, softDeleteColumn, softDeleteParam, tenantParam,
        listPageSize, strict);
  }

  public CatalogConventions withListPageSize(int size) {
    return new CatalogConventions(identityColumn, createdAtColumn, softDeleteColumn, softDeleteParam, tenantParam,
        size, strictDirectives);
  }
}
