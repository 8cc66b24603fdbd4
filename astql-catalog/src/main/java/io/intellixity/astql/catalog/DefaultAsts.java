package io.intellixity.astql.catalog;

import io.intellixity.astql.query.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Builds the conventional CRUD {@link QueryAst}s for an entity from its {@link EntityMetadata}.
 * <p>
 * Every literal is a null placeholder bound under a stable parameter name ({@code id}, {@code tenant_id},
 * {@code update_<column>}, ...); callers fill the real values at execution time. Condition order is tenant scope,
 * then the soft-delete check, then identity.
 */
public final class DefaultAsts {
  private static final Logger log = LoggerFactory.getLogger(DefaultAsts.class);

  public static final String RETURN_ALL = "*";
  public static final String UNSUPPORTED_HINT_PROVIDER = "astql";

  private DefaultAsts() {}

  public static QueryAst defaultAst(EntityMetadata metadata, CrudVerb verb) {
    return defaultAst(metadata, verb, CatalogConventions.defaults());
  }

  public static QueryAst defaultAst(EntityMetadata metadata, CrudVerb verb, CatalogConventions conventions) {
    Objects.requireNonNull(metadata, "metadata");
    Objects.requireNonNull(verb, "verb");
    Objects.requireNonNull(conventions, "conventions");

    Shape shape = Shape.of(metadata, conventions);
    String target = metadata.resolvedTarget();
    boolean softDelete = metadata.hasField(conventions.softDeleteColumn());

    QueryBuilder b = switch (verb) {
      case GET -> identity(scope(QueryBuilder.select(target).fields(shape.columnArray()), shape, softDelete, conventions),
          conventions);
      case LIST -> {
        QueryBuilder q = scope(QueryBuilder.select(target).fields(shape.columnArray()), shape, softDelete, conventions);
        if (metadata.hasField(conventions.createdAtColumn())) q.orderByDesc(conventions.createdAtColumn());
        yield q.limit(conventions.listPageSize()).offset(0);
      }
      case CREATE -> {
        Map<String, Object> row = new LinkedHashMap<>();
        for (String col : shape.columns) row.put(col, null);
        yield QueryBuilder.insert(target).values(row).returning(RETURN_ALL);
      }
      case UPDATE -> {
        QueryBuilder q = QueryBuilder.update(target);
        for (String col : shape.columns) {
          if (col.equals(conventions.identityColumn())) continue;
          if (col.equals(conventions.createdAtColumn())) continue;
          if (shape.tenantColumns.contains(col)) continue; // tenant boundary is insert-only
          q.set(col, null);
        }
        yield identity(scope(q, shape, softDelete, conventions), conventions).returning(RETURN_ALL);
      }
      case DELETE -> {
        QueryBuilder q = softDelete
            ? QueryBuilder.update(target).set(conventions.softDeleteColumn(), null)
            : QueryBuilder.delete(target);
        yield identity(scope(q, shape, softDelete, conventions), conventions);
      }
      case COUNT -> scope(QueryBuilder.count(target), shape, softDelete, conventions);
    };

    for (Hint h : shape.hints) b.hint(h.provider(), h.type(), h.value());
    return b.build();
  }

  /**
   * All six verbs, in {@link CrudVerb} order. A verb whose AST cannot be valid for this entity (an UPDATE with no
   * updatable column) is logged and left out.
   */
  public static Map<CrudVerb, QueryAst> crudQueries(EntityMetadata metadata) {
    return crudQueries(metadata, CatalogConventions.defaults());
  }

  public static Map<CrudVerb, QueryAst> crudQueries(EntityMetadata metadata, CatalogConventions conventions) {
    Map<CrudVerb, QueryAst> out = new EnumMap<>(CrudVerb.class);
    for (CrudVerb verb : CrudVerb.values()) {
      try {
        out.put(verb, defaultAst(metadata, verb, conventions));
      } catch (QueryValidationException e) {
        log.warn("astql.catalog type={} verb={} skipped kind={} reason={}",
            metadata.typeName(), verb.key(), e.kind(), e.getMessage());
      }
    }
    log.info("astql.catalog type={} target={} verbs={}", metadata.typeName(), metadata.resolvedTarget(), out.keySet());
    return Collections.unmodifiableMap(out);
  }

  private static QueryBuilder scope(QueryBuilder q, Shape shape, boolean softDelete, CatalogConventions conventions) {
    for (String col : shape.tenantColumns) q.whereRaw(col, Operator.EQ, null, conventions.tenantParam());
    if (softDelete) {
      q.whereRaw(conventions.softDeleteColumn(), Operator.IS_NULL, null, conventions.softDeleteParam());
    }
    return q;
  }

  private static QueryBuilder identity(QueryBuilder q, CatalogConventions conventions) {
    return q.where(conventions.identityColumn(), Operator.EQ, null);
  }

  /** Columns, hints and tenant columns gathered from the field list and its tag directives. */
  private static final class Shape {
    private final List<String> columns = new ArrayList<>();
    private final List<Hint> hints = new ArrayList<>();
    private final Set<String> tenantColumns = new LinkedHashSet<>();

    static Shape of(EntityMetadata metadata, CatalogConventions conventions) {
      Shape s = new Shape();
      for (FieldDescriptor f : metadata.fields()) {
        if (f.skipped()) continue;
        String col = f.column();
        s.columns.add(col);
        for (TagDirective d : TagDirective.parse(f.tags().get(FieldDescriptor.ASTQL_TAG))) {
          switch (d.type()) {
            case INDEX -> s.hints.add(new Hint("sql", "index", col + ":" + d.argument()));
            case UNIQUE -> s.hints.add(new Hint("sql", "unique", col));
            case TENANT -> s.tenantColumns.add(col);
            case UNSUPPORTED -> {
              if (conventions.strictDirectives()) throw new UnsupportedDirectiveException(f.name(), d.raw());
              log.warn("astql.catalog type={} field={} unsupported directive={} kept as hint",
                  metadata.typeName(), f.name(), d.raw());
              s.hints.add(new Hint(UNSUPPORTED_HINT_PROVIDER, "unsupported", col + ":" + d.raw()));
            }
          }
        }
      }
      return s;
    }

    String[] columnArray() {
      return columns.toArray(new String[0]);
    }
  }
}
