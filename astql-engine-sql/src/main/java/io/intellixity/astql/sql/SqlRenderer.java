package io.intellixity.astql.sql;

import io.intellixity.astql.query.*;
import io.intellixity.astql.spi.RenderException;
import io.intellixity.astql.spi.Renderer;
import io.intellixity.astql.sql.SqlStatement.ExecKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Renders a {@link QueryAst} as named-parameter SQL (Postgres flavour: {@code = ANY(:p)}, {@code RETURNING}).
 * <p>
 * Identifiers, join targets and join conditions are emitted verbatim; literal values only ever travel in
 * {@link SqlStatement#params()}. Stateless and thread-safe.
 */
public final class SqlRenderer implements Renderer<SqlStatement> {
  private static final Logger log = LoggerFactory.getLogger(SqlRenderer.class);

  public static final String ID = "sql";

  @Override public String id() { return ID; }

  @Override
  public SqlStatement render(QueryAst ast) {
    QueryValidator.validate(ast);

    RenderCtx ctx = new RenderCtx();
    String sql = switch (ast.operation()) {
      case SELECT -> renderSelect(ast, ctx);
      case INSERT -> renderInsert(ast, ctx);
      case UPDATE -> renderUpdate(ast, ctx);
      case DELETE -> renderDelete(ast, ctx);
      case COUNT -> renderCount(ast, ctx);
      case AGGREGATE -> throw fail(ErrorKind.UNSUPPORTED_OPERATION, "operation " + ast.operation() + " is not supported");
    };

    boolean rowsBack = switch (ast.operation()) {
      case SELECT, COUNT -> true;
      default -> !ast.returning().isEmpty();
    };
    SqlStatement st = new SqlStatement(sql, ctx.params, sqlHints(ast.hints()), rowsBack ? ExecKind.QUERY : ExecKind.UPDATE);
    if (log.isDebugEnabled()) {
      log.debug("astql.sql op={} target={} execKind={} paramCount={} sql={}",
          ast.operation(), ast.target(), st.execKind(), st.params().size(), sql);
    }
    return st;
  }

  private String renderSelect(QueryAst ast, RenderCtx ctx) {
    StringBuilder sql = new StringBuilder("SELECT ").append(projection(ast.fields()))
        .append(" FROM ").append(ast.target());

    for (Join j : ast.joins()) {
      sql.append(' ').append(j.joinType()).append(" JOIN ").append(j.target());
      if (j.condition() != null && !j.condition().isBlank()) sql.append(" ON ").append(j.condition());
    }

    appendWhere(sql, ast.conditions(), ctx);

    if (!ast.grouping().isEmpty()) sql.append(" GROUP BY ").append(String.join(", ", ast.grouping()));

    if (!ast.having().isEmpty()) sql.append(" HAVING ").append(chain(ast.having(), ctx));

    if (!ast.ordering().isEmpty()) {
      List<String> parts = new ArrayList<>(ast.ordering().size());
      for (SortField sf : ast.ordering()) parts.add(sf.field() + " " + sf.direction().name());
      sql.append(" ORDER BY ").append(String.join(", ", parts));
    }

    if (ast.limit() != null) sql.append(" LIMIT ").append(ast.limit());
    if (ast.offset() != null) sql.append(" OFFSET ").append(ast.offset());
    return sql.toString();
  }

  private String renderInsert(QueryAst ast, RenderCtx ctx) {
    List<String> cols = ast.values().get(0).fields();
    if (cols.isEmpty()) throw fail(ErrorKind.MALFORMED_ROW, "row 0 of INSERT into '" + ast.target() + "' has no columns");

    List<String> tuples = new ArrayList<>(ast.values().size());
    for (int i = 0; i < ast.values().size(); i++) {
      Row row = ast.values().get(i);
      if (!row.fields().equals(cols)) {
        throw fail(ErrorKind.MALFORMED_ROW,
            "row " + i + " has columns " + row.fields() + " but row 0 has " + cols);
      }
      List<String> ph = new ArrayList<>(cols.size());
      for (Assignment a : row.assignments()) ph.add(ctx.bind(a.field() + "_" + i, a.value()));
      tuples.add("(" + String.join(", ", ph) + ")");
    }

    String sql = "INSERT INTO " + ast.target() + " (" + String.join(", ", cols) + ") VALUES "
        + String.join(", ", tuples);
    return sql + returning(ast.returning());
  }

  private String renderUpdate(QueryAst ast, RenderCtx ctx) {
    List<String> sets = new ArrayList<>(ast.updates().size());
    for (Assignment a : ast.updates()) sets.add(a.field() + " = " + ctx.bind("update_" + a.field(), a.value()));

    StringBuilder sql = new StringBuilder("UPDATE ").append(ast.target()).append(" SET ").append(String.join(", ", sets));
    appendWhere(sql, ast.conditions(), ctx);
    return sql.append(returning(ast.returning())).toString();
  }

  private String renderDelete(QueryAst ast, RenderCtx ctx) {
    StringBuilder sql = new StringBuilder("DELETE FROM ").append(ast.target());
    appendWhere(sql, ast.conditions(), ctx);
    return sql.append(returning(ast.returning())).toString();
  }

  private String renderCount(QueryAst ast, RenderCtx ctx) {
    StringBuilder sql = new StringBuilder("SELECT COUNT(*) FROM ").append(ast.target());
    appendWhere(sql, ast.conditions(), ctx);
    return sql.toString();
  }

  private void appendWhere(StringBuilder sql, List<Condition> conditions, RenderCtx ctx) {
    if (conditions.isEmpty()) return;
    sql.append(" WHERE ").append(chain(conditions, ctx));
  }

  /** Predicates joined by the connector stored on the preceding condition. */
  private String chain(List<Condition> conditions, RenderCtx ctx) {
    StringBuilder out = new StringBuilder();
    for (int i = 0; i < conditions.size(); i++) {
      Condition c = conditions.get(i);
      if (i > 0) out.append(' ').append(conditions.get(i - 1).logical().name()).append(' ');
      out.append(predicate(c, ctx));
    }
    return out.toString();
  }

  private String predicate(Condition c, RenderCtx ctx) {
    String f = c.field();
    String p = c.paramName();
    return switch (c.operator()) {
      case EQ -> f + " = " + ctx.bind(p, c.value());
      case NE -> f + " != " + ctx.bind(p, c.value());
      case GT -> f + " > " + ctx.bind(p, c.value());
      case GE -> f + " >= " + ctx.bind(p, c.value());
      case LT -> f + " < " + ctx.bind(p, c.value());
      case LE -> f + " <= " + ctx.bind(p, c.value());
      case IN -> f + " = ANY(" + ctx.bind(p, requireList(c)) + ")";
      case NOT_IN -> f + " != ALL(" + ctx.bind(p, requireList(c)) + ")";
      case LIKE -> {
        if (!(c.value() instanceof Value.StrValue)) {
          throw fail(ErrorKind.MALFORMED_VALUE, "LIKE on '" + f + "' needs a string pattern, got " + c.value());
        }
        yield f + " LIKE " + ctx.bind(p, c.value());
      }
      case IS_NULL -> f + " IS NULL";
      case IS_NOT_NULL -> f + " IS NOT NULL";
      case BETWEEN -> {
        Value.PairValue range = bounds(c);
        yield f + " BETWEEN " + ctx.bind(p + "_lo", range.lo()) + " AND " + ctx.bind(p + "_hi", range.hi());
      }
      case REGEX, EXISTS -> throw fail(ErrorKind.UNSUPPORTED_OPERATOR,
          "operator " + c.operator() + " on '" + f + "' has no SQL form");
    };
  }

  private static Value requireList(Condition c) {
    if (c.value() instanceof Value.ListValue) return c.value();
    throw fail(ErrorKind.MALFORMED_VALUE, c.operator() + " on '" + c.field() + "' needs a list, got " + c.value());
  }

  private static Value.PairValue bounds(Condition c) {
    if (c.value() instanceof Value.PairValue pv) return pv;
    if (c.value() instanceof Value.ListValue lv && lv.items().size() == 2) {
      return new Value.PairValue(lv.items().get(0), lv.items().get(1));
    }
    throw fail(ErrorKind.MALFORMED_BETWEEN, "BETWEEN on '" + c.field() + "' needs exactly two bounds, got " + c.value());
  }

  private static String projection(List<SelectField> fields) {
    if (fields.isEmpty()) return "*";
    List<String> parts = new ArrayList<>(fields.size());
    for (SelectField f : fields) parts.add(f.hasAlias() ? f.name() + " AS " + f.alias() : f.name());
    return String.join(", ", parts);
  }

  private static String returning(List<String> cols) {
    return cols.isEmpty() ? "" : " RETURNING " + String.join(", ", cols);
  }

  private static List<Hint> sqlHints(List<Hint> hints) {
    List<Hint> out = new ArrayList<>();
    for (Hint h : hints) if (ID.equals(h.provider())) out.add(h);
    return out;
  }

  private static RenderException fail(ErrorKind kind, String message) {
    return new RenderException(ID, kind, message);
  }

  private static final class RenderCtx {
    private final LinkedHashMap<String, Value> params = new LinkedHashMap<>();

    String bind(String name, Value value) {
      Value prev = params.putIfAbsent(name, value);
      if (prev != null && !prev.equals(value)) {
        throw fail(ErrorKind.PARAM_COLLISION,
            "parameter :" + name + " is bound to both " + prev + " and " + value + "; use whereRaw to rename one");
      }
      return ":" + name;
    }
  }
}
