package io.intellixity.astql.sql;

import io.intellixity.astql.query.Hint;
import io.intellixity.astql.query.Value;
import io.intellixity.astql.spi.NativeStatement;

import java.util.*;

/**
 * Named-parameter SQL plus its binds.
 * <p>
 * {@code params} iterates in placeholder order of first appearance. Placeholders are written {@code :name}.
 */
public record SqlStatement(String sql, Map<String, Value> params, List<Hint> hints, ExecKind execKind)
    implements NativeStatement {
  public enum ExecKind {
    /** Produces rows: SELECT, COUNT, and writes with RETURNING. */
    QUERY,
    /** Produces an update count only. */
    UPDATE
  }

  public SqlStatement {
    Objects.requireNonNull(sql, "sql");
    params = (params == null) ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(params));
    hints = (hints == null) ? List.of() : List.copyOf(hints);
    execKind = (execKind == null) ? ExecKind.QUERY : execKind;
  }

  public SqlStatement(String sql, Map<String, Value> params) {
    this(sql, params, List.of(), ExecKind.QUERY);
  }

  /** Params unwrapped to plain Java values, for drivers that bind Objects by name. */
  public Map<String, Object> paramValues() {
    Map<String, Object> out = new LinkedHashMap<>();
    for (var e : params.entrySet()) out.put(e.getKey(), e.getValue().toJava());
    return out;
  }
}
