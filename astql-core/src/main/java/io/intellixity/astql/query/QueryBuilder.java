package io.intellixity.astql.query;

import java.util.*;

/**
 * Fluent, mutable constructor for {@link QueryAst}.
 * <p>
 * Not thread-safe: confine an instance to one thread until {@link #build()} returns. The built AST is a snapshot and
 * does not observe later calls on the builder.
 *
 * <pre>
 * QueryAst q = QueryBuilder.select("users")
 *     .fields("id", "email")
 *     .where("tenant_id", Operator.EQ, "t1")
 *     .limit(10)
 *     .build();
 * </pre>
 */
public final class QueryBuilder {
  private final Operation operation;
  private final String target;
  private final List<SelectField> fields = new ArrayList<>();
  private final List<Condition> conditions = new ArrayList<>();
  private final List<Join> joins = new ArrayList<>();
  private final List<SortField> ordering = new ArrayList<>();
  private final List<String> grouping = new ArrayList<>();
  private final List<Condition> having = new ArrayList<>();
  private Integer limit;
  private Integer offset;
  private final List<Row> values = new ArrayList<>();
  private final TreeMap<String, Value> updates = new TreeMap<>();
  private List<String> returning = new ArrayList<>();
  private final List<Hint> hints = new ArrayList<>();

  private QueryBuilder(Operation operation, String target) {
    this.operation = Objects.requireNonNull(operation, "operation");
    this.target = target;
  }

  public static QueryBuilder select(String target) { return new QueryBuilder(Operation.SELECT, target); }
  public static QueryBuilder insert(String target) { return new QueryBuilder(Operation.INSERT, target); }
  public static QueryBuilder update(String target) { return new QueryBuilder(Operation.UPDATE, target); }
  public static QueryBuilder delete(String target) { return new QueryBuilder(Operation.DELETE, target); }
  public static QueryBuilder count(String target) { return new QueryBuilder(Operation.COUNT, target); }

  static QueryBuilder from(QueryAst ast) {
    QueryBuilder b = new QueryBuilder(ast.operation(), ast.target());
    b.fields.addAll(ast.fields());
    b.conditions.addAll(ast.conditions());
    b.joins.addAll(ast.joins());
    b.ordering.addAll(ast.ordering());
    b.grouping.addAll(ast.grouping());
    b.having.addAll(ast.having());
    b.limit = ast.limit();
    b.offset = ast.offset();
    b.values.addAll(ast.values());
    for (Assignment a : ast.updates()) b.updates.put(a.field(), a.value());
    b.returning = new ArrayList<>(ast.returning());
    b.hints.addAll(ast.hints());
    return b;
  }

  // ---- projection ----

  public QueryBuilder fields(String... names) {
    for (String n : names) this.fields.add(SelectField.of(n));
    return this;
  }

  public QueryBuilder field(String name, String alias) {
    this.fields.add(new SelectField(name, alias));
    return this;
  }

  // ---- conditions ----

  public QueryBuilder where(String field, Operator op, Object value) {
    return whereRaw(field, op, value, Condition.paramNameFor(field));
  }

  /** Like {@link #where} with an explicit parameter name, for when two conditions share a field. */
  public QueryBuilder whereRaw(String field, Operator op, Object value, String paramName) {
    conditions.add(new Condition(field, op, Value.of(value), Logical.AND, paramName));
    return this;
  }

  /**
   * Turns the connector <em>before</em> the new condition into OR.
   * <p>
   * There is no grouping: {@code where(A).where(B).orWhere(C)} reads {@code A AND B OR C}. On an empty chain this is
   * plain {@link #where}.
   */
  public QueryBuilder orWhere(String field, Operator op, Object value) {
    if (conditions.isEmpty()) return where(field, op, value);
    int last = conditions.size() - 1;
    conditions.set(last, conditions.get(last).withLogical(Logical.OR));
    return where(field, op, value);
  }

  public QueryBuilder whereNull(String field) { return where(field, Operator.IS_NULL, null); }

  public QueryBuilder whereNotNull(String field) { return where(field, Operator.IS_NOT_NULL, null); }

  public QueryBuilder whereIn(String field, Collection<?> values) {
    return where(field, Operator.IN, Value.of(values == null ? List.of() : values));
  }

  public QueryBuilder whereNotIn(String field, Collection<?> values) {
    return where(field, Operator.NOT_IN, Value.of(values == null ? List.of() : values));
  }

  public QueryBuilder whereBetween(String field, Object start, Object end) {
    return where(field, Operator.BETWEEN, Value.pair(start, end));
  }

  // ---- joins ----

  public QueryBuilder join(String joinType, String target, String condition) {
    joins.add(new Join(joinType, target, condition));
    return this;
  }

  public QueryBuilder innerJoin(String target, String condition) { return join("INNER", target, condition); }

  public QueryBuilder leftJoin(String target, String condition) { return join("LEFT", target, condition); }

  // ---- ordering / grouping ----

  public QueryBuilder orderBy(String field, SortField.Direction direction) {
    ordering.add(new SortField(field, direction));
    return this;
  }

  public QueryBuilder orderByAsc(String field) { return orderBy(field, SortField.Direction.ASC); }

  public QueryBuilder orderByDesc(String field) { return orderBy(field, SortField.Direction.DESC); }

  public QueryBuilder groupBy(String... fields) {
    grouping.addAll(Arrays.asList(fields));
    return this;
  }

  public QueryBuilder having(String field, Operator op, Object value) {
    having.add(new Condition(field, op, Value.of(value), Logical.AND, "having_" + Condition.paramNameFor(field)));
    return this;
  }

  // ---- paging ----

  public QueryBuilder limit(int limit) {
    this.limit = limit;
    return this;
  }

  public QueryBuilder offset(int offset) {
    this.offset = offset;
    return this;
  }

  /** {@code page} is 1-based and unchecked: page 0 yields a negative offset. */
  public QueryBuilder paginate(int page, int pageSize) {
    return limit(pageSize).offset((page - 1) * pageSize);
  }

  // ---- writes ----

  /** Appends an insert row; ignored unless this builds an INSERT. */
  public QueryBuilder values(Map<String, ?> row) {
    if (operation != Operation.INSERT) return this;
    values.add(Row.of(row));
    return this;
  }

  /** Adds (or replaces) an update assignment; ignored unless this builds an UPDATE. */
  public QueryBuilder set(String field, Object value) {
    if (operation != Operation.UPDATE) return this;
    updates.put(Objects.requireNonNull(field, "field"), Value.of(value));
    return this;
  }

  /** Replaces the returning list. */
  public QueryBuilder returning(String... fields) {
    this.returning = new ArrayList<>(Arrays.asList(fields));
    return this;
  }

  public QueryBuilder hint(String provider, String type, String value) {
    hints.add(new Hint(provider, type, value));
    return this;
  }

  // ---- terminal ----

  public QueryAst build() {
    QueryAst ast = snapshot();
    QueryValidator.validate(ast);
    return ast;
  }

  /** {@link #build()} for call sites where a malformed query is a programming error. */
  public QueryAst mustBuild() {
    try {
      return build();
    } catch (QueryValidationException e) {
      throw new IllegalStateException("Invalid query: " + e.getMessage(), e);
    }
  }

  private QueryAst snapshot() {
    List<Assignment> sets = new ArrayList<>(updates.size());
    for (var e : updates.entrySet()) sets.add(new Assignment(e.getKey(), e.getValue()));
    return new QueryAst(operation, target, fields, conditions, joins, ordering, grouping, having,
        limit, offset, values, sets, returning, hints);
  }
}
