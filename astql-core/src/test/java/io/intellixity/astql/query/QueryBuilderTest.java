package io.intellixity.astql.query;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class QueryBuilderTest {
  @Test
  void selectWithNothingElseIsValid() {
    QueryAst q = QueryBuilder.select("users").build();
    assertEquals(Operation.SELECT, q.operation());
    assertEquals("users", q.target());
    assertTrue(q.fields().isEmpty());
    assertFalse(q.hasConditions());
    assertNull(q.limit());
    assertNull(q.offset());
  }

  @Test
  void whereDerivesParamNameFromField() {
    QueryAst q = QueryBuilder.select("users")
        .where("u.tenant_id", Operator.EQ, "t1")
        .build();

    Condition c = q.conditions().get(0);
    assertEquals("u.tenant_id", c.field());
    assertEquals("u_tenant_id", c.paramName());
    assertEquals(new Value.StrValue("t1"), c.value());
    assertEquals(Logical.AND, c.logical());
  }

  @Test
  void whereRawKeepsExplicitParamName() {
    QueryAst q = QueryBuilder.select("events")
        .whereRaw("ts", Operator.GE, 10, "ts_from")
        .whereRaw("ts", Operator.LT, 20, "ts_to")
        .build();

    assertEquals(List.of("ts_from", "ts_to"), q.conditions().stream().map(Condition::paramName).toList());
  }

  @Test
  void orWhereRewritesPreviousConnector() {
    QueryAst q = QueryBuilder.select("users")
        .where("a", Operator.EQ, 1)
        .where("b", Operator.EQ, 2)
        .orWhere("c", Operator.EQ, 3)
        .build();

    List<Condition> cs = q.conditions();
    assertEquals(3, cs.size());
    assertEquals(Logical.AND, cs.get(0).logical());
    assertEquals(Logical.OR, cs.get(1).logical());
    assertEquals(Logical.AND, cs.get(2).logical());
  }

  @Test
  void orWhereOnEmptyChainActsAsWhere() {
    QueryAst q = QueryBuilder.select("users").orWhere("a", Operator.EQ, 1).build();
    assertEquals(1, q.conditions().size());
    assertEquals(Logical.AND, q.conditions().get(0).logical());
  }

  @Test
  void nullAndInHelpers() {
    QueryAst q = QueryBuilder.select("users")
        .whereNull("deleted_at")
        .whereNotNull("email")
        .whereIn("status", List.of("active", "pending"))
        .whereNotIn("role", List.of("bot"))
        .build();

    List<Condition> cs = q.conditions();
    assertEquals(Operator.IS_NULL, cs.get(0).operator());
    assertEquals(Value.NULL, cs.get(0).value());
    assertEquals(Operator.IS_NOT_NULL, cs.get(1).operator());
    assertEquals(Operator.IN, cs.get(2).operator());
    assertEquals(Value.list(Value.str("active"), Value.str("pending")), cs.get(2).value());
    assertEquals(Operator.NOT_IN, cs.get(3).operator());
  }

  @Test
  void whereBetweenStoresPair() {
    QueryAst q = QueryBuilder.select("orders").whereBetween("total", 10, 99.5).build();
    Condition c = q.conditions().get(0);
    assertEquals(Operator.BETWEEN, c.operator());
    assertEquals(new Value.PairValue(new Value.IntValue(10), new Value.FloatValue(99.5)), c.value());
  }

  @Test
  void joinsOrderingGroupingAndHaving() {
    QueryAst q = QueryBuilder.select("orders")
        .field("o.id", "order_id")
        .innerJoin("users u", "u.id = o.user_id")
        .leftJoin("coupons c", "c.id = o.coupon_id")
        .join("right", "regions r", "r.id = u.region_id")
        .groupBy("u.region_id")
        .having("o.total", Operator.GT, 100)
        .orderByDesc("o.created_at")
        .orderByAsc("o.id")
        .build();

    assertEquals(new SelectField("o.id", "order_id"), q.fields().get(0));
    assertEquals(List.of("INNER", "LEFT", "RIGHT"), q.joins().stream().map(Join::joinType).toList());
    assertEquals(List.of("u.region_id"), q.grouping());
    assertEquals("having_o_total", q.having().get(0).paramName());
    assertEquals(SortField.Direction.DESC, q.ordering().get(0).direction());
    assertEquals(SortField.Direction.ASC, q.ordering().get(1).direction());
  }

  @Test
  void paginateComputesOffset() {
    QueryAst q = QueryBuilder.select("users").paginate(3, 20).build();
    assertEquals(20, q.limit());
    assertEquals(40, q.offset());
  }

  @Test
  void paginatePageZeroIsNotRejected() {
    QueryAst q = QueryBuilder.select("users").paginate(0, 20).build();
    assertEquals(-20, q.offset());
  }

  @Test
  void insertRowsAreSortedByField() {
    Map<String, Object> row = new LinkedHashMap<>();
    row.put("name", "Alice");
    row.put("email", "a@x");
    QueryAst q = QueryBuilder.insert("users").values(row).build();

    assertEquals(List.of("email", "name"), q.values().get(0).fields());
    assertEquals(Value.str("Alice"), q.values().get(0).get("name"));
    assertNull(q.values().get(0).get("missing"));
  }

  @Test
  void valuesIgnoredOutsideInsert() {
    QueryAst q = QueryBuilder.select("users").values(Map.of("a", 1)).build();
    assertTrue(q.values().isEmpty());
  }

  @Test
  void setIgnoredOutsideUpdate() {
    QueryAst q = QueryBuilder.delete("users").set("a", 1).build();
    assertTrue(q.updates().isEmpty());
  }

  @Test
  void repeatedSetReplacesEarlierValue() {
    QueryAst q = QueryBuilder.update("users")
        .set("status", "a")
        .set("name", "n")
        .set("status", "b")
        .build();

    assertEquals(List.of("name", "status"), q.updates().stream().map(Assignment::field).toList());
    assertEquals(Value.str("b"), q.update("status"));
  }

  @Test
  void returningReplacesList() {
    QueryAst q = QueryBuilder.insert("users")
        .values(Map.of("a", 1))
        .returning("id")
        .returning("id", "created_at")
        .build();
    assertEquals(List.of("id", "created_at"), q.returning());
  }

  @Test
  void hintsPassThrough() {
    QueryAst q = QueryBuilder.select("users").hint("sql", "index", "users_email_idx").build();
    assertEquals(List.of(new Hint("sql", "index", "users_email_idx")), q.hints());
  }

  @Test
  void buildRejectsInvalidAst() {
    QueryValidationException ex = assertThrows(QueryValidationException.class,
        () -> QueryBuilder.insert("users").build());
    assertEquals(ErrorKind.MISSING_INSERT_VALUES, ex.kind());
  }

  @Test
  void mustBuildWrapsValidationError() {
    IllegalStateException ex = assertThrows(IllegalStateException.class,
        () -> QueryBuilder.update("users").mustBuild());
    assertTrue(ex.getCause() instanceof QueryValidationException);
    assertEquals(ErrorKind.MISSING_UPDATE_FIELDS, ((QueryValidationException) ex.getCause()).kind());
  }

  @Test
  void builtAstIsIndependentOfLaterBuilderCalls() {
    QueryBuilder b = QueryBuilder.select("users").where("a", Operator.EQ, 1);
    QueryAst first = b.build();
    b.where("b", Operator.EQ, 2).limit(5);

    assertEquals(1, first.conditions().size());
    assertNull(first.limit());
    assertEquals(2, b.build().conditions().size());
  }

  @Test
  void toBuilderDoesNotTouchOriginal() {
    QueryAst original = QueryBuilder.update("users")
        .set("name", "a")
        .where("id", Operator.EQ, 7)
        .build();

    QueryAst edited = original.toBuilder()
        .set("email", "e")
        .orWhere("id", Operator.EQ, 8)
        .build();

    assertEquals(1, original.updates().size());
    assertEquals(1, original.conditions().size());
    assertEquals(Logical.AND, original.conditions().get(0).logical());

    assertEquals(2, edited.updates().size());
    assertEquals(Logical.OR, edited.conditions().get(0).logical());
  }

  @Test
  void astListsAreUnmodifiable() {
    QueryAst q = QueryBuilder.select("users").fields("id").build();
    assertThrows(UnsupportedOperationException.class, () -> q.fields().add(SelectField.of("x")));
  }
}
