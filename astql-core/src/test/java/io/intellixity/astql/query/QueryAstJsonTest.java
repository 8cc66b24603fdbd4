package io.intellixity.astql.query;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class QueryAstJsonTest {
  private static final ObjectMapper JSON = new ObjectMapper();

  @Test
  void writesCanonicalShape() throws Exception {
    QueryAst q = QueryBuilder.select("users")
        .fields("id", "email")
        .where("tenant_id", Operator.EQ, "t1")
        .whereBetween("age", 18, 65)
        .limit(10)
        .build();

    JsonNode n = JSON.readTree(JSON.writeValueAsString(q));
    assertEquals("SELECT", n.get("operation").asText());
    assertEquals("users", n.get("target").asText());
    assertEquals("id", n.get("fields").get(0).get("name").asText());
    assertEquals("EQ", n.get("conditions").get(0).get("op").asText());
    assertEquals("tenant_id", n.get("conditions").get(0).get("param").asText());
    assertEquals(18, n.get("conditions").get(1).get("value").get("lo").asInt());
    assertEquals(65, n.get("conditions").get(1).get("value").get("hi").asInt());
    assertEquals(10, n.get("limit").asInt());
    assertFalse(n.has("offset"));
    assertFalse(n.has("joins"));
  }

  @Test
  void readsBackEquivalentAst() throws Exception {
    QueryAst q = QueryBuilder.select("orders")
        .field("o.id", "oid")
        .innerJoin("users u", "u.id = o.user_id")
        .where("status", Operator.IN, List.of("open", "held"))
        .orWhere("total", Operator.GE, 12.5)
        .whereNull("deleted_at")
        .groupBy("status")
        .having("total", Operator.GT, 0)
        .orderByDesc("created_at")
        .paginate(2, 25)
        .hint("sql", "index", "orders_status_idx")
        .build();

    QueryAst back = JSON.readValue(JSON.writeValueAsString(q), QueryAst.class);
    assertEquals(q, back);
  }

  @Test
  void writesRowsAndUpdatesAsObjects() throws Exception {
    QueryAst ins = QueryBuilder.insert("users")
        .values(Map.of("name", "A", "active", true))
        .returning("id")
        .build();
    JsonNode n = JSON.readTree(JSON.writeValueAsString(ins));
    assertTrue(n.get("values").get(0).get("active").asBoolean());
    assertEquals("id", n.get("returning").get(0).asText());

    QueryAst upd = QueryBuilder.update("users").set("name", null).where("id", Operator.EQ, 1).build();
    QueryAst back = JSON.readValue(JSON.writeValueAsString(upd), QueryAst.class);
    assertEquals(Value.NULL, back.update("name"));
    assertEquals(upd, back);
  }

  @Test
  void readsHandWrittenJson() throws Exception {
    String s = """
        {
          "operation": "delete",
          "target": "sessions",
          "fields": ["ignored_on_delete"],
          "conditions": [
            { "field": "expires_at", "op": "lt", "value": 1700000000 }
          ]
        }
        """;
    QueryAst q = JSON.readValue(s, QueryAst.class);
    assertEquals(Operation.DELETE, q.operation());
    Condition c = q.conditions().get(0);
    assertEquals(Operator.LT, c.operator());
    assertEquals(new Value.IntValue(1700000000L), c.value());
    assertEquals(Logical.AND, c.logical());
    assertEquals("expires_at", c.paramName());
  }

  @Test
  void rejectsMissingOperation() {
    Exception ex = assertThrows(Exception.class, () -> JSON.readValue("{\"target\":\"x\"}", QueryAst.class));
    assertTrue(ex.getMessage().contains("operation"));
  }
}
