package io.intellixity.astql.query;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.ObjectCodec;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;
import java.util.*;

/**
 * Canonical JSON deserializer for {@link QueryAst}.
 * <p>
 * The result is not validated; hand it to {@link QueryValidator} or a renderer, both of which do.
 */
public final class QueryAstJsonDeserializer extends JsonDeserializer<QueryAst> {
  @Override
  public QueryAst deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
    ObjectCodec codec = p.getCodec();
    JsonNode root = codec.readTree(p);
    if (root == null || root.isNull()) return null;
    if (!root.isObject()) throw new IllegalArgumentException("QueryAst JSON must be an object");

    String op = textOrNull(root.get("operation"));
    if (op == null) throw new IllegalArgumentException("QueryAst JSON requires operation");
    Operation operation = Operation.valueOf(op.toUpperCase());

    List<SelectField> fields = new ArrayList<>();
    for (JsonNode f : array(root.get("fields"))) {
      if (f.isTextual()) {
        fields.add(SelectField.of(f.asText()));
      } else if (f.isObject()) {
        fields.add(new SelectField(required(f, "name"), textOrNull(f.get("alias"))));
      }
    }

    List<Join> joins = new ArrayList<>();
    for (JsonNode j : array(root.get("joins"))) {
      joins.add(new Join(textOrNull(j.get("type")), required(j, "target"), textOrNull(j.get("on"))));
    }

    List<SortField> ordering = new ArrayList<>();
    for (JsonNode s : array(root.get("ordering"))) {
      String f = textOrNull(s.get("field"));
      if (f == null) continue;
      String dir = textOrNull(s.get("dir"));
      SortField.Direction d = (dir == null) ? SortField.Direction.ASC : SortField.Direction.valueOf(dir.toUpperCase());
      ordering.add(new SortField(f, d));
    }

    List<Row> values = new ArrayList<>();
    for (JsonNode r : array(root.get("values"))) values.add(new Row(parseAssignments(r)));

    return new QueryAst(
        operation,
        textOrNull(root.get("target")),
        fields,
        parseConditions(root.get("conditions")),
        joins,
        ordering,
        strings(root.get("grouping")),
        parseConditions(root.get("having")),
        intOrNull(root.get("limit")),
        intOrNull(root.get("offset")),
        values,
        parseAssignments(root.get("updates")),
        strings(root.get("returning")),
        parseHints(root.get("hints")));
  }

  private static List<Condition> parseConditions(JsonNode arr) {
    List<Condition> out = new ArrayList<>();
    for (JsonNode c : array(arr)) {
      String field = required(c, "field");
      String op = textOrNull(c.get("op"));
      if (op == null) throw new IllegalArgumentException("condition on '" + field + "' requires op");
      String logical = textOrNull(c.get("logical"));
      out.add(new Condition(
          field,
          Operator.valueOf(op.toUpperCase()),
          decodeValue(c.get("value")),
          (logical == null) ? Logical.AND : Logical.valueOf(logical.toUpperCase()),
          textOrNull(c.get("param"))));
    }
    return out;
  }

  private static List<Assignment> parseAssignments(JsonNode obj) {
    if (obj == null || !obj.isObject()) return List.of();
    List<Assignment> out = new ArrayList<>();
    Iterator<Map.Entry<String, JsonNode>> it = obj.fields();
    while (it.hasNext()) {
      Map.Entry<String, JsonNode> e = it.next();
      out.add(new Assignment(e.getKey(), decodeValue(e.getValue())));
    }
    return out;
  }

  private static List<Hint> parseHints(JsonNode arr) {
    List<Hint> out = new ArrayList<>();
    for (JsonNode h : array(arr)) {
      out.add(new Hint(required(h, "provider"), required(h, "type"), textOrNull(h.get("value"))));
    }
    return out;
  }

  static Value decodeValue(JsonNode v) {
    if (v == null || v.isNull() || v.isMissingNode()) return Value.NULL;
    if (v.isBoolean()) return new Value.BoolValue(v.booleanValue());
    if (v.isIntegralNumber()) return new Value.IntValue(v.longValue());
    if (v.isNumber()) return new Value.FloatValue(v.doubleValue());
    if (v.isTextual()) return new Value.StrValue(v.asText());
    if (v.isArray()) {
      List<Value> items = new ArrayList<>(v.size());
      for (JsonNode x : v) items.add(decodeValue(x));
      return new Value.ListValue(items);
    }
    if (v.isObject() && v.has("lo") && v.has("hi")) {
      return new Value.PairValue(decodeValue(v.get("lo")), decodeValue(v.get("hi")));
    }
    throw new IllegalArgumentException("Unsupported value: " + v);
  }

  private static Iterable<JsonNode> array(JsonNode n) {
    return (n == null || !n.isArray()) ? List.of() : n;
  }

  private static List<String> strings(JsonNode n) {
    List<String> out = new ArrayList<>();
    for (JsonNode x : array(n)) if (x.isTextual()) out.add(x.asText());
    return out;
  }

  private static String required(JsonNode n, String key) {
    String s = textOrNull(n.get(key));
    if (s == null) throw new IllegalArgumentException("missing '" + key + "' in " + n);
    return s;
  }

  private static String textOrNull(JsonNode n) {
    return (n == null || n.isNull()) ? null : n.asText();
  }

  private static Integer intOrNull(JsonNode n) {
    if (n == null || n.isNull()) return null;
    return n.isNumber() ? n.intValue() : Integer.parseInt(n.asText());
  }
}
