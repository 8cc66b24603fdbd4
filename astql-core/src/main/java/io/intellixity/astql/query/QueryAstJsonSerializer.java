package io.intellixity.astql.query;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;

import java.io.IOException;
import java.util.List;

/** Canonical JSON serializer for {@link QueryAst}. Empty lists and unset paging are omitted. */
public final class QueryAstJsonSerializer extends JsonSerializer<QueryAst> {
  @Override
  public void serialize(QueryAst q, JsonGenerator g, SerializerProvider serializers) throws IOException {
    if (q == null) {
      g.writeNull();
      return;
    }

    g.writeStartObject();
    g.writeStringField("operation", q.operation().name());
    if (q.target() != null) g.writeStringField("target", q.target());

    if (!q.fields().isEmpty()) {
      g.writeArrayFieldStart("fields");
      for (SelectField f : q.fields()) {
        g.writeStartObject();
        g.writeStringField("name", f.name());
        if (f.hasAlias()) g.writeStringField("alias", f.alias());
        g.writeEndObject();
      }
      g.writeEndArray();
    }

    writeConditions("conditions", q.conditions(), g);

    if (!q.joins().isEmpty()) {
      g.writeArrayFieldStart("joins");
      for (Join j : q.joins()) {
        g.writeStartObject();
        g.writeStringField("type", j.joinType());
        g.writeStringField("target", j.target());
        g.writeStringField("on", j.condition());
        g.writeEndObject();
      }
      g.writeEndArray();
    }

    if (!q.ordering().isEmpty()) {
      g.writeArrayFieldStart("ordering");
      for (SortField sf : q.ordering()) {
        g.writeStartObject();
        g.writeStringField("field", sf.field());
        g.writeStringField("dir", sf.direction().name());
        g.writeEndObject();
      }
      g.writeEndArray();
    }

    if (!q.grouping().isEmpty()) g.writeObjectField("grouping", q.grouping());
    writeConditions("having", q.having(), g);

    if (q.limit() != null) g.writeNumberField("limit", q.limit());
    if (q.offset() != null) g.writeNumberField("offset", q.offset());

    if (!q.values().isEmpty()) {
      g.writeArrayFieldStart("values");
      for (Row r : q.values()) writeAssignments(r.assignments(), g);
      g.writeEndArray();
    }

    if (!q.updates().isEmpty()) {
      g.writeFieldName("updates");
      writeAssignments(q.updates(), g);
    }

    if (!q.returning().isEmpty()) g.writeObjectField("returning", q.returning());

    if (!q.hints().isEmpty()) {
      g.writeArrayFieldStart("hints");
      for (Hint h : q.hints()) {
        g.writeStartObject();
        g.writeStringField("provider", h.provider());
        g.writeStringField("type", h.type());
        if (h.value() != null) g.writeStringField("value", h.value());
        g.writeEndObject();
      }
      g.writeEndArray();
    }

    g.writeEndObject();
  }

  private static void writeConditions(String key, List<Condition> conditions, JsonGenerator g) throws IOException {
    if (conditions.isEmpty()) return;
    g.writeArrayFieldStart(key);
    for (Condition c : conditions) {
      g.writeStartObject();
      g.writeStringField("field", c.field());
      g.writeStringField("op", c.operator().name());
      if (c.operator().usesValue()) {
        g.writeFieldName("value");
        writeValue(c.value(), g);
      }
      g.writeStringField("logical", c.logical().name());
      g.writeStringField("param", c.paramName());
      g.writeEndObject();
    }
    g.writeEndArray();
  }

  private static void writeAssignments(List<Assignment> assignments, JsonGenerator g) throws IOException {
    g.writeStartObject();
    for (Assignment a : assignments) {
      g.writeFieldName(a.field());
      writeValue(a.value(), g);
    }
    g.writeEndObject();
  }

  static void writeValue(Value v, JsonGenerator g) throws IOException {
    if (v instanceof Value.NullValue) {
      g.writeNull();
    } else if (v instanceof Value.BoolValue b) {
      g.writeBoolean(b.value());
    } else if (v instanceof Value.IntValue i) {
      g.writeNumber(i.value());
    } else if (v instanceof Value.FloatValue f) {
      g.writeNumber(f.value());
    } else if (v instanceof Value.StrValue s) {
      g.writeString(s.value());
    } else if (v instanceof Value.ListValue l) {
      g.writeStartArray();
      for (Value item : l.items()) writeValue(item, g);
      g.writeEndArray();
    } else if (v instanceof Value.PairValue p) {
      g.writeStartObject();
      g.writeFieldName("lo");
      writeValue(p.lo(), g);
      g.writeFieldName("hi");
      writeValue(p.hi(), g);
      g.writeEndObject();
    }
  }
}
