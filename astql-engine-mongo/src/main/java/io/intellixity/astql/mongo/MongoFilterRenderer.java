package io.intellixity.astql.mongo;

import io.intellixity.astql.query.*;
import io.intellixity.astql.spi.RenderException;
import org.bson.Document;

import java.util.*;

/**
 * Condition chain to BSON filter.
 * <p>
 * All-AND chains render as one flat document. A field that appears twice switches the chain to the
 * {@code $and} list form so neither predicate is overwritten.
 */
final class MongoFilterRenderer {
  private static final String REGEX_META = "\\^$.|?*+()[]{}";

  private MongoFilterRenderer() {}

  /** AND binds tighter than OR, the same reading the SQL chain gets. */
  static Document precedence(List<Condition> conditions) {
    List<List<Condition>> groups = new ArrayList<>();
    List<Condition> current = new ArrayList<>();
    for (Condition c : conditions) {
      current.add(c);
      if (c.logical() == Logical.OR) {
        groups.add(current);
        current = new ArrayList<>();
      }
    }
    if (!current.isEmpty()) groups.add(current);

    if (groups.size() == 1) return andGroup(groups.get(0));
    List<Document> ors = new ArrayList<>(groups.size());
    for (List<Condition> g : groups) ors.add(andGroup(g));
    return new Document("$or", ors);
  }

  /** Every condition ANDed regardless of connector. */
  static Document legacyAnd(List<Condition> conditions) {
    return new Document("$and", terms(conditions));
  }

  static boolean allAnd(List<Condition> conditions) {
    for (int i = 0; i < conditions.size() - 1; i++) {
      if (conditions.get(i).logical() == Logical.OR) return false;
    }
    return true;
  }

  private static Document andGroup(List<Condition> group) {
    Set<String> seen = new HashSet<>();
    for (Condition c : group) {
      if (!seen.add(c.field())) return new Document("$and", terms(group));
    }
    Document d = new Document();
    for (Condition c : group) d.append(c.field(), predicate(c));
    return d;
  }

  private static List<Document> terms(List<Condition> conditions) {
    List<Document> out = new ArrayList<>(conditions.size());
    for (Condition c : conditions) out.add(new Document(c.field(), predicate(c)));
    return out;
  }

  static Object predicate(Condition c) {
    return switch (c.operator()) {
      case EQ -> toBson(c.value());
      case NE -> new Document("$ne", toBson(c.value()));
      case GT -> new Document("$gt", toBson(c.value()));
      case GE -> new Document("$gte", toBson(c.value()));
      case LT -> new Document("$lt", toBson(c.value()));
      case LE -> new Document("$lte", toBson(c.value()));
      case IN -> new Document("$in", toBson(requireList(c)));
      case NOT_IN -> new Document("$nin", toBson(requireList(c)));
      case IS_NULL -> null;
      case IS_NOT_NULL -> new Document("$ne", null);
      case BETWEEN -> {
        Value.PairValue range = bounds(c);
        yield new Document("$gte", toBson(range.lo())).append("$lte", toBson(range.hi()));
      }
      case REGEX -> new Document("$regex", requireString(c));
      case LIKE -> new Document("$regex", likeToRegex(requireString(c))).append("$options", "i");
      case EXISTS -> new Document("$exists", true);
    };
  }

  /** SQL LIKE to an anchored regex: '%' to '.*', '_' to '.', everything else literal. */
  static String likeToRegex(String like) {
    StringBuilder re = new StringBuilder("^");
    for (int i = 0; i < like.length(); i++) {
      char ch = like.charAt(i);
      if (ch == '%') re.append(".*");
      else if (ch == '_') re.append('.');
      else {
        if (REGEX_META.indexOf(ch) >= 0) re.append('\\');
        re.append(ch);
      }
    }
    return re.append('$').toString();
  }

  /** Value to the Java type the BSON codecs expect; integers stay 64-bit. */
  static Object toBson(Value v) {
    if (v instanceof Value.ListValue l) {
      List<Object> out = new ArrayList<>(l.items().size());
      for (Value item : l.items()) out.add(toBson(item));
      return out;
    }
    if (v instanceof Value.PairValue p) return Arrays.asList(toBson(p.lo()), toBson(p.hi()));
    return v.toJava();
  }

  private static Value requireList(Condition c) {
    if (c.value() instanceof Value.ListValue) return c.value();
    throw fail(ErrorKind.MALFORMED_VALUE, c.operator() + " on '" + c.field() + "' needs a list, got " + c.value());
  }

  private static String requireString(Condition c) {
    if (c.value() instanceof Value.StrValue s) return s.value();
    throw fail(ErrorKind.MALFORMED_VALUE, c.operator() + " on '" + c.field() + "' needs a string pattern, got " + c.value());
  }

  private static Value.PairValue bounds(Condition c) {
    if (c.value() instanceof Value.PairValue pv) return pv;
    if (c.value() instanceof Value.ListValue lv && lv.items().size() == 2) {
      return new Value.PairValue(lv.items().get(0), lv.items().get(1));
    }
    throw fail(ErrorKind.MALFORMED_BETWEEN, "BETWEEN on '" + c.field() + "' needs exactly two bounds, got " + c.value());
  }

  static RenderException fail(ErrorKind kind, String message) {
    return new RenderException(MongoRenderer.ID, kind, message);
  }
}
