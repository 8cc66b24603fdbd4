package io.intellixity.astql.query;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.*;

/**
 * Literal operand carried by conditions, rows and updates.
 * <p>
 * A closed union so renderers can handle every shape explicitly instead of switching on arbitrary runtime types.
 * All variants are immutable.
 */
public sealed interface Value permits Value.NullValue, Value.BoolValue, Value.IntValue, Value.FloatValue,
    Value.StrValue, Value.ListValue, Value.PairValue {

  NullValue NULL = new NullValue();

  /** Unwrap to a plain Java object (null, Boolean, Long, Double, String, List). */
  Object toJava();

  record NullValue() implements Value {
    @Override public Object toJava() { return null; }
    @Override public String toString() { return "null"; }
  }

  record BoolValue(boolean value) implements Value {
    @Override public Object toJava() { return value; }
  }

  record IntValue(long value) implements Value {
    @Override public Object toJava() { return value; }
  }

  record FloatValue(double value) implements Value {
    @Override public Object toJava() { return value; }
  }

  record StrValue(String value) implements Value {
    public StrValue {
      Objects.requireNonNull(value, "value");
    }
    @Override public Object toJava() { return value; }
  }

  record ListValue(List<Value> items) implements Value {
    public ListValue {
      Objects.requireNonNull(items, "items");
      items = List.copyOf(items);
    }

    @Override
    public Object toJava() {
      List<Object> out = new ArrayList<>(items.size());
      for (Value v : items) out.add(v.toJava());
      return Collections.unmodifiableList(out);
    }
  }

  /** Lower/upper bound, as produced by {@code whereBetween}. */
  record PairValue(Value lo, Value hi) implements Value {
    public PairValue {
      Objects.requireNonNull(lo, "lo");
      Objects.requireNonNull(hi, "hi");
    }

    @Override
    public Object toJava() {
      return Collections.unmodifiableList(Arrays.asList(lo.toJava(), hi.toJava()));
    }
  }

  static Value str(String s) { return s == null ? NULL : new StrValue(s); }
  static Value of(long n) { return new IntValue(n); }
  static Value of(double d) { return new FloatValue(d); }
  static Value of(boolean b) { return new BoolValue(b); }
  static Value list(Value... items) { return new ListValue(List.of(items)); }
  static Value pair(Object lo, Object hi) { return new PairValue(of(lo), of(hi)); }

  /**
   * Convert a plain Java object.
   * <p>
   * Collections and arrays become {@link ListValue}; maps are rejected since no backend here has a portable
   * representation for them.
   */
  static Value of(Object o) {
    if (o == null) return NULL;
    if (o instanceof Value v) return v;
    if (o instanceof Boolean b) return new BoolValue(b);
    if (o instanceof Byte || o instanceof Short || o instanceof Integer || o instanceof Long) {
      return new IntValue(((Number) o).longValue());
    }
    if (o instanceof BigInteger bi) return new IntValue(bi.longValueExact());
    if (o instanceof Float || o instanceof Double) return new FloatValue(((Number) o).doubleValue());
    if (o instanceof BigDecimal bd) return new FloatValue(bd.doubleValue());
    if (o instanceof CharSequence cs) return new StrValue(cs.toString());
    if (o instanceof Character ch) return new StrValue(String.valueOf(ch));
    if (o instanceof Enum<?> e) return new StrValue(e.name());
    if (o instanceof Collection<?> c) {
      List<Value> items = new ArrayList<>(c.size());
      for (Object x : c) items.add(of(x));
      return new ListValue(items);
    }
    if (o instanceof Object[] arr) {
      List<Value> items = new ArrayList<>(arr.length);
      for (Object x : arr) items.add(of(x));
      return new ListValue(items);
    }
    throw new IllegalArgumentException("Unsupported value type: " + o.getClass().getName());
  }
}
