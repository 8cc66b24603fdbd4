package io.intellixity.astql.query;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class ValueTest {
  enum Status { ACTIVE }

  @Test
  void convertsScalars() {
    assertSame(Value.NULL, Value.of((Object) null));
    assertEquals(new Value.BoolValue(true), Value.of((Object) Boolean.TRUE));
    assertEquals(new Value.IntValue(42), Value.of((Object) 42));
    assertEquals(new Value.IntValue(42), Value.of((Object) (short) 42));
    assertEquals(new Value.FloatValue(1.5), Value.of((Object) 1.5f));
    assertEquals(new Value.FloatValue(2.25), Value.of(new BigDecimal("2.25")));
    assertEquals(new Value.StrValue("x"), Value.of((Object) 'x'));
    assertEquals(new Value.StrValue("ACTIVE"), Value.of(Status.ACTIVE));
  }

  @Test
  void convertsCollectionsAndArrays() {
    Value fromList = Value.of(List.of(1, "a"));
    Value fromArray = Value.of(new Object[] {1, "a"});
    assertEquals(fromList, fromArray);
    assertEquals(Value.list(Value.of(1L), Value.str("a")), fromList);
  }

  @Test
  void existingValuePassesThrough() {
    Value v = Value.str("s");
    assertSame(v, Value.of((Object) v));
  }

  @Test
  void rejectsMaps() {
    assertThrows(IllegalArgumentException.class, () -> Value.of(Map.of("a", 1)));
  }

  @Test
  void unwrapsToJava() {
    assertNull(Value.NULL.toJava());
    assertEquals(7L, Value.of(7L).toJava());
    assertEquals(Arrays.asList(1L, null), Value.of(Arrays.asList(1, null)).toJava());
    assertEquals(List.of(1L, 9L), Value.pair(1, 9).toJava());
  }
}
