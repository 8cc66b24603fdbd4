package io.intellixity.astql.util;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class AstqlFactoriesLoaderTest {
  public interface Greeter { String greet(); }

  public static final class Hello implements Greeter {
    @Override public String greet() { return "hello"; }
  }

  public static final class Hola implements Greeter {
    @Override public String greet() { return "hola"; }
  }

  public interface Misregistered {}

  public interface Missing {}

  public interface Unlisted {}

  @Test
  void loadsListedImplementationsInOrderWithoutDuplicates() {
    List<Greeter> gs = AstqlFactoriesLoader.load(Greeter.class);
    assertEquals(List.of("hello", "hola"), gs.stream().map(Greeter::greet).toList());
  }

  @Test
  void unlistedTypeYieldsEmptyList() {
    assertTrue(AstqlFactoriesLoader.load(Unlisted.class).isEmpty());
  }

  @Test
  void rejectsClassNotImplementingType() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> AstqlFactoriesLoader.load(Misregistered.class));
    assertTrue(ex.getMessage().contains("java.lang.String"));
  }

  @Test
  void failsOnMissingClass() {
    IllegalStateException ex = assertThrows(IllegalStateException.class,
        () -> AstqlFactoriesLoader.load(Missing.class));
    assertTrue(ex.getMessage().contains("com.acme.DoesNotExist"));
  }
}
