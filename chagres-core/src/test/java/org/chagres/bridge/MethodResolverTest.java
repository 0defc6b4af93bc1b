package org.chagres.bridge;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.lang.reflect.Method;
import java.util.ArrayList;
import java.util.List;
import org.chagres.bridge.fixtures.SampleObject;
import org.chagres.bridge.observability.StructuredLogger;
import org.junit.jupiter.api.Test;

class MethodResolverTest {

  /** Two overloads that no argument list can tell apart in the second position. */
  public static class Ambiguous {
    public void pick(Object a, String b) {}

    public void pick(String a, Object b) {}
  }

  public interface Shape {
    Object area();
  }

  public static class Square implements Shape {
    @Override
    public Double area() {
      return 4.0;
    }
  }

  private final ReflectionCache cache = new ReflectionCache(128);
  private final MethodResolver resolver = new MethodResolver(cache);

  @Test
  void primitive_argument_binds_to_primitive_overload() throws BridgeException {
    Method remove = resolver.resolveMethod(List.class, "remove", new Class<?>[] {int.class}, false);

    assertThat(remove.getParameterTypes()).containsExactly(int.class);
  }

  @Test
  void boxed_argument_binds_to_reference_overload() throws BridgeException {
    Method remove =
        resolver.resolveMethod(List.class, "remove", new Class<?>[] {Integer.class}, false);

    assertThat(remove.getParameterTypes()).containsExactly(Object.class);
  }

  @Test
  void list_remove_through_runtime_handles() throws Throwable {
    List<String> values = new ArrayList<>(List.of("a", "b", "c"));
    ReflectionCache.CachedMethod byIndex =
        cache.getMethod(ArrayList.class, "remove", new Class<?>[] {int.class}, false);
    ReflectionCache.CachedMethod byValue =
        cache.getMethod(ArrayList.class, "remove", new Class<?>[] {String.class}, false);

    assertThat(byIndex.invoke(values, new Object[] {0})).isEqualTo("a");
    assertThat(byValue.invoke(values, new Object[] {"c"})).isEqualTo(true);
    assertThat(values).containsExactly("b");
  }

  @Test
  void widening_is_preferred_over_boxing() throws BridgeException {
    Method describe =
        resolver.resolveMethod(SampleObject.class, "describe", new Class<?>[] {int.class}, false);

    assertThat(describe.getParameterTypes()).containsExactly(long.class);
  }

  @Test
  void most_specific_candidate_wins() throws BridgeException {
    Method max =
        resolver.resolveMethod(
            Math.class, "max", new Class<?>[] {int.class, int.class}, true);

    assertThat(max.getParameterTypes()).containsExactly(int.class, int.class);
  }

  @Test
  void ambiguous_call_is_reported() {
    assertThatThrownBy(
            () ->
                resolver.resolveMethod(
                    Ambiguous.class, "pick", new Class<?>[] {String.class, String.class}, false))
        .isInstanceOf(MethodNotFoundException.class)
        .hasMessageContaining("Ambiguous call");
  }

  @Test
  void covariant_override_is_chosen_over_bridge() throws BridgeException {
    Method area = resolver.resolveMethod(Square.class, "area", new Class<?>[0], false);

    assertThat(area.isBridge()).isFalse();
    assertThat(area.getReturnType()).isEqualTo(Double.class);
  }

  @Test
  void interface_handles_see_object_methods() throws BridgeException {
    Method hashCode = resolver.resolveMethod(Shape.class, "hashCode", new Class<?>[0], false);

    assertThat(hashCode.getDeclaringClass()).isEqualTo(Object.class);
  }

  @Test
  void variadic_member_needs_the_array() throws BridgeException {
    Method addInts =
        resolver.resolveMethod(
            SampleObject.class, "addInts", new Class<?>[] {Integer[].class}, false);

    assertThat(addInts.isVarArgs()).isTrue();
    assertThatThrownBy(
            () ->
                resolver.resolveMethod(
                    SampleObject.class,
                    "addInts",
                    new Class<?>[] {Integer.class, Integer.class, Integer.class},
                    false))
        .isInstanceOf(MethodNotFoundException.class)
        .satisfies(
            e ->
                assertThat(((MethodNotFoundException) e).memberName()).isEqualTo("addInts"));
  }

  @Test
  void constructor_resolution() throws BridgeException {
    assertThat(
            resolver
                .resolveConstructor(SampleObject.class, new Class<?>[] {String.class})
                .getParameterTypes())
        .containsExactly(String.class);
    assertThat(
            resolver
                .resolveConstructor(SampleObject.class, new Class<?>[] {String[].class})
                .isVarArgs())
        .isTrue();
  }

  @Test
  void resolutions_are_cached() throws BridgeException {
    ReflectionCache.CachedMethod first =
        cache.getMethod(SampleObject.class, "greet", new Class<?>[] {String.class}, true);
    ReflectionCache.CachedMethod second =
        cache.getMethod(SampleObject.class, "greet", new Class<?>[] {String.class}, true);

    assertThat(second).isSameAs(first);
    assertThat(first.isStatic).isTrue();
    assertThat(first.resultType).isEqualTo(String.class);
  }

  @Test
  void resolution_is_traced_when_enabled() throws BridgeException {
    StructuredLogger.setTraceMode(true);
    try {
      Method greet =
          resolver.resolveMethod(
              SampleObject.class, "greet", new Class<?>[] {String.class}, true);
      assertThat(greet.getName()).isEqualTo("greet");
    } finally {
      StructuredLogger.setTraceMode(false);
    }
    assertThat(StructuredLogger.isTraceEnabled()).isFalse();
  }

  @Test
  void conversion_rules() {
    assertThat(MethodResolver.isConvertible(long.class, int.class, false)).isTrue();
    assertThat(MethodResolver.isConvertible(int.class, long.class, true)).isFalse();
    assertThat(MethodResolver.isConvertible(Number.class, int.class, false)).isFalse();
    assertThat(MethodResolver.isConvertible(Number.class, int.class, true)).isTrue();
    assertThat(MethodResolver.isConvertible(long.class, Integer.class, true)).isTrue();
    assertThat(MethodResolver.isConvertible(Integer.class, Long.class, true)).isFalse();
  }
}
