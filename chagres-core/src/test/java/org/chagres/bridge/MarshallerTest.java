package org.chagres.bridge;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.file.Path;
import java.util.HashSet;
import java.util.LinkedList;
import java.util.List;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Stream;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

class MarshallerTest {

  @TempDir Path staging;

  private BridgeRuntime runtime;

  @BeforeEach
  void setUp() throws BridgeException {
    runtime = BridgeRuntime.builder().stagingDirectory(staging).localRepository(staging).build();
  }

  @AfterEach
  void tearDown() {
    runtime.close();
  }

  @Test
  void numbers_widen_without_loss() throws BridgeException {
    assertThat(Marshaller.convertNumber((byte) 7, Long.class)).isEqualTo(7L);
    assertThat(Marshaller.convertNumber(3, Double.class)).isEqualTo(3.0);
    assertThat(Marshaller.convertNumber(1.5f, Double.class)).isEqualTo(1.5);
  }

  @Test
  void narrowing_checks_range() throws BridgeException {
    assertThat(Marshaller.convertNumber(127L, Byte.class)).isEqualTo((byte) 127);
    assertThatThrownBy(() -> Marshaller.convertNumber(128, Byte.class))
        .isInstanceOf(BridgeException.class)
        .hasFieldOrPropertyWithValue("kind", ErrorKind.NUMERIC_OVERFLOW);
    assertThatThrownBy(() -> Marshaller.convertNumber(1e300, Float.class))
        .hasFieldOrPropertyWithValue("kind", ErrorKind.NUMERIC_OVERFLOW);
  }

  @Test
  void floating_targets_reject_lost_precision() throws BridgeException {
    assertThat(Marshaller.convertNumber(1L << 53, Double.class)).isEqualTo(0x1p53);
    assertThat(Marshaller.convertNumber(16777216, Float.class)).isEqualTo(16777216f);
    assertThat(Marshaller.convertNumber(0.5, Float.class)).isEqualTo(0.5f);
    assertThatThrownBy(() -> Marshaller.convertNumber((1L << 53) + 1, Double.class))
        .hasFieldOrPropertyWithValue("kind", ErrorKind.NUMERIC_OVERFLOW);
    assertThatThrownBy(() -> Marshaller.convertNumber(Long.MAX_VALUE, Double.class))
        .hasFieldOrPropertyWithValue("kind", ErrorKind.NUMERIC_OVERFLOW);
    assertThatThrownBy(() -> Marshaller.convertNumber(16777217, Float.class))
        .hasFieldOrPropertyWithValue("kind", ErrorKind.NUMERIC_OVERFLOW);
    assertThatThrownBy(() -> Marshaller.convertNumber(0.1, Float.class))
        .hasFieldOrPropertyWithValue("kind", ErrorKind.NUMERIC_OVERFLOW);
  }

  @Test
  void long_beyond_double_precision_overflows_on_conversion_to_host() throws BridgeException {
    try (ObjectHandle big = runtime.toManaged(InvocationArg.of(9007199254740993L))) {
      assertThatThrownBy(() -> big.toHost(Double.class))
          .isInstanceOf(BridgeException.class)
          .hasFieldOrPropertyWithValue("kind", ErrorKind.NUMERIC_OVERFLOW);
      assertThatThrownBy(() -> big.toHost(Float.class))
          .hasFieldOrPropertyWithValue("kind", ErrorKind.NUMERIC_OVERFLOW);
    }
  }

  @Test
  void host_int_declared_as_float_must_be_exact() throws BridgeException {
    assertThatThrownBy(() -> runtime.toManaged(InvocationArg.of(16777217, "java.lang.Float")))
        .isInstanceOf(BridgeException.class)
        .hasFieldOrPropertyWithValue("kind", ErrorKind.NUMERIC_OVERFLOW);
    try (ObjectHandle exact = runtime.toManaged(InvocationArg.of(16777216, "java.lang.Float"))) {
      assertThat(exact.toHost(Float.class)).isEqualTo(16777216f);
    }
  }

  static Stream<Arguments> scalars() {
    return Stream.of(
        Arguments.of(InvocationArg.of(true), true),
        Arguments.of(InvocationArg.of((byte) -7), (byte) -7),
        Arguments.of(InvocationArg.of((short) 31000), (short) 31000),
        Arguments.of(InvocationArg.of(Integer.MIN_VALUE), Integer.MIN_VALUE),
        Arguments.of(InvocationArg.of(Long.MAX_VALUE), Long.MAX_VALUE),
        Arguments.of(InvocationArg.of(1.25f), 1.25f),
        Arguments.of(InvocationArg.of(Double.MIN_VALUE), Double.MIN_VALUE),
        Arguments.of(InvocationArg.of('q'), 'q'));
  }

  @ParameterizedTest
  @MethodSource("scalars")
  void primitive_scalars_come_back_unchanged(InvocationArg arg, Object expected)
      throws BridgeException {
    try (ObjectHandle value = runtime.toManaged(arg.intoPrimitive())) {
      assertThat(value.className()).isEqualTo(expected.getClass().getName());
      assertThat(value.toHost(expected.getClass())).isEqualTo(expected);
    }
  }

  @Test
  void primitive_class_is_not_a_host_target() throws BridgeException {
    try (ObjectHandle value = runtime.toManaged(InvocationArg.of(3))) {
      assertThatThrownBy(() -> value.toHost(int.class))
          .isInstanceOf(IllegalArgumentException.class);
    }
  }

  @Test
  void incompatible_kinds_do_not_convert() throws BridgeException {
    assertThat(Marshaller.convertNumber(2.5, Integer.class)).isNull();
    assertThat(Marshaller.convertNumber('c', Integer.class)).isNull();
  }

  @Test
  void long_beyond_int_range_overflows_on_conversion_to_host() throws BridgeException {
    try (ObjectHandle big = runtime.toManaged(InvocationArg.of(1L << 40))) {
      assertThat(big.toHost(Long.class)).isEqualTo(1L << 40);
      assertThatThrownBy(() -> big.toHost(Integer.class))
          .isInstanceOf(BridgeException.class)
          .hasFieldOrPropertyWithValue("kind", ErrorKind.NUMERIC_OVERFLOW);
    }
  }

  @Test
  void host_number_is_converted_to_declared_wrapper() throws BridgeException {
    try (ObjectHandle value = runtime.toManaged(InvocationArg.of(5L, "java.lang.Integer"))) {
      assertThat(value.className()).isEqualTo("java.lang.Integer");
      assertThat(value.invoke("getClass").invoke("getName").toHost(String.class))
          .isEqualTo("java.lang.Integer");
    }
  }

  @Test
  void primitive_is_declared_as_its_wrapper() throws BridgeException {
    try (ObjectHandle value = runtime.toManaged(InvocationArg.of('x').intoPrimitive())) {
      assertThat(value.className()).isEqualTo("java.lang.Character");
      assertThat(value.toHost(Character.class)).isEqualTo('x');
    }
  }

  @Test
  void strings_do_not_convert_to_numbers() throws BridgeException {
    try (ObjectHandle value = runtime.toManaged(InvocationArg.of("12"))) {
      assertThatThrownBy(() -> value.toHost(Integer.class))
          .isInstanceOf(BridgeException.class)
          .hasFieldOrPropertyWithValue("kind", ErrorKind.INVALID_CAST);
    }
  }

  @Test
  void null_reference_needs_optional() throws BridgeException {
    try (ObjectHandle value = runtime.toManaged(InvocationArg.nullOf("java.lang.String"))) {
      assertThat(value.toHostOptional(String.class)).isEmpty();
      assertThatThrownBy(() -> value.toHost(String.class))
          .isInstanceOf(BridgeException.class)
          .hasFieldOrPropertyWithValue("kind", ErrorKind.NULL_RESULT);
    }
  }

  @Test
  void host_value_must_match_declared_class() {
    assertThatThrownBy(() -> runtime.toManaged(InvocationArg.of("text", "java.util.List")))
        .isInstanceOf(BridgeException.class)
        .hasFieldOrPropertyWithValue("kind", ErrorKind.CONVERSION_ERROR);
    assertThatThrownBy(() -> runtime.toManaged(InvocationArg.of(1, "int")))
        .hasFieldOrPropertyWithValue("kind", ErrorKind.CONVERSION_ERROR);
  }

  @Test
  void only_boxed_scalars_become_primitives() {
    assertThatThrownBy(() -> InvocationArg.of("abc").intoPrimitive())
        .isInstanceOf(BridgeException.class)
        .hasFieldOrPropertyWithValue("kind", ErrorKind.CONVERSION_ERROR);
    assertThatThrownBy(() -> InvocationArg.nullOf("java.lang.Integer").intoPrimitive())
        .hasFieldOrPropertyWithValue("kind", ErrorKind.CONVERSION_ERROR);
  }

  @Test
  void host_arrays_are_copied() throws BridgeException {
    byte[] bytes = {1, 2, 3};
    try (ObjectHandle array = runtime.toManaged(InvocationArg.of(bytes))) {
      bytes[0] = 9;
      assertThat(array.toHost(byte[].class)).containsExactly(1, 2, 3);
    }
  }

  @Test
  void set_is_passed_as_declared_interface() throws BridgeException {
    Set<Integer> values = new HashSet<>(Set.of(1, 2));
    try (ObjectHandle set = runtime.toManaged(InvocationArg.of(values, "java.util.Set"));
        ObjectHandle size = set.invoke("size")) {
      assertThat(set.className()).isEqualTo("java.util.Set");
      assertThat(size.toHost(Integer.class)).isEqualTo(2);
    }
  }

  @Test
  void sorted_map_keeps_its_ordering() throws BridgeException {
    TreeMap<String, Integer> map = new TreeMap<>();
    map.put("b", 2);
    map.put("a", 1);
    try (ObjectHandle sorted = runtime.toManaged(InvocationArg.of(map, "java.util.SortedMap"));
        ObjectHandle first = sorted.invoke("firstKey")) {
      assertThat(first.toHost(String.class)).isEqualTo("a");
    }
  }

  @Test
  void collection_is_passed_as_its_concrete_class() throws BridgeException {
    LinkedList<String> queue = new LinkedList<>(List.of("head", "tail"));
    try (ObjectHandle list = runtime.toManaged(InvocationArg.of(queue, "java.util.LinkedList"));
        ObjectHandle first = list.invoke("getFirst")) {
      assertThat(list.className()).isEqualTo("java.util.LinkedList");
      assertThat(first.toHost(String.class)).isEqualTo("head");
    }
  }

  @Test
  void list_elements_are_converted_one_by_one() throws BridgeException {
    try (ObjectHandle list =
        runtime.toManaged(InvocationArg.of(List.of(1, 2, 3), "java.util.List"))) {
      assertThat(list.toHostList(Long.class)).containsExactly(1L, 2L, 3L);
      assertThatThrownBy(() -> list.toHostList(String.class))
          .hasFieldOrPropertyWithValue("kind", ErrorKind.INVALID_CAST);
    }
  }

  @Test
  void string_limit_is_enforced(@TempDir Path other) throws BridgeException {
    try (BridgeRuntime limited =
        BridgeRuntime.builder()
            .stagingDirectory(other)
            .localRepository(other)
            .limits(BridgeLimits.defaults().withMaxStringLength(4))
            .build()) {
      assertThatThrownBy(() -> limited.toManaged(InvocationArg.of("too long")))
          .hasFieldOrPropertyWithValue("kind", ErrorKind.RESOURCE_LIMIT);
    }
  }
}
