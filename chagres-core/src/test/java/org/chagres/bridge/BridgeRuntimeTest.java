package org.chagres.bridge;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.file.Path;
import java.util.List;
import org.chagres.bridge.fixtures.SampleObject;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class BridgeRuntimeTest {
  private static final String SAMPLE = SampleObject.class.getName();

  @TempDir Path staging;

  private BridgeRuntime runtime;

  @BeforeEach
  void setUp() throws BridgeException {
    runtime =
        BridgeRuntime.builder()
            .stagingDirectory(staging)
            .localRepository(staging.resolve("m2"))
            .build();
  }

  @AfterEach
  void tearDown() {
    runtime.close();
  }

  @Nested
  class Instances {

    @Test
    void default_constructor() throws BridgeException {
      try (ObjectHandle sample = runtime.createInstance(SAMPLE)) {
        assertThat(sample.className()).isEqualTo(SAMPLE);
        assertThat(sample.invoke("getMyString").toHost(String.class))
            .isEqualTo("THE DEFAULT CONSTRUCTOR WAS CALLED");
      }
    }

    @Test
    void constructor_with_string() throws BridgeException {
      try (ObjectHandle sample = runtime.createInstance(SAMPLE, InvocationArg.of("abc"));
          ObjectHandle value = sample.invoke("getMyString")) {
        assertThat(value.toHost(String.class)).isEqualTo("abc");
      }
    }

    @Test
    void variadic_constructor_takes_an_array() throws BridgeException {
      try (ObjectHandle sample =
              runtime.createInstance(SAMPLE, InvocationArg.stringArray("a", "b", "c"));
          ObjectHandle value = sample.field("myString")) {
        assertThat(value.toHost(String.class)).isEqualTo("a, b, c");
      }
    }

    @Test
    void jdk_class() throws BridgeException {
      try (ObjectHandle list = runtime.createInstance("java.util.ArrayList")) {
        list.invoke("add", InvocationArg.of("x")).release();
        assertThat(list.invoke("size").toHost(Integer.class)).isEqualTo(1);
      }
    }

    @Test
    void unknown_class_is_class_not_found() {
      assertThatThrownBy(() -> runtime.createInstance("org.chagres.DoesNotExist"))
          .isInstanceOf(BridgeException.class)
          .hasFieldOrPropertyWithValue("kind", ErrorKind.CLASS_NOT_FOUND);
    }

    @Test
    void no_matching_constructor_is_method_not_found() {
      assertThatThrownBy(
              () -> runtime.createInstance(SAMPLE, InvocationArg.of(1), InvocationArg.of(2)))
          .isInstanceOf(MethodNotFoundException.class)
          .satisfies(
              e ->
                  assertThat(((MethodNotFoundException) e).argTypes())
                      .containsExactly("java.lang.Integer", "java.lang.Integer"));
    }
  }

  @Nested
  class Invocation {

    @Test
    void method_with_arguments() throws BridgeException {
      try (ObjectHandle sample = runtime.createInstance(SAMPLE, InvocationArg.of("my"))) {
        assertThat(sample.invoke("getMyWithArgs", InvocationArg.of("-arg")).toHost(String.class))
            .isEqualTo("my-arg");
      }
    }

    @Test
    void void_method_returns_null_reference() throws BridgeException {
      try (ObjectHandle sample = runtime.createInstance(SAMPLE, InvocationArg.of("abc"));
          ObjectHandle result = sample.invoke("appendToMyString", InvocationArg.of("def"))) {
        assertThat(result.className()).isEqualTo("java.lang.Void");
        assertThat(result.toHostOptional(String.class)).isEmpty();
        assertThat(sample.invoke("getMyString").toHost(String.class)).isEqualTo("abcdef");
      }
    }

    @Test
    void static_method_by_class_name() throws BridgeException {
      try (ObjectHandle result =
          runtime.invokeStatic(SAMPLE, "greet", InvocationArg.of("world"))) {
        assertThat(result.toHost(String.class)).isEqualTo("Hello, world");
      }
    }

    @Test
    void static_method_through_class_handle() throws BridgeException {
      try (ObjectHandle math = runtime.staticClass("java.lang.Math");
          ObjectHandle max =
              math.invoke(
                  "max",
                  InvocationArg.of(3).intoPrimitive(),
                  InvocationArg.of(7).intoPrimitive())) {
        assertThat(math.isStaticClass()).isTrue();
        assertThat(max.className()).isEqualTo("java.lang.Integer");
        assertThat(max.toHost(Integer.class)).isEqualTo(7);
      }
    }

    @Test
    void instance_method_is_not_static() throws BridgeException {
      try (ObjectHandle sampleClass = runtime.staticClass(SAMPLE)) {
        assertThatThrownBy(() -> sampleClass.invoke("getMyString"))
            .isInstanceOf(MethodNotFoundException.class);
      }
    }

    @Test
    void managed_exception_is_reported_not_thrown() throws BridgeException {
      try (ObjectHandle sample = runtime.createInstance(SAMPLE)) {
        assertThatThrownBy(() -> sample.invoke("fail", InvocationArg.of("boom")))
            .isInstanceOf(InvocationFailedException.class)
            .satisfies(
                e -> {
                  InvocationFailedException failure = (InvocationFailedException) e;
                  assertThat(failure.kind()).isEqualTo(ErrorKind.INVOCATION_FAILED);
                  assertThat(failure.managedExceptionClass())
                      .isEqualTo("java.lang.IllegalStateException");
                  assertThat(failure.managedStackTrace())
                      .contains("boom")
                      .contains("Caused by: java.lang.IllegalArgumentException: root cause");
                });
      }
      assertThat(runtime.isOpen()).isTrue();
    }

    @Test
    void method_on_null_reference_fails_in_runtime() throws BridgeException {
      try (ObjectHandle sample = runtime.createInstance(SAMPLE);
          ObjectHandle nothing = sample.invoke("getNullInteger")) {
        assertThatThrownBy(() -> nothing.invoke("intValue"))
            .isInstanceOf(InvocationFailedException.class)
            .satisfies(
                e ->
                    assertThat(((InvocationFailedException) e).managedExceptionClass())
                        .isEqualTo("java.lang.NullPointerException"));
      }
    }

    @Test
    void result_is_declared_as_return_type() throws BridgeException {
      try (ObjectHandle sample = runtime.createInstance(SAMPLE);
          ObjectHandle chars = sample.invoke("getCharSequence")) {
        assertThat(chars.className()).isEqualTo("java.lang.CharSequence");
        assertThat(chars.invoke("length").toHost(Integer.class)).isEqualTo(15);
        assertThatThrownBy(() -> chars.invoke("isBlank"))
            .isInstanceOf(MethodNotFoundException.class);
      }
    }

    @Test
    void handle_argument_is_not_consumed() throws BridgeException {
      try (ObjectHandle sample = runtime.createInstance(SAMPLE);
          ObjectHandle suffix = runtime.toManaged(InvocationArg.of("!"))) {
        sample.invoke("appendToMyString", InvocationArg.of(suffix)).release();
        assertThat(suffix.isReleased()).isFalse();
        assertThat(suffix.toHost(String.class)).isEqualTo("!");
      }
    }

    @Test
    void list_argument_is_the_host_list() throws BridgeException {
      List<String> values = new java.util.ArrayList<>(List.of("a", "b"));
      InvocationArg arg = InvocationArg.of(values, "java.util.List");
      values.add("c");
      try (ObjectHandle sample = runtime.createInstance(SAMPLE);
          ObjectHandle joined = sample.invoke("list", arg)) {
        assertThat(joined.toHost(String.class)).isEqualTo("a,b,c");
      }
    }

    @Test
    void collection_result_converts_to_list() throws BridgeException {
      try (ObjectHandle sample = runtime.createInstance(SAMPLE);
          ObjectHandle numbers =
              sample.invoke("getNumbersUntil", InvocationArg.of(4).intoPrimitive())) {
        assertThat(numbers.toHostList(Integer.class)).containsExactly(0, 1, 2, 3);
      }
    }

    @Test
    void map_result_is_usable_through_its_interface() throws BridgeException {
      try (ObjectHandle sample = runtime.createInstance(SAMPLE);
          ObjectHandle map = sample.invoke("getMap");
          ObjectHandle two = map.invoke("get", InvocationArg.of("two"))) {
        assertThat(map.className()).isEqualTo("java.util.Map");
        assertThat(two.toHost(Long.class)).isEqualTo(2L);
      }
    }
  }

  @Nested
  class Overloads {

    @Test
    void exact_primitive_match_wins() throws BridgeException {
      try (ObjectHandle sample = runtime.createInstance(SAMPLE)) {
        InvocationArg one = InvocationArg.of(1).intoPrimitive();
        InvocationArg two = InvocationArg.of(2).intoPrimitive();
        try (ObjectHandle sum = sample.invoke("addInts", one, two)) {
          assertThat(sum.toHost(Integer.class)).isEqualTo(3);
        }
      }
    }

    @Test
    void boxed_arguments_resolve_by_unboxing() throws BridgeException {
      try (ObjectHandle sample = runtime.createInstance(SAMPLE)) {
        assertThat(
                sample
                    .invoke("addInts", InvocationArg.of(4), InvocationArg.of(5))
                    .toHost(Integer.class))
            .isEqualTo(9);
      }
    }

    @Test
    void variadic_member_takes_an_explicit_array() throws BridgeException {
      InvocationArg ints =
          InvocationArg.array(
              "java.lang.Integer", InvocationArg.of(1), InvocationArg.of(2), InvocationArg.of(3));
      try (ObjectHandle sample = runtime.createInstance(SAMPLE)) {
        assertThat(sample.invoke("addInts", ints).toHost(Integer.class)).isEqualTo(6);
        assertThat(
                sample
                    .invoke("getMyWithArgsList", InvocationArg.stringArray("x", "y"))
                    .toHost(String.class))
            .isEqualTo("xy");
      }
    }

    @Test
    void most_specific_reference_type_wins() throws BridgeException {
      try (ObjectHandle sample = runtime.createInstance(SAMPLE)) {
        assertThat(sample.invoke("describe", InvocationArg.of("s")).toHost(String.class))
            .isEqualTo("string");
        assertThat(
                sample
                    .invoke("describe", InvocationArg.nullOf("java.lang.String"))
                    .toHost(String.class))
            .isEqualTo("string");
      }
    }

    @Test
    void boxed_argument_prefers_reference_widening_over_unboxing() throws BridgeException {
      try (ObjectHandle sample = runtime.createInstance(SAMPLE)) {
        assertThat(sample.invoke("describe", InvocationArg.of(5)).toHost(String.class))
            .isEqualTo("object");
        assertThat(
                sample
                    .invoke("describe", InvocationArg.of(5).intoPrimitive())
                    .toHost(String.class))
            .isEqualTo("long");
      }
    }

    @Test
    void null_for_primitive_parameter_is_conversion_error() throws BridgeException {
      try (ObjectHandle sample = runtime.createInstance(SAMPLE)) {
        assertThatThrownBy(
                () ->
                    sample.invoke(
                        "addInts",
                        InvocationArg.nullOf("java.lang.Integer"),
                        InvocationArg.of(1)))
            .isInstanceOf(BridgeException.class)
            .hasFieldOrPropertyWithValue("kind", ErrorKind.CONVERSION_ERROR);
      }
    }
  }

  @Nested
  class Fields {

    @Test
    void read_and_write_instance_field() throws BridgeException {
      try (ObjectHandle sample = runtime.createInstance(SAMPLE)) {
        runtime.setField(sample, "counter", InvocationArg.of(42).intoPrimitive());
        runtime.setField(sample, "myString", InvocationArg.of("changed"));
        assertThat(sample.field("counter").toHost(Integer.class)).isEqualTo(42);
        assertThat(sample.field("myString").toHost(String.class)).isEqualTo("changed");
      }
    }

    @Test
    void boxed_value_unboxes_into_primitive_field() throws BridgeException {
      try (ObjectHandle sample = runtime.createInstance(SAMPLE)) {
        runtime.setField(sample, "counter", InvocationArg.of(7));
        assertThat(sample.field("counter").toHost(Integer.class)).isEqualTo(7);
      }
    }

    @Test
    void field_is_declared_as_its_type() throws BridgeException {
      try (ObjectHandle sample = runtime.createInstance(SAMPLE);
          ObjectHandle counter = sample.field("counter");
          ObjectHandle boxed = sample.field("boxedCounter")) {
        assertThat(counter.className()).isEqualTo("java.lang.Integer");
        assertThat(boxed.toHostOptional(Integer.class)).isEmpty();
      }
    }

    @Test
    void non_public_field_is_readable() throws BridgeException {
      try (ObjectHandle sample = runtime.createInstance(SAMPLE)) {
        assertThat(sample.field("secret").toHost(String.class)).isEqualTo("hidden");
      }
    }

    @Test
    void static_field_through_class_handle() throws BridgeException {
      try (ObjectHandle sampleClass = runtime.staticClass(SAMPLE)) {
        assertThat(sampleClass.field("GREETING").toHost(String.class))
            .isEqualTo(SampleObject.GREETING);
      }
    }

    @Test
    void wrong_value_type_is_conversion_error() throws BridgeException {
      try (ObjectHandle sample = runtime.createInstance(SAMPLE)) {
        assertThatThrownBy(() -> runtime.setField(sample, "myString", InvocationArg.of(1)))
            .isInstanceOf(BridgeException.class)
            .hasFieldOrPropertyWithValue("kind", ErrorKind.CONVERSION_ERROR);
      }
    }

    @Test
    void missing_field_is_field_not_found() throws BridgeException {
      try (ObjectHandle sample = runtime.createInstance(SAMPLE)) {
        assertThatThrownBy(() -> sample.field("nope"))
            .isInstanceOf(BridgeException.class)
            .hasFieldOrPropertyWithValue("kind", ErrorKind.FIELD_NOT_FOUND);
      }
    }
  }

  @Nested
  class Casts {

    @Test
    void cast_changes_declared_class() throws BridgeException {
      try (ObjectHandle list = runtime.createInstance("java.util.ArrayList");
          ObjectHandle asCollection = list.cast("java.util.Collection")) {
        assertThat(asCollection.className()).isEqualTo("java.util.Collection");
        assertThat(asCollection.invoke("isEmpty").toHost(Boolean.class)).isTrue();
        assertThat(list.isReleased()).isFalse();
      }
    }

    @Test
    void cast_to_unrelated_class_is_illegal() throws BridgeException {
      try (ObjectHandle list = runtime.createInstance("java.util.ArrayList")) {
        assertThatThrownBy(() -> list.cast("java.lang.String"))
            .isInstanceOf(BridgeException.class)
            .hasFieldOrPropertyWithValue("kind", ErrorKind.ILLEGAL_CAST);
      }
    }

    @Test
    void cast_of_class_handle_is_illegal() throws BridgeException {
      try (ObjectHandle cls = runtime.staticClass(SAMPLE)) {
        assertThatThrownBy(() -> cls.cast("java.lang.Object"))
            .isInstanceOf(BridgeException.class)
            .hasFieldOrPropertyWithValue("kind", ErrorKind.ILLEGAL_CAST);
      }
    }
  }

  @Nested
  class Arrays {

    @Test
    void primitive_array_argument() throws BridgeException {
      InvocationArg longs =
          InvocationArg.array(
              "long",
              InvocationArg.of(1L).intoPrimitive(),
              InvocationArg.of(2).intoPrimitive(),
              InvocationArg.of(3L));
      try (ObjectHandle result = runtime.invokeStatic(SAMPLE, "useLongPrimitivesArray", longs)) {
        assertThat(result.toHost(String.class)).isEqualTo("6");
      }
    }

    @Test
    void create_java_array() throws BridgeException {
      try (ObjectHandle array =
          runtime.createJavaArray(
              "java.lang.String", InvocationArg.of("a"), InvocationArg.of("b"))) {
        assertThat(array.className()).isEqualTo("[Ljava.lang.String;");
        assertThat(array.toHost(String[].class)).containsExactly("a", "b");
        assertThat(array.toHostList(String.class)).containsExactly("a", "b");
      }
    }

    @Test
    void byte_array_round_trip() throws BridgeException {
      try (ObjectHandle sample = runtime.createInstance(SAMPLE);
          ObjectHandle bytes = sample.invoke("getBytes")) {
        assertThat(bytes.toHost(byte[].class)).containsExactly(1, 2, 3);
      }
    }

    @Test
    void mismatched_element_is_conversion_error() {
      assertThatThrownBy(
              () -> runtime.createJavaArray("java.lang.Integer", InvocationArg.of("one")))
          .isInstanceOf(BridgeException.class)
          .hasFieldOrPropertyWithValue("kind", ErrorKind.CONVERSION_ERROR);
    }
  }

  @Nested
  class Lifecycle {

    @Test
    void references_are_counted_until_released() throws BridgeException {
      int before = runtime.liveReferenceCount();
      ObjectHandle sample = runtime.createInstance(SAMPLE);
      ObjectHandle clone = sample.cloneReference();
      assertThat(runtime.liveReferenceCount()).isEqualTo(before + 2);

      sample.release();
      try (ObjectHandle value = clone.invoke("getMyString")) {
        assertThat(value.toHost(String.class)).isNotNull();
      }
      clone.release();
      assertThat(runtime.liveReferenceCount()).isEqualTo(before);
      assertThat(runtime.peakReferenceCount()).isGreaterThanOrEqualTo(before + 2);
    }

    @Test
    void caches_report_their_statistics() throws BridgeException {
      try (ObjectHandle sample = runtime.createInstance(SAMPLE)) {
        sample.invoke("getMyString").release();
        sample.invoke("getMyString").release();
      }

      int max = BridgeRuntimeBuilder.DEFAULT_CACHE_MAX_ENTRIES;
      assertThat(runtime.cacheStats())
          .contains("classes: size=")
          .contains("methods: size=1/" + max + " hits=1");
    }

    @Test
    void closed_runtime_rejects_operations() throws BridgeException {
      ObjectHandle sample = runtime.createInstance(SAMPLE);
      runtime.close();

      assertThat(runtime.isOpen()).isFalse();
      assertThat(runtime.liveReferenceCount()).isZero();
      assertThatThrownBy(() -> sample.invoke("getMyString"))
          .isInstanceOf(BridgeException.class)
          .hasFieldOrPropertyWithValue("kind", ErrorKind.RUNTIME_UNAVAILABLE);
      assertThatThrownBy(() -> runtime.createInstance(SAMPLE))
          .isInstanceOf(BridgeException.class);
      // Releasing after shutdown is harmless
      sample.release();
    }

    @Test
    void reference_limit_is_enforced(@TempDir Path otherStaging) throws BridgeException {
      try (BridgeRuntime limited =
          BridgeRuntime.builder()
              .stagingDirectory(otherStaging)
              .localRepository(otherStaging)
              .limits(BridgeLimits.defaults().withMaxReferences(2))
              .build()) {
        limited.toManaged(InvocationArg.of(1));
        limited.toManaged(InvocationArg.of(2));
        assertThatThrownBy(() -> limited.toManaged(InvocationArg.of(3)))
            .isInstanceOf(BridgeException.class)
            .hasFieldOrPropertyWithValue("kind", ErrorKind.RESOURCE_LIMIT);
      }
    }

    @Test
    void handles_of_other_runtimes_are_rejected(@TempDir Path otherStaging)
        throws BridgeException {
      try (BridgeRuntime other =
              BridgeRuntime.builder()
                  .stagingDirectory(otherStaging)
                  .localRepository(otherStaging)
                  .build();
          ObjectHandle foreign = other.createInstance(SAMPLE)) {
        assertThat(other.id()).isNotEqualTo(runtime.id());
        assertThatThrownBy(() -> runtime.invoke(foreign, "getMyString"))
            .isInstanceOf(IllegalArgumentException.class);
      }
    }

    @Test
    void system_property_options_are_applied(@TempDir Path otherStaging) throws BridgeException {
      try (BridgeRuntime configured =
              BridgeRuntime.builder()
                  .stagingDirectory(otherStaging)
                  .localRepository(otherStaging)
                  .javaOpt(new JavaOpt("-Dchagres.test.option=enabled"))
                  .javaOpt(new JavaOpt("-Xmx64m"))
                  .build();
          ObjectHandle value =
              configured.invokeStatic(
                  "java.lang.System", "getProperty", InvocationArg.of("chagres.test.option"))) {
        assertThat(value.toHost(String.class)).isEqualTo("enabled");
        assertThat(configured.javaOpts()).hasSize(2);
      } finally {
        System.clearProperty("chagres.test.option");
      }
    }
  }
}
