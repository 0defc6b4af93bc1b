package org.chagres.bridge;

import java.util.HashMap;
import java.util.Map;

/** Boxing tables and primitive widening rules (JLS 5.1.2). */
final class Primitives {

  private static final Map<Class<?>, Class<?>> PRIMITIVE_TO_WRAPPER = new HashMap<>();
  private static final Map<Class<?>, Class<?>> WRAPPER_TO_PRIMITIVE = new HashMap<>();
  private static final Map<String, Class<?>> PRIMITIVES_BY_NAME = new HashMap<>();

  static {
    PRIMITIVE_TO_WRAPPER.put(boolean.class, Boolean.class);
    PRIMITIVE_TO_WRAPPER.put(byte.class, Byte.class);
    PRIMITIVE_TO_WRAPPER.put(char.class, Character.class);
    PRIMITIVE_TO_WRAPPER.put(short.class, Short.class);
    PRIMITIVE_TO_WRAPPER.put(int.class, Integer.class);
    PRIMITIVE_TO_WRAPPER.put(long.class, Long.class);
    PRIMITIVE_TO_WRAPPER.put(float.class, Float.class);
    PRIMITIVE_TO_WRAPPER.put(double.class, Double.class);
    PRIMITIVE_TO_WRAPPER.put(void.class, Void.class);

    for (var entry : PRIMITIVE_TO_WRAPPER.entrySet()) {
      WRAPPER_TO_PRIMITIVE.put(entry.getValue(), entry.getKey());
      PRIMITIVES_BY_NAME.put(entry.getKey().getName(), entry.getKey());
    }
  }

  private Primitives() {}

  /** The wrapper class of {@code type} if it is primitive, otherwise {@code type} itself. */
  static Class<?> wrap(Class<?> type) {
    Class<?> wrapper = PRIMITIVE_TO_WRAPPER.get(type);
    return wrapper != null ? wrapper : type;
  }

  /** The primitive class for a wrapper, or {@code null} if {@code type} is not a wrapper. */
  static Class<?> unwrap(Class<?> type) {
    return WRAPPER_TO_PRIMITIVE.get(type);
  }

  static boolean isWrapper(Class<?> type) {
    return WRAPPER_TO_PRIMITIVE.containsKey(type);
  }

  /** Primitive class by keyword ("int", "boolean", ...), or {@code null}. */
  static Class<?> forName(String name) {
    return PRIMITIVES_BY_NAME.get(name);
  }

  /**
   * Check if primitive widening conversion is valid (JLS 5.1.2). Widening: byte -> short -> int ->
   * long -> float -> double, char -> int -> long -> float -> double
   */
  static boolean isWidening(Class<?> to, Class<?> from) {
    if (to == from) return true;

    if (from == byte.class) {
      return to == short.class
          || to == int.class
          || to == long.class
          || to == float.class
          || to == double.class;
    }
    if (from == short.class || from == char.class) {
      return to == int.class || to == long.class || to == float.class || to == double.class;
    }
    if (from == int.class) {
      return to == long.class || to == float.class || to == double.class;
    }
    if (from == long.class) {
      return to == float.class || to == double.class;
    }
    if (from == float.class) {
      return to == double.class;
    }
    return false;
  }

  /**
   * Widen a boxed value to the wrapper of the primitive type {@code to}. The caller has already
   * checked {@link #isWidening}.
   */
  static Object widen(Object value, Class<?> to) {
    if (value instanceof Character c) {
      if (to == char.class) return c;
      value = (int) c.charValue();
    }
    if (!(value instanceof Number n)) {
      return value;
    }
    if (to == byte.class) return n.byteValue();
    if (to == short.class) return n.shortValue();
    if (to == int.class) return n.intValue();
    if (to == long.class) return n.longValue();
    if (to == float.class) return n.floatValue();
    if (to == double.class) return n.doubleValue();
    return value;
  }
}
