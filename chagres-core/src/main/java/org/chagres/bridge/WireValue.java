package org.chagres.bridge;

/**
 * A marshaled argument: the managed value plus the formal type overload resolution sees for it.
 *
 * <p>The type is {@code int.class} for a primitive-tagged int, {@code Integer.class} for a boxed
 * one, the declared class for a handle and the array class for arrays. It is never {@code null},
 * even when the value is.
 */
record WireValue(Object value, Class<?> type) {

  static Class<?>[] types(WireValue[] values) {
    Class<?>[] types = new Class<?>[values.length];
    for (int i = 0; i < values.length; i++) {
      types[i] = values[i].type();
    }
    return types;
  }

  static Object[] values(WireValue[] values) {
    if (values.length == 0) return ReflectionCache.EMPTY_OBJECT_ARRAY;
    Object[] result = new Object[values.length];
    for (int i = 0; i < values.length; i++) {
      result[i] = values[i].value();
    }
    return result;
  }
}
