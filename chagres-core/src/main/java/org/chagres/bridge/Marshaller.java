package org.chagres.bridge;

import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Converts {@link InvocationArg}s into managed values and managed values back into host values.
 *
 * <p>Host to managed ({@link #toWire}):
 *
 * <ul>
 *   <li>primitive: the boxed scalar, typed as its primitive class
 *   <li>host object: the value checked against (and, for numbers, converted to) the declared class;
 *       arrays are copied
 *   <li>handle: the referenced object, typed as the handle's declared class
 *   <li>array: a new managed array of the element class, filled positionally
 * </ul>
 *
 * <p>Managed to host ({@link #toHost}) supports strings, booleans, characters, every numeric type,
 * arrays of those, and sequences through {@link #toHostList}. Numeric conversions are exact: a
 * value that the target cannot represent (out of range, or losing precision such as 2^53 + 1 as a
 * {@code double}) fails with {@link ErrorKind#NUMERIC_OVERFLOW}.
 */
final class Marshaller {

  private final BridgeRuntime runtime;
  private final ClassResolver classes;
  private final BridgeLimits limits;

  Marshaller(BridgeRuntime runtime, ClassResolver classes, BridgeLimits limits) {
    this.runtime = runtime;
    this.classes = classes;
    this.limits = limits;
  }

  // ========== HOST -> MANAGED ==========

  WireValue toWire(InvocationArg arg) throws BridgeException {
    return switch (arg.kind()) {
      case PRIMITIVE -> new WireValue(arg.value(), Primitives.forName(arg.className()));
      case HOST_OBJECT -> hostObject(arg);
      case HANDLE -> handle(arg.handle());
      case ARRAY -> array(arg);
    };
  }

  WireValue[] toWire(InvocationArg[] args) throws BridgeException {
    WireValue[] wire = new WireValue[args.length];
    for (int i = 0; i < args.length; i++) {
      wire[i] = toWire(args[i]);
    }
    return wire;
  }

  private WireValue hostObject(InvocationArg arg) throws BridgeException {
    Class<?> declared = classes.resolve(arg.className());
    if (declared.isPrimitive()) {
      throw BridgeException.conversion(
          "A host object cannot be declared as primitive "
              + declared.getName()
              + "; use intoPrimitive()");
    }
    Object value = arg.value();
    if (value == null) {
      return new WireValue(null, declared);
    }
    if (value instanceof String s) {
      limits.checkStringLength(s);
    }
    if (Primitives.isWrapper(declared) && !declared.isInstance(value)) {
      Object converted = convertNumber(value, declared);
      if (converted == null) {
        throw mismatch(value, declared);
      }
      return new WireValue(converted, declared);
    }
    if (!declared.isInstance(value)) {
      throw mismatch(value, declared);
    }
    if (value.getClass().isArray()) {
      return new WireValue(copyArray(value), declared);
    }
    return new WireValue(value, declared);
  }

  private WireValue handle(ObjectHandle handle) throws BridgeException {
    if (handle.runtime() != runtime) {
      throw BridgeException.conversion(
          "Handle " + handle + " belongs to runtime " + handle.runtime().id());
    }
    return new WireValue(handle.target(), handle.declaredClass());
  }

  private WireValue array(InvocationArg arg) throws BridgeException {
    Class<?> component = classes.resolve(arg.elementClassName());
    if (component == void.class) {
      throw BridgeException.conversion("Cannot create an array of void");
    }
    List<InvocationArg> elements = arg.elements();
    limits.checkArrayLength(elements.size());

    Object array = Array.newInstance(component, elements.size());
    for (int i = 0; i < elements.size(); i++) {
      WireValue element = toWire(elements.get(i));
      Object value = element.value();
      if (component.isPrimitive()) {
        if (value == null) {
          throw BridgeException.conversion(
              "Element " + i + " of a " + component.getName() + "[] cannot be null");
        }
        Class<?> elementType =
            element.type().isPrimitive() ? element.type() : Primitives.unwrap(element.type());
        if (elementType == null || !Primitives.isWidening(component, elementType)) {
          throw BridgeException.conversion(
              "Element "
                  + i
                  + " of type "
                  + element.type().getName()
                  + " does not fit a "
                  + component.getName()
                  + "[]");
        }
        value = Primitives.widen(value, component);
      }
      try {
        Array.set(array, i, value);
      } catch (IllegalArgumentException e) {
        throw BridgeException.conversion(
            "Element "
                + i
                + " of type "
                + element.type().getName()
                + " cannot be stored in a "
                + component.getName()
                + "[]");
      }
    }
    return new WireValue(array, array.getClass());
  }

  // ========== MANAGED -> HOST ==========

  <T> T toHost(Object value, Class<T> type) throws BridgeException {
    if (type.isPrimitive()) {
      throw new IllegalArgumentException(
          "Request the wrapper of " + type.getName() + ", e.g. Integer.class for int");
    }
    if (value == null) {
      throw BridgeException.nullResult(type);
    }
    Object converted;
    if (type == String.class || type == Boolean.class || type == Character.class) {
      converted = type.isInstance(value) ? value : null;
    } else if (Primitives.isWrapper(type) && type != Void.class) {
      converted = convertNumber(value, type);
    } else if (type.isArray() && isHostComponent(type.getComponentType())) {
      converted = type.isInstance(value) ? copyArray(value) : null;
    } else {
      converted = null;
    }
    if (converted == null) {
      throw BridgeException.invalidCast(value, type);
    }
    return type.cast(converted);
  }

  /** Convert an {@link Iterable} or array into a list, element by element. */
  <E> List<E> toHostList(Object value, Class<E> elementType) throws BridgeException {
    if (value == null) {
      throw BridgeException.nullResult(List.class);
    }
    List<E> result = new ArrayList<>();
    if (value instanceof Iterable<?> iterable) {
      for (Object element : iterable) {
        result.add(toHost(element, elementType));
      }
    } else if (value.getClass().isArray()) {
      int length = Array.getLength(value);
      for (int i = 0; i < length; i++) {
        result.add(toHost(Array.get(value, i), elementType));
      }
    } else {
      throw BridgeException.invalidCast(value, List.class);
    }
    return Collections.unmodifiableList(result);
  }

  private static boolean isHostComponent(Class<?> component) {
    return (component.isPrimitive() && component != void.class)
        || component == String.class
        || Primitives.isWrapper(component);
  }

  // ========== NUMERIC CONVERSION ==========

  /**
   * Convert a boxed number to the wrapper class {@code target} without losing range or precision.
   *
   * @return the converted value, or {@code null} if the kinds do not convert at all (a character
   *     to a number, a floating value to an integral type)
   * @throws BridgeException with {@link ErrorKind#NUMERIC_OVERFLOW} if the value is out of range
   */
  static Object convertNumber(Object value, Class<?> target) throws BridgeException {
    if (target.isInstance(value)) {
      return value;
    }
    if (value instanceof Byte
        || value instanceof Short
        || value instanceof Integer
        || value instanceof Long) {
      long l = ((Number) value).longValue();
      if (target == Byte.class) {
        return (byte) checkRange(l, Byte.MIN_VALUE, Byte.MAX_VALUE, value, target);
      }
      if (target == Short.class) {
        return (short) checkRange(l, Short.MIN_VALUE, Short.MAX_VALUE, value, target);
      }
      if (target == Integer.class) {
        return (int) checkRange(l, Integer.MIN_VALUE, Integer.MAX_VALUE, value, target);
      }
      if (target == Long.class) return l;
      if (target == Float.class) {
        float f = l;
        if (f == 0x1p63f || (long) f != l) {
          throw BridgeException.numericOverflow(value, target);
        }
        return f;
      }
      if (target == Double.class) {
        double d = l;
        if (d == 0x1p63 || (long) d != l) {
          throw BridgeException.numericOverflow(value, target);
        }
        return d;
      }
      return null;
    }
    if (value instanceof Float f) {
      return target == Double.class ? (Object) f.doubleValue() : null;
    }
    if (value instanceof Double d) {
      if (target != Float.class) return null;
      double v = d;
      float f = (float) v;
      if (Double.isFinite(v) && (double) f != v) {
        throw BridgeException.numericOverflow(value, target);
      }
      return f;
    }
    return null;
  }

  private static long checkRange(long l, long min, long max, Object value, Class<?> target)
      throws BridgeException {
    if (l < min || l > max) {
      throw BridgeException.numericOverflow(value, target);
    }
    return l;
  }

  private static BridgeException mismatch(Object value, Class<?> declared) {
    return BridgeException.conversion(
        "Host value of type "
            + value.getClass().getName()
            + " cannot be passed as "
            + declared.getName());
  }

  private static Object copyArray(Object array) {
    int length = Array.getLength(array);
    Object copy = Array.newInstance(array.getClass().getComponentType(), length);
    System.arraycopy(array, 0, copy, 0, length);
    return copy;
  }
}
