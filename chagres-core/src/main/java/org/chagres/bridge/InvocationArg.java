package org.chagres.bridge;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One argument of a constructor or method call, tagged with the managed class it is passed as.
 *
 * <p>Four kinds exist:
 *
 * <ul>
 *   <li>host object: a host value plus the class to create it as ({@code of("abc")} is a {@code
 *       java.lang.String}, {@code of(1)} a {@code java.lang.Integer})
 *   <li>primitive: a scalar passed as the unboxed primitive ({@code of(1).intoPrimitive()} is an
 *       {@code int})
 *   <li>handle: an existing {@link ObjectHandle}, passed as its declared class
 *   <li>array: elements of one class, allocated as a managed array; used for variadic members
 * </ul>
 *
 * <p>Passing a handle does not consume it; the caller still owns and must release it.
 */
public final class InvocationArg {

  enum Kind {
    HOST_OBJECT,
    PRIMITIVE,
    HANDLE,
    ARRAY
  }

  private final Kind kind;
  private final String className;
  private final Object value;
  private final ObjectHandle handle;
  private final List<InvocationArg> elements;

  private InvocationArg(
      Kind kind,
      String className,
      Object value,
      ObjectHandle handle,
      List<InvocationArg> elements) {
    this.kind = kind;
    this.className = Objects.requireNonNull(className, "className");
    this.value = value;
    this.handle = handle;
    this.elements = elements;
  }

  // ========== FACTORIES ==========

  public static InvocationArg of(String value) {
    return new InvocationArg(Kind.HOST_OBJECT, "java.lang.String", value, null, null);
  }

  public static InvocationArg of(boolean value) {
    return new InvocationArg(Kind.HOST_OBJECT, "java.lang.Boolean", value, null, null);
  }

  public static InvocationArg of(byte value) {
    return new InvocationArg(Kind.HOST_OBJECT, "java.lang.Byte", value, null, null);
  }

  public static InvocationArg of(short value) {
    return new InvocationArg(Kind.HOST_OBJECT, "java.lang.Short", value, null, null);
  }

  public static InvocationArg of(int value) {
    return new InvocationArg(Kind.HOST_OBJECT, "java.lang.Integer", value, null, null);
  }

  public static InvocationArg of(long value) {
    return new InvocationArg(Kind.HOST_OBJECT, "java.lang.Long", value, null, null);
  }

  public static InvocationArg of(float value) {
    return new InvocationArg(Kind.HOST_OBJECT, "java.lang.Float", value, null, null);
  }

  public static InvocationArg of(double value) {
    return new InvocationArg(Kind.HOST_OBJECT, "java.lang.Double", value, null, null);
  }

  public static InvocationArg of(char value) {
    return new InvocationArg(Kind.HOST_OBJECT, "java.lang.Character", value, null, null);
  }

  /** A managed {@code byte[]}. The bytes are copied when the argument is marshaled. */
  public static InvocationArg of(byte[] value) {
    return new InvocationArg(Kind.HOST_OBJECT, "[B", value, null, null);
  }

  /**
   * A host value passed as {@code className}. The value must be an instance of that class (numbers
   * are converted to a declared wrapper). Collections and maps are passed as they are, not copied:
   * the managed side sees the host object itself, including changes made before the call.
   */
  public static InvocationArg of(Object value, String className) {
    return new InvocationArg(Kind.HOST_OBJECT, className, value, null, null);
  }

  /** Pass an existing handle, typed as its declared class. */
  public static InvocationArg of(ObjectHandle handle) {
    Objects.requireNonNull(handle, "handle");
    return new InvocationArg(Kind.HANDLE, handle.className(), null, handle, null);
  }

  /** A {@code null} typed as {@code className}, so overload resolution still sees a type. */
  public static InvocationArg nullOf(String className) {
    return new InvocationArg(Kind.HOST_OBJECT, className, null, null, null);
  }

  /** A managed array of {@code elementClassName} holding {@code elements} in order. */
  public static InvocationArg array(String elementClassName, InvocationArg... elements) {
    return array(elementClassName, List.of(elements));
  }

  public static InvocationArg array(String elementClassName, List<InvocationArg> elements) {
    return new InvocationArg(
        Kind.ARRAY,
        elementClassName + "[]",
        null,
        null,
        Collections.unmodifiableList(new ArrayList<>(elements)));
  }

  /** Array of strings, the common case for {@code String...} members. */
  public static InvocationArg stringArray(String... values) {
    List<InvocationArg> elements = new ArrayList<>(values.length);
    for (String value : values) {
      elements.add(of(value));
    }
    return array("java.lang.String", elements);
  }

  // ========== CONVERSION ==========

  /**
   * The same scalar passed as its unboxed primitive type.
   *
   * @throws BridgeException with {@link ErrorKind#CONVERSION_ERROR} if this is not a non-null boxed
   *     scalar
   */
  public InvocationArg intoPrimitive() throws BridgeException {
    if (kind == Kind.PRIMITIVE) {
      return this;
    }
    if (kind == Kind.HOST_OBJECT && value != null) {
      Class<?> primitive = Primitives.unwrap(value.getClass());
      if (primitive != null && value.getClass().getName().equals(className)) {
        return new InvocationArg(Kind.PRIMITIVE, primitive.getName(), value, null, null);
      }
    }
    throw BridgeException.conversion(
        "Cannot convert " + describe() + " to a primitive; only boxed scalars can be");
  }

  // ========== ACCESSORS ==========

  /** Fully qualified managed class name (or primitive keyword) this argument is passed as. */
  public String className() {
    return className;
  }

  public boolean isPrimitive() {
    return kind == Kind.PRIMITIVE;
  }

  Kind kind() {
    return kind;
  }

  Object value() {
    return value;
  }

  ObjectHandle handle() {
    return handle;
  }

  List<InvocationArg> elements() {
    return elements;
  }

  String elementClassName() {
    return className.substring(0, className.length() - 2);
  }

  private String describe() {
    return kind + "(" + className + ")";
  }

  @Override
  public String toString() {
    return switch (kind) {
      case HOST_OBJECT, PRIMITIVE -> describe() + "=" + formatValue(value);
      case HANDLE -> describe() + "=" + handle;
      case ARRAY -> describe() + "[" + elements.size() + "]";
    };
  }

  private static String formatValue(Object value) {
    if (value instanceof byte[] bytes) {
      return "byte[" + bytes.length + "]";
    }
    return String.valueOf(value);
  }
}
