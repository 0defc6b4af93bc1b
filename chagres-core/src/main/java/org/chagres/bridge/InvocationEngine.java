package org.chagres.bridge;

import java.lang.reflect.Field;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import org.chagres.bridge.ReflectionCache.CachedConstructor;
import org.chagres.bridge.ReflectionCache.CachedMethod;
import org.chagres.bridge.observability.BridgeEvents;
import org.chagres.bridge.observability.InvocationContext;
import org.chagres.bridge.observability.Metrics;
import org.chagres.bridge.observability.Operation;
import org.chagres.bridge.observability.StructuredLogger;

/**
 * Performs every operation that crosses into a runtime: construction, invocation, field access,
 * casts, reference cloning and conversion back to host values.
 *
 * <p>Each operation attaches the calling thread if needed, is timed and logged, and returns a
 * freshly registered {@link ObjectHandle}. Exceptions raised by managed code never escape: they are
 * reported as {@link InvocationFailedException}.
 */
final class InvocationEngine {

  /** A call into managed code; anything it throws is a managed failure. */
  @FunctionalInterface
  private interface ManagedCall {
    Object run() throws Throwable;
  }

  /** A bridge operation; may fail with a {@link BridgeException}. */
  @FunctionalInterface
  interface BridgeCall<T> {
    T run() throws BridgeException;
  }

  private final BridgeRuntime runtime;
  private final ThreadGateway gateway;
  private final ObjectRegistry registry;
  private final ClassResolver classes;
  private final ReflectionCache reflection;
  private final Marshaller marshaller;
  private final AtomicLong invocationIds = new AtomicLong();

  InvocationEngine(
      BridgeRuntime runtime,
      ThreadGateway gateway,
      ObjectRegistry registry,
      ClassResolver classes,
      ReflectionCache reflection,
      Marshaller marshaller) {
    this.runtime = runtime;
    this.gateway = gateway;
    this.registry = registry;
    this.classes = classes;
    this.reflection = reflection;
    this.marshaller = marshaller;
  }

  // ========== CONSTRUCTION ==========

  ObjectHandle createInstance(String className, InvocationArg[] args) throws BridgeException {
    return observe(
        Operation.CREATE_INSTANCE,
        className,
        () -> {
          Class<?> cls = classes.resolve(className);
          WireValue[] wire = marshaller.toWire(args);
          CachedConstructor ctor = reflection.getConstructor(cls, WireValue.types(wire));
          Object[] values =
              MethodResolver.coerceArguments(
                  className, ctor.parameterTypes(), WireValue.values(wire));
          Object instance = call(className + ".<init>", () -> ctor.newInstance(values));
          return newHandle(instance, cls, false);
        });
  }

  ObjectHandle staticClass(String className) throws BridgeException {
    return observe(
        Operation.STATIC_CLASS,
        className,
        () -> {
          Class<?> cls = classes.resolve(className);
          if (cls.isPrimitive()) {
            throw BridgeException.classNotFound(className + " (primitive, no members)", null);
          }
          return newHandle(cls, cls, true);
        });
  }

  ObjectHandle createArray(String elementClassName, InvocationArg[] elements)
      throws BridgeException {
    return observe(
        Operation.CREATE_ARRAY,
        elementClassName + "[]",
        () -> {
          WireValue array = marshaller.toWire(InvocationArg.array(elementClassName, elements));
          return newHandle(array.value(), array.type(), false);
        });
  }

  ObjectHandle toManaged(InvocationArg arg) throws BridgeException {
    return observe(
        Operation.TO_MANAGED,
        arg.className(),
        () -> {
          WireValue wire = marshaller.toWire(arg);
          return newHandle(wire.value(), Primitives.wrap(wire.type()), false);
        });
  }

  // ========== INVOCATION ==========

  ObjectHandle invoke(ObjectHandle receiver, String methodName, InvocationArg[] args)
      throws BridgeException {
    checkOwner(receiver);
    if (receiver.isStaticClass()) {
      return invokeStatic(receiver.declaredClass(), methodName, args);
    }
    Class<?> owner = receiver.declaredClass();
    String target = owner.getName() + "." + methodName;
    return observe(
        Operation.INVOKE,
        target,
        () -> {
          Object instance = receiver.target();
          WireValue[] wire = marshaller.toWire(args);
          CachedMethod method =
              reflection.getMethod(owner, methodName, WireValue.types(wire), false);
          Object[] values =
              MethodResolver.coerceArguments(
                  methodName, method.parameterTypes(), WireValue.values(wire));
          if (instance == null && !method.isStatic) {
            throw new InvocationFailedException(
                target,
                new NullPointerException(
                    "Cannot invoke " + method.describe() + " on a null reference"));
          }
          Object result = call(target, () -> method.invoke(instance, values));
          return newHandle(result, method.resultType, false);
        });
  }

  ObjectHandle invokeStatic(String className, String methodName, InvocationArg[] args)
      throws BridgeException {
    return observe(
        Operation.INVOKE_STATIC,
        className + "." + methodName,
        () -> callStatic(classes.resolve(className), methodName, args));
  }

  private ObjectHandle invokeStatic(Class<?> owner, String methodName, InvocationArg[] args)
      throws BridgeException {
    return observe(
        Operation.INVOKE_STATIC,
        owner.getName() + "." + methodName,
        () -> callStatic(owner, methodName, args));
  }

  private ObjectHandle callStatic(Class<?> owner, String methodName, InvocationArg[] args)
      throws BridgeException {
    WireValue[] wire = marshaller.toWire(args);
    CachedMethod method = reflection.getMethod(owner, methodName, WireValue.types(wire), true);
    Object[] values =
        MethodResolver.coerceArguments(methodName, method.parameterTypes(), WireValue.values(wire));
    Object result =
        call(owner.getName() + "." + methodName, () -> method.invoke(null, values));
    return newHandle(result, method.resultType, false);
  }

  // ========== FIELDS ==========

  ObjectHandle field(ObjectHandle holder, String fieldName) throws BridgeException {
    checkOwner(holder);
    String target = holder.className() + "." + fieldName;
    return observe(
        Operation.FIELD,
        target,
        () -> {
          Object instance = holder.target();
          Field field = lookupField(holder, instance, fieldName);
          Object receiver = holder.isStaticClass() ? null : instance;
          Object value = call(target, () -> field.get(receiver));
          return newHandle(value, Primitives.wrap(field.getType()), false);
        });
  }

  void setField(ObjectHandle holder, String fieldName, InvocationArg value)
      throws BridgeException {
    checkOwner(holder);
    String target = holder.className() + "." + fieldName;
    observe(
        Operation.SET_FIELD,
        target,
        () -> {
          Object instance = holder.target();
          Field field = lookupField(holder, instance, fieldName);
          WireValue wire = marshaller.toWire(value);
          Class<?> fieldType = field.getType();
          if (!MethodResolver.isConvertible(fieldType, wire.type(), true)) {
            throw BridgeException.conversion(
                "Cannot assign "
                    + wire.type().getName()
                    + " to field "
                    + target
                    + " of type "
                    + fieldType.getName());
          }
          Object[] coerced =
              MethodResolver.coerceArguments(
                  fieldName, new Class<?>[] {fieldType}, new Object[] {wire.value()});
          Object receiver = holder.isStaticClass() ? null : instance;
          call(
              target,
              () -> {
                field.set(receiver, coerced[0]);
                return null;
              });
          return null;
        });
  }

  private Field lookupField(ObjectHandle holder, Object instance, String fieldName)
      throws BridgeException {
    if (holder.isStaticClass()) {
      return reflection.getField(holder.declaredClass(), fieldName, true);
    }
    if (instance == null) {
      throw new InvocationFailedException(
          holder.className() + "." + fieldName,
          new NullPointerException("Cannot read field '" + fieldName + "' of a null reference"));
    }
    try {
      return reflection.getField(holder.declaredClass(), fieldName, false);
    } catch (BridgeException e) {
      if (e.kind() != ErrorKind.FIELD_NOT_FOUND || instance.getClass() == holder.declaredClass()) {
        throw e;
      }
      // Declared as a supertype: look on the runtime class too
      return reflection.getField(instance.getClass(), fieldName, false);
    }
  }

  // ========== REFERENCES ==========

  ObjectHandle cast(ObjectHandle handle, String targetClassName) throws BridgeException {
    checkOwner(handle);
    return observe(
        Operation.CAST,
        handle.className() + " -> " + targetClassName,
        () -> {
          if (handle.isStaticClass()) {
            throw new BridgeException(
                ErrorKind.ILLEGAL_CAST,
                "Cannot cast class handle " + handle.className() + " to " + targetClassName);
          }
          Object instance = handle.target();
          Class<?> target = classes.resolve(targetClassName);
          if (target.isPrimitive() || (instance != null && !target.isInstance(instance))) {
            throw new BridgeException(
                ErrorKind.ILLEGAL_CAST,
                "Cannot cast "
                    + (instance == null ? "null" : instance.getClass().getName())
                    + " to "
                    + targetClassName);
          }
          return newHandle(instance, target, false);
        });
  }

  ObjectHandle cloneReference(ObjectHandle handle) throws BridgeException {
    checkOwner(handle);
    return observe(
        Operation.CLONE_REFERENCE,
        handle.className(),
        () -> newHandle(handle.target(), handle.declaredClass(), handle.isStaticClass()));
  }

  // ========== HOST CONVERSION ==========

  <T> T toHost(ObjectHandle handle, Class<T> type) throws BridgeException {
    checkOwner(handle);
    return observe(
        Operation.TO_HOST, type.getName(), () -> marshaller.toHost(handle.target(), type));
  }

  <T> Optional<T> toHostOptional(ObjectHandle handle, Class<T> type) throws BridgeException {
    checkOwner(handle);
    return observe(
        Operation.TO_HOST,
        type.getName(),
        () -> {
          Object value = handle.target();
          return value == null ? Optional.empty() : Optional.of(marshaller.toHost(value, type));
        });
  }

  <E> List<E> toHostList(ObjectHandle handle, Class<E> elementType) throws BridgeException {
    checkOwner(handle);
    return observe(
        Operation.TO_HOST,
        "List<" + elementType.getName() + ">",
        () -> marshaller.toHostList(handle.target(), elementType));
  }

  // ========== SUPPORT ==========

  /** Register a managed object delivered by the runtime, declared as its own runtime class. */
  ObjectHandle adopt(Object value) throws BridgeException {
    return newHandle(value, value == null ? Object.class : value.getClass(), false);
  }

  ObjectHandle newHandle(Object value, Class<?> declaredClass, boolean staticReceiver)
      throws BridgeException {
    long token = registry.register(value);
    return new ObjectHandle(runtime, registry, token, declaredClass, staticReceiver);
  }

  /**
   * Run one bridge operation on an attached thread, with timing, logging, metrics and a JFR event.
   */
  <T> T observe(Operation operation, String target, BridgeCall<T> body) throws BridgeException {
    gateway.attach(true).checkUsable();
    InvocationContext ctx =
        InvocationContext.create(runtime.id(), invocationIds.incrementAndGet(), operation, target);
    BridgeEvents.InvocationEvent event = BridgeEvents.beginInvocation(ctx);
    try {
      T result = body.run();
      complete(ctx, event, true, null);
      return result;
    } catch (BridgeException e) {
      complete(ctx, event, false, e.kind().name());
      StructuredLogger.logError(ctx, e.kind().name(), e.getMessage(), e.kind().isClientError());
      throw e;
    } catch (RuntimeException e) {
      complete(ctx, event, false, e.getClass().getSimpleName());
      throw e;
    }
  }

  private static void complete(
      InvocationContext ctx, BridgeEvents.InvocationEvent event, boolean success, String error) {
    BridgeEvents.endInvocation(event, success, error);
    Metrics.getInstance().recordOperation(ctx.operation(), ctx.elapsedMicros(), success);
    StructuredLogger.logOperation(ctx, success, error);
  }

  private static Object call(String target, ManagedCall call) throws InvocationFailedException {
    try {
      return call.run();
    } catch (Throwable t) {
      throw new InvocationFailedException(target, t);
    }
  }

  private void checkOwner(ObjectHandle handle) {
    if (handle.runtime() != runtime) {
      throw new IllegalArgumentException(
          "Handle "
              + handle
              + " belongs to runtime "
              + handle.runtime().id()
              + ", not runtime "
              + runtime.id());
    }
  }
}
