package org.chagres.bridge;

import java.lang.invoke.MethodHandle;
import java.lang.invoke.MethodHandles;
import java.lang.reflect.Constructor;
import java.lang.reflect.Field;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.Arrays;
import java.util.function.Function;
import java.util.logging.Logger;

/**
 * Per-runtime cache for reflection lookups.
 *
 * <p>This class caches:
 *
 * <ul>
 *   <li>Public methods and constructors per class (candidate lists for overload resolution)
 *   <li>Resolved methods and constructors, keyed by (class, name, argument types, static-only),
 *       with a {@link MethodHandle} for fast invocation
 *   <li>Field lookups (static and instance)
 * </ul>
 *
 * <p>All caches are LRU-bounded {@link BoundedCache}s, so classes from a runtime's loader are not
 * pinned forever.
 */
final class ReflectionCache {
  private static final Logger LOG = Logger.getLogger(ReflectionCache.class.getName());

  /** Lookup for converting Methods to MethodHandles. */
  static final MethodHandles.Lookup METHOD_LOOKUP = MethodHandles.publicLookup();

  static final Object[] EMPTY_OBJECT_ARRAY = new Object[0];

  private final MemberResolver resolver;

  // --- CANDIDATES ---
  private final BoundedCache<Class<?>, Method[]> publicMethods;
  private final BoundedCache<Class<?>, Constructor<?>[]> publicConstructors;

  // --- RESOLUTION RESULTS ---
  private final BoundedCache<MemberKey, CachedMethod> methods;
  private final BoundedCache<MemberKey, CachedConstructor> constructors;

  // --- FIELDS ---
  private final BoundedCache<MemberKey, Field> fields;

  ReflectionCache(int maxEntries) {
    this(maxEntries, MethodResolver::new);
  }

  ReflectionCache(int maxEntries, Function<ReflectionCache, MemberResolver> resolverFactory) {
    this.publicMethods = new BoundedCache<>("publicMethods", maxEntries);
    this.publicConstructors = new BoundedCache<>("publicConstructors", maxEntries);
    this.methods = new BoundedCache<>("methods", maxEntries);
    this.constructors = new BoundedCache<>("constructors", maxEntries);
    this.fields = new BoundedCache<>("fields", maxEntries);
    this.resolver = resolverFactory.apply(this);
  }

  // ========== CANDIDATES ==========

  Method[] getPublicMethods(Class<?> clazz) {
    return publicMethods.getOrLoad(clazz, Class::getMethods);
  }

  Constructor<?>[] getPublicConstructors(Class<?> clazz) {
    return publicConstructors.getOrLoad(clazz, Class::getConstructors);
  }

  // ========== METHOD RESOLUTION ==========

  CachedMethod getMethod(Class<?> owner, String name, Class<?>[] argTypes, boolean staticOnly)
      throws MethodNotFoundException {
    MemberKey key = new MemberKey(owner, name, argTypes, staticOnly);
    return methods.getOrLoad(
        key, k -> new CachedMethod(resolver.resolveMethod(owner, name, argTypes, staticOnly)));
  }

  CachedConstructor getConstructor(Class<?> owner, Class<?>[] argTypes)
      throws MethodNotFoundException {
    MemberKey key = new MemberKey(owner, "<init>", argTypes, false);
    return constructors.getOrLoad(
        key, k -> new CachedConstructor(resolver.resolveConstructor(owner, argTypes)));
  }

  // ========== FIELD ==========

  /**
   * Find a field by name. Public fields (including inherited and interface constants) are found
   * first; otherwise the declared hierarchy is searched and the field made accessible if the module
   * system allows it.
   */
  Field getField(Class<?> owner, String fieldName, boolean staticOnly) throws BridgeException {
    MemberKey key = new MemberKey(owner, fieldName, new Class<?>[0], staticOnly);
    Field field = fields.getOrLoad(key, k -> lookupField(owner, fieldName));
    if (staticOnly && !Modifier.isStatic(field.getModifiers())) {
      throw new BridgeException(
          ErrorKind.FIELD_NOT_FOUND,
          "Field '" + fieldName + "' of " + owner.getName() + " is not static");
    }
    return field;
  }

  private static Field lookupField(Class<?> owner, String fieldName) throws BridgeException {
    try {
      return owner.getField(fieldName);
    } catch (NoSuchFieldException e) {
      // Fall through to declared fields
    }
    Class<?> current = owner;
    while (current != null) {
      try {
        Field field = current.getDeclaredField(fieldName);
        if (!field.trySetAccessible()) {
          LOG.fine("Field " + current.getName() + "." + fieldName + " is not accessible");
        }
        return field;
      } catch (NoSuchFieldException e) {
        current = current.getSuperclass();
      }
    }
    throw new BridgeException(
        ErrorKind.FIELD_NOT_FOUND, "No field named '" + fieldName + "' in " + owner.getName());
  }

  String getStats() {
    return String.join(
        "; ",
        publicMethods.getStats(),
        publicConstructors.getStats(),
        methods.getStats(),
        constructors.getStats(),
        fields.getStats());
  }

  /**
   * The most visible declaration of {@code method}. Public methods declared by non-public classes
   * (for example a private {@code Iterator} implementation) cannot be called reflectively, but the
   * same signature on a public supertype can.
   */
  static Method publicDeclaration(Method method) {
    if (Modifier.isPublic(method.getDeclaringClass().getModifiers())) {
      return method;
    }
    Method found = findPublicDeclaration(method.getDeclaringClass(), method);
    return found != null ? found : method;
  }

  private static Method findPublicDeclaration(Class<?> type, Method method) {
    for (Class<?> itf : type.getInterfaces()) {
      if (Modifier.isPublic(itf.getModifiers())) {
        try {
          return itf.getMethod(method.getName(), method.getParameterTypes());
        } catch (NoSuchMethodException e) {
          // Not declared here
        }
      }
      Method found = findPublicDeclaration(itf, method);
      if (found != null) return found;
    }
    Class<?> superclass = type.getSuperclass();
    if (superclass == null) return null;
    if (Modifier.isPublic(superclass.getModifiers())) {
      try {
        return superclass.getMethod(method.getName(), method.getParameterTypes());
      } catch (NoSuchMethodException e) {
        // Keep walking
      }
    }
    return findPublicDeclaration(superclass, method);
  }

  /** The class a result of {@code type} is declared as: primitives boxed, void as Void. */
  static Class<?> declaredResultType(Class<?> type) {
    return Primitives.wrap(type);
  }

  // ========== CACHE KEY ==========

  /** Key for member cache lookup. */
  static final class MemberKey {
    private final Class<?> owner;
    private final String name;
    private final Class<?>[] argTypes;
    private final boolean staticOnly;
    private final int hashCode;

    MemberKey(Class<?> owner, String name, Class<?>[] argTypes, boolean staticOnly) {
      this.owner = owner;
      this.name = name;
      this.argTypes = argTypes.clone();
      this.staticOnly = staticOnly;
      // Pre-compute hash for faster lookups
      int h = owner.hashCode() * 31 + name.hashCode();
      for (Class<?> t : argTypes) {
        h = h * 31 + t.hashCode();
      }
      this.hashCode = h * 2 + (staticOnly ? 1 : 0);
    }

    @Override
    public int hashCode() {
      return hashCode;
    }

    @Override
    public boolean equals(Object obj) {
      if (!(obj instanceof MemberKey other)) return false;
      return owner == other.owner
          && staticOnly == other.staticOnly
          && name.equals(other.name)
          && Arrays.equals(argTypes, other.argTypes);
    }
  }

  // ========== CACHED MEMBERS ==========

  /** Cached method resolution result with MethodHandle for fast invocation. */
  static final class CachedMethod {
    final Method method;
    final MethodHandle handle;
    final boolean isStatic;
    final Class<?> resultType;

    CachedMethod(Method resolved) {
      this.method = publicDeclaration(resolved);
      this.isStatic = Modifier.isStatic(method.getModifiers());
      this.resultType = declaredResultType(method.getReturnType());
      MethodHandle h = null;
      try {
        h = METHOD_LOOKUP.unreflect(method).asFixedArity();
      } catch (IllegalAccessException e) {
        LOG.fine("No method handle for " + method + ", using reflection: " + e.getMessage());
      }
      this.handle = h;
    }

    Class<?>[] parameterTypes() {
      return method.getParameterTypes();
    }

    /**
     * Invoke using the MethodHandle if available, otherwise reflection. Exceptions thrown by the
     * method itself propagate unwrapped.
     */
    Object invoke(Object target, Object[] args) throws Throwable {
      if (handle != null) {
        if (isStatic) {
          return handle.invokeWithArguments(args);
        }
        Object[] fullArgs = new Object[args.length + 1];
        fullArgs[0] = target;
        System.arraycopy(args, 0, fullArgs, 1, args.length);
        return handle.invokeWithArguments(fullArgs);
      }
      try {
        return method.invoke(isStatic ? null : target, args);
      } catch (InvocationTargetException e) {
        throw e.getCause();
      }
    }

    String describe() {
      return MethodResolver.formatMember(method);
    }
  }

  /** Cached constructor resolution result. */
  static final class CachedConstructor {
    final Constructor<?> constructor;
    final MethodHandle handle;

    CachedConstructor(Constructor<?> constructor) {
      this.constructor = constructor;
      MethodHandle h = null;
      if (!Modifier.isAbstract(constructor.getDeclaringClass().getModifiers())) {
        try {
          h = METHOD_LOOKUP.unreflectConstructor(constructor).asFixedArity();
        } catch (IllegalAccessException e) {
          LOG.fine("No constructor handle for " + constructor + ": " + e.getMessage());
        }
      }
      this.handle = h;
    }

    Class<?>[] parameterTypes() {
      return constructor.getParameterTypes();
    }

    Object newInstance(Object[] args) throws Throwable {
      if (handle != null) {
        return handle.invokeWithArguments(args);
      }
      try {
        return constructor.newInstance(args);
      } catch (InvocationTargetException e) {
        throw e.getCause();
      }
    }
  }
}
