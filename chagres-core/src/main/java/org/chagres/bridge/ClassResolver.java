package org.chagres.bridge;

import java.util.logging.Logger;

/**
 * Resolves class names through a runtime's class loader.
 *
 * <p>Accepted forms: primitive keywords ({@code int}), binary names ({@code java.lang.String},
 * {@code java.util.Map$Entry}), JVM descriptors ({@code [B}, {@code [Ljava.lang.String;}) and
 * source-style array names ({@code java.lang.String[]}, {@code int[][]}). Successful lookups are
 * cached; failures are not, so a class made available later by an artifact deployment is found on
 * the next lookup.
 */
final class ClassResolver {
  private static final Logger LOG = Logger.getLogger(ClassResolver.class.getName());

  private final ClassLoader loader;
  private final BoundedCache<String, Class<?>> cache;

  ClassResolver(ClassLoader loader, int maxEntries) {
    this.loader = loader;
    this.cache = new BoundedCache<>("classes", maxEntries);
  }

  Class<?> resolve(String className) throws BridgeException {
    if (className == null || className.isEmpty()) {
      throw BridgeException.classNotFound(String.valueOf(className), null);
    }
    return cache.getOrLoad(className, this::load);
  }

  String getStats() {
    return cache.getStats();
  }

  private Class<?> load(String className) throws BridgeException {
    Class<?> primitive = Primitives.forName(className);
    if (primitive != null) {
      return primitive;
    }
    if (className.endsWith("[]")) {
      Class<?> component = resolve(className.substring(0, className.length() - 2).trim());
      if (component == void.class) {
        throw BridgeException.classNotFound(className, null);
      }
      return component.arrayType();
    }
    try {
      return Class.forName(className, true, loader);
    } catch (ClassNotFoundException | LinkageError e) {
      LOG.fine("Class lookup failed for " + className + ": " + e);
      throw BridgeException.classNotFound(className, e);
    }
  }
}
