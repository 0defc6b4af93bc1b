package org.chagres.bridge;

import java.lang.reflect.Constructor;
import java.lang.reflect.Method;

/**
 * Selects the constructor or method a call binds to.
 *
 * <p>The invocation engine depends only on this interface; how candidates are enumerated and
 * ranked is up to the implementation.
 */
interface MemberResolver {

  /**
   * Resolve a method of {@code owner} applicable to {@code argTypes}.
   *
   * @param staticOnly only consider static methods
   * @throws MethodNotFoundException if no single most specific method exists
   */
  Method resolveMethod(Class<?> owner, String name, Class<?>[] argTypes, boolean staticOnly)
      throws MethodNotFoundException;

  Constructor<?> resolveConstructor(Class<?> owner, Class<?>[] argTypes)
      throws MethodNotFoundException;
}
