package org.chagres.bridge;

import java.lang.reflect.Constructor;
import java.lang.reflect.Executable;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.chagres.bridge.observability.BridgeEvents;
import org.chagres.bridge.observability.StructuredLogger;

/**
 * Overload resolution over public constructors and methods.
 *
 * <p>Resolution follows the managed runtime's own rules (JLS 15.12.2) for fixed-arity calls:
 *
 * <ol>
 *   <li>Phase 1: candidates applicable by identity, primitive widening or reference widening
 *   <li>Phase 2: candidates applicable once boxing and unboxing are allowed
 * </ol>
 *
 * The first phase with an applicable candidate wins, and among its candidates the single most
 * specific one is chosen. A variadic member is matched only when the caller passes the array
 * itself as the final argument, so variable-arity expansion is never attempted.
 *
 * <p>Distinguishing primitive-tagged from boxed arguments matters here: {@code List.remove}
 * binds to {@code remove(int)} for an {@code int} argument and to {@code remove(Object)} for an
 * {@code Integer}.
 */
final class MethodResolver implements MemberResolver {

  private final ReflectionCache cache;

  MethodResolver(ReflectionCache cache) {
    this.cache = cache;
  }

  // ========== METHOD RESOLUTION ==========

  @Override
  public Method resolveMethod(
      Class<?> owner, String name, Class<?>[] argTypes, boolean staticOnly)
      throws MethodNotFoundException {
    List<Method> candidates = new ArrayList<>();
    for (Method m : cache.getPublicMethods(owner)) {
      if (isCandidate(m, name, argTypes.length, staticOnly)) {
        candidates.add(m);
      }
    }
    // Interfaces do not inherit Object's members reflectively, but every instance has them
    if (owner.isInterface() && !staticOnly) {
      for (Method m : cache.getPublicMethods(Object.class)) {
        if (isCandidate(m, name, argTypes.length, false) && !hasSameSignature(candidates, m)) {
          candidates.add(m);
        }
      }
    }
    if (candidates.isEmpty()) {
      String kind = staticOnly ? "No static method" : "No method";
      throw new MethodNotFoundException(name, argTypes, kind + " in " + owner.getName());
    }
    return select(owner, name, candidates, argTypes);
  }

  private static boolean isCandidate(Method m, String name, int arity, boolean staticOnly) {
    return m.getName().equals(name)
        && m.getParameterCount() == arity
        && (!staticOnly || Modifier.isStatic(m.getModifiers()));
  }

  private static boolean hasSameSignature(List<Method> methods, Method m) {
    for (Method existing : methods) {
      if (Arrays.equals(existing.getParameterTypes(), m.getParameterTypes())) {
        return true;
      }
    }
    return false;
  }

  // ========== CONSTRUCTOR RESOLUTION ==========

  @Override
  public Constructor<?> resolveConstructor(Class<?> owner, Class<?>[] argTypes)
      throws MethodNotFoundException {
    List<Constructor<?>> candidates = new ArrayList<>();
    for (Constructor<?> c : cache.getPublicConstructors(owner)) {
      if (c.getParameterCount() == argTypes.length) {
        candidates.add(c);
      }
    }
    if (candidates.isEmpty()) {
      throw new MethodNotFoundException(
          owner.getName(), argTypes, "No public constructor with " + argTypes.length + " args");
    }
    return select(owner, owner.getName(), candidates, argTypes);
  }

  // ========== SELECTION ==========

  private static <T extends Executable> T select(
      Class<?> owner, String name, List<T> candidates, Class<?>[] argTypes)
      throws MethodNotFoundException {
    for (int phase = 1; phase <= 2; phase++) {
      List<T> applicable = new ArrayList<>();
      for (T candidate : candidates) {
        if (isApplicable(candidate.getParameterTypes(), argTypes, phase == 2)) {
          applicable.add(candidate);
        }
      }
      if (applicable.isEmpty()) continue;

      T chosen = mostSpecific(name, applicable, argTypes);
      if (StructuredLogger.isTraceEnabled()) {
        String chosenMember = formatMember(chosen);
        StructuredLogger.logMethodResolution(
            owner.getName(), name, candidates.size(), chosenMember, phase, argTypes);
        BridgeEvents.emitMethodResolution(
            owner.getName(),
            name,
            candidates.size(),
            chosenMember,
            phase,
            formatArgTypes(argTypes));
      }
      return chosen;
    }
    throw new MethodNotFoundException(name, argTypes, "No applicable overload");
  }

  private static <T extends Executable> T mostSpecific(
      String name, List<T> applicable, Class<?>[] argTypes) throws MethodNotFoundException {
    List<T> maximal = new ArrayList<>();
    for (T m1 : applicable) {
      boolean isMaximal = true;
      for (T m2 : applicable) {
        if (m1 != m2
            && isMoreSpecific(m2.getParameterTypes(), m1.getParameterTypes())
            && !isMoreSpecific(m1.getParameterTypes(), m2.getParameterTypes())) {
          isMaximal = false;
          break;
        }
      }
      if (isMaximal) {
        maximal.add(m1);
      }
    }
    if (maximal.size() == 1) {
      return maximal.get(0);
    }
    T preferred = preferAmongEquivalent(maximal);
    if (preferred != null) {
      return preferred;
    }
    throw new MethodNotFoundException(
        name, argTypes, "Ambiguous call, " + maximal.size() + " overloads match");
  }

  /**
   * Several maximal candidates with identical parameter types (a covariant bridge method next to
   * its target, or the same method inherited along several paths): prefer the concrete,
   * non-bridge one with the most specific return type. Returns {@code null} when the candidates
   * differ in their parameters.
   */
  private static <T extends Executable> T preferAmongEquivalent(List<T> maximal) {
    Class<?>[] params = maximal.get(0).getParameterTypes();
    for (T m : maximal) {
      if (!Arrays.equals(params, m.getParameterTypes())) {
        return null;
      }
    }
    T best = null;
    for (T m : maximal) {
      if (best == null || ranksAbove(m, best)) {
        best = m;
      }
    }
    return best;
  }

  private static boolean ranksAbove(Executable a, Executable b) {
    if (!(a instanceof Method ma) || !(b instanceof Method mb)) {
      return false;
    }
    if (ma.isBridge() != mb.isBridge()) {
      return !ma.isBridge();
    }
    Class<?> ra = ma.getReturnType();
    Class<?> rb = mb.getReturnType();
    if (ra != rb && rb.isAssignableFrom(ra)) {
      return true;
    }
    return Modifier.isAbstract(mb.getModifiers()) && !Modifier.isAbstract(ma.getModifiers());
  }

  // ========== TYPE CHECKING ==========

  /** Every argument type converts to the matching parameter type in the given phase. */
  static boolean isApplicable(Class<?>[] paramTypes, Class<?>[] argTypes, boolean allowBoxing) {
    if (paramTypes.length != argTypes.length) return false;
    for (int i = 0; i < paramTypes.length; i++) {
      if (!isConvertible(paramTypes[i], argTypes[i], allowBoxing)) {
        return false;
      }
    }
    return true;
  }

  /**
   * Method invocation conversion (JLS 5.3) from {@code argType} to {@code paramType}.
   *
   * <p>Without boxing: identity, primitive widening, reference widening. With boxing also: boxing
   * followed by reference widening ({@code int -> Integer -> Number}), and unboxing followed by
   * primitive widening ({@code Integer -> int -> long}).
   */
  static boolean isConvertible(Class<?> paramType, Class<?> argType, boolean allowBoxing) {
    if (paramType == argType) return true;

    if (paramType.isPrimitive() && argType.isPrimitive()) {
      return Primitives.isWidening(paramType, argType);
    }
    if (!paramType.isPrimitive() && !argType.isPrimitive()) {
      return paramType.isAssignableFrom(argType);
    }
    if (!allowBoxing) return false;

    if (argType.isPrimitive()) {
      // Boxing, then widening reference conversion
      return argType != void.class && paramType.isAssignableFrom(Primitives.wrap(argType));
    }
    // Unboxing, then widening primitive conversion
    Class<?> unboxed = Primitives.unwrap(argType);
    return unboxed != null && unboxed != void.class && Primitives.isWidening(paramType, unboxed);
  }

  /** {@code a} is at least as specific as {@code b}: each a[i] is a subtype of b[i] (JLS 4.10). */
  static boolean isMoreSpecific(Class<?>[] a, Class<?>[] b) {
    for (int i = 0; i < a.length; i++) {
      if (!isSubtype(a[i], b[i])) {
        return false;
      }
    }
    return true;
  }

  private static boolean isSubtype(Class<?> s, Class<?> t) {
    if (s == t) return true;
    if (s.isPrimitive() && t.isPrimitive()) {
      return Primitives.isWidening(t, s);
    }
    if (s.isPrimitive() || t.isPrimitive()) {
      return false;
    }
    return t.isAssignableFrom(s);
  }

  // ========== ARGUMENT COERCION ==========

  /**
   * Adapt marshaled values to the chosen member's parameter types: boxed values bound to a wider
   * primitive parameter are widened ({@code Integer 1 -> long 1L}).
   *
   * @throws BridgeException if a {@code null} is bound to a primitive parameter
   */
  static Object[] coerceArguments(String memberName, Class<?>[] paramTypes, Object[] values)
      throws BridgeException {
    Object[] coerced = values;
    for (int i = 0; i < paramTypes.length; i++) {
      Class<?> param = paramTypes[i];
      if (!param.isPrimitive()) continue;
      Object value = values[i];
      if (value == null) {
        throw BridgeException.conversion(
            "Cannot pass null as primitive "
                + param.getName()
                + " argument "
                + i
                + " of "
                + memberName);
      }
      if (Primitives.wrap(param) != value.getClass()) {
        if (coerced == values) {
          coerced = values.clone();
        }
        coerced[i] = Primitives.widen(value, param);
      }
    }
    return coerced;
  }

  // ========== FORMATTING ==========

  /** Format member signature for logging, e.g. {@code addInts(Integer...)}. */
  static String formatMember(Executable m) {
    StringBuilder sb = new StringBuilder();
    sb.append(m instanceof Constructor<?> ? m.getDeclaringClass().getSimpleName() : m.getName());
    sb.append("(");
    Class<?>[] params = m.getParameterTypes();
    for (int i = 0; i < params.length; i++) {
      if (i > 0) sb.append(",");
      if (m.isVarArgs() && i == params.length - 1) {
        sb.append(params[i].getComponentType().getSimpleName()).append("...");
      } else {
        sb.append(params[i].getSimpleName());
      }
    }
    sb.append(")");
    return sb.toString();
  }

  private static String formatArgTypes(Class<?>[] argTypes) {
    if (argTypes.length == 0) return "[]";
    StringBuilder sb = new StringBuilder("[");
    for (int i = 0; i < argTypes.length; i++) {
      if (i > 0) sb.append(",");
      sb.append(argTypes[i].getSimpleName());
    }
    sb.append("]");
    return sb.toString();
  }
}
