package org.chagres.bridge;

import java.util.List;

/**
 * A sequence of dependent calls on an evolving result, without restating the handle each time.
 *
 * <pre>{@code
 * String s = runtime.chain(instance)
 *     .invoke("appendToMyString", InvocationArg.of("def"))
 *     .invoke("getMyString")
 *     .toHost(String.class);
 * }</pre>
 *
 * <p>The chain owns its current handle: each step releases the previous one, and a failing step
 * releases it and ends the chain. Terminal operations ({@link #collect()}, {@link #toHost}, {@link
 * #toHostList}) end the chain as well; {@link #close()} releases whatever the chain still holds.
 */
public final class InvocationChain implements AutoCloseable {

  @FunctionalInterface
  private interface Step {
    ObjectHandle apply(ObjectHandle current) throws BridgeException;
  }

  private ObjectHandle current;

  InvocationChain(ObjectHandle start) {
    this.current = start;
  }

  public InvocationChain invoke(String methodName, InvocationArg... args) throws BridgeException {
    return step(h -> h.invoke(methodName, args));
  }

  public InvocationChain field(String fieldName) throws BridgeException {
    return step(h -> h.field(fieldName));
  }

  public InvocationChain cast(String targetClassName) throws BridgeException {
    return step(h -> h.cast(targetClassName));
  }

  /** End the chain and take ownership of the current handle. */
  public ObjectHandle collect() {
    ObjectHandle result = current();
    current = null;
    return result;
  }

  /** End the chain, converting the current value to a host value. */
  public <T> T toHost(Class<T> type) throws BridgeException {
    try (ObjectHandle last = collect()) {
      return last.toHost(type);
    }
  }

  public <E> List<E> toHostList(Class<E> elementType) throws BridgeException {
    try (ObjectHandle last = collect()) {
      return last.toHostList(elementType);
    }
  }

  @Override
  public void close() {
    if (current != null) {
      current.close();
      current = null;
    }
  }

  private InvocationChain step(Step step) throws BridgeException {
    ObjectHandle previous = current();
    ObjectHandle next;
    try {
      next = step.apply(previous);
    } catch (BridgeException | RuntimeException e) {
      current = null;
      previous.close();
      throw e;
    }
    current = next;
    previous.release();
    return this;
  }

  private ObjectHandle current() {
    if (current == null) {
      throw new IllegalStateException("Invocation chain already ended");
    }
    return current;
  }
}
