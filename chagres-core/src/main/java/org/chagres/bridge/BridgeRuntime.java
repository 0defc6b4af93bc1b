package org.chagres.bridge;

import java.io.IOException;
import java.net.URL;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.chagres.bridge.observability.Metrics;
import org.chagres.bridge.observability.Operation;
import org.chagres.bridge.observability.StructuredLogger;
import org.chagres.bridge.provisioning.ArtifactDeployer;
import org.chagres.bridge.provisioning.ArtifactDeploymentException;
import org.chagres.bridge.provisioning.JavaArtifact;
import org.chagres.bridge.provisioning.MavenSettings;

/**
 * A managed runtime: an isolated class-loading domain plus the table of every object handed out to
 * the host.
 *
 * <p>Host code only reaches managed objects through {@link ObjectHandle}s. Every operation attaches
 * the calling thread on first use; attachment is per thread and cached (see {@link
 * #attachCurrentThread(boolean)}).
 *
 * <p>Several runtimes may coexist, each with its own class loader, references and caches. {@link
 * #close()} is terminal: every handle becomes unusable, callback registrations are reclaimed and
 * later operations fail with {@link ErrorKind#RUNTIME_UNAVAILABLE}.
 */
public final class BridgeRuntime implements AutoCloseable {
  private static final Logger LOG = Logger.getLogger(BridgeRuntime.class.getName());

  private static final AtomicLong RUNTIME_IDS = new AtomicLong();

  private final long id;
  private final long startNanos = System.nanoTime();
  private final List<ClasspathEntry> classpath;
  private final List<JavaOpt> javaOpts;
  private final BridgeLimits limits;
  private final BridgeClassLoader loader;
  private final ObjectRegistry registry;
  private final ThreadGateway gateway;
  private final ClassResolver classes;
  private final ReflectionCache reflection;
  private final InvocationEngine engine;
  private final ArtifactDeployer deployer;
  private final AtomicBoolean open = new AtomicBoolean(true);

  BridgeRuntime(
      List<ClasspathEntry> classpath,
      List<JavaOpt> javaOpts,
      URL[] urls,
      ClassLoader parent,
      Path stagingDirectory,
      Path localRepository,
      MavenSettings mavenSettings,
      BridgeLimits limits,
      int cacheMaxEntries) {
    this.id = RUNTIME_IDS.incrementAndGet();
    this.classpath = new CopyOnWriteArrayList<>(classpath);
    this.javaOpts = javaOpts;
    this.limits = limits;
    this.loader = new BridgeClassLoader("chagres-runtime-" + id, urls, parent);
    this.registry = new ObjectRegistry(id, limits);
    this.gateway = new ThreadGateway(this, limits);
    this.classes = new ClassResolver(loader, cacheMaxEntries);
    this.reflection = new ReflectionCache(cacheMaxEntries);
    Marshaller marshaller = new Marshaller(this, classes, limits);
    this.engine = new InvocationEngine(this, gateway, registry, classes, reflection, marshaller);
    this.deployer = new ArtifactDeployer(stagingDirectory, localRepository, mavenSettings);

    Metrics.getInstance().updateOpenRuntimeCount(1);
    StructuredLogger.logRuntimeStart(id, urls.length, javaOpts.size());
    if (LOG.isLoggable(Level.FINE)) {
      LOG.fine("Runtime " + id + " started; " + limits.getSummary());
    }
  }

  public static BridgeRuntimeBuilder builder() {
    return new BridgeRuntimeBuilder();
  }

  // ========== THREADS ==========

  /** Attach the calling thread, detaching it automatically once it ends. */
  public RuntimeAccess attachCurrentThread() throws BridgeException {
    return attachCurrentThread(true);
  }

  /**
   * Attach the calling thread, or return its existing attachment.
   *
   * @param detachOnExit whether to tear the attachment down once the thread ends; threads owned by
   *     managed code pass {@code false}
   * @throws BridgeException with {@link ErrorKind#RUNTIME_UNAVAILABLE} if the runtime is closed, or
   *     {@link ErrorKind#ATTACH_FAILED} if too many threads are attached
   */
  public RuntimeAccess attachCurrentThread(boolean detachOnExit) throws BridgeException {
    return gateway.attach(detachOnExit);
  }

  // ========== OBJECTS ==========

  /** Instantiate {@code className} with the constructor matching {@code args}. */
  public ObjectHandle createInstance(String className, InvocationArg... args)
      throws BridgeException {
    return engine.createInstance(className, args);
  }

  /** A handle standing for the class itself: calls through it are static calls. */
  public ObjectHandle staticClass(String className) throws BridgeException {
    return engine.staticClass(className);
  }

  /** A new managed array of {@code elementClassName} holding {@code elements}. */
  public ObjectHandle createJavaArray(String elementClassName, InvocationArg... elements)
      throws BridgeException {
    return engine.createArray(elementClassName, elements);
  }

  /** Marshal one argument into the runtime and return a handle to the result. */
  public ObjectHandle toManaged(InvocationArg arg) throws BridgeException {
    return engine.toManaged(arg);
  }

  public ObjectHandle invoke(ObjectHandle handle, String methodName, InvocationArg... args)
      throws BridgeException {
    return engine.invoke(handle, methodName, args);
  }

  public ObjectHandle invokeStatic(String className, String methodName, InvocationArg... args)
      throws BridgeException {
    return engine.invokeStatic(className, methodName, args);
  }

  /** Read an instance field, or a static field through a {@link #staticClass} handle. */
  public ObjectHandle field(ObjectHandle handle, String fieldName) throws BridgeException {
    return engine.field(handle, fieldName);
  }

  public void setField(ObjectHandle handle, String fieldName, InvocationArg value)
      throws BridgeException {
    engine.setField(handle, fieldName, value);
  }

  /**
   * The same object declared as {@code targetClassName}; later calls resolve against that class.
   *
   * @throws BridgeException with {@link ErrorKind#ILLEGAL_CAST} if the object is not an instance
   */
  public ObjectHandle cast(ObjectHandle handle, String targetClassName) throws BridgeException {
    return engine.cast(handle, targetClassName);
  }

  /** A second, independent reference to the same object. */
  public ObjectHandle cloneReference(ObjectHandle handle) throws BridgeException {
    return engine.cloneReference(handle);
  }

  /** Start a chain of calls on a new reference to {@code handle}'s object. */
  public InvocationChain chain(ObjectHandle handle) throws BridgeException {
    return new InvocationChain(cloneReference(handle));
  }

  // ========== HOST VALUES ==========

  /**
   * Convert the referenced object into a host value of {@code type}: a string, a wrapper class
   * ({@code Integer.class}, not {@code int.class}) or an array of those.
   */
  public <T> T toHost(ObjectHandle handle, Class<T> type) throws BridgeException {
    return engine.toHost(handle, type);
  }

  /** Like {@link #toHost} but empty for a null reference. */
  public <T> Optional<T> toHostOptional(ObjectHandle handle, Class<T> type)
      throws BridgeException {
    return engine.toHostOptional(handle, type);
  }

  /** Convert a managed {@link Iterable} or array element by element. */
  public <E> List<E> toHostList(ObjectHandle handle, Class<E> elementType)
      throws BridgeException {
    return engine.toHostList(handle, elementType);
  }

  // ========== CALLBACKS ==========

  /**
   * Register a callback channel on {@code handle}, whose object must extend {@link
   * NativeCallbackSupport}.
   *
   * <p>The registration lives until this runtime is closed; there is no way to unregister it
   * earlier, so each call holds a small amount of memory for the runtime's lifetime. Closing the
   * receiver only stops deliveries.
   *
   * <p>Every thread that delivers a callback stays attached until it calls {@link
   * RuntimeAccess#detach()} or the runtime closes, even after it ends. Managed code that starts a
   * new thread per callback therefore eventually reaches {@code
   * chagres.limits.max_attached_threads}, after which each delivery fails with {@link
   * ErrorKind#ATTACH_FAILED}. Deliver from a long-lived thread or a fixed pool instead.
   */
  public CallbackReceiver initCallbackChannel(ObjectHandle handle) throws BridgeException {
    return engine.observe(
        Operation.INIT_CALLBACK_CHANNEL,
        handle.className(),
        () -> {
          CallbackChannel channel = CallbackRegistry.getInstance().register(this);
          try {
            engine
                .invoke(
                    handle,
                    "initCallbackChannel",
                    new InvocationArg[] {InvocationArg.of(channel.token()).intoPrimitive()})
                .release();
          } catch (BridgeException | RuntimeException e) {
            CallbackRegistry.getInstance().discard(channel);
            throw e;
          }
          return new CallbackReceiver(channel);
        });
  }

  /** Register a callback channel on {@code handle}, then invoke {@code methodName} on it. */
  public CallbackReceiver invokeToChannel(
      ObjectHandle handle, String methodName, InvocationArg... args) throws BridgeException {
    CallbackReceiver receiver = initCallbackChannel(handle);
    try {
      invoke(handle, methodName, args).release();
    } catch (BridgeException | RuntimeException e) {
      receiver.close();
      throw e;
    }
    return receiver;
  }

  // ========== ARTIFACTS ==========

  /**
   * Stage {@code artifact} and add it to this runtime's classpath immediately.
   *
   * @return the staged jar
   * @throws BridgeException with {@link ErrorKind#ARTIFACT_DEPLOY_FAILED} if it cannot be staged
   */
  public Path deployArtifact(JavaArtifact artifact) throws BridgeException {
    return engine.observe(
        Operation.DEPLOY_ARTIFACT,
        String.valueOf(artifact),
        () -> {
          try {
            Path jar = deployer.deploy(artifact);
            loader.addJar(jar);
            classpath.add(ClasspathEntry.of(jar));
            Metrics.getInstance().recordArtifactDeployed();
            return jar;
          } catch (ArtifactDeploymentException e) {
            throw new BridgeException(ErrorKind.ARTIFACT_DEPLOY_FAILED, e.getMessage(), e);
          } catch (IOException e) {
            throw new BridgeException(
                ErrorKind.ARTIFACT_DEPLOY_FAILED, "Cannot add artifact to classpath", e);
          }
        });
  }

  // ========== STATE ==========

  public long id() {
    return id;
  }

  public boolean isOpen() {
    return open.get();
  }

  /** References handed out and not yet released. */
  public int liveReferenceCount() {
    return registry.size();
  }

  /** Highest number of live references this runtime has held at once. */
  public long peakReferenceCount() {
    return registry.peakSize();
  }

  public int attachedThreadCount() {
    return gateway.attachedCount();
  }

  public int callbackRegistrationCount() {
    return CallbackRegistry.getInstance().count(this);
  }

  /** Configured classpath entries followed by deployed artifacts. */
  public List<ClasspathEntry> classpath() {
    return List.copyOf(classpath);
  }

  public List<JavaOpt> javaOpts() {
    return javaOpts;
  }

  public BridgeLimits limits() {
    return limits;
  }

  public Path stagingDirectory() {
    return deployer.stagingDirectory();
  }

  /** Class and reflection cache statistics, for diagnostics. */
  public String cacheStats() {
    List<String> stats = new ArrayList<>();
    stats.add(classes.getStats());
    stats.add(reflection.getStats());
    return String.join("; ", stats);
  }

  /** Register an object delivered by managed code, declared as its runtime class. */
  ObjectHandle adopt(Object value) throws BridgeException {
    return engine.adopt(value);
  }

  // ========== SHUTDOWN ==========

  /**
   * Shut the runtime down: reclaim callback registrations, detach every thread, drop every
   * reference and close the class loader. Idempotent.
   */
  @Override
  public void close() {
    if (!open.compareAndSet(true, false)) {
      return;
    }
    int callbacks = CallbackRegistry.getInstance().reclaim(this);
    int threads = gateway.shutdown();
    int leaked = registry.clear();
    try {
      loader.close();
    } catch (IOException e) {
      LOG.log(Level.WARNING, "Failed to close class loader of runtime " + id, e);
    }
    Metrics.getInstance().updateOpenRuntimeCount(-1);

    long durationMillis = (System.nanoTime() - startNanos) / 1_000_000;
    StructuredLogger.logRuntimeEnd(id, leaked, threads, durationMillis);
    if (callbacks > 0 || leaked > 0) {
      LOG.fine(
          "Runtime "
              + id
              + " reclaimed "
              + callbacks
              + " callback registrations and "
              + leaked
              + " unreleased references");
    }
    StructuredLogger.dumpMetrics();
  }

  @Override
  public String toString() {
    return "BridgeRuntime{id=" + id + (isOpen() ? "" : ", closed") + "}";
  }
}
