package org.chagres.bridge;

import java.io.IOException;
import java.net.URL;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;
import org.chagres.bridge.provisioning.LocalRepositoryLocator;
import org.chagres.bridge.provisioning.MavenSettings;

/**
 * Configures and builds a {@link BridgeRuntime}.
 *
 * <pre>{@code
 * try (BridgeRuntime runtime = BridgeRuntime.builder()
 *     .classpathEntry(new ClasspathEntry("libs/*"))
 *     .javaOpt(new JavaOpt("-Dapp.mode=test"))
 *     .build()) {
 *   ...
 * }
 * }</pre>
 */
public final class BridgeRuntimeBuilder {
  private static final Logger LOG = Logger.getLogger(BridgeRuntimeBuilder.class.getName());

  /** Default LRU size of the per-runtime class and reflection caches. */
  public static final int DEFAULT_CACHE_MAX_ENTRIES =
      Integer.getInteger("chagres.cache.max_entries", 4096);

  private final List<ClasspathEntry> classpathEntries = new ArrayList<>();
  private final List<JavaOpt> javaOpts = new ArrayList<>();
  private MavenSettings mavenSettings = MavenSettings.defaults();
  private Path stagingDirectory;
  private Path localRepository;
  private ClassLoader parentClassLoader = BridgeRuntime.class.getClassLoader();
  private boolean includeStagedJars = true;
  private BridgeLimits limits = BridgeLimits.defaults();
  private int cacheMaxEntries = DEFAULT_CACHE_MAX_ENTRIES;

  BridgeRuntimeBuilder() {}

  public BridgeRuntimeBuilder classpathEntry(ClasspathEntry entry) {
    classpathEntries.add(Objects.requireNonNull(entry, "entry"));
    return this;
  }

  public BridgeRuntimeBuilder classpathEntries(List<ClasspathEntry> entries) {
    entries.forEach(this::classpathEntry);
    return this;
  }

  public BridgeRuntimeBuilder javaOpt(JavaOpt opt) {
    javaOpts.add(Objects.requireNonNull(opt, "opt"));
    return this;
  }

  public BridgeRuntimeBuilder javaOpts(List<JavaOpt> opts) {
    opts.forEach(this::javaOpt);
    return this;
  }

  public BridgeRuntimeBuilder mavenSettings(MavenSettings settings) {
    this.mavenSettings = Objects.requireNonNull(settings, "settings");
    return this;
  }

  /** Directory deployed artifacts are staged in; defaults to {@code chagres.staging.dir}. */
  public BridgeRuntimeBuilder stagingDirectory(Path dir) {
    this.stagingDirectory = dir;
    return this;
  }

  /** Local Maven repository; detected from the environment when not set. */
  public BridgeRuntimeBuilder localRepository(Path dir) {
    this.localRepository = dir;
    return this;
  }

  public BridgeRuntimeBuilder parentClassLoader(ClassLoader parent) {
    this.parentClassLoader = parent;
    return this;
  }

  /** Whether jars already in the staging directory join the classpath (default true). */
  public BridgeRuntimeBuilder includeStagedJars(boolean include) {
    this.includeStagedJars = include;
    return this;
  }

  public BridgeRuntimeBuilder limits(BridgeLimits limits) {
    this.limits = Objects.requireNonNull(limits, "limits");
    return this;
  }

  public BridgeRuntimeBuilder cacheMaxEntries(int maxEntries) {
    if (maxEntries <= 0) {
      throw new IllegalArgumentException("cacheMaxEntries must be positive: " + maxEntries);
    }
    this.cacheMaxEntries = maxEntries;
    return this;
  }

  /**
   * Build the runtime.
   *
   * @throws BridgeException with {@link ErrorKind#RUNTIME_UNAVAILABLE} if the classpath or staging
   *     directory cannot be set up
   */
  public BridgeRuntime build() throws BridgeException {
    applyJavaOpts();
    Path staging = stagingDirectory != null ? stagingDirectory : defaultStagingDirectory();
    Path localRepo =
        localRepository != null ? localRepository : LocalRepositoryLocator.findLocalRepository();

    List<URL> urls = new ArrayList<>();
    try {
      for (ClasspathEntry entry : classpathEntries) {
        urls.addAll(entry.toUrls());
      }
      if (includeStagedJars && Files.isDirectory(staging)) {
        for (Path jar : ClasspathEntry.listJars(staging)) {
          urls.add(jar.toUri().toURL());
        }
      }
    } catch (IOException e) {
      throw new BridgeException(
          ErrorKind.RUNTIME_UNAVAILABLE, "Cannot build classpath: " + e.getMessage(), e);
    }

    return new BridgeRuntime(
        List.copyOf(classpathEntries),
        List.copyOf(javaOpts),
        urls.toArray(new URL[0]),
        parentClassLoader,
        staging,
        localRepo,
        mavenSettings,
        limits,
        cacheMaxEntries);
  }

  private void applyJavaOpts() {
    for (JavaOpt opt : javaOpts) {
      if (opt.isSystemProperty()) {
        System.setProperty(opt.propertyKey(), opt.propertyValue());
      } else {
        LOG.info("Java option " + opt.value() + " has no effect on an in-process runtime");
      }
    }
  }

  static Path defaultStagingDirectory() {
    String configured = System.getProperty("chagres.staging.dir");
    if (configured != null && !configured.isBlank()) {
      return Path.of(configured);
    }
    return Path.of(System.getProperty("user.home"), ".chagres", "jassets");
  }
}
