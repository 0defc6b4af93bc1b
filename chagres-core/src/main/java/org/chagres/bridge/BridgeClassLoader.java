package org.chagres.bridge;

import java.net.MalformedURLException;
import java.net.URL;
import java.net.URLClassLoader;
import java.nio.file.Path;

/** Class loader of one runtime; grows when artifacts are deployed. */
final class BridgeClassLoader extends URLClassLoader {

  static {
    ClassLoader.registerAsParallelCapable();
  }

  BridgeClassLoader(String name, URL[] urls, ClassLoader parent) {
    super(name, urls, parent);
  }

  void addJar(Path jar) throws MalformedURLException {
    addURL(jar.toUri().toURL());
  }
}
