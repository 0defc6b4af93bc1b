package org.chagres.bridge;

import java.io.IOException;
import java.net.URL;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** One classpath element: a directory, a jar, or {@code dir/*} for every jar in a directory. */
public record ClasspathEntry(String path) {

  public ClasspathEntry {
    Objects.requireNonNull(path, "path");
    if (path.isBlank()) {
      throw new IllegalArgumentException("Classpath entry must not be empty");
    }
  }

  public static ClasspathEntry of(Path path) {
    return new ClasspathEntry(path.toString());
  }

  public boolean isWildcard() {
    return path.equals("*") || path.endsWith("/*") || path.endsWith("\\*");
  }

  /** The URLs this entry contributes, expanding a wildcard to the jars it matches, sorted. */
  List<URL> toUrls() throws IOException {
    List<URL> urls = new ArrayList<>();
    if (!isWildcard()) {
      urls.add(Path.of(path).toAbsolutePath().toUri().toURL());
      return urls;
    }
    String dirName = path.substring(0, path.length() - 1);
    Path dir = Path.of(dirName.isEmpty() ? "." : dirName);
    if (!Files.isDirectory(dir)) {
      return urls;
    }
    for (Path jar : listJars(dir)) {
      urls.add(jar.toAbsolutePath().toUri().toURL());
    }
    return urls;
  }

  static List<Path> listJars(Path dir) throws IOException {
    List<Path> jars = new ArrayList<>();
    try (DirectoryStream<Path> files = Files.newDirectoryStream(dir, "*.jar")) {
      for (Path file : files) {
        if (Files.isRegularFile(file)) {
          jars.add(file);
        }
      }
    }
    jars.sort(null);
    return jars;
  }
}
