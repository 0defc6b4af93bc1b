package org.chagres.bridge.provisioning;

import java.nio.file.Path;
import java.util.Objects;

/** A jar file on the local file system. */
public record LocalJarArtifact(Path path) implements JavaArtifact {

  public LocalJarArtifact {
    Objects.requireNonNull(path, "path");
  }

  public static LocalJarArtifact of(String path) {
    return new LocalJarArtifact(Path.of(path));
  }

  @Override
  public String fileName() {
    return path.getFileName().toString();
  }
}
