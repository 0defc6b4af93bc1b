package org.chagres.bridge.provisioning;

import java.util.Objects;

/**
 * A Maven coordinate, {@code groupId:artifactId:version[:qualifier]}.
 *
 * <p>Resolves to the standard repository layout:
 *
 * <pre>
 * {groupId as path}/{artifactId}/{version}/{artifactId}-{version}[-{qualifier}].jar
 * Example: org/example/my-lib/1.0.0/my-lib-1.0.0.jar
 * </pre>
 */
public record MavenArtifact(String groupId, String artifactId, String version, String qualifier)
    implements JavaArtifact {

  public MavenArtifact {
    requireSegment("groupId", groupId);
    requireSegment("artifactId", artifactId);
    requireSegment("version", version);
    qualifier = qualifier == null ? "" : qualifier;
  }

  public MavenArtifact(String groupId, String artifactId, String version) {
    this(groupId, artifactId, version, "");
  }

  /**
   * Parse {@code groupId:artifactId:version} or {@code groupId:artifactId:version:qualifier}.
   *
   * @throws IllegalArgumentException if the coordinate has the wrong shape
   */
  public static MavenArtifact parse(String coordinate) {
    Objects.requireNonNull(coordinate, "coordinate");
    String[] parts = coordinate.trim().split(":", -1);
    if (parts.length == 3) {
      return new MavenArtifact(parts[0], parts[1], parts[2]);
    }
    if (parts.length == 4) {
      return new MavenArtifact(parts[0], parts[1], parts[2], parts[3]);
    }
    throw new IllegalArgumentException(
        "Expected groupId:artifactId:version[:qualifier], got '" + coordinate + "'");
  }

  @Override
  public String fileName() {
    return artifactId + "-" + version + (qualifier.isEmpty() ? "" : "-" + qualifier) + ".jar";
  }

  /** Path of the jar relative to a repository root, with '/' separators. */
  public String repositoryPath() {
    return groupId.replace('.', '/') + "/" + artifactId + "/" + version + "/" + fileName();
  }

  @Override
  public String toString() {
    String base = groupId + ":" + artifactId + ":" + version;
    return qualifier.isEmpty() ? base : base + ":" + qualifier;
  }

  private static void requireSegment(String name, String value) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException(name + " must not be empty");
    }
  }
}
