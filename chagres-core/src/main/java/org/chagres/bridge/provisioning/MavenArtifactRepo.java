package org.chagres.bridge.provisioning;

import java.util.Objects;

/** A remote Maven repository, written {@code id::url}. */
public record MavenArtifactRepo(String id, String url) {

  public static final MavenArtifactRepo MAVEN_CENTRAL =
      new MavenArtifactRepo("central", "https://repo.maven.apache.org/maven2");

  public MavenArtifactRepo {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(url, "url");
    while (url.endsWith("/")) {
      url = url.substring(0, url.length() - 1);
    }
  }

  /**
   * Parse {@code id::url}.
   *
   * @throws IllegalArgumentException if the separator is missing or a part is empty
   */
  public static MavenArtifactRepo parse(String spec) {
    int separator = spec.indexOf("::");
    if (separator <= 0 || separator + 2 >= spec.length()) {
      throw new IllegalArgumentException("Expected id::url, got '" + spec + "'");
    }
    return new MavenArtifactRepo(
        spec.substring(0, separator).trim(), spec.substring(separator + 2).trim());
  }

  /** Location of {@code artifact} in this repository. */
  public String urlOf(MavenArtifact artifact) {
    return url + "/" + artifact.repositoryPath();
  }

  @Override
  public String toString() {
    return id + "::" + url;
  }
}
