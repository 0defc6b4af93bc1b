package org.chagres.bridge.provisioning;

import java.util.List;

/** Remote repositories searched, in order, when a Maven artifact is not in the local repository. */
public record MavenSettings(List<MavenArtifactRepo> repositories) {

  public MavenSettings {
    repositories = List.copyOf(repositories);
  }

  /** Maven Central only. */
  public static MavenSettings defaults() {
    return new MavenSettings(List.of(MavenArtifactRepo.MAVEN_CENTRAL));
  }

  public static MavenSettings of(MavenArtifactRepo... repositories) {
    return new MavenSettings(List.of(repositories));
  }
}
