package org.chagres.bridge.provisioning;

/**
 * Something that can be deployed onto a runtime's classpath: a {@link MavenArtifact} or a {@link
 * LocalJarArtifact}.
 */
public interface JavaArtifact {

  /** File name the artifact is staged under. */
  String fileName();
}
