package org.chagres.bridge.provisioning;

import java.io.IOException;

/** An artifact could not be found, fetched or staged. */
public class ArtifactDeploymentException extends IOException {

  public ArtifactDeploymentException(String message) {
    super(message);
  }

  public ArtifactDeploymentException(String message, Throwable cause) {
    super(message, cause);
  }
}
