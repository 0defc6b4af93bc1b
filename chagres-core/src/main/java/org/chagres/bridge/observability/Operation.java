package org.chagres.bridge.observability;

/** Boundary-crossing operations tracked by {@link Metrics} and {@link StructuredLogger}. */
public enum Operation {
  CREATE_INSTANCE("CreateInstance"),
  STATIC_CLASS("StaticClass"),
  INVOKE("Invoke"),
  INVOKE_STATIC("InvokeStatic"),
  FIELD("Field"),
  SET_FIELD("SetField"),
  CAST("Cast"),
  CLONE_REFERENCE("CloneReference"),
  CREATE_ARRAY("CreateArray"),
  TO_MANAGED("ToManaged"),
  TO_HOST("ToHost"),
  INIT_CALLBACK_CHANNEL("InitCallbackChannel"),
  DEPLOY_ARTIFACT("DeployArtifact");

  private final String displayName;

  Operation(String displayName) {
    this.displayName = displayName;
  }

  public String displayName() {
    return displayName;
  }
}
