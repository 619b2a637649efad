package com.ozmeta.compiler.deploy;

public enum DeploymentStatus {
    /** Candidate slot became active. */
    PROMOTED,
    /** Compilation failed; nothing was deployed. */
    FAILED,
    /** Deployment, validation or promotion failed and the previous slot stayed active. */
    ROLLED_BACK,
    CANCELLED
}
