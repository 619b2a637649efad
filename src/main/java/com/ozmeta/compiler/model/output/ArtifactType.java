package com.ozmeta.compiler.model.output;

public enum ArtifactType {
    DDL,
    JOB,
    SEMANTIC,
    DRIFT_RULES,
    DOCUMENTATION
}
