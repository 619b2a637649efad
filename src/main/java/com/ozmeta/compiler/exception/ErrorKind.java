package com.ozmeta.compiler.exception;

/**
 * Classification of compiler failures. CLI commands map these onto exit codes.
 */
public enum ErrorKind {
    SNAPSHOT_INVALID,
    UNMAPPED_TYPE,
    NAMING_COLLISION,
    COMPILATION_ERROR,
    DRIFT_DETECTED,
    DEPLOY_FAILED,
    VALIDATION_FAILED,
    CONNECTION_FAILED,
    CANCELLED,
    UNEXPECTED
}
