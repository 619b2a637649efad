package com.ozmeta.compiler.cli;

import com.ozmeta.compiler.exception.ErrorKind;

/**
 * Documented process exit codes of the {@code ozmeta} commands.
 */
public final class ExitCodes {

    public static final int OK = 0;
    public static final int INPUT_INVALID = 2;
    public static final int FILE_ERROR = 3;
    public static final int CONNECTION_FAILED = 4;
    public static final int DRIFT_DETECTED = 5;
    public static final int UNEXPECTED = 10;

    private ExitCodes() {
        // Utility class
    }

    /**
     * Exit code for a failed compilation: invalid input and per-target
     * compilation failures are the caller's to fix, the rest is unexpected.
     */
    public static int forCompilation(ErrorKind kind) {
        if (kind == null) {
            return UNEXPECTED;
        }
        switch (kind) {
            case SNAPSHOT_INVALID:
            case UNMAPPED_TYPE:
            case NAMING_COLLISION:
            case COMPILATION_ERROR:
            case VALIDATION_FAILED:
                return INPUT_INVALID;
            case CONNECTION_FAILED:
                return CONNECTION_FAILED;
            case DRIFT_DETECTED:
                return DRIFT_DETECTED;
            default:
                return UNEXPECTED;
        }
    }
}
