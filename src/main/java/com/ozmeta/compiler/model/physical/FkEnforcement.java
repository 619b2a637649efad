package com.ozmeta.compiler.model.physical;

public enum FkEnforcement {
    /** Emitted as a foreign key constraint. */
    DECLARATIVE,
    /** Not emitted; checked by the drift validator instead. */
    LOGICAL_ONLY
}
