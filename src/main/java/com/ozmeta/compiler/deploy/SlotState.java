package com.ozmeta.compiler.deploy;

public enum SlotState {
    IDLE,
    COMPILING,
    DEPLOYING,
    VALIDATING,
    PROMOTING,
    ROLLING_BACK
}
