package com.ozmeta.compiler.model.canonical;

public enum TargetRole {
    PRIMARY,
    SECONDARY,
    DR
}
