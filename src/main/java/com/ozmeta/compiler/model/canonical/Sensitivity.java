package com.ozmeta.compiler.model.canonical;

/**
 * Data classification of a field, ordered from least to most sensitive.
 */
public enum Sensitivity {
    NONE,
    INTERNAL,
    CONFIDENTIAL,
    RESTRICTED;

    public boolean atLeast(Sensitivity other) {
        return compareTo(other) >= 0;
    }
}
