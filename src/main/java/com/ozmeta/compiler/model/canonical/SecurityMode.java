package com.ozmeta.compiler.model.canonical;

/**
 * How a row policy applies: {@code FILTER} hides rows from reads,
 * {@code BLOCK} rejects writes of rows that fail the predicate.
 */
public enum SecurityMode {
    FILTER,
    BLOCK,
    BOTH;

    public boolean filters() {
        return this != BLOCK;
    }

    public boolean blocks() {
        return this != FILTER;
    }
}
