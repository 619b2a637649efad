package com.ozmeta.compiler.model.canonical;

public enum PolicyType {
    /** Row-level filter applied to whole tables. */
    RLS,
    FLS,
    ABAC
}
