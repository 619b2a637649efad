package com.ozmeta.compiler.model.canonical;

public enum CasePolicy {
    LOWER,
    UPPER,
    PRESERVE
}
