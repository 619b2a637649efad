package com.ozmeta.compiler.model.physical;

public enum CanonicalType {
    TABLE,
    FIELD
}
