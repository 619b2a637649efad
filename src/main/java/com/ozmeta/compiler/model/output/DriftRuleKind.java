package com.ozmeta.compiler.model.output;

public enum DriftRuleKind {
    OBJECT_EXISTS,
    FIELD_TYPE,
    MANDATORY_FIELD,
    FOREIGN_KEY,
    LOGICAL_FOREIGN_KEY,
    PARTITIONING
}
