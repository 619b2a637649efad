package com.ozmeta.compiler.drift;

public enum DriftFindingKind {
    MISSING_OBJECT,
    UNEXPECTED_OBJECT,
    MISSING_FIELD,
    UNEXPECTED_FIELD,
    MISSING_MANDATORY_FIELD,
    TYPE_MISMATCH,
    NAMING_VIOLATION,
    PARTITIONING_MISMATCH,
    MISSING_FOREIGN_KEY,
    UNEXPECTED_FOREIGN_KEY,
    FOREIGN_KEY_MISMATCH,
    LOGICAL_FK_ORPHANS,
    ROW_COUNT_ANOMALY,
    CHECKSUM_ANOMALY
}
