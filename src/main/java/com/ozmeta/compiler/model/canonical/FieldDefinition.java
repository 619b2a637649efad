package com.ozmeta.compiler.model.canonical;

import java.util.UUID;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Canonical column of a {@link TableDefinition}.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class FieldDefinition {
    UUID id;
    String name;
    String logicalType;
    @Builder.Default
    int ordinal = 0;
    @Builder.Default
    boolean nullable = true;
    boolean primaryKey;
    boolean foreignKey;
    boolean internal;
    @Builder.Default
    Sensitivity sensitivity = Sensitivity.NONE;
    UUID referencesFieldId;
}
