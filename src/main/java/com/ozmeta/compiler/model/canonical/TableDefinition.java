package com.ozmeta.compiler.model.canonical;

import java.util.List;
import java.util.UUID;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Canonical table. {@code code} is the globally unique two-letter table code.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class TableDefinition {
    UUID id;
    String code;
    String name;
    @Builder.Default
    String schema = "dbo";
    String domain;
    boolean requiresTenant;
    @Builder.Default
    List<FieldDefinition> fields = List.of();
}
