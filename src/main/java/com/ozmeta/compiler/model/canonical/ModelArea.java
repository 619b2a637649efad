package com.ozmeta.compiler.model.canonical;

import java.util.List;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder(toBuilder = true)
@Jacksonized
public class ModelArea {
    @Builder.Default
    List<LogicalTypeDefinition> logicalTypes = List.of();
    @Builder.Default
    List<TableDefinition> tables = List.of();
    @Builder.Default
    List<RelationDefinition> relations = List.of();
    @Builder.Default
    List<CodeRegistryEntry> codeRegistry = List.of();

    public static ModelArea empty() {
        return ModelArea.builder().build();
    }
}
