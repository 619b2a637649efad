package com.ozmeta.compiler.model.canonical;

import java.util.UUID;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class RelationDefinition {
    UUID id;
    UUID fromFieldId;
    UUID toFieldId;
    String roleName;
    @Builder.Default
    String cardinality = "ManyToOne";
    @Builder.Default
    boolean enforce = true;
}
