package com.ozmeta.compiler.model.canonical;

import java.util.UUID;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class TableSecurityDefinition {
    UUID id;
    UUID tableId;
    UUID policyId;
    @Builder.Default
    SecurityMode mode = SecurityMode.FILTER;
}
