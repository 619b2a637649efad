package com.ozmeta.compiler.model.canonical;

import java.util.List;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Security policies and the tables they are applied to.
 */
@Value
@Builder
@Jacksonized
public class SecurityArea {
    @Builder.Default
    List<SecurityPolicyDefinition> policies = List.of();
    @Builder.Default
    List<TableSecurityDefinition> tableSecurity = List.of();

    public static SecurityArea empty() {
        return SecurityArea.builder().build();
    }
}
