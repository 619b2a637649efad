package com.ozmeta.compiler.model.canonical;

import java.util.UUID;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class PlatformDefinition {
    UUID id;
    String code;
    String cloud;
    PlatformCategory category;
    String constraintProfile;
    String typeMappingProfile;
    @Builder.Default
    boolean enabled = true;
}
