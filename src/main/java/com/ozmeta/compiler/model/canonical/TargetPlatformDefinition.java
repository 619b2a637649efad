package com.ozmeta.compiler.model.canonical;

import java.util.UUID;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class TargetPlatformDefinition {
    UUID id;
    UUID targetId;
    UUID platformId;
    @Builder.Default
    TargetRole role = TargetRole.PRIMARY;
    @Builder.Default
    int failoverOrder = 0;
}
