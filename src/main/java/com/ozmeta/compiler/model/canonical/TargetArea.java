package com.ozmeta.compiler.model.canonical;

import java.util.List;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class TargetArea {
    @Builder.Default
    List<TargetDefinition> targets = List.of();
    @Builder.Default
    List<TargetPlatformDefinition> targetPlatforms = List.of();

    public static TargetArea empty() {
        return TargetArea.builder().build();
    }
}
