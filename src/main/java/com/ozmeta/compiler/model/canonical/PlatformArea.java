package com.ozmeta.compiler.model.canonical;

import java.util.List;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Platforms with their constraint and type-mapping profiles. Also the shape of
 * the bundled default profile set.
 */
@Value
@Builder
@Jacksonized
public class PlatformArea {
    @Builder.Default
    List<PlatformDefinition> platforms = List.of();
    @Builder.Default
    List<ConstraintProfile> constraintProfiles = List.of();
    @Builder.Default
    List<TypeMapEntry> typeMaps = List.of();

    public boolean isEmpty() {
        return platforms.isEmpty();
    }
}
