package com.ozmeta.compiler.model.physical;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.ozmeta.compiler.projection.ReverseIndex;

import lombok.Builder;
import lombok.Value;

/**
 * The physical model of one target platform, input to every emitter and to
 * drift validation. All lists are sorted deterministically.
 */
@Value
@Builder
public class TargetProjection {
    TargetPlatformBinding binding;
    String container;
    List<PhysicalObject> objects;
    List<ProjectedRelation> relations;
    List<ProjectedJob> jobs;
    List<ProjectedMetric> metrics;
    @Builder.Default
    List<ProjectedRowPolicy> rowPolicies = List.of();
    ReverseIndex reverseIndex;

    public UUID getTargetPlatformId() {
        return binding.getTargetPlatform().getId();
    }

    public Optional<PhysicalObject> findObject(String physicalSchema, String physicalName) {
        return objects.stream()
                .filter(o -> o.getPhysicalSchema().equals(physicalSchema) && o.getPhysicalName().equals(physicalName))
                .findFirst();
    }
}
