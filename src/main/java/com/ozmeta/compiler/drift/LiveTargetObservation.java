package com.ozmeta.compiler.drift;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Snapshot of a live target's physical state, supplied by whoever can reach
 * the target. {@code references} is keyed by {@code schema.name};
 * {@code orphanCounts} by logical foreign key constraint name.
 */
@Value
@Builder
@Jacksonized
public class LiveTargetObservation {
    UUID targetPlatformId;
    Instant observedAtUTC;
    @Singular
    List<ObservedObject> objects;
    @Singular("reference")
    Map<String, ObjectFingerprint> references;
    @Singular
    Map<String, Long> orphanCounts;

    public Optional<ObservedObject> findObject(String schema, String name) {
        return objects.stream()
                .filter(o -> Objects.equals(o.getSchema(), schema) && Objects.equals(o.getName(), name))
                .findFirst();
    }
}
