package com.ozmeta.compiler.drift;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import com.fasterxml.jackson.annotation.JsonIgnore;

import lombok.Builder;
import lombok.Value;

/**
 * Findings of one drift check, sorted by kind, object and column.
 */
@Value
@Builder
public class DriftReport {
    UUID targetPlatformId;
    String targetKey;
    int objectsChecked;
    List<DriftFinding> findings;

    public boolean hasDrift() {
        return !findings.isEmpty();
    }

    @JsonIgnore
    public Map<DriftFindingKind, Long> getCountsByKind() {
        Map<DriftFindingKind, Long> counts = new EnumMap<>(DriftFindingKind.class);
        for (DriftFinding finding : findings) {
            counts.merge(finding.getKind(), 1L, Long::sum);
        }
        return counts;
    }
}
