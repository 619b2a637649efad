package com.ozmeta.compiler.model.canonical;

import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * A committed point-in-time export of the canonical model. Areas the compiler
 * does not interpret (workflows, ui, texts, ...) are kept raw in
 * {@code otherAreas}.
 */
@Value
@Builder(toBuilder = true)
public class SnapshotDocument {
    @NonNull
    SnapshotMeta meta;
    @Builder.Default
    ModelArea model = ModelArea.empty();
    @Builder.Default
    PlatformArea platforms = PlatformArea.builder().build();
    @Builder.Default
    TargetArea targets = TargetArea.empty();
    @Builder.Default
    IntegrationArea integrations = IntegrationArea.empty();
    @Builder.Default
    JobArea jobs = JobArea.empty();
    @Builder.Default
    MetricArea metrics = MetricArea.empty();
    @Builder.Default
    SecurityArea security = SecurityArea.empty();
    @Builder.Default
    Map<String, JsonNode> otherAreas = Map.of();
}
