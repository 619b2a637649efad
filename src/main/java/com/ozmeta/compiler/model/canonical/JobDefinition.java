package com.ozmeta.compiler.model.canonical;

import java.util.List;
import java.util.UUID;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Logical pipeline. {@code schedule} is a five-field cron expression.
 */
@Value
@Builder
@Jacksonized
public class JobDefinition {
    UUID id;
    String code;
    String domain;
    String layer;
    @Builder.Default
    boolean enabled = true;
    String schedule;
    @Builder.Default
    List<JobStepDefinition> steps = List.of();
}
