package com.ozmeta.compiler.model.canonical;

import java.util.List;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class MetricArea {
    @Builder.Default
    List<MetricDefinition> metrics = List.of();

    public static MetricArea empty() {
        return MetricArea.builder().build();
    }
}
