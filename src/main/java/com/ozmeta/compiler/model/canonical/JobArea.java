package com.ozmeta.compiler.model.canonical;

import java.util.List;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class JobArea {
    @Builder.Default
    List<JobDefinition> jobs = List.of();

    public static JobArea empty() {
        return JobArea.builder().build();
    }
}
