package com.ozmeta.compiler.model.output;

import java.util.List;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

@Value
@Builder
public class EmitResult {
    @Singular
    List<EmittedFile> files;
    @Singular
    List<DriftRule> driftRules;
    @Singular
    List<JobTarget> jobTargets;
    @Singular
    List<MetricPlatform> metricPlatforms;
}
