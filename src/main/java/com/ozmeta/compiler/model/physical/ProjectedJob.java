package com.ozmeta.compiler.model.physical;

import java.util.List;
import java.util.UUID;

import lombok.Builder;
import lombok.Value;

/**
 * A job bound to a target platform with its steps in execution order.
 */
@Value
@Builder
public class ProjectedJob {
    UUID jobId;
    String code;
    String physicalName;
    String layer;
    String schedule;
    List<ProjectedJobStep> steps;
}
