package com.ozmeta.compiler.model.physical;

import java.util.List;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ProjectedJobStep {
    String code;
    String taskName;
    int order;
    String type;
    String command;
    List<String> dependsOnTasks;
}
