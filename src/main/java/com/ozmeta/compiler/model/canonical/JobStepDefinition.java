package com.ozmeta.compiler.model.canonical;

import java.util.List;
import java.util.UUID;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class JobStepDefinition {
    UUID id;
    int order;
    String code;
    String type;
    String command;
    @Builder.Default
    List<String> dependsOn = List.of();
}
