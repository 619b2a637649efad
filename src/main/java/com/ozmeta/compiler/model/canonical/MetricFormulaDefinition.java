package com.ozmeta.compiler.model.canonical;

import java.util.UUID;

import com.fasterxml.jackson.databind.JsonNode;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * A versioned metric formula; {@code expression} is the metric DSL tree.
 */
@Value
@Builder
@Jacksonized
public class MetricFormulaDefinition {
    public static final String APPROVED = "Approved";

    UUID id;
    int version;
    String status;
    JsonNode expression;

    public boolean isApproved() {
        return APPROVED.equalsIgnoreCase(status);
    }
}
