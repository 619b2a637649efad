package com.ozmeta.compiler.model.canonical;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class MetricDefinition {
    UUID id;
    String code;
    String domain;
    UUID baseTableId;
    String format;
    @Builder.Default
    List<MetricFormulaDefinition> formulas = List.of();

    /**
     * Highest approved version, if any.
     */
    public Optional<MetricFormulaDefinition> currentFormula() {
        return formulas.stream()
                .filter(MetricFormulaDefinition::isApproved)
                .max(Comparator.comparingInt(MetricFormulaDefinition::getVersion));
    }
}
