package com.ozmeta.compiler.model.physical;

import java.util.UUID;

import com.ozmeta.compiler.metric.MetricExpression;

import lombok.Builder;
import lombok.Value;

/**
 * A metric whose field references point at physical columns and whose
 * references to other metrics are inlined.
 */
@Value
@Builder
public class ProjectedMetric {
    UUID metricId;
    UUID formulaId;
    int formulaVersion;
    String code;
    String physicalName;
    String format;
    MetricExpression expression;
}
