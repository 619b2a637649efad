package com.ozmeta.compiler.model.output;

import java.util.UUID;

import lombok.Value;

/**
 * A metric formula compiled for one platform.
 */
@Value
public class MetricPlatform {
    UUID formulaId;
    UUID platformId;
    String metricCode;
    String expressionPhysical;
}
