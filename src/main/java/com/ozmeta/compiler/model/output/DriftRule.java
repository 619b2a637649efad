package com.ozmeta.compiler.model.output;

import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * An expectation about the live target, written to {@code drift/rules.json}.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
@Jacksonized
public class DriftRule {
    DriftRuleKind kind;
    String schema;
    String object;
    String column;
    String constraint;
    String expected;
}
