package com.ozmeta.compiler.model.canonical;

import java.util.UUID;

import com.fasterxml.jackson.databind.JsonNode;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * A portable policy. {@code expression} holds the guard DSL, either as a JSON
 * tree or as a string (a shorthand such as {@code "tenant"}, or JSON text).
 */
@Value
@Builder
@Jacksonized
public class SecurityPolicyDefinition {
    UUID id;
    String code;
    @Builder.Default
    PolicyType type = PolicyType.RLS;
    JsonNode expression;
    @Builder.Default
    boolean enabled = true;
    String notes;
}
