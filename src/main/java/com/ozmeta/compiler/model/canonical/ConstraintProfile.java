package com.ozmeta.compiler.model.canonical;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

import com.fasterxml.jackson.annotation.JsonIgnore;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Naming limits of a platform. {@code allowedCharsPattern} is a regular
 * expression matching one allowed character, e.g. {@code [a-z0-9_]}.
 */
@Value
@Builder
@Jacksonized
public class ConstraintProfile {
    private static final Map<String, Pattern> PATTERNS = new ConcurrentHashMap<>();

    String code;
    int maxLength;
    @Builder.Default
    CasePolicy casePolicy = CasePolicy.PRESERVE;
    @Builder.Default
    String allowedCharsPattern = "[A-Za-z0-9_]";
    @Builder.Default
    NormalizeRule normalizeRule = NormalizeRule.replaceWith('_');

    @JsonIgnore
    public Pattern allowedChars() {
        return PATTERNS.computeIfAbsent(allowedCharsPattern, Pattern::compile);
    }

    @JsonIgnore
    public boolean allows(char c) {
        return allowedChars().matcher(String.valueOf(c)).matches();
    }
}
