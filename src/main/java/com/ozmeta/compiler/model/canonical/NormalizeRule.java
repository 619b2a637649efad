package com.ozmeta.compiler.model.canonical;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import lombok.EqualsAndHashCode;

/**
 * What happens to a character outside the allowed set: {@code replace:<c>}
 * substitutes it, {@code strip} drops it.
 */
@EqualsAndHashCode
public final class NormalizeRule {

    private static final String REPLACE_PREFIX = "replace:";

    private final Character replacement;

    private NormalizeRule(Character replacement) {
        this.replacement = replacement;
    }

    public static NormalizeRule strip() {
        return new NormalizeRule(null);
    }

    public static NormalizeRule replaceWith(char replacement) {
        return new NormalizeRule(replacement);
    }

    @JsonCreator
    public static NormalizeRule parse(String text) {
        if (text == null || text.isBlank() || "strip".equalsIgnoreCase(text.trim())) {
            return strip();
        }
        String trimmed = text.trim();
        if (trimmed.regionMatches(true, 0, REPLACE_PREFIX, 0, REPLACE_PREFIX.length())
                && trimmed.length() == REPLACE_PREFIX.length() + 1) {
            return replaceWith(trimmed.charAt(REPLACE_PREFIX.length()));
        }
        throw new IllegalArgumentException("Unsupported normalize rule: " + text);
    }

    public boolean isStrip() {
        return replacement == null;
    }

    public char getReplacement() {
        if (replacement == null) {
            throw new IllegalStateException("strip rule has no replacement character");
        }
        return replacement;
    }

    @JsonValue
    @Override
    public String toString() {
        return isStrip() ? "strip" : REPLACE_PREFIX + replacement;
    }
}
