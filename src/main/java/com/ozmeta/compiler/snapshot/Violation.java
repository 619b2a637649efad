package com.ozmeta.compiler.snapshot;

import lombok.Value;

/**
 * One snapshot problem: a stable rule id, where it was found and what is wrong.
 */
@Value
public class Violation {
    String rule;
    String path;
    String message;

    public static Violation of(String rule, String path, String message) {
        return new Violation(rule, path, message);
    }

    @Override
    public String toString() {
        return "[" + rule + "] " + path + ": " + message;
    }
}
