package com.ozmeta.compiler.lineage;

import com.fasterxml.jackson.annotation.JsonCreator;

/**
 * Discriminant of a lineage node.
 */
public enum NodeKind {
    SOURCE_FIELD,
    CANONICAL_FIELD,
    PHYSICAL_FIELD,
    SEMANTIC_MEASURE;

    /**
     * Accepts both {@code SOURCE_FIELD} and the exported {@code SourceField} spelling.
     */
    @JsonCreator
    public static NodeKind fromValue(String value) {
        String compact = value.replace("_", "");
        for (NodeKind kind : values()) {
            if (kind.name().replace("_", "").equalsIgnoreCase(compact)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown lineage node type: " + value);
    }
}
