package com.ozmeta.compiler.model.physical;

import java.util.UUID;

import lombok.Builder;
import lombok.Value;

/**
 * Locates a physical object, or one of its columns, on a target platform.
 * Unique per target platform.
 */
@Value
@Builder
public class ReverseKey {
    UUID targetPlatformId;
    String container;
    String schema;
    String name;
    String column;

    public ReverseKey forColumn(String columnName) {
        return new ReverseKey(targetPlatformId, container, schema, name, columnName);
    }

    public boolean isColumn() {
        return column != null;
    }

    public String asString() {
        String base = targetPlatformId + "|" + container + "|" + schema + "|" + name;
        return column == null ? base : base + "|" + column;
    }
}
