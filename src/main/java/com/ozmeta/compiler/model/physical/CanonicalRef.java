package com.ozmeta.compiler.model.physical;

import java.util.UUID;

import lombok.Value;

/**
 * What a reverse key resolves back to. {@code tableId} is set for both tables
 * and fields; {@code fieldId} only for fields.
 */
@Value
public class CanonicalRef {
    CanonicalType type;
    UUID tableId;
    UUID fieldId;

    public static CanonicalRef table(UUID tableId) {
        return new CanonicalRef(CanonicalType.TABLE, tableId, null);
    }

    public static CanonicalRef field(UUID tableId, UUID fieldId) {
        return new CanonicalRef(CanonicalType.FIELD, tableId, fieldId);
    }
}
