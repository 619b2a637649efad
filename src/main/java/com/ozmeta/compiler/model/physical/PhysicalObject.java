package com.ozmeta.compiler.model.physical;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * A canonical table as it exists on one target platform.
 */
@Value
@Builder
public class PhysicalObject {
    UUID id;
    UUID targetPlatformId;
    CanonicalType canonicalType;
    UUID canonicalId;
    String tableCode;
    String canonicalName;
    String physicalContainer;
    String physicalSchema;
    String physicalName;
    ReverseKey reverseKey;
    boolean requiresTenant;
    String primaryKeyName;
    @Singular
    List<PhysicalField> fields;
    @Singular("primaryKeyColumn")
    List<String> primaryKey;
    @Singular("partitionColumn")
    List<String> partitionColumns;

    public Optional<PhysicalField> findField(UUID canonicalFieldId) {
        return fields.stream().filter(f -> f.getCanonicalFieldId().equals(canonicalFieldId)).findFirst();
    }

    public Optional<PhysicalField> findFieldByCanonicalName(String canonicalName) {
        return fields.stream().filter(f -> f.getCanonicalName().equalsIgnoreCase(canonicalName)).findFirst();
    }

    public String qualifiedName() {
        return physicalSchema + "." + physicalName;
    }
}
