package com.ozmeta.compiler.model.physical;

import java.util.UUID;

import com.ozmeta.compiler.model.canonical.Sensitivity;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class PhysicalField {
    UUID id;
    UUID canonicalFieldId;
    String canonicalName;
    String physicalName;
    String logicalType;
    String physicalType;
    boolean nullable;
    boolean primaryKey;
    boolean foreignKey;
    boolean internal;
    Sensitivity sensitivity;
    boolean masked;
    boolean encrypted;
    ReverseKey reverseKey;
}
