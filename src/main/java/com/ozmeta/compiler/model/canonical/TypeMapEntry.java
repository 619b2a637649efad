package com.ozmeta.compiler.model.canonical;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class TypeMapEntry {
    String profile;
    String logicalType;
    String physicalType;
}
