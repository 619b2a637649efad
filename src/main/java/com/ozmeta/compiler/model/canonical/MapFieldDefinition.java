package com.ozmeta.compiler.model.canonical;

import java.util.UUID;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class MapFieldDefinition {
    UUID id;
    UUID mapObjectId;
    UUID sourceFieldId;
    UUID fieldId;
    String transform;
}
