package com.ozmeta.compiler.model.canonical;

import java.util.UUID;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Maps a source-system object onto a canonical table.
 */
@Value
@Builder
@Jacksonized
public class MapObjectDefinition {
    UUID id;
    String sourceSystem;
    String sourceObject;
    UUID tableId;
}
