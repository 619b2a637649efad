package com.ozmeta.compiler.model.canonical;

import java.util.UUID;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * A two-letter code ever issued to a table. Retired entries still block reuse.
 */
@Value
@Builder
@Jacksonized
public class CodeRegistryEntry {
    String code;
    UUID tableId;
    boolean retired;
}
