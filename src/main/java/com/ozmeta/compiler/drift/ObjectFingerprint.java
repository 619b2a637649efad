package com.ozmeta.compiler.drift;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Reference row count and content checksum of one object, taken from a
 * known-good load.
 */
@Value
@Builder
@Jacksonized
public class ObjectFingerprint {
    Long rowCount;
    String checksum;
}
