package com.ozmeta.compiler.drift;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * A declared foreign key constraint as reported by the live target.
 * {@code references} is {@code schema.object.column}.
 */
@Value
@Builder
@Jacksonized
public class ObservedForeignKey {
    String name;
    String column;
    String references;
}
