package com.ozmeta.compiler.drift;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class ObservedColumn {
    String name;
    String type;
    Boolean nullable;
}
