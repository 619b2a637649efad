package com.ozmeta.compiler.model.canonical;

import java.util.UUID;

import com.ozmeta.compiler.lineage.NodeKind;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class LineageEdgeDefinition {
    UUID id;
    NodeKind fromType;
    UUID fromId;
    NodeKind toType;
    UUID toId;
}
