package com.ozmeta.compiler.lineage;

import lombok.Value;

@Value
public class LineageEdge {
    LineageNodeRef from;
    LineageNodeRef to;
}
