package com.ozmeta.compiler.lineage;

import java.util.UUID;

import lombok.Value;

/**
 * A lineage node: the {@link NodeKind} says which table {@code id} belongs to.
 */
@Value
public class LineageNodeRef implements Comparable<LineageNodeRef> {
    NodeKind kind;
    UUID id;

    public static LineageNodeRef of(NodeKind kind, UUID id) {
        return new LineageNodeRef(kind, id);
    }

    @Override
    public int compareTo(LineageNodeRef other) {
        int byKind = kind.compareTo(other.kind);
        return byKind != 0 ? byKind : id.compareTo(other.id);
    }
}
