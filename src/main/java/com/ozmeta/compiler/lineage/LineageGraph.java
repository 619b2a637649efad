package com.ozmeta.compiler.lineage;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import com.ozmeta.compiler.model.canonical.IntegrationArea;
import com.ozmeta.compiler.model.canonical.LineageEdgeDefinition;
import com.ozmeta.compiler.model.canonical.MapFieldDefinition;
import com.ozmeta.compiler.model.physical.PhysicalField;
import com.ozmeta.compiler.model.physical.PhysicalObject;
import com.ozmeta.compiler.model.physical.TargetProjection;

/**
 * Directed field-level lineage: source fields feed canonical fields, which
 * project to physical fields and feed semantic measures.
 */
public class LineageGraph {

    private final Set<LineageEdge> edges = new LinkedHashSet<>();
    private final Map<LineageNodeRef, Set<LineageNodeRef>> forward = new HashMap<>();
    private final Map<LineageNodeRef, Set<LineageNodeRef>> backward = new HashMap<>();

    public static LineageGraph build(IntegrationArea integrations, List<TargetProjection> projections) {
        LineageGraph graph = new LineageGraph();
        for (MapFieldDefinition mapField : integrations.getMapFields()) {
            if (mapField.getSourceFieldId() != null) {
                graph.addEdge(LineageNodeRef.of(NodeKind.SOURCE_FIELD, mapField.getSourceFieldId()),
                        LineageNodeRef.of(NodeKind.CANONICAL_FIELD, mapField.getFieldId()));
            }
        }
        for (LineageEdgeDefinition edge : integrations.getLineageEdges()) {
            graph.addEdge(LineageNodeRef.of(edge.getFromType(), edge.getFromId()),
                    LineageNodeRef.of(edge.getToType(), edge.getToId()));
        }
        for (TargetProjection projection : projections) {
            for (PhysicalObject object : projection.getObjects()) {
                for (PhysicalField field : object.getFields()) {
                    graph.addEdge(LineageNodeRef.of(NodeKind.CANONICAL_FIELD, field.getCanonicalFieldId()),
                            LineageNodeRef.of(NodeKind.PHYSICAL_FIELD, field.getId()));
                }
            }
        }
        return graph;
    }

    public void addEdge(LineageNodeRef from, LineageNodeRef to) {
        if (edges.add(new LineageEdge(from, to))) {
            forward.computeIfAbsent(from, k -> new TreeSet<>()).add(to);
            backward.computeIfAbsent(to, k -> new TreeSet<>()).add(from);
        }
    }

    public Set<LineageEdge> edges() {
        return Collections.unmodifiableSet(edges);
    }

    public boolean contains(LineageNodeRef node) {
        return forward.containsKey(node) || backward.containsKey(node);
    }

    public Set<LineageNodeRef> directUpstream(LineageNodeRef node) {
        return Collections.unmodifiableSet(backward.getOrDefault(node, Set.of()));
    }

    /**
     * Every node {@code node} depends on, nearest first.
     */
    public List<LineageNodeRef> upstream(LineageNodeRef node) {
        return walk(node, backward);
    }

    /**
     * Every node depending on {@code node}, nearest first.
     */
    public List<LineageNodeRef> downstream(LineageNodeRef node) {
        return walk(node, forward);
    }

    private List<LineageNodeRef> walk(LineageNodeRef start, Map<LineageNodeRef, Set<LineageNodeRef>> adjacency) {
        Set<LineageNodeRef> visited = new LinkedHashSet<>();
        Deque<LineageNodeRef> queue = new ArrayDeque<>();
        queue.add(start);
        while (!queue.isEmpty()) {
            LineageNodeRef current = queue.poll();
            for (LineageNodeRef next : adjacency.getOrDefault(current, Set.of())) {
                if (!next.equals(start) && visited.add(next)) {
                    queue.add(next);
                }
            }
        }
        return new ArrayList<>(visited);
    }
}
