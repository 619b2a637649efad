package com.ozmeta.compiler.lineage;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import com.ozmeta.compiler.model.canonical.FieldDefinition;
import com.ozmeta.compiler.model.canonical.MapObjectDefinition;
import com.ozmeta.compiler.model.canonical.MetricDefinition;
import com.ozmeta.compiler.model.canonical.SnapshotDocument;
import com.ozmeta.compiler.model.canonical.TableDefinition;

/**
 * Reports gaps in lineage as warnings. Lineage never blocks compilation.
 */
public class LineageCompletenessChecker {

    /**
     * @param physicalFieldIds ids of every physical field the run produced
     */
    public List<String> check(SnapshotDocument snapshot, LineageGraph graph, Set<UUID> physicalFieldIds) {
        List<String> warnings = new ArrayList<>();

        Set<UUID> mappedTables = snapshot.getIntegrations().getMapObjects().stream()
                .map(MapObjectDefinition::getTableId)
                .collect(Collectors.toSet());
        snapshot.getModel().getTables().stream()
                .filter(t -> mappedTables.contains(t.getId()))
                .sorted(Comparator.comparing(TableDefinition::getCode))
                .forEach(table -> {
                    for (FieldDefinition field : table.getFields()) {
                        if (field.isInternal() || field.getName().startsWith("_")) {
                            continue;
                        }
                        LineageNodeRef node = LineageNodeRef.of(NodeKind.CANONICAL_FIELD, field.getId());
                        boolean sourced = graph.directUpstream(node).stream()
                                .anyMatch(n -> n.getKind() == NodeKind.SOURCE_FIELD);
                        if (!sourced) {
                            warnings.add("Field " + table.getName() + "." + field.getName()
                                    + " is mapped from a source object but has no source lineage");
                        }
                    }
                });

        Set<UUID> metricIds = snapshot.getMetrics().getMetrics().stream()
                .map(MetricDefinition::getId)
                .collect(Collectors.toSet());
        graph.edges().stream()
                .flatMap(e -> Stream.of(e.getFrom(), e.getTo()))
                .distinct()
                .sorted()
                .forEach(node -> {
                    if (node.getKind() == NodeKind.SEMANTIC_MEASURE && !metricIds.contains(node.getId())) {
                        warnings.add("Lineage references unknown semantic measure " + node.getId());
                    }
                    if (node.getKind() == NodeKind.PHYSICAL_FIELD && !physicalFieldIds.contains(node.getId())) {
                        warnings.add("Lineage references physical field " + node.getId()
                                + " that no compiled target produces");
                    }
                });
        return warnings;
    }
}
