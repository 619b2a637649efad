package com.ozmeta.compiler.drift;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.function.UnaryOperator;

import com.ozmeta.compiler.TestSnapshots;
import com.ozmeta.compiler.compile.TargetBinder;
import com.ozmeta.compiler.model.canonical.SnapshotDocument;
import com.ozmeta.compiler.model.core.context.ToolDiagnostics;
import com.ozmeta.compiler.model.physical.PhysicalField;
import com.ozmeta.compiler.model.physical.PhysicalObject;
import com.ozmeta.compiler.model.physical.TargetPlatformBinding;
import com.ozmeta.compiler.model.physical.TargetProjection;
import com.ozmeta.compiler.naming.CodeRegistry;
import com.ozmeta.compiler.projection.ProjectionResolver;
import com.ozmeta.compiler.snapshot.SnapshotIndex;
import com.ozmeta.compiler.snapshot.SnapshotLoader;

/**
 * Projections of the multi-target fixture and observations that mirror them.
 */
final class DriftFixtures {

    private DriftFixtures() {
    }

    static TargetProjection project(UUID targetPlatformId) throws IOException {
        SnapshotDocument snapshot = new SnapshotLoader().load(TestSnapshots.path(TestSnapshots.MULTI_TARGET));
        SnapshotIndex index = new SnapshotIndex(snapshot);
        TargetPlatformBinding binding = new TargetBinder("Postgres").bind(index, new ToolDiagnostics()).stream()
                .filter(b -> TargetBinder.sameTargetPlatform(b, targetPlatformId))
                .findFirst()
                .orElseThrow();
        return new ProjectionResolver(index, CodeRegistry.fromSnapshot(snapshot))
                .project(binding, new ToolDiagnostics());
    }

    static ObservedObject mirror(PhysicalObject object) {
        return mirror(object, columns -> columns);
    }

    static ObservedObject mirror(PhysicalObject object, UnaryOperator<List<ObservedColumn>> columnEdit) {
        List<ObservedColumn> columns = new ArrayList<>();
        for (PhysicalField field : object.getFields()) {
            columns.add(ObservedColumn.builder()
                    .name(field.getPhysicalName())
                    .type(field.getPhysicalType())
                    .nullable(field.isNullable())
                    .build());
        }
        return ObservedObject.builder()
                .schema(object.getPhysicalSchema())
                .name(object.getPhysicalName())
                .columns(columnEdit.apply(columns))
                .partitionColumns(object.getPartitionColumns())
                .build();
    }

    static ObservedObject withForeignKeys(ObservedObject observed, List<ObservedForeignKey> foreignKeys) {
        return ObservedObject.builder()
                .schema(observed.getSchema())
                .name(observed.getName())
                .columns(observed.getColumns())
                .partitionColumns(observed.getPartitionColumns())
                .foreignKeys(foreignKeys)
                .build();
    }

    /**
     * Observation in which the live target matches the projection exactly.
     */
    static LiveTargetObservation.LiveTargetObservationBuilder matching(TargetProjection projection) {
        LiveTargetObservation.LiveTargetObservationBuilder observation = LiveTargetObservation.builder()
                .targetPlatformId(projection.getTargetPlatformId());
        for (PhysicalObject object : projection.getObjects()) {
            observation.object(mirror(object));
        }
        return observation;
    }
}
