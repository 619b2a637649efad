package com.ozmeta.compiler.emit;

import java.util.List;
import java.util.Set;

import com.ozmeta.compiler.emit.sql.DdlBuilder;
import com.ozmeta.compiler.emit.sql.DdlBuilder.TableStyle;
import com.ozmeta.compiler.emit.sql.SqlDialect;
import com.ozmeta.compiler.job.JobFormat;
import com.ozmeta.compiler.model.output.EmitResult;
import com.ozmeta.compiler.model.physical.PhysicalField;
import com.ozmeta.compiler.model.physical.PhysicalObject;
import com.ozmeta.compiler.model.physical.TargetProjection;
import com.ozmeta.compiler.snapshot.InternalFields;

/**
 * BigQuery DDL (datasets as schemas) with Airflow DAGs for jobs. Keys are
 * declared {@code NOT ENFORCED}; BigQuery primary keys carry no constraint name.
 */
public class BigQueryEmitter implements ArtifactEmitter {

    private static final String NOT_ENFORCED = "NOT ENFORCED";

    private final DdlBuilder ddl = new DdlBuilder(SqlDialect.BIGQUERY);
    private final SharedArtifacts shared;
    private final TableStyle style;

    public BigQueryEmitter(TemplateRenderer templates) {
        this.shared = new SharedArtifacts(templates);
        this.style = TableStyle.builder()
                .inlinePrimaryKey(true)
                .anonymousPrimaryKey(true)
                .primaryKeySuffix(NOT_ENFORCED)
                .columnOptions(f -> f.isMasked()
                        ? "OPTIONS(description=" + SqlDialect.BIGQUERY.stringLiteral(DdlBuilder.sensitivityNote(f)) + ")"
                        : "")
                .tableClauses(this::clusterByTenant)
                .build();
    }

    @Override
    public Set<String> platformCodes() {
        return Set.of("bigquery");
    }

    @Override
    public EmitResult emit(TargetProjection projection) {
        EmitResult.EmitResultBuilder result = EmitResult.builder();
        String header = ddl.header(projection.getBinding().key());

        shared.addSchemas(result, ddl, projection);
        for (PhysicalObject object : projection.getObjects()) {
            result.file(SharedArtifacts.sql(SharedArtifacts.tableFile(object), header + ddl.createTable(object, style)));
        }
        shared.addRowPolicies(result, ddl, projection);
        shared.addForeignKeys(result, ddl, projection, NOT_ENFORCED);
        shared.addJobs(result, projection, JobFormat.AIRFLOW);
        shared.addMetrics(result, projection, SqlDialect.BIGQUERY);
        shared.addDriftRules(result, projection);
        return result.build();
    }

    private List<String> clusterByTenant(PhysicalObject object) {
        if (!object.isRequiresTenant()) {
            return List.of();
        }
        return object.findFieldByCanonicalName(InternalFields.TENANT_ID)
                .map(PhysicalField::getPhysicalName)
                .map(column -> List.of("CLUSTER BY " + SqlDialect.BIGQUERY.quote(column)))
                .orElse(List.of());
    }
}
