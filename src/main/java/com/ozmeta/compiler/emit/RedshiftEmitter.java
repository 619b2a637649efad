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
 * Amazon Redshift DDL distributed on the tenant column and sorted by create
 * date, with Airflow DAGs for jobs. Redshift keeps declared keys as planner
 * hints only.
 */
public class RedshiftEmitter implements ArtifactEmitter {

    private final DdlBuilder ddl = new DdlBuilder(SqlDialect.REDSHIFT);
    private final SharedArtifacts shared;
    private final TableStyle style;

    public RedshiftEmitter(TemplateRenderer templates) {
        this.shared = new SharedArtifacts(templates);
        this.style = TableStyle.builder()
                .inlinePrimaryKey(true)
                .tableClauses(this::distributionClauses)
                .build();
    }

    @Override
    public Set<String> platformCodes() {
        return Set.of("redshift");
    }

    @Override
    public EmitResult emit(TargetProjection projection) {
        EmitResult.EmitResultBuilder result = EmitResult.builder();
        String header = ddl.header(projection.getBinding().key());

        shared.addSchemas(result, ddl, projection);
        for (PhysicalObject object : projection.getObjects()) {
            StringBuilder sb = new StringBuilder(header).append(ddl.createTable(object, style));
            for (PhysicalField field : object.getFields()) {
                if (field.isMasked()) {
                    sb.append("COMMENT ON COLUMN ")
                            .append(SqlDialect.REDSHIFT.qualify(object.getPhysicalSchema(), object.getPhysicalName(),
                                    field.getPhysicalName()))
                            .append(" IS ")
                            .append(SqlDialect.REDSHIFT.stringLiteral(DdlBuilder.sensitivityNote(field)))
                            .append(";\n");
                }
            }
            result.file(SharedArtifacts.sql(SharedArtifacts.tableFile(object), sb.toString()));
        }
        shared.addRowPolicies(result, ddl, projection);
        shared.addForeignKeys(result, ddl, projection, "");
        shared.addJobs(result, projection, JobFormat.AIRFLOW);
        shared.addMetrics(result, projection, SqlDialect.REDSHIFT);
        shared.addDriftRules(result, projection);
        return result.build();
    }

    private List<String> distributionClauses(PhysicalObject object) {
        String distribution = object.isRequiresTenant()
                ? object.findFieldByCanonicalName(InternalFields.TENANT_ID)
                        .map(f -> "DISTKEY (" + SqlDialect.REDSHIFT.quote(f.getPhysicalName()) + ")")
                        .orElse("DISTSTYLE AUTO")
                : "DISTSTYLE AUTO";
        return object.findFieldByCanonicalName(InternalFields.CREATE_DATE)
                .map(f -> List.of(distribution, "SORTKEY (" + SqlDialect.REDSHIFT.quote(f.getPhysicalName()) + ")"))
                .orElse(List.of(distribution));
    }
}
