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
 * Snowflake DDL clustered by create date, with Snowflake tasks for jobs.
 * Foreign keys are declared; Snowflake records but does not enforce them.
 */
public class SnowflakeEmitter implements ArtifactEmitter {

    private final DdlBuilder ddl = new DdlBuilder(SqlDialect.SNOWFLAKE);
    private final SharedArtifacts shared;
    private final TableStyle style;

    public SnowflakeEmitter(TemplateRenderer templates) {
        this.shared = new SharedArtifacts(templates);
        this.style = TableStyle.builder()
                .inlinePrimaryKey(true)
                .columnOptions(f -> f.isMasked()
                        ? "COMMENT " + SqlDialect.SNOWFLAKE.stringLiteral(DdlBuilder.sensitivityNote(f))
                        : "")
                .tableClauses(this::clusterBy)
                .build();
    }

    @Override
    public Set<String> platformCodes() {
        return Set.of("snowflake");
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
        shared.addForeignKeys(result, ddl, projection, "");
        shared.addJobs(result, projection, JobFormat.SNOWFLAKE_TASK);
        shared.addMetrics(result, projection, SqlDialect.SNOWFLAKE);
        shared.addDriftRules(result, projection);
        return result.build();
    }

    private List<String> clusterBy(PhysicalObject object) {
        return object.findFieldByCanonicalName(InternalFields.CREATE_DATE)
                .map(PhysicalField::getPhysicalName)
                .map(column -> List.of("CLUSTER BY (" + SqlDialect.SNOWFLAKE.quote(column) + ")"))
                .orElse(List.of());
    }
}
