package com.ozmeta.compiler.emit;

import java.util.Set;

import com.ozmeta.compiler.emit.sql.DdlBuilder;
import com.ozmeta.compiler.emit.sql.DdlBuilder.TableStyle;
import com.ozmeta.compiler.emit.sql.SqlDialect;
import com.ozmeta.compiler.job.JobFormat;
import com.ozmeta.compiler.model.output.EmitResult;
import com.ozmeta.compiler.model.physical.PhysicalField;
import com.ozmeta.compiler.model.physical.PhysicalObject;
import com.ozmeta.compiler.model.physical.TargetProjection;

/**
 * PostgreSQL DDL, pg_cron jobs and column comments for classified data.
 */
public class PostgresEmitter implements ArtifactEmitter {

    private static final TableStyle STYLE = TableStyle.builder()
            .inlinePrimaryKey(true)
            .build();

    private final DdlBuilder ddl = new DdlBuilder(SqlDialect.POSTGRES);
    private final SharedArtifacts shared;

    public PostgresEmitter(TemplateRenderer templates) {
        this.shared = new SharedArtifacts(templates);
    }

    @Override
    public Set<String> platformCodes() {
        return Set.of("postgres", "postgresql", "pg");
    }

    @Override
    public EmitResult emit(TargetProjection projection) {
        EmitResult.EmitResultBuilder result = EmitResult.builder();
        String header = ddl.header(projection.getBinding().key());

        shared.addSchemas(result, ddl, projection);
        for (PhysicalObject object : projection.getObjects()) {
            StringBuilder sb = new StringBuilder(header).append(ddl.createTable(object, STYLE));
            for (PhysicalField field : object.getFields()) {
                if (field.isMasked()) {
                    sb.append("COMMENT ON COLUMN ")
                            .append(SqlDialect.POSTGRES.qualify(object.getPhysicalSchema(), object.getPhysicalName(),
                                    field.getPhysicalName()))
                            .append(" IS ")
                            .append(SqlDialect.POSTGRES.stringLiteral(DdlBuilder.sensitivityNote(field)))
                            .append(";\n");
                }
            }
            result.file(SharedArtifacts.sql(SharedArtifacts.tableFile(object), sb.toString()));
        }
        shared.addRowPolicies(result, ddl, projection);
        shared.addForeignKeys(result, ddl, projection, "");
        shared.addJobs(result, projection, JobFormat.PG_CRON);
        shared.addMetrics(result, projection, SqlDialect.POSTGRES);
        shared.addDriftRules(result, projection);
        return result.build();
    }
}
