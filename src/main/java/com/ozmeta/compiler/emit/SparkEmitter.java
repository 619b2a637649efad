package com.ozmeta.compiler.emit;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import com.ozmeta.compiler.emit.sql.DdlBuilder;
import com.ozmeta.compiler.emit.sql.DdlBuilder.TableStyle;
import com.ozmeta.compiler.emit.sql.SqlDialect;
import com.ozmeta.compiler.job.JobFormat;
import com.ozmeta.compiler.model.output.EmitResult;
import com.ozmeta.compiler.model.physical.PhysicalObject;
import com.ozmeta.compiler.model.physical.TargetProjection;

/**
 * Delta tables for Spark lakehouses (Databricks, Fabric). No key
 * constraints; relations are left to drift validation.
 */
public class SparkEmitter implements ArtifactEmitter {

    private final DdlBuilder ddl = new DdlBuilder(SqlDialect.SPARK);
    private final SharedArtifacts shared;
    private final TableStyle style;

    public SparkEmitter(TemplateRenderer templates) {
        this.shared = new SharedArtifacts(templates);
        this.style = TableStyle.builder()
                .inlinePrimaryKey(false)
                .columnOptions(f -> f.isMasked()
                        ? "COMMENT " + SqlDialect.SPARK.stringLiteral(DdlBuilder.sensitivityNote(f))
                        : "")
                .tableClauses(this::deltaClauses)
                .build();
    }

    @Override
    public Set<String> platformCodes() {
        return Set.of("spark", "databricks", "fabric");
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
        shared.addJobs(result, projection, JobFormat.AIRFLOW);
        shared.addMetrics(result, projection, SqlDialect.SPARK);
        shared.addDriftRules(result, projection);
        return result.build();
    }

    private List<String> deltaClauses(PhysicalObject object) {
        List<String> clauses = new ArrayList<>();
        clauses.add("USING DELTA");
        if (!object.getPartitionColumns().isEmpty()) {
            clauses.add("PARTITIONED BY (" + ddl.quotedList(object.getPartitionColumns()) + ")");
        }
        clauses.add("TBLPROPERTIES ('delta.enableChangeDataFeed' = 'true')");
        return clauses;
    }
}
