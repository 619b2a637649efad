package com.ozmeta.compiler.emit;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import com.ozmeta.compiler.emit.sql.DdlBuilder;
import com.ozmeta.compiler.emit.sql.RowPolicyBuilder;
import com.ozmeta.compiler.emit.sql.SqlDialect;
import com.ozmeta.compiler.job.JobCompiler;
import com.ozmeta.compiler.job.JobFormat;
import com.ozmeta.compiler.metric.MetricExpressionCompiler;
import com.ozmeta.compiler.model.output.ArtifactType;
import com.ozmeta.compiler.model.output.DriftRule;
import com.ozmeta.compiler.model.output.DriftRuleKind;
import com.ozmeta.compiler.model.output.EmitResult;
import com.ozmeta.compiler.model.output.EmittedFile;
import com.ozmeta.compiler.model.output.JobTarget;
import com.ozmeta.compiler.model.output.MetricPlatform;
import com.ozmeta.compiler.model.physical.FkEnforcement;
import com.ozmeta.compiler.model.physical.PhysicalField;
import com.ozmeta.compiler.model.physical.PhysicalObject;
import com.ozmeta.compiler.model.physical.ProjectedJob;
import com.ozmeta.compiler.model.physical.ProjectedMetric;
import com.ozmeta.compiler.model.physical.ProjectedRelation;
import com.ozmeta.compiler.model.physical.TargetProjection;
import com.ozmeta.compiler.util.JsonSupport;

/**
 * Artifacts every emitter produces the same way apart from dialect: schema
 * script, row policies, foreign keys, jobs, compiled metrics and drift rules.
 */
public class SharedArtifacts {

    public static final String SCHEMAS_FILE = "sql/00-schemas.sql";
    public static final String RLS_FILE = "sql/85-rls.sql";
    public static final String FOREIGN_KEYS_FILE = "sql/90-foreign-keys.sql";
    public static final String METRICS_FILE = "semantic/metrics.json";
    public static final String DRIFT_RULES_FILE = "drift/rules.json";

    private final JobCompiler jobCompiler;

    public SharedArtifacts(TemplateRenderer templates) {
        this.jobCompiler = new JobCompiler(templates);
    }

    public static String tableFile(PhysicalObject object) {
        return "sql/" + object.getPhysicalName() + ".sql";
    }

    public void addSchemas(EmitResult.EmitResultBuilder result, DdlBuilder ddl, TargetProjection projection) {
        List<String> schemas = projection.getObjects().stream()
                .map(PhysicalObject::getPhysicalSchema)
                .collect(Collectors.toList());
        result.file(sql(SCHEMAS_FILE, ddl.header(projection.getBinding().key()) + ddl.createSchemas(schemas)));
    }

    public void addRowPolicies(EmitResult.EmitResultBuilder result, DdlBuilder ddl, TargetProjection projection) {
        if (projection.getRowPolicies().isEmpty()) {
            return;
        }
        RowPolicyBuilder builder = new RowPolicyBuilder(ddl.getDialect());
        StringBuilder sb = new StringBuilder(ddl.header(projection.getBinding().key()));
        projection.getRowPolicies().forEach(p -> sb.append(builder.render(p)));
        result.file(sql(RLS_FILE, sb.toString()));
    }

    public void addForeignKeys(EmitResult.EmitResultBuilder result, DdlBuilder ddl, TargetProjection projection,
            String suffix) {
        List<ProjectedRelation> declarative = projection.getRelations().stream()
                .filter(r -> r.getEnforcement() == FkEnforcement.DECLARATIVE)
                .sorted((a, b) -> a.getConstraintName().compareTo(b.getConstraintName()))
                .collect(Collectors.toList());
        if (declarative.isEmpty()) {
            return;
        }
        StringBuilder sb = new StringBuilder(ddl.header(projection.getBinding().key()));
        declarative.forEach(r -> sb.append(ddl.addForeignKey(r, suffix)));
        result.file(sql(FOREIGN_KEYS_FILE, sb.toString()));
    }

    public void addJobs(EmitResult.EmitResultBuilder result, TargetProjection projection, JobFormat format) {
        for (ProjectedJob job : projection.getJobs()) {
            EmittedFile file = jobCompiler.compile(job, format, projection.getBinding().key());
            result.file(file);
            result.jobTarget(new JobTarget(job.getJobId(), projection.getTargetPlatformId(), format, file.getPath()));
        }
    }

    public void addMetrics(EmitResult.EmitResultBuilder result, TargetProjection projection, SqlDialect dialect) {
        if (projection.getMetrics().isEmpty()) {
            return;
        }
        MetricExpressionCompiler compiler = new MetricExpressionCompiler(dialect);
        List<Map<String, Object>> entries = new ArrayList<>();
        for (ProjectedMetric metric : projection.getMetrics()) {
            String expression = compiler.compile(metric.getExpression());
            result.metricPlatform(new MetricPlatform(metric.getFormulaId(),
                    projection.getBinding().getPlatform().getId(), metric.getCode(), expression));
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("code", metric.getCode());
            entry.put("name", metric.getPhysicalName());
            entry.put("formulaId", metric.getFormulaId());
            entry.put("version", metric.getFormulaVersion());
            entry.put("format", metric.getFormat());
            entry.put("expression", expression);
            entries.add(entry);
        }
        Map<String, Object> document = new LinkedHashMap<>();
        document.put("target", projection.getBinding().key());
        document.put("metrics", entries);
        result.file(EmittedFile.builder()
                .path(METRICS_FILE)
                .contents(JsonSupport.toCanonicalJson(document))
                .type(ArtifactType.SEMANTIC)
                .build());
    }

    public void addDriftRules(EmitResult.EmitResultBuilder result, TargetProjection projection) {
        List<DriftRule> rules = driftRules(projection);
        rules.forEach(result::driftRule);
        Map<String, Object> document = new LinkedHashMap<>();
        document.put("target", projection.getBinding().key());
        document.put("rules", rules);
        result.file(EmittedFile.builder()
                .path(DRIFT_RULES_FILE)
                .contents(JsonSupport.toCanonicalJson(document))
                .type(ArtifactType.DRIFT_RULES)
                .build());
    }

    static List<DriftRule> driftRules(TargetProjection projection) {
        List<DriftRule> rules = new ArrayList<>();
        for (PhysicalObject object : projection.getObjects()) {
            rules.add(rule(DriftRuleKind.OBJECT_EXISTS, object, null, null));
            for (PhysicalField field : object.getFields()) {
                rules.add(rule(DriftRuleKind.FIELD_TYPE, object, field.getPhysicalName(), field.getPhysicalType()));
                if (field.isInternal()) {
                    rules.add(rule(DriftRuleKind.MANDATORY_FIELD, object, field.getPhysicalName(), null));
                }
            }
            if (!object.getPartitionColumns().isEmpty()) {
                rules.add(rule(DriftRuleKind.PARTITIONING, object, null,
                        String.join(",", object.getPartitionColumns())));
            }
        }
        for (ProjectedRelation relation : projection.getRelations()) {
            DriftRuleKind kind = relation.getEnforcement() == FkEnforcement.DECLARATIVE
                    ? DriftRuleKind.FOREIGN_KEY
                    : DriftRuleKind.LOGICAL_FOREIGN_KEY;
            rules.add(DriftRule.builder()
                    .kind(kind)
                    .schema(relation.getFromObject().getPhysicalSchema())
                    .object(relation.getFromObject().getPhysicalName())
                    .column(relation.getFromColumn())
                    .constraint(relation.getConstraintName())
                    .expected(relation.getToObject().qualifiedName() + "." + relation.getToColumn())
                    .build());
        }
        return rules;
    }

    private static DriftRule rule(DriftRuleKind kind, PhysicalObject object, String column, String expected) {
        return DriftRule.builder()
                .kind(kind)
                .schema(object.getPhysicalSchema())
                .object(object.getPhysicalName())
                .column(column)
                .expected(expected)
                .build();
    }

    static EmittedFile sql(String path, String contents) {
        return EmittedFile.builder().path(path).contents(contents).type(ArtifactType.DDL).build();
    }
}
