package com.ozmeta.compiler.projection;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.ozmeta.compiler.job.JobDag;
import com.ozmeta.compiler.metric.MetricExpression;
import com.ozmeta.compiler.metric.MetricExpression.FieldRef;
import com.ozmeta.compiler.metric.MetricFormulaParser;
import com.ozmeta.compiler.metric.MetricResolver;
import com.ozmeta.compiler.model.canonical.ConstraintProfile;
import com.ozmeta.compiler.model.canonical.FieldDefinition;
import com.ozmeta.compiler.model.canonical.JobDefinition;
import com.ozmeta.compiler.model.canonical.JobStepDefinition;
import com.ozmeta.compiler.model.canonical.MetricDefinition;
import com.ozmeta.compiler.model.canonical.MetricFormulaDefinition;
import com.ozmeta.compiler.model.canonical.PlatformCategory;
import com.ozmeta.compiler.model.canonical.PlatformDefinition;
import com.ozmeta.compiler.model.canonical.PolicyType;
import com.ozmeta.compiler.model.canonical.RelationDefinition;
import com.ozmeta.compiler.model.canonical.SecurityPolicyDefinition;
import com.ozmeta.compiler.model.canonical.Sensitivity;
import com.ozmeta.compiler.model.canonical.TableDefinition;
import com.ozmeta.compiler.model.canonical.TableSecurityDefinition;
import com.ozmeta.compiler.model.canonical.TargetDefinition;
import com.ozmeta.compiler.model.core.context.ToolDiagnostics;
import com.ozmeta.compiler.model.physical.CanonicalRef;
import com.ozmeta.compiler.model.physical.CanonicalType;
import com.ozmeta.compiler.model.physical.FkEnforcement;
import com.ozmeta.compiler.model.physical.PhysicalField;
import com.ozmeta.compiler.model.physical.PhysicalObject;
import com.ozmeta.compiler.model.physical.ProjectedJob;
import com.ozmeta.compiler.model.physical.ProjectedJobStep;
import com.ozmeta.compiler.model.physical.ProjectedMetric;
import com.ozmeta.compiler.model.physical.ProjectedRelation;
import com.ozmeta.compiler.model.physical.ProjectedRowPolicy;
import com.ozmeta.compiler.model.physical.ReverseKey;
import com.ozmeta.compiler.model.physical.TargetPlatformBinding;
import com.ozmeta.compiler.model.physical.TargetProjection;
import com.ozmeta.compiler.naming.CodeRegistry;
import com.ozmeta.compiler.naming.IdentifierNormalizer;
import com.ozmeta.compiler.naming.PhysicalNameRegistry;
import com.ozmeta.compiler.naming.TypeResolver;
import com.ozmeta.compiler.policy.PolicyBinder;
import com.ozmeta.compiler.policy.PolicyExpression;
import com.ozmeta.compiler.policy.PolicyExpression.Operation;
import com.ozmeta.compiler.policy.PolicyExpression.Operator;
import com.ozmeta.compiler.policy.PolicyParser;
import com.ozmeta.compiler.snapshot.InternalFields;
import com.ozmeta.compiler.snapshot.SnapshotIndex;
import com.ozmeta.compiler.snapshot.SnapshotIndex.FieldLocation;
import com.ozmeta.compiler.util.Hashing;

/**
 * Derives the physical model of one target platform from the canonical
 * snapshot. The result depends only on the snapshot and the platform's
 * profiles; every collection is processed in code or id order.
 */
public class ProjectionResolver {

    private static final Logger log = LoggerFactory.getLogger(ProjectionResolver.class);

    private static final Comparator<FieldDefinition> FIELD_ORDER =
            Comparator.comparingInt(FieldDefinition::getOrdinal).thenComparing(FieldDefinition::getName);

    private final SnapshotIndex index;
    private final TypeResolver typeResolver;
    private final CodeRegistry codes;
    private final MetricFormulaParser metricParser = new MetricFormulaParser();
    private final PolicyParser policyParser = new PolicyParser();

    public ProjectionResolver(SnapshotIndex index, CodeRegistry codes) {
        this.index = index;
        this.typeResolver = new TypeResolver(index);
        this.codes = codes;
    }

    public TargetProjection project(TargetPlatformBinding binding, ToolDiagnostics diagnostics) {
        TargetDefinition target = binding.getTarget();
        PlatformDefinition platform = binding.getPlatform();
        ConstraintProfile profile = binding.getConstraintProfile();

        PhysicalNameRegistry names = new PhysicalNameRegistry(profile);
        ReverseIndex reverseIndex = new ReverseIndex();
        String container = IdentifierNormalizer.normalizeIdentifier(target.getCanonicalName(), profile);

        List<TableDefinition> tables = index.getSnapshot().getModel().getTables().stream()
                .filter(t -> target.coversDomain(t.getDomain()))
                .sorted(Comparator.comparing(TableDefinition::getCode))
                .collect(Collectors.toList());
        log.debug("Projecting {} tables onto {}", tables.size(), binding.key());

        Map<UUID, PhysicalObject> objectsByTable = new LinkedHashMap<>();
        for (TableDefinition table : tables) {
            PhysicalObject object = projectTable(table, binding, names, reverseIndex, container);
            objectsByTable.put(table.getId(), object);
        }

        List<ProjectedRelation> relations = projectRelations(objectsByTable, platform.getCategory(), names,
                diagnostics);
        List<ProjectedJob> jobs = projectJobs(target, names);
        List<ProjectedMetric> metrics = projectMetrics(target, objectsByTable, names, diagnostics);
        List<ProjectedRowPolicy> rowPolicies = projectRowPolicies(objectsByTable, names);

        diagnostics.info(binding.key() + ": " + objectsByTable.size() + " objects, " + relations.size()
                + " relations, " + jobs.size() + " jobs, " + metrics.size() + " metrics, " + rowPolicies.size()
                + " row policies");

        return TargetProjection.builder()
                .binding(binding)
                .container(container)
                .objects(List.copyOf(objectsByTable.values()))
                .relations(relations)
                .jobs(jobs)
                .metrics(metrics)
                .rowPolicies(rowPolicies)
                .reverseIndex(reverseIndex)
                .build();
    }

    private PhysicalObject projectTable(TableDefinition table, TargetPlatformBinding binding,
            PhysicalNameRegistry names, ReverseIndex reverseIndex, String container) {
        UUID targetPlatformId = binding.getTargetPlatform().getId();
        String schema = names.claim(PhysicalNameRegistry.SCHEMA_SCOPE, Hashing.derivedId("schema", table.getSchema()),
                table.getSchema());
        String name = names.claim(PhysicalNameRegistry.TABLE_SCOPE, table.getId(), table.getName());
        ReverseKey tableKey = ReverseKey.builder()
                .targetPlatformId(targetPlatformId)
                .container(container)
                .schema(schema)
                .name(name)
                .build();
        reverseIndex.register(tableKey, CanonicalRef.table(table.getId()));

        PhysicalObject.PhysicalObjectBuilder object = PhysicalObject.builder()
                .id(Hashing.derivedId(targetPlatformId, table.getId()))
                .targetPlatformId(targetPlatformId)
                .canonicalType(CanonicalType.TABLE)
                .canonicalId(table.getId())
                .tableCode(table.getCode())
                .canonicalName(table.getName())
                .physicalContainer(container)
                .physicalSchema(schema)
                .physicalName(name)
                .reverseKey(tableKey)
                .requiresTenant(table.isRequiresTenant());

        List<FieldDefinition> fields = new ArrayList<>(table.getFields());
        fields.sort(FIELD_ORDER);
        boolean hasPrimaryKey = false;
        for (FieldDefinition field : fields) {
            String column = names.claim(PhysicalNameRegistry.columnScope(name), field.getId(), field.getName());
            ReverseKey columnKey = tableKey.forColumn(column);
            reverseIndex.register(columnKey, CanonicalRef.field(table.getId(), field.getId()));
            object.field(PhysicalField.builder()
                    .id(Hashing.derivedId(targetPlatformId, field.getId()))
                    .canonicalFieldId(field.getId())
                    .canonicalName(field.getName())
                    .physicalName(column)
                    .logicalType(field.getLogicalType())
                    .physicalType(typeResolver.resolveType(field.getLogicalType(), binding.getPlatform()))
                    .nullable(field.isNullable() && !field.isPrimaryKey())
                    .primaryKey(field.isPrimaryKey())
                    .foreignKey(field.isForeignKey() || field.getReferencesFieldId() != null)
                    .internal(field.isInternal() || field.getName().startsWith("_"))
                    .sensitivity(field.getSensitivity())
                    .masked(field.getSensitivity().atLeast(Sensitivity.CONFIDENTIAL))
                    .encrypted(field.getSensitivity() == Sensitivity.RESTRICTED)
                    .reverseKey(columnKey)
                    .build());
            if (field.isPrimaryKey()) {
                object.primaryKeyColumn(column);
                hasPrimaryKey = true;
            }
            if (table.isRequiresTenant() && InternalFields.TENANT_ID.equals(field.getName())
                    && binding.getPlatform().getCategory() == PlatformCategory.LAKEHOUSE) {
                object.partitionColumn(column);
            }
        }
        if (hasPrimaryKey) {
            object.primaryKeyName(names.claim(PhysicalNameRegistry.CONSTRAINT_SCOPE,
                    Hashing.derivedId("pk", table.getId()), "pk_" + table.getCode()));
        }
        return object.build();
    }

    private List<ProjectedRelation> projectRelations(Map<UUID, PhysicalObject> objectsByTable,
            PlatformCategory category, PhysicalNameRegistry names, ToolDiagnostics diagnostics) {
        List<RelationDefinition> relations = new ArrayList<>(index.getSnapshot().getModel().getRelations());
        Set<UUID> declaredFromFields = new HashSet<>();
        relations.forEach(r -> declaredFromFields.add(r.getFromFieldId()));

        // column-level references without an explicit relation become implicit relations
        for (TableDefinition table : index.getSnapshot().getModel().getTables()) {
            for (FieldDefinition field : table.getFields()) {
                if (field.getReferencesFieldId() != null && !declaredFromFields.contains(field.getId())) {
                    relations.add(RelationDefinition.builder()
                            .id(Hashing.derivedId("fk", field.getId()))
                            .fromFieldId(field.getId())
                            .toFieldId(field.getReferencesFieldId())
                            .build());
                }
            }
        }
        relations.sort(Comparator.comparing(r -> r.getId().toString()));

        List<ProjectedRelation> projected = new ArrayList<>();
        for (RelationDefinition relation : relations) {
            FieldLocation from = index.findField(relation.getFromFieldId()).orElseThrow();
            FieldLocation to = index.findField(relation.getToFieldId()).orElseThrow();
            PhysicalObject fromObject = objectsByTable.get(from.getTable().getId());
            PhysicalObject toObject = objectsByTable.get(to.getTable().getId());
            if (fromObject == null) {
                continue;
            }
            if (toObject == null) {
                diagnostics.warn("Relation " + relation.getId() + " from " + from.getTable().getName()
                        + " points outside the target's domain; skipped");
                continue;
            }
            String fromCode = codes.codeFor(from.getTable().getId()).orElse(from.getTable().getCode());
            String toCode = codes.codeFor(to.getTable().getId()).orElse(to.getTable().getCode());
            String constraintName = names.claim(PhysicalNameRegistry.CONSTRAINT_SCOPE, relation.getId(),
                    "fk_" + fromCode + "_" + toCode + "_" + from.getField().getName());
            FkEnforcement enforcement = relation.isEnforce() && category.supportsDeclarativeForeignKeys()
                    ? FkEnforcement.DECLARATIVE
                    : FkEnforcement.LOGICAL_ONLY;
            projected.add(ProjectedRelation.builder()
                    .relationId(relation.getId())
                    .constraintName(constraintName)
                    .roleName(relation.getRoleName())
                    .cardinality(relation.getCardinality())
                    .fromObject(fromObject)
                    .fromColumn(fromObject.findField(from.getField().getId()).orElseThrow().getPhysicalName())
                    .toObject(toObject)
                    .toColumn(toObject.findField(to.getField().getId()).orElseThrow().getPhysicalName())
                    .enforcement(enforcement)
                    .build());
        }
        return projected;
    }

    private List<ProjectedJob> projectJobs(TargetDefinition target, PhysicalNameRegistry names) {
        List<JobDefinition> jobs = index.getSnapshot().getJobs().getJobs().stream()
                .filter(JobDefinition::isEnabled)
                .filter(j -> target.coversDomain(j.getDomain()))
                .sorted(Comparator.comparing(JobDefinition::getCode))
                .collect(Collectors.toList());

        List<ProjectedJob> projected = new ArrayList<>();
        for (JobDefinition job : jobs) {
            String jobName = names.claim(PhysicalNameRegistry.JOB_SCOPE, job.getId(), job.getCode());
            List<JobStepDefinition> ordered = JobDag.executionOrder(job);

            Map<String, String> taskNames = new HashMap<>();
            for (JobStepDefinition step : ordered) {
                UUID stepId = step.getId() != null ? step.getId() : Hashing.derivedId(job.getId(), step.getCode());
                taskNames.put(step.getCode(), names.claim(PhysicalNameRegistry.JOB_SCOPE, stepId,
                        job.getCode() + "_" + step.getCode()));
            }
            List<ProjectedJobStep> steps = ordered.stream()
                    .map(step -> ProjectedJobStep.builder()
                            .code(step.getCode())
                            .taskName(taskNames.get(step.getCode()))
                            .order(step.getOrder())
                            .type(step.getType())
                            .command(step.getCommand())
                            .dependsOnTasks(step.getDependsOn().stream()
                                    .sorted()
                                    .map(taskNames::get)
                                    .collect(Collectors.toList()))
                            .build())
                    .collect(Collectors.toList());
            projected.add(ProjectedJob.builder()
                    .jobId(job.getId())
                    .code(job.getCode())
                    .physicalName(jobName)
                    .layer(job.getLayer())
                    .schedule(job.getSchedule())
                    .steps(steps)
                    .build());
        }
        return projected;
    }

    private List<ProjectedMetric> projectMetrics(TargetDefinition target, Map<UUID, PhysicalObject> objectsByTable,
            PhysicalNameRegistry names, ToolDiagnostics diagnostics) {
        List<MetricDefinition> metrics = index.getSnapshot().getMetrics().getMetrics().stream()
                .filter(m -> target.coversDomain(m.getDomain()))
                .sorted(Comparator.comparing(MetricDefinition::getCode))
                .collect(Collectors.toList());

        Map<String, MetricExpression> parsed = new HashMap<>();
        Map<String, MetricFormulaDefinition> formulas = new HashMap<>();
        for (MetricDefinition metric : metrics) {
            Optional<MetricFormulaDefinition> formula = metric.currentFormula();
            if (formula.isEmpty()) {
                diagnostics.warn("Metric '" + metric.getCode() + "' has no approved formula; skipped");
                continue;
            }
            formulas.put(metric.getCode(), formula.get());
            parsed.put(metric.getCode(), metricParser.parse(metric.getCode(), formula.get().getExpression()));
        }

        MetricResolver resolver = new MetricResolver(parsed, (table, field) -> index.findTableByNameOrCode(table)
                .map(t -> objectsByTable.get(t.getId()))
                .flatMap(object -> object.findFieldByCanonicalName(field)
                        .map(column -> new FieldRef(table, field, object.getPhysicalSchema(),
                                object.getPhysicalName(), column.getPhysicalName()))));

        List<ProjectedMetric> projected = new ArrayList<>();
        for (MetricDefinition metric : metrics) {
            MetricFormulaDefinition formula = formulas.get(metric.getCode());
            if (formula == null) {
                continue;
            }
            projected.add(ProjectedMetric.builder()
                    .metricId(metric.getId())
                    .formulaId(formula.getId())
                    .formulaVersion(formula.getVersion())
                    .code(metric.getCode())
                    .physicalName(names.claim(PhysicalNameRegistry.METRIC_SCOPE, metric.getId(), metric.getCode()))
                    .format(metric.getFormat())
                    .expression(resolver.resolve(metric.getCode()))
                    .build());
        }
        return projected;
    }

    /**
     * One combined row policy per secured table: enabled RLS policies in
     * filter mode are AND-ed into the read filter, those in block mode into
     * the write check.
     */
    private List<ProjectedRowPolicy> projectRowPolicies(Map<UUID, PhysicalObject> objectsByTable,
            PhysicalNameRegistry names) {
        Map<UUID, SecurityPolicyDefinition> policies = new HashMap<>();
        for (SecurityPolicyDefinition policy : index.getSnapshot().getSecurity().getPolicies()) {
            if (policy.isEnabled() && policy.getType() == PolicyType.RLS) {
                policies.putIfAbsent(policy.getId(), policy);
            }
        }
        Map<UUID, List<TableSecurityDefinition>> byTable = index.getSnapshot().getSecurity().getTableSecurity()
                .stream()
                .filter(ts -> policies.containsKey(ts.getPolicyId()))
                .collect(Collectors.groupingBy(TableSecurityDefinition::getTableId));

        List<ProjectedRowPolicy> projected = new ArrayList<>();
        for (PhysicalObject object : objectsByTable.values()) {
            List<TableSecurityDefinition> applied = byTable.getOrDefault(object.getCanonicalId(), List.of());
            if (applied.isEmpty()) {
                continue;
            }
            List<TableSecurityDefinition> ordered = new ArrayList<>(applied);
            ordered.sort(Comparator.comparing(
                    (TableSecurityDefinition ts) -> policies.get(ts.getPolicyId()).getCode()));

            PolicyBinder binder = new PolicyBinder(object);
            List<PolicyExpression> filters = new ArrayList<>();
            List<PolicyExpression> checks = new ArrayList<>();
            ProjectedRowPolicy.ProjectedRowPolicyBuilder rowPolicy = ProjectedRowPolicy.builder()
                    .object(object)
                    .physicalName(names.claim(PhysicalNameRegistry.POLICY_SCOPE,
                            Hashing.derivedId("rls", object.getCanonicalId()), "rls_" + object.getTableCode()));
            for (TableSecurityDefinition security : ordered) {
                SecurityPolicyDefinition policy = policies.get(security.getPolicyId());
                PolicyExpression bound = binder.bind(policy.getCode(),
                        policyParser.parse(policy.getCode(), policy.getExpression()));
                rowPolicy.policyCode(policy.getCode());
                if (security.getMode().filters()) {
                    filters.add(bound);
                }
                if (security.getMode().blocks()) {
                    checks.add(bound);
                }
            }
            projected.add(rowPolicy
                    .filter(conjunction(filters))
                    .check(conjunction(checks))
                    .columns(binder.referencedColumns())
                    .build());
        }
        return projected;
    }

    private static PolicyExpression conjunction(List<PolicyExpression> guards) {
        if (guards.isEmpty()) {
            return null;
        }
        return guards.size() == 1 ? guards.get(0) : new Operation(Operator.AND, List.copyOf(guards));
    }
}
