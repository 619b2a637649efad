package com.ozmeta.compiler.snapshot;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import com.ozmeta.compiler.exception.CompilationException;
import com.ozmeta.compiler.lineage.NodeKind;
import com.ozmeta.compiler.model.canonical.CodeRegistryEntry;
import com.ozmeta.compiler.model.canonical.FieldDefinition;
import com.ozmeta.compiler.model.canonical.IntegrationArea;
import com.ozmeta.compiler.model.canonical.JobDefinition;
import com.ozmeta.compiler.model.canonical.JobStepDefinition;
import com.ozmeta.compiler.model.canonical.LineageEdgeDefinition;
import com.ozmeta.compiler.model.canonical.LogicalTypeDefinition;
import com.ozmeta.compiler.model.canonical.MapFieldDefinition;
import com.ozmeta.compiler.model.canonical.MapObjectDefinition;
import com.ozmeta.compiler.model.canonical.MetricDefinition;
import com.ozmeta.compiler.model.canonical.PlatformDefinition;
import com.ozmeta.compiler.model.canonical.PolicyType;
import com.ozmeta.compiler.model.canonical.RelationDefinition;
import com.ozmeta.compiler.model.canonical.SecurityPolicyDefinition;
import com.ozmeta.compiler.model.canonical.SnapshotDocument;
import com.ozmeta.compiler.model.canonical.SourceFieldDefinition;
import com.ozmeta.compiler.model.canonical.TableDefinition;
import com.ozmeta.compiler.model.canonical.TableSecurityDefinition;
import com.ozmeta.compiler.model.canonical.TargetDefinition;
import com.ozmeta.compiler.model.canonical.TargetPlatformDefinition;
import com.ozmeta.compiler.model.canonical.TargetRole;
import com.ozmeta.compiler.policy.PolicyExpression;
import com.ozmeta.compiler.policy.PolicyExpression.ColumnRef;
import com.ozmeta.compiler.policy.PolicyExpression.Operation;
import com.ozmeta.compiler.policy.PolicyParser;

/**
 * Semantic checks that JSON-Schema cannot express: references, code registry,
 * mandatory internal fields and target topology. Collects every violation.
 */
public class SnapshotValidator {

    public static final Set<String> SUPPORTED_VERSIONS = Set.of("0.1", "1.0");

    private static final Pattern TABLE_CODE = Pattern.compile("^[A-Z]{2}$");

    public List<Violation> validate(SnapshotIndex index) {
        List<Violation> violations = new ArrayList<>();
        SnapshotDocument snapshot = index.getSnapshot();

        checkVersion(snapshot, violations);
        checkTables(index, violations);
        checkCodeRegistry(snapshot, violations);
        checkRelations(index, violations);
        checkPlatforms(index, violations);
        checkTargets(index, violations);
        checkIntegrations(index, violations);
        checkJobs(snapshot, violations);
        checkMetrics(index, violations);
        checkSecurity(index, violations);

        return violations;
    }

    private void checkVersion(SnapshotDocument snapshot, List<Violation> violations) {
        String version = snapshot.getMeta().getVersion();
        if (!SUPPORTED_VERSIONS.contains(version)) {
            violations.add(Violation.of("meta.version", "meta.version",
                    "Unsupported snapshot version '" + version + "'; supported: "
                            + SUPPORTED_VERSIONS.stream().sorted().collect(Collectors.joining(", "))));
        }
    }

    private void checkTables(SnapshotIndex index, List<Violation> violations) {
        Set<String> logicalTypes = index.getSnapshot().getModel().getLogicalTypes().stream()
                .map(LogicalTypeDefinition::getCode)
                .collect(Collectors.toSet());
        Set<UUID> tableIds = new HashSet<>();
        Set<UUID> fieldIds = new HashSet<>();
        Map<String, String> codes = new HashMap<>();

        for (TableDefinition table : index.getSnapshot().getModel().getTables()) {
            String path = "model.tables[" + table.getName() + "]";
            if (!tableIds.add(table.getId())) {
                violations.add(Violation.of("table.id.duplicate", path, "Duplicate table id " + table.getId()));
            }
            if (table.getCode() == null || !TABLE_CODE.matcher(table.getCode()).matches()) {
                violations.add(Violation.of("table.code.format", path,
                        "Table code '" + table.getCode() + "' must be exactly two upper-case letters"));
            } else {
                String previous = codes.putIfAbsent(table.getCode(), table.getName());
                if (previous != null) {
                    violations.add(Violation.of("table.code.duplicate", path,
                            "Table code '" + table.getCode() + "' is already used by table '" + previous + "'"));
                }
            }

            Set<String> fieldNames = new HashSet<>();
            for (FieldDefinition field : table.getFields()) {
                String fieldPath = path + ".fields[" + field.getName() + "]";
                if (!fieldIds.add(field.getId())) {
                    violations.add(Violation.of("field.id.duplicate", fieldPath, "Duplicate field id " + field.getId()));
                }
                if (!fieldNames.add(field.getName().toLowerCase(Locale.ROOT))) {
                    violations.add(Violation.of("field.name.duplicate", fieldPath,
                            "Field name '" + field.getName() + "' appears more than once"));
                }
                if (!logicalTypes.contains(field.getLogicalType())) {
                    violations.add(Violation.of("field.logicalType.unresolved", fieldPath,
                            "Logical type '" + field.getLogicalType() + "' is not defined"));
                }
                if (field.getReferencesFieldId() != null && index.findField(field.getReferencesFieldId()).isEmpty()) {
                    violations.add(Violation.of("field.fk.unresolved", fieldPath,
                            "Foreign key references unknown field " + field.getReferencesFieldId()));
                }
            }

            for (String required : InternalFields.requiredFor(table.isRequiresTenant())) {
                boolean present = table.getFields().stream().anyMatch(f -> f.getName().equals(required));
                if (!present) {
                    violations.add(Violation.of("table.internalField.missing", path,
                            "Table '" + table.getName() + "' (" + table.getCode()
                                    + ") is missing mandatory internal field " + required));
                }
            }
        }
    }

    private void checkCodeRegistry(SnapshotDocument snapshot, List<Violation> violations) {
        Map<String, UUID> issued = new HashMap<>();
        for (CodeRegistryEntry entry : snapshot.getModel().getCodeRegistry()) {
            UUID previous = issued.putIfAbsent(entry.getCode(), entry.getTableId());
            if (previous != null && !previous.equals(entry.getTableId())) {
                violations.add(Violation.of("code.reassigned", "model.codeRegistry[" + entry.getCode() + "]",
                        "Code '" + entry.getCode() + "' was issued to more than one table"));
            }
        }
        for (TableDefinition table : snapshot.getModel().getTables()) {
            UUID owner = issued.get(table.getCode());
            if (owner != null && !owner.equals(table.getId())) {
                violations.add(Violation.of("code.reassigned", "model.tables[" + table.getName() + "]",
                        "Code '" + table.getCode() + "' belongs to table " + owner + " and cannot be reused"));
            }
        }
    }

    private void checkRelations(SnapshotIndex index, List<Violation> violations) {
        for (RelationDefinition relation : index.getSnapshot().getModel().getRelations()) {
            String path = "model.relations[" + relation.getId() + "]";
            if (index.findField(relation.getFromFieldId()).isEmpty()) {
                violations.add(Violation.of("relation.from.unresolved", path,
                        "Relation source field " + relation.getFromFieldId() + " does not exist"));
            }
            if (index.findField(relation.getToFieldId()).isEmpty()) {
                violations.add(Violation.of("relation.to.unresolved", path,
                        "Relation target field " + relation.getToFieldId() + " does not exist"));
            }
        }
    }

    private void checkPlatforms(SnapshotIndex index, List<Violation> violations) {
        Set<String> codes = new HashSet<>();
        for (PlatformDefinition platform : index.getPlatformArea().getPlatforms()) {
            String path = "platforms.platforms[" + platform.getCode() + "]";
            if (!codes.add(platform.getCode().toLowerCase(Locale.ROOT))) {
                violations.add(Violation.of("platform.code.duplicate", path,
                        "Platform code '" + platform.getCode() + "' is defined more than once"));
            }
            if (index.findConstraintProfile(platform.getConstraintProfile()).isEmpty()) {
                violations.add(Violation.of("platform.constraintProfile.unresolved", path,
                        "Constraint profile '" + platform.getConstraintProfile() + "' is not defined"));
            }
            if (!index.hasTypeMappingProfile(platform.getTypeMappingProfile())) {
                violations.add(Violation.of("platform.typeMappingProfile.unresolved", path,
                        "Type mapping profile '" + platform.getTypeMappingProfile() + "' has no entries"));
            }
        }
        index.getPlatformArea().getConstraintProfiles().forEach(profile -> {
            if (profile.getMaxLength() < 8) {
                violations.add(Violation.of("constraintProfile.maxLength", "platforms.constraintProfiles["
                        + profile.getCode() + "]", "maxLength must be at least 8 to fit a hash suffix"));
            }
        });
    }

    private void checkTargets(SnapshotIndex index, List<Violation> violations) {
        List<TargetDefinition> targets = index.getSnapshot().getTargets().getTargets();
        List<TargetPlatformDefinition> bindings = index.getSnapshot().getTargets().getTargetPlatforms();

        Set<String> canonicalNames = new HashSet<>();
        Map<String, List<TargetDefinition>> groups = new HashMap<>();
        for (TargetDefinition target : targets) {
            String path = "targets.targets[" + target.getCanonicalName() + "]";
            if (!canonicalNames.add(target.getCanonicalName().toLowerCase(Locale.ROOT))) {
                violations.add(Violation.of("target.name.duplicate", path,
                        "Target canonical name '" + target.getCanonicalName() + "' is not unique"));
            }
            if (target.isProductionSlot()) {
                if (target.getSwitchGroup() == null || target.getSwitchGroup().isBlank()) {
                    violations.add(Violation.of("target.switchGroup.missing", path,
                            "Production slot target must name a switch group"));
                } else {
                    groups.computeIfAbsent(target.getSwitchGroup(), k -> new ArrayList<>()).add(target);
                }
            }
            long primaries = bindings.stream()
                    .filter(b -> target.getId().equals(b.getTargetId()))
                    .filter(b -> b.getRole() == TargetRole.PRIMARY)
                    .count();
            if (primaries != 1) {
                violations.add(Violation.of("target.primary.count", path,
                        "Target must have exactly one Primary platform, found " + primaries));
            }
        }

        groups.entrySet().stream()
                .sorted(Map.Entry.comparingByKey())
                .forEach(group -> {
                    long active = group.getValue().stream().filter(TargetDefinition::isActive).count();
                    if (active != 1) {
                        violations.add(Violation.of("switchGroup.active.count", "targets.switchGroups["
                                + group.getKey() + "]", "Switch group must have exactly one active slot, found " + active));
                    }
                });

        Set<String> targetPlatformPairs = new HashSet<>();
        for (TargetPlatformDefinition binding : bindings) {
            String path = "targets.targetPlatforms[" + binding.getId() + "]";
            // Each (target, platform) pair owns one output folder.
            if (!targetPlatformPairs.add(binding.getTargetId() + "/" + binding.getPlatformId())) {
                violations.add(Violation.of("targetPlatform.platform.duplicate", path,
                        "Platform " + binding.getPlatformId() + " is already bound to target " + binding.getTargetId()));
            }
            if (index.findTarget(binding.getTargetId()).isEmpty()) {
                violations.add(Violation.of("targetPlatform.target.unresolved", path,
                        "Target " + binding.getTargetId() + " does not exist"));
            }
            if (index.findPlatform(binding.getPlatformId()).isEmpty()) {
                violations.add(Violation.of("targetPlatform.platform.unresolved", path,
                        "Platform " + binding.getPlatformId() + " does not exist"));
            }
        }
    }

    private void checkIntegrations(SnapshotIndex index, List<Violation> violations) {
        IntegrationArea integrations = index.getSnapshot().getIntegrations();
        Set<UUID> sourceFields = integrations.getSourceFields().stream()
                .map(SourceFieldDefinition::getId)
                .collect(Collectors.toSet());
        Set<UUID> mapObjects = new HashSet<>();
        for (MapObjectDefinition mapObject : integrations.getMapObjects()) {
            mapObjects.add(mapObject.getId());
            if (index.findTable(mapObject.getTableId()).isEmpty()) {
                violations.add(Violation.of("mapObject.table.unresolved", "integrations.mapObjects[" + mapObject.getId() + "]",
                        "Mapped table " + mapObject.getTableId() + " does not exist"));
            }
        }
        for (MapFieldDefinition mapField : integrations.getMapFields()) {
            String path = "integrations.mapFields[" + mapField.getId() + "]";
            if (!mapObjects.contains(mapField.getMapObjectId())) {
                violations.add(Violation.of("mapField.mapObject.unresolved", path,
                        "Map object " + mapField.getMapObjectId() + " does not exist"));
            }
            if (index.findField(mapField.getFieldId()).isEmpty()) {
                violations.add(Violation.of("mapField.field.unresolved", path,
                        "Canonical field " + mapField.getFieldId() + " does not exist"));
            }
            if (mapField.getSourceFieldId() != null && !sourceFields.contains(mapField.getSourceFieldId())) {
                violations.add(Violation.of("mapField.sourceField.unresolved", path,
                        "Source field " + mapField.getSourceFieldId() + " does not exist"));
            }
        }
        for (LineageEdgeDefinition edge : integrations.getLineageEdges()) {
            String path = "integrations.lineageEdges[" + edge.getId() + "]";
            checkLineageEndpoint(index, sourceFields, edge.getFromType(), edge.getFromId(), path, violations);
            checkLineageEndpoint(index, sourceFields, edge.getToType(), edge.getToId(), path, violations);
        }
    }

    private void checkLineageEndpoint(SnapshotIndex index, Set<UUID> sourceFields, NodeKind kind, UUID id,
            String path, List<Violation> violations) {
        boolean resolved;
        if (kind == NodeKind.CANONICAL_FIELD) {
            resolved = index.findField(id).isPresent();
        } else if (kind == NodeKind.SOURCE_FIELD) {
            resolved = sourceFields.contains(id);
        } else {
            // physical fields and semantic measures are derived; checked after projection
            resolved = true;
        }
        if (!resolved) {
            violations.add(Violation.of("lineage.endpoint.unresolved", path, kind + " " + id + " does not exist"));
        }
    }

    private void checkJobs(SnapshotDocument snapshot, List<Violation> violations) {
        Set<String> jobCodes = new HashSet<>();
        for (JobDefinition job : snapshot.getJobs().getJobs()) {
            String path = "jobs.jobs[" + job.getCode() + "]";
            if (!jobCodes.add(job.getCode())) {
                violations.add(Violation.of("job.code.duplicate", path, "Job code '" + job.getCode() + "' is not unique"));
            }
            Set<String> stepCodes = job.getSteps().stream()
                    .map(JobStepDefinition::getCode)
                    .collect(Collectors.toSet());
            if (stepCodes.size() != job.getSteps().size()) {
                violations.add(Violation.of("job.step.duplicate", path, "Step codes must be unique within a job"));
            }
            job.getSteps().stream()
                    .sorted(Comparator.comparing(JobStepDefinition::getCode))
                    .forEach(step -> step.getDependsOn().stream()
                            .filter(dep -> !stepCodes.contains(dep))
                            .forEach(dep -> violations.add(Violation.of("job.step.dependency.unresolved",
                                    path + ".steps[" + step.getCode() + "]", "Depends on unknown step '" + dep + "'"))));
        }
    }

    private void checkMetrics(SnapshotIndex index, List<Violation> violations) {
        Set<String> metricCodes = new HashSet<>();
        for (MetricDefinition metric : index.getSnapshot().getMetrics().getMetrics()) {
            String path = "metrics.metrics[" + metric.getCode() + "]";
            if (!metricCodes.add(metric.getCode())) {
                violations.add(Violation.of("metric.code.duplicate", path,
                        "Metric code '" + metric.getCode() + "' is not unique"));
            }
            if (metric.getBaseTableId() != null && index.findTable(metric.getBaseTableId()).isEmpty()) {
                violations.add(Violation.of("metric.baseTable.unresolved", path,
                        "Base table " + metric.getBaseTableId() + " does not exist"));
            }
        }
    }

    private void checkSecurity(SnapshotIndex index, List<Violation> violations) {
        PolicyParser parser = new PolicyParser();
        Set<String> policyCodes = new HashSet<>();
        Map<UUID, SecurityPolicyDefinition> policies = new HashMap<>();
        Map<UUID, PolicyExpression> parsed = new HashMap<>();
        for (SecurityPolicyDefinition policy : index.getSnapshot().getSecurity().getPolicies()) {
            String path = "security.policies[" + policy.getCode() + "]";
            if (!policyCodes.add(policy.getCode())) {
                violations.add(Violation.of("policy.code.duplicate", path,
                        "Policy code '" + policy.getCode() + "' is not unique"));
            }
            policies.putIfAbsent(policy.getId(), policy);
            try {
                parsed.putIfAbsent(policy.getId(), parser.parse(policy.getCode(), policy.getExpression()));
            } catch (CompilationException e) {
                violations.add(Violation.of("policy.expression.invalid", path, e.getMessage()));
            }
        }

        for (TableSecurityDefinition security : index.getSnapshot().getSecurity().getTableSecurity()) {
            String path = "security.tableSecurity[" + security.getId() + "]";
            TableDefinition table = index.findTable(security.getTableId()).orElse(null);
            if (table == null) {
                violations.add(Violation.of("tableSecurity.table.unresolved", path,
                        "Table " + security.getTableId() + " does not exist"));
            }
            SecurityPolicyDefinition policy = policies.get(security.getPolicyId());
            if (policy == null) {
                violations.add(Violation.of("tableSecurity.policy.unresolved", path,
                        "Policy " + security.getPolicyId() + " does not exist"));
                continue;
            }
            if (policy.getType() != PolicyType.RLS) {
                violations.add(Violation.of("tableSecurity.policy.notRowLevel", path,
                        "Policy '" + policy.getCode() + "' is " + policy.getType() + ", tables take RLS policies"));
            }
            PolicyExpression expression = parsed.get(policy.getId());
            if (table == null || expression == null) {
                continue;
            }
            Set<String> columns = new HashSet<>();
            table.getFields().forEach(f -> columns.add(f.getName().toLowerCase(Locale.ROOT)));
            for (String field : referencedFields(expression)) {
                if (!columns.contains(field.toLowerCase(Locale.ROOT))) {
                    violations.add(Violation.of("tableSecurity.field.unresolved", path,
                            "Policy '" + policy.getCode() + "' references " + field + ", which " + table.getName()
                                    + " does not have"));
                }
            }
        }
    }

    private static Set<String> referencedFields(PolicyExpression node) {
        Set<String> fields = new LinkedHashSet<>();
        collectFields(node, fields);
        return fields;
    }

    private static void collectFields(PolicyExpression node, Set<String> fields) {
        if (node instanceof ColumnRef ref) {
            fields.add(ref.getField());
        } else if (node instanceof Operation op) {
            op.getArguments().forEach(arg -> collectFields(arg, fields));
        }
    }
}
