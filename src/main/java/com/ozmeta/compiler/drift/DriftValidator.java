package com.ozmeta.compiler.drift;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.ozmeta.compiler.model.canonical.ConstraintProfile;
import com.ozmeta.compiler.model.physical.FkEnforcement;
import com.ozmeta.compiler.model.physical.PhysicalField;
import com.ozmeta.compiler.model.physical.PhysicalObject;
import com.ozmeta.compiler.model.physical.ProjectedRelation;
import com.ozmeta.compiler.model.physical.TargetProjection;
import com.ozmeta.compiler.naming.IdentifierNormalizer;

/**
 * Compares a compiled projection with what a live target reports. Read-only:
 * it never talks to the target itself.
 */
public class DriftValidator {

    private static final Logger log = LoggerFactory.getLogger(DriftValidator.class);

    private final double rowCountTolerance;

    public DriftValidator() {
        this(0.0);
    }

    /**
     * @param rowCountTolerance allowed relative deviation from the reference
     *                          row count, e.g. {@code 0.05} for five percent
     */
    public DriftValidator(double rowCountTolerance) {
        if (rowCountTolerance < 0) {
            throw new IllegalArgumentException("rowCountTolerance must not be negative");
        }
        this.rowCountTolerance = rowCountTolerance;
    }

    public DriftReport validate(TargetProjection projection, LiveTargetObservation observation) {
        ConstraintProfile profile = projection.getBinding().getConstraintProfile();
        List<DriftFinding> findings = new ArrayList<>();
        Set<String> expectedObjects = new HashSet<>();

        for (PhysicalObject expected : projection.getObjects()) {
            expectedObjects.add(expected.qualifiedName());
            Optional<ObservedObject> observed =
                    observation.findObject(expected.getPhysicalSchema(), expected.getPhysicalName());
            if (observed.isEmpty()) {
                findings.add(finding(DriftFindingKind.MISSING_OBJECT, expected.qualifiedName(), null,
                        null, null, "Object " + expected.qualifiedName() + " does not exist"));
                continue;
            }
            compareFields(expected, observed.get(), findings);
            comparePartitioning(expected, observed.get(), findings);
            compareFingerprint(observed.get(), observation.getReferences(), findings);
        }

        for (ObservedObject observed : observation.getObjects()) {
            if (!expectedObjects.contains(observed.qualifiedName())) {
                findings.add(finding(DriftFindingKind.UNEXPECTED_OBJECT, observed.qualifiedName(), null,
                        null, null, "Object " + observed.qualifiedName() + " is not part of the compiled model"));
            }
            checkNaming(observed, profile, findings);
        }

        compareForeignKeys(projection.getRelations(), observation, findings);
        checkLogicalForeignKeys(projection.getRelations(), observation.getOrphanCounts(), findings);

        findings.sort(DriftFinding.ORDER);
        DriftReport report = DriftReport.builder()
                .targetPlatformId(projection.getTargetPlatformId())
                .targetKey(projection.getBinding().key())
                .objectsChecked(projection.getObjects().size())
                .findings(List.copyOf(findings))
                .build();
        log.debug("Drift check for {}: {} finding(s)", report.getTargetKey(), findings.size());
        return report;
    }

    private void compareFields(PhysicalObject expected, ObservedObject observed, List<DriftFinding> findings) {
        String object = expected.qualifiedName();
        Set<String> expectedColumns = new HashSet<>();
        for (PhysicalField field : expected.getFields()) {
            expectedColumns.add(field.getPhysicalName());
            Optional<ObservedColumn> column = observed.findColumn(field.getPhysicalName());
            if (column.isEmpty()) {
                DriftFindingKind kind = field.isInternal()
                        ? DriftFindingKind.MISSING_MANDATORY_FIELD
                        : DriftFindingKind.MISSING_FIELD;
                findings.add(finding(kind, object, field.getPhysicalName(), field.getPhysicalType(), null,
                        "Column " + object + "." + field.getPhysicalName() + " is missing"));
                continue;
            }
            String actualType = column.get().getType();
            if (actualType != null && !sameType(field.getPhysicalType(), actualType)) {
                findings.add(finding(DriftFindingKind.TYPE_MISMATCH, object, field.getPhysicalName(),
                        field.getPhysicalType(), actualType,
                        "Column " + object + "." + field.getPhysicalName() + " is " + actualType
                                + ", expected " + field.getPhysicalType()));
            }
        }
        for (ObservedColumn column : observed.getColumns()) {
            if (!expectedColumns.contains(column.getName())) {
                findings.add(finding(DriftFindingKind.UNEXPECTED_FIELD, object, column.getName(), null,
                        column.getType(), "Column " + object + "." + column.getName() + " is not compiled"));
            }
        }
    }

    private void comparePartitioning(PhysicalObject expected, ObservedObject observed, List<DriftFinding> findings) {
        if (observed.getPartitionColumns() == null) {
            return;
        }
        if (!expected.getPartitionColumns().equals(observed.getPartitionColumns())) {
            findings.add(finding(DriftFindingKind.PARTITIONING_MISMATCH, expected.qualifiedName(), null,
                    String.join(",", expected.getPartitionColumns()),
                    String.join(",", observed.getPartitionColumns()),
                    "Partitioning of " + expected.qualifiedName() + " is " + observed.getPartitionColumns()
                            + ", expected " + expected.getPartitionColumns()));
        }
    }

    private void compareFingerprint(ObservedObject observed, Map<String, ObjectFingerprint> reference,
            List<DriftFinding> findings) {
        ObjectFingerprint fingerprint = reference.get(observed.qualifiedName());
        if (fingerprint == null) {
            return;
        }
        if (fingerprint.getRowCount() != null && observed.getRowCount() != null) {
            long expectedRows = fingerprint.getRowCount();
            long deviation = Math.abs(observed.getRowCount() - expectedRows);
            if (deviation > Math.floor(expectedRows * rowCountTolerance)) {
                findings.add(finding(DriftFindingKind.ROW_COUNT_ANOMALY, observed.qualifiedName(), null,
                        Long.toString(expectedRows), Long.toString(observed.getRowCount()),
                        "Row count of " + observed.qualifiedName() + " is " + observed.getRowCount()
                                + ", reference " + expectedRows));
            }
        }
        if (fingerprint.getChecksum() != null && observed.getChecksum() != null
                && !fingerprint.getChecksum().equalsIgnoreCase(observed.getChecksum())) {
            findings.add(finding(DriftFindingKind.CHECKSUM_ANOMALY, observed.qualifiedName(), null,
                    fingerprint.getChecksum(), observed.getChecksum(),
                    "Checksum of " + observed.qualifiedName() + " differs from the reference"));
        }
    }

    private void checkNaming(ObservedObject observed, ConstraintProfile profile, List<DriftFinding> findings) {
        if (!IdentifierNormalizer.conforms(observed.getName(), profile)) {
            findings.add(finding(DriftFindingKind.NAMING_VIOLATION, observed.qualifiedName(), null,
                    null, observed.getName(),
                    "Object name '" + observed.getName() + "' violates profile " + profile.getCode()));
        }
        for (ObservedColumn column : observed.getColumns()) {
            if (!IdentifierNormalizer.conforms(column.getName(), profile)) {
                findings.add(finding(DriftFindingKind.NAMING_VIOLATION, observed.qualifiedName(), column.getName(),
                        null, column.getName(),
                        "Column name '" + column.getName() + "' violates profile " + profile.getCode()));
            }
        }
    }

    /**
     * Declarative relations must exist as constraints on the referencing object,
     * and no other constraint may be declared there. Objects whose observation
     * carries no foreign key list are skipped.
     */
    private void compareForeignKeys(List<ProjectedRelation> relations, LiveTargetObservation observation,
            List<DriftFinding> findings) {
        Map<String, List<ProjectedRelation>> declaredByObject = new HashMap<>();
        for (ProjectedRelation relation : relations) {
            if (relation.getEnforcement() == FkEnforcement.DECLARATIVE) {
                declaredByObject.computeIfAbsent(relation.getFromObject().qualifiedName(), k -> new ArrayList<>())
                        .add(relation);
            }
        }

        for (ObservedObject observed : observation.getObjects()) {
            List<ObservedForeignKey> actual = observed.getForeignKeys();
            if (actual == null) {
                continue;
            }
            String object = observed.qualifiedName();
            List<ProjectedRelation> declared = declaredByObject.getOrDefault(object, List.of());
            Set<String> declaredNames = new HashSet<>();
            for (ProjectedRelation relation : declared) {
                declaredNames.add(relation.getConstraintName());
                String expected = relation.getFromColumn() + " -> " + referenceOf(relation);
                Optional<ObservedForeignKey> match = actual.stream()
                        .filter(fk -> relation.getConstraintName().equals(fk.getName()))
                        .findFirst();
                if (match.isEmpty()) {
                    findings.add(finding(DriftFindingKind.MISSING_FOREIGN_KEY, object, relation.getFromColumn(),
                            relation.getConstraintName(), null,
                            "Foreign key " + relation.getConstraintName() + " on " + object + " is missing"));
                    continue;
                }
                String found = match.get().getColumn() + " -> " + match.get().getReferences();
                if (!relation.getFromColumn().equals(match.get().getColumn())
                        || !referenceOf(relation).equals(match.get().getReferences())) {
                    findings.add(finding(DriftFindingKind.FOREIGN_KEY_MISMATCH, object, relation.getFromColumn(),
                            expected, found,
                            "Foreign key " + relation.getConstraintName() + " on " + object + " is " + found
                                    + ", expected " + expected));
                }
            }
            for (ObservedForeignKey fk : actual) {
                if (!declaredNames.contains(fk.getName())) {
                    findings.add(finding(DriftFindingKind.UNEXPECTED_FOREIGN_KEY, object, fk.getColumn(),
                            null, fk.getName(),
                            "Foreign key " + fk.getName() + " on " + object + " is not part of the compiled model"));
                }
            }
        }
    }

    private static String referenceOf(ProjectedRelation relation) {
        return relation.getToObject().qualifiedName() + "." + relation.getToColumn();
    }

    private void checkLogicalForeignKeys(List<ProjectedRelation> relations, Map<String, Long> orphanCounts,
            List<DriftFinding> findings) {
        for (ProjectedRelation relation : relations) {
            if (relation.getEnforcement() != FkEnforcement.LOGICAL_ONLY) {
                continue;
            }
            Long orphans = orphanCounts.get(relation.getConstraintName());
            if (orphans != null && orphans > 0) {
                String object = relation.getFromObject().qualifiedName();
                findings.add(finding(DriftFindingKind.LOGICAL_FK_ORPHANS, object, relation.getFromColumn(),
                        "0", Long.toString(orphans),
                        orphans + " row(s) of " + object + " violate " + relation.getConstraintName()
                                + " -> " + relation.getToObject().qualifiedName()));
            }
        }
    }

    static boolean sameType(String expected, String actual) {
        return canonicalType(expected).equals(canonicalType(actual));
    }

    private static String canonicalType(String type) {
        return type.replaceAll("\\s+", "").toUpperCase(Locale.ROOT);
    }

    private static DriftFinding finding(DriftFindingKind kind, String object, String column, String expected,
            String actual, String message) {
        return DriftFinding.builder()
                .kind(kind)
                .object(object)
                .column(column)
                .expected(expected)
                .actual(actual)
                .message(message)
                .build();
    }
}
