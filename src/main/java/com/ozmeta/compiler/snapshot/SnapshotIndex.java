package com.ozmeta.compiler.snapshot;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import com.ozmeta.compiler.model.canonical.ConstraintProfile;
import com.ozmeta.compiler.model.canonical.FieldDefinition;
import com.ozmeta.compiler.model.canonical.PlatformArea;
import com.ozmeta.compiler.model.canonical.PlatformDefinition;
import com.ozmeta.compiler.model.canonical.SnapshotDocument;
import com.ozmeta.compiler.model.canonical.TableDefinition;
import com.ozmeta.compiler.model.canonical.TargetDefinition;
import com.ozmeta.compiler.model.canonical.TypeMapEntry;

import lombok.Value;

/**
 * Lookup tables over a snapshot. The first definition wins when ids repeat;
 * duplicates are reported by {@link SnapshotValidator}.
 */
public class SnapshotIndex {

    /**
     * A field together with the table that owns it.
     */
    @Value
    public static class FieldLocation {
        TableDefinition table;
        FieldDefinition field;
    }

    private final SnapshotDocument snapshot;
    private final PlatformArea platformArea;
    private final Map<UUID, TableDefinition> tablesById = new LinkedHashMap<>();
    private final Map<String, TableDefinition> tablesByCode = new HashMap<>();
    private final Map<String, TableDefinition> tablesByName = new HashMap<>();
    private final Map<UUID, FieldLocation> fieldsById = new HashMap<>();
    private final Map<UUID, PlatformDefinition> platformsById = new LinkedHashMap<>();
    private final Map<String, ConstraintProfile> constraintProfiles = new HashMap<>();
    private final Map<String, Map<String, String>> typeMappings = new HashMap<>();
    private final Map<UUID, TargetDefinition> targetsById = new LinkedHashMap<>();

    public SnapshotIndex(SnapshotDocument snapshot) {
        this(snapshot, snapshot.getPlatforms());
    }

    /**
     * @param platformArea profiles to resolve platforms against, either the
     *                     snapshot's own or a default profile set
     */
    public SnapshotIndex(SnapshotDocument snapshot, PlatformArea platformArea) {
        this.snapshot = snapshot;
        this.platformArea = platformArea;

        for (TableDefinition table : snapshot.getModel().getTables()) {
            tablesById.putIfAbsent(table.getId(), table);
            if (table.getCode() != null) {
                tablesByCode.putIfAbsent(table.getCode().toUpperCase(Locale.ROOT), table);
            }
            if (table.getName() != null) {
                tablesByName.putIfAbsent(table.getName().toLowerCase(Locale.ROOT), table);
            }
            for (FieldDefinition field : table.getFields()) {
                fieldsById.putIfAbsent(field.getId(), new FieldLocation(table, field));
            }
        }
        for (PlatformDefinition platform : platformArea.getPlatforms()) {
            platformsById.putIfAbsent(platform.getId(), platform);
        }
        for (ConstraintProfile profile : platformArea.getConstraintProfiles()) {
            constraintProfiles.putIfAbsent(profile.getCode(), profile);
        }
        for (TypeMapEntry entry : platformArea.getTypeMaps()) {
            typeMappings.computeIfAbsent(entry.getProfile(), k -> new HashMap<>())
                    .putIfAbsent(entry.getLogicalType(), entry.getPhysicalType());
        }
        for (TargetDefinition target : snapshot.getTargets().getTargets()) {
            targetsById.putIfAbsent(target.getId(), target);
        }
    }

    public SnapshotDocument getSnapshot() {
        return snapshot;
    }

    public PlatformArea getPlatformArea() {
        return platformArea;
    }

    public Optional<TableDefinition> findTable(UUID id) {
        return Optional.ofNullable(tablesById.get(id));
    }

    public Optional<TableDefinition> findTableByCode(String code) {
        return code == null ? Optional.empty() : Optional.ofNullable(tablesByCode.get(code.toUpperCase(Locale.ROOT)));
    }

    /**
     * Resolves a table by name first, then by two-letter code.
     */
    public Optional<TableDefinition> findTableByNameOrCode(String token) {
        if (token == null) {
            return Optional.empty();
        }
        TableDefinition byName = tablesByName.get(token.toLowerCase(Locale.ROOT));
        return byName != null ? Optional.of(byName) : findTableByCode(token);
    }

    public Optional<FieldLocation> findField(UUID id) {
        return Optional.ofNullable(fieldsById.get(id));
    }

    public Optional<PlatformDefinition> findPlatform(UUID id) {
        return Optional.ofNullable(platformsById.get(id));
    }

    public Optional<PlatformDefinition> findPlatformByCode(String code) {
        return platformsById.values().stream()
                .filter(p -> p.getCode().equalsIgnoreCase(code))
                .findFirst();
    }

    public Optional<ConstraintProfile> findConstraintProfile(String code) {
        return Optional.ofNullable(constraintProfiles.get(code));
    }

    /**
     * Logical type to physical type rows of one type-mapping profile; empty when
     * the profile is unknown.
     */
    public Map<String, String> typeMapping(String profileCode) {
        return Collections.unmodifiableMap(typeMappings.getOrDefault(profileCode, Map.of()));
    }

    public boolean hasTypeMappingProfile(String profileCode) {
        return typeMappings.containsKey(profileCode);
    }

    public Optional<TargetDefinition> findTarget(UUID id) {
        return Optional.ofNullable(targetsById.get(id));
    }
}
