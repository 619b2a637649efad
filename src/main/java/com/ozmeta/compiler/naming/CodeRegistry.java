package com.ozmeta.compiler.naming;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import com.ozmeta.compiler.model.canonical.CodeRegistryEntry;
import com.ozmeta.compiler.model.canonical.SnapshotDocument;
import com.ozmeta.compiler.model.canonical.TableDefinition;

/**
 * Two-letter table codes known to one compilation run: every code issued by
 * the snapshot's registry, retired ones included, plus the live tables' codes.
 */
public class CodeRegistry {

    private final Map<String, UUID> ownerByCode = new HashMap<>();
    private final Map<UUID, String> codeByTable = new HashMap<>();

    public static CodeRegistry fromSnapshot(SnapshotDocument snapshot) {
        CodeRegistry registry = new CodeRegistry();
        for (CodeRegistryEntry entry : snapshot.getModel().getCodeRegistry()) {
            registry.register(entry.getCode(), entry.getTableId());
        }
        for (TableDefinition table : snapshot.getModel().getTables()) {
            registry.register(table.getCode(), table.getId());
        }
        return registry;
    }

    /**
     * Binds a code to a table. Registering the same pair twice is a no-op.
     *
     * @throws IllegalStateException when the code belongs to another table
     */
    public synchronized void register(String code, UUID tableId) {
        UUID owner = ownerByCode.putIfAbsent(code, tableId);
        if (owner != null && !owner.equals(tableId)) {
            throw new IllegalStateException("Code '" + code + "' is already issued to table " + owner);
        }
        codeByTable.putIfAbsent(tableId, code);
    }

    public synchronized boolean isIssued(String code) {
        return ownerByCode.containsKey(code);
    }

    public synchronized Optional<String> codeFor(UUID tableId) {
        return Optional.ofNullable(codeByTable.get(tableId));
    }
}
