package com.ozmeta.compiler.naming;

import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.ozmeta.compiler.exception.NamingCollisionException;
import com.ozmeta.compiler.model.canonical.ConstraintProfile;

/**
 * Physical names handed out for one target platform. Names are unique within
 * a scope (tables, constraints, or the columns of one table). A canonical
 * object asking again receives the name it already owns.
 */
public class PhysicalNameRegistry {

    private static final Logger log = LoggerFactory.getLogger(PhysicalNameRegistry.class);

    public static final String TABLE_SCOPE = "tables";
    public static final String SCHEMA_SCOPE = "schemas";
    public static final String CONSTRAINT_SCOPE = "constraints";
    public static final String JOB_SCOPE = "jobs";
    public static final String METRIC_SCOPE = "metrics";
    public static final String POLICY_SCOPE = "policies";

    private final ConstraintProfile profile;
    private final Map<String, Map<String, UUID>> owners = new HashMap<>();
    private final Map<String, Map<UUID, String>> assigned = new HashMap<>();

    public PhysicalNameRegistry(ConstraintProfile profile) {
        this.profile = profile;
    }

    public static String columnScope(String physicalTableName) {
        return "columns:" + physicalTableName;
    }

    /**
     * Normalizes {@code canonicalName} and reserves the result for
     * {@code canonicalId}. A name taken by another id is re-suffixed once.
     *
     * @throws NamingCollisionException when the suffixed name is taken too
     */
    public synchronized String claim(String scope, UUID canonicalId, String canonicalName) {
        Map<UUID, String> byId = assigned.computeIfAbsent(scope, k -> new HashMap<>());
        String existing = byId.get(canonicalId);
        if (existing != null) {
            return existing;
        }

        Map<String, UUID> byName = owners.computeIfAbsent(scope, k -> new HashMap<>());
        String candidate = IdentifierNormalizer.normalizeIdentifier(canonicalName, profile);
        UUID owner = byName.get(candidate);
        if (owner != null) {
            String suffixed = IdentifierNormalizer.withHashSuffix(candidate, canonicalName, profile);
            log.debug("Name '{}' in scope '{}' already owned by {}, trying '{}'", candidate, scope, owner, suffixed);
            UUID suffixedOwner = byName.get(suffixed);
            if (suffixedOwner != null) {
                throw new NamingCollisionException(scope, suffixed, suffixedOwner.toString(),
                        canonicalName + " (" + canonicalId + ")");
            }
            candidate = suffixed;
        }

        byName.put(candidate, canonicalId);
        byId.put(canonicalId, candidate);
        return candidate;
    }

    public synchronized boolean isTaken(String scope, String physicalName) {
        return owners.getOrDefault(scope, Map.of()).containsKey(physicalName);
    }

    public ConstraintProfile getProfile() {
        return profile;
    }
}
