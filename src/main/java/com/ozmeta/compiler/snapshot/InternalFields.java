package com.ozmeta.compiler.snapshot;

import java.util.List;

/**
 * Technical columns every canonical table carries.
 */
public final class InternalFields {

    public static final String TENANT_ID = "_TenantID";
    public static final String CREATE_DATE = "_CreateDate";
    public static final String SOURCE_SYSTEM = "_SourceSystem";
    public static final String SOURCE_KEY = "_SourceKey";
    public static final String SYNC_DATE = "_SyncDate";
    public static final String DELETE_DATE = "_DeleteDate";

    /** Required on every table regardless of tenancy. */
    public static final List<String> ALWAYS_REQUIRED =
            List.of(CREATE_DATE, SOURCE_SYSTEM, SOURCE_KEY, SYNC_DATE, DELETE_DATE);

    private InternalFields() {
        // Utility class
    }

    public static List<String> requiredFor(boolean requiresTenant) {
        if (!requiresTenant) {
            return ALWAYS_REQUIRED;
        }
        return List.of(TENANT_ID, CREATE_DATE, SOURCE_SYSTEM, SOURCE_KEY, SYNC_DATE, DELETE_DATE);
    }
}
