package com.ozmeta.compiler.model.canonical;

public enum PlatformCategory {
    OLTP(true),
    WAREHOUSE(true),
    LAKEHOUSE(false),
    SEMANTIC(false),
    ORCHESTRATOR(false);

    private final boolean declarativeForeignKeys;

    PlatformCategory(boolean declarativeForeignKeys) {
        this.declarativeForeignKeys = declarativeForeignKeys;
    }

    public boolean supportsDeclarativeForeignKeys() {
        return declarativeForeignKeys;
    }
}
