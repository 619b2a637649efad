package com.ozmeta.compiler.naming;

import java.util.Map;

import com.ozmeta.compiler.exception.UnmappedTypeException;
import com.ozmeta.compiler.model.canonical.PlatformDefinition;
import com.ozmeta.compiler.snapshot.SnapshotIndex;

/**
 * Resolves logical types through a platform's type-mapping profile. There is
 * no fallback type.
 */
public class TypeResolver {

    private final SnapshotIndex index;

    public TypeResolver(SnapshotIndex index) {
        this.index = index;
    }

    public String resolveType(String logicalType, PlatformDefinition platform) {
        Map<String, String> mapping = index.typeMapping(platform.getTypeMappingProfile());
        String physical = mapping.get(logicalType);
        if (physical == null || physical.isBlank()) {
            throw new UnmappedTypeException(logicalType, platform.getCode());
        }
        return physical;
    }
}
