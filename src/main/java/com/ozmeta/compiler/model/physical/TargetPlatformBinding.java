package com.ozmeta.compiler.model.physical;

import com.ozmeta.compiler.model.canonical.ConstraintProfile;
import com.ozmeta.compiler.model.canonical.PlatformDefinition;
import com.ozmeta.compiler.model.canonical.TargetDefinition;
import com.ozmeta.compiler.model.canonical.TargetPlatformDefinition;

import lombok.Builder;
import lombok.Value;

/**
 * A target platform with everything resolved that projection needs.
 */
@Value
@Builder
public class TargetPlatformBinding {
    TargetDefinition target;
    TargetPlatformDefinition targetPlatform;
    PlatformDefinition platform;
    ConstraintProfile constraintProfile;

    /**
     * Stable folder-safe key, e.g. {@code SFO-ProdA-Fabric-BI-USW.Postgres}.
     */
    public String key() {
        return target.getCanonicalName() + "." + platform.getCode();
    }
}
