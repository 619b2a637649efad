package com.ozmeta.compiler.deploy;

import java.nio.file.Path;
import java.util.List;

import com.ozmeta.compiler.model.output.Manifest;
import com.ozmeta.compiler.model.physical.TargetProjection;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Artifacts compiled for the inactive slot of a switch group.
 */
@Value
@Builder
public class SlotBuild {
    Slot slot;
    Path outputDir;
    Manifest manifest;
    @Singular
    List<TargetProjection> projections;
    @Singular
    List<String> errors;
    @Singular
    List<String> warnings;

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
