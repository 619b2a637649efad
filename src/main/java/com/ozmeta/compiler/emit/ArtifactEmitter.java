package com.ozmeta.compiler.emit;

import java.util.Set;

import com.ozmeta.compiler.model.output.EmitResult;
import com.ozmeta.compiler.model.physical.TargetProjection;

/**
 * Turns a target projection into platform artifacts. Implementations must be
 * deterministic and free of side effects.
 */
public interface ArtifactEmitter {

    /**
     * Platform codes this emitter serves, lower case.
     */
    Set<String> platformCodes();

    EmitResult emit(TargetProjection projection);
}
