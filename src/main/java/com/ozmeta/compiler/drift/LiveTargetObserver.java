package com.ozmeta.compiler.drift;

import java.io.IOException;

import com.ozmeta.compiler.model.physical.TargetProjection;

/**
 * Reads the physical state of a deployed target. Implementations live
 * outside the compiler; callers bound every call with a timeout.
 */
@FunctionalInterface
public interface LiveTargetObserver {

    LiveTargetObservation observe(TargetProjection projection) throws IOException;
}
