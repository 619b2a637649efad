package com.ozmeta.compiler.deploy;

import com.ozmeta.compiler.compile.CancellationToken;

/**
 * Compiles the artifacts of one slot.
 */
@FunctionalInterface
public interface SlotBuilder {

    SlotBuild build(String switchGroup, Slot slot, CancellationToken cancellation);
}
