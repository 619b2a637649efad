package com.ozmeta.compiler.deploy;

import java.io.IOException;

/**
 * Applies compiled artifacts to the physical targets of a slot. The compiler
 * ships no implementation; deployment tooling plugs in here.
 */
@FunctionalInterface
public interface ArtifactDeployer {

    void deploy(String switchGroup, SlotBuild build) throws IOException;
}
