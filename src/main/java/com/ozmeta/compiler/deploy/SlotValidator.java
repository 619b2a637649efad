package com.ozmeta.compiler.deploy;

import java.io.IOException;
import java.util.List;

/**
 * Smoke, drift and quality checks against a freshly deployed slot.
 */
@FunctionalInterface
public interface SlotValidator {

    /**
     * @return failure reasons, empty when the slot may be promoted
     */
    List<String> validate(String switchGroup, SlotBuild build) throws IOException;
}
