package com.ozmeta.compiler.deploy;

import lombok.Value;

@Value
public class DeploymentOutcome {
    DeploymentRecord record;
    Slot activeSlot;

    public boolean isPromoted() {
        return record.getStatus() == DeploymentStatus.PROMOTED;
    }
}
