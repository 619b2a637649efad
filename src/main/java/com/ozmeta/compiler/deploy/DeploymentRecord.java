package com.ozmeta.compiler.deploy;

import java.time.Instant;
import java.util.UUID;

import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * One deployment attempt on a switch group. Records are immutable and only
 * ever appended to the history.
 */
@Value
@Builder
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DeploymentRecord {
    UUID id;
    String switchGroup;
    String actor;
    String snapshotVersion;
    String manifestHash;
    Slot previousActive;
    Slot candidate;
    Slot activeAfter;
    DeploymentStatus status;
    SlotState failedIn;
    String failureReason;
    Instant startedAtUTC;
    Instant finishedAtUTC;
}
