package com.ozmeta.compiler.deploy;

import java.time.Duration;

import com.ozmeta.compiler.compile.CancellationToken;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class DeploymentRequest {
    String switchGroup;
    String actor;
    String snapshotVersion;

    /** Bound on each external call (deploy, validate). */
    @Builder.Default
    Duration callTimeout = Duration.ofMinutes(5);

    @Builder.Default
    CancellationToken cancellation = CancellationToken.none();
}
