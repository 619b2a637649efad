package com.ozmeta.compiler.model.output;

import java.util.UUID;

import com.ozmeta.compiler.job.JobFormat;

import lombok.Value;

/**
 * Where a job's compiled artifact for one target platform lives.
 */
@Value
public class JobTarget {
    UUID jobId;
    UUID targetPlatformId;
    JobFormat implType;
    String artifactPath;
}
