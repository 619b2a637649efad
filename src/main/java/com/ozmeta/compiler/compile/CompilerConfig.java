package com.ozmeta.compiler.compile;

import java.nio.file.Path;

import lombok.Builder;
import lombok.Data;

/**
 * Configuration for one compilation run.
 */
@Data
@Builder
public class CompilerConfig {
    private Path snapshotPath;
    private Path schemaPath;
    private Path profilesPath;
    private Path outputDir;

    @Builder.Default
    private int parallelism = Runtime.getRuntime().availableProcessors();

    /** Platform used for the implicit target when a snapshot defines none. */
    @Builder.Default
    private String defaultPlatformCode = "Postgres";
}
