package com.ozmeta.compiler.cli.model;

import java.nio.file.Path;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Derived values needed by the executor. Keeps GenerateCommand thin.
 */
@Data
@AllArgsConstructor
public class ValidatedGenerateOptions {
    Path snapshotPath;
    Path normalizedOutputDir;
    int parallelism;
}
