package com.ozmeta.compiler.cli.output;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.ozmeta.compiler.cli.model.GenerateOptions;
import com.ozmeta.compiler.cli.model.ValidatedGenerateOptions;
import com.ozmeta.compiler.compile.CompilationResult;
import com.ozmeta.compiler.compile.TargetCompilationResult;
import com.ozmeta.compiler.snapshot.Violation;

/**
 * Responsible only for printing CLI output for the "generate" and "validate"
 * commands. No validation, no execution.
 */
public class GenerateResultsPrinter {

    private static final Logger log = LoggerFactory.getLogger(GenerateResultsPrinter.class);

    public void printBanner(GenerateOptions o, ValidatedGenerateOptions v) {
        log.info("=================================================");
        log.info("OZMeta Compiler");
        log.info("=================================================");
        log.info("Snapshot: {}", v.getSnapshotPath());
        log.info("Profiles: {}", o.getProfiles() != null ? o.getProfiles().toAbsolutePath() : "snapshot / bundled");
        log.info("Schema: {}", o.getSchema() != null ? o.getSchema().toAbsolutePath() : "bundled");
        log.info("Parallelism: {}", v.getParallelism());
        log.info("Output Directory: {}", v.getNormalizedOutputDir());
        log.info("=================================================");
    }

    public void printSuccess(CompilationResult result) {
        log.info("");
        log.info("=================================================");
        log.info("GENERATION SUCCESSFUL");
        log.info("=================================================");
        printSummary(result);
        log.info("=================================================");
    }

    /**
     * Some targets failed; the successful ones were written.
     */
    public void printPartialFailure(CompilationResult result) {
        log.error("");
        log.error("=================================================");
        log.error("GENERATION FINISHED WITH {} FAILED TARGET(S)", result.failedTargets());
        log.error("=================================================");
        for (TargetCompilationResult target : result.getTargets()) {
            if (!target.isSuccess()) {
                log.error("  {} [{}]: {}", target.key(), target.getErrorKind(), target.getErrorMessage());
            }
        }
        printSummary(result);
        log.error("=================================================");
    }

    public void printFailure(CompilationResult result) {
        log.error("Generation failed [{}]: {}", result.getErrorKind(), result.getErrorMessage());
        printViolations(result.getViolations());
    }

    public void printViolations(List<Violation> violations) {
        if (violations.isEmpty()) {
            return;
        }
        log.error("{} violation(s):", violations.size());
        for (Violation violation : violations) {
            log.error("  {}", violation);
        }
    }

    private void printSummary(CompilationResult result) {
        log.info("Output Path: {}", result.getOutputPath());
        log.info("Targets Compiled: {}", result.getTargets().size() - result.failedTargets());
        log.info("Objects Projected: {}", result.getObjectsProjected());
        log.info("Files Written: {}", result.getFilesWritten());
        if (!result.getWarnings().isEmpty()) {
            log.info("");
            log.info("Warnings:");
            result.getWarnings().forEach(w -> log.warn("  {}", w));
        }
    }
}
