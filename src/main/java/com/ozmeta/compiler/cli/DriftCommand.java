package com.ozmeta.compiler.cli;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.ozmeta.compiler.cli.output.DriftReportPrinter;
import com.ozmeta.compiler.cli.output.GenerateResultsPrinter;
import com.ozmeta.compiler.compile.CancellationToken;
import com.ozmeta.compiler.compile.CompilationPipeline;
import com.ozmeta.compiler.compile.CompilationPipeline.ValidatedSnapshot;
import com.ozmeta.compiler.compile.CompilerConfig;
import com.ozmeta.compiler.compile.TargetBinder;
import com.ozmeta.compiler.compile.TargetCompilationResult;
import com.ozmeta.compiler.drift.DriftReport;
import com.ozmeta.compiler.drift.DriftValidator;
import com.ozmeta.compiler.drift.LiveTargetObservation;
import com.ozmeta.compiler.drift.ObservationFileReader;
import com.ozmeta.compiler.emit.EmitterRegistry;
import com.ozmeta.compiler.exception.SnapshotInvalidException;
import com.ozmeta.compiler.util.FileWriteUtil;
import com.ozmeta.compiler.util.JsonSupport;

import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Compiles one target platform and compares it with an observation of the
 * live target.
 */
@Command(
        name = "drift",
        mixinStandardHelpOptions = true,
        description = "Compares a target platform's compiled model with an observation of the live target."
)
public class DriftCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(DriftCommand.class);

    @Option(names = {"--snapshot", "-s"}, required = true, description = "Snapshot document")
    private Path snapshot;

    @Option(names = {"--observation"}, required = true, description = "Observation JSON of the live target")
    private Path observation;

    @Option(names = {"--target-platform"}, required = true, description = "Target platform UUID to check")
    private String targetPlatform;

    @Option(names = {"--report"}, description = "Write the drift report as JSON to this file")
    private Path report;

    @Option(names = {"--profiles"}, description = "Profile set used when the snapshot has no platforms area")
    private Path profiles;

    @Option(names = {"--row-count-tolerance"}, defaultValue = "0.0",
            description = "Allowed relative row count deviation from the reference, e.g. 0.05")
    private double rowCountTolerance;

    private final GenerateResultsPrinter resultsPrinter = new GenerateResultsPrinter();
    private final DriftReportPrinter reportPrinter = new DriftReportPrinter();

    @Override
    public Integer call() {
        UUID targetPlatformId;
        try {
            targetPlatformId = UUID.fromString(targetPlatform);
        } catch (IllegalArgumentException e) {
            log.error("Target platform id is not a UUID: {}", targetPlatform);
            return ExitCodes.INPUT_INVALID;
        }
        if (!Files.isRegularFile(snapshot)) {
            log.error("Snapshot file does not exist: {}", snapshot);
            return ExitCodes.INPUT_INVALID;
        }
        if (rowCountTolerance < 0) {
            log.error("Row count tolerance must be >= 0. Got: {}", rowCountTolerance);
            return ExitCodes.INPUT_INVALID;
        }

        try {
            CompilationPipeline pipeline = new CompilationPipeline(CompilerConfig.builder()
                    .snapshotPath(snapshot)
                    .profilesPath(profiles)
                    .parallelism(1)
                    .build(), EmitterRegistry.withDefaults());
            ValidatedSnapshot validated = pipeline.loadAndValidate();

            List<TargetCompilationResult> results = pipeline.compileTargets(validated,
                    b -> TargetBinder.sameTargetPlatform(b, targetPlatformId), CancellationToken.none());
            if (results.isEmpty()) {
                log.error("Target platform {} is not defined in the snapshot", targetPlatformId);
                return ExitCodes.INPUT_INVALID;
            }
            TargetCompilationResult compiled = results.get(0);
            if (!compiled.isSuccess()) {
                log.error("Target {} failed to compile [{}]: {}", compiled.key(), compiled.getErrorKind(),
                        compiled.getErrorMessage());
                return ExitCodes.INPUT_INVALID;
            }

            LiveTargetObservation observed = ObservationFileReader.read(observation);
            DriftReport driftReport = new DriftValidator(rowCountTolerance)
                    .validate(compiled.getProjection(), observed);
            reportPrinter.print(driftReport);
            if (report != null) {
                FileWriteUtil.safeWrite(report,
                        JsonSupport.toCanonicalJson(driftReport).getBytes(StandardCharsets.UTF_8));
                log.info("Drift report written to {}", report.toAbsolutePath());
            }
            return driftReport.hasDrift() ? ExitCodes.DRIFT_DETECTED : ExitCodes.OK;

        } catch (SnapshotInvalidException e) {
            log.error("Snapshot is invalid");
            resultsPrinter.printViolations(e.getViolations());
            return ExitCodes.INPUT_INVALID;
        } catch (IOException | IllegalArgumentException e) {
            log.error("Invalid drift input: {}", e.getMessage());
            return ExitCodes.INPUT_INVALID;
        } catch (Exception e) {
            log.error("Drift check failed with exception", e);
            return ExitCodes.UNEXPECTED;
        }
    }
}
