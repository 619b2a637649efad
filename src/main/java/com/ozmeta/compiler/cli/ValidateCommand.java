package com.ozmeta.compiler.cli;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.ozmeta.compiler.cli.output.GenerateResultsPrinter;
import com.ozmeta.compiler.compile.CompilationPipeline;
import com.ozmeta.compiler.compile.CompilationPipeline.ValidatedSnapshot;
import com.ozmeta.compiler.compile.CompilerConfig;
import com.ozmeta.compiler.emit.EmitterRegistry;
import com.ozmeta.compiler.exception.SnapshotInvalidException;

import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Validates a snapshot without generating anything.
 */
@Command(
        name = "validate",
        mixinStandardHelpOptions = true,
        description = "Validates a snapshot: JSON schema, references, codes, internal fields and targets."
)
public class ValidateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ValidateCommand.class);

    @Option(names = {"--snapshot", "-s"}, required = true, description = "Snapshot document to validate")
    private Path snapshot;

    @Option(names = {"--schema"}, description = "JSON schema to validate against instead of the bundled one")
    private Path schema;

    @Option(names = {"--profiles"}, description = "Profile set used when the snapshot has no platforms area")
    private Path profiles;

    private final GenerateResultsPrinter printer = new GenerateResultsPrinter();

    @Override
    public Integer call() {
        if (!Files.isRegularFile(snapshot)) {
            log.error("Snapshot file does not exist: {}", snapshot);
            return ExitCodes.FILE_ERROR;
        }
        if (schema != null && !Files.isRegularFile(schema)) {
            log.error("Schema file does not exist: {}", schema);
            return ExitCodes.FILE_ERROR;
        }
        if (profiles != null && !Files.isRegularFile(profiles)) {
            log.error("Profile set does not exist: {}", profiles);
            return ExitCodes.FILE_ERROR;
        }

        CompilerConfig config = CompilerConfig.builder()
                .snapshotPath(snapshot)
                .schemaPath(schema)
                .profilesPath(profiles)
                .build();
        try {
            ValidatedSnapshot validated = new CompilationPipeline(config, EmitterRegistry.withDefaults())
                    .loadAndValidate();
            log.info("Snapshot is valid: version {}, {} table(s), {} target(s)",
                    validated.getSnapshot().getMeta().getVersion(),
                    validated.getSnapshot().getModel().getTables().size(),
                    validated.getSnapshot().getTargets().getTargets().size());
            return ExitCodes.OK;
        } catch (SnapshotInvalidException e) {
            log.error("Snapshot is invalid");
            printer.printViolations(e.getViolations());
            return ExitCodes.INPUT_INVALID;
        } catch (IOException e) {
            log.error("Failed to read input: {}", e.getMessage());
            return ExitCodes.FILE_ERROR;
        } catch (Exception e) {
            log.error("Validation failed with exception", e);
            return ExitCodes.UNEXPECTED;
        }
    }
}
