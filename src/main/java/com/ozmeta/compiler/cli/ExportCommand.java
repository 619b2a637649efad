package com.ozmeta.compiler.cli;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.UUID;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.ozmeta.compiler.cli.output.GenerateResultsPrinter;
import com.ozmeta.compiler.exception.ConnectionFailedException;
import com.ozmeta.compiler.exception.SnapshotInvalidException;
import com.ozmeta.compiler.exception.ValidationFailedException;
import com.ozmeta.compiler.export.SnapshotExportService;
import com.ozmeta.compiler.export.SnapshotExporterRegistry;
import com.ozmeta.compiler.model.canonical.SnapshotDocument;
import com.ozmeta.compiler.snapshot.SnapshotLoader;

import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(
        name = "export",
        mixinStandardHelpOptions = true,
        description = "Exports a snapshot document from a metadata source."
)
public class ExportCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ExportCommand.class);

    @Option(names = {"--provider"}, defaultValue = "stub", description = "Export provider: stub or extract")
    private String provider;

    @Option(names = {"--connection"}, defaultValue = "", description = "Provider connection; a directory for extract")
    private String connection;

    @Option(names = {"--project-id"}, required = true, description = "Project UUID")
    private String projectId;

    @Option(names = {"--out", "-o"}, required = true, description = "Snapshot file to write")
    private Path out;

    private final GenerateResultsPrinter printer = new GenerateResultsPrinter();

    @Override
    public Integer call() {
        UUID project;
        try {
            project = UUID.fromString(projectId);
        } catch (IllegalArgumentException e) {
            log.error("Project id is not a UUID: {}", projectId);
            return ExitCodes.INPUT_INVALID;
        }

        SnapshotExportService service = new SnapshotExportService(
                SnapshotExporterRegistry.withDefaults(Clock.systemUTC()), new SnapshotLoader());
        try {
            SnapshotDocument snapshot = service.export(provider, connection, project, out);
            log.info("Exported {} table(s) to {}", snapshot.getModel().getTables().size(), out.toAbsolutePath());
            return ExitCodes.OK;
        } catch (SnapshotInvalidException e) {
            log.error("Exported snapshot violates the snapshot contract");
            printer.printViolations(e.getViolations());
            return ExitCodes.INPUT_INVALID;
        } catch (ValidationFailedException e) {
            log.error(e.getMessage());
            return ExitCodes.INPUT_INVALID;
        } catch (ConnectionFailedException e) {
            log.error("Connection failed: {}", e.getMessage());
            return ExitCodes.CONNECTION_FAILED;
        } catch (IOException e) {
            log.error("Export failed: {}", e.getMessage(), e);
            return ExitCodes.UNEXPECTED;
        } catch (Exception e) {
            log.error("Export failed with exception", e);
            return ExitCodes.UNEXPECTED;
        }
    }
}
