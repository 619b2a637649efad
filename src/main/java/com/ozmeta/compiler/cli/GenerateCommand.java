package com.ozmeta.compiler.cli;

import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.ozmeta.compiler.cli.exception.OptionsValidationException;
import com.ozmeta.compiler.cli.model.GenerateOptions;
import com.ozmeta.compiler.cli.model.ValidatedGenerateOptions;
import com.ozmeta.compiler.cli.output.GenerateResultsPrinter;
import com.ozmeta.compiler.cli.validation.GenerateOptionsValidator;
import com.ozmeta.compiler.compile.CancellationToken;
import com.ozmeta.compiler.compile.CompilationPipeline;
import com.ozmeta.compiler.compile.CompilationResult;
import com.ozmeta.compiler.compile.CompilerConfig;
import com.ozmeta.compiler.emit.EmitterRegistry;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

/**
 * CLI command compiling a snapshot into an output folder with a manifest.
 */
@Command(
        name = "generate",
        mixinStandardHelpOptions = true,
        description = "Generates DDL, job, semantic and drift artifacts for every target platform of a snapshot."
)
public class GenerateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(GenerateCommand.class);

    @Mixin
    private GenerateOptions options;

    private final GenerateOptionsValidator validator = new GenerateOptionsValidator();
    private final GenerateResultsPrinter printer = new GenerateResultsPrinter();

    @Override
    public Integer call() {
        ValidatedGenerateOptions validated;
        try {
            validated = validator.validate(options);
        } catch (OptionsValidationException e) {
            e.getErrors().forEach(error -> log.error(error));
            return ExitCodes.INPUT_INVALID;
        }

        try {
            printer.printBanner(options, validated);

            CompilerConfig config = CompilerConfig.builder()
                    .snapshotPath(validated.getSnapshotPath())
                    .schemaPath(options.getSchema())
                    .profilesPath(options.getProfiles())
                    .outputDir(validated.getNormalizedOutputDir())
                    .parallelism(validated.getParallelism())
                    .defaultPlatformCode(options.getDefaultPlatform())
                    .build();

            CancellationToken cancellation = new CancellationToken();
            CompilationResult result = new CompilationPipeline(config, EmitterRegistry.withDefaults())
                    .generate(cancellation);

            if (result.isSuccess()) {
                printer.printSuccess(result);
                return ExitCodes.OK;
            }
            if (result.getManifest() != null) {
                printer.printPartialFailure(result);
            } else {
                printer.printFailure(result);
            }
            return ExitCodes.forCompilation(result.getErrorKind());

        } catch (Exception e) {
            log.error("Generation failed with exception", e);
            return ExitCodes.UNEXPECTED;
        }
    }
}
