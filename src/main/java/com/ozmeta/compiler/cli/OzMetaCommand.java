package com.ozmeta.compiler.cli;

import java.util.concurrent.Callable;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level {@code ozmeta} command; the work happens in its subcommands.
 */
@Command(
        name = "ozmeta",
        mixinStandardHelpOptions = true,
        version = "ozmeta-compiler 1.0.0",
        description = "Compiles a canonical MetaDB snapshot into deterministic platform artifacts.",
        subcommands = {
                ValidateCommand.class,
                GenerateCommand.class,
                ExportCommand.class,
                DriftCommand.class
        }
)
public class OzMetaCommand implements Callable<Integer> {

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        spec.commandLine().usage(spec.commandLine().getErr());
        return CommandLine.ExitCode.USAGE;
    }
}
