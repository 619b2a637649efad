package com.ozmeta.compiler;

import com.ozmeta.compiler.cli.OzMetaCommand;

import picocli.CommandLine;

/**
 * Main entry point of the {@code ozmeta} command line.
 */
public class OzMetaApplication {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new OzMetaCommand())
                .setCaseInsensitiveEnumValuesAllowed(true)
                .execute(args);
        System.exit(exitCode);
    }
}
