package com.ozmeta.compiler.cli.model;

import java.nio.file.Path;

import lombok.Getter;
import picocli.CommandLine.Option;

/**
 * Holds all CLI options for the "generate" command. No validation, no execution
 * logic, no printing.
 */
@Getter
public class GenerateOptions {

	@Option(names = { "--snapshot", "-s" }, required = true, description = "Snapshot document to compile")
	private Path snapshot;

	@Option(names = { "--out", "-o" }, required = true, description = "Output folder")
	private Path out;

	@Option(names = {
			"--profiles" }, description = "Platform/constraint/type-mapping profile set, used when the snapshot has no platforms area")
	private Path profiles;

	@Option(names = { "--schema" }, description = "JSON schema to validate against instead of the bundled one")
	private Path schema;

	@Option(names = {
			"--parallelism" }, defaultValue = "0", description = "Targets compiled concurrently (default: available processors)")
	private int parallelism;

	@Option(names = {
			"--default-platform" }, defaultValue = "Postgres", description = "Platform of the implicit target when the snapshot defines none")
	private String defaultPlatform;

}
