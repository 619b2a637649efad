package com.ozmeta.compiler.cli.validation;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.ozmeta.compiler.cli.exception.OptionsValidationException;
import com.ozmeta.compiler.cli.model.GenerateOptions;
import com.ozmeta.compiler.cli.model.ValidatedGenerateOptions;

public class GenerateOptionsValidator {

	public ValidatedGenerateOptions validate(GenerateOptions o) {
		List<String> errors = new ArrayList<>();

		if (o.getSnapshot() == null || !Files.isRegularFile(o.getSnapshot())) {
			errors.add("Snapshot file does not exist: " + o.getSnapshot());
		}
		if (o.getProfiles() != null && !Files.isRegularFile(o.getProfiles())) {
			errors.add("Profile set does not exist: " + o.getProfiles());
		}
		if (o.getSchema() != null && !Files.isRegularFile(o.getSchema())) {
			errors.add("Schema file does not exist: " + o.getSchema());
		}
		if (o.getParallelism() < 0) {
			errors.add("Parallelism must be >= 0. Got: " + o.getParallelism());
		}
		if (isBlank(o.getDefaultPlatform())) {
			errors.add("Default platform must not be blank (--default-platform).");
		}

		Path normalizedOutputDir = null;
		if (o.getOut() == null) {
			errors.add("Output folder is required (--out / -o).");
		} else {
			normalizedOutputDir = o.getOut().toAbsolutePath().normalize();
			if (Files.isRegularFile(normalizedOutputDir)) {
				errors.add("Output path is a file, not a folder: " + normalizedOutputDir);
			}
		}

		if (!errors.isEmpty()) {
			throw new OptionsValidationException(errors);
		}

		int parallelism = o.getParallelism() == 0 ? Runtime.getRuntime().availableProcessors() : o.getParallelism();
		return new ValidatedGenerateOptions(o.getSnapshot().toAbsolutePath().normalize(), normalizedOutputDir,
				parallelism);
	}

	private static boolean isBlank(String s) {
		return s == null || s.trim().isEmpty();
	}
}
