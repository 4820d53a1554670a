package com.commerce.extobject.cli.validation;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import lombok.experimental.UtilityClass;

/**
 * Checks shared by the command validators. Each check appends to the error list instead of throwing.
 */
@UtilityClass
class OptionChecks {

	static void requireReadableFile(Path p, String what, List<String> errors) {
		if (p == null) {
			errors.add(what + " path is required.");
		} else if (!Files.isRegularFile(p)) {
			errors.add(what + " does not exist or is not a file: " + p);
		} else if (!Files.isReadable(p)) {
			errors.add(what + " is not readable: " + p);
		}
	}

	static void checkOutput(Path output, boolean force, List<String> errors) {
		if (output == null) {
			return;
		}
		if (Files.isDirectory(output)) {
			errors.add("Output path is a directory: " + output);
		} else if (Files.exists(output) && !force) {
			errors.add("Output file already exists: " + output + ". Use --force to overwrite.");
		}
	}

	static boolean isBlank(String s) {
		return s == null || s.trim().isEmpty();
	}

	static Path normalize(Path p) {
		return p.toAbsolutePath().normalize();
	}
}
