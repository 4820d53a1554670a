package com.commerce.extobject.cli.model;

import java.nio.file.Path;

import lombok.Getter;
import picocli.CommandLine.Option;

/**
 * Holds all CLI options for the "map" command. No validation, no execution
 * logic, no printing.
 */
@Getter
public class MapOptions {

	@Option(names = { "--mappings", "-m" }, required = true, description = "Path to the field-mapping catalog")
	private Path mappings;

	@Option(names = { "--document", "-d" }, required = true, description = "JSON document from the source system")
	private Path document;

	@Option(names = { "--context", "-c" }, description = "Identifier attached to diagnostics (defaults to the document file name)")
	private String context;

	@Option(names = { "--output", "-o" }, description = "Write the record to this file instead of stdout")
	private Path output;

	@Option(names = { "--force" }, description = "Overwrite an existing output file")
	private boolean force;
}
