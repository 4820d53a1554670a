package com.commerce.extobject.cli.model;

import java.nio.file.Path;

import lombok.Getter;
import picocli.CommandLine.Option;

/**
 * Holds all CLI options for the "schema" command. No validation, no execution
 * logic, no printing.
 */
@Getter
public class SchemaOptions {

	@Option(names = { "--mappings", "-m" }, required = true, description = "Path to the field-mapping catalog")
	private Path mappings;

	@Option(names = { "--name", "-n" }, required = true, description = "API name of the external object, e.g. B2C_Address")
	private String name;

	@Option(names = { "--label-singular" }, description = "Singular label (defaults to the name)")
	private String labelSingular;

	@Option(names = { "--label-plural" }, description = "Plural label (defaults to the singular label)")
	private String labelPlural;

	@Option(names = { "--description" }, defaultValue = "", description = "Description of the external object")
	private String description;

	// Indirect lookup to the owning entity
	@Option(names = { "--lookup-column" }, required = true, description = "Name of the indirect lookup column")
	private String lookupColumn;

	@Option(names = { "--lookup-label" }, description = "Label of the indirect lookup column (defaults to its name)")
	private String lookupLabel;

	@Option(names = { "--lookup-description" }, defaultValue = "", description = "Description of the indirect lookup column")
	private String lookupDescription;

	@Option(names = { "--lookup-target" }, required = true, description = "Entity the lookup points at, e.g. Contact")
	private String lookupTarget;

	@Option(names = { "--lookup-field" }, required = true, description = "Field on the target entity matched by value")
	private String lookupField;

	@Option(names = { "--format", "-f" }, defaultValue = "JSON", description = "Output format: JSON or MARKDOWN")
	private OutputFormat format;

	@Option(names = { "--output", "-o" }, description = "Write the result to this file instead of stdout")
	private Path output;

	@Option(names = { "--force" }, description = "Overwrite an existing output file")
	private boolean force;
}
