package com.commerce.extobject.cli;

import picocli.CommandLine.Command;

/**
 * Top-level command; the work happens in the subcommands.
 */
@Command(
        name = "extobject",
        mixinStandardHelpOptions = true,
        version = "external-object-mapper 1.0.0",
        description = "Builds external-object schemas and typed records from a field-mapping catalog.",
        subcommands = {SchemaCommand.class, MapCommand.class}
)
public class ExtObjectCommand {
}
