package com.commerce.extobject;

import com.commerce.extobject.cli.ExtObjectCommand;
import picocli.CommandLine;

/**
 * Main entry point of the external-object mapper CLI.
 * Generates external-object table schemas from a field-mapping catalog and maps
 * JSON payloads from the source system into typed records with the same catalog.
 */
public class ExtObjectApplication {

    public static void main(String[] args) {
        System.exit(commandLine().execute(args));
    }

    public static CommandLine commandLine() {
        return new CommandLine(new ExtObjectCommand())
                .setCaseInsensitiveEnumValuesAllowed(true);
    }
}
