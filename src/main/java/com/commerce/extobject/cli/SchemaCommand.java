package com.commerce.extobject.cli;

import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.commerce.extobject.cli.exception.OptionsValidationException;
import com.commerce.extobject.cli.model.SchemaOptions;
import com.commerce.extobject.cli.model.ValidatedSchemaOptions;
import com.commerce.extobject.cli.output.ResultsPrinter;
import com.commerce.extobject.cli.validation.SchemaOptionsValidator;
import com.commerce.extobject.mapping.MappingCatalog;
import com.commerce.extobject.mapping.MappingParser;
import com.commerce.extobject.render.SchemaDocumentRenderer;
import com.commerce.extobject.schema.TableDescriptor;
import com.commerce.extobject.schema.TableDescriptorBuilder;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * CLI command that turns a mapping catalog into an external-object table descriptor.
 */
@Command(
        name = "schema",
        mixinStandardHelpOptions = true,
        description = "Generates the external-object table schema described by a mapping catalog."
)
public class SchemaCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(SchemaCommand.class);

    @Mixin
    private SchemaOptions options;

    @Spec
    private CommandSpec spec;

    private final SchemaOptionsValidator validator = new SchemaOptionsValidator();
    private final ResultsPrinter printer = new ResultsPrinter();

    @Override
    public Integer call() {
        try {
            ValidatedSchemaOptions v = validator.validate(options);

            MappingCatalog catalog = new MappingParser().parse(v.getMappings());
            printer.printCatalogProblems(catalog);
            if (catalog.hasErrors()) {
                log.error("Mapping catalog has {} error(s); no schema generated", catalog.getErrors().size());
                return 1;
            }

            TableDescriptor table = new TableDescriptorBuilder()
                    .buildTableDescriptor(v.getTableSpec(), catalog.getMappings());

            String payload = switch (options.getFormat()) {
                case JSON -> JsonOutput.write(table);
                case MARKDOWN -> new SchemaDocumentRenderer().render(table);
            };
            printer.writePayload(payload, v.getOutput(), spec.commandLine().getOut());
            printer.printSchemaSummary(v, table);
            return 0;

        } catch (OptionsValidationException e) {
            e.getErrors().forEach(error -> log.error("{}", error));
            return 1;
        } catch (Exception e) {
            log.error("Schema generation failed", e);
            return 1;
        }
    }
}
