package com.commerce.extobject.cli;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.commerce.extobject.cli.exception.OptionsValidationException;
import com.commerce.extobject.cli.model.MapOptions;
import com.commerce.extobject.cli.model.ValidatedMapOptions;
import com.commerce.extobject.cli.output.ResultsPrinter;
import com.commerce.extobject.cli.validation.MapOptionsValidator;
import com.commerce.extobject.diagnostics.CollectingDiagnosticsSink;
import com.commerce.extobject.diagnostics.LoggingDiagnosticsSink;
import com.commerce.extobject.document.JsonStructuredDocument;
import com.commerce.extobject.document.TypeMismatchException;
import com.commerce.extobject.mapping.MappingCatalog;
import com.commerce.extobject.mapping.MappingParser;
import com.commerce.extobject.record.MappedRecord;
import com.commerce.extobject.record.RecordMapper;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * CLI command that maps one source document into a typed record.
 */
@Command(
        name = "map",
        mixinStandardHelpOptions = true,
        description = "Maps a JSON document from the source system into a typed record."
)
public class MapCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(MapCommand.class);

    static final int EXIT_TYPE_MISMATCH = 2;

    @Mixin
    private MapOptions options;

    @Spec
    private CommandSpec spec;

    private final MapOptionsValidator validator = new MapOptionsValidator();
    private final ResultsPrinter printer = new ResultsPrinter();

    @Override
    public Integer call() {
        try {
            ValidatedMapOptions v = validator.validate(options);

            MappingCatalog catalog = new MappingParser().parse(v.getMappings());
            printer.printCatalogProblems(catalog);
            if (catalog.hasErrors()) {
                log.error("Mapping catalog has {} error(s); document not mapped", catalog.getErrors().size());
                return 1;
            }

            JsonStructuredDocument document =
                    JsonStructuredDocument.parse(Files.readString(v.getDocument(), StandardCharsets.UTF_8));

            CollectingDiagnosticsSink collected = new CollectingDiagnosticsSink();
            LoggingDiagnosticsSink logging = new LoggingDiagnosticsSink();
            RecordMapper mapper = new RecordMapper(diagnostic -> {
                logging.missingAttribute(diagnostic);
                collected.missingAttribute(diagnostic);
            });

            MappedRecord record = mapper.mapFields(document, catalog.getMappings(), v.getContext());

            printer.writePayload(JsonOutput.write(record.asMap()), v.getOutput(), spec.commandLine().getOut());
            printer.printRecordSummary(v, record, collected.getMissingAttributes());
            return 0;

        } catch (OptionsValidationException e) {
            e.getErrors().forEach(error -> log.error("{}", error));
            return 1;
        } catch (TypeMismatchException e) {
            log.error("Record not mapped: {}", e.getMessage());
            return EXIT_TYPE_MISMATCH;
        } catch (Exception e) {
            log.error("Record mapping failed", e);
            return 1;
        }
    }
}
