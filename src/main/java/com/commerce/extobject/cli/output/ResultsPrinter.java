package com.commerce.extobject.cli.output;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.commerce.extobject.cli.model.ValidatedMapOptions;
import com.commerce.extobject.cli.model.ValidatedSchemaOptions;
import com.commerce.extobject.diagnostics.MissingAttributeDiagnostic;
import com.commerce.extobject.mapping.MappingCatalog;
import com.commerce.extobject.record.MappedRecord;
import com.commerce.extobject.schema.TableDescriptor;

/**
 * Responsible only for CLI output: summaries go to the log, payloads go to stdout or a file.
 * No validation, no execution.
 */
public class ResultsPrinter {

    private static final Logger log = LoggerFactory.getLogger(ResultsPrinter.class);

    public void printCatalogProblems(MappingCatalog catalog) {
        for (String warning : catalog.getWarnings()) {
            log.warn("Mapping catalog: {}", warning);
        }
        for (String error : catalog.getErrors()) {
            log.error("Mapping catalog: {}", error);
        }
    }

    public void printSchemaSummary(ValidatedSchemaOptions v, TableDescriptor table) {
        log.info("=================================================");
        log.info("Schema generated for {}", table.getName());
        log.info("=================================================");
        log.info("Mapping Catalog: {}", v.getMappings());
        log.info("Columns: {}", table.getColumns().size());
        log.info("Primary Key: {}", table.getPrimaryKeyColumn());
        log.info("Lookup: {} -> {}.{}", v.getTableSpec().getLookup().getColumnName(),
                v.getTableSpec().getLookup().getTargetEntity(), v.getTableSpec().getLookup().getTargetField());
        log.info("Output: {}", v.getOutput() != null ? v.getOutput() : "stdout");
    }

    public void printRecordSummary(ValidatedMapOptions v, MappedRecord record, List<MissingAttributeDiagnostic> missing) {
        log.info("=================================================");
        log.info("Record mapped [{}]", v.getContext());
        log.info("=================================================");
        log.info("Source Document: {}", v.getDocument());
        log.info("Fields Mapped: {}", record.size());
        if (!missing.isEmpty()) {
            log.info("Missing Source Attributes: {}",
                    missing.stream().map(MissingAttributeDiagnostic::sourceAttribute).toList());
        }
        log.info("Output: {}", v.getOutput() != null ? v.getOutput() : "stdout");
    }

    public void writePayload(String payload, Path output, PrintWriter out) throws IOException {
        if (output == null) {
            out.println(payload);
            out.flush();
            return;
        }
        Path parent = output.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(output, payload + System.lineSeparator(), StandardCharsets.UTF_8);
    }
}
