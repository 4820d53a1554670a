package com.commerce.extobject.record;

import com.commerce.extobject.diagnostics.DiagnosticsSink;
import com.commerce.extobject.diagnostics.LoggingDiagnosticsSink;
import com.commerce.extobject.diagnostics.MissingAttributeDiagnostic;
import com.commerce.extobject.document.Lookup;
import com.commerce.extobject.document.StructuredDocument;
import com.commerce.extobject.mapper.AttributeTypeMapper;
import com.commerce.extobject.mapping.FieldMapping;
import lombok.NonNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Extracts a {@link MappedRecord} from a source document.
 *
 * <p>An absent source attribute only drops that one field and is reported to the
 * {@link DiagnosticsSink}. A value that is present but of the wrong shape raises
 * {@link com.commerce.extobject.document.TypeMismatchException} and no record is returned.
 * When two mappings share a target attribute the later one wins.
 *
 * <p>Holds no per-call state; one instance can map documents concurrently.
 */
public class RecordMapper {
    private static final Logger log = LoggerFactory.getLogger(RecordMapper.class);

    private final DiagnosticsSink diagnostics;

    public RecordMapper() {
        this(new LoggingDiagnosticsSink());
    }

    public RecordMapper(@NonNull DiagnosticsSink diagnostics) {
        this.diagnostics = diagnostics;
    }

    public MappedRecord mapFields(@NonNull StructuredDocument sourceDocument,
                                  @NonNull List<FieldMapping> fieldMappings,
                                  String context) {
        MappedRecord record = new MappedRecord();
        for (FieldMapping mapping : fieldMappings) {
            Lookup lookup = sourceDocument.lookup(mapping.getSourceAttribute());
            if (lookup.isAbsent()) {
                report(new MissingAttributeDiagnostic(mapping.getSourceAttribute(), sourceDocument.describe(), context));
                continue;
            }
            record.put(mapping.getTargetAttribute(), AttributeTypeMapper.coerce(lookup.getValue(), mapping));
        }
        return record;
    }

    private void report(MissingAttributeDiagnostic diagnostic) {
        try {
            diagnostics.missingAttribute(diagnostic);
        } catch (RuntimeException e) {
            log.warn("[{}] Diagnostics sink failed for attribute '{}': {}",
                    diagnostic.context(), diagnostic.sourceAttribute(), e.getMessage(), e);
        }
    }
}
