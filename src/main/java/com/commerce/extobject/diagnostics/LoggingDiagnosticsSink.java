package com.commerce.extobject.diagnostics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes diagnostics to the log. Missing attributes are expected, so they go out at DEBUG.
 */
public class LoggingDiagnosticsSink implements DiagnosticsSink {

    private static final Logger log = LoggerFactory.getLogger(LoggingDiagnosticsSink.class);

    @Override
    public void missingAttribute(MissingAttributeDiagnostic diagnostic) {
        log.debug("[{}] Attribute '{}' not present in source document: {}",
                diagnostic.context(), diagnostic.sourceAttribute(), diagnostic.documentSnapshot());
    }
}
