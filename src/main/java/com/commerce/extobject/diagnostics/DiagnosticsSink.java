package com.commerce.extobject.diagnostics;

/**
 * Receives diagnostics emitted while mapping documents. Implementations must tolerate being
 * called from several threads when documents are mapped in parallel.
 */
@FunctionalInterface
public interface DiagnosticsSink {

    void missingAttribute(MissingAttributeDiagnostic diagnostic);
}
