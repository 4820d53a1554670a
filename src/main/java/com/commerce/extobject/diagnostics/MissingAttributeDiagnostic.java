package com.commerce.extobject.diagnostics;

/**
 * Emitted when a mapped source attribute is absent from a document.
 *
 * @param sourceAttribute  the key that was looked up
 * @param documentSnapshot serialized source document
 * @param context          caller-supplied identifier of the mapping run
 */
public record MissingAttributeDiagnostic(
        String sourceAttribute,
        String documentSnapshot,
        String context
) {}
