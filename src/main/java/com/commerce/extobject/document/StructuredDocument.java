package com.commerce.extobject.document;

/**
 * Keyed read access to a semi-structured payload.
 */
public interface StructuredDocument {

    /**
     * Looks a key up. Never throws for a missing key; returns {@link Lookup#absent()} instead.
     */
    Lookup lookup(String key);

    /**
     * Full-document serialization for diagnostics.
     */
    String describe();
}
