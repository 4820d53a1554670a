package com.commerce.extobject.document;

import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * Outcome of looking a key up in a {@link StructuredDocument}: either a value or the fact
 * that the key is absent. Absence is an ordinary result, not an exception.
 */
public final class Lookup {

    private static final Lookup ABSENT = new Lookup(null);

    private final DocumentValue value;

    private Lookup(DocumentValue value) {
        this.value = value;
    }

    public static Lookup present(DocumentValue value) {
        return new Lookup(Objects.requireNonNull(value, "value"));
    }

    public static Lookup absent() {
        return ABSENT;
    }

    public boolean isPresent() {
        return value != null;
    }

    public boolean isAbsent() {
        return value == null;
    }

    public DocumentValue getValue() {
        if (value == null) {
            throw new NoSuchElementException("Lookup is absent");
        }
        return value;
    }

    @Override
    public String toString() {
        return value == null ? "Lookup.absent" : "Lookup.present(" + value + ")";
    }
}
