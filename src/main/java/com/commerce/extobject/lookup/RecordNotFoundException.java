package com.commerce.extobject.lookup;

import lombok.Getter;

/**
 * No record matched the requested identifier.
 */
@Getter
public class RecordNotFoundException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String identifier;

    public RecordNotFoundException(String identifier, String message) {
        super(message);
        this.identifier = identifier;
    }
}
