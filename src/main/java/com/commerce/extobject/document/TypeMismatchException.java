package com.commerce.extobject.document;

import lombok.Getter;

/**
 * A document value is present but cannot be read as the requested type.
 */
@Getter
public class TypeMismatchException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String key;
    private final String expectedType;
    private final String actualType;

    public TypeMismatchException(String key, String expectedType, String actualType) {
        super("Value at '" + key + "' is " + actualType + ", expected " + expectedType);
        this.key = key;
        this.expectedType = expectedType;
        this.actualType = actualType;
    }
}
