package com.commerce.extobject.mapping;

/**
 * Raised when a mapping catalog cannot be read at all.
 */
public class CatalogException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public CatalogException(String message, Throwable cause) {
        super(message, cause);
    }
}
