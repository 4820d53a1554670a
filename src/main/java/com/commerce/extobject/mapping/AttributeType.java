package com.commerce.extobject.mapping;

import java.util.Locale;

/**
 * Semantic type of a mapped attribute.
 */
public enum AttributeType {

    BOOLEAN,

    INTEGER,

    /**
     * Fixed-point decimal.
     */
    NUMBER,

    /**
     * Default for any tag that is not one of the other three.
     */
    TEXT;

    /**
     * Classifies a raw catalog tag. Matching is case-insensitive and unrecognized
     * (or missing) tags fall back to {@link #TEXT}.
     */
    public static AttributeType fromTag(String tag) {
        if (tag == null) {
            return TEXT;
        }
        return switch (tag.trim().toLowerCase(Locale.ROOT)) {
            case "boolean" -> BOOLEAN;
            case "integer" -> INTEGER;
            case "number" -> NUMBER;
            default -> TEXT;
        };
    }
}
