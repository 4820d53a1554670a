package com.commerce.extobject.schema;

/**
 * Column kinds an external-object table can declare.
 */
public enum ColumnKind {
    BOOLEAN,
    INTEGER,
    NUMBER,
    TEXT,
    URL,
    /**
     * Relationship resolved by value equality against a field of another entity.
     */
    INDIRECT_LOOKUP
}
