package com.commerce.extobject.mapping;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Pairs an attribute of the source document with a column of the generated schema.
 */
@Value
@Builder(toBuilder = true)
public class FieldMapping {

    /**
     * Key (or path) of the value inside the source document.
     */
    @NonNull
    String sourceAttribute;

    /**
     * Column name in the generated schema and key in the mapped record.
     */
    @NonNull
    String targetAttribute;

    /**
     * Raw type tag as written in the catalog, e.g. "integer". May be unrecognized.
     */
    String attributeTypeTag;

    @NonNull
    @Builder.Default
    String label = "";

    @NonNull
    @Builder.Default
    String description = "";

    public AttributeType getAttributeType() {
        return AttributeType.fromTag(attributeTypeTag);
    }
}
