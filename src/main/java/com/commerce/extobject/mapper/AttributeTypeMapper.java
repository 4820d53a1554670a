package com.commerce.extobject.mapper;

import com.commerce.extobject.document.DocumentValue;
import com.commerce.extobject.mapping.FieldMapping;
import com.commerce.extobject.schema.ColumnDefinition;

import lombok.experimental.UtilityClass;

/**
 * The one place where an attribute type decides what a mapping becomes, both as a
 * schema column and as a record value.
 */
@UtilityClass
public class AttributeTypeMapper {

    public static final int INTEGER_PRECISION = 10;
    public static final int NUMBER_PRECISION = 10;
    public static final int NUMBER_SCALE = 2;
    public static final int TEXT_LENGTH = 255;

    /**
     * Column for a mapping: named after the target attribute, carrying its label and description.
     */
    public ColumnDefinition toColumn(FieldMapping mapping) {
        String name = mapping.getTargetAttribute();
        String label = mapping.getLabel();
        String description = mapping.getDescription();
        return switch (mapping.getAttributeType()) {
            case BOOLEAN -> ColumnDefinition.bool(name, label, description);
            case INTEGER -> ColumnDefinition.integer(name, label, description, INTEGER_PRECISION);
            case NUMBER -> ColumnDefinition.number(name, label, description, NUMBER_PRECISION, NUMBER_SCALE);
            case TEXT -> ColumnDefinition.text(name, label, description, TEXT_LENGTH);
        };
    }

    /**
     * Reads a document value as the mapping's type.
     *
     * @throws com.commerce.extobject.document.TypeMismatchException if the value has another shape
     */
    public Object coerce(DocumentValue value, FieldMapping mapping) {
        return switch (mapping.getAttributeType()) {
            case BOOLEAN -> value.asBoolean();
            case INTEGER -> value.asInteger();
            case NUMBER -> value.asDecimal();
            case TEXT -> value.asString();
        };
    }
}
