package com.commerce.extobject.schema;

import com.commerce.extobject.mapper.AttributeTypeMapper;
import com.commerce.extobject.mapping.FieldMapping;
import lombok.NonNull;

import java.util.List;

/**
 * Turns field mappings into column definitions, one per mapping, in input order.
 */
public class ColumnBuilder {

    public List<ColumnDefinition> buildColumns(@NonNull List<FieldMapping> fieldMappings) {
        return fieldMappings.stream()
                .map(AttributeTypeMapper::toColumn)
                .toList();
    }
}
