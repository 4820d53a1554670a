package com.commerce.extobject.schema;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Optional;

/**
 * Schema of an external-object table, ready to hand to a schema registration sink.
 */
@Value
@Builder
public class TableDescriptor {

    @NonNull
    String name;

    String labelSingular;

    String labelPlural;

    String description;

    @NonNull
    String primaryKeyColumn;

    /**
     * Columns in declaration order.
     */
    @Singular
    List<ColumnDefinition> columns;

    public Optional<ColumnDefinition> getColumn(String columnName) {
        return columns.stream()
                .filter(c -> c.getName().equals(columnName))
                .findFirst();
    }
}
