package com.commerce.extobject.schema;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Table-level inputs of {@link TableDescriptorBuilder}; the columns come from the mapping catalog.
 */
@Value
@Builder(toBuilder = true)
public class TableSpec {

    @NonNull
    String name;

    String labelSingular;

    String labelPlural;

    String description;

    @NonNull
    IndirectLookup lookup;
}
