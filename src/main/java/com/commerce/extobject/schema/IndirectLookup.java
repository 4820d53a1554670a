package com.commerce.extobject.schema;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * The relationship column that ties an external record to its owning entity.
 */
@Value
@Builder
public class IndirectLookup {

    @NonNull
    String columnName;

    @NonNull
    @Builder.Default
    String label = "";

    @NonNull
    @Builder.Default
    String description = "";

    @NonNull
    String targetEntity;

    @NonNull
    String targetField;
}
