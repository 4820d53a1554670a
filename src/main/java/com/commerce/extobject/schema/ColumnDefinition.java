package com.commerce.extobject.schema;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Describes a single column of an external-object table.
 *
 * Size attributes are only populated for the kinds that use them:
 * precision for INTEGER and NUMBER, scale for NUMBER, length for TEXT,
 * and the reference pair for INDIRECT_LOOKUP.
 */
@Value
@Builder(toBuilder = true)
public class ColumnDefinition {

    @NonNull
    String name;

    @NonNull
    @Builder.Default
    String label = "";

    @NonNull
    @Builder.Default
    String description = "";

    @NonNull
    ColumnKind kind;

    Integer precision;

    Integer scale;

    Integer length;

    /**
     * Entity the lookup points at.
     */
    String referenceTo;

    /**
     * Field on {@link #referenceTo} whose value must equal this column's value.
     */
    String referenceTargetField;

    public static ColumnDefinition bool(String name, String label, String description) {
        return ColumnDefinition.builder()
                .name(name).label(label).description(description)
                .kind(ColumnKind.BOOLEAN)
                .build();
    }

    public static ColumnDefinition integer(String name, String label, String description, int precision) {
        return ColumnDefinition.builder()
                .name(name).label(label).description(description)
                .kind(ColumnKind.INTEGER)
                .precision(precision)
                .build();
    }

    public static ColumnDefinition number(String name, String label, String description, int precision, int scale) {
        return ColumnDefinition.builder()
                .name(name).label(label).description(description)
                .kind(ColumnKind.NUMBER)
                .precision(precision)
                .scale(scale)
                .build();
    }

    public static ColumnDefinition text(String name, String label, String description, int length) {
        return ColumnDefinition.builder()
                .name(name).label(label).description(description)
                .kind(ColumnKind.TEXT)
                .length(length)
                .build();
    }

    public static ColumnDefinition url(String name, String label, String description) {
        return ColumnDefinition.builder()
                .name(name).label(label).description(description)
                .kind(ColumnKind.URL)
                .build();
    }

    public static ColumnDefinition indirectLookup(String name, String label, String description,
                                                  String referenceTo, String referenceTargetField) {
        return ColumnDefinition.builder()
                .name(name).label(label).description(description)
                .kind(ColumnKind.INDIRECT_LOOKUP)
                .referenceTo(referenceTo)
                .referenceTargetField(referenceTargetField)
                .build();
    }
}
