package com.commerce.extobject.schema;

import com.commerce.extobject.mapping.FieldMapping;
import lombok.NonNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Builds the full table descriptor of an external object: the mapped columns followed by
 * the fixed {@value #EXTERNAL_ID_COLUMN} and {@value #DISPLAY_URL_COLUMN} columns and
 * finally the indirect lookup to the owning entity.
 *
 * <p>Every call returns a new descriptor; nothing is cached.
 */
public class TableDescriptorBuilder {
    private static final Logger log = LoggerFactory.getLogger(TableDescriptorBuilder.class);

    public static final String EXTERNAL_ID_COLUMN = "ExternalId";
    public static final String DISPLAY_URL_COLUMN = "DisplayUrl";
    public static final int EXTERNAL_ID_LENGTH = 255;

    private final ColumnBuilder columnBuilder;

    public TableDescriptorBuilder() {
        this(new ColumnBuilder());
    }

    public TableDescriptorBuilder(ColumnBuilder columnBuilder) {
        this.columnBuilder = columnBuilder;
    }

    /**
     * Positional form of {@link #buildTableDescriptor(TableSpec, List)}.
     */
    public TableDescriptor buildTableDescriptor(String name, String labelSingular, String labelPlural,
                                                String description, String lookupColumn, String lookupLabel,
                                                String lookupDescription, String lookupTargetEntity,
                                                String lookupTargetField, List<FieldMapping> fieldMappings) {
        TableSpec spec = TableSpec.builder()
                .name(name)
                .labelSingular(labelSingular)
                .labelPlural(labelPlural)
                .description(description)
                .lookup(IndirectLookup.builder()
                        .columnName(lookupColumn)
                        .label(lookupLabel)
                        .description(lookupDescription)
                        .targetEntity(lookupTargetEntity)
                        .targetField(lookupTargetField)
                        .build())
                .build();
        return buildTableDescriptor(spec, fieldMappings);
    }

    public TableDescriptor buildTableDescriptor(@NonNull TableSpec spec, @NonNull List<FieldMapping> fieldMappings) {
        List<ColumnDefinition> mapped = columnBuilder.buildColumns(fieldMappings);

        IndirectLookup lookup = spec.getLookup();
        ColumnDefinition lookupColumn = ColumnDefinition.indirectLookup(
                lookup.getColumnName(), lookup.getLabel(), lookup.getDescription(),
                lookup.getTargetEntity(), lookup.getTargetField());

        TableDescriptor descriptor = TableDescriptor.builder()
                .name(spec.getName())
                .labelSingular(spec.getLabelSingular())
                .labelPlural(spec.getLabelPlural())
                .description(spec.getDescription())
                .primaryKeyColumn(EXTERNAL_ID_COLUMN)
                .columns(mapped)
                .column(ColumnDefinition.text(EXTERNAL_ID_COLUMN, "External ID",
                        "Unique identifier of the record in the source system", EXTERNAL_ID_LENGTH))
                .column(ColumnDefinition.url(DISPLAY_URL_COLUMN, "Display URL",
                        "Link to the record in the source system"))
                .column(lookupColumn)
                .build();

        log.debug("Built table descriptor {} with {} columns ({} mapped)",
                descriptor.getName(), descriptor.getColumns().size(), mapped.size());
        return descriptor;
    }
}
