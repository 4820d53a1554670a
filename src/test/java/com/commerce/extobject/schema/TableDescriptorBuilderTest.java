package com.commerce.extobject.schema;

import com.commerce.extobject.mapping.FieldMapping;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for TableDescriptorBuilder.
 */
class TableDescriptorBuilderTest {

    private final TableDescriptorBuilder builder = new TableDescriptorBuilder();

    private static final List<FieldMapping> ADDRESS_MAPPINGS = List.of(
            FieldMapping.builder().sourceAttribute("city").targetAttribute("City__c")
                    .attributeTypeTag("text").label("City").build(),
            FieldMapping.builder().sourceAttribute("zip").targetAttribute("Zip__c")
                    .attributeTypeTag("integer").label("Zip").build());

    private TableDescriptor buildAddress(List<FieldMapping> mappings) {
        return builder.buildTableDescriptor("B2C_Address", "Address", "Addresses", "Customer addresses",
                "Contact__c", "Contact", "Owning contact", "Contact", "Customer_Id__c", mappings);
    }

    @Test
    void testSchemaExample() {
        List<FieldMapping> mappings = List.of(FieldMapping.builder()
                .sourceAttribute("city").targetAttribute("City__c").attributeTypeTag("text").build());

        TableDescriptor table = buildAddress(mappings);

        assertThat(table.getName()).isEqualTo("B2C_Address");
        assertThat(table.getPrimaryKeyColumn()).isEqualTo("ExternalId");
        assertThat(table.getColumns()).extracting(ColumnDefinition::getName)
                .containsExactly("City__c", "ExternalId", "DisplayUrl", "Contact__c");
        assertThat(table.getColumns()).extracting(ColumnDefinition::getKind)
                .containsExactly(ColumnKind.TEXT, ColumnKind.TEXT, ColumnKind.URL, ColumnKind.INDIRECT_LOOKUP);
        assertThat(table.getColumns().get(0).getLength()).isEqualTo(255);
        assertThat(table.getColumns().get(1).getLength()).isEqualTo(255);
    }

    @Test
    void testTableMetadata() {
        TableDescriptor table = buildAddress(ADDRESS_MAPPINGS);

        assertThat(table.getLabelSingular()).isEqualTo("Address");
        assertThat(table.getLabelPlural()).isEqualTo("Addresses");
        assertThat(table.getDescription()).isEqualTo("Customer addresses");
    }

    @Test
    void testTrailingColumnsFollowMappedColumns() {
        TableDescriptor table = buildAddress(ADDRESS_MAPPINGS);

        List<ColumnDefinition> columns = table.getColumns();
        assertThat(columns).hasSize(5);
        assertThat(columns.subList(0, 2)).extracting(ColumnDefinition::getName).containsExactly("City__c", "Zip__c");
        assertThat(columns.get(2).getName()).isEqualTo(TableDescriptorBuilder.EXTERNAL_ID_COLUMN);
        assertThat(columns.get(3).getName()).isEqualTo(TableDescriptorBuilder.DISPLAY_URL_COLUMN);
        assertThat(columns.get(4).getKind()).isEqualTo(ColumnKind.INDIRECT_LOOKUP);
    }

    @Test
    void testIndirectLookupColumn() {
        ColumnDefinition lookup = buildAddress(ADDRESS_MAPPINGS).getColumn("Contact__c").orElseThrow();

        assertThat(lookup.getKind()).isEqualTo(ColumnKind.INDIRECT_LOOKUP);
        assertThat(lookup.getLabel()).isEqualTo("Contact");
        assertThat(lookup.getDescription()).isEqualTo("Owning contact");
        assertThat(lookup.getReferenceTo()).isEqualTo("Contact");
        assertThat(lookup.getReferenceTargetField()).isEqualTo("Customer_Id__c");
    }

    @Test
    void testEmptyMappingsStillYieldFixedColumns() {
        TableDescriptor table = buildAddress(List.of());

        assertThat(table.getColumns()).extracting(ColumnDefinition::getName)
                .containsExactly("ExternalId", "DisplayUrl", "Contact__c");
    }

    @Test
    void testDeterministic() {
        TableDescriptor first = buildAddress(ADDRESS_MAPPINGS);
        TableDescriptor second = buildAddress(ADDRESS_MAPPINGS);

        assertThat(first).isEqualTo(second);
        assertThat(first).isNotSameAs(second);
    }

    @Test
    void testSpecOverloadMatchesPositionalForm() {
        TableSpec spec = TableSpec.builder()
                .name("B2C_Address")
                .labelSingular("Address")
                .labelPlural("Addresses")
                .description("Customer addresses")
                .lookup(IndirectLookup.builder()
                        .columnName("Contact__c")
                        .label("Contact")
                        .description("Owning contact")
                        .targetEntity("Contact")
                        .targetField("Customer_Id__c")
                        .build())
                .build();

        assertThat(builder.buildTableDescriptor(spec, ADDRESS_MAPPINGS)).isEqualTo(buildAddress(ADDRESS_MAPPINGS));
    }

    @Test
    void testColumnsAreUnmodifiable() {
        TableDescriptor table = buildAddress(ADDRESS_MAPPINGS);

        assertThatThrownBy(() -> table.getColumns().clear()).isInstanceOf(UnsupportedOperationException.class);
    }
}
