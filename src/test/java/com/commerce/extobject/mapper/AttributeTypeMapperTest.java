package com.commerce.extobject.mapper;

import com.commerce.extobject.document.DocumentValue;
import com.commerce.extobject.document.JsonStructuredDocument;
import com.commerce.extobject.mapping.FieldMapping;
import com.commerce.extobject.schema.ColumnDefinition;
import com.commerce.extobject.schema.ColumnKind;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.*;

/**
 * Both arms of the type dispatch: the column a mapping becomes and the value type it produces.
 */
class AttributeTypeMapperTest {

    private static final JsonStructuredDocument DOCUMENT = JsonStructuredDocument.parse(
            "{\"flag\": true, \"count\": 7, \"amount\": 12.5, \"name\": \"Ada\"}");

    @ParameterizedTest
    @CsvSource({
            "flag,   boolean,  BOOLEAN, java.lang.Boolean",
            "count,  integer,  INTEGER, java.lang.Long",
            "amount, number,   NUMBER,  java.math.BigDecimal",
            "name,   text,     TEXT,    java.lang.String",
            "name,   currency, TEXT,    java.lang.String"
    })
    void testDispatchTable(String source, String tag, ColumnKind kind, Class<?> valueType) {
        FieldMapping mapping = FieldMapping.builder()
                .sourceAttribute(source).targetAttribute("T__c").attributeTypeTag(tag).build();

        ColumnDefinition column = AttributeTypeMapper.toColumn(mapping);
        DocumentValue value = DOCUMENT.lookup(source).getValue();

        assertThat(column.getKind()).isEqualTo(kind);
        assertThat(column.getName()).isEqualTo("T__c");
        assertThat(AttributeTypeMapper.coerce(value, mapping)).isInstanceOf(valueType);
    }

    @ParameterizedTest
    @CsvSource({
            "integer, 10, ",
            "number,  10, 2"
    })
    void testNumericPrecision(String tag, Integer precision, Integer scale) {
        FieldMapping mapping = FieldMapping.builder()
                .sourceAttribute("x").targetAttribute("X__c").attributeTypeTag(tag).build();

        ColumnDefinition column = AttributeTypeMapper.toColumn(mapping);

        assertThat(column.getPrecision()).isEqualTo(precision);
        assertThat(column.getScale()).isEqualTo(scale);
    }

    @ParameterizedTest
    @CsvSource({"amount, 12.5"})
    void testDecimalValueKeepsSourceScale(String source, BigDecimal expected) {
        FieldMapping mapping = FieldMapping.builder()
                .sourceAttribute(source).targetAttribute("A__c").attributeTypeTag("number").build();

        Object value = AttributeTypeMapper.coerce(DOCUMENT.lookup(source).getValue(), mapping);

        assertThat(value).isEqualTo(expected);
    }
}
