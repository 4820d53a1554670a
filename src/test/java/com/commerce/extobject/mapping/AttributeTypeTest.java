package com.commerce.extobject.mapping;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.NullAndEmptySource;

import static org.assertj.core.api.Assertions.*;

class AttributeTypeTest {

    @ParameterizedTest
    @CsvSource({
            "boolean, BOOLEAN",
            "BOOLEAN, BOOLEAN",
            "integer, INTEGER",
            "Integer, INTEGER",
            "number, NUMBER",
            "text, TEXT",
            "picklist, TEXT",
            "datetime, TEXT",
            "' number ', NUMBER"
    })
    void testFromTag(String tag, AttributeType expected) {
        assertThat(AttributeType.fromTag(tag)).isEqualTo(expected);
    }

    @ParameterizedTest
    @NullAndEmptySource
    void testMissingTagIsText(String tag) {
        assertThat(AttributeType.fromTag(tag)).isEqualTo(AttributeType.TEXT);
    }
}
