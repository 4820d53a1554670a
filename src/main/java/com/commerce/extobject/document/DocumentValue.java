package com.commerce.extobject.document;

import java.math.BigDecimal;

/**
 * A value found in a {@link StructuredDocument}, readable as one of the mapped scalar types.
 * Every accessor throws {@link TypeMismatchException} when the underlying value has another shape.
 */
public interface DocumentValue {

    boolean asBoolean();

    long asInteger();

    BigDecimal asDecimal();

    String asString();
}
