package com.commerce.extobject.record;

import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Typed values keyed by target attribute, in the order they were first written.
 * Values are {@link Boolean}, {@link Long}, {@link java.math.BigDecimal} or {@link String}.
 */
@ToString
@EqualsAndHashCode
public class MappedRecord {
    private final Map<String, Object> values = new LinkedHashMap<>();

    void put(String targetAttribute, Object value) {
        values.put(targetAttribute, value);
    }

    public Optional<Object> get(String targetAttribute) {
        return Optional.ofNullable(values.get(targetAttribute));
    }

    public boolean containsKey(String targetAttribute) {
        return values.containsKey(targetAttribute);
    }

    public int size() {
        return values.size();
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public Map<String, Object> asMap() {
        return Collections.unmodifiableMap(values);
    }
}
