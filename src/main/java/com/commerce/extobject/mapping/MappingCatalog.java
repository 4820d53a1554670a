package com.commerce.extobject.mapping;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A parsed field-mapping catalog, plus the problems found while parsing it.
 */
public class MappingCatalog {
    private final List<FieldMapping> mappings = new ArrayList<>();
    private final Map<String, FieldMapping> mappingsByTarget = new LinkedHashMap<>();
    private final List<String> errors = new ArrayList<>();
    private final List<String> warnings = new ArrayList<>();

    public void addMapping(FieldMapping mapping) {
        if (mappingsByTarget.containsKey(mapping.getTargetAttribute())) {
            warnings.add("Duplicate target attribute '" + mapping.getTargetAttribute()
                    + "': the later mapping overwrites the earlier one");
        }
        mappings.add(mapping);
        mappingsByTarget.put(mapping.getTargetAttribute(), mapping);
    }

    public List<FieldMapping> getMappings() {
        return Collections.unmodifiableList(mappings);
    }

    public Optional<FieldMapping> getMappingForTarget(String targetAttribute) {
        return Optional.ofNullable(mappingsByTarget.get(targetAttribute));
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    public void addError(String error) {
        errors.add(error);
    }

    public List<String> getErrors() {
        return Collections.unmodifiableList(errors);
    }

    public List<String> getWarnings() {
        return Collections.unmodifiableList(warnings);
    }
}
