package com.commerce.extobject.mapping;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parser for field-mapping catalog files.
 *
 * Format:
 * - Mapping: city = City__c:text | City | Billing or shipping city
 * - Nested source: address.zip = Zip__c:integer
 * - Type, label and description are optional: city = City__c
 * - Comments: # comment
 */
public class MappingParser {
    private static final Logger log = LoggerFactory.getLogger(MappingParser.class);

    private static final Pattern MAPPING_PATTERN = Pattern.compile(
            "^([A-Za-z0-9_\\-.\\[\\]]+)\\s*=\\s*(.+)$"
    );

    private static final Pattern TARGET_TYPE_PATTERN = Pattern.compile(
            "^([A-Za-z][A-Za-z0-9_]*)(?:\\s*:\\s*([A-Za-z]+))?$"
    );

    public MappingCatalog parse(Path catalogFile) {
        try {
            return parse(Files.readAllLines(catalogFile, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new CatalogException("Cannot read mapping catalog " + catalogFile, e);
        }
    }

    public MappingCatalog parse(List<String> lines) {
        MappingCatalog catalog = new MappingCatalog();

        int lineNum = 0;
        for (String line : lines) {
            lineNum++;

            String trimmed = line.trim();
            if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                continue;
            }

            try {
                FieldMapping mapping = parseLine(trimmed);
                catalog.addMapping(mapping);
                log.debug("Parsed mapping: {} -> {} ({})",
                        mapping.getSourceAttribute(), mapping.getTargetAttribute(), mapping.getAttributeType());
            } catch (IllegalArgumentException e) {
                catalog.addError("Line " + lineNum + ": " + e.getMessage());
                log.warn("Failed to parse mapping line {}: {}", lineNum, e.getMessage());
            }
        }

        return catalog;
    }

    private FieldMapping parseLine(String line) {
        Matcher matcher = MAPPING_PATTERN.matcher(line);
        if (!matcher.matches()) {
            throw new IllegalArgumentException("Invalid mapping format: " + line);
        }

        String source = matcher.group(1);
        String[] parts = matcher.group(2).split("\\|", -1);

        Matcher targetMatcher = TARGET_TYPE_PATTERN.matcher(parts[0].trim());
        if (!targetMatcher.matches()) {
            throw new IllegalArgumentException("Invalid target format: " + parts[0].trim());
        }
        if (parts.length > 3) {
            throw new IllegalArgumentException("Too many '|' sections: " + line);
        }

        String target = targetMatcher.group(1);
        String label = parts.length > 1 && !parts[1].isBlank() ? parts[1].trim() : target;
        String description = parts.length > 2 ? parts[2].trim() : "";

        return FieldMapping.builder()
                .sourceAttribute(source)
                .targetAttribute(target)
                .attributeTypeTag(targetMatcher.group(2))
                .label(label)
                .description(description)
                .build();
    }
}
