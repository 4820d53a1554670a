package com.commerce.extobject.document;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.NonNull;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * {@link StructuredDocument} over a Jackson tree.
 *
 * <p>A key is first looked up literally among the top-level fields, so
 * {@code "c_zip.code"} finds a field of that exact name. Otherwise it is read as a path:
 * {@code address.city} walks into nested objects and {@code lines[1]} into arrays. A missing segment, an out-of-range index or a JSON
 * {@code null} at the end of the path all count as absent.
 */
public class JsonStructuredDocument implements StructuredDocument {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final Pattern SEGMENT_PATTERN = Pattern.compile("^([^\\[\\]]*)((?:\\[\\d+])*)$");
    private static final Pattern INDEX_PATTERN = Pattern.compile("\\[(\\d+)]");

    private final JsonNode root;

    public JsonStructuredDocument(@NonNull JsonNode root) {
        this.root = root;
    }

    public static JsonStructuredDocument parse(String json) {
        try {
            return new JsonStructuredDocument(MAPPER.readTree(json));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Source document is not valid JSON: " + e.getOriginalMessage(), e);
        }
    }

    @Override
    public Lookup lookup(@NonNull String key) {
        JsonNode node = root.isObject() ? root.get(key) : null;
        if (node == null) {
            node = resolve(key);
        }
        if (node == null || node.isMissingNode() || node.isNull()) {
            return Lookup.absent();
        }
        return Lookup.present(new JsonValue(key, node));
    }

    @Override
    public String describe() {
        return root.toString();
    }

    private JsonNode resolve(String path) {
        JsonNode current = root;
        for (String segment : path.split("\\.", -1)) {
            Matcher matcher = SEGMENT_PATTERN.matcher(segment);
            if (!matcher.matches()) {
                return null;
            }
            String field = matcher.group(1);
            if (field.isEmpty() && matcher.group(2).isEmpty()) {
                return null;
            }
            if (!field.isEmpty()) {
                if (!current.isObject()) {
                    return null;
                }
                current = current.get(field);
                if (current == null) {
                    return null;
                }
            }
            Matcher index = INDEX_PATTERN.matcher(matcher.group(2));
            while (index.find()) {
                if (!current.isArray()) {
                    return null;
                }
                int position = arrayIndex(index.group(1), current.size());
                if (position < 0) {
                    return null;
                }
                current = current.get(position);
            }
        }
        return current;
    }

    /**
     * Returns the index, or -1 when it is not below {@code size}.
     */
    private static int arrayIndex(String digits, int size) {
        String trimmed = digits.replaceFirst("^0+(?=\\d)", "");
        if (trimmed.length() > String.valueOf(Integer.MAX_VALUE).length()) {
            return -1;
        }
        long index = Long.parseLong(trimmed);
        return index < size ? (int) index : -1;
    }

    private static final class JsonValue implements DocumentValue {
        private final String key;
        private final JsonNode node;

        private JsonValue(String key, JsonNode node) {
            this.key = key;
            this.node = node;
        }

        @Override
        public boolean asBoolean() {
            if (!node.isBoolean()) {
                throw mismatch("boolean");
            }
            return node.booleanValue();
        }

        @Override
        public long asInteger() {
            if (!node.isIntegralNumber() || !node.canConvertToLong()) {
                throw mismatch("integer");
            }
            return node.longValue();
        }

        @Override
        public BigDecimal asDecimal() {
            if (!node.isNumber()) {
                throw mismatch("number");
            }
            return node.decimalValue();
        }

        @Override
        public String asString() {
            if (!node.isValueNode()) {
                throw mismatch("text");
            }
            return node.asText();
        }

        private TypeMismatchException mismatch(String expected) {
            return new TypeMismatchException(key, expected, node.getNodeType().name().toLowerCase(Locale.ROOT));
        }

        @Override
        public String toString() {
            return node.toString();
        }
    }
}
