package io.typedhttp.client.codec;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.BinaryNode;
import org.jspecify.annotations.Nullable;

/**
 * Flattens an input object into ordered key/value pairs for the form and query formats.
 * <p>
 * Properties keep their declaration order, {@code null} values are omitted, array elements
 * repeat the key and nested objects are addressed as {@code parent[child]}.
 */
final class FormFields {

    /**
     * One flattened field. Exactly one of {@code text} and {@code binary} is set.
     */
    record Field(String name, @Nullable String text, byte @Nullable [] binary) {

        boolean isBinary() {
            return binary != null;
        }
    }

    private FormFields() {
    }

    static List<Field> flatten(Object input, ObjectMapper mapper) {
        JsonNode root = mapper.valueToTree(input);
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("Form and query input must be an object, got "
                    + input.getClass().getName());
        }
        List<Field> fields = new ArrayList<>();
        appendObject(null, root, fields);
        return fields;
    }

    private static void appendObject(@Nullable String prefix, JsonNode node, List<Field> fields) {
        Iterator<Map.Entry<String, JsonNode>> properties = node.fields();
        while (properties.hasNext()) {
            Map.Entry<String, JsonNode> property = properties.next();
            String name = prefix == null ? property.getKey() : prefix + "[" + property.getKey() + "]";
            appendValue(name, property.getValue(), fields);
        }
    }

    private static void appendValue(String name, @Nullable JsonNode value, List<Field> fields) {
        if (value == null || value.isNull() || value.isMissingNode()) {
            return;
        }
        if (value.isObject()) {
            appendObject(name, value, fields);
        } else if (value.isArray()) {
            for (JsonNode element : value) {
                appendValue(name, element, fields);
            }
        } else if (value instanceof BinaryNode binary) {
            fields.add(new Field(name, null, binary.binaryValue()));
        } else {
            fields.add(new Field(name, value.asText(), null));
        }
    }
}
