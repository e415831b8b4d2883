package no.cantara.mnoda.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Field readers shared by every schema type, including Record subtypes
 * defined outside this package. Each reader names the field and the
 * enclosing type in the exception it throws.
 */
public final class JsonFields {

    static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private JsonFields() {}

    public static String getRequiredString(String key, JsonNode json, String typeName) {
        JsonNode value = json.get(key);
        if (value == null || value.isNull()) {
            throw new MnodaFormatException.MissingField(key, typeName);
        }
        if (!value.isTextual()) {
            throw new MnodaFormatException.InvalidFieldType(key, typeName, "a string", kindOf(value));
        }
        String text = value.textValue();
        if (text.isEmpty()) {
            throw new MnodaFormatException(key, typeName,
                    "The field '" + key + "' in " + typeName + " must not be empty");
        }
        return text;
    }

    /** Returns the string at {@code key}, or the empty string when the key is absent. */
    public static String getOptionalString(String key, JsonNode json, String typeName) {
        JsonNode value = json.get(key);
        if (value == null || value.isNull()) {
            return "";
        }
        if (!value.isTextual()) {
            throw new MnodaFormatException.InvalidFieldType(key, typeName, "a string", kindOf(value));
        }
        return value.textValue();
    }

    /** Returns the array at {@code key}, or an empty array when the key is absent. */
    public static ArrayNode getOptionalArray(String key, JsonNode json, String typeName) {
        JsonNode value = json.get(key);
        if (value == null || value.isNull()) {
            return NODES.arrayNode();
        }
        if (!value.isArray()) {
            throw new MnodaFormatException.InvalidFieldType(key, typeName, "an array", kindOf(value));
        }
        return (ArrayNode) value;
    }

    public static List<String> getOptionalStringList(String key, JsonNode json, String typeName) {
        List<String> result = new ArrayList<>();
        for (JsonNode element : getOptionalArray(key, json, typeName)) {
            if (!element.isTextual()) {
                throw new MnodaFormatException.InvalidFieldType(key, typeName,
                        "an array of strings", kindOf(element));
            }
            result.add(element.textValue());
        }
        return result;
    }

    /** Fails unless {@code json} is a JSON object. */
    public static void requireObject(JsonNode json, String fieldName, String typeName) {
        if (json == null || !json.isObject()) {
            throw new MnodaFormatException.InvalidFieldType(fieldName, typeName, "an object",
                    json == null ? "missing" : kindOf(json));
        }
    }

    public static ArrayNode stringArray(List<String> values) {
        ArrayNode array = NODES.arrayNode();
        values.forEach(array::add);
        return array;
    }

    static String kindOf(JsonNode node) {
        return node.getNodeType().name().toLowerCase(Locale.ROOT);
    }
}
