package no.cantara.mnoda.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;
import java.util.Objects;

/**
 * A named value attached to a record. The value is either a string or a
 * scalar (double); units and tags are optional.
 *
 * <pre>{"name": "density", "value": 2.22, "units": "g/L", "tags": ["input"]}</pre>
 *
 * @param name  the datum name, never empty
 * @param value a {@link String} or a {@link Double}
 * @param units the units, or the empty string when there are none
 * @param tags  tags in declaration order
 */
public record Datum(String name, Object value, String units, List<String> tags) {

    static final String TYPE_NAME = "Datum";
    static final String NAME_KEY = "name";
    static final String VALUE_KEY = "value";
    static final String UNITS_KEY = "units";
    static final String TAGS_KEY = "tags";

    public Datum {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Datum name must not be empty");
        }
        Objects.requireNonNull(value, "value");
        if (value instanceof Number n && !(value instanceof Double)) {
            value = n.doubleValue();
        } else if (!(value instanceof String) && !(value instanceof Double)) {
            throw new IllegalArgumentException(
                    "Datum value must be a string or a number, got " + value.getClass().getSimpleName());
        }
        if (value instanceof Double d && !Double.isFinite(d)) {
            throw new IllegalArgumentException("Datum value must be a finite number, got " + d);
        }
        units = units != null ? units : "";
        tags = tags != null ? List.copyOf(tags) : List.of();
    }

    public Datum(String name, String value) {
        this(name, value, "", List.of());
    }

    public Datum(String name, double value) {
        this(name, value, "", List.of());
    }

    public static Datum fromJson(JsonNode json) {
        JsonFields.requireObject(json, "data", TYPE_NAME);
        String name = JsonFields.getRequiredString(NAME_KEY, json, TYPE_NAME);
        JsonNode valueNode = json.get(VALUE_KEY);
        if (valueNode == null || valueNode.isNull()) {
            throw new MnodaFormatException.MissingField(VALUE_KEY, TYPE_NAME);
        }
        Object value;
        if (valueNode.isTextual()) {
            value = valueNode.textValue();
        } else if (valueNode.isNumber()) {
            double scalar = valueNode.doubleValue();
            if (!Double.isFinite(scalar)) {
                throw new MnodaFormatException.InvalidFieldType(VALUE_KEY, TYPE_NAME,
                        "a finite number", valueNode.asText());
            }
            value = scalar;
        } else {
            throw new MnodaFormatException.InvalidFieldType(VALUE_KEY, TYPE_NAME,
                    "a string or a number", JsonFields.kindOf(valueNode));
        }
        return new Datum(name, value,
                JsonFields.getOptionalString(UNITS_KEY, json, TYPE_NAME),
                JsonFields.getOptionalStringList(TAGS_KEY, json, TYPE_NAME));
    }

    public boolean isScalar() { return value instanceof Double; }

    /**
     * @throws IllegalStateException if this datum holds a scalar
     */
    public String asString() {
        if (value instanceof String s) return s;
        throw new IllegalStateException("Datum '" + name + "' holds a scalar, not a string");
    }

    /**
     * @throws IllegalStateException if this datum holds a string
     */
    public double asScalar() {
        if (value instanceof Double d) return d;
        throw new IllegalStateException("Datum '" + name + "' holds a string, not a scalar");
    }

    public Datum withUnits(String units) {
        return new Datum(name, value, units, tags);
    }

    public Datum withTags(List<String> tags) {
        return new Datum(name, value, units, tags);
    }

    public ObjectNode toJson() {
        ObjectNode json = JsonFields.NODES.objectNode();
        json.put(NAME_KEY, name);
        if (value instanceof Double d) {
            json.put(VALUE_KEY, d);
        } else {
            json.put(VALUE_KEY, (String) value);
        }
        if (!units.isEmpty()) {
            json.put(UNITS_KEY, units);
        }
        if (!tags.isEmpty()) {
            json.set(TAGS_KEY, JsonFields.stringArray(tags));
        }
        return json;
    }
}
