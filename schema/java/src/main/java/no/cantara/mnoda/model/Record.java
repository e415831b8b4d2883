package no.cantara.mnoda.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * The base entity of a Mnoda document: an identity, a type tag, data, files
 * and free-form user-defined JSON.
 *
 * <pre>{@code
 * {
 *     "type": "msub",
 *     "local_id": "msub_1",
 *     "data": [{"name": "temperature", "value": 293.15, "units": "K"}],
 *     "files": [{"uri": "out/plot.png", "mimetype": "image/png"}],
 *     "user_defined": {"anything": ["at", "all"]}
 * }
 * }</pre>
 *
 * <p>Records form an open family. A subtype adds its own keys by calling
 * {@link #Record(JsonNode, String, Supplier)} from its JSON constructor and
 * appending to {@code super.toJson()}; it becomes loadable once its factory
 * is registered with a {@link RecordLoader}. A record is owned by one
 * {@link Document} and is not copied.
 */
public class Record {

    static final String TYPE_NAME = "Record";
    static final String TYPE_KEY = "type";
    static final String DATA_KEY = "data";
    static final String FILES_KEY = "files";
    static final String USER_DEFINED_KEY = "user_defined";

    private final Identity id;
    private final String type;
    private final List<Datum> data = new ArrayList<>();
    private final List<FileReference> files = new ArrayList<>();
    private JsonNode userDefined = NullNode.getInstance();

    public Record(Identity id, String type) {
        this.id = Objects.requireNonNull(id, "id");
        if (type == null || type.isEmpty()) {
            throw new IllegalArgumentException("Record type must not be empty");
        }
        this.type = type;
    }

    /**
     * Decodes a record. Either {@code id} or {@code local_id} must be present.
     *
     * @throws MnodaFormatException if a required field is missing or malformed
     */
    public Record(JsonNode json) {
        this(json, TYPE_NAME, null);
    }

    /**
     * Decodes the fields common to all records.
     *
     * @param json            the record as a JSON object
     * @param typeName        name used in error messages
     * @param defaultIdentity supplies the identity when neither identity key
     *                        is present, or {@code null} to make that an error
     */
    protected Record(JsonNode json, String typeName, Supplier<Identity> defaultIdentity) {
        JsonFields.requireObject(json, "records", typeName);
        this.type = JsonFields.getRequiredString(TYPE_KEY, json, typeName);
        Optional<Identity> identity = IdentityField.RECORD_ID.readOptional(json, typeName);
        if (identity.isPresent()) {
            this.id = identity.get();
        } else if (defaultIdentity != null) {
            this.id = defaultIdentity.get();
        } else {
            throw IdentityField.RECORD_ID.missing(typeName);
        }
        for (JsonNode datum : JsonFields.getOptionalArray(DATA_KEY, json, typeName)) {
            data.add(Datum.fromJson(datum));
        }
        for (JsonNode file : JsonFields.getOptionalArray(FILES_KEY, json, typeName)) {
            files.add(FileReference.fromJson(file));
        }
        JsonNode userDefinedNode = json.get(USER_DEFINED_KEY);
        if (userDefinedNode != null) {
            userDefined = userDefinedNode.deepCopy();
        }
    }

    public Identity getId() { return id; }

    public String getType() { return type; }

    /** @return the data in insertion order, read-only */
    public List<Datum> getData() { return Collections.unmodifiableList(data); }

    /** @return the files in insertion order, read-only */
    public List<FileReference> getFiles() { return Collections.unmodifiableList(files); }

    public void add(Datum datum) {
        data.add(Objects.requireNonNull(datum, "datum"));
    }

    public void add(FileReference file) {
        files.add(Objects.requireNonNull(file, "file"));
    }

    /** @return the first datum with the given name */
    public Optional<Datum> findDatum(String name) {
        return data.stream().filter(d -> d.name().equals(name)).findFirst();
    }

    /**
     * Returns the stored user-defined content itself, not a copy: object and
     * array content may be edited in place. JSON null when nothing was set.
     */
    public JsonNode getUserDefinedContent() { return userDefined; }

    /**
     * Returns the user-defined content as an object for in-place editing.
     * Null content is first replaced by an empty object.
     *
     * @throws IllegalStateException if the content is some other non-object value
     */
    public ObjectNode editUserDefinedContent() {
        if (userDefined.isNull() || userDefined.isMissingNode()) {
            userDefined = JsonFields.NODES.objectNode();
        }
        if (!userDefined.isObject()) {
            throw new IllegalStateException("User-defined content of record " + id
                    + " is " + JsonFields.kindOf(userDefined) + ", not an object");
        }
        return (ObjectNode) userDefined;
    }

    /** Replaces the user-defined content wholesale; {@code null} clears it. */
    public void setUserDefinedContent(JsonNode content) {
        userDefined = content != null ? content : NullNode.getInstance();
    }

    /**
     * Encodes this record. Subtypes append their own keys to the result.
     */
    public ObjectNode toJson() {
        ObjectNode json = JsonFields.NODES.objectNode();
        json.put(TYPE_KEY, type);
        IdentityField.RECORD_ID.write(json, id);
        if (!data.isEmpty()) {
            ArrayNode dataArray = json.putArray(DATA_KEY);
            data.forEach(d -> dataArray.add(d.toJson()));
        }
        if (!files.isEmpty()) {
            ArrayNode filesArray = json.putArray(FILES_KEY);
            files.forEach(f -> filesArray.add(f.toJson()));
        }
        if (!userDefined.isNull() && !userDefined.isMissingNode()) {
            json.set(USER_DEFINED_KEY, userDefined.deepCopy());
        }
        return json;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + type + " " + id + "]";
    }
}
