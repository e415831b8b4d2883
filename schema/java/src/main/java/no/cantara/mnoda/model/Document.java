package no.cantara.mnoda.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * The top-level object of a Mnoda JSON file: a list of records and a list
 * of relationships.
 *
 * <pre>{"records": [], "relationships": []}</pre>
 *
 * <p>Both lists keep insertion order. The document owns its records; no
 * de-duplication or identity check is done here (see
 * {@code MnodaValidator} for that).
 */
public class Document {

    static final String TYPE_NAME = "Document";
    static final String RECORDS_KEY = "records";
    static final String RELATIONSHIPS_KEY = "relationships";

    private final List<Record> records = new ArrayList<>();
    private final List<Relationship> relationships = new ArrayList<>();

    public Document() {}

    /**
     * Decodes a document, using {@code recordLoader} to pick the type of each record.
     * Missing arrays are treated as empty. The first malformed entry aborts the decode.
     *
     * @throws MnodaFormatException if the JSON does not follow the schema
     */
    public static Document fromJson(JsonNode json, RecordLoader recordLoader) {
        Objects.requireNonNull(recordLoader, "recordLoader");
        JsonFields.requireObject(json, "document", TYPE_NAME);
        Document document = new Document();
        for (JsonNode record : JsonFields.getOptionalArray(RECORDS_KEY, json, TYPE_NAME)) {
            document.add(recordLoader.load(record));
        }
        for (JsonNode relationship : JsonFields.getOptionalArray(RELATIONSHIPS_KEY, json, TYPE_NAME)) {
            document.add(Relationship.fromJson(relationship));
        }
        return document;
    }

    public void add(Record record) {
        records.add(Objects.requireNonNull(record, "record"));
    }

    public void add(Relationship relationship) {
        relationships.add(Objects.requireNonNull(relationship, "relationship"));
    }

    public List<Record> getRecords() { return Collections.unmodifiableList(records); }

    public List<Relationship> getRelationships() { return Collections.unmodifiableList(relationships); }

    public ObjectNode toJson() {
        ObjectNode json = JsonFields.NODES.objectNode();
        ArrayNode recordArray = json.putArray(RECORDS_KEY);
        records.forEach(r -> recordArray.add(r.toJson()));
        ArrayNode relationshipArray = json.putArray(RELATIONSHIPS_KEY);
        relationships.forEach(r -> relationshipArray.add(r.toJson()));
        return json;
    }
}
