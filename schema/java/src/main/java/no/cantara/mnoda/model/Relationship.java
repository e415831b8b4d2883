package no.cantara.mnoda.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Objects;

/**
 * A directed link between two records, read as
 * "{@code subject} {@code predicate} {@code object}", e.g.
 * "Task_22 contains Run_1024". Predicates are meant to be in the active voice.
 *
 * <p>The JSON form names each endpoint by its value only. Endpoints decoded
 * from {@code subject}/{@code object} are global; {@code local_subject} and
 * {@code local_object} are also accepted and decode as local.
 */
public record Relationship(Identity subject, String predicate, Identity object) {

    static final String TYPE_NAME = "Relationship";
    static final String PREDICATE_KEY = "predicate";

    public Relationship {
        Objects.requireNonNull(subject, "subject");
        Objects.requireNonNull(object, "object");
        if (predicate == null || predicate.isEmpty()) {
            throw new IllegalArgumentException("Relationship predicate must not be empty");
        }
    }

    public static Relationship fromJson(JsonNode json) {
        JsonFields.requireObject(json, "relationships", TYPE_NAME);
        return new Relationship(
                IdentityField.SUBJECT.read(json, TYPE_NAME),
                JsonFields.getRequiredString(PREDICATE_KEY, json, TYPE_NAME),
                IdentityField.OBJECT.read(json, TYPE_NAME));
    }

    public ObjectNode toJson() {
        ObjectNode json = JsonFields.NODES.objectNode();
        json.put(IdentityField.SUBJECT.globalKey(), subject.value());
        json.put(PREDICATE_KEY, predicate);
        json.put(IdentityField.OBJECT.globalKey(), object.value());
        return json;
    }
}
