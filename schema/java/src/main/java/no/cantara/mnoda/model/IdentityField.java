package no.cantara.mnoda.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Optional;

/**
 * A JSON field holding an {@link Identity}. The kind is carried by which of
 * two keys is used: the global key (e.g. {@code id}) or the local key
 * (e.g. {@code local_id}). This is the only place that encoding exists.
 */
final class IdentityField {

    static final IdentityField RECORD_ID = new IdentityField("id", "local_id");
    static final IdentityField SUBJECT = new IdentityField("subject", "local_subject");
    static final IdentityField OBJECT = new IdentityField("object", "local_object");

    private final String globalKey;
    private final String localKey;

    IdentityField(String globalKey, String localKey) {
        this.globalKey = globalKey;
        this.localKey = localKey;
    }

    String globalKey() { return globalKey; }

    String localKey() { return localKey; }

    /** The global key wins when both keys are present. */
    Optional<Identity> readOptional(JsonNode json, String typeName) {
        if (json.hasNonNull(globalKey)) {
            return Optional.of(Identity.global(JsonFields.getRequiredString(globalKey, json, typeName)));
        }
        if (json.hasNonNull(localKey)) {
            return Optional.of(Identity.local(JsonFields.getRequiredString(localKey, json, typeName)));
        }
        return Optional.empty();
    }

    Identity read(JsonNode json, String typeName) {
        return readOptional(json, typeName).orElseThrow(() -> missing(typeName));
    }

    MnodaFormatException.MissingField missing(String typeName) {
        return new MnodaFormatException.MissingField(globalKey, typeName,
                "Missing required field '" + globalKey + "' or '" + localKey + "' in " + typeName);
    }

    /** Writes exactly one of the two keys, chosen by the identity's kind. */
    void write(ObjectNode json, Identity identity) {
        json.put(identity.isLocal() ? localKey : globalKey, identity.value());
    }
}
