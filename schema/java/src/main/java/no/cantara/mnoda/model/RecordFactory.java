package no.cantara.mnoda.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Builds a record, possibly of a subtype, from its JSON object.
 */
@FunctionalInterface
public interface RecordFactory {

    /**
     * @throws MnodaFormatException if the JSON is not a valid record of this type
     */
    Record create(JsonNode json);
}
