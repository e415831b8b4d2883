package no.cantara.mnoda.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;

/**
 * A file or other resource produced or consumed by a record.
 *
 * @param uri      location of the resource, never empty
 * @param mimeType the MIME type, or the empty string when unknown
 * @param tags     tags in declaration order
 */
public record FileReference(String uri, String mimeType, List<String> tags) {

    static final String TYPE_NAME = "File";
    static final String URI_KEY = "uri";
    static final String MIMETYPE_KEY = "mimetype";
    static final String TAGS_KEY = "tags";

    public FileReference {
        if (uri == null || uri.isEmpty()) {
            throw new IllegalArgumentException("File uri must not be empty");
        }
        mimeType = mimeType != null ? mimeType : "";
        tags = tags != null ? List.copyOf(tags) : List.of();
    }

    public FileReference(String uri) {
        this(uri, "", List.of());
    }

    public static FileReference fromJson(JsonNode json) {
        JsonFields.requireObject(json, "files", TYPE_NAME);
        return new FileReference(
                JsonFields.getRequiredString(URI_KEY, json, TYPE_NAME),
                JsonFields.getOptionalString(MIMETYPE_KEY, json, TYPE_NAME),
                JsonFields.getOptionalStringList(TAGS_KEY, json, TYPE_NAME));
    }

    public FileReference withMimeType(String mimeType) {
        return new FileReference(uri, mimeType, tags);
    }

    public FileReference withTags(List<String> tags) {
        return new FileReference(uri, mimeType, tags);
    }

    public ObjectNode toJson() {
        ObjectNode json = JsonFields.NODES.objectNode();
        json.put(URI_KEY, uri);
        if (!mimeType.isEmpty()) {
            json.put(MIMETYPE_KEY, mimeType);
        }
        if (!tags.isEmpty()) {
            json.set(TAGS_KEY, JsonFields.stringArray(tags));
        }
        return json;
    }
}
