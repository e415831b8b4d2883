package no.cantara.mnoda;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import no.cantara.mnoda.model.Document;
import no.cantara.mnoda.model.MnodaFormatException;
import no.cantara.mnoda.model.RecordLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads and saves Mnoda documents as UTF-8 JSON.
 *
 * <p>File-system failures surface as {@link IOException}; text that is not
 * JSON, or JSON that does not follow the schema, surfaces as
 * {@link MnodaFormatException}.
 */
public final class MnodaDocuments {

    private static final Logger LOGGER = LoggerFactory.getLogger(MnodaDocuments.class);

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);

    private MnodaDocuments() {}

    /** Loads a document, decoding every record type this library knows. */
    public static Document load(Path path) throws IOException {
        return load(path, RecordLoader.withAllKnownTypes());
    }

    public static Document load(Path path, RecordLoader recordLoader) throws IOException {
        LOGGER.debug("Loading document from {}", path);
        try (InputStream is = Files.newInputStream(path)) {
            Document document = load(is, recordLoader);
            LOGGER.debug("Loaded {} record(s) and {} relationship(s) from {}",
                    document.getRecords().size(), document.getRelationships().size(), path);
            return document;
        }
    }

    public static Document load(InputStream is, RecordLoader recordLoader) throws IOException {
        JsonNode json;
        try {
            json = MAPPER.readTree(is);
        } catch (JsonProcessingException e) {
            throw notJson(e);
        }
        return Document.fromJson(json, recordLoader);
    }

    public static Document parse(String text, RecordLoader recordLoader) {
        JsonNode json;
        try {
            json = MAPPER.readTree(text);
        } catch (JsonProcessingException e) {
            throw notJson(e);
        }
        return Document.fromJson(json, recordLoader);
    }

    /** Writes {@code document} to {@code path}, replacing any existing file. */
    public static void save(Document document, Path path) throws IOException {
        LOGGER.debug("Saving {} record(s) and {} relationship(s) to {}",
                document.getRecords().size(), document.getRelationships().size(), path);
        try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            MAPPER.writeValue(writer, document.toJson());
        }
    }

    public static String toJsonString(Document document, boolean pretty) {
        try {
            return pretty
                    ? MAPPER.writer(SerializationFeature.INDENT_OUTPUT).writeValueAsString(document.toJson())
                    : MAPPER.writeValueAsString(document.toJson());
        } catch (JsonProcessingException e) {
            // A tree built from JsonNodeFactory always serialises.
            throw new UncheckedIOException(e);
        }
    }

    private static MnodaFormatException notJson(JsonProcessingException e) {
        return new MnodaFormatException("document", "Document",
                "Document is not valid JSON: " + e.getOriginalMessage(), e);
    }
}
