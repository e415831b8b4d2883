package no.cantara.mnoda.model;

import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static no.cantara.mnoda.model.TestJson.json;
import static org.junit.jupiter.api.Assertions.*;

class FileReferenceTest {

    @Test
    void decodesAllFields() {
        FileReference file = FileReference.fromJson(json(Map.of(
                "uri", "out/plot.png", "mimetype", "image/png", "tags", List.of("plot"))));
        assertEquals("out/plot.png", file.uri());
        assertEquals("image/png", file.mimeType());
        assertEquals(List.of("plot"), file.tags());
    }

    @Test
    void decodesUriOnly() {
        FileReference file = FileReference.fromJson(json(Map.of("uri", "uri1")));
        assertEquals("", file.mimeType());
        assertTrue(file.tags().isEmpty());
    }

    @Test
    void missingUriFails() {
        var e = assertThrows(MnodaFormatException.MissingField.class,
                () -> FileReference.fromJson(json(Map.of("mimetype", "text/plain"))));
        assertEquals("uri", e.fieldName());
        assertEquals("File", e.typeName());
    }

    @Test
    void nonStringTagFails() {
        var e = assertThrows(MnodaFormatException.InvalidFieldType.class,
                () -> FileReference.fromJson(json(Map.of("uri", "u", "tags", List.of(Map.of())))));
        assertEquals("tags", e.fieldName());
        assertEquals("object", e.actualKind());
    }

    @Test
    void tagsMustBeAnArray() {
        var e = assertThrows(MnodaFormatException.InvalidFieldType.class,
                () -> FileReference.fromJson(json(Map.of("uri", "u", "tags", "plot"))));
        assertEquals("string", e.actualKind());
    }

    @Test
    void encodesOnlyPresentFields() {
        ObjectNode bare = new FileReference("uri2").toJson();
        assertEquals(json(Map.of("uri", "uri2")), bare);

        ObjectNode full = new FileReference("uri1").withMimeType("mt1").withTags(List.of("t")).toJson();
        assertEquals(json(Map.of("uri", "uri1", "mimetype", "mt1", "tags", List.of("t"))), full);
    }

    @Test
    void rejectsEmptyUri() {
        assertThrows(IllegalArgumentException.class, () -> new FileReference(""));
    }
}
