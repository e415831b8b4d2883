package no.cantara.mnoda.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static no.cantara.mnoda.model.TestJson.json;
import static no.cantara.mnoda.model.TestJson.parse;
import static org.junit.jupiter.api.Assertions.*;

class DocumentTest {

    @Test
    void emptyDocumentEncodesBothArrays() {
        assertEquals(parse("{\"records\":[],\"relationships\":[]}"), new Document().toJson());
    }

    @Test
    void roundTripsRecordsAndRelationship() {
        Document document = new Document();
        document.add(new Record(Identity.global("R1"), "task"));
        document.add(new Record(Identity.local("r2"), "msub"));
        document.add(new Relationship(Identity.global("R1"), "contains", Identity.local("r2")));

        ObjectNode encoded = document.toJson();
        assertEquals(json(Map.of(
                "records", List.of(
                        Map.of("type", "task", "id", "R1"),
                        Map.of("type", "msub", "local_id", "r2")),
                "relationships", List.of(
                        Map.of("subject", "R1", "predicate", "contains", "object", "r2")))),
                encoded);

        Document decoded = Document.fromJson(encoded, new RecordLoader());
        assertEquals(2, decoded.getRecords().size());
        assertEquals(Identity.global("R1"), decoded.getRecords().get(0).getId());
        assertEquals(Identity.local("r2"), decoded.getRecords().get(1).getId());
        Relationship rel = decoded.getRelationships().get(0);
        assertEquals("R1", rel.subject().value());
        assertEquals("contains", rel.predicate());
        assertEquals("r2", rel.object().value());
    }

    @Test
    void dispatchesThroughLoader() {
        JsonNode json = json(Map.of("records", List.of(
                Map.of("type", "run", "id", "r1", "application", "app"),
                Map.of("type", "msub", "id", "m1"))));
        Document document = Document.fromJson(json, RecordLoader.withAllKnownTypes());
        assertInstanceOf(Run.class, document.getRecords().get(0));
        assertEquals(Record.class, document.getRecords().get(1).getClass());
        assertTrue(document.getRelationships().isEmpty());
    }

    @Test
    void preservesRecordOrder() {
        JsonNode json = json(Map.of("records", List.of(
                Map.of("type", "t", "id", "c"),
                Map.of("type", "t", "id", "a"),
                Map.of("type", "t", "id", "b"))));
        Document document = Document.fromJson(json, new RecordLoader());
        assertEquals(List.of("c", "a", "b"),
                document.getRecords().stream().map(r -> r.getId().value()).toList());
        assertEquals(json, document.toJson().without("relationships"));
    }

    @Test
    void missingArraysMeanEmpty() {
        Document document = Document.fromJson(parse("{}"), new RecordLoader());
        assertTrue(document.getRecords().isEmpty());
        assertTrue(document.getRelationships().isEmpty());
    }

    @Test
    void malformedRecordAbortsDocument() {
        JsonNode json = json(Map.of("records", List.of(
                Map.of("type", "t", "id", "ok"),
                Map.of("type", "t"))));
        assertThrows(MnodaFormatException.MissingField.class, () -> Document.fromJson(json, new RecordLoader()));
    }

    @Test
    void malformedRelationshipAbortsDocument() {
        JsonNode json = json(Map.of("relationships", List.of(Map.of("subject", "a", "object", "b"))));
        assertThrows(MnodaFormatException.MissingField.class, () -> Document.fromJson(json, new RecordLoader()));
    }

    @Test
    void topLevelMustBeObject() {
        var e = assertThrows(MnodaFormatException.InvalidFieldType.class,
                () -> Document.fromJson(parse("[]"), new RecordLoader()));
        assertEquals("array", e.actualKind());
    }

    @Test
    void recordsMustBeArray() {
        var e = assertThrows(MnodaFormatException.InvalidFieldType.class,
                () -> Document.fromJson(parse("{\"records\": {}}"), new RecordLoader()));
        assertEquals("records", e.fieldName());
    }

    @Test
    void listsAreReadOnly() {
        Document document = new Document();
        assertThrows(UnsupportedOperationException.class,
                () -> document.getRelationships().add(new Relationship(Identity.global("a"), "p", Identity.global("b"))));
    }
}
