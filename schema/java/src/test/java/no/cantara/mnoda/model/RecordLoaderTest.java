package no.cantara.mnoda.model;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static no.cantara.mnoda.model.TestJson.json;
import static org.junit.jupiter.api.Assertions.*;

class RecordLoaderTest {

    @Test
    void unknownTypeLoadsAsBaseRecord() {
        RecordLoader loader = new RecordLoader();
        Record loaded = loader.load(json(Map.of("id", "the ID", "type", "unknownType")));
        assertEquals(Record.class, loaded.getClass());
        assertEquals("unknownType", loaded.getType());
        assertSame(RecordLoader.FALLBACK, loader.factoryFor("unknownType"));
    }

    @Test
    void registeredFactoryIsUsed() {
        RecordLoader loader = new RecordLoader();
        assertFalse(loader.canLoad("TestString"));

        List<String> calls = new ArrayList<>();
        loader.addTypeLoader("TestString", json -> {
            calls.add(json.get("type").textValue());
            return new TestRecord(json);
        });
        assertTrue(loader.canLoad("TestString"));

        Record loaded = loader.load(json(Map.of(
                "id", "the ID", "type", "TestString", TestRecord.VALUE_KEY, "The value")));
        assertEquals(List.of("TestString"), calls);
        TestRecord testRecord = assertInstanceOf(TestRecord.class, loaded);
        assertEquals("The value", testRecord.getValue());
        assertEquals("The value", testRecord.toJson().get(TestRecord.VALUE_KEY).textValue());
    }

    @Test
    void lastRegistrationWins() {
        RecordLoader loader = new RecordLoader();
        loader.addTypeLoader("x", json -> { throw new AssertionError("replaced factory called"); });
        loader.addTypeLoader("x", json -> new Record(Identity.global("fixed"), "x"));
        assertEquals(Identity.global("fixed"), loader.load(json(Map.of("type", "x", "id", "ignored"))).getId());
    }

    @Test
    void missingTypeFails() {
        var e = assertThrows(MnodaFormatException.MissingField.class,
                () -> new RecordLoader().load(json(Map.of("id", "the ID"))));
        assertEquals("type", e.fieldName());
    }

    @Test
    void nonObjectFails() {
        assertThrows(MnodaFormatException.InvalidFieldType.class,
                () -> new RecordLoader().load(TestJson.parse("\"run\"")));
    }

    @Test
    void allKnownTypesIncludesRun() {
        RecordLoader loader = RecordLoader.withAllKnownTypes();
        assertTrue(loader.canLoad("run"));
        assertTrue(loader.knownTypes().contains(Run.TYPE));
        Record loaded = loader.load(json(Map.of("type", "run", "id", "r", "application", "app")));
        assertInstanceOf(Run.class, loaded);
    }
}
