package no.cantara.mnoda.model;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Maps record type tags to the factories that decode them.
 *
 * <p>A record whose type has no registered factory is decoded as a plain
 * {@link Record} through {@link #FALLBACK}, so documents naming unknown or
 * retired types still load.
 *
 * <p>Not thread-safe. Register all types before sharing a loader.
 */
public class RecordLoader {

    private static final Logger LOGGER = LoggerFactory.getLogger(RecordLoader.class);

    /** Decodes any record as the base type. */
    public static final RecordFactory FALLBACK = Record::new;

    private final Map<String, RecordFactory> factories = new HashMap<>();

    /**
     * @return a loader that knows every record type in this library
     */
    public static RecordLoader withAllKnownTypes() {
        RecordLoader loader = new RecordLoader();
        loader.addTypeLoader(Run.TYPE, Run::new);
        return loader;
    }

    /** Registers the factory for {@code type}, replacing any earlier one. */
    public void addTypeLoader(String type, RecordFactory factory) {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(factory, "factory");
        if (factories.put(type, factory) != null) {
            LOGGER.debug("Replaced record factory for type '{}'", type);
        }
    }

    public boolean canLoad(String type) {
        return factories.containsKey(type);
    }

    /** @return the registered types, unordered */
    public Set<String> knownTypes() {
        return Set.copyOf(factories.keySet());
    }

    /** @return the factory for {@code type}, or {@link #FALLBACK} */
    public RecordFactory factoryFor(String type) {
        return factories.getOrDefault(type, FALLBACK);
    }

    /**
     * Decodes a record, dispatching on its {@code type}.
     *
     * @throws MnodaFormatException if {@code type} is missing or the record is malformed
     */
    public Record load(JsonNode json) {
        JsonFields.requireObject(json, "records", Record.TYPE_NAME);
        String type = JsonFields.getRequiredString(Record.TYPE_KEY, json, Record.TYPE_NAME);
        if (!canLoad(type)) {
            LOGGER.debug("No factory for record type '{}'; loading as a plain record", type);
        }
        return factoryFor(type).create(json);
    }
}
