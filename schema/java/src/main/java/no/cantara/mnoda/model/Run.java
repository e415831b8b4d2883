package no.cantara.mnoda.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.UUID;

/**
 * A single execution of a simulation code, type tag {@value #TYPE}.
 *
 * <pre>{"type": "run", "id": "run_1024", "application": "kripke", "version": "1.2.3", "user": "jdoe"}</pre>
 *
 * <p>A run without {@code id} or {@code local_id} gets a generated local id.
 */
public class Run extends Record {

    public static final String TYPE = "run";

    static final String TYPE_NAME = "Run";
    static final String APPLICATION_KEY = "application";
    static final String VERSION_KEY = "version";
    static final String USER_KEY = "user";

    private final String application;
    private final String version;
    private final String user;

    public Run(Identity id, String application, String version, String user) {
        super(id, TYPE);
        if (application == null || application.isEmpty()) {
            throw new IllegalArgumentException("Run application must not be empty");
        }
        this.application = application;
        this.version = version != null ? version : "";
        this.user = user != null ? user : "";
    }

    public Run(JsonNode json) {
        super(json, TYPE_NAME, () -> Identity.local(UUID.randomUUID().toString()));
        this.application = JsonFields.getRequiredString(APPLICATION_KEY, json, TYPE_NAME);
        this.version = JsonFields.getOptionalString(VERSION_KEY, json, TYPE_NAME);
        this.user = JsonFields.getOptionalString(USER_KEY, json, TYPE_NAME);
    }

    public String getApplication() { return application; }

    /** @return the application version, or the empty string */
    public String getVersion() { return version; }

    /** @return the user who ran it, or the empty string */
    public String getUser() { return user; }

    @Override
    public ObjectNode toJson() {
        ObjectNode json = super.toJson();
        json.put(APPLICATION_KEY, application);
        if (!version.isEmpty()) {
            json.put(VERSION_KEY, version);
        }
        if (!user.isEmpty()) {
            json.put(USER_KEY, user);
        }
        return json;
    }
}
