package no.cantara.mnoda.model;

import java.util.Objects;

/**
 * Identifies a record, either within one document ({@link IdentityKind#LOCAL})
 * or within a database ({@link IdentityKind#GLOBAL}).
 */
public record Identity(String value, IdentityKind kind) {

    public Identity {
        Objects.requireNonNull(kind, "kind");
        if (value == null || value.isEmpty()) {
            throw new IllegalArgumentException("Identity value must not be empty");
        }
    }

    public static Identity local(String value) {
        return new Identity(value, IdentityKind.LOCAL);
    }

    public static Identity global(String value) {
        return new Identity(value, IdentityKind.GLOBAL);
    }

    public boolean isLocal() { return kind == IdentityKind.LOCAL; }

    @Override
    public String toString() {
        return (isLocal() ? "local:" : "") + value;
    }
}
