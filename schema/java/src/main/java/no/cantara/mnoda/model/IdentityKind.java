package no.cantara.mnoda.model;

/**
 * Scope in which an {@link Identity} is unique.
 */
public enum IdentityKind {
    /** Unique within one document; replaced by a global id when ingested into a database. */
    LOCAL,
    /** Unique within a database. */
    GLOBAL
}
