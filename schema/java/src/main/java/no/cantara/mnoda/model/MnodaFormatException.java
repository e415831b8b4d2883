package no.cantara.mnoda.model;

/**
 * Thrown when JSON does not have the shape the Mnoda schema requires.
 *
 * <p>Every decode failure is raised at the point it is found and aborts the
 * whole decode; there is no partial recovery.
 */
public class MnodaFormatException extends IllegalArgumentException {

    private final String fieldName;
    private final String typeName;

    public MnodaFormatException(String fieldName, String typeName, String message) {
        super(message);
        this.fieldName = fieldName;
        this.typeName = typeName;
    }

    public MnodaFormatException(String fieldName, String typeName, String message, Throwable cause) {
        super(message, cause);
        this.fieldName = fieldName;
        this.typeName = typeName;
    }

    /** The JSON key at fault. */
    public String fieldName() { return fieldName; }

    /** The schema type whose JSON was being decoded, e.g. {@code Record} or {@code Datum}. */
    public String typeName() { return typeName; }

    /** Thrown when a required key is absent. */
    public static class MissingField extends MnodaFormatException {
        public MissingField(String fieldName, String typeName) {
            super(fieldName, typeName,
                    "Missing required field '" + fieldName + "' in " + typeName);
        }

        public MissingField(String fieldName, String typeName, String message) {
            super(fieldName, typeName, message);
        }
    }

    /** Thrown when a key is present but holds the wrong kind of JSON value. */
    public static class InvalidFieldType extends MnodaFormatException {
        private final String expectedKind;
        private final String actualKind;

        public InvalidFieldType(String fieldName, String typeName, String expectedKind, String actualKind) {
            super(fieldName, typeName,
                    "The field '" + fieldName + "' in " + typeName + " must be " + expectedKind
                            + ". Found '" + actualKind + "' instead.");
            this.expectedKind = expectedKind;
            this.actualKind = actualKind;
        }

        public String expectedKind() { return expectedKind; }
        public String actualKind() { return actualKind; }
    }
}
