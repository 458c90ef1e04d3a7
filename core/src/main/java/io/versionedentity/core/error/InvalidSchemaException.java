package io.versionedentity.core.error;

/** Thrown when a JSON Schema document cannot be compiled (JSON Schema 2020-12). */
public final class InvalidSchemaException extends EntityLoadException {

    private static final long serialVersionUID = 1L;

    public InvalidSchemaException(String message, String entityId, String source) {
        super(message, entityId, source);
    }

    public InvalidSchemaException(String message, Throwable cause, String entityId, String source) {
        super(message, cause, entityId, source);
    }
}
