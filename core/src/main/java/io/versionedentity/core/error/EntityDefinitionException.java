package io.versionedentity.core.error;

/** Thrown when an entity definition is structurally invalid (bad YAML, missing fields, bad keys). */
public final class EntityDefinitionException extends EntityLoadException {

    private static final long serialVersionUID = 1L;

    public EntityDefinitionException(String message, String entityId, String source) {
        super(message, entityId, source);
    }

    public EntityDefinitionException(String message, Throwable cause, String entityId, String source) {
        super(message, cause, entityId, source);
    }
}
