package io.versionedentity.core.error;

/**
 * Abstract parent for definition-time errors. Thrown while an entity is being assembled, either
 * through the registry builder or by {@code EntityDefinitionParser}. Carries an additional {@code
 * source} field identifying the file or resource that caused the error.
 */
public abstract class EntityLoadException extends EntityException {

    private static final long serialVersionUID = 1L;

    private final String source;

    protected EntityLoadException(String message, String entityId, String source) {
        super(message, entityId, Phase.LOAD);
        this.source = source;
    }

    protected EntityLoadException(String message, Throwable cause, String entityId, String source) {
        super(message, cause, entityId, Phase.LOAD);
        this.source = source;
    }

    /** The file path or resource identifier that caused the error, or {@code null} for code-built entities. */
    public String source() {
        return source;
    }
}
