package io.versionedentity.core.error;

/**
 * Abstract parent for per-call evaluation errors raised while checking or migrating a value.
 * Carries an additional {@code version} field naming the entity version being processed.
 */
public abstract class EntityEvalException extends EntityException {

    private static final long serialVersionUID = 1L;

    private final Integer version;

    protected EntityEvalException(String message, String entityId, Integer version) {
        super(message, entityId, Phase.EVALUATION);
        this.version = version;
    }

    protected EntityEvalException(String message, Throwable cause, String entityId, Integer version) {
        super(message, cause, entityId, Phase.EVALUATION);
        this.version = version;
    }

    /** The entity version being processed, or {@code null} if not known. */
    public Integer version() {
        return version;
    }
}
