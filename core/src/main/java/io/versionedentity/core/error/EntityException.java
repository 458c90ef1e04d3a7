package io.versionedentity.core.error;

/**
 * Abstract base for all versioned-entity exceptions. Never thrown directly; use the concrete
 * subclasses under {@link EntityLoadException} or {@link EntityEvalException}.
 */
public abstract class EntityException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Phase in which the error occurred. */
    public enum Phase {
        LOAD,
        EVALUATION
    }

    private final String entityId;
    private final Phase phase;

    protected EntityException(String message, String entityId, Phase phase) {
        super(message);
        this.entityId = entityId;
        this.phase = phase;
    }

    protected EntityException(String message, Throwable cause, String entityId, Phase phase) {
        super(message, cause);
        this.entityId = entityId;
        this.phase = phase;
    }

    /** The entity that triggered the error, or {@code null} if not yet identified. */
    public String entityId() {
        return entityId;
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }

    /** The phase in which the error occurred. */
    public Phase phase() {
        return phase;
    }
}
