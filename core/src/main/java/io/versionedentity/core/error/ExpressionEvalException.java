package io.versionedentity.core.error;

/** Thrown when a compiled upgrade expression fails at runtime. */
public final class ExpressionEvalException extends EntityEvalException {

    private static final long serialVersionUID = 1L;

    public ExpressionEvalException(String message, String entityId, Integer version) {
        super(message, entityId, version);
    }

    public ExpressionEvalException(String message, Throwable cause, String entityId, Integer version) {
        super(message, cause, entityId, version);
    }
}
