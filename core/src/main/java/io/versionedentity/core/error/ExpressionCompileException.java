package io.versionedentity.core.error;

/** Thrown when an upgrade or resolver expression fails to compile, or names an unknown engine. */
public final class ExpressionCompileException extends EntityLoadException {

    private static final long serialVersionUID = 1L;

    public ExpressionCompileException(String message, String entityId, String source) {
        super(message, entityId, source);
    }

    public ExpressionCompileException(String message, Throwable cause, String entityId, String source) {
        super(message, cause, entityId, source);
    }
}
