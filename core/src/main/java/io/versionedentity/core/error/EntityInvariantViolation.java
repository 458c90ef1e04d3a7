package io.versionedentity.core.error;

/**
 * Thrown when an entity reports a value as a member ({@code is} returns {@code true}) but cannot
 * parse it. This signals a corrupt entity definition, never bad caller data, and is never turned
 * into an ordinary validation rejection.
 */
public final class EntityInvariantViolation extends EntityEvalException {

    private static final long serialVersionUID = 1L;

    public EntityInvariantViolation(String message, String entityId, Integer version) {
        super(message, entityId, version);
    }
}
