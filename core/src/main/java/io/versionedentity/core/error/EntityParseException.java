package io.versionedentity.core.error;

import io.versionedentity.core.model.ParseError;
import java.util.Objects;

/**
 * Thrown by {@code VersionedEntity.parse} when a value cannot be validated and migrated. Wraps the
 * same {@link ParseError} that {@code safeParse} would have returned.
 */
public final class EntityParseException extends EntityEvalException {

    private static final long serialVersionUID = 1L;

    private final transient ParseError error;

    public EntityParseException(ParseError error, String entityId) {
        super(
                "Failed to parse entity '" + entityId + "': " + Objects.requireNonNull(error, "error").describe(),
                entityId,
                error.version());
        this.error = error;
    }

    /** The parse error that caused this exception. */
    public ParseError error() {
        return error;
    }
}
