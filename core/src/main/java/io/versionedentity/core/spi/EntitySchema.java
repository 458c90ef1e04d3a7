package io.versionedentity.core.spi;

import com.fasterxml.jackson.databind.JsonNode;
import io.versionedentity.core.model.ValidationOutcome;
import io.versionedentity.core.schema.TransformingSchema;
import java.util.function.UnaryOperator;

/**
 * Structural validation contract consumed by the migration engine. The engine and the entity
 * facade need only {@link #validate}; composition ({@link #withTransform} and embedding inside
 * {@link io.versionedentity.core.schema.CompositeSchema}) is used by entity references.
 *
 * <p>Implementations MUST be reentrant and MUST NOT mutate the validated value.
 */
@FunctionalInterface
public interface EntitySchema {

    /**
     * Validates a value.
     *
     * @param value the value to check, never {@code null} (JSON null is {@code NullNode})
     * @return accepted with the effective output value, or rejected with structured detail
     */
    ValidationOutcome validate(JsonNode value);

    /** Returns whether {@code value} is accepted. */
    default boolean test(JsonNode value) {
        return validate(value).isAccepted();
    }

    /**
     * Returns a schema that validates like this one and, on acceptance, replaces the output with
     * {@code transform} applied to it.
     */
    default EntitySchema withTransform(UnaryOperator<JsonNode> transform) {
        return new TransformingSchema(this, transform);
    }
}
