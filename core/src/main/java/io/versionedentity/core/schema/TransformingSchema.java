package io.versionedentity.core.schema;

import com.fasterxml.jackson.databind.JsonNode;
import io.versionedentity.core.model.ValidationOutcome;
import io.versionedentity.core.spi.EntitySchema;
import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * Validates with a delegate and, on acceptance, replaces the output with a transform of it. The
 * transform only runs on accepted values; exceptions it throws propagate unchanged.
 */
public final class TransformingSchema implements EntitySchema {

    private final EntitySchema delegate;
    private final UnaryOperator<JsonNode> transform;

    public TransformingSchema(EntitySchema delegate, UnaryOperator<JsonNode> transform) {
        this.delegate = Objects.requireNonNull(delegate, "delegate must not be null");
        this.transform = Objects.requireNonNull(transform, "transform must not be null");
    }

    @Override
    public ValidationOutcome validate(JsonNode value) {
        ValidationOutcome outcome = delegate.validate(value);
        if (outcome.isRejected()) {
            return outcome;
        }
        return ValidationOutcome.accepted(transform.apply(outcome.value()));
    }
}
