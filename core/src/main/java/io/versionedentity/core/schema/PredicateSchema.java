package io.versionedentity.core.schema;

import com.fasterxml.jackson.databind.JsonNode;
import io.versionedentity.core.model.ValidationOutcome;
import io.versionedentity.core.model.Violation;
import io.versionedentity.core.spi.EntitySchema;
import java.util.Objects;
import java.util.function.Predicate;

/** Accepts exactly the values a predicate accepts, returning them unchanged. */
public final class PredicateSchema implements EntitySchema {

    /** Keyword reported on rejection. */
    public static final String KEYWORD = "custom";

    private final Predicate<JsonNode> predicate;
    private final String message;

    /**
     * @param predicate membership test; must be side-effect free
     * @param message   description reported when the predicate rejects a value
     */
    public PredicateSchema(Predicate<JsonNode> predicate, String message) {
        this.predicate = Objects.requireNonNull(predicate, "predicate must not be null");
        this.message = Objects.requireNonNull(message, "message must not be null");
    }

    @Override
    public ValidationOutcome validate(JsonNode value) {
        if (predicate.test(value)) {
            return ValidationOutcome.accepted(value);
        }
        return ValidationOutcome.rejected(new Violation(Violation.ROOT, KEYWORD, message));
    }
}
