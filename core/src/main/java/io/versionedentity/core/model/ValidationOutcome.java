package io.versionedentity.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Result of validating a value against an {@link io.versionedentity.core.spi.EntitySchema}.
 * Either accepted, carrying the (possibly transformed) output value, or rejected, carrying at
 * least one {@link Violation}.
 *
 * <p>Immutable and thread-safe as long as the carried {@link JsonNode} is not mutated.
 */
public final class ValidationOutcome {

    private final JsonNode value;
    private final List<Violation> violations;

    private ValidationOutcome(JsonNode value, List<Violation> violations) {
        this.value = value;
        this.violations = violations;
    }

    /** Creates an accepted outcome whose effective output is {@code value}. */
    public static ValidationOutcome accepted(JsonNode value) {
        Objects.requireNonNull(value, "value must not be null for an accepted outcome");
        return new ValidationOutcome(value, List.of());
    }

    /** Creates a rejected outcome. */
    public static ValidationOutcome rejected(List<Violation> violations) {
        Objects.requireNonNull(violations, "violations must not be null");
        if (violations.isEmpty()) {
            throw new IllegalArgumentException("a rejected outcome needs at least one violation");
        }
        return new ValidationOutcome(null, List.copyOf(violations));
    }

    /** Creates a rejected outcome with a single violation. */
    public static ValidationOutcome rejected(Violation violation) {
        return rejected(List.of(violation));
    }

    public boolean isAccepted() {
        return value != null;
    }

    public boolean isRejected() {
        return value == null;
    }

    /** Returns the validated output. Only valid when {@link #isAccepted()}. */
    public JsonNode value() {
        return value;
    }

    /** Returns the violations; empty when accepted. */
    public List<Violation> violations() {
        return violations;
    }

    /** Joins all violations into a single line, for logs and exception messages. */
    public String describe() {
        return violations.stream().map(Violation::toString).collect(Collectors.joining("; "));
    }

    @Override
    public String toString() {
        return isAccepted() ? "ValidationOutcome[ACCEPTED]" : "ValidationOutcome[REJECTED, " + describe() + "]";
    }
}
