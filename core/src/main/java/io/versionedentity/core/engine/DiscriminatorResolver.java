package io.versionedentity.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import io.versionedentity.core.model.ResolvedVersion;
import io.versionedentity.core.spi.VersionResolver;
import java.util.Objects;

/**
 * Reads the version from a numeric field of an object, {@code v} by default. Non-objects, a
 * missing field and non-numeric values (including numeric strings) are indeterminate. Any number
 * resolves, including zero, negative and fractional ones; those simply match no registered version.
 */
public final class DiscriminatorResolver implements VersionResolver {

    /** Field read when none is specified. */
    public static final String DEFAULT_FIELD = "v";

    private final String field;

    public DiscriminatorResolver() {
        this(DEFAULT_FIELD);
    }

    public DiscriminatorResolver(String field) {
        this.field = Objects.requireNonNull(field, "field must not be null");
        if (field.isEmpty()) {
            throw new IllegalArgumentException("field must not be empty");
        }
    }

    public String field() {
        return field;
    }

    @Override
    public ResolvedVersion resolve(JsonNode input) {
        if (input == null || !input.isObject()) {
            return ResolvedVersion.indeterminate();
        }
        return toResolved(input.get(field));
    }

    static ResolvedVersion toResolved(JsonNode version) {
        if (version == null || !version.isNumber()) {
            return ResolvedVersion.indeterminate();
        }
        // NaN and infinities have no decimal form
        if ((version.isDouble() || version.isFloat()) && !Double.isFinite(version.doubleValue())) {
            return ResolvedVersion.indeterminate();
        }
        return ResolvedVersion.of(version.decimalValue());
    }

    @Override
    public String toString() {
        return "DiscriminatorResolver[" + field + "]";
    }
}
