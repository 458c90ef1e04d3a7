package io.versionedentity.core.model;

import java.math.BigDecimal;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * The version a resolver extracted from raw input: either indeterminate (no version could be
 * extracted at all) or a raw numeric value.
 *
 * <p>The raw value is kept as a {@link BigDecimal} so that zero, negative, fractional and
 * out-of-range numbers survive resolution unchanged. Such values are "resolved but unregistered":
 * registry lookup fails on them and the migration reports {@code INVALID_VER}, not {@code
 * VER_CHECK_FAIL}.
 */
public final class ResolvedVersion {

    private static final ResolvedVersion INDETERMINATE = new ResolvedVersion(null);

    private static final BigDecimal MIN_INT = BigDecimal.valueOf(Integer.MIN_VALUE);
    private static final BigDecimal MAX_INT = BigDecimal.valueOf(Integer.MAX_VALUE);

    private final BigDecimal raw;

    private ResolvedVersion(BigDecimal raw) {
        this.raw = raw;
    }

    /** No version could be extracted from the input. */
    public static ResolvedVersion indeterminate() {
        return INDETERMINATE;
    }

    public static ResolvedVersion of(int version) {
        return new ResolvedVersion(BigDecimal.valueOf(version));
    }

    public static ResolvedVersion of(BigDecimal raw) {
        return new ResolvedVersion(Objects.requireNonNull(raw, "raw must not be null"));
    }

    public boolean isIndeterminate() {
        return raw == null;
    }

    /** The raw resolved number, or {@code null} when indeterminate. */
    public BigDecimal raw() {
        return raw;
    }

    /**
     * Returns the raw value as a version number when it is an exact {@code int} ({@code 2} and
     * {@code 2.0} both qualify). Fractional and out-of-range values yield empty.
     */
    public OptionalInt versionNumber() {
        // range check first: intValueExact overflows internally on extreme exponents
        if (raw == null || raw.compareTo(MIN_INT) < 0 || raw.compareTo(MAX_INT) > 0) {
            return OptionalInt.empty();
        }
        try {
            return OptionalInt.of(raw.intValueExact());
        } catch (ArithmeticException notAnInt) {
            return OptionalInt.empty();
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ResolvedVersion other)) {
            return false;
        }
        if (raw == null || other.raw == null) {
            return raw == other.raw;
        }
        return raw.compareTo(other.raw) == 0;
    }

    @Override
    public int hashCode() {
        return raw == null ? 0 : raw.stripTrailingZeros().hashCode();
    }

    @Override
    public String toString() {
        return raw == null ? "ResolvedVersion[INDETERMINATE]" : "ResolvedVersion[" + raw + "]";
    }
}
