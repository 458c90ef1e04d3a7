package io.versionedentity.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Why a value could not be parsed and migrated. Exactly one of five disjoint kinds; the first
 * three are problems with the caller's data, the last two are defects in the entity definition.
 *
 * <p>Errors are returned as data inside a {@link ParseResult}, never thrown by {@code safeParse}.
 */
public sealed interface ParseError {

    /** The error kinds, with their classification. */
    enum Kind {
        /** The resolver could not extract any version from the input. */
        VER_CHECK_FAIL(false),
        /** The resolved version has no definition in the registry. */
        INVALID_VER(false),
        /** The resolved version exists but its schema rejected the input. */
        GIVEN_VER_VALIDATION_FAIL(false),
        /** The registry has a gap between the input's version and the latest. */
        BUG_NO_INTERMEDIATE_FOUND(true),
        /** A version after the input's version is marked initial and cannot be upgraded into. */
        BUG_INTERMEDIATE_MARKED_INITIAL(true);

        private final boolean definitionDefect;

        Kind(boolean definitionDefect) {
            this.definitionDefect = definitionDefect;
        }

        /** {@code true} when this kind points at a broken entity definition rather than bad input. */
        public boolean isDefinitionDefect() {
            return definitionDefect;
        }
    }

    Kind kind();

    /** The version this error refers to, or {@code null} when no registered version is involved. */
    Integer version();

    /** One-line human-readable description. */
    String describe();

    default boolean isDefinitionDefect() {
        return kind().isDefinitionDefect();
    }

    // ── Implementations ──

    /** No version could be extracted from the input. */
    record VersionCheckFailed() implements ParseError {
        @Override
        public Kind kind() {
            return Kind.VER_CHECK_FAIL;
        }

        @Override
        public Integer version() {
            return null;
        }

        @Override
        public String describe() {
            return "could not determine the version of the input";
        }
    }

    /**
     * The resolved version is not registered.
     *
     * @param resolved what the resolver returned
     */
    record InvalidVersion(ResolvedVersion resolved) implements ParseError {
        public InvalidVersion {
            Objects.requireNonNull(resolved, "resolved must not be null");
        }

        @Override
        public Kind kind() {
            return Kind.INVALID_VER;
        }

        @Override
        public Integer version() {
            return null;
        }

        @Override
        public String describe() {
            return "version " + resolved.raw() + " is not defined";
        }
    }

    /**
     * The input failed the schema of the version it claims to be.
     *
     * @param version    the resolved version
     * @param definition that version's definition
     * @param violations structured rejection detail
     */
    record GivenVersionValidationFailed(Integer version, VersionDefinition definition, List<Violation> violations)
            implements ParseError {
        public GivenVersionValidationFailed {
            Objects.requireNonNull(version, "version must not be null");
            Objects.requireNonNull(definition, "definition must not be null");
            violations = List.copyOf(violations);
        }

        @Override
        public Kind kind() {
            return Kind.GIVEN_VER_VALIDATION_FAIL;
        }

        @Override
        public String describe() {
            return "input is not a valid version " + version + ": " + violations;
        }
    }

    /**
     * Migration reached a version number with no definition.
     *
     * @param missingVersion the first missing version
     */
    record NoIntermediateFound(int missingVersion) implements ParseError {
        @Override
        public Kind kind() {
            return Kind.BUG_NO_INTERMEDIATE_FOUND;
        }

        @Override
        public Integer version() {
            return missingVersion;
        }

        @Override
        public String describe() {
            return "entity definition has no version " + missingVersion + " to migrate through";
        }
    }

    /**
     * Migration reached a version that is marked initial.
     *
     * @param version the offending version
     */
    record IntermediateMarkedInitial(Integer version) implements ParseError {
        public IntermediateMarkedInitial {
            Objects.requireNonNull(version, "version must not be null");
        }

        @Override
        public Kind kind() {
            return Kind.BUG_INTERMEDIATE_MARKED_INITIAL;
        }

        @Override
        public String describe() {
            return "version " + version + " is marked initial but is not the first version";
        }
    }
}
