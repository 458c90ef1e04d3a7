package io.versionedentity.core.model;

import io.versionedentity.core.spi.EntitySchema;
import io.versionedentity.core.spi.Upgrade;
import java.util.Objects;

/**
 * One version of an entity: the schema that validates it and, unless it is the initial version,
 * the upgrade that produces it from the previous version.
 *
 * <p>Sealed: a definition is either {@link Initial} (never carries an upgrade) or {@link
 * Upgradeable} (always carries one). Thread-safe and immutable.
 */
public sealed interface VersionDefinition {

    /** The schema values of this version must satisfy. */
    EntitySchema schema();

    /** {@code true} for {@link Initial}. */
    boolean isInitial();

    /** Creates the definition of an entity's first version. */
    static VersionDefinition initial(EntitySchema schema) {
        return new Initial(schema);
    }

    /** Creates the definition of a version reached by upgrading the previous one. */
    static VersionDefinition upgradeable(EntitySchema schema, Upgrade upgrade) {
        return new Upgradeable(schema, upgrade);
    }

    /** First version of an entity; there is nothing to upgrade from. */
    record Initial(EntitySchema schema) implements VersionDefinition {
        public Initial {
            Objects.requireNonNull(schema, "schema must not be null");
        }

        @Override
        public boolean isInitial() {
            return true;
        }
    }

    /**
     * A version reached from its predecessor.
     *
     * @param schema  schema of this version
     * @param upgrade converts a value of the previous version into this version
     */
    record Upgradeable(EntitySchema schema, Upgrade upgrade) implements VersionDefinition {
        public Upgradeable {
            Objects.requireNonNull(schema, "schema must not be null");
            Objects.requireNonNull(upgrade, "upgrade must not be null for an upgradeable version");
        }

        @Override
        public boolean isInitial() {
            return false;
        }
    }
}
