package io.versionedentity.core.model;

import io.versionedentity.core.error.EntityDefinitionException;
import io.versionedentity.core.spi.EntitySchema;
import io.versionedentity.core.spi.Upgrade;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Immutable mapping from version number to {@link VersionDefinition}, plus the declared latest
 * version.
 *
 * <p>The registry may be sparse: intermediate version numbers can be missing, and an entry past
 * the first may be marked initial. Both are accepted here and reported by the migration engine
 * when a migration actually walks over them. The only construction-time checks are that the
 * latest version is a registered key and that every key is positive.
 *
 * <p>Thread-safe: all fields are final and the map is unmodifiable.
 */
public final class VersionRegistry {

    private final SortedMap<Integer, VersionDefinition> versions;
    private final int latestVersion;

    /**
     * Creates a registry. The map is defensively copied.
     *
     * @param versions      version number to definition
     * @param latestVersion the version every migration ends at
     * @throws EntityDefinitionException if {@code latestVersion} is not a key or a key is not positive
     */
    public VersionRegistry(Map<Integer, VersionDefinition> versions, int latestVersion) {
        Objects.requireNonNull(versions, "versions must not be null");
        for (Map.Entry<Integer, VersionDefinition> entry : versions.entrySet()) {
            Objects.requireNonNull(entry.getKey(), "version number must not be null");
            Objects.requireNonNull(entry.getValue(), "definition of version " + entry.getKey() + " must not be null");
            if (entry.getKey() < 1) {
                throw new EntityDefinitionException(
                        "Version numbers must be positive, got: " + entry.getKey(), null, null);
            }
        }
        if (!versions.containsKey(latestVersion)) {
            throw new EntityDefinitionException(
                    "Latest version " + latestVersion + " has no definition; defined versions: " + versions.keySet(),
                    null,
                    null);
        }
        this.versions = Collections.unmodifiableSortedMap(new TreeMap<>(versions));
        this.latestVersion = latestVersion;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Looks up a version definition.
     *
     * @param version the version number
     * @return the definition, or {@code null} if the version is not registered
     */
    public VersionDefinition get(int version) {
        return versions.get(version);
    }

    public boolean contains(int version) {
        return versions.containsKey(version);
    }

    public int latestVersion() {
        return latestVersion;
    }

    /** Definition of the latest version; never null. */
    public VersionDefinition latest() {
        return versions.get(latestVersion);
    }

    /** Unmodifiable view of all registered versions, in ascending order. */
    public SortedMap<Integer, VersionDefinition> versions() {
        return versions;
    }

    public int size() {
        return versions.size();
    }

    @Override
    public String toString() {
        return "VersionRegistry[versions=" + versions.keySet() + ", latest=" + latestVersion + "]";
    }

    /**
     * Fluent builder for {@link VersionRegistry}. When no latest version is set explicitly, the
     * highest registered version is used.
     */
    public static final class Builder {

        private final TreeMap<Integer, VersionDefinition> versions = new TreeMap<>();
        private Integer latestVersion;

        Builder() {}

        /**
         * Registers a definition, replacing any earlier one for the same number.
         *
         * @return this builder (fluent)
         */
        public Builder version(int version, VersionDefinition definition) {
            versions.put(version, Objects.requireNonNull(definition, "definition must not be null"));
            return this;
        }

        /** Registers an {@link VersionDefinition.Initial} version. */
        public Builder initial(int version, EntitySchema schema) {
            return version(version, VersionDefinition.initial(schema));
        }

        /** Registers an {@link VersionDefinition.Upgradeable} version. */
        public Builder upgradeable(int version, EntitySchema schema, Upgrade upgrade) {
            return version(version, VersionDefinition.upgradeable(schema, upgrade));
        }

        public Builder latest(int latestVersion) {
            this.latestVersion = latestVersion;
            return this;
        }

        /**
         * Builds an immutable registry from the accumulated state.
         *
         * @throws EntityDefinitionException if no version was registered, or the latest is not registered
         */
        public VersionRegistry build() {
            if (versions.isEmpty()) {
                throw new EntityDefinitionException("An entity needs at least one version", null, null);
            }
            int latest = latestVersion != null ? latestVersion : versions.lastKey();
            return new VersionRegistry(versions, latest);
        }
    }
}
