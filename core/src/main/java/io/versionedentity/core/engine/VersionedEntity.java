package io.versionedentity.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import io.versionedentity.core.error.EntityParseException;
import io.versionedentity.core.model.ParseResult;
import io.versionedentity.core.model.ResolvedVersion;
import io.versionedentity.core.model.VersionDefinition;
import io.versionedentity.core.model.VersionRegistry;
import io.versionedentity.core.spi.EntitySchema;
import io.versionedentity.core.spi.Upgrade;
import io.versionedentity.core.spi.VersionResolver;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * A named data shape with several historical versions and a migration path between them.
 *
 * <p>Offers three read-only operations:
 *
 * <ul>
 * <li>{@link #is}: is the value a valid instance of the version it claims to be?
 * <li>{@link #isLatest}: is the value valid at the latest version, whatever it claims?
 * <li>{@link #safeParse}: validate and migrate to the latest version, see {@link MigrationEngine}.
 * </ul>
 *
 * <p>Thread-safe: registry, resolver and engine are immutable and shared by all callers. A
 * {@code null} argument is treated as JSON {@code null}.
 */
public final class VersionedEntity {

    private final String id;
    private final VersionRegistry registry;
    private final VersionResolver resolver;
    private final MigrationEngine engine;

    public VersionedEntity(String id, VersionRegistry registry, VersionResolver resolver) {
        this(id, registry, resolver, UpgradeCheckMode.LENIENT);
    }

    public VersionedEntity(
            String id, VersionRegistry registry, VersionResolver resolver, UpgradeCheckMode upgradeCheckMode) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.resolver = Objects.requireNonNull(resolver, "resolver must not be null");
        this.engine = new MigrationEngine(id, registry, resolver, upgradeCheckMode);
    }

    /** Starts a builder for an entity with the given id. */
    public static Builder builder(String id) {
        return new Builder(id);
    }

    /**
     * Returns whether {@code value} is valid at the version the resolver assigns it. Does not
     * migrate; every failure collapses to {@code false}.
     */
    public boolean is(JsonNode value) {
        JsonNode input = orNull(value);
        OptionalInt version = resolver.resolve(input).versionNumber();
        if (version.isEmpty()) {
            return false;
        }
        VersionDefinition definition = registry.get(version.getAsInt());
        return definition != null && definition.schema().test(input);
    }

    /** Returns whether {@code value} is valid at the latest version. The resolver is not consulted. */
    public boolean isLatest(JsonNode value) {
        return registry.latest().schema().test(orNull(value));
    }

    /**
     * Validates {@code value} at its own version and migrates it to the latest version.
     *
     * @return OK with the migrated value, or ERR describing why parsing failed; never throws for bad
     *     input or a defective registry
     */
    public ParseResult safeParse(JsonNode value) {
        return engine.safeParse(orNull(value));
    }

    /**
     * Like {@link #safeParse} but returns the migrated value directly.
     *
     * @throws EntityParseException carrying the parse error when parsing fails
     */
    public JsonNode parse(JsonNode value) {
        ParseResult result = safeParse(value);
        if (result.isErr()) {
            throw new EntityParseException(result.error(), id);
        }
        return result.value();
    }

    /** Resolves the version {@code value} claims to be, without validating it. */
    public ResolvedVersion resolveVersion(JsonNode value) {
        return resolver.resolve(orNull(value));
    }

    public String id() {
        return id;
    }

    public int latestVersion() {
        return registry.latestVersion();
    }

    public VersionRegistry registry() {
        return registry;
    }

    public UpgradeCheckMode upgradeCheckMode() {
        return engine.upgradeCheckMode();
    }

    private static JsonNode orNull(JsonNode value) {
        return value != null ? value : NullNode.getInstance();
    }

    @Override
    public String toString() {
        return "VersionedEntity[" + id + ", latest=" + registry.latestVersion() + "]";
    }

    /** Fluent builder for {@link VersionedEntity}. */
    public static final class Builder {

        private final String id;
        private final VersionRegistry.Builder registry = VersionRegistry.builder();
        private VersionResolver resolver;
        private UpgradeCheckMode upgradeCheckMode = UpgradeCheckMode.LENIENT;

        Builder(String id) {
            this.id = Objects.requireNonNull(id, "id must not be null");
        }

        public Builder initial(int version, EntitySchema schema) {
            registry.initial(version, schema);
            return this;
        }

        public Builder upgradeable(int version, EntitySchema schema, Upgrade upgrade) {
            registry.upgradeable(version, schema, upgrade);
            return this;
        }

        public Builder version(int version, VersionDefinition definition) {
            registry.version(version, definition);
            return this;
        }

        /** Declares the latest version; defaults to the highest registered one. */
        public Builder latest(int latestVersion) {
            registry.latest(latestVersion);
            return this;
        }

        public Builder resolver(VersionResolver resolver) {
            this.resolver = resolver;
            return this;
        }

        /** Shortcut for a {@link DiscriminatorResolver} reading the given numeric field. */
        public Builder versionField(String field) {
            return resolver(new DiscriminatorResolver(field));
        }

        public Builder upgradeCheck(UpgradeCheckMode mode) {
            this.upgradeCheckMode = Objects.requireNonNull(mode, "mode must not be null");
            return this;
        }

        public VersionedEntity build() {
            Objects.requireNonNull(resolver, "resolver must be set for entity '" + id + "'");
            return new VersionedEntity(id, registry.build(), resolver, upgradeCheckMode);
        }
    }
}
