package io.versionedentity.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import io.versionedentity.core.model.ParseError;
import io.versionedentity.core.model.ParseResult;
import io.versionedentity.core.model.ResolvedVersion;
import io.versionedentity.core.model.ValidationOutcome;
import io.versionedentity.core.model.VersionDefinition;
import io.versionedentity.core.model.VersionRegistry;
import io.versionedentity.core.spi.VersionResolver;
import java.util.Objects;
import java.util.OptionalInt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves, validates and migrates a raw value to an entity's latest version.
 *
 * <p>Algorithm for {@link #safeParse(JsonNode)}:
 *
 * <ol>
 * <li>Resolve the version; indeterminate fails with {@code VER_CHECK_FAIL}.
 * <li>Look the version up; a missing definition fails with {@code INVALID_VER}.
 * <li>Validate against that version's schema; rejection fails with {@code
 * GIVEN_VER_VALIDATION_FAIL}.
 * <li>Walk every version from the next one up to the latest, in order. A missing version fails
 * with {@code BUG_NO_INTERMEDIATE_FOUND}, a version marked initial fails with {@code
 * BUG_INTERMEDIATE_MARKED_INITIAL}; otherwise its upgrade is applied exactly once.
 * </ol>
 *
 * <p>Every failure is returned as data. Exceptions thrown by upgrades themselves propagate.
 *
 * <p>Thread-safe: all state is immutable and shared read-only. The caller's input is never
 * mutated; the validated payload is copied once before the first upgrade.
 */
public final class MigrationEngine {

    private static final Logger LOG = LoggerFactory.getLogger(MigrationEngine.class);

    private final String entityId;
    private final VersionRegistry registry;
    private final VersionResolver resolver;
    private final UpgradeCheckMode upgradeCheckMode;

    public MigrationEngine(
            String entityId, VersionRegistry registry, VersionResolver resolver, UpgradeCheckMode upgradeCheckMode) {
        this.entityId = Objects.requireNonNull(entityId, "entityId must not be null");
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.resolver = Objects.requireNonNull(resolver, "resolver must not be null");
        this.upgradeCheckMode = Objects.requireNonNull(upgradeCheckMode, "upgradeCheckMode must not be null");
    }

    /**
     * Parses {@code input} and migrates it to the latest version.
     *
     * @param input the raw value, never {@code null}
     * @return OK with the value at the latest version, or ERR with one of the five error kinds
     */
    public ParseResult safeParse(JsonNode input) {
        ResolvedVersion resolved = resolver.resolve(input);
        if (resolved.isIndeterminate()) {
            LOG.debug("Version check failed: entity={}", entityId);
            return ParseResult.err(new ParseError.VersionCheckFailed());
        }

        OptionalInt number = resolved.versionNumber();
        VersionDefinition definition = number.isPresent() ? registry.get(number.getAsInt()) : null;
        if (definition == null) {
            LOG.debug("Unknown version: entity={}, resolved={}", entityId, resolved.raw());
            return ParseResult.err(new ParseError.InvalidVersion(resolved));
        }

        int version = number.getAsInt();
        ValidationOutcome validation = definition.schema().validate(input);
        if (validation.isRejected()) {
            LOG.debug(
                    "Input rejected by its own version: entity={}, version={}, violations={}",
                    entityId,
                    version,
                    validation.describe());
            return ParseResult.err(
                    new ParseError.GivenVersionValidationFailed(version, definition, validation.violations()));
        }

        return migrate(validation.value(), version);
    }

    private ParseResult migrate(JsonNode validated, int fromVersion) {
        int latest = registry.latestVersion();
        if (fromVersion >= latest) {
            return ParseResult.ok(validated);
        }

        JsonNode payload = validated.deepCopy();
        // ends on equality with latest; a <= bound would wrap when latest is Integer.MAX_VALUE
        for (int current = fromVersion + 1; ; current++) {
            VersionDefinition step = registry.get(current);
            if (step == null) {
                LOG.warn(
                        "Entity definition has a gap: entity={}, missing_version={}, migrating_from={}",
                        entityId,
                        current,
                        fromVersion);
                return ParseResult.err(new ParseError.NoIntermediateFound(current));
            }
            if (!(step instanceof VersionDefinition.Upgradeable upgradeable)) {
                LOG.warn(
                        "Intermediate version is marked initial: entity={}, version={}, migrating_from={}",
                        entityId,
                        current,
                        fromVersion);
                return ParseResult.err(new ParseError.IntermediateMarkedInitial(current));
            }
            payload = Objects.requireNonNull(
                    upgradeable.upgrade().apply(payload), "upgrade to version " + current + " returned null");
            LOG.debug("Upgraded: entity={}, {} -> {}", entityId, current - 1, current);
            if (upgradeCheckMode == UpgradeCheckMode.STRICT) {
                checkUpgradeOutput(payload, current, upgradeable);
            }
            if (current == latest) {
                return ParseResult.ok(payload);
            }
        }
    }

    private void checkUpgradeOutput(JsonNode payload, int version, VersionDefinition.Upgradeable definition) {
        ValidationOutcome check = definition.schema().validate(payload);
        if (check.isRejected()) {
            LOG.warn(
                    "Upgrade output does not match its version schema: entity={}, version={}, violations={}",
                    entityId,
                    version,
                    check.describe());
        }
    }

    public String entityId() {
        return entityId;
    }

    public VersionRegistry registry() {
        return registry;
    }

    public UpgradeCheckMode upgradeCheckMode() {
        return upgradeCheckMode;
    }
}
