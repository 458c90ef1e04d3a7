package io.versionedentity.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import io.versionedentity.core.error.EntityInvariantViolation;
import io.versionedentity.core.model.ParseError;
import io.versionedentity.core.model.ParseResult;
import io.versionedentity.core.model.ValidationOutcome;
import io.versionedentity.core.schema.Schemas;
import io.versionedentity.core.spi.EntitySchema;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Schema for a field whose value is itself a versioned entity. Accepts any value the entity
 * accepts at any of its versions, and outputs that value migrated to the entity's latest version.
 *
 * <p>Embed it in a {@link io.versionedentity.core.schema.CompositeSchema} to nest entities; the
 * child is migrated when the parent's field is validated, so the parent's own upgrades only ever
 * see the child at its latest version.
 *
 * <p>If the entity accepts a value but then fails to parse it, the entity definition is corrupt.
 * That raises {@link EntityInvariantViolation} instead of a validation rejection.
 */
public final class EntityReference implements EntitySchema {

    private static final Logger LOG = LoggerFactory.getLogger(EntityReference.class);

    private final VersionedEntity entity;
    private final EntitySchema schema;

    private EntityReference(VersionedEntity entity) {
        this.entity = Objects.requireNonNull(entity, "entity must not be null");
        this.schema = Schemas.predicate(entity::is, "not a valid '" + entity.id() + "' entity at any known version")
                .withTransform(this::migrate);
    }

    /** Creates a reference to {@code entity}. */
    public static EntityReference to(VersionedEntity entity) {
        return new EntityReference(entity);
    }

    public VersionedEntity entity() {
        return entity;
    }

    @Override
    public ValidationOutcome validate(JsonNode value) {
        return schema.validate(value);
    }

    private JsonNode migrate(JsonNode value) {
        ParseResult result = entity.safeParse(value);
        if (result.isOk()) {
            return result.value();
        }
        ParseError error = result.error();
        LOG.error(
                "Entity accepted a value it cannot parse: entity={}, error={}, detail={}",
                entity.id(),
                error.kind(),
                error.describe());
        throw new EntityInvariantViolation(
                "Invalid entity definition for '" + entity.id() + "': is() accepted the value but safeParse failed with "
                        + error.kind() + " (" + error.describe() + ")",
                entity.id(),
                error.version());
    }

    @Override
    public String toString() {
        return "EntityReference[" + entity.id() + "]";
    }
}
