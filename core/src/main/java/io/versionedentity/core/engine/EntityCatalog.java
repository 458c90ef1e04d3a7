package io.versionedentity.core.engine;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entities known by id, so that definitions can reference other entities by name. Thread-safe.
 *
 * <p>Registering an id twice replaces the earlier entity; references created before the
 * replacement keep pointing at the entity they were created with.
 */
public final class EntityCatalog {

    private static final Logger LOG = LoggerFactory.getLogger(EntityCatalog.class);

    private final Map<String, VersionedEntity> entities = new ConcurrentHashMap<>();

    /** Registers {@code entity} under its id and returns it. */
    public VersionedEntity register(VersionedEntity entity) {
        if (entity == null) {
            throw new NullPointerException("entity must not be null");
        }
        VersionedEntity previous = entities.put(entity.id(), entity);
        if (previous != null) {
            LOG.info("Replaced entity definition: entity={}", entity.id());
        }
        return entity;
    }

    public Optional<VersionedEntity> get(String entityId) {
        return Optional.ofNullable(entities.get(entityId));
    }

    /**
     * Looks up an entity, throwing if absent.
     *
     * @throws IllegalArgumentException if no entity is registered under {@code entityId}
     */
    public VersionedEntity require(String entityId) {
        return get(entityId)
                .orElseThrow(() -> new IllegalArgumentException("No entity registered with id: '" + entityId + "'"));
    }

    /** Returns a schema referencing the registered entity {@code entityId}. */
    public EntityReference reference(String entityId) {
        return EntityReference.to(require(entityId));
    }

    public boolean contains(String entityId) {
        return entities.containsKey(entityId);
    }

    public Set<String> ids() {
        return Set.copyOf(entities.keySet());
    }

    public int size() {
        return entities.size();
    }
}
