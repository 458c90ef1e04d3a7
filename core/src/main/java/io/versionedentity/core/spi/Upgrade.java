package io.versionedentity.core.spi;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Converts a value of the previous version into a value of the version that declares it. Must be
 * pure: the output is trusted to conform to the target schema and is not re-validated (except in
 * {@code UpgradeCheckMode.STRICT}, which only logs).
 */
@FunctionalInterface
public interface Upgrade {

    /**
     * @param previous a value valid at the previous version; owned by the engine, callers' input is
     *     never passed here directly
     * @return the value at this version
     */
    JsonNode apply(JsonNode previous);
}
