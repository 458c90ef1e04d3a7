package io.versionedentity.core.spi;

import com.fasterxml.jackson.databind.JsonNode;
import io.versionedentity.core.model.ResolvedVersion;

/**
 * Extracts the version a raw value claims to be. Entity-specific and supplied when the entity is
 * defined.
 *
 * <p>Implementations MUST be total and side-effect free: every input, however malformed, yields a
 * {@link ResolvedVersion} (possibly {@link ResolvedVersion#indeterminate()}) and never an
 * exception.
 */
@FunctionalInterface
public interface VersionResolver {

    ResolvedVersion resolve(JsonNode input);
}
