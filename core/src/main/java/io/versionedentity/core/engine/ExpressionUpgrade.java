package io.versionedentity.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import io.versionedentity.core.error.ExpressionEvalException;
import io.versionedentity.core.spi.CompiledExpression;
import io.versionedentity.core.spi.Upgrade;
import java.util.Objects;

/** {@link Upgrade} backed by a compiled expression; evaluation errors carry entity and version. */
public final class ExpressionUpgrade implements Upgrade {

    private final CompiledExpression expression;
    private final String entityId;
    private final int targetVersion;

    /**
     * @param expression    maps a value of {@code targetVersion - 1} to {@code targetVersion}
     * @param entityId      entity the upgrade belongs to, for error context
     * @param targetVersion the version this upgrade produces
     */
    public ExpressionUpgrade(CompiledExpression expression, String entityId, int targetVersion) {
        this.expression = Objects.requireNonNull(expression, "expression must not be null");
        this.entityId = entityId;
        this.targetVersion = targetVersion;
    }

    @Override
    public JsonNode apply(JsonNode previous) {
        try {
            return expression.evaluate(previous);
        } catch (ExpressionEvalException e) {
            throw new ExpressionEvalException(
                    "Upgrade to version " + targetVersion + " of '" + entityId + "' failed: " + e.getMessage(),
                    e.getCause(),
                    entityId,
                    targetVersion);
        }
    }

    public int targetVersion() {
        return targetVersion;
    }
}
