package io.versionedentity.core.spi;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * An immutable, thread-safe compiled expression handle produced by {@link
 * ExpressionEngine#compile(String)}. A single instance is shared across concurrent callers.
 */
public interface CompiledExpression {

    /**
     * Evaluates this expression against the given input.
     *
     * @param input the JSON value to transform
     * @return the expression output
     * @throws io.versionedentity.core.error.ExpressionEvalException if evaluation fails at runtime
     */
    JsonNode evaluate(JsonNode input);
}
