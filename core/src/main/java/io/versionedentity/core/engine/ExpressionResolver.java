package io.versionedentity.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import io.versionedentity.core.error.ExpressionEvalException;
import io.versionedentity.core.model.ResolvedVersion;
import io.versionedentity.core.spi.CompiledExpression;
import io.versionedentity.core.spi.VersionResolver;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves the version by evaluating an expression against the input. A numeric result is the
 * version; any other result, or an evaluation failure, is indeterminate.
 */
public final class ExpressionResolver implements VersionResolver {

    private static final Logger LOG = LoggerFactory.getLogger(ExpressionResolver.class);

    private final CompiledExpression expression;

    public ExpressionResolver(CompiledExpression expression) {
        this.expression = Objects.requireNonNull(expression, "expression must not be null");
    }

    @Override
    public ResolvedVersion resolve(JsonNode input) {
        JsonNode result;
        try {
            result = expression.evaluate(input);
        } catch (ExpressionEvalException e) {
            LOG.debug("Version expression failed, treating as indeterminate: {}", e.getMessage());
            return ResolvedVersion.indeterminate();
        } catch (RuntimeException e) {
            // third-party engines may not wrap their failures
            LOG.debug("Version expression threw {}, treating as indeterminate", e.getClass().getName(), e);
            return ResolvedVersion.indeterminate();
        }
        return DiscriminatorResolver.toResolved(result);
    }
}
