package io.versionedentity.core.spi;

/**
 * Pluggable expression engine used by declarative entity definitions for upgrades and resolvers.
 * Implementations are registered with an {@code EngineRegistry} and selected by the {@code lang}
 * field of a definition.
 *
 * <p>Implementations MUST be stateless and thread-safe.
 */
public interface ExpressionEngine {

    /**
     * Returns the engine identifier, e.g. {@code "jslt"}.
     *
     * @return a non-null, non-empty engine identifier (lowercase, no spaces)
     */
    String id();

    /**
     * Compiles the given expression into an immutable, thread-safe handle.
     *
     * @param expression the expression source code
     * @return a compiled expression ready for evaluation
     * @throws io.versionedentity.core.error.ExpressionCompileException if the expression has syntax
     *     errors
     */
    CompiledExpression compile(String expression);
}
