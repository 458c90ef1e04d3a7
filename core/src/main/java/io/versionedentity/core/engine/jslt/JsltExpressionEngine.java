package io.versionedentity.core.engine.jslt;

import com.fasterxml.jackson.databind.JsonNode;
import com.schibsted.spt.data.jslt.Expression;
import com.schibsted.spt.data.jslt.JsltException;
import com.schibsted.spt.data.jslt.Parser;
import io.versionedentity.core.error.ExpressionCompileException;
import io.versionedentity.core.error.ExpressionEvalException;
import io.versionedentity.core.spi.CompiledExpression;
import io.versionedentity.core.spi.ExpressionEngine;

/**
 * JSLT expression engine. Uses the Schibsted JSLT library to compile and evaluate JSON-to-JSON
 * transforms, e.g. an upgrade {@code {"v": 2, "b": .a}}.
 */
public final class JsltExpressionEngine implements ExpressionEngine {

    /** Engine identifier used in definition YAML {@code lang:} fields. */
    public static final String ENGINE_ID = "jslt";

    @Override
    public String id() {
        return ENGINE_ID;
    }

    @Override
    public CompiledExpression compile(String expression) {
        try {
            return new JsltCompiledExpression(Parser.compileString(expression));
        } catch (JsltException e) {
            throw new ExpressionCompileException("Failed to compile JSLT expression: " + e.getMessage(), e, null, null);
        }
    }

    /** Thread-safe compiled JSLT expression handle. */
    private static final class JsltCompiledExpression implements CompiledExpression {

        private final Expression jsltExpression;

        JsltCompiledExpression(Expression jsltExpression) {
            this.jsltExpression = jsltExpression;
        }

        @Override
        public JsonNode evaluate(JsonNode input) {
            try {
                return jsltExpression.apply(input);
            } catch (JsltException e) {
                throw new ExpressionEvalException("JSLT evaluation failed: " + e.getMessage(), e, null, null);
            }
        }
    }
}
