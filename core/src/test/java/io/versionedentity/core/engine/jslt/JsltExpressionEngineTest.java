package io.versionedentity.core.engine.jslt;

import static io.versionedentity.core.testkit.TestEntities.json;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import io.versionedentity.core.engine.ExpressionUpgrade;
import io.versionedentity.core.error.ExpressionCompileException;
import io.versionedentity.core.error.ExpressionEvalException;
import io.versionedentity.core.spi.CompiledExpression;
import org.junit.jupiter.api.Test;

class JsltExpressionEngineTest {

    private final JsltExpressionEngine engine = new JsltExpressionEngine();

    @Test
    void idIsJslt() {
        assertThat(engine.id()).isEqualTo("jslt");
    }

    @Test
    void compilesAndEvaluatesUpgrade() {
        CompiledExpression expr = engine.compile("{\"v\": 2, \"b\": .a}");

        JsonNode out = expr.evaluate(json("{'v': 1, 'a': 5}"));

        assertThat(out.get("v").asInt()).isEqualTo(2);
        assertThat(out.get("b").asInt()).isEqualTo(5);
        assertThat(out.has("a")).isFalse();
    }

    @Test
    void syntaxErrorIsCompileException() {
        assertThatThrownBy(() -> engine.compile("{ \"broken\": "))
                .isInstanceOf(ExpressionCompileException.class)
                .hasMessageContaining("JSLT");
    }

    @Test
    void runtimeErrorIsEvalException() {
        CompiledExpression expr = engine.compile("error(\"cannot upgrade\")");

        assertThatThrownBy(() -> expr.evaluate(json("{}")))
                .isInstanceOf(ExpressionEvalException.class)
                .hasMessageContaining("cannot upgrade");
    }

    @Test
    void expressionUpgradeAddsEntityAndVersionToFailures() {
        ExpressionUpgrade upgrade = new ExpressionUpgrade(engine.compile("error(\"nope\")"), "orders", 3);

        assertThatThrownBy(() -> upgrade.apply(json("{}")))
                .isInstanceOf(ExpressionEvalException.class)
                .hasMessageContaining("version 3")
                .hasMessageContaining("orders")
                .satisfies(e -> {
                    ExpressionEvalException eval = (ExpressionEvalException) e;
                    assertThat(eval.entityId()).isEqualTo("orders");
                    assertThat(eval.version()).isEqualTo(3);
                });
    }
}
