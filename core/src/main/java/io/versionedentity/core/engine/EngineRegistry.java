package io.versionedentity.core.engine;

import io.versionedentity.core.engine.jslt.JsltExpressionEngine;
import io.versionedentity.core.spi.ExpressionEngine;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Expression engines available to declarative entity definitions, keyed by their {@code lang} id.
 * Thread-safe: registration and lookup can happen concurrently.
 */
public final class EngineRegistry {

    private final Map<String, ExpressionEngine> engines = new ConcurrentHashMap<>();

    /** Creates a registry holding the built-in JSLT engine. */
    public static EngineRegistry withDefaults() {
        EngineRegistry registry = new EngineRegistry();
        registry.register(new JsltExpressionEngine());
        return registry;
    }

    /**
     * Registers an expression engine, replacing any engine with the same id.
     *
     * @throws NullPointerException     if engine or engine.id() is null
     * @throws IllegalArgumentException if engine.id() is empty
     */
    public void register(ExpressionEngine engine) {
        if (engine == null) {
            throw new NullPointerException("engine must not be null");
        }
        String id = engine.id();
        if (id == null || id.isEmpty()) {
            throw new IllegalArgumentException("engine id must not be null or empty");
        }
        engines.put(id, engine);
    }

    public Optional<ExpressionEngine> getEngine(String engineId) {
        return Optional.ofNullable(engines.get(engineId));
    }

    public boolean hasEngine(String engineId) {
        return engines.containsKey(engineId);
    }

    public int size() {
        return engines.size();
    }
}
