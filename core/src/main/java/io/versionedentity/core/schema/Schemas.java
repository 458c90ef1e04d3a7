package io.versionedentity.core.schema;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.versionedentity.core.error.InvalidSchemaException;
import io.versionedentity.core.spi.EntitySchema;
import java.util.function.Predicate;

/** Static factories for the built-in {@link EntitySchema} implementations. */
public final class Schemas {

    private static final ObjectMapper JSON = new ObjectMapper();

    private Schemas() {}

    /** Compiles a JSON Schema 2020-12 document. */
    public static JsonSchemaValidator jsonSchema(JsonNode schema) {
        return new JsonSchemaValidator(schema);
    }

    /**
     * Parses and compiles a JSON Schema 2020-12 document.
     *
     * @throws InvalidSchemaException if the text is not JSON or not a valid schema
     */
    public static JsonSchemaValidator jsonSchema(String schemaJson) {
        try {
            return new JsonSchemaValidator(JSON.readTree(schemaJson));
        } catch (JsonProcessingException e) {
            throw new InvalidSchemaException("Schema is not valid JSON: " + e.getOriginalMessage(), e, null, null);
        }
    }

    /** Accepts every value unchanged. */
    public static EntitySchema any() {
        return new PredicateSchema(value -> true, "never rejects");
    }

    /** Accepts the values {@code predicate} accepts. */
    public static PredicateSchema predicate(Predicate<JsonNode> predicate, String message) {
        return new PredicateSchema(predicate, message);
    }

    /** Starts an object schema with embedded field schemas. */
    public static CompositeSchema.Builder object(EntitySchema base) {
        return CompositeSchema.over(base);
    }
}
