package io.versionedentity.core.schema;

import com.fasterxml.jackson.databind.JsonNode;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import io.versionedentity.core.error.InvalidSchemaException;
import io.versionedentity.core.model.ValidationOutcome;
import io.versionedentity.core.model.Violation;
import io.versionedentity.core.spi.EntitySchema;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * {@link EntitySchema} backed by a JSON Schema 2020-12 document, compiled once at construction.
 * Accepted values are returned unchanged (same instance).
 *
 * <p>Thread-safe: the compiled networknt schema is immutable after initialization.
 */
public final class JsonSchemaValidator implements EntitySchema {

    private static final JsonSchemaFactory SCHEMA_FACTORY =
            JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V202012);

    private static final Set<String> JSON_SCHEMA_TYPES =
            Set.of("object", "array", "string", "number", "integer", "boolean", "null");

    private static final Comparator<Violation> BY_PATH =
            Comparator.comparing(Violation::path).thenComparing(Violation::message);

    private final JsonNode schemaNode;
    private final JsonSchema schema;

    /**
     * Compiles a JSON Schema document.
     *
     * @param schemaNode the schema document, a JSON object
     * @throws InvalidSchemaException if the document cannot be compiled
     */
    public JsonSchemaValidator(JsonNode schemaNode) {
        this.schemaNode = Objects.requireNonNull(schemaNode, "schemaNode must not be null");
        this.schema = compile(schemaNode);
    }

    /** The schema document this validator was compiled from. */
    public JsonNode schemaNode() {
        return schemaNode;
    }

    @Override
    public ValidationOutcome validate(JsonNode value) {
        Set<ValidationMessage> messages = schema.validate(value);
        if (messages.isEmpty()) {
            return ValidationOutcome.accepted(value);
        }
        List<Violation> violations = messages.stream()
                .map(JsonSchemaValidator::toViolation)
                .sorted(BY_PATH)
                .toList();
        return ValidationOutcome.rejected(violations);
    }

    private static Violation toViolation(ValidationMessage message) {
        String path = message.getInstanceLocation() != null
                ? message.getInstanceLocation().toString()
                : Violation.ROOT;
        String keyword = message.getType() != null ? message.getType() : "schema";
        return new Violation(path, keyword, message.getMessage());
    }

    private static JsonSchema compile(JsonNode schemaNode) {
        if (!schemaNode.isObject()) {
            throw new InvalidSchemaException(
                    "Invalid JSON Schema: expected an object, got " + schemaNode.getNodeType(), null, null);
        }
        checkTypeKeyword(schemaNode.get("type"));
        try {
            JsonSchema compiled = SCHEMA_FACTORY.getSchema(schemaNode);
            compiled.initializeValidators();
            return compiled;
        } catch (RuntimeException e) {
            throw new InvalidSchemaException("Invalid JSON Schema: " + e.getMessage(), e, null, null);
        }
    }

    // networknt accepts unknown type names silently; reject them here so typos surface at load time
    private static void checkTypeKeyword(JsonNode typeNode) {
        if (typeNode == null) {
            return;
        }
        if (typeNode.isTextual()) {
            requireKnownType(typeNode.asText());
        } else if (typeNode.isArray()) {
            typeNode.forEach(t -> requireKnownType(t.asText()));
        }
    }

    private static void requireKnownType(String type) {
        if (!JSON_SCHEMA_TYPES.contains(type)) {
            throw new InvalidSchemaException(
                    "Invalid JSON Schema: unknown type '" + type
                            + "', expected one of: object, array, string, number, integer, boolean, null",
                    null,
                    null);
        }
    }

    @Override
    public String toString() {
        return "JsonSchemaValidator[" + schemaNode + "]";
    }
}
