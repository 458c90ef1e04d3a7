package io.versionedentity.core.schema;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.versionedentity.core.model.ValidationOutcome;
import io.versionedentity.core.model.Violation;
import io.versionedentity.core.spi.EntitySchema;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Object schema assembled from a base schema plus embedded schemas for individual fields.
 *
 * <p>The base schema checks the object as a whole; each field schema then checks the value of its
 * field, when present. Whether a field is required is the base schema's business. Violations from
 * field schemas are re-rooted under the field name. When everything is accepted, the output is a
 * copy of the input with every embedded field replaced by its schema's output; the input itself is
 * never modified.
 *
 * <p>Exceptions thrown by field schemas (notably {@code EntityInvariantViolation}) are not caught.
 */
public final class CompositeSchema implements EntitySchema {

    private final EntitySchema base;
    private final Map<String, EntitySchema> fields;

    private CompositeSchema(EntitySchema base, Map<String, EntitySchema> fields) {
        this.base = base;
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    /**
     * Starts a composite over {@code base}.
     *
     * @param base schema applied to the whole object
     */
    public static Builder over(EntitySchema base) {
        return new Builder(base);
    }

    /** Field name to embedded schema, in declaration order. */
    public Map<String, EntitySchema> fields() {
        return fields;
    }

    @Override
    public ValidationOutcome validate(JsonNode value) {
        List<Violation> violations = new ArrayList<>(base.validate(value).violations());
        if (!value.isObject()) {
            if (violations.isEmpty()) {
                violations.add(new Violation(
                        Violation.ROOT, "type", value.getNodeType().toString().toLowerCase(Locale.ROOT) + " found, object expected"));
            }
            return ValidationOutcome.rejected(violations);
        }

        Map<String, JsonNode> replacements = new LinkedHashMap<>();
        for (Map.Entry<String, EntitySchema> field : fields.entrySet()) {
            JsonNode fieldValue = value.get(field.getKey());
            if (fieldValue == null) {
                continue;
            }
            ValidationOutcome outcome = field.getValue().validate(fieldValue);
            if (outcome.isAccepted()) {
                replacements.put(field.getKey(), outcome.value());
            } else {
                outcome.violations().forEach(v -> violations.add(v.under(field.getKey())));
            }
        }
        if (!violations.isEmpty()) {
            return ValidationOutcome.rejected(violations);
        }
        if (replacements.isEmpty()) {
            return ValidationOutcome.accepted(value);
        }
        ObjectNode output = ((ObjectNode) value).deepCopy();
        replacements.forEach(output::set);
        return ValidationOutcome.accepted(output);
    }

    /** Builder for {@link CompositeSchema}. */
    public static final class Builder {

        private final EntitySchema base;
        private final Map<String, EntitySchema> fields = new LinkedHashMap<>();

        Builder(EntitySchema base) {
            this.base = Objects.requireNonNull(base, "base must not be null");
        }

        /**
         * Embeds a schema for one field, replacing any earlier one for the same name.
         *
         * @return this builder (fluent)
         */
        public Builder field(String name, EntitySchema schema) {
            Objects.requireNonNull(name, "name must not be null");
            fields.put(name, Objects.requireNonNull(schema, "schema must not be null"));
            return this;
        }

        public CompositeSchema build() {
            return new CompositeSchema(base, fields);
        }
    }
}
