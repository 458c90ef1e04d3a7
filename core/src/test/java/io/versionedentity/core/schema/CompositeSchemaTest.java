package io.versionedentity.core.schema;

import static io.versionedentity.core.testkit.TestEntities.json;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.TextNode;
import io.versionedentity.core.model.ValidationOutcome;
import io.versionedentity.core.model.Violation;
import io.versionedentity.core.spi.EntitySchema;
import java.util.Locale;
import org.junit.jupiter.api.Test;

class CompositeSchemaTest {

    private final EntitySchema upperName = Schemas.jsonSchema("{\"type\": \"string\"}")
            .withTransform(name -> TextNode.valueOf(name.asText().toUpperCase(Locale.ROOT)));

    private final CompositeSchema person = Schemas.object(Schemas.jsonSchema(
                    "{\"type\": \"object\", \"required\": [\"name\"], \"properties\": {\"age\": {\"type\": \"integer\"}}}"))
            .field("name", upperName)
            .field("nickname", upperName)
            .build();

    @Test
    void replacesFieldsWithEmbeddedOutputOnACopy() {
        JsonNode input = json("{'name': 'ada', 'age': 36}");

        ValidationOutcome outcome = person.validate(input);

        assertThat(outcome.value()).isEqualTo(json("{'name': 'ADA', 'age': 36}"));
        assertThat(input.get("name").asText()).isEqualTo("ada");
    }

    @Test
    void absentOptionalFieldIsSkipped() {
        assertThat(person.validate(json("{'name': 'ada'}")).value().has("nickname")).isFalse();
    }

    @Test
    void collectsBaseAndFieldViolations() {
        ValidationOutcome outcome = person.validate(json("{'age': 'old', 'nickname': 3}"));

        assertThat(outcome.isRejected()).isTrue();
        assertThat(outcome.violations())
                .extracting(Violation::path)
                .contains("$.age", "$.nickname");
        assertThat(outcome.violations()).extracting(Violation::keyword).contains("required", "type");
    }

    @Test
    void nestedViolationPathsAreReRooted() {
        CompositeSchema outer = Schemas.object(Schemas.jsonSchema("{\"type\": \"object\"}"))
                .field("person", person)
                .build();

        ValidationOutcome outcome = outer.validate(json("{'person': {'name': 1}}"));

        assertThat(outcome.violations()).extracting(Violation::path).containsExactly("$.person.name");
    }

    @Test
    void nonObjectIsRejectedEvenIfBaseAllowsIt() {
        CompositeSchema loose = Schemas.object(Schemas.any()).field("name", upperName).build();

        ValidationOutcome outcome = loose.validate(json("[1]"));

        assertThat(outcome.isRejected()).isTrue();
        assertThat(outcome.violations().get(0).message()).contains("array found, object expected");
    }

    @Test
    void withoutEmbeddedChangesTheInputInstanceIsReturned() {
        JsonNode input = json("{'age': 1, 'name': 'x'}");
        CompositeSchema plain = Schemas.object(Schemas.any()).field("other", upperName).build();

        assertThat(plain.validate(input).value()).isSameAs(input);
    }

    @Test
    void exceptionsFromFieldSchemasPropagate() {
        CompositeSchema exploding = Schemas.object(Schemas.any())
                .field("x", value -> {
                    throw new IllegalStateException("field schema failed");
                })
                .build();

        assertThatThrownBy(() -> exploding.validate(json("{'x': 1}")))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("field schema failed");
    }

    @Test
    void transformOnlyRunsOnAcceptedValues() {
        EntitySchema guarded = Schemas.predicate(JsonNode::isNumber, "expected a number").withTransform(value -> {
            throw new AssertionError("must not transform a rejected value");
        });

        ValidationOutcome outcome = guarded.validate(json("'text'"));

        assertThat(outcome.violations())
                .singleElement()
                .isEqualTo(new Violation("$", PredicateSchema.KEYWORD, "expected a number"));
    }
}
