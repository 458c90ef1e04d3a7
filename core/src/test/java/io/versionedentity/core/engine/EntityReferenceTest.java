package io.versionedentity.core.engine;

import static io.versionedentity.core.testkit.TestEntities.JSON;
import static io.versionedentity.core.testkit.TestEntities.json;
import static io.versionedentity.core.testkit.TestEntities.versionOnly;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.versionedentity.core.error.EntityInvariantViolation;
import io.versionedentity.core.model.ParseResult;
import io.versionedentity.core.model.ValidationOutcome;
import io.versionedentity.core.schema.Schemas;
import io.versionedentity.core.spi.EntitySchema;
import io.versionedentity.core.testkit.TestEntities;
import java.util.stream.Stream;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;
import org.slf4j.LoggerFactory;

/** Tests for {@link EntityReference}: embedding, migration of embedded values, and the is/safeParse agreement. */
@DisplayName("EntityReference")
class EntityReferenceTest {

    private static final VersionedEntity ENVIRONMENT = TestEntities.environmentEntity();
    private static final VersionedEntity RENAME = TestEntities.renameEntity();

    private final EntitySchema connected = Schemas.object(Schemas.jsonSchema(
                    json("{'type': 'object', 'required': ['v', 'testEntity'], 'properties': {'v': {'const': 1}}}")))
            .field("testEntity", EntityReference.to(ENVIRONMENT))
            .build();

    @Nested
    @DisplayName("Inside a composite schema")
    class Embedded {

        @Test
        void acceptsLatestVersion() {
            assertThat(connected.test(json("{'v': 1, 'testEntity': {'v': 2, 'name': 'test',"
                            + " 'variables': [{'name': 'test', 'value': 'test', 'masked': false}]}}")))
                    .isTrue();
        }

        @Test
        void leavesLatestVersionUnchanged() {
            ValidationOutcome outcome = connected.validate(json("{'v': 1, 'testEntity': {'v': 2, 'name': 'test',"
                    + " 'variables': [{'name': 'test', 'value': 'test', 'masked': false}]}}"));

            assertThat(outcome.isAccepted()).isTrue();
            assertThat(outcome.value().get("testEntity"))
                    .isEqualTo(json("{'v': 2, 'name': 'test',"
                            + " 'variables': [{'name': 'test', 'value': 'test', 'masked': false}]}"));
        }

        @Test
        void acceptsOldVersion() {
            assertThat(connected.test(json("{'v': 1, 'testEntity': {'v': 1, 'name': 'test',"
                            + " 'variables': [{'name': 'test', 'value': 'test'}]}}")))
                    .isTrue();
        }

        @Test
        void migratesOldVersionToLatest() {
            JsonNode input = json("{'v': 1, 'testEntity': {'v': 1, 'name': 'test',"
                    + " 'variables': [{'name': 'test', 'value': 'test'}]}}");
            JsonNode snapshot = input.deepCopy();

            ValidationOutcome outcome = connected.validate(input);

            assertThat(outcome.isAccepted()).isTrue();
            assertThat(outcome.value().get("testEntity"))
                    .isEqualTo(json("{'v': 2, 'name': 'test',"
                            + " 'variables': [{'name': 'test', 'value': 'test', 'masked': false}]}"));
            assertThat(input).isEqualTo(snapshot);
        }

        @Test
        void rejectsInvalidEmbeddedValueUnderItsFieldPath() {
            ValidationOutcome outcome = connected.validate(json("{'v': 1, 'testEntity': {'v': 7}}"));

            assertThat(outcome.isRejected()).isTrue();
            assertThat(outcome.violations())
                    .singleElement()
                    .satisfies(v -> {
                        assertThat(v.path()).isEqualTo("$.testEntity");
                        assertThat(v.message()).contains("environment");
                    });
        }
    }

    @Test
    @DisplayName("nested entities migrate independently: {v:1, c:4, child:{v:1, a:8}} -> {v:2, d:4, child:{v:2, b:8}}")
    void nestedComposition() {
        EntityReference child = EntityReference.to(RENAME);
        VersionedEntity parent = VersionedEntity.builder("parent")
                .initial(1, Schemas.object(TestEntities.numberField(1, "c")).field("child", child).build())
                .upgradeable(2, Schemas.object(TestEntities.numberField(2, "d")).field("child", child).build(), old -> JSON
                        .createObjectNode()
                        .put("v", 2)
                        .<ObjectNode>set("d", old.get("c"))
                        .set("child", old.get("child")))
                .versionField("v")
                .build();

        ParseResult result = parent.safeParse(json("{'v': 1, 'c': 4, 'child': {'v': 1, 'a': 8}}"));

        assertThat(result.isOk()).isTrue();
        assertThat(result.value()).isEqualTo(json("{'v': 2, 'd': 4, 'child': {'v': 2, 'b': 8}}"));
    }

    @Nested
    @DisplayName("Invariant violation")
    class InvariantViolation {

        private ListAppender<ILoggingEvent> logAppender;
        private Logger referenceLogger;

        /** Accepts {v:1} but cannot migrate it: version 2 is wrongly marked initial. */
        private final VersionedEntity corrupt = VersionedEntity.builder("corrupt")
                .initial(1, versionOnly(1))
                .initial(2, versionOnly(2))
                .upgradeable(3, versionOnly(3), old -> old)
                .versionField("v")
                .build();

        @BeforeEach
        void attachLogCapture() {
            referenceLogger = (Logger) LoggerFactory.getLogger(EntityReference.class);
            logAppender = new ListAppender<>();
            logAppender.start();
            referenceLogger.addAppender(logAppender);
        }

        @AfterEach
        void detachLogCapture() {
            referenceLogger.detachAppender(logAppender);
            logAppender.stop();
        }

        @Test
        void isAndSafeParseDisagreeingThrows() {
            assertThat(corrupt.is(json("{'v': 1}"))).isTrue();

            assertThatThrownBy(() -> EntityReference.to(corrupt).validate(json("{'v': 1}")))
                    .isInstanceOf(EntityInvariantViolation.class)
                    .hasMessageContaining("corrupt")
                    .hasMessageContaining("BUG_INTERMEDIATE_MARKED_INITIAL")
                    .satisfies(e -> assertThat(((EntityInvariantViolation) e).version()).isEqualTo(2));
            assertThat(logAppender.list).anySatisfy(event -> assertThat(event.getLevel()).isEqualTo(Level.ERROR));
        }

        @Test
        @DisplayName("is never downgraded to a validation rejection by an enclosing entity")
        void propagatesThroughEnclosingEntity() {
            VersionedEntity holder = VersionedEntity.builder("holder")
                    .initial(1, Schemas.object(versionOnly(1))
                            .field("inner", EntityReference.to(corrupt))
                            .build())
                    .versionField("v")
                    .build();

            assertThatThrownBy(() -> holder.safeParse(json("{'v': 1, 'inner': {'v': 1}}")))
                    .isInstanceOf(EntityInvariantViolation.class);
            assertThatThrownBy(() -> holder.is(json("{'v': 1, 'inner': {'v': 1}}")))
                    .isInstanceOf(EntityInvariantViolation.class);
        }

        @Test
        void valuesTheEntityRejectsAreOrdinaryRejections() {
            ValidationOutcome outcome = EntityReference.to(corrupt).validate(json("{'v': 5}"));

            assertThat(outcome.isRejected()).isTrue();
            assertThat(logAppender.list).isEmpty();
        }
    }

    static Stream<JsonNode> agreementInputs() {
        return Stream.of(
                json("{'v': 1, 'a': 5}"),
                json("{'v': 2, 'b': 5}"),
                json("{'v': 1, 'b': 5}"),
                json("{'v': 2, 'a': 5}"),
                json("{'v': 3, 'a': 5}"),
                json("{'v': 1.0, 'a': 5}"),
                json("{'v': '1', 'a': 5}"),
                json("{'a': 5}"),
                json("[1, 2]"),
                json("'text'"),
                json("null"),
                json("{'name': 'test', 'v': 1, 'variables': [{'name': 'x', 'value': 'y'}]}"),
                json("{'name': 'test', 'v': 2, 'variables': [{'name': 'x', 'masked': true}]}"),
                json("{'name': 'test', 'v': 2, 'variables': [{'name': 'x', 'value': 1}]}"));
    }

    @ParameterizedTest
    @MethodSource("agreementInputs")
    @DisplayName("is(x) implies safeParse(x) succeeds")
    void agreementLaw(JsonNode input) {
        for (VersionedEntity entity : new VersionedEntity[] {RENAME, ENVIRONMENT}) {
            if (entity.is(input)) {
                assertThat(entity.safeParse(input).isOk())
                        .as("%s accepted %s", entity.id(), input)
                        .isTrue();
                assertThat(EntityReference.to(entity).test(input)).isTrue();
            } else {
                assertThat(EntityReference.to(entity).test(input)).isFalse();
            }
        }
    }
}
