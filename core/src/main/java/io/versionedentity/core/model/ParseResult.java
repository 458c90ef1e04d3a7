package io.versionedentity.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Objects;

/**
 * Outcome of {@code safeParse}. Exactly one of two states:
 *
 * <ul>
 * <li>{@link Type#OK}: {@code value} holds the input migrated to the latest version.
 * <li>{@link Type#ERR}: {@code error} says why parsing failed.
 * </ul>
 */
public final class ParseResult {

    /** The type of parse outcome. */
    public enum Type {
        OK,
        ERR
    }

    private final Type type;
    private final JsonNode value;
    private final ParseError error;

    private ParseResult(Type type, JsonNode value, ParseError error) {
        this.type = type;
        this.value = value;
        this.error = error;
    }

    /** Creates an OK result holding the value at the latest version. */
    public static ParseResult ok(JsonNode value) {
        Objects.requireNonNull(value, "value must not be null for OK");
        return new ParseResult(Type.OK, value, null);
    }

    /** Creates an ERR result. */
    public static ParseResult err(ParseError error) {
        Objects.requireNonNull(error, "error must not be null for ERR");
        return new ParseResult(Type.ERR, null, error);
    }

    public Type type() {
        return type;
    }

    /** Returns the migrated value. Only valid when {@code type() == OK}. */
    public JsonNode value() {
        return value;
    }

    /** Returns the error. Only valid when {@code type() == ERR}. */
    public ParseError error() {
        return error;
    }

    public boolean isOk() {
        return type == Type.OK;
    }

    public boolean isErr() {
        return type == Type.ERR;
    }

    @Override
    public String toString() {
        return switch (type) {
            case OK -> "ParseResult[OK]";
            case ERR -> "ParseResult[ERR, " + error.kind() + ": " + error.describe() + "]";
        };
    }
}
