package io.versionedentity.core.model;

import java.util.Objects;

/**
 * A single structural rejection reported by a schema.
 *
 * @param path    JSON path of the offending value, rooted at {@code $} (e.g. {@code $.variables[0].name})
 * @param keyword the schema keyword that failed (e.g. {@code type}, {@code required}), never null
 * @param message human-readable description of the expected/actual mismatch
 */
public record Violation(String path, String keyword, String message) {

    /** Path of the document root. */
    public static final String ROOT = "$";

    public Violation {
        Objects.requireNonNull(path, "path must not be null");
        Objects.requireNonNull(keyword, "keyword must not be null");
        Objects.requireNonNull(message, "message must not be null");
    }

    /**
     * Re-roots this violation under a field of an enclosing object. A violation at {@code $.a}
     * nested under field {@code child} becomes {@code $.child.a}.
     *
     * @param field the field name in the enclosing object
     * @return a new violation with the prefixed path
     */
    public Violation under(String field) {
        String relative = path.startsWith(ROOT) ? path.substring(ROOT.length()) : "." + path;
        return new Violation(ROOT + "." + field + relative, keyword, message);
    }

    @Override
    public String toString() {
        return path + " [" + keyword + "]: " + message;
    }
}
