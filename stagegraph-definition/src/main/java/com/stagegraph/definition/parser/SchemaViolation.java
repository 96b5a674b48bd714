package com.stagegraph.definition.parser;

import java.util.Objects;

/** One problem found in a document, tagged with the field path (e.g. {@code stages[2].produces}). */
public final class SchemaViolation {

    private final String path;
    private final String message;

    public SchemaViolation(String path, String message) {
        this.path = path != null ? path : "";
        this.message = Objects.requireNonNull(message, "message");
    }

    /** Field path; empty for the document root. */
    public String getPath() {
        return path;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SchemaViolation that = (SchemaViolation) o;
        return path.equals(that.path) && message.equals(that.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(path, message);
    }

    @Override
    public String toString() {
        return "[" + path + "] " + message;
    }
}
