package com.stagegraph.definition.parser;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Collects {@link SchemaViolation}s while walking a document tree. Each check records at most one
 * violation per field and never stops the walk, so a single parse reports every problem.
 */
final class SchemaChecker {

    static final Pattern HANDLER_PATTERN = Pattern.compile("^[a-z][a-z0-9_-]*$");

    private final String documentKind;
    private final List<SchemaViolation> violations = new ArrayList<>();

    SchemaChecker(String documentKind) {
        this.documentKind = documentKind;
    }

    static String path(String prefix, String field) {
        return prefix.isEmpty() ? field : prefix + "." + field;
    }

    static String index(String prefix, int i) {
        return prefix + "[" + i + "]";
    }

    void violation(String path, String message) {
        violations.add(new SchemaViolation(path, message));
    }

    List<SchemaViolation> getViolations() {
        return List.copyOf(violations);
    }

    /** Throws one {@link DefinitionParseException} carrying every violation collected so far. */
    void throwIfAny() {
        if (!violations.isEmpty()) {
            throw new DefinitionParseException(documentKind, violations);
        }
    }

    void requireNonBlankString(JsonNode parent, String field, String prefix) {
        JsonNode value = parent.get(field);
        String p = path(prefix, field);
        if (value == null || value.isNull()) {
            violation(p, "is required");
        } else if (!value.isTextual()) {
            violation(p, "must be a string");
        } else if (value.asText().isBlank()) {
            violation(p, "must not be blank");
        }
    }

    void optionalString(JsonNode parent, String field, String prefix) {
        JsonNode value = parent.get(field);
        if (value != null && !value.isNull() && !value.isTextual()) {
            violation(path(prefix, field), "must be a string");
        }
    }

    /** Version fields accept {@code 1.0.0} as well as a bare number such as {@code 2}. */
    void optionalStringOrNumber(JsonNode parent, String field, String prefix) {
        JsonNode value = parent.get(field);
        if (value != null && !value.isNull() && !value.isTextual() && !value.isNumber()) {
            violation(path(prefix, field), "must be a string or number");
        }
    }

    void optionalBoolean(JsonNode parent, String field, String prefix) {
        JsonNode value = parent.get(field);
        if (value != null && !value.isNull() && !value.isBoolean()) {
            violation(path(prefix, field), "must be a boolean");
        }
    }

    void optionalMapping(JsonNode parent, String field, String prefix) {
        JsonNode value = parent.get(field);
        if (value != null && !value.isNull() && !value.isObject()) {
            violation(path(prefix, field), "must be a mapping");
        }
    }

    void optionalStringList(JsonNode parent, String field, String prefix) {
        JsonNode value = parent.get(field);
        if (value == null || value.isNull()) return;
        String p = path(prefix, field);
        if (!value.isArray()) {
            violation(p, "must be a list of strings");
            return;
        }
        checkStringItems(value, p);
    }

    void requireNonEmptyStringList(JsonNode parent, String field, String prefix) {
        JsonNode value = parent.get(field);
        String p = path(prefix, field);
        if (value == null || value.isNull()) {
            violation(p, "is required");
        } else if (!value.isArray()) {
            violation(p, "must be a list of strings");
        } else if (value.isEmpty()) {
            violation(p, "must contain at least one entry");
        } else {
            checkStringItems(value, p);
        }
    }

    private void checkStringItems(JsonNode array, String p) {
        for (int i = 0; i < array.size(); i++) {
            JsonNode item = array.get(i);
            if (!item.isTextual() || item.asText().isBlank()) {
                violation(index(p, i), "must be a non-blank string");
            }
        }
    }
}
