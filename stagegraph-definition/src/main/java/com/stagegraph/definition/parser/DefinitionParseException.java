package com.stagegraph.definition.parser;

import java.util.List;
import java.util.stream.Collectors;

/**
 * A manifest or script failed validation. Carries every violation found, not just the first;
 * the message lists them as {@code [path] message; [path] message}.
 */
public class DefinitionParseException extends DefinitionException {

    private final List<SchemaViolation> violations;

    public DefinitionParseException(String documentKind, List<SchemaViolation> violations) {
        super("Invalid " + documentKind + ": " + describe(violations));
        this.violations = List.copyOf(violations);
    }

    public DefinitionParseException(String documentKind, List<SchemaViolation> violations, Throwable cause) {
        super("Invalid " + documentKind + ": " + describe(violations), cause);
        this.violations = List.copyOf(violations);
    }

    public List<SchemaViolation> getViolations() {
        return violations;
    }

    /** True if some violation was reported for exactly this field path. */
    public boolean hasViolationAt(String path) {
        return violations.stream().anyMatch(v -> v.getPath().equals(path));
    }

    private static String describe(List<SchemaViolation> violations) {
        return violations.stream().map(SchemaViolation::toString).collect(Collectors.joining("; "));
    }
}
