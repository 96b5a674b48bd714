package com.stagegraph.definition.topology;

import java.util.List;

/** Outcome of {@link DefinitionValidator#validate}. Valid exactly when there are no errors. */
public final class ValidationResult {

    private final List<String> errors;

    public ValidationResult(List<String> errors) {
        this.errors = errors != null ? List.copyOf(errors) : List.of();
    }

    public boolean isValid() {
        return errors.isEmpty();
    }

    public List<String> getErrors() {
        return errors;
    }

    @Override
    public String toString() {
        return isValid() ? "ValidationResult{valid}" : "ValidationResult{errors=" + errors + "}";
    }
}
