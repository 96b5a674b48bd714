package com.stagegraph.definition.parser;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Shape checks for a manifest document. Runs before any field is read into the model.
 */
final class ManifestSchema {

    static final String KIND = "manifest";

    private ManifestSchema() {
    }

    static void check(JsonNode root, SchemaChecker checker) {
        checker.requireNonBlankString(root, "name", "");
        checker.requireNonBlankString(root, "persona", "");
        checker.optionalString(root, "description", "");
        checker.optionalString(root, "category", "");
        checker.optionalString(root, "authors", "");
        checker.optionalStringOrNumber(root, "version", "");
        checker.optionalBoolean(root, "locked", "");

        JsonNode stages = root.get("stages");
        if (stages == null || stages.isNull()) {
            checker.violation("stages", "is required");
            return;
        }
        if (!stages.isArray()) {
            checker.violation("stages", "must be a list");
            return;
        }
        if (stages.isEmpty()) {
            checker.violation("stages", "must contain at least one stage");
            return;
        }
        for (int i = 0; i < stages.size(); i++) {
            checkStage(stages.get(i), SchemaChecker.index("stages", i), checker);
        }
    }

    private static void checkStage(JsonNode stage, String prefix, SchemaChecker checker) {
        if (!stage.isObject()) {
            checker.violation(prefix, "must be a mapping");
            return;
        }
        checker.requireNonBlankString(stage, "id", prefix);
        checker.requireNonEmptyStringList(stage, "produces", prefix);
        checker.optionalString(stage, "name", prefix);
        checker.optionalString(stage, "phase", prefix);
        checker.optionalBoolean(stage, "optional", prefix);
        checker.optionalBoolean(stage, "structural", prefix);
        checker.optionalMapping(stage, "parameters", prefix);
        checker.optionalString(stage, "instruction", prefix);
        checker.optionalStringList(stage, "commands", prefix);
        checker.optionalString(stage, "narrative", prefix);
        checker.optionalStringList(stage, "blueprint", prefix);
        checkPrevious(stage, prefix, checker);
        checkHandler(stage, prefix, checker);
        checkSkipWarning(stage, prefix, checker);
    }

    private static void checkPrevious(JsonNode stage, String prefix, SchemaChecker checker) {
        JsonNode previous = stage.get("previous");
        if (previous == null || previous.isNull()) return;
        String p = SchemaChecker.path(prefix, "previous");
        if (previous.isTextual()) {
            if (previous.asText().isBlank()) checker.violation(p, "must not be blank");
            return;
        }
        if (!previous.isArray()) {
            checker.violation(p, "must be null, a stage id or a list of stage ids");
            return;
        }
        if (previous.isEmpty()) {
            checker.violation(p, "must not be an empty list; omit it or use null for a root stage");
            return;
        }
        for (int i = 0; i < previous.size(); i++) {
            JsonNode item = previous.get(i);
            if (!item.isTextual() || item.asText().isBlank()) {
                checker.violation(SchemaChecker.index(p, i), "must be a non-blank string");
            }
        }
    }

    private static void checkHandler(JsonNode stage, String prefix, SchemaChecker checker) {
        JsonNode handler = stage.get("handler");
        if (handler == null || handler.isNull()) return;
        String p = SchemaChecker.path(prefix, "handler");
        if (!handler.isTextual()) {
            checker.violation(p, "must be a string");
        } else if (!SchemaChecker.HANDLER_PATTERN.matcher(handler.asText()).matches()) {
            checker.violation(p, "must be a lowercase identifier (" + SchemaChecker.HANDLER_PATTERN.pattern() + ")");
        }
    }

    private static void checkSkipWarning(JsonNode stage, String prefix, SchemaChecker checker) {
        JsonNode warning = stage.get("skip_warning");
        if (warning == null || warning.isNull()) return;
        String p = SchemaChecker.path(prefix, "skip_warning");
        if (!warning.isObject()) {
            checker.violation(p, "must be a mapping");
            return;
        }
        checker.requireNonBlankString(warning, "short", p);
        checker.requireNonBlankString(warning, "reason", p);
        JsonNode max = warning.get("max_warnings");
        if (max != null && !max.isNull() && (!max.isIntegralNumber() || max.asInt() < 0)) {
            checker.violation(SchemaChecker.path(p, "max_warnings"), "must be a non-negative integer");
        }
    }
}
