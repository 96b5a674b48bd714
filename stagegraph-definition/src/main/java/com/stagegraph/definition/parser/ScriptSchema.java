package com.stagegraph.definition.parser;

import com.fasterxml.jackson.databind.JsonNode;

/** Shape checks for a script document (a parameter overlay on a manifest). */
final class ScriptSchema {

    static final String KIND = "script";

    private ScriptSchema() {
    }

    static void check(JsonNode root, SchemaChecker checker) {
        checker.optionalString(root, "name", "");
        checker.requireNonBlankString(root, "manifest", "");
        checker.optionalString(root, "description", "");
        checker.optionalString(root, "authors", "");
        checker.optionalStringOrNumber(root, "version", "");

        JsonNode stages = root.get("stages");
        if (stages == null || stages.isNull()) return;
        if (!stages.isArray()) {
            checker.violation("stages", "must be a list");
            return;
        }
        for (int i = 0; i < stages.size(); i++) {
            JsonNode entry = stages.get(i);
            String prefix = SchemaChecker.index("stages", i);
            if (!entry.isObject()) {
                checker.violation(prefix, "must be a mapping");
                continue;
            }
            checker.requireNonBlankString(entry, "id", prefix);
            checker.optionalBoolean(entry, "skip", prefix);
            checker.optionalMapping(entry, "parameters", prefix);
        }
    }
}
