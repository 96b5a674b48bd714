package com.stagegraph.definition.parser;

import com.stagegraph.definition.model.GraphDefinition;

/**
 * Entry point for turning manifest and script documents into {@link GraphDefinition}s.
 * Stateless and safe to share between threads.
 */
public final class DefinitionParser {

    /**
     * Parses a manifest.
     *
     * @throws DefinitionParseException with every schema and structural violation found,
     *                                  or a cycle among the stages
     */
    public GraphDefinition parseManifest(String text) {
        return ManifestParser.parse(text);
    }

    /**
     * Applies a script to an already-parsed manifest. The manifest definition is not modified.
     *
     * @throws DefinitionParseException        if the script document is malformed
     * @throws UnknownStageReferenceException if an override names a stage the manifest lacks
     */
    public GraphDefinition parseScript(String text, GraphDefinition manifest) {
        return ScriptParser.parse(text, manifest);
    }

    /** Reads only the {@code manifest} reference of a script, without applying it. */
    public String scriptManifestReference(String text) {
        var root = YamlDocuments.readDocument(text, ScriptSchema.KIND);
        SchemaChecker checker = new SchemaChecker(ScriptSchema.KIND);
        checker.requireNonBlankString(root, "manifest", "");
        checker.throwIfAny();
        return root.get("manifest").asText();
    }
}
