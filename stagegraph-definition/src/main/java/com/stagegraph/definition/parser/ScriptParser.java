package com.stagegraph.definition.parser;

import com.fasterxml.jackson.databind.JsonNode;
import com.stagegraph.definition.model.DefinitionSource;
import com.stagegraph.definition.model.GraphDefinition;
import com.stagegraph.definition.model.ScriptHeader;
import com.stagegraph.definition.model.SkipMarker;
import com.stagegraph.definition.model.StageNode;
import com.stagegraph.definition.model.StageParameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Script document + anchoring manifest → new {@link GraphDefinition}.
 * Every manifest node is cloned, then overrides are applied in declaration order; the manifest
 * itself is never touched. Topology (edges, roots, terminals) is carried over unchanged.
 */
final class ScriptParser {

    private static final Logger log = LoggerFactory.getLogger(ScriptParser.class);

    private ScriptParser() {
    }

    static GraphDefinition parse(String text, GraphDefinition manifest) {
        Objects.requireNonNull(manifest, "manifest");
        JsonNode root = YamlDocuments.readDocument(text, ScriptSchema.KIND);
        SchemaChecker checker = new SchemaChecker(ScriptSchema.KIND);
        ScriptSchema.check(root, checker);
        checker.throwIfAny();

        String name = YamlDocuments.text(root, "name", "");
        Map<String, StageNode> nodes = new LinkedHashMap<>();
        for (StageNode node : manifest.getNodes()) {
            nodes.put(node.getId(), node.withParameters(
                    new StageParameters(node.getParameters().getValues(), node.getParameters().getSkipMarker().orElse(null))));
        }

        JsonNode stages = root.get("stages");
        int overrides = 0;
        if (stages != null && stages.isArray()) {
            for (JsonNode entry : stages) {
                String id = YamlDocuments.text(entry, "id", null);
                StageNode current = nodes.get(id);
                if (current == null) {
                    throw new UnknownStageReferenceException(id);
                }
                StageParameters params = current.getParameters().mergedWith(YamlDocuments.toMap(entry.get("parameters")));
                if (YamlDocuments.bool(entry, "skip", false)) {
                    params = params.withSkipMarker(new SkipMarker("script:" + (name.isEmpty() ? "unnamed" : name)));
                }
                nodes.put(id, current.withParameters(params));
                overrides++;
            }
        }

        ScriptHeader header = new ScriptHeader(
                name,
                YamlDocuments.text(root, "description", ""),
                YamlDocuments.text(root, "manifest", null),
                YamlDocuments.text(root, "version", "1.0.0"),
                YamlDocuments.text(root, "authors", ""));
        log.debug("Parsed script name={} manifest={} overrides={}", name, header.getManifest(), overrides);
        return new GraphDefinition(DefinitionSource.SCRIPT, header, new ArrayList<>(nodes.values()),
                manifest.getEdges(), manifest.getRootIds(), manifest.getTerminalIds());
    }
}
