package com.stagegraph.definition.parser;

import com.stagegraph.definition.model.DefinitionSource;
import com.stagegraph.definition.model.GraphDefinition;
import com.stagegraph.definition.model.ScriptHeader;
import com.stagegraph.definition.model.StageNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ScriptParserTest {

    private static final String MANIFEST = """
            name: Discovery
            persona: fedml
            stages:
              - id: search
                optional: true
                produces: [search.json]
                parameters:
                  keywords: [brain]
                  limit: 10
              - id: gather
                previous: search
                produces: [gather.json]
              - id: harmonize
                previous: gather
                produces: [harmonize.json]
            """;

    private final DefinitionParser parser = new DefinitionParser();
    private GraphDefinition manifest;

    @BeforeEach
    void setUp() {
        manifest = parser.parseManifest(MANIFEST);
    }

    @Test
    void parseScript_mergesParametersOverManifestValues() {
        GraphDefinition script = parser.parseScript("""
                name: quick-run
                manifest: discovery
                stages:
                  - id: search
                    parameters:
                      limit: 50
                      site: bch
                """, manifest);

        assertEquals(DefinitionSource.SCRIPT, script.getSource());
        Map<String, Object> values = script.getNode("search").getParameters().getValues();
        assertEquals(List.of("keywords", "limit", "site"), List.copyOf(values.keySet()));
        assertEquals(50, values.get("limit"));
        assertEquals("bch", values.get("site"));
        assertEquals("discovery", ((ScriptHeader) script.getHeader()).getManifest());
    }

    @Test
    void parseScript_skipAttachesMarkerWithoutTouchingParameterMap() {
        GraphDefinition script = parser.parseScript("""
                name: no-search
                manifest: discovery
                stages:
                  - id: search
                    skip: true
                """, manifest);

        StageNode search = script.getNode("search");
        assertTrue(search.isSkipped());
        assertEquals("script:no-search", search.getParameters().getSkipMarker().orElseThrow().getOrigin());
        assertFalse(search.getParameters().getValues().containsKey("skip"));
        assertFalse(script.getNode("gather").isSkipped());
    }

    @Test
    void parseScript_neverMutatesManifest() {
        StageNode before = manifest.getNode("search");

        parser.parseScript("""
                manifest: discovery
                stages:
                  - id: search
                    skip: true
                    parameters:
                      limit: 99
                """, manifest);

        assertEquals(before, manifest.getNode("search"));
        assertEquals(10, manifest.getNode("search").getParameters().getValues().get("limit"));
        assertFalse(manifest.getNode("search").isSkipped());
    }

    @Test
    void parseScript_copiesTopologyFromManifest() {
        GraphDefinition script = parser.parseScript("manifest: discovery\n", manifest);

        assertEquals(manifest.getOrderedNodeIds(), script.getOrderedNodeIds());
        assertEquals(manifest.getEdges(), script.getEdges());
        assertEquals(manifest.getRootIds(), script.getRootIds());
        assertEquals(manifest.getTerminalIds(), script.getTerminalIds());
    }

    @Test
    void parseScript_laterOverrideForSameStageWins() {
        GraphDefinition script = parser.parseScript("""
                manifest: discovery
                stages:
                  - id: gather
                    parameters: {mode: fast}
                  - id: gather
                    parameters: {mode: thorough}
                """, manifest);

        assertEquals("thorough", script.getNode("gather").getParameters().getValues().get("mode"));
    }

    @Test
    void parseScript_unknownStageIsRejectedByName() {
        UnknownStageReferenceException e = assertThrows(UnknownStageReferenceException.class, () -> parser.parseScript("""
                manifest: discovery
                stages:
                  - id: search
                    skip: true
                  - id: nonexistent
                    skip: true
                """, manifest));

        assertEquals("nonexistent", e.getStageId());
        assertTrue(e.getMessage().contains("'nonexistent'"));
        assertFalse(manifest.getNode("search").isSkipped());
    }

    @Test
    void parseScript_reportsSchemaViolations() {
        DefinitionParseException e = assertThrows(DefinitionParseException.class, () -> parser.parseScript("""
                name: bad
                stages:
                  - skip: maybe
                  - id: gather
                    parameters: [not, a, map]
                """, manifest));

        assertTrue(e.hasViolationAt("manifest"));
        assertTrue(e.hasViolationAt("stages[0].id"));
        assertTrue(e.hasViolationAt("stages[0].skip"));
        assertTrue(e.hasViolationAt("stages[1].parameters"));
        assertTrue(e.getMessage().startsWith("Invalid script: "));
    }

    @Test
    void scriptManifestReference_readsReferenceOnly() {
        assertEquals("discovery", parser.scriptManifestReference("manifest: discovery\nstages: []\n"));
    }
}
