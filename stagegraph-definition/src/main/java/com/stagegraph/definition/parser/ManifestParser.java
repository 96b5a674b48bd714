package com.stagegraph.definition.parser;

import com.fasterxml.jackson.databind.JsonNode;
import com.stagegraph.definition.model.DefinitionSource;
import com.stagegraph.definition.model.GraphDefinition;
import com.stagegraph.definition.model.ManifestHeader;
import com.stagegraph.definition.model.SkipWarning;
import com.stagegraph.definition.model.StageEdge;
import com.stagegraph.definition.model.StageNode;
import com.stagegraph.definition.model.StageParameters;
import com.stagegraph.definition.topology.TopologicalOrder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Manifest document → {@link GraphDefinition}.
 * <ol>
 *   <li>schema pass over the raw tree (all violations collected),</li>
 *   <li>structural pass: duplicate ids and dangling {@code previous} references (collected),</li>
 *   <li>cycle detection on the built graph.</li>
 * </ol>
 * Edges are derived from {@code previous} after every node is indexed.
 */
final class ManifestParser {

    private static final Logger log = LoggerFactory.getLogger(ManifestParser.class);

    private ManifestParser() {
    }

    static GraphDefinition parse(String text) {
        JsonNode root = YamlDocuments.readDocument(text, ManifestSchema.KIND);
        SchemaChecker checker = new SchemaChecker(ManifestSchema.KIND);
        ManifestSchema.check(root, checker);
        checker.throwIfAny();

        JsonNode stages = root.get("stages");
        List<StageNode> nodes = new ArrayList<>(stages.size());
        for (JsonNode stage : stages) {
            nodes.add(toNode(stage));
        }
        checkStructure(nodes, checker);
        checker.throwIfAny();

        List<StageEdge> edges = new ArrayList<>();
        List<String> roots = new ArrayList<>();
        Set<String> parentsSeen = new HashSet<>();
        for (StageNode node : nodes) {
            if (node.isRoot()) {
                roots.add(node.getId());
                continue;
            }
            for (String parent : new LinkedHashSet<>(node.getPrevious())) {
                edges.add(new StageEdge(parent, node.getId()));
                parentsSeen.add(parent);
            }
        }
        List<String> terminals = new ArrayList<>();
        for (StageNode node : nodes) {
            if (!parentsSeen.contains(node.getId())) terminals.add(node.getId());
        }

        ManifestHeader header = new ManifestHeader(
                YamlDocuments.text(root, "name", null),
                YamlDocuments.text(root, "description", ""),
                YamlDocuments.text(root, "category", ""),
                YamlDocuments.text(root, "persona", null),
                YamlDocuments.text(root, "version", "1.0.0"),
                YamlDocuments.bool(root, "locked", false),
                YamlDocuments.text(root, "authors", ""));
        GraphDefinition definition = new GraphDefinition(DefinitionSource.MANIFEST, header, nodes, edges, roots, terminals);

        List<String> cycle = TopologicalOrder.cycleMembers(definition);
        if (!cycle.isEmpty()) {
            checker.violation("stages", "cycle detected among stages " + cycle);
            checker.throwIfAny();
        }
        log.debug("Parsed manifest name={} stages={} edges={} roots={} terminals={}",
                header.getName(), nodes.size(), edges.size(), roots, terminals);
        return definition;
    }

    private static StageNode toNode(JsonNode stage) {
        String id = YamlDocuments.text(stage, "id", null);
        JsonNode warning = stage.get("skip_warning");
        SkipWarning skipWarning = null;
        if (warning != null && warning.isObject()) {
            JsonNode max = warning.get("max_warnings");
            skipWarning = new SkipWarning(
                    YamlDocuments.text(warning, "short", ""),
                    YamlDocuments.text(warning, "reason", ""),
                    max != null && !max.isNull() ? max.asInt() : null);
        }
        return new StageNode(
                id,
                YamlDocuments.text(stage, "name", id),
                YamlDocuments.text(stage, "phase", null),
                YamlDocuments.stringListOrNull(stage, "previous"),
                YamlDocuments.bool(stage, "optional", false),
                YamlDocuments.bool(stage, "structural", false),
                YamlDocuments.stringList(stage, "produces"),
                StageParameters.of(YamlDocuments.toMap(stage.get("parameters"))),
                YamlDocuments.text(stage, "instruction", ""),
                YamlDocuments.stringList(stage, "commands"),
                YamlDocuments.text(stage, "handler", null),
                skipWarning,
                YamlDocuments.text(stage, "narrative", null),
                YamlDocuments.stringList(stage, "blueprint"));
    }

    private static void checkStructure(List<StageNode> nodes, SchemaChecker checker) {
        Set<String> ids = new HashSet<>();
        for (int i = 0; i < nodes.size(); i++) {
            String id = nodes.get(i).getId();
            if (!ids.add(id)) {
                checker.violation(SchemaChecker.path(SchemaChecker.index("stages", i), "id"),
                        "duplicate stage id '" + id + "'");
            }
        }
        for (int i = 0; i < nodes.size(); i++) {
            StageNode node = nodes.get(i);
            if (node.isRoot()) continue;
            for (String parent : node.getPrevious()) {
                if (!ids.contains(parent)) {
                    checker.violation(SchemaChecker.path(SchemaChecker.index("stages", i), "previous"),
                            "stage '" + node.getId() + "' references unknown stage '" + parent + "'");
                }
            }
            if (node.getPrevious().contains(node.getId())) {
                checker.violation(SchemaChecker.path(SchemaChecker.index("stages", i), "previous"),
                        "stage '" + node.getId() + "' lists itself as a parent");
            }
        }
    }
}
