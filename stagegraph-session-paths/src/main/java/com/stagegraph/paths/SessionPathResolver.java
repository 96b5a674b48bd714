package com.stagegraph.paths;

import com.stagegraph.definition.model.GraphDefinition;
import com.stagegraph.definition.model.StageNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Derives the session-tree layout from topology. Each stage nests under its primary-parent
 * chain (first entry of {@code previous}, up to a root). Ancestors that are structural
 * (gates, joins) or optional with a parent of their own (bypass branches) are left out of the path,
 * so adding or removing them never moves a descendant. Optional roots stay in.
 * <p>
 * Never throws for a parsed definition: a missing parent or a revisited id ends the walk.
 */
public final class SessionPathResolver {

    private static final Logger log = LoggerFactory.getLogger(SessionPathResolver.class);

    private SessionPathResolver() {
    }

    /** Paths for every stage, in declaration order. */
    public static Map<String, StagePath> resolvePaths(GraphDefinition definition) {
        Map<String, StagePath> paths = new LinkedHashMap<>();
        for (StageNode node : definition.getNodes()) {
            paths.put(node.getId(), pathFor(definition, node));
        }
        return paths;
    }

    /**
     * Path for one stage.
     *
     * @throws IllegalArgumentException if the definition has no such stage
     */
    public static StagePath resolvePath(GraphDefinition definition, String stageId) {
        StageNode node = definition.getNode(stageId);
        if (node == null) {
            throw new IllegalArgumentException("Unknown stage: '" + stageId + "'");
        }
        return pathFor(definition, node);
    }

    private static StagePath pathFor(GraphDefinition definition, StageNode node) {
        Deque<String> segments = new ArrayDeque<>();
        segments.addFirst(node.getId());
        Set<String> visited = new HashSet<>();
        visited.add(node.getId());

        String parentId = node.getPrimaryParent();
        while (parentId != null) {
            StageNode parent = definition.getNode(parentId);
            if (parent == null) {
                log.debug("Path walk for stage={} stopped at unknown parent={}", node.getId(), parentId);
                break;
            }
            if (!visited.add(parentId)) {
                log.debug("Path walk for stage={} stopped at revisited stage={}", node.getId(), parentId);
                break;
            }
            if (!isTransparent(parent)) {
                segments.addFirst(parentId);
            }
            parentId = parent.getPrimaryParent();
        }

        String fileName = node.getProduces().isEmpty() ? node.getId() + ".json" : node.getProduces().get(0);
        return new StagePath(String.join("/", segments), fileName);
    }

    /** Structural stages and non-root optional stages do not appear in descendants' paths. */
    static boolean isTransparent(StageNode ancestor) {
        return ancestor.isStructural() || (ancestor.isOptional() && ancestor.getPrimaryParent() != null);
    }
}
