package com.stagegraph.definition.topology;

import com.stagegraph.definition.model.GraphDefinition;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.Set;

/**
 * Kahn's algorithm over a {@link GraphDefinition}. Among stages that become available at the same
 * time, the one declared first comes first, so the order is stable across runs.
 * Parent references that do not resolve are ignored here; {@link DefinitionValidator} reports them.
 */
public final class TopologicalOrder {

    private TopologicalOrder() {
    }

    /**
     * Stage ids in dependency order.
     *
     * @throws IllegalStateException if the definition contains a cycle
     */
    public static List<String> of(GraphDefinition definition) {
        List<String> sorted = sort(definition);
        if (sorted.size() < definition.size()) {
            throw new IllegalStateException("Stage graph contains a cycle among: " + unsorted(definition, sorted));
        }
        return sorted;
    }

    /** Ids that cannot be ordered because they sit on or behind a cycle; empty when the graph is acyclic. */
    public static List<String> cycleMembers(GraphDefinition definition) {
        return unsorted(definition, sort(definition));
    }

    public static boolean isAcyclic(GraphDefinition definition) {
        return sort(definition).size() == definition.size();
    }

    private static List<String> sort(GraphDefinition definition) {
        List<String> ids = definition.getOrderedNodeIds();
        Map<String, Integer> position = new HashMap<>();
        for (int i = 0; i < ids.size(); i++) {
            position.put(ids.get(i), i);
        }

        Map<String, Integer> inDegree = new HashMap<>();
        Map<String, List<String>> children = new HashMap<>();
        for (String id : ids) {
            Set<String> parents = new LinkedHashSet<>(definition.parentsOf(id));
            int degree = 0;
            for (String parent : parents) {
                if (!definition.containsNode(parent)) continue;
                degree++;
                children.computeIfAbsent(parent, k -> new ArrayList<>()).add(id);
            }
            inDegree.put(id, degree);
        }

        PriorityQueue<String> ready = new PriorityQueue<>((a, b) -> Integer.compare(position.get(a), position.get(b)));
        for (String id : ids) {
            if (inDegree.get(id) == 0) ready.add(id);
        }
        List<String> sorted = new ArrayList<>(ids.size());
        while (!ready.isEmpty()) {
            String id = ready.poll();
            sorted.add(id);
            for (String child : children.getOrDefault(id, List.of())) {
                int remaining = inDegree.merge(child, -1, Integer::sum);
                if (remaining == 0) ready.add(child);
            }
        }
        return sorted;
    }

    private static List<String> unsorted(GraphDefinition definition, List<String> sorted) {
        Set<String> done = new LinkedHashSet<>(sorted);
        List<String> rest = new ArrayList<>();
        for (String id : definition.getOrderedNodeIds()) {
            if (!done.contains(id)) rest.add(id);
        }
        return rest;
    }
}
