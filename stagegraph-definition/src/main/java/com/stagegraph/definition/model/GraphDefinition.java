package com.stagegraph.definition.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Parsed stage graph, the common output of the manifest and script parsers.
 * Nodes are keyed by id and kept in declaration order; edges point parent → child.
 * Immutable: overlays build a new definition instead of changing this one.
 */
public final class GraphDefinition {

    private final DefinitionSource source;
    private final DefinitionHeader header;
    private final Map<String, StageNode> nodes;
    private final List<String> orderedNodeIds;
    private final List<StageEdge> edges;
    private final List<String> rootIds;
    private final List<String> terminalIds;

    /**
     * @param nodes nodes in declaration order; ids must be unique
     */
    public GraphDefinition(
            DefinitionSource source,
            DefinitionHeader header,
            List<StageNode> nodes,
            List<StageEdge> edges,
            List<String> rootIds,
            List<String> terminalIds) {
        this.source = Objects.requireNonNull(source, "source");
        this.header = header;
        Map<String, StageNode> byId = new LinkedHashMap<>();
        List<String> order = new ArrayList<>();
        for (StageNode node : nodes) {
            if (byId.putIfAbsent(node.getId(), node) != null) {
                throw new IllegalArgumentException("Duplicate stage id: '" + node.getId() + "'");
            }
            order.add(node.getId());
        }
        this.nodes = Collections.unmodifiableMap(byId);
        this.orderedNodeIds = List.copyOf(order);
        this.edges = edges != null ? List.copyOf(edges) : List.of();
        this.rootIds = rootIds != null ? List.copyOf(rootIds) : List.of();
        this.terminalIds = terminalIds != null ? List.copyOf(terminalIds) : List.of();
    }

    public DefinitionSource getSource() {
        return source;
    }

    public DefinitionHeader getHeader() {
        return header;
    }

    /** Node by id, or null when absent. */
    public StageNode getNode(String id) {
        return id != null ? nodes.get(id) : null;
    }

    public boolean containsNode(String id) {
        return id != null && nodes.containsKey(id);
    }

    /** All nodes in declaration order. */
    public Collection<StageNode> getNodes() {
        return nodes.values();
    }

    public List<String> getOrderedNodeIds() {
        return orderedNodeIds;
    }

    public List<StageEdge> getEdges() {
        return edges;
    }

    public List<String> getRootIds() {
        return rootIds;
    }

    public List<String> getTerminalIds() {
        return terminalIds;
    }

    public int size() {
        return nodes.size();
    }

    public boolean isTerminal(String id) {
        return terminalIds.contains(id);
    }

    /** Child ids of {@code id} in edge order. */
    public List<String> childrenOf(String id) {
        List<String> children = new ArrayList<>();
        for (StageEdge edge : edges) {
            if (edge.getFrom().equals(id)) children.add(edge.getTo());
        }
        return children;
    }

    /** Parent ids of {@code id} as declared; empty for a root or unknown id. */
    public List<String> parentsOf(String id) {
        StageNode node = getNode(id);
        return node != null && node.getPrevious() != null ? node.getPrevious() : List.of();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        GraphDefinition that = (GraphDefinition) o;
        return source == that.source && Objects.equals(header, that.header)
                && orderedNodeIds.equals(that.orderedNodeIds)
                && nodes.equals(that.nodes) && edges.equals(that.edges)
                && rootIds.equals(that.rootIds) && terminalIds.equals(that.terminalIds);
    }

    @Override
    public int hashCode() {
        return Objects.hash(source, header, nodes, orderedNodeIds, edges, rootIds, terminalIds);
    }
}
