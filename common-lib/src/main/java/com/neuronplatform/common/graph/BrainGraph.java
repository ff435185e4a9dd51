package com.neuronplatform.common.graph;

import com.neuronplatform.common.exception.DanglingReferenceException;
import com.neuronplatform.common.exception.DuplicateIdentifierException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Owner of all nodes and edges.
 *
 * <p>Nodes live in an insertion-ordered arena addressed by a compact integer index;
 * the id → index table is filled once, on insert. Edges are kept in insertion order
 * together with outgoing-by-source and incoming-by-target indices. Every traversal
 * exposed here is insertion-ordered, which is what makes tie-breaks in dynamics,
 * arbitration and generation reproducible.
 *
 * <p>There is no removal. Not thread-safe: one graph is driven by one turn at a time.
 */
public class BrainGraph {

    static final String NO_GOALS_PROBLEM = "No goal nodes defined in graph";

    private final List<Node>           nodes     = new ArrayList<>();
    private final Map<String, Integer> indexById = new HashMap<>();
    private final List<Edge>           edges     = new ArrayList<>();
    private final List<List<Edge>>     outgoing  = new ArrayList<>();
    private final List<List<Edge>>     incoming  = new ArrayList<>();

    /**
     * Inserts a node and opens empty adjacency slots for it.
     *
     * @throws DuplicateIdentifierException if the id is already present
     */
    public void addNode(Node node) {
        if (indexById.containsKey(node.getId())) {
            throw new DuplicateIdentifierException(node.getId());
        }
        indexById.put(node.getId(), nodes.size());
        nodes.add(node);
        outgoing.add(new ArrayList<>());
        incoming.add(new ArrayList<>());
    }

    /**
     * Appends an edge to the edge list and both adjacency indices.
     *
     * @throws DanglingReferenceException if either endpoint is absent
     */
    public void addEdge(Edge edge) {
        Integer source = indexById.get(edge.getSourceId());
        if (source == null) {
            throw new DanglingReferenceException("source", edge.getSourceId());
        }
        Integer target = indexById.get(edge.getTargetId());
        if (target == null) {
            throw new DanglingReferenceException("target", edge.getTargetId());
        }
        edges.add(edge);
        outgoing.get(source).add(edge);
        incoming.get(target).add(edge);
    }

    public Optional<Node> node(String id) {
        Integer idx = indexById.get(id);
        return idx == null ? Optional.empty() : Optional.of(nodes.get(idx));
    }

    /** Arena index of the node, or {@code -1} when absent. */
    public int indexOf(String id) {
        Integer idx = indexById.get(id);
        return idx == null ? -1 : idx;
    }

    public boolean contains(String id) {
        return indexById.containsKey(id);
    }

    /** Nodes in insertion order (read-only view). */
    public List<Node> nodes() {
        return Collections.unmodifiableList(nodes);
    }

    /** Edges in insertion order (read-only view). */
    public List<Edge> edges() {
        return Collections.unmodifiableList(edges);
    }

    public List<Edge> outgoing(String id) {
        Integer idx = indexById.get(id);
        return idx == null ? List.of() : Collections.unmodifiableList(outgoing.get(idx));
    }

    public List<Edge> incoming(String id) {
        Integer idx = indexById.get(id);
        return idx == null ? List.of() : Collections.unmodifiableList(incoming.get(idx));
    }

    public List<Node> nodesByCategory(NodeCategory category) {
        List<Node> matches = new ArrayList<>();
        for (Node n : nodes) {
            if (n.getCategory() == category) matches.add(n);
        }
        return matches;
    }

    public int nodeCount() {
        return nodes.size();
    }

    public int edgeCount() {
        return edges.size();
    }

    public void resetActivations() {
        for (Node n : nodes) n.reset();
    }

    public void resetContributions() {
        for (Edge e : edges) e.resetContribution();
    }

    /**
     * Structural check over the whole graph. Never throws; the caller decides
     * whether any reported problem is fatal.
     *
     * @return problems in discovery order: dangling endpoints per edge, then a
     *         missing-goal finding; empty when the graph is consistent
     */
    public List<String> validate() {
        List<String> problems = new ArrayList<>();
        for (Edge e : edges) {
            if (!indexById.containsKey(e.getSourceId())) {
                problems.add("Edge references missing source: " + e.getSourceId());
            }
            if (!indexById.containsKey(e.getTargetId())) {
                problems.add("Edge references missing target: " + e.getTargetId());
            }
        }
        if (nodesByCategory(NodeCategory.GOAL).isEmpty()) {
            problems.add(NO_GOALS_PROBLEM);
        }
        return problems;
    }

    public String summary() {
        return nodes.size() + " nodes, " + edges.size() + " edges";
    }
}
