package io.decisionflow.core.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * A compiled decision graph, handed as a whole to the execution engine.
 *
 * <p>The first node is always the {@link NodeContent.Input} sentinel and the last one the {@link
 * NodeContent.Output} sentinel; no other node is a sentinel. Cycles and unreachable nodes are
 * allowed. Immutable.
 *
 * @param nodes nodes in compile order
 * @param edges edges in derivation order; duplicates are kept
 */
public record DecisionGraph(List<DecisionNode> nodes, List<DecisionEdge> edges) {

    /**
     * Canonical constructor.
     *
     * @throws IllegalArgumentException if the sentinel layout is violated
     */
    public DecisionGraph {
        nodes = List.copyOf(Objects.requireNonNull(nodes, "nodes must not be null"));
        edges = List.copyOf(Objects.requireNonNull(edges, "edges must not be null"));
        if (nodes.size() < 2
                || !(nodes.get(0).content() instanceof NodeContent.Input)
                || !(nodes.get(nodes.size() - 1).content() instanceof NodeContent.Output)) {
            throw new IllegalArgumentException("graph must start with an input node and end with an output node");
        }
        for (DecisionNode node : nodes.subList(1, nodes.size() - 1)) {
            if (node.isSentinel()) {
                throw new IllegalArgumentException("sentinel node '" + node.id() + "' inside the graph");
            }
        }
    }

    public DecisionNode inputNode() {
        return nodes.get(0);
    }

    public DecisionNode outputNode() {
        return nodes.get(nodes.size() - 1);
    }

    /** The nodes built from decisions, in compile order. */
    public List<DecisionNode> decisionNodes() {
        return nodes.subList(1, nodes.size() - 1);
    }

    /** Finds the first node with the given id. */
    public Optional<DecisionNode> node(String id) {
        return nodes.stream().filter(n -> n.id().equals(id)).findFirst();
    }

    /**
     * Returns the edges whose source or target does not name a node of this graph. The compiler
     * never calls this; callers that need referential integrity run it after compiling.
     */
    public List<DecisionEdge> danglingEdges() {
        Set<String> ids = nodes.stream().map(DecisionNode::id).collect(Collectors.toSet());
        return edges.stream()
                .filter(e -> !ids.contains(e.sourceId()) || !ids.contains(e.targetId()))
                .collect(Collectors.toList());
    }
}
