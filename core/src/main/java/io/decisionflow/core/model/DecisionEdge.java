package io.decisionflow.core.model;

import java.util.Objects;
import java.util.Optional;

/**
 * Directed connection between two nodes, derived from a decision's declared sources and targets.
 * Endpoints are not checked against the graph's nodes; see {@link DecisionGraph#danglingEdges()}.
 *
 * @param id edge id; the compiler leaves it empty
 * @param sourceId id of the upstream node
 * @param targetId id of the downstream node
 * @param sourceHandle output handle on the source node, or {@code null}
 */
public record DecisionEdge(String id, String sourceId, String targetId, String sourceHandle) {

    public DecisionEdge {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(sourceId, "sourceId must not be null");
        Objects.requireNonNull(targetId, "targetId must not be null");
    }

    /** An edge with an empty id and an empty source handle, the shape the compiler emits. */
    public static DecisionEdge between(String sourceId, String targetId) {
        return new DecisionEdge("", sourceId, targetId, "");
    }

    public Optional<String> handle() {
        return Optional.ofNullable(sourceHandle);
    }
}
