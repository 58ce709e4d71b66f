package io.decisionflow.core.model;

import java.util.Objects;

/**
 * A node of a compiled {@link DecisionGraph}.
 *
 * @param id node id; equals the originating decision id for non-sentinel nodes
 * @param name display name
 * @param content kind-specific payload
 */
public record DecisionNode(String id, String name, NodeContent content) {

    /** Id of the node every graph starts with. */
    public static final String REQUEST_ID = "request";

    /** Id of the node every graph ends with. */
    public static final String RESPONSE_ID = "response";

    public DecisionNode {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(content, "content must not be null");
    }

    /** The request sentinel. */
    public static DecisionNode request() {
        return new DecisionNode(REQUEST_ID, REQUEST_ID, new NodeContent.Input());
    }

    /** The response sentinel. */
    public static DecisionNode response() {
        return new DecisionNode(RESPONSE_ID, RESPONSE_ID, new NodeContent.Output());
    }

    public boolean isSentinel() {
        return content instanceof NodeContent.Input || content instanceof NodeContent.Output;
    }
}
