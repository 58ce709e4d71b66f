package io.decisionflow.core.spi;

import io.decisionflow.core.model.DecisionNode;
import io.decisionflow.core.model.DecisionSpec;

/**
 * Turns one decision of a given kind into a graph node. Registered with a {@link
 * io.decisionflow.core.graph.NodeBuilderRegistry} under {@link #kind()}.
 *
 * <p>Implementations MUST be stateless and thread-safe.
 */
public interface NodeBuilder {

    /** The decision kind handled, e.g. {@code "table"}. Lowercase, no spaces. */
    String kind();

    /**
     * Builds the node for the given decision. The returned node's id equals {@code spec.id()}.
     *
     * @throws io.decisionflow.core.error.DecisionBuildException if the decision lacks data this
     *     kind requires
     */
    DecisionNode build(DecisionSpec spec);
}
