package io.decisionflow.core.graph;

import io.decisionflow.core.model.DecisionNode;
import io.decisionflow.core.model.DecisionSpec;
import io.decisionflow.core.model.NodeContent;
import io.decisionflow.core.spi.NodeBuilder;

/** Builds function nodes. The function body is opaque at compile time. */
public final class FunctionNodeBuilder implements NodeBuilder {

    public static final String KIND = "function";

    @Override
    public String kind() {
        return KIND;
    }

    @Override
    public DecisionNode build(DecisionSpec spec) {
        return new DecisionNode(spec.id(), spec.id(), new NodeContent.Function(spec.function()));
    }
}
