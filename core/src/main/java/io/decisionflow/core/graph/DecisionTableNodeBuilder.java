package io.decisionflow.core.graph;

import io.decisionflow.core.model.DecisionNode;
import io.decisionflow.core.model.DecisionSpec;
import io.decisionflow.core.model.HitPolicy;
import io.decisionflow.core.model.NodeContent;
import io.decisionflow.core.spi.NodeBuilder;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Builds decision-table nodes. Rule rows are carried verbatim, each input and output name becomes
 * a column whose id, name and field are that name, and the hit policy is always {@link
 * HitPolicy#FIRST}.
 */
public final class DecisionTableNodeBuilder implements NodeBuilder {

    public static final String KIND = "table";

    @Override
    public String kind() {
        return KIND;
    }

    @Override
    public DecisionNode build(DecisionSpec spec) {
        NodeContent.DecisionTable content = new NodeContent.DecisionTable(
                HitPolicy.FIRST, spec.rules(), fields(spec.inputs()), fields(spec.outputs()));
        return new DecisionNode(spec.id(), spec.id(), content);
    }

    private static List<NodeContent.Field> fields(List<String> names) {
        return names.stream().map(NodeContent.Field::of).collect(Collectors.toList());
    }
}
