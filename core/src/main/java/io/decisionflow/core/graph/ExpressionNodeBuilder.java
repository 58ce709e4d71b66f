package io.decisionflow.core.graph;

import io.decisionflow.core.error.DecisionBuildException;
import io.decisionflow.core.model.DecisionNode;
import io.decisionflow.core.model.DecisionSpec;
import io.decisionflow.core.model.NodeContent;
import io.decisionflow.core.spi.NodeBuilder;
import java.util.List;

/**
 * Builds expression nodes holding one formula, bound to the decision's first input name. The
 * formula text is not checked here; the execution engine's expression language is a superset of
 * what {@link io.decisionflow.core.expression.ExpressionEvaluator} accepts.
 */
public final class ExpressionNodeBuilder implements NodeBuilder {

    public static final String KIND = "expression";

    @Override
    public String kind() {
        return KIND;
    }

    @Override
    public DecisionNode build(DecisionSpec spec) {
        if (spec.inputs().isEmpty()) {
            throw new DecisionBuildException(
                    "Expression decision '" + spec.id() + "' declares no inputs to bind its expression to",
                    spec.id(),
                    spec.kind());
        }
        String key = spec.inputs().get(0);
        NodeContent.NamedExpression expression = new NodeContent.NamedExpression(key, key, spec.expression());
        return new DecisionNode(spec.id(), spec.id(), new NodeContent.Expression(List.of(expression)));
    }
}
