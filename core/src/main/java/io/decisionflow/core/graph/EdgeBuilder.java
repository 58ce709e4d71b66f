package io.decisionflow.core.graph;

import io.decisionflow.core.model.DecisionEdge;
import io.decisionflow.core.model.DecisionSpec;
import java.util.ArrayList;
import java.util.List;

/**
 * Derives graph edges from declared neighbours. For each decision, in order, every source yields
 * {@code source -> decision} and then every target yields {@code decision -> target}. Edges are
 * neither de-duplicated nor checked against existing ids.
 */
public final class EdgeBuilder {

    private EdgeBuilder() {}

    public static List<DecisionEdge> buildEdges(List<DecisionSpec> specs) {
        List<DecisionEdge> edges = new ArrayList<>();
        for (DecisionSpec spec : specs) {
            for (String source : spec.sources()) {
                edges.add(DecisionEdge.between(source, spec.id()));
            }
            for (String target : spec.targets()) {
                edges.add(DecisionEdge.between(spec.id(), target));
            }
        }
        return edges;
    }
}
