package io.decisionflow.core.graph;

import io.decisionflow.core.error.DecisionBuildException;
import io.decisionflow.core.model.DecisionGraph;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of {@link DecisionGraphCompiler#compileSkippingFailures}: the graph built from every
 * decision that succeeded, plus one exception per decision that did not.
 *
 * @param graph the compiled graph; edges still reference skipped decisions
 * @param failures build failures in input order
 */
public record CompilationResult(DecisionGraph graph, List<DecisionBuildException> failures) {

    public CompilationResult {
        Objects.requireNonNull(graph, "graph must not be null");
        failures = List.copyOf(failures);
    }

    public boolean isComplete() {
        return failures.isEmpty();
    }
}
