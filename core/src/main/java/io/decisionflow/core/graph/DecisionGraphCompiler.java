package io.decisionflow.core.graph;

import io.decisionflow.core.error.DecisionBuildException;
import io.decisionflow.core.model.DecisionEdge;
import io.decisionflow.core.model.DecisionGraph;
import io.decisionflow.core.model.DecisionNode;
import io.decisionflow.core.model.DecisionSpec;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Compiles an ordered list of decisions into a {@link DecisionGraph}: the request sentinel, one
 * node per decision in input order, the response sentinel, and the edges derived by {@link
 * EdgeBuilder}.
 *
 * <p>Decision ids must be unique and must not collide with the sentinel ids {@value
 * DecisionNode#REQUEST_ID} and {@value DecisionNode#RESPONSE_ID}. A builder must return a
 * non-sentinel node carrying the decision's id. No cycle detection or reachability analysis is
 * done; that belongs to the execution engine.
 * Compilation is a pure function of its input, so one compiler may be used from many threads.
 */
public final class DecisionGraphCompiler {

    private static final Logger LOG = LoggerFactory.getLogger(DecisionGraphCompiler.class);

    private final NodeBuilderRegistry builders;

    /** Creates a compiler over {@link NodeBuilderRegistry#standard()}. */
    public DecisionGraphCompiler() {
        this(NodeBuilderRegistry.standard());
    }

    public DecisionGraphCompiler(NodeBuilderRegistry builders) {
        this.builders = Objects.requireNonNull(builders, "builders must not be null");
    }

    /**
     * Compiles all decisions; the first failing decision aborts the whole batch.
     *
     * @param specs decisions in the order their nodes should appear
     * @return the compiled graph
     * @throws DecisionBuildException if any decision has an unregistered kind, invalid data or a
     *     duplicate id
     */
    public DecisionGraph compile(List<DecisionSpec> specs) {
        Objects.requireNonNull(specs, "specs must not be null");
        List<DecisionNode> nodes = new ArrayList<>(specs.size() + 2);
        Set<String> seen = new HashSet<>();
        nodes.add(DecisionNode.request());
        for (DecisionSpec spec : specs) {
            nodes.add(buildNode(spec, seen));
        }
        nodes.add(DecisionNode.response());
        return assemble(nodes, specs);
    }

    /**
     * Compiles every decision that can be built and collects the failures of the others. Edges
     * are derived from the full input, so edges of a skipped decision dangle.
     */
    public CompilationResult compileSkippingFailures(List<DecisionSpec> specs) {
        Objects.requireNonNull(specs, "specs must not be null");
        List<DecisionNode> nodes = new ArrayList<>(specs.size() + 2);
        List<DecisionBuildException> failures = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        nodes.add(DecisionNode.request());
        for (DecisionSpec spec : specs) {
            try {
                nodes.add(buildNode(spec, seen));
            } catch (DecisionBuildException e) {
                LOG.warn("Skipping decision {}: {}", spec.id(), e.getMessage());
                failures.add(e);
            }
        }
        nodes.add(DecisionNode.response());
        return new CompilationResult(assemble(nodes, specs), failures);
    }

    private DecisionNode buildNode(DecisionSpec spec, Set<String> seen) {
        Objects.requireNonNull(spec, "decision must not be null");
        if (DecisionNode.REQUEST_ID.equals(spec.id()) || DecisionNode.RESPONSE_ID.equals(spec.id())) {
            throw new DecisionBuildException(
                    "Decision id '" + spec.id() + "' is reserved for a sentinel node", spec.id(), spec.kind());
        }
        if (seen.contains(spec.id())) {
            throw new DecisionBuildException("Duplicate decision id: '" + spec.id() + "'", spec.id(), spec.kind());
        }
        DecisionNode node = checkBuilt(builders.createNode(spec), spec);
        seen.add(spec.id());
        LOG.debug("Built {} node for decision {}", node.content().type(), spec.id());
        return node;
    }

    private static DecisionNode checkBuilt(DecisionNode node, DecisionSpec spec) {
        if (node == null) {
            throw new DecisionBuildException(
                    "Builder for kind '" + spec.kind() + "' returned no node", spec.id(), spec.kind());
        }
        if (!node.id().equals(spec.id())) {
            throw new DecisionBuildException(
                    "Builder for kind '" + spec.kind() + "' returned node id '" + node.id() + "'",
                    spec.id(),
                    spec.kind());
        }
        if (node.isSentinel()) {
            throw new DecisionBuildException(
                    "Builder for kind '" + spec.kind() + "' returned a " + node.content().type(),
                    spec.id(),
                    spec.kind());
        }
        return node;
    }

    private static DecisionGraph assemble(List<DecisionNode> nodes, List<DecisionSpec> specs) {
        List<DecisionEdge> edges = EdgeBuilder.buildEdges(specs);
        DecisionGraph graph = new DecisionGraph(nodes, edges);
        LOG.info("Compiled decision graph: decisions={}, nodes={}, edges={}", specs.size(), nodes.size(), edges.size());
        return graph;
    }
}
