package io.decisionflow.core.graph;

import io.decisionflow.core.error.DecisionBuildException;
import io.decisionflow.core.model.DecisionNode;
import io.decisionflow.core.model.DecisionSpec;
import io.decisionflow.core.spi.NodeBuilder;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Registry of {@link NodeBuilder}s keyed by decision kind. Immutable once built and safe to share
 * between concurrent compilations.
 */
public final class NodeBuilderRegistry {

    private static final NodeBuilderRegistry STANDARD = builder()
            .register(new DecisionTableNodeBuilder())
            .register(new ExpressionNodeBuilder())
            .register(new FunctionNodeBuilder())
            .build();

    private final Map<String, NodeBuilder> builders;

    private NodeBuilderRegistry(Map<String, NodeBuilder> builders) {
        this.builders = Map.copyOf(builders);
    }

    /** Returns the shared registry for the {@code table}, {@code expression} and {@code function} kinds. */
    public static NodeBuilderRegistry standard() {
        return STANDARD;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Looks up a builder by decision kind.
     *
     * @param kind the decision kind (e.g. "table")
     * @return the builder, or empty if not registered
     */
    public Optional<NodeBuilder> getBuilder(String kind) {
        return Optional.ofNullable(builders.get(kind));
    }

    /**
     * Builds the node for a decision with the builder registered for its kind.
     *
     * @throws DecisionBuildException if no builder is registered for the kind, or the builder
     *     rejects the decision
     */
    public DecisionNode createNode(DecisionSpec spec) {
        NodeBuilder builder = getBuilder(spec.kind())
                .orElseThrow(() -> new DecisionBuildException(
                        "Unsupported decision kind: '" + spec.kind() + "' (decision '" + spec.id() + "')",
                        spec.id(),
                        spec.kind()));
        return builder.build(spec);
    }

    /** Returns the number of registered builders. */
    public int size() {
        return builders.size();
    }

    /** Returns {@code true} if a builder is registered for the given kind. */
    public boolean hasBuilder(String kind) {
        return builders.containsKey(kind);
    }

    /** Registered kinds, in no particular order. */
    public Set<String> kinds() {
        return builders.keySet();
    }

    /** Collects builders before freezing them into a registry. Not thread-safe. */
    public static final class Builder {

        private final Map<String, NodeBuilder> builders = new HashMap<>();

        private Builder() {}

        /**
         * Registers a node builder. If a builder for the same kind is already registered, it is
         * replaced (last-write-wins semantics).
         *
         * @throws NullPointerException if builder or builder.kind() is null
         * @throws IllegalArgumentException if builder.kind() is empty
         */
        public Builder register(NodeBuilder builder) {
            if (builder == null) {
                throw new NullPointerException("builder must not be null");
            }
            String kind = builder.kind();
            if (kind == null) {
                throw new NullPointerException("builder kind must not be null");
            }
            if (kind.isEmpty()) {
                throw new IllegalArgumentException("builder kind must not be empty");
            }
            builders.put(kind, builder);
            return this;
        }

        public NodeBuilderRegistry build() {
            return new NodeBuilderRegistry(builders);
        }
    }
}
