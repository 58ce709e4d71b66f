package io.decisionflow.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One decision to compile into a graph node. Immutable; list and map arguments are copied and
 * keep their order.
 *
 * @param id unique decision id, becomes the node id
 * @param kind selects the node builder, e.g. {@code "table"}, {@code "expression"}, {@code
 *     "function"}
 * @param rules rule rows of a decision table, each a column-to-cell mapping
 * @param expression formula source, used by expression decisions
 * @param function function body source, used by function decisions
 * @param inputs input field names
 * @param outputs output field names
 * @param sources ids of decisions feeding into this one
 * @param targets ids of decisions this one feeds
 */
public record DecisionSpec(
        String id,
        String kind,
        List<Map<String, String>> rules,
        String expression,
        String function,
        List<String> inputs,
        List<String> outputs,
        List<String> sources,
        List<String> targets) {

    /**
     * Canonical constructor. Null text becomes {@code ""} and null lists become empty.
     *
     * @throws NullPointerException if id or kind is null
     */
    public DecisionSpec {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        rules = copyRules(rules);
        expression = expression != null ? expression : "";
        function = function != null ? function : "";
        inputs = inputs != null ? List.copyOf(inputs) : List.of();
        outputs = outputs != null ? List.copyOf(outputs) : List.of();
        sources = sources != null ? List.copyOf(sources) : List.of();
        targets = targets != null ? List.copyOf(targets) : List.of();
    }

    public static Builder builder(String id, String kind) {
        return new Builder(id, kind);
    }

    private static List<Map<String, String>> copyRules(List<Map<String, String>> rules) {
        if (rules == null) {
            return List.of();
        }
        List<Map<String, String>> copy = new ArrayList<>(rules.size());
        for (Map<String, String> row : rules) {
            Objects.requireNonNull(row, "rule row must not be null");
            copy.add(Collections.unmodifiableMap(new LinkedHashMap<>(row)));
        }
        return Collections.unmodifiableList(copy);
    }

    /** Fluent construction for the optional parts of a decision. */
    public static final class Builder {

        private final String id;
        private final String kind;
        private List<Map<String, String>> rules;
        private String expression;
        private String function;
        private List<String> inputs;
        private List<String> outputs;
        private List<String> sources;
        private List<String> targets;

        private Builder(String id, String kind) {
            this.id = id;
            this.kind = kind;
        }

        public Builder rules(List<Map<String, String>> rules) {
            this.rules = rules;
            return this;
        }

        public Builder expression(String expression) {
            this.expression = expression;
            return this;
        }

        public Builder function(String function) {
            this.function = function;
            return this;
        }

        public Builder inputs(String... inputs) {
            return inputs(List.of(inputs));
        }

        public Builder inputs(List<String> inputs) {
            this.inputs = inputs;
            return this;
        }

        public Builder outputs(String... outputs) {
            return outputs(List.of(outputs));
        }

        public Builder outputs(List<String> outputs) {
            this.outputs = outputs;
            return this;
        }

        public Builder sources(String... sources) {
            return sources(List.of(sources));
        }

        public Builder sources(List<String> sources) {
            this.sources = sources;
            return this;
        }

        public Builder targets(String... targets) {
            return targets(List.of(targets));
        }

        public Builder targets(List<String> targets) {
            this.targets = targets;
            return this;
        }

        public DecisionSpec build() {
            return new DecisionSpec(id, kind, rules, expression, function, inputs, outputs, sources, targets);
        }
    }
}
