package io.decisionflow.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Kind-specific payload of a {@link DecisionNode}. A sealed hierarchy: the execution engine
 * understands exactly these node types.
 *
 * <p>Thread-safe and immutable.
 */
public sealed interface NodeContent {

    /** The node type tag written to the serialized graph, e.g. {@code "inputNode"}. */
    String type();

    // ── Implementations ──

    /** Marks where the request enters the graph. */
    record Input() implements NodeContent {
        @Override
        public String type() {
            return "inputNode";
        }
    }

    /** Marks where the response leaves the graph. */
    record Output() implements NodeContent {
        @Override
        public String type() {
            return "outputNode";
        }
    }

    /**
     * Decision table: rule rows matched against input fields to produce output fields.
     *
     * @param hitPolicy how matching rows are combined
     * @param rules rule rows, verbatim from the decision
     * @param inputs input column descriptors
     * @param outputs output column descriptors
     */
    record DecisionTable(HitPolicy hitPolicy, List<Map<String, String>> rules, List<Field> inputs, List<Field> outputs)
            implements NodeContent {
        public DecisionTable {
            Objects.requireNonNull(hitPolicy, "hitPolicy must not be null");
            Objects.requireNonNull(rules, "rules must not be null");
            List<Map<String, String>> rows = new ArrayList<>(rules.size());
            rules.forEach(row -> rows.add(Collections.unmodifiableMap(new LinkedHashMap<>(row))));
            rules = Collections.unmodifiableList(rows);
            inputs = List.copyOf(inputs);
            outputs = List.copyOf(outputs);
        }

        @Override
        public String type() {
            return "decisionTableNode";
        }
    }

    /**
     * Expression node: named formulas whose results are written under their keys.
     *
     * @param expressions the formulas, in order
     */
    record Expression(List<NamedExpression> expressions) implements NodeContent {
        public Expression {
            expressions = List.copyOf(expressions);
        }

        @Override
        public String type() {
            return "expressionNode";
        }
    }

    /**
     * Function node: an opaque function body run by the execution engine.
     *
     * @param source the function source text
     */
    record Function(String source) implements NodeContent {
        public Function {
            Objects.requireNonNull(source, "source must not be null");
        }

        @Override
        public String type() {
            return "functionNode";
        }
    }

    /**
     * Decision-table column descriptor.
     *
     * @param id column id
     * @param name display name
     * @param field the request or response key the column reads or writes
     */
    record Field(String id, String name, String field) {
        public Field {
            Objects.requireNonNull(id, "id must not be null");
            Objects.requireNonNull(name, "name must not be null");
        }

        /** A descriptor whose id, name and field are all the given key. */
        public static Field of(String key) {
            return new Field(key, key, key);
        }
    }

    /**
     * A formula bound to an output key.
     *
     * @param id expression id
     * @param key the key the result is written under
     * @param value the formula source text
     */
    record NamedExpression(String id, String key, String value) {
        public NamedExpression {
            Objects.requireNonNull(id, "id must not be null");
            Objects.requireNonNull(key, "key must not be null");
            Objects.requireNonNull(value, "value must not be null");
        }
    }
}
