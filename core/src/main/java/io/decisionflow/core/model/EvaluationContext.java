package io.decisionflow.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Read-only variable values against which {@code $name} tokens are resolved. Backed by a JSON
 * object; only top-level members holding a JSON number resolve, any other member type counts as
 * missing.
 *
 * <p>Immutable and thread-safe: the backing object is copied on construction.
 */
public final class EvaluationContext {

    private static final EvaluationContext EMPTY = new EvaluationContext(JsonNodeFactory.instance.objectNode());

    private final JsonNode data;

    private EvaluationContext(JsonNode data) {
        this.data = data;
    }

    /** A context without variables. */
    public static EvaluationContext empty() {
        return EMPTY;
    }

    /**
     * Creates a context from a name-to-number map.
     *
     * @throws NullPointerException if the map, a key or a value is null
     */
    public static EvaluationContext of(Map<String, ? extends Number> values) {
        Objects.requireNonNull(values, "values must not be null");
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        values.forEach((name, value) -> {
            Objects.requireNonNull(name, "variable name must not be null");
            Objects.requireNonNull(value, "value of '" + name + "' must not be null");
            node.put(name, value.doubleValue());
        });
        return new EvaluationContext(node);
    }

    /**
     * Creates a context from a JSON document. A non-object document (array, scalar, null) yields
     * a context in which every lookup misses.
     */
    public static EvaluationContext fromJson(JsonNode data) {
        if (data == null || data.isNull() || data.isMissingNode()) {
            return EMPTY;
        }
        return new EvaluationContext(data.deepCopy());
    }

    /**
     * Resolves a variable.
     *
     * @param name variable name without the {@code $} sigil
     * @return the numeric value, or empty if absent or not a number
     */
    public OptionalDouble lookup(String name) {
        if (!data.isObject()) {
            return OptionalDouble.empty();
        }
        JsonNode value = data.get(name);
        if (value == null || !value.isNumber()) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(value.doubleValue());
    }

    /** Returns a copy of the backing JSON document. */
    public JsonNode asJson() {
        return data.deepCopy();
    }

    @Override
    public String toString() {
        return "EvaluationContext" + data;
    }
}
