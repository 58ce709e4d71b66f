package io.decisionflow.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import io.decisionflow.core.error.ExpressionException;
import java.util.Objects;

/**
 * Outcome of evaluating a formula. Exactly one of two states:
 *
 * <ul>
 * <li>{@link Type#SUCCESS}: {@link #value()} holds the number.
 * <li>{@link Type#FAILURE}: {@link #error()} holds the typed exception, whose {@link
 * ExpressionException#phase()} tells lex, parse and evaluation failures apart.
 * </ul>
 */
public final class EvaluationResult {

    /** The type of evaluation outcome. */
    public enum Type {
        SUCCESS,
        FAILURE
    }

    private final Type type;
    private final double value;
    private final ExpressionException error;

    private EvaluationResult(Type type, double value, ExpressionException error) {
        this.type = type;
        this.value = value;
        this.error = error;
    }

    public static EvaluationResult success(double value) {
        return new EvaluationResult(Type.SUCCESS, value, null);
    }

    public static EvaluationResult failure(ExpressionException error) {
        Objects.requireNonNull(error, "error must not be null for FAILURE");
        return new EvaluationResult(Type.FAILURE, Double.NaN, error);
    }

    public Type type() {
        return type;
    }

    /**
     * Returns the computed number.
     *
     * @throws IllegalStateException if this is a FAILURE
     */
    public double value() {
        if (type != Type.SUCCESS) {
            throw new IllegalStateException("No value on a failed evaluation: " + error.getMessage());
        }
        return value;
    }

    /** Returns the failure cause. Only valid when {@code type() == FAILURE}. */
    public ExpressionException error() {
        return error;
    }

    public boolean isSuccess() {
        return type == Type.SUCCESS;
    }

    public boolean isFailure() {
        return type == Type.FAILURE;
    }

    /**
     * Renders this result in the single-slot shape older consumers expect: a JSON number on
     * success, a JSON string holding the error message on failure. A NaN or infinite value has no
     * JSON number form and renders as {@code 0}.
     */
    public JsonNode toLegacyJson() {
        if (type == Type.FAILURE) {
            return JsonNodeFactory.instance.textNode(error.getMessage());
        }
        if (!Double.isFinite(value)) {
            return JsonNodeFactory.instance.numberNode(0);
        }
        return JsonNodeFactory.instance.numberNode(value);
    }

    @Override
    public String toString() {
        return switch (type) {
            case SUCCESS -> "EvaluationResult[SUCCESS, value=" + value + "]";
            case FAILURE -> "EvaluationResult[FAILURE, " + error.phase() + ": " + error.getMessage() + "]";
        };
    }
}
