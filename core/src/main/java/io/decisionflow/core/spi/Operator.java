package io.decisionflow.core.spi;

import java.util.OptionalDouble;

/**
 * Pluggable arithmetic operator. Implementations are registered with an {@link
 * io.decisionflow.core.expression.OperatorRegistry} under their {@link #symbol()} and become
 * usable in formulas without changes to the parser or evaluator.
 *
 * <p>Implementations MUST be stateless and thread-safe.
 */
public interface Operator {

    /**
     * Returns the symbol this operator is written as in formula text, e.g. {@code "+"} or {@code
     * "abs"}. Symbols are matched verbatim against whitespace-delimited fragments.
     */
    String symbol();

    /**
     * Applies the operator.
     *
     * @param left the left operand, or the only operand of a unary operator
     * @param right the right operand; empty for unary operators
     * @return the result
     */
    double apply(double left, OptionalDouble right);

    /** Binding strength; higher binds tighter. */
    int precedence();

    /** Returns {@code true} if the operator takes a single (prefix) operand. */
    default boolean isUnary() {
        return false;
    }
}
