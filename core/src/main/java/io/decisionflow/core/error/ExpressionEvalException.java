package io.decisionflow.core.error;

/**
 * Thrown when a postfix sequence fails at evaluation time: unknown operator, missing variable,
 * operand underflow, or a malformed final stack.
 */
public final class ExpressionEvalException extends ExpressionException {

    private static final long serialVersionUID = 1L;

    public ExpressionEvalException(String message, String expression) {
        super(message, expression, Phase.EVALUATION);
    }
}
