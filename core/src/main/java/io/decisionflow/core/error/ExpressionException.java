package io.decisionflow.core.error;

/**
 * Abstract parent for failures raised while turning formula text into a number. Carries the
 * source text of the formula that failed, or {@code null} when the failing input was a pre-built
 * token sequence.
 */
public abstract class ExpressionException extends FlowException {

    private static final long serialVersionUID = 1L;

    private final String expression;

    protected ExpressionException(String message, String expression, Phase phase) {
        super(message, phase);
        this.expression = expression;
    }

    /** The formula source text, or {@code null} if unknown. */
    public String expression() {
        return expression;
    }
}
