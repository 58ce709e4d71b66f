package io.decisionflow.core.error;

/**
 * Abstract base for all decision-flow exceptions. Never thrown directly. Use the concrete
 * subclasses under {@link ExpressionException}, or {@link DecisionBuildException} and {@link
 * FlowLoadException}.
 */
public abstract class FlowException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Stage in which the error occurred. */
    public enum Phase {
        LEX,
        PARSE,
        EVALUATION,
        BUILD,
        LOAD
    }

    private final Phase phase;

    protected FlowException(String message, Phase phase) {
        super(message);
        this.phase = phase;
    }

    protected FlowException(String message, Throwable cause, Phase phase) {
        super(message, cause);
        this.phase = phase;
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }

    /** The stage in which the error occurred. */
    public Phase phase() {
        return phase;
    }
}
