package io.decisionflow.core.error;

/**
 * Thrown when a decision cannot be turned into a graph node: no builder is registered for its
 * kind, or the decision lacks data its builder requires.
 */
public final class DecisionBuildException extends FlowException {

    private static final long serialVersionUID = 1L;

    private final String decisionId;
    private final String kind;

    public DecisionBuildException(String message, String decisionId, String kind) {
        super(message, Phase.BUILD);
        this.decisionId = decisionId;
        this.kind = kind;
    }

    /** Id of the decision that failed to build. */
    public String decisionId() {
        return decisionId;
    }

    /** The decision kind that was requested. */
    public String kind() {
        return kind;
    }
}
