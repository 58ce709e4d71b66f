package io.decisionflow.core.error;

/** Thrown when formula text cannot be tokenized (currently: blank input). */
public final class ExpressionLexException extends ExpressionException {

    private static final long serialVersionUID = 1L;

    public ExpressionLexException(String message, String expression) {
        super(message, expression, Phase.LEX);
    }
}
