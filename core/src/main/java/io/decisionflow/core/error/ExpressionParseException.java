package io.decisionflow.core.error;

/** Thrown when a token sequence cannot be reordered into postfix (unknown operator, unbalanced parentheses). */
public final class ExpressionParseException extends ExpressionException {

    private static final long serialVersionUID = 1L;

    public ExpressionParseException(String message, String expression) {
        super(message, expression, Phase.PARSE);
    }
}
