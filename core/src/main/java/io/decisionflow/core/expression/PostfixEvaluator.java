package io.decisionflow.core.expression;

import io.decisionflow.core.error.ExpressionEvalException;
import io.decisionflow.core.model.EvaluationContext;
import io.decisionflow.core.spi.Operator;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Stack machine that executes a postfix token sequence against an {@link EvaluationContext}.
 * Thread-safe; the value stack is local to each call.
 */
public final class PostfixEvaluator {

    private final OperatorRegistry registry;

    public PostfixEvaluator(OperatorRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
    }

    /**
     * Evaluates the given postfix sequence.
     *
     * @param postfix tokens in postfix order
     * @param context variable values
     * @return the single value left on the stack
     * @throws ExpressionEvalException on an unknown operator, a missing variable, operand
     *     underflow, or when the sequence does not reduce to exactly one value
     */
    public double evaluate(List<Token> postfix, EvaluationContext context) {
        return evaluate(postfix, context, null);
    }

    double evaluate(List<Token> postfix, EvaluationContext context, String expression) {
        Objects.requireNonNull(postfix, "postfix must not be null");
        Objects.requireNonNull(context, "context must not be null");
        Deque<Double> stack = new ArrayDeque<>();

        for (Token token : postfix) {
            switch (token.type()) {
                case NUMBER -> stack.push(token.number());
                case VARIABLE -> stack.push(context.lookup(token.text())
                        .orElseThrow(() -> new ExpressionEvalException(
                                "Invalid or missing variable: " + token.text(), expression)));
                case OPERATOR -> {
                    Operator operator = registry.getOperator(token.text())
                            .orElseThrow(() -> new ExpressionEvalException(
                                    "Unknown operator: " + token.text(), expression));
                    if (operator.isUnary()) {
                        double operand = pop(stack, "Not enough operands for unary operator", expression);
                        stack.push(operator.apply(operand, OptionalDouble.empty()));
                    } else {
                        double right = pop(stack, "Not enough operands for binary operator", expression);
                        double left = pop(stack, "Not enough operands for binary operator", expression);
                        stack.push(operator.apply(left, OptionalDouble.of(right)));
                    }
                }
                case LEFT_PAREN, RIGHT_PAREN -> throw new ExpressionEvalException(
                        "Unexpected token in postfix expression: " + token, expression);
            }
        }

        if (stack.isEmpty()) {
            throw new ExpressionEvalException("Empty expression", expression);
        }
        if (stack.size() > 1) {
            throw new ExpressionEvalException(
                    "Malformed expression: " + stack.size() + " values left on the stack", expression);
        }
        return stack.pop();
    }

    private static double pop(Deque<Double> stack, String message, String expression) {
        Double value = stack.poll();
        if (value == null) {
            throw new ExpressionEvalException(message, expression);
        }
        return value;
    }
}
