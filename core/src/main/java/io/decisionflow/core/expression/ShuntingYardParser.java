package io.decisionflow.core.expression;

import io.decisionflow.core.error.ExpressionParseException;
import io.decisionflow.core.spi.Operator;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reorders infix tokens into postfix (reverse-Polish) order using the precedences held by an
 * {@link OperatorRegistry}.
 *
 * <p>Binary operators of equal precedence associate left to right. Unary operators are prefix
 * operators: pushing one never pops the stack, so consecutive unary operators nest right to
 * left ({@code abs abs -3}). Both an unmatched {@code (} and an unmatched {@code )} are
 * rejected.
 *
 * <p>Thread-safe; holds no per-call state.
 */
public final class ShuntingYardParser {

    private static final Logger LOG = LoggerFactory.getLogger(ShuntingYardParser.class);

    private final OperatorRegistry registry;

    public ShuntingYardParser(OperatorRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
    }

    /**
     * Converts the given infix tokens to postfix order.
     *
     * @param tokens infix tokens as produced by {@link ExpressionLexer}
     * @return the postfix tokens; contains no parentheses
     * @throws ExpressionParseException on an unregistered operator symbol or unbalanced parentheses
     */
    public List<Token> toPostfix(List<Token> tokens) {
        return toPostfix(tokens, null);
    }

    List<Token> toPostfix(List<Token> tokens, String expression) {
        Objects.requireNonNull(tokens, "tokens must not be null");
        List<Token> output = new ArrayList<>(tokens.size());
        Deque<Token> stack = new ArrayDeque<>();

        for (Token token : tokens) {
            switch (token.type()) {
                case NUMBER, VARIABLE -> output.add(token);
                case OPERATOR -> {
                    Operator current = requireOperator(token.text(), expression);
                    if (!current.isUnary()) {
                        while (!stack.isEmpty() && stack.peek().is(Token.Type.OPERATOR)) {
                            Operator top = requireOperator(stack.peek().text(), expression);
                            if (top.precedence() < current.precedence()) {
                                break;
                            }
                            output.add(stack.pop());
                        }
                    }
                    stack.push(token);
                }
                case LEFT_PAREN -> stack.push(token);
                case RIGHT_PAREN -> {
                    boolean matched = false;
                    while (!stack.isEmpty()) {
                        Token top = stack.pop();
                        if (top.is(Token.Type.LEFT_PAREN)) {
                            matched = true;
                            break;
                        }
                        output.add(top);
                    }
                    if (!matched) {
                        throw new ExpressionParseException("Mismatched parentheses", expression);
                    }
                }
            }
        }

        while (!stack.isEmpty()) {
            Token top = stack.pop();
            if (top.is(Token.Type.LEFT_PAREN)) {
                throw new ExpressionParseException("Mismatched parentheses", expression);
            }
            output.add(top);
        }

        LOG.debug("Postfix for '{}': {}", expression, output);
        return output;
    }

    private Operator requireOperator(String symbol, String expression) {
        return registry.getOperator(symbol)
                .orElseThrow(() -> new ExpressionParseException("Unknown operator: " + symbol, expression));
    }
}
