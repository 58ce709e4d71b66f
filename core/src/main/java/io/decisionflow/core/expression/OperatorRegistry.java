package io.decisionflow.core.expression;

import io.decisionflow.core.spi.Operator;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Lookup table from operator symbol to {@link Operator}. Immutable once built, so a single
 * instance can be shared by any number of concurrent evaluations.
 *
 * <pre>{@code
 * OperatorRegistry registry = OperatorRegistry.builder()
 *         .registerAll(StandardOperator.values())
 *         .register(customOperator)
 *         .build();
 * }</pre>
 */
public final class OperatorRegistry {

    private static final OperatorRegistry STANDARD =
            builder().registerAll(StandardOperator.values()).build();

    private final Map<String, Operator> operators;

    private OperatorRegistry(Map<String, Operator> operators) {
        this.operators = Map.copyOf(operators);
    }

    /** Returns the shared registry holding {@link StandardOperator}s. */
    public static OperatorRegistry standard() {
        return STANDARD;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Looks up an operator by symbol.
     *
     * @param symbol the operator symbol (e.g. "+")
     * @return the operator, or empty if not registered
     */
    public Optional<Operator> getOperator(String symbol) {
        return Optional.ofNullable(operators.get(symbol));
    }

    /** Returns the number of registered operators. */
    public int size() {
        return operators.size();
    }

    /** Returns {@code true} if an operator with the given symbol is registered. */
    public boolean hasOperator(String symbol) {
        return operators.containsKey(symbol);
    }

    /** Registered symbols, in no particular order. */
    public Set<String> symbols() {
        return operators.keySet();
    }

    /** Collects operators before freezing them into a registry. Not thread-safe. */
    public static final class Builder {

        private final Map<String, Operator> operators = new HashMap<>();

        private Builder() {}

        /**
         * Registers an operator. If an operator with the same symbol is already registered, it is
         * replaced (last-write-wins semantics).
         *
         * @throws NullPointerException if operator or operator.symbol() is null
         * @throws IllegalArgumentException if operator.symbol() is empty, contains whitespace,
         *     is a parenthesis, or would be read as a number or variable
         */
        public Builder register(Operator operator) {
            if (operator == null) {
                throw new NullPointerException("operator must not be null");
            }
            String symbol = operator.symbol();
            if (symbol == null) {
                throw new NullPointerException("operator symbol must not be null");
            }
            if (symbol.isEmpty() || symbol.chars().anyMatch(Character::isWhitespace)) {
                throw new IllegalArgumentException(
                        "operator symbol must be non-empty without whitespace: '" + symbol + "'");
            }
            if (!ExpressionLexer.classify(symbol).is(Token.Type.OPERATOR)) {
                throw new IllegalArgumentException("operator symbol would not lex as an operator: '" + symbol + "'");
            }
            operators.put(symbol, operator);
            return this;
        }

        public Builder registerAll(Operator... toRegister) {
            for (Operator operator : toRegister) {
                register(operator);
            }
            return this;
        }

        public OperatorRegistry build() {
            return new OperatorRegistry(operators);
        }
    }
}
