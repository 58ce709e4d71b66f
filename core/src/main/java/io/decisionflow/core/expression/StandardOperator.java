package io.decisionflow.core.expression;

import io.decisionflow.core.spi.Operator;
import java.util.OptionalDouble;

/** The reference operator set: {@code + - * %} (binary) and {@code abs} (unary prefix). */
public enum StandardOperator implements Operator {
    ADD("+", 1) {
        @Override
        public double apply(double left, OptionalDouble right) {
            return left + right.orElse(0.0);
        }
    },
    SUBTRACT("-", 1) {
        @Override
        public double apply(double left, OptionalDouble right) {
            return left - right.orElse(0.0);
        }
    },
    MULTIPLY("*", 2) {
        @Override
        public double apply(double left, OptionalDouble right) {
            return left * right.orElse(0.0);
        }
    },
    /** Truncated remainder; the result takes the sign of the dividend. */
    MODULO("%", 2) {
        @Override
        public double apply(double left, OptionalDouble right) {
            return left % right.orElse(0.0);
        }
    },
    ABS("abs", 3) {
        @Override
        public double apply(double left, OptionalDouble right) {
            return Math.abs(left);
        }

        @Override
        public boolean isUnary() {
            return true;
        }
    };

    private final String symbol;
    private final int precedence;

    StandardOperator(String symbol, int precedence) {
        this.symbol = symbol;
        this.precedence = precedence;
    }

    @Override
    public String symbol() {
        return symbol;
    }

    @Override
    public int precedence() {
        return precedence;
    }
}
