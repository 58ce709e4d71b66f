package io.decisionflow.core.expression;

import java.util.Objects;

/**
 * Lexical unit of a formula. Exactly one of five types:
 *
 * <ul>
 * <li>{@link Type#NUMBER} with {@link #number()} set
 * <li>{@link Type#VARIABLE} with {@link #text()} holding the name without the {@code $} sigil
 * <li>{@link Type#OPERATOR} with {@link #text()} holding the symbol verbatim
 * <li>{@link Type#LEFT_PAREN} and {@link Type#RIGHT_PAREN}
 * </ul>
 *
 * <p>Immutable.
 */
public final class Token {

    /** The kind of lexical unit. */
    public enum Type {
        NUMBER,
        VARIABLE,
        OPERATOR,
        LEFT_PAREN,
        RIGHT_PAREN
    }

    private static final Token LEFT_PAREN = new Token(Type.LEFT_PAREN, "(", 0.0);
    private static final Token RIGHT_PAREN = new Token(Type.RIGHT_PAREN, ")", 0.0);

    private final Type type;
    private final String text;
    private final double number;

    private Token(Type type, String text, double number) {
        this.type = type;
        this.text = text;
        this.number = number;
    }

    public static Token number(double value) {
        return new Token(Type.NUMBER, null, value);
    }

    public static Token variable(String name) {
        Objects.requireNonNull(name, "name must not be null");
        return new Token(Type.VARIABLE, name, 0.0);
    }

    public static Token operator(String symbol) {
        Objects.requireNonNull(symbol, "symbol must not be null");
        return new Token(Type.OPERATOR, symbol, 0.0);
    }

    public static Token leftParen() {
        return LEFT_PAREN;
    }

    public static Token rightParen() {
        return RIGHT_PAREN;
    }

    public Type type() {
        return type;
    }

    /** Variable name or operator symbol. Only valid for VARIABLE and OPERATOR tokens. */
    public String text() {
        return text;
    }

    /** Numeric value. Only valid for NUMBER tokens. */
    public double number() {
        return number;
    }

    public boolean is(Type candidate) {
        return type == candidate;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Token other)) return false;
        return type == other.type
                && Double.compare(number, other.number) == 0
                && Objects.equals(text, other.text);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, text, number);
    }

    @Override
    public String toString() {
        return switch (type) {
            case NUMBER -> "Number(" + number + ")";
            case VARIABLE -> "Variable(" + text + ")";
            case OPERATOR -> "Operator(" + text + ")";
            case LEFT_PAREN -> "LeftParen";
            case RIGHT_PAREN -> "RightParen";
        };
    }
}
