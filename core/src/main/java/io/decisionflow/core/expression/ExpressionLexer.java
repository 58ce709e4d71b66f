package io.decisionflow.core.expression;

import io.decisionflow.core.error.ExpressionLexException;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits whitespace-delimited formula text into {@link Token}s.
 *
 * <p>A number is a decimal float literal or one of {@code inf}, {@code infinity} and {@code nan}
 * in any case, each with an optional sign. Classification is permissive: any fragment that is not
 * a parenthesis, a number or a {@code $variable} becomes an operator token, and unknown symbols
 * are rejected later by the parser.
 * Stateless and thread-safe.
 */
public final class ExpressionLexer {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    /** Decimal float literal with optional sign and exponent. */
    private static final Pattern NUMBER = Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");

    /** Infinity and NaN spellings, any case, with optional sign. */
    private static final Pattern NON_FINITE = Pattern.compile("([+-]?)(inf|infinity|nan)", Pattern.CASE_INSENSITIVE);

    /**
     * Tokenizes the given formula.
     *
     * @param expression the formula text
     * @return the tokens in source order, never empty
     * @throws ExpressionLexException if the text is null, empty or blank
     */
    public List<Token> tokenize(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new ExpressionLexException("Invalid expression", expression);
        }
        String[] fragments = WHITESPACE.split(expression.strip());
        List<Token> tokens = new ArrayList<>(fragments.length);
        for (String fragment : fragments) {
            tokens.add(classify(fragment));
        }
        return tokens;
    }

    static Token classify(String fragment) {
        if ("(".equals(fragment)) {
            return Token.leftParen();
        }
        if (")".equals(fragment)) {
            return Token.rightParen();
        }
        Double number = parseNumber(fragment);
        if (number != null) {
            return Token.number(number);
        }
        if (fragment.startsWith("$")) {
            return Token.variable(fragment.substring(1));
        }
        return Token.operator(fragment);
    }

    private static Double parseNumber(String fragment) {
        if (NUMBER.matcher(fragment).matches()) {
            return Double.parseDouble(fragment);
        }
        Matcher nonFinite = NON_FINITE.matcher(fragment);
        if (!nonFinite.matches()) {
            return null;
        }
        if (nonFinite.group(2).equalsIgnoreCase("nan")) {
            return Double.NaN;
        }
        return "-".equals(nonFinite.group(1)) ? Double.NEGATIVE_INFINITY : Double.POSITIVE_INFINITY;
    }
}
