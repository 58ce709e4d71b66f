package io.decisionflow.core.expression;

import com.fasterxml.jackson.databind.JsonNode;
import io.decisionflow.core.error.ExpressionException;
import io.decisionflow.core.model.EvaluationContext;
import io.decisionflow.core.model.EvaluationResult;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for arithmetic formulas: lexes, parses and evaluates whitespace-delimited infix
 * text such as {@code "$x * ( 2 + $y )"}.
 *
 * <p>Thread-safe: the operator registry is immutable and every call works on its own stacks.
 */
public final class ExpressionEvaluator {

    private static final Logger LOG = LoggerFactory.getLogger(ExpressionEvaluator.class);

    private final ExpressionLexer lexer = new ExpressionLexer();
    private final ShuntingYardParser parser;
    private final PostfixEvaluator postfixEvaluator;

    /** Creates an evaluator over {@link OperatorRegistry#standard()}. */
    public ExpressionEvaluator() {
        this(OperatorRegistry.standard());
    }

    public ExpressionEvaluator(OperatorRegistry registry) {
        Objects.requireNonNull(registry, "registry must not be null");
        this.parser = new ShuntingYardParser(registry);
        this.postfixEvaluator = new PostfixEvaluator(registry);
    }

    /**
     * Lexes and parses the formula once.
     *
     * @throws io.decisionflow.core.error.ExpressionLexException if the text is blank
     * @throws io.decisionflow.core.error.ExpressionParseException on unknown operators or
     *     unbalanced parentheses
     */
    public CompiledFormula compile(String expression) {
        List<Token> tokens = lexer.tokenize(expression);
        List<Token> postfix = parser.toPostfix(tokens, expression);
        return new CompiledFormula(expression, postfix, postfixEvaluator);
    }

    /**
     * Evaluates the formula against the context. Never throws for a bad formula or missing data;
     * the failure is returned as {@link EvaluationResult#failure}.
     */
    public EvaluationResult evaluate(String expression, EvaluationContext context) {
        Objects.requireNonNull(context, "context must not be null");
        try {
            return EvaluationResult.success(compile(expression).evaluate(context));
        } catch (ExpressionException e) {
            LOG.debug("Evaluation of '{}' failed in phase {}: {}", expression, e.phase(), e.getMessage());
            return EvaluationResult.failure(e);
        }
    }

    /**
     * Evaluates against raw JSON data and returns the single-slot legacy value: a JSON number on
     * success or a JSON string with the error message.
     *
     * @see EvaluationResult#toLegacyJson()
     */
    public JsonNode evaluateLegacy(String expression, JsonNode data) {
        return evaluate(expression, EvaluationContext.fromJson(data)).toLegacyJson();
    }
}
