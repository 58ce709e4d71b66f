package io.decisionflow.core.expression;

import io.decisionflow.core.model.EvaluationContext;
import java.util.List;

/**
 * A formula that has been lexed and reordered into postfix once, ready to be evaluated against
 * any number of contexts. Produced by {@link ExpressionEvaluator#compile(String)}.
 *
 * <p>Immutable and thread-safe.
 */
public final class CompiledFormula {

    private final String source;
    private final List<Token> postfix;
    private final PostfixEvaluator evaluator;

    CompiledFormula(String source, List<Token> postfix, PostfixEvaluator evaluator) {
        this.source = source;
        this.postfix = List.copyOf(postfix);
        this.evaluator = evaluator;
    }

    /**
     * Evaluates the formula.
     *
     * @throws io.decisionflow.core.error.ExpressionEvalException if evaluation fails
     */
    public double evaluate(EvaluationContext context) {
        return evaluator.evaluate(postfix, context, source);
    }

    /** The original formula text. */
    public String source() {
        return source;
    }

    /** The postfix token sequence. */
    public List<Token> postfix() {
        return postfix;
    }

    @Override
    public String toString() {
        return "CompiledFormula[" + source + "]";
    }
}
