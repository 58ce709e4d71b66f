package io.decisionflow.core.expression;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.decisionflow.core.error.ExpressionEvalException;
import io.decisionflow.core.model.EvaluationContext;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

/** Tests for {@link PostfixEvaluator} on hand-built postfix sequences. */
class PostfixEvaluatorTest {

    private final PostfixEvaluator evaluator = new PostfixEvaluator(OperatorRegistry.standard());

    @Test
    void binaryOperatorTakesLeftOperandFromDeeperInStack() {
        List<Token> postfix = List.of(Token.number(10), Token.number(4), Token.operator("-"));

        assertThat(evaluator.evaluate(postfix, EvaluationContext.empty())).isEqualTo(6.0);
    }

    @Test
    void unaryOperatorTakesOneOperand() {
        List<Token> postfix = List.of(Token.number(2), Token.number(-3), Token.operator("abs"), Token.operator("*"));

        assertThat(evaluator.evaluate(postfix, EvaluationContext.empty())).isEqualTo(6.0);
    }

    @Test
    void variablesResolveFromContext() {
        List<Token> postfix = List.of(Token.variable("x"), Token.variable("y"), Token.operator("%"));

        assertThat(evaluator.evaluate(postfix, EvaluationContext.of(Map.of("x", 7, "y", 4)))).isEqualTo(3.0);
    }

    @Test
    void missingVariableFails() {
        assertThatThrownBy(() -> evaluator.evaluate(List.of(Token.variable("z")), EvaluationContext.empty()))
                .isInstanceOf(ExpressionEvalException.class)
                .hasMessage("Invalid or missing variable: z");
    }

    @Test
    void unknownOperatorFails() {
        List<Token> postfix = List.of(Token.number(1), Token.number(2), Token.operator("^"));

        assertThatThrownBy(() -> evaluator.evaluate(postfix, EvaluationContext.empty()))
                .isInstanceOf(ExpressionEvalException.class)
                .hasMessage("Unknown operator: ^");
    }

    @Test
    void binaryUnderflowFails() {
        List<Token> postfix = List.of(Token.number(1), Token.operator("+"));

        assertThatThrownBy(() -> evaluator.evaluate(postfix, EvaluationContext.empty()))
                .isInstanceOf(ExpressionEvalException.class)
                .hasMessage("Not enough operands for binary operator");
    }

    @Test
    void unaryUnderflowFails() {
        assertThatThrownBy(() -> evaluator.evaluate(List.of(Token.operator("abs")), EvaluationContext.empty()))
                .isInstanceOf(ExpressionEvalException.class)
                .hasMessage("Not enough operands for unary operator");
    }

    @Test
    void emptySequenceFails() {
        assertThatThrownBy(() -> evaluator.evaluate(List.of(), EvaluationContext.empty()))
                .isInstanceOf(ExpressionEvalException.class)
                .hasMessage("Empty expression");
    }

    @Test
    void leftoverValuesAreSurfaced() {
        List<Token> postfix = List.of(Token.number(1), Token.number(2), Token.number(3), Token.operator("+"));

        assertThatThrownBy(() -> evaluator.evaluate(postfix, EvaluationContext.empty()))
                .isInstanceOf(ExpressionEvalException.class)
                .hasMessage("Malformed expression: 2 values left on the stack");
    }

    @Test
    void parenthesisInPostfixFails() {
        assertThatThrownBy(() -> evaluator.evaluate(List.of(Token.leftParen()), EvaluationContext.empty()))
                .isInstanceOf(ExpressionEvalException.class)
                .hasMessageStartingWith("Unexpected token in postfix expression");
    }
}
