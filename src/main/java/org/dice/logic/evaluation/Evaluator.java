package org.dice.logic.evaluation;

import org.dice.logic.parsing.ast.Expression;
import org.dice.logic.parsing.ast.Operator;

import java.util.List;
import java.util.Map;

/**
 * Entry point for reducing expression trees to a boolean. Evaluation is pure: it reads the
 * tree and the assignment and never modifies either.
 */
public final class Evaluator {

    private Evaluator() {
    }

    /**
     * @param assignment bindings for at least every variable of {@code expression}
     * @throws UnboundVariableException naming the first unbound variable in sorted order
     */
    public static boolean evaluate(Expression expression, Map<String, Boolean> assignment) {
        if (expression == null) {
            throw new IllegalArgumentException("expression must not be null");
        }
        if (assignment == null) {
            throw new IllegalArgumentException("assignment must not be null");
        }
        for (String name : expression.getVariables()) {
            if (assignment.get(name) == null) {
                throw new UnboundVariableException(name);
            }
        }
        return expression.evaluate(assignment);
    }

    /**
     * Applies an operator to any number of inputs, the way a gate with that many inputs would.
     */
    public static boolean evaluate(Operator op, List<Boolean> inputs) {
        boolean[] values = new boolean[inputs.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = inputs.get(i);
        }
        return op.fold(values);
    }
}
