package org.dice.logic.circuit;

import org.dice.logic.evaluation.Evaluator;
import org.dice.logic.parsing.ast.Operator;

import java.util.ArrayList;
import java.util.List;

/**
 * Kinds of combinational gate. All but NOT accept any arity of at least one and fold their
 * inputs through {@link Evaluator#evaluate(Operator, List)}; XNOR negates the XOR (parity) fold.
 */
public enum GateType {
    AND(Operator.AND),
    OR(Operator.OR),
    XOR(Operator.XOR),
    NAND(Operator.NAND),
    NOR(Operator.NOR),
    XNOR(Operator.XOR),
    NOT(Operator.NOT);

    private final Operator operator;

    GateType(Operator operator) {
        this.operator = operator;
    }

    public boolean evaluate(List<Boolean> inputs) {
        boolean folded = Evaluator.evaluate(operator, inputs);
        return this == XNOR ? !folded : folded;
    }

    public boolean evaluate(boolean... inputs) {
        List<Boolean> values = new ArrayList<Boolean>(inputs.length);
        for (boolean input : inputs) {
            values.add(input);
        }
        return evaluate(values);
    }

    public boolean acceptsArity(int arity) {
        return this == NOT ? arity == 1 : arity >= 1;
    }

    /**
     * @return the gate kind computing the same function as a binary or unary expression operator
     */
    public static GateType of(Operator operator) {
        return valueOf(operator.name());
    }
}
