package org.dice.logic.circuit;

import org.dice.logic.parsing.ast.Expression;
import org.dice.logic.parsing.ast.operands.Constant;
import org.dice.logic.parsing.ast.operands.Variable;
import org.dice.logic.parsing.ast.operators.BinaryOperator;
import org.dice.logic.parsing.ast.operators.Not;

/**
 * Builds a gate network computing an expression: one two-input gate per binary operator, one
 * NOT gate per negation, one external input per variable and a single external output,
 * {@value #OUTPUT} unless named otherwise. When a variable already uses that name the output
 * takes the first free one of OUT_1, OUT_2 and so on. Constants become external inputs named
 * TRUE and FALSE that already carry their value. Gates are named after their type and a running number, e.g. AND1, NOT2.
 */
public class ExpressionCircuitCompiler {

    public static final String OUTPUT = "OUT";

    private Circuit circuit;
    private int gateCount;

    public Circuit compile(Expression expression) {
        if (expression == null) {
            throw new IllegalArgumentException("expression must not be null");
        }
        return compile(expression, outputName(expression));
    }

    /**
     * @param output name of the external output; must differ from every variable name
     */
    public Circuit compile(Expression expression, String output) {
        if (expression == null) {
            throw new IllegalArgumentException("expression must not be null");
        }
        circuit = new Circuit();
        gateCount = 0;
        for (String variable : expression.getVariables()) {
            circuit.addInput(variable);
        }
        circuit.addOutput(output);
        circuit.connect(build(expression), output);
        return circuit;
    }

    /**
     * @return the pin carrying the value of {@code node}
     */
    private String build(Expression node) {
        if (node instanceof Variable) {
            return ((Variable) node).getName();
        }
        if (node instanceof Constant) {
            String name = ((Constant) node).getValue() ? "TRUE" : "FALSE";
            if (!circuit.hasInput(name)) {
                circuit.setInput(name, ((Constant) node).getValue());
            }
            return name;
        }
        if (node instanceof Not) {
            String operand = build(((Not) node).getChild());
            Gate gate = circuit.addGate(nextName(GateType.NOT), GateType.NOT, 1);
            circuit.connect(operand, gate.getInput(1).toString());
            return gate.getOutput().toString();
        }
        if (node instanceof BinaryOperator) {
            BinaryOperator binary = (BinaryOperator) node;
            String left = build(binary.getLeft());
            String right = build(binary.getRight());
            GateType type = GateType.of(binary.getOperator());
            Gate gate = circuit.addGate(nextName(type), type, 2);
            circuit.connect(left, gate.getInput(1).toString());
            circuit.connect(right, gate.getInput(2).toString());
            return gate.getOutput().toString();
        }
        throw new IllegalArgumentException("Unsupported expression node " + node.getClass().getName());
    }

    private static String outputName(Expression expression) {
        String name = OUTPUT;
        for (int suffix = 1; expression.getVariables().contains(name); suffix++) {
            name = OUTPUT + "_" + suffix;
        }
        return name;
    }

    private String nextName(GateType type) {
        gateCount++;
        return type.name() + gateCount;
    }
}
