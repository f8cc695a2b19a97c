package org.dice.logic.circuit;

import org.dice.logic.evaluation.Evaluator;
import org.dice.logic.parsing.ast.Operator;
import org.junit.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class TestGateType {

    @Test
    public void xorAndXnorUseParity() {
        assertTrue(GateType.XOR.evaluate(true, true, true));
        assertFalse(GateType.XOR.evaluate(true, true, false, false));
        assertFalse(GateType.XNOR.evaluate(true, true, true));
        assertTrue(GateType.XNOR.evaluate(true, false, true));
        assertTrue(GateType.XNOR.evaluate(false, false));
    }

    @Test
    public void nandAndNorNegateTheWholeFold() {
        assertTrue(GateType.NAND.evaluate(true, true, false));
        assertFalse(GateType.NAND.evaluate(true, true, true));
        assertTrue(GateType.NOR.evaluate(false, false, false, false));
        assertFalse(GateType.NOR.evaluate(false, false, true));
    }

    @Test
    public void foldsInputListsLikeTheEvaluator() {
        List<Boolean> inputs = Arrays.asList(true, false, true, true);
        assertTrue(Evaluator.evaluate(Operator.XOR, inputs));
        assertFalse(GateType.AND.evaluate(inputs));
        assertTrue(GateType.OR.evaluate(inputs));
        assertTrue(GateType.XOR.evaluate(inputs));
        assertTrue(GateType.NAND.evaluate(inputs));
        assertFalse(GateType.NOR.evaluate(inputs));
        assertFalse(GateType.XNOR.evaluate(inputs));
        assertTrue(GateType.NOT.evaluate(Arrays.asList(false)));
    }

    @Test
    public void checksArity() {
        assertTrue(GateType.NOT.acceptsArity(1));
        assertFalse(GateType.NOT.acceptsArity(2));
        assertTrue(GateType.OR.acceptsArity(5));
        assertFalse(GateType.XNOR.acceptsArity(0));
    }

    @Test
    public void mapsExpressionOperators() {
        for (Operator op : Operator.values()) {
            assertEquals(op.name(), GateType.of(op).name());
        }
    }
}
