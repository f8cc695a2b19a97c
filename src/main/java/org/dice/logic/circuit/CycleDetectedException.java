package org.dice.logic.circuit;

import org.dice.logic.LogicException;

import java.util.Collections;
import java.util.List;

/**
 * Raised when the gate graph has no topological order. The reported gates are those left
 * unordered: every gate on a cycle plus any gate fed, directly or not, by one.
 */
public class CycleDetectedException extends LogicException {

    private final List<String> gates;

    public CycleDetectedException(List<String> gates) {
        super(ErrorCode.CYCLE_DETECTED, "Feedback loop through gates " + gates);
        this.gates = Collections.unmodifiableList(gates);
    }

    public List<String> getGates() {
        return gates;
    }
}
