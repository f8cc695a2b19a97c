package org.dice.logic.circuit;

import org.dice.logic.LogicException;

/**
 * Raised when a gate, or an external input or output, is declared under a name already in use.
 */
public class DuplicateGateNameException extends LogicException {

    private final String name;

    public DuplicateGateNameException(String name) {
        super(ErrorCode.DUPLICATE_GATE_NAME, String.format("Name '%s' is already declared", name));
        this.name = name;
    }

    public String getName() {
        return name;
    }
}
