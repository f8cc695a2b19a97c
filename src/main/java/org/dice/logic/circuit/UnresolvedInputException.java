package org.dice.logic.circuit;

import org.dice.logic.LogicException;

public class UnresolvedInputException extends LogicException {

    private final String pin;

    public UnresolvedInputException(String pin, String reason) {
        super(ErrorCode.UNRESOLVED_INPUT, String.format("No value for pin '%s': %s", pin, reason));
        this.pin = pin;
    }

    public String getPin() {
        return pin;
    }
}
