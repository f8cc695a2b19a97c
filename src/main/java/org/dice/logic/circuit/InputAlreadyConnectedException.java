package org.dice.logic.circuit;

import org.dice.logic.LogicException;

public class InputAlreadyConnectedException extends LogicException {

    private final String pin;

    public InputAlreadyConnectedException(String pin, String existingDriver) {
        super(ErrorCode.INPUT_ALREADY_CONNECTED, String.format("Pin '%s' is already driven by %s", pin, existingDriver));
        this.pin = pin;
    }

    public String getPin() {
        return pin;
    }
}
