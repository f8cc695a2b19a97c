package org.dice.logic.circuit;

import org.dice.logic.LogicException;

public class UnknownPinException extends LogicException {

    private final String pin;

    public UnknownPinException(String pin, String reason) {
        super(ErrorCode.UNKNOWN_PIN, String.format("Unknown pin '%s': %s", pin, reason));
        this.pin = pin;
    }

    public String getPin() {
        return pin;
    }
}
