package org.dice.logic.evaluation;

import org.dice.logic.LogicException;

public class UnboundVariableException extends LogicException {

    private final String variable;

    public UnboundVariableException(String variable) {
        super(ErrorCode.UNBOUND_VARIABLE, String.format("No value bound for variable '%s'", variable));
        this.variable = variable;
    }

    public String getVariable() {
        return variable;
    }
}
