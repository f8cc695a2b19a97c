package org.dice.logic.truthtable;

import org.dice.logic.LogicException;

public class TooManyVariablesException extends LogicException {

    private final int variableCount;
    private final int maxVariables;

    public TooManyVariablesException(int variableCount, int maxVariables) {
        super(ErrorCode.TOO_MANY_VARIABLES, String.format(
                "Truth table over %d variables exceeds the limit of %d", variableCount, maxVariables));
        this.variableCount = variableCount;
        this.maxVariables = maxVariables;
    }

    public int getVariableCount() {
        return variableCount;
    }

    public int getMaxVariables() {
        return maxVariables;
    }
}
