package org.dice.logic.parsing;

public enum TokenType {
    VARIABLE,
    CONSTANT,
    OPERATOR,
    LEFT,
    RIGHT,
    EOF
}
