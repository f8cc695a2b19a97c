package org.dice.logic.parsing;

public enum ParserErrors {
    MissingLeftParen(1, "Unmatched closing parenthesis"),
    MissingRightParen(2, "Missing closing parenthesis"),
    MalFormedExpression(4, "Expected a variable, constant, NOT or '('"),
    EmptyExpression(5, "Expression is empty"),
    TrailingTokens(6, "Unexpected token after a complete expression"),
    NestingTooDeep(7, "Expression nests more than " + RecursiveDescentParser.MAX_DEPTH + " levels deep");

    public final int value;
    public final String description;

    ParserErrors(int value, String description){
        this.value = value;
        this.description = description;
    }
}
