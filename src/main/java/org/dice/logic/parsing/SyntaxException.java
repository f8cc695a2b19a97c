package org.dice.logic.parsing;

import org.dice.logic.LogicException;

public class SyntaxException extends LogicException {

    private final ParserErrors error;
    private final int position;
    private final String tokenText;

    public SyntaxException(ParserErrors error, Token token) {
        super(ErrorCode.SYNTAX_ERROR, String.format("%s at position %d (found %s)",
                error.description, token.getPosition(), token.describe()));
        this.error = error;
        this.position = token.getPosition();
        this.tokenText = token.getText();
    }

    public ParserErrors getError() {
        return error;
    }

    public int getPosition() {
        return position;
    }

    public String getTokenText() {
        return tokenText;
    }
}
