package org.dice.logic.parsing;

import org.dice.logic.LogicException;

/**
 * Raised when the input contains a character that cannot start any token.
 */
public class LexerException extends LogicException {

    private final char character;
    private final int position;

    public LexerException(char character, int position) {
        super(ErrorCode.LEX_ERROR, String.format("Unexpected character '%s' at position %d", character, position));
        this.character = character;
        this.position = position;
    }

    public char getCharacter() {
        return character;
    }

    public int getPosition() {
        return position;
    }
}
