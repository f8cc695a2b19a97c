package org.dice.logic.parsing;

import org.dice.logic.parsing.ast.Operator;

/**
 * A single lexical token. Immutable; the position is the zero-based offset of the token's
 * first character in the source text.
 */
public final class Token {

    private final TokenType type;
    private final String text;
    private final int position;
    private final Operator operator;
    private final boolean constant;

    private Token(TokenType type, String text, int position, Operator operator, boolean constant) {
        this.type = type;
        this.text = text;
        this.position = position;
        this.operator = operator;
        this.constant = constant;
    }

    public static Token variable(String name, int position) {
        return new Token(TokenType.VARIABLE, name, position, null, false);
    }

    public static Token constant(String text, boolean value, int position) {
        return new Token(TokenType.CONSTANT, text, position, null, value);
    }

    public static Token operator(String text, Operator operator, int position) {
        return new Token(TokenType.OPERATOR, text, position, operator, false);
    }

    public static Token left(int position) {
        return new Token(TokenType.LEFT, "(", position, null, false);
    }

    public static Token right(int position) {
        return new Token(TokenType.RIGHT, ")", position, null, false);
    }

    public static Token eof(int position) {
        return new Token(TokenType.EOF, "", position, null, false);
    }

    public TokenType getType() {
        return type;
    }

    public String getText() {
        return text;
    }

    public int getPosition() {
        return position;
    }

    /** Only meaningful for {@link TokenType#OPERATOR} tokens. */
    public Operator getOperator() {
        return operator;
    }

    /** Only meaningful for {@link TokenType#CONSTANT} tokens. */
    public boolean getConstantValue() {
        return constant;
    }

    public boolean is(TokenType type) {
        return this.type == type;
    }

    public boolean is(Operator operator) {
        return this.type == TokenType.OPERATOR && this.operator == operator;
    }

    String describe() {
        return type == TokenType.EOF ? "end of input" : String.format("'%s'", text);
    }

    @Override
    public String toString() {
        return type == TokenType.EOF ? "EOF" : String.format("%s(%s)@%d", type, text, position);
    }
}
