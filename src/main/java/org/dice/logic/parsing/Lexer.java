package org.dice.logic.parsing;

import org.dice.logic.parsing.ast.Operator;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Scans boolean expression text left to right, one token per {@link #nextToken()} call.
 *
 * Keywords (AND, OR, NOT, XOR, NAND, NOR) and the constants True/False are matched
 * case-insensitively; any other maximal run of ASCII letters, digits and underscores is a
 * variable name and keeps its case. Whitespace only separates tokens.
 *
 * Iterating a lexer always rescans from the beginning, so the token sequence can be consumed
 * any number of times.
 */
public class Lexer implements Iterable<Token> {

    private static final String TRUE = "true";
    private static final String FALSE = "false";

    private final String input;
    private int cursor;

    public Lexer(String input) {
        this.input = input == null ? "" : input;
        this.cursor = 0;
    }

    /**
     * @return the next token; once the input is exhausted every call returns an EOF token
     * @throws LexerException on a character that cannot begin a token
     */
    public Token nextToken() {
        while (cursor < input.length() && Character.isWhitespace(input.charAt(cursor))) {
            cursor++;
        }
        if (cursor >= input.length()) {
            return Token.eof(input.length());
        }

        final int start = cursor;
        final char c = input.charAt(cursor);
        if (c == '(') {
            cursor++;
            return Token.left(start);
        }
        if (c == ')') {
            cursor++;
            return Token.right(start);
        }
        if (!isWordCharacter(c)) {
            throw new LexerException(c, start);
        }

        while (cursor < input.length() && isWordCharacter(input.charAt(cursor))) {
            cursor++;
        }
        String word = input.substring(start, cursor);

        Operator op = Operator.fromKeyword(word);
        if (op != null) {
            return Token.operator(word, op, start);
        }
        if (TRUE.equalsIgnoreCase(word)) {
            return Token.constant(word, true, start);
        }
        if (FALSE.equalsIgnoreCase(word)) {
            return Token.constant(word, false, start);
        }
        return Token.variable(word, start);
    }

    public void reset() {
        cursor = 0;
    }

    public String getInput() {
        return input;
    }

    @Override
    public Iterator<Token> iterator() {
        final Lexer scanner = new Lexer(input);
        return new Iterator<Token>() {
            private Token next = scanner.nextToken();

            @Override
            public boolean hasNext() {
                return !next.is(TokenType.EOF);
            }

            @Override
            public Token next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                Token current = next;
                next = scanner.nextToken();
                return current;
            }
        };
    }

    /**
     * Tokenizes the whole input, excluding the trailing EOF token.
     */
    public static List<Token> tokenize(String inputString) {
        // create a new lexer so as not to disturb any other scan of the same text
        List<Token> tokens = new ArrayList<Token>();
        for (Token token : new Lexer(inputString)) {
            tokens.add(token);
        }
        return tokens;
    }

    private static boolean isWordCharacter(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9') || c == '_';
    }
}
