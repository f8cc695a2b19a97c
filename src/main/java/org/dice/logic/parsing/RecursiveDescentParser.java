package org.dice.logic.parsing;

import org.dice.logic.parsing.ast.Expression;
import org.dice.logic.parsing.ast.Operator;
import org.dice.logic.parsing.ast.operands.Constant;
import org.dice.logic.parsing.ast.operands.Variable;
import org.dice.logic.parsing.ast.operators.BinaryOperator;
import org.dice.logic.parsing.ast.operators.Not;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds an expression tree from a {@link Lexer}.
 *
 * Precedence, highest first: NOT, then AND/NAND, then XOR, then OR/NOR. All binary operators
 * are left associative, NOT is right associative and parentheses reset precedence.
 *
 * Trees deeper than {@link #MAX_DEPTH} levels, and parentheses nested deeper than that, are
 * rejected with {@link ParserErrors#NestingTooDeep}.
 */
public class RecursiveDescentParser {

    private static final Logger log = LoggerFactory.getLogger(RecursiveDescentParser.class);

    public static final int MAX_DEPTH = 500;

    private final Lexer lexer;
    private Token symbol;
    private Expression root;
    private int depth;
    // levels in the tree held by root
    private int height;

    public RecursiveDescentParser(Lexer lexer) {
        if (lexer == null) {
            throw new IllegalArgumentException("lexer must not be null");
        }
        this.lexer = lexer;
    }

    /**
     * Parses the whole input. Can be called repeatedly; every call rescans from the start.
     *
     * @throws LexerException  on an unrecognized character
     * @throws SyntaxException on malformed input
     */
    public Expression parse() {
        lexer.reset();
        depth = 0;
        height = 0;
        root = null;
        symbol = lexer.nextToken();
        if (symbol.is(TokenType.EOF)) {
            throw new SyntaxException(ParserErrors.EmptyExpression, symbol);
        }

        orExpression();
        if (!symbol.is(TokenType.EOF)) {
            if (symbol.is(TokenType.RIGHT)) {
                throw new SyntaxException(ParserErrors.MissingLeftParen, symbol);
            }
            throw new SyntaxException(ParserErrors.TrailingTokens, symbol);
        }

        if (log.isDebugEnabled()) {
            log.debug("Parsed '{}' as {} over variables {}", lexer.getInput(), root.render(), root.getVariables());
        }
        return root;
    }

    /**
     * @return the sorted, distinct variable names of the last parsed expression
     */
    public List<String> getVariables() {
        if (root == null) {
            throw new IllegalStateException("parse() has not completed");
        }
        return new ArrayList<String>(root.getVariables());
    }

    public static Expression parse(String input) {
        return new RecursiveDescentParser(new Lexer(input)).parse();
    }

    private void orExpression() {
        xorExpression();
        while (symbol.is(Operator.OR) || symbol.is(Operator.NOR)) {
            Operator op = symbol.getOperator();
            Expression left = root;
            int leftHeight = height;
            advance();
            xorExpression();
            root = BinaryOperator.create(op, left, root);
            grow(Math.max(leftHeight, height) + 1);
        }
    }

    private void xorExpression() {
        andExpression();
        while (symbol.is(Operator.XOR)) {
            Expression left = root;
            int leftHeight = height;
            advance();
            andExpression();
            root = BinaryOperator.create(Operator.XOR, left, root);
            grow(Math.max(leftHeight, height) + 1);
        }
    }

    private void andExpression() {
        notExpression();
        while (symbol.is(Operator.AND) || symbol.is(Operator.NAND)) {
            Operator op = symbol.getOperator();
            Expression left = root;
            int leftHeight = height;
            advance();
            notExpression();
            root = BinaryOperator.create(op, left, root);
            grow(Math.max(leftHeight, height) + 1);
        }
    }

    private void notExpression() {
        int negations = 0;
        while (symbol.is(Operator.NOT)) {
            if (++negations >= MAX_DEPTH) {
                throw new SyntaxException(ParserErrors.NestingTooDeep, symbol);
            }
            advance();
        }
        atom();
        for (int i = 0; i < negations; i++) {
            root = new Not(root);
        }
        grow(height + negations);
    }

    private void atom() {
        switch (symbol.getType()) {
            case VARIABLE:
                root = new Variable(symbol.getText());
                height = 1;
                advance();
                break;

            case CONSTANT:
                root = Constant.of(symbol.getConstantValue());
                height = 1;
                advance();
                break;

            case LEFT:
                if (++depth > MAX_DEPTH) {
                    throw new SyntaxException(ParserErrors.NestingTooDeep, symbol);
                }
                advance();
                if (symbol.is(TokenType.RIGHT)) {
                    throw new SyntaxException(ParserErrors.MalFormedExpression, symbol);
                }
                orExpression();
                if (!symbol.is(TokenType.RIGHT)) {
                    throw new SyntaxException(ParserErrors.MissingRightParen, symbol);
                }
                depth--;
                advance();
                break;

            case RIGHT:
                // a ')' where an operand belongs is only an unmatched paren when nothing is open
                throw new SyntaxException(depth == 0 ? ParserErrors.MissingLeftParen : ParserErrors.MalFormedExpression, symbol);

            default:
                throw new SyntaxException(ParserErrors.MalFormedExpression, symbol);
        }
    }

    private void grow(int newHeight) {
        if (newHeight > MAX_DEPTH) {
            throw new SyntaxException(ParserErrors.NestingTooDeep, symbol);
        }
        height = newHeight;
    }

    private void advance() {
        symbol = lexer.nextToken();
    }
}
