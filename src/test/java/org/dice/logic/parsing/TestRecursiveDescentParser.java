package org.dice.logic.parsing;

import org.apache.commons.lang.StringUtils;
import org.dice.logic.parsing.ast.Expression;
import org.dice.logic.parsing.ast.operands.Constant;
import org.dice.logic.parsing.ast.operands.Variable;
import org.dice.logic.parsing.ast.operators.And;
import org.dice.logic.parsing.ast.operators.Not;
import org.dice.logic.parsing.ast.operators.Or;
import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.fail;

public class TestRecursiveDescentParser {

    @Test
    public void enforcesOperatorPrecedence(){
        assertEquals("((A AND B) OR C)", parse("A and B or C"));
        assertEquals("(A OR (B AND C))", parse("A or B AnD C"));
        assertEquals("(A OR (B XOR C))", parse("A OR B XOR C"));
        assertEquals("((A AND B) XOR C)", parse("A AND B XOR C"));
        assertEquals("((A NAND B) OR C)", parse("A NAND B OR C"));
        assertEquals("(A NOR (B NAND C))", parse("A NOR B NAND C"));
        assertEquals("((A XOR B) NOR C)", parse("A XOR B NOR C"));
    }

    @Test
    public void binaryOperatorsAreLeftAssociative() {
        assertEquals("((A AND B) AND C)", parse("A AND B AND C"));
        assertEquals("((A NAND B) AND C)", parse("A NAND B AND C"));
        assertEquals("((A OR B) NOR C)", parse("A OR B NOR C"));
        assertEquals("((A XOR B) XOR C)", parse("A XOR B XOR C"));
    }

    @Test
    public void parsesNotOperator(){
        assertEquals("NOT A", parse("not A"));
        assertEquals("(NOT A AND B)", parse("not A and B"));
        assertEquals("((NOT A AND B) OR C)", parse("not A and B or C"));
        assertEquals("(NOT (A AND B) OR C)", parse("not (A and B) or C"));
        assertEquals("NOT NOT A", parse("NOT NOT A"));
    }

    @Test
    public void parenthesesResetPrecedence() {
        assertEquals("(A AND (B OR C))", parse("A AND (B OR C)"));
        assertEquals("(A AND B)", parse("(((A AND B)))"));
    }

    @Test
    public void parsesConstants() {
        assertSame(Constant.TRUE, RecursiveDescentParser.parse("TRUE"));
        assertEquals("(A OR False)", parse("A OR false"));
    }

    @Test
    public void buildsExpectedTree() {
        Expression expected = new Or(new And(new Variable("A"), new Variable("B")),
                new And(new Variable("A"), new Not(new Variable("B"))));
        assertEquals(expected, RecursiveDescentParser.parse("(A AND B) OR (A AND NOT B)"));
    }

    @Test
    public void reportsSortedDistinctVariables() {
        RecursiveDescentParser parser = new RecursiveDescentParser(new Lexer("c OR B AND a OR B OR c"));
        parser.parse();
        assertEquals(Arrays.asList("B", "a", "c"), parser.getVariables());
    }

    @Test
    public void renderedOutputParsesBack() {
        String[] inputs = {"A NAND B OR NOT C", "NOT (A XOR B) NOR C AND True", "x", "NOT NOT (p OR q)"};
        for (String input : inputs) {
            Expression ast = RecursiveDescentParser.parse(input);
            assertEquals(ast, RecursiveDescentParser.parse(ast.render()));
        }
    }

    @Test
    public void reportsMissingLeftParen(){
        assertEquals(ParserErrors.MissingLeftParen, getParserError("A or B)"));
        assertEquals(ParserErrors.MissingLeftParen, getParserError("(A or B))"));
        assertEquals(ParserErrors.MissingLeftParen, getParserError(")"));
        assertEquals(ParserErrors.MissingLeftParen, getParserError("A AND )"));
    }

    @Test
    public void reportsMissingRightParen(){
        assertEquals(ParserErrors.MissingRightParen, getParserError("(A or B"));
        assertEquals(ParserErrors.MissingRightParen, getParserError("((A or B)"));
        assertEquals(ParserErrors.MissingRightParen, getParserError("C AND (A or B"));
        assertEquals(ParserErrors.MissingRightParen, getParserError("(A B)"));
    }

    @Test
    public void reportsMalformedExpression() {
        assertEquals(ParserErrors.MalFormedExpression, getParserError("A or"));
        assertEquals(ParserErrors.MalFormedExpression, getParserError("A AND"));
        assertEquals(ParserErrors.MalFormedExpression, getParserError("AND A"));
        assertEquals(ParserErrors.MalFormedExpression, getParserError("NOT"));
        assertEquals(ParserErrors.MalFormedExpression, getParserError("()"));
        assertEquals(ParserErrors.MalFormedExpression, getParserError("(A AND )"));
    }

    @Test
    public void reportsTrailingTokens() {
        assertEquals(ParserErrors.TrailingTokens, getParserError("A B"));
        assertEquals(ParserErrors.TrailingTokens, getParserError("(A) (B)"));
        assertEquals(ParserErrors.TrailingTokens, getParserError("A OR B NOT C"));
        assertEquals(ParserErrors.TrailingTokens, getParserError("A NOT"));
    }

    @Test
    public void reportsEmptyInput() {
        assertEquals(ParserErrors.EmptyExpression, getParserError(""));
        assertEquals(ParserErrors.EmptyExpression, getParserError("   "));
    }

    @Test
    public void syntaxErrorCarriesPosition() {
        try {
            RecursiveDescentParser.parse("A AND OR B");
            fail("expected a syntax error");
        } catch (SyntaxException e) {
            assertEquals(6, e.getPosition());
            assertEquals("OR", e.getTokenText());
        }
    }

    @Test(expected = LexerException.class)
    public void propagatesLexerErrors() {
        RecursiveDescentParser.parse("A AND $");
    }

    @Test
    public void parseCanBeRepeated() {
        RecursiveDescentParser parser = new RecursiveDescentParser(new Lexer("A XOR B"));
        assertEquals(parser.parse(), parser.parse());
    }

    @Test
    public void acceptsNestingUpToTheLimit() {
        int limit = RecursiveDescentParser.MAX_DEPTH;
        Expression negated = RecursiveDescentParser.parse(StringUtils.repeat("NOT ", limit - 1) + "A");
        assertFalse(negated.evaluate(Collections.singletonMap("A", true)));
        assertEquals("A", parse(StringUtils.repeat("(", limit) + "A" + StringUtils.repeat(")", limit)));
    }

    @Test
    public void rejectsNestingBeyondTheLimit() {
        assertEquals(ParserErrors.NestingTooDeep, getParserError(StringUtils.repeat("NOT ", 50000) + "A"));
        assertEquals(ParserErrors.NestingTooDeep,
                getParserError(StringUtils.repeat("(", 50000) + "A" + StringUtils.repeat(")", 50000)));
        assertEquals(ParserErrors.NestingTooDeep, getParserError("A" + StringUtils.repeat(" AND A", 50000)));
        assertEquals(ParserErrors.NestingTooDeep,
                getParserError(StringUtils.repeat("NOT ", 300) + "(" + StringUtils.repeat("NOT ", 300) + "A)"));
    }

    private String parse(String input){
        return RecursiveDescentParser.parse(input).render();
    }

    private ParserErrors getParserError(String input){
        try {
            RecursiveDescentParser.parse(input);
        } catch (SyntaxException e) {
            return e.getError();
        }
        fail("expected a syntax error for: " + input);
        return null;
    }
}
