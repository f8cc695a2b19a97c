package org.dice.logic.parsing.ast;

/**
 * Operator kinds shared by the expression tree, the lexer and the gate model.
 *
 * Binary semantics are defined by {@link #apply(boolean, boolean)}. The n-ary form
 * ({@link #fold(boolean...)}) folds the underlying AND/OR/XOR left to right and, for NAND and
 * NOR, negates the final result rather than each pairwise step.
 */
public enum Operator {
    NOT("NOT"),
    AND("AND"),
    OR("OR"),
    XOR("XOR"),
    NAND("NAND"),
    NOR("NOR");

    private final String keyword;

    Operator(String keyword) {
        this.keyword = keyword;
    }

    public String getKeyword() {
        return keyword;
    }

    public boolean isUnary() {
        return this == NOT;
    }

    public boolean apply(boolean left, boolean right) {
        switch (this) {
            case AND:
                return left && right;
            case OR:
                return left || right;
            case XOR:
                return left ^ right;
            case NAND:
                return !(left && right);
            case NOR:
                return !(left || right);
            default:
                throw new UnsupportedOperationException(keyword + " is not a binary operator");
        }
    }

    public boolean apply(boolean operand) {
        if (this != NOT) {
            throw new UnsupportedOperationException(keyword + " is not a unary operator");
        }
        return !operand;
    }

    public boolean fold(boolean... inputs) {
        switch (this) {
            case NOT:
                if (inputs.length != 1) {
                    throw new IllegalArgumentException("NOT takes exactly one input, got " + inputs.length);
                }
                return !inputs[0];
            case NAND:
                return !AND.fold(inputs);
            case NOR:
                return !OR.fold(inputs);
            default:
                // identity of the fold: AND -> true, OR/XOR -> false
                boolean result = this == AND;
                for (boolean input : inputs) {
                    result = apply(result, input);
                }
                return result;
        }
    }

    /**
     * @return the operator for a keyword, ignoring case, or null when the word is not a keyword
     */
    public static Operator fromKeyword(String word) {
        for (Operator op : values()) {
            if (op.keyword.equalsIgnoreCase(word)) {
                return op;
            }
        }
        return null;
    }
}
