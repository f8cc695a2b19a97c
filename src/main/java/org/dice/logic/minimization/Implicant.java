package org.dice.logic.minimization;

import org.dice.logic.parsing.ast.Expression;
import org.dice.logic.parsing.ast.Operator;
import org.dice.logic.parsing.ast.operands.Constant;
import org.dice.logic.parsing.ast.operands.Variable;
import org.dice.logic.parsing.ast.operators.BinaryOperator;
import org.dice.logic.parsing.ast.operators.Not;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * A product term over a fixed, ordered variable list. Position 0 is the first variable and maps
 * to the most significant bit of a minterm index. Each position is 0, 1 or don't-care; bits set in
 * {@code mask} are don't-care and are always clear in {@code value}.
 */
public final class Implicant {

    private final int value;
    private final int mask;
    private final int width;
    private final SortedSet<Integer> minterms;

    Implicant(int value, int mask, int width, SortedSet<Integer> minterms) {
        this.value = value & ~mask;
        this.mask = mask;
        this.width = width;
        this.minterms = Collections.unmodifiableSortedSet(minterms);
    }

    static Implicant ofMinterm(int minterm, int width) {
        return new Implicant(minterm, 0, width, new TreeSet<Integer>(Collections.singleton(minterm)));
    }

    public int getValue() {
        return value;
    }

    public int getMask() {
        return mask;
    }

    public int getWidth() {
        return width;
    }

    /**
     * @return the row indices this implicant was built from (minterms and don't-cares)
     */
    public SortedSet<Integer> getMinterms() {
        return minterms;
    }

    public int getLiteralCount() {
        return width - Integer.bitCount(mask);
    }

    int countOnes() {
        return Integer.bitCount(value);
    }

    /**
     * Two implicants merge when they have the same don't-care positions and their fixed bits
     * differ in exactly one place.
     */
    static long key(int value, int mask) {
        return ((long) mask << 32) | (value & 0xffffffffL);
    }

    long key() {
        return key(value, mask);
    }

    boolean canMerge(Implicant other) {
        return mask == other.mask && Integer.bitCount(value ^ other.value) == 1;
    }

    Implicant merge(Implicant other) {
        TreeSet<Integer> covered = new TreeSet<Integer>(minterms);
        covered.addAll(other.minterms);
        return new Implicant(value, mask | (value ^ other.value), width, covered);
    }

    public boolean covers(int minterm) {
        return (minterm & ~mask) == value;
    }

    /**
     * @return 0/1/- per position, first variable first
     */
    public String getPattern() {
        StringBuilder pattern = new StringBuilder(width);
        for (int i = width - 1; i >= 0; i--) {
            int bit = 1 << i;
            if ((mask & bit) != 0) {
                pattern.append('-');
            } else {
                pattern.append((value & bit) != 0 ? '1' : '0');
            }
        }
        return pattern.toString();
    }

    /**
     * Builds the AND of the literals for the fixed positions: the variable itself for a 1 bit,
     * its negation for a 0 bit. A single literal is returned as is, no literals yields True.
     */
    public Expression toExpression(List<String> variables) {
        if (variables.size() != width) {
            throw new IllegalArgumentException("Expected " + width + " variables, got " + variables.size());
        }
        List<Expression> literals = new ArrayList<Expression>();
        for (int position = 0; position < width; position++) {
            int bit = 1 << (width - 1 - position);
            if ((mask & bit) != 0) {
                continue;
            }
            Expression literal = new Variable(variables.get(position));
            if ((value & bit) == 0) {
                literal = new Not(literal);
            }
            literals.add(literal);
        }
        return literals.isEmpty() ? Constant.TRUE : BinaryOperator.join(Operator.AND, literals);
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof Implicant)) {
            return false;
        }
        Implicant other = (Implicant) o;
        return value == other.value && mask == other.mask && width == other.width;
    }

    @Override
    public int hashCode() {
        return (31 * value + mask) * 31 + width;
    }

    @Override
    public String toString() {
        return getPattern() + minterms;
    }
}
