package org.dice.logic.parsing.ast.operators;

import org.dice.logic.parsing.ast.Expression;
import org.dice.logic.parsing.ast.Operator;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;

public abstract class BinaryOperator implements Expression {
	protected final Expression left, right;
	private final SortedSet<String> variables;

    BinaryOperator(Expression left, Expression right){
        if (left == null || right == null) {
            throw new IllegalArgumentException("Operands must not be null");
        }
        this.left = left;
        this.right = right;

        if (left.getVariables().containsAll(right.getVariables())) {
            this.variables = left.getVariables();
        } else if (right.getVariables().containsAll(left.getVariables())) {
            this.variables = right.getVariables();
        } else {
            TreeSet<String> names = new TreeSet<String>(left.getVariables());
            names.addAll(right.getVariables());
            this.variables = Collections.unmodifiableSortedSet(names);
        }
    }

    /**
     * Builds the node class matching a binary operator kind.
     */
    public static BinaryOperator create(Operator op, Expression left, Expression right) {
        switch (op) {
            case AND:
                return new And(left, right);
            case OR:
                return new Or(left, right);
            case XOR:
                return new Xor(left, right);
            case NAND:
                return new Nand(left, right);
            case NOR:
                return new Nor(left, right);
            default:
                throw new IllegalArgumentException(op + " is not a binary operator");
        }
    }

    /**
     * Joins operands with an associative operator (AND, OR or XOR) as a balanced tree, so the
     * depth grows with the log of the operand count. Up to three operands the result is the
     * left-nested tree the parser builds for the same text.
     */
    public static Expression join(Operator op, List<? extends Expression> operands) {
        if (op != Operator.AND && op != Operator.OR && op != Operator.XOR) {
            throw new IllegalArgumentException(op + " is not associative");
        }
        if (operands.isEmpty()) {
            throw new IllegalArgumentException("Nothing to join");
        }
        return join(op, operands, 0, operands.size());
    }

    private static Expression join(Operator op, List<? extends Expression> operands, int from, int to) {
        if (to - from == 1) {
            return operands.get(from);
        }
        int middle = from + (to - from + 1) / 2;
        return create(op, join(op, operands, from, middle), join(op, operands, middle, to));
    }

    public abstract Operator getOperator();

    public Expression getLeft() {
        return left;
    }

    public Expression getRight() {
        return right;
    }

    public boolean evaluate(Map<String, Boolean> assignment) {
        return getOperator().apply(left.evaluate(assignment), right.evaluate(assignment));
    }

    public SortedSet<String> getVariables() {
        return variables;
    }

    public String render() {
        return String.format("(%s %s %s)", left.render(), getOperator().getKeyword(), right.render());
    }

    @Override
    public boolean equals(Object o) {
        if (o == null || o.getClass() != getClass()) {
            return false;
        }
        BinaryOperator other = (BinaryOperator) o;
        return left.equals(other.left) && right.equals(other.right);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * getOperator().hashCode() + left.hashCode()) + right.hashCode();
    }

	@Override
	public String toString(){
		return this.render();
	}
}
