package org.dice.logic.parsing.ast.operators;

import org.dice.logic.parsing.ast.Expression;

import java.util.SortedSet;

public abstract class UnaryOperator implements Expression {
    protected final Expression child;

    UnaryOperator(Expression child){
        if (child == null) {
            throw new IllegalArgumentException("Operand must not be null");
        }
        this.child = child;
    }

    public Expression getChild() {
        return child;
    }

    public SortedSet<String> getVariables() {
        return child.getVariables();
    }

    @Override
    public boolean equals(Object o) {
        return o != null && o.getClass() == getClass() && ((UnaryOperator) o).child.equals(child);
    }

    @Override
    public int hashCode() {
        return 31 * getClass().hashCode() + child.hashCode();
    }

    @Override
    public String toString(){
        return this.render();
    }
}
