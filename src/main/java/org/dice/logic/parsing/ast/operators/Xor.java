package org.dice.logic.parsing.ast.operators;

import org.dice.logic.parsing.ast.Expression;
import org.dice.logic.parsing.ast.Operator;

public class Xor extends BinaryOperator {
	public Xor(Expression left, Expression right){
		super(left, right);
	}

	@Override
	public Operator getOperator() {
		return Operator.XOR;
	}
}
