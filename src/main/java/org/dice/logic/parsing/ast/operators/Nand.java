package org.dice.logic.parsing.ast.operators;

import org.dice.logic.parsing.ast.Expression;
import org.dice.logic.parsing.ast.Operator;

public class Nand extends BinaryOperator {
	public Nand(Expression left, Expression right){
		super(left, right);
	}

	@Override
	public Operator getOperator() {
		return Operator.NAND;
	}
}
