package org.dice.logic.parsing.ast.operators;

import org.dice.logic.parsing.ast.Expression;
import org.dice.logic.parsing.ast.Operator;

import java.util.Map;

public class Not extends UnaryOperator {
	public Not(Expression child){
		super(child);
	}

	public boolean evaluate(Map<String, Boolean> assignment) {
		return Operator.NOT.apply(child.evaluate(assignment));
	}

	public String render() {
		return String.format("NOT %s", child.render());
	}
}
