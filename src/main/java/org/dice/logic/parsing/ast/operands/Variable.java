package org.dice.logic.parsing.ast.operands;

import org.dice.logic.evaluation.UnboundVariableException;
import org.dice.logic.parsing.ast.Expression;

import java.util.Collections;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;

public class Variable implements Expression {
	private final String name;
	private final SortedSet<String> variables;

	public Variable(String name) {
		if (name == null || name.isEmpty()) {
			throw new IllegalArgumentException("Variable name must not be empty");
		}
		this.name = name;
		this.variables = Collections.unmodifiableSortedSet(new TreeSet<String>(Collections.singleton(name)));
	}

	public String getName() {
		return name;
	}

	public boolean evaluate(Map<String, Boolean> assignment) {
		Boolean value = assignment.get(name);
		if (value == null) {
			throw new UnboundVariableException(name);
		}
		return value;
	}

	public SortedSet<String> getVariables() {
		return variables;
	}

	public String render() {
		return name;
	}

	@Override
	public boolean equals(Object o) {
		return o instanceof Variable && ((Variable) o).name.equals(name);
	}

	@Override
	public int hashCode() {
		return name.hashCode();
	}

	@Override
	public String toString(){
		return this.render();
	}
}
