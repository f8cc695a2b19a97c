package org.dice.logic.parsing.ast.operands;

import org.dice.logic.parsing.ast.Expression;

import java.util.Collections;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;

public class Constant implements Expression {
	public static final Constant TRUE = new Constant(true);
	public static final Constant FALSE = new Constant(false);

	private static final SortedSet<String> NO_VARIABLES = Collections.unmodifiableSortedSet(new TreeSet<String>());

	private final boolean value;

	private Constant(boolean value) {
		this.value = value;
	}

	public static Constant of(boolean value) {
		return value ? TRUE : FALSE;
	}

	public boolean getValue() {
		return value;
	}

	public boolean evaluate(Map<String, Boolean> assignment) {
		return value;
	}

	public SortedSet<String> getVariables() {
		return NO_VARIABLES;
	}

	public String render() {
		return value ? "True" : "False";
	}

	@Override
	public String toString(){
		return this.render();
	}
}
