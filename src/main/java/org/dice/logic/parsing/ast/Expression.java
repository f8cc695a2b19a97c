package org.dice.logic.parsing.ast;

import java.util.Map;
import java.util.SortedSet;

/**
 * A node of a boolean expression tree.
 *
 * <expression>::=<xor>{(OR|NOR)<xor>}
 * <xor>::=<term>{XOR<term>}
 * <term>::=<factor>{(AND|NAND)<factor>}
 * <factor>::=NOT<factor>|<variable>|<constant>|(<expression>)
 * <constant>::=True|False
 *
 * Trees are immutable. Every node exclusively owns its children.
 */
public interface Expression {

	/**
	 * @param assignment variable bindings; must bind every variable of this tree, extra bindings are ignored
	 * @throws org.dice.logic.evaluation.UnboundVariableException if a variable has no binding
	 */
	public boolean evaluate(Map<String, Boolean> assignment);

	/**
	 * @return the distinct variable names in this tree, sorted ascending
	 */
	public SortedSet<String> getVariables();

	/**
	 * @return the expression in the parser's own syntax, fully parenthesized
	 */
	public String render();
}
