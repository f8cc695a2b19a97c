package org.dice.logic.minimization;

import org.dice.logic.parsing.ast.Expression;

import java.util.Collections;
import java.util.List;

/**
 * Result of minimizing a truth table, with the intermediate Quine-McCluskey products kept for
 * inspection.
 */
public final class Minimization {

    private final List<String> variables;
    private final List<Integer> minterms;
    private final List<Implicant> primeImplicants;
    private final List<Implicant> essentialPrimeImplicants;
    private final List<Implicant> selected;
    private final Expression expression;

    Minimization(List<String> variables, List<Integer> minterms, List<Implicant> primeImplicants,
                 List<Implicant> essentialPrimeImplicants, List<Implicant> selected, Expression expression) {
        this.variables = Collections.unmodifiableList(variables);
        this.minterms = Collections.unmodifiableList(minterms);
        this.primeImplicants = Collections.unmodifiableList(primeImplicants);
        this.essentialPrimeImplicants = Collections.unmodifiableList(essentialPrimeImplicants);
        this.selected = Collections.unmodifiableList(selected);
        this.expression = expression;
    }

    public List<String> getVariables() {
        return variables;
    }

    public List<Integer> getMinterms() {
        return minterms;
    }

    public List<Implicant> getPrimeImplicants() {
        return primeImplicants;
    }

    public List<Implicant> getEssentialPrimeImplicants() {
        return essentialPrimeImplicants;
    }

    /**
     * @return the cover the expression was built from, in output term order
     */
    public List<Implicant> getSelectedImplicants() {
        return selected;
    }

    public Expression getExpression() {
        return expression;
    }

    @Override
    public String toString() {
        return expression.render();
    }
}
