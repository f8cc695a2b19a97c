package org.dice.logic.truthtable;

import org.dice.logic.config.EngineSettings;
import org.dice.logic.evaluation.Evaluator;
import org.dice.logic.evaluation.UnboundVariableException;
import org.dice.logic.parsing.ast.Expression;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.stream.IntStream;

/**
 * Enumerates every assignment of an expression's variables and records the evaluator's output.
 * Cost is exponential in the variable count, which is bounded by
 * {@link EngineSettings#getMaxVariables()}.
 */
public class TruthTableEngine {

    private static final Logger log = LoggerFactory.getLogger(TruthTableEngine.class);

    private final int maxVariables;
    private final boolean parallel;

    public TruthTableEngine() {
        this(EngineSettings.defaults());
    }

    public TruthTableEngine(EngineSettings settings) {
        this.maxVariables = settings.getMaxVariables();
        this.parallel = settings.isParallel();
    }

    public TruthTable generate(Expression expression) {
        return generate(expression, expression.getVariables());
    }

    /**
     * Enumerates over a caller-chosen variable set, which must include every variable of the
     * expression. Extra names become columns the output does not depend on.
     *
     * @throws UnboundVariableException  if {@code variables} lacks one of the expression's variables
     * @throws TooManyVariablesException if the set is larger than the configured ceiling
     */
    public TruthTable generate(final Expression expression, Collection<String> variables) {
        SortedSet<String> sorted = new TreeSet<String>(variables);
        for (String name : expression.getVariables()) {
            if (!sorted.contains(name)) {
                throw new UnboundVariableException(name);
            }
        }
        if (sorted.size() > maxVariables) {
            throw new TooManyVariablesException(sorted.size(), maxVariables);
        }

        final List<String> order = new ArrayList<String>(sorted);
        final int rowCount = 1 << order.size();
        final boolean[] outputs = new boolean[rowCount];

        IntStream indices = IntStream.range(0, rowCount);
        if (parallel) {
            indices = indices.parallel();
        }
        // each row writes only its own slot
        indices.forEach(i -> outputs[i] = Evaluator.evaluate(expression, TruthTableRow.assignmentFor(i, order)));

        log.debug("Generated {} rows over variables {} for {}", rowCount, order, expression);
        return new TruthTable(order, outputs);
    }

    /**
     * @return whether both expressions agree on every assignment of their combined variables
     */
    public boolean equivalent(Expression a, Expression b) {
        SortedSet<String> all = new TreeSet<String>(a.getVariables());
        all.addAll(b.getVariables());
        if (all.size() > maxVariables) {
            throw new TooManyVariablesException(all.size(), maxVariables);
        }
        List<String> order = new ArrayList<String>(all);
        for (int i = 0; i < (1 << order.size()); i++) {
            Map<String, Boolean> assignment = TruthTableRow.assignmentFor(i, order);
            if (Evaluator.evaluate(a, assignment) != Evaluator.evaluate(b, assignment)) {
                return false;
            }
        }
        return true;
    }
}
