package org.dice.logic;

import org.dice.logic.config.EngineSettings;
import org.dice.logic.evaluation.Evaluator;
import org.dice.logic.minimization.Minimization;
import org.dice.logic.minimization.Minimizer;
import org.dice.logic.parsing.Lexer;
import org.dice.logic.parsing.RecursiveDescentParser;
import org.dice.logic.parsing.ast.Expression;
import org.dice.logic.truthtable.TruthTable;
import org.dice.logic.truthtable.TruthTableEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Facade over parsing, evaluation, truth tables and minimization, configured by
 * {@link EngineSettings}.
 */
public class LogicEngine {

    private static final Logger log = LoggerFactory.getLogger(LogicEngine.class);

    private final EngineSettings settings;
    private final TruthTableEngine truthTableEngine;
    private final Minimizer minimizer;

    public LogicEngine() {
        this(EngineSettings.load());
    }

    public LogicEngine(EngineSettings settings) {
        this.settings = settings;
        this.truthTableEngine = new TruthTableEngine(settings);
        this.minimizer = new Minimizer(truthTableEngine);
        log.debug("Created logic engine with {}", settings);
    }

    public EngineSettings getSettings() {
        return settings;
    }

    public Expression parse(String text) {
        return new RecursiveDescentParser(new Lexer(text)).parse();
    }

    public boolean evaluate(String text, Map<String, Boolean> assignment) {
        return Evaluator.evaluate(parse(text), assignment);
    }

    public boolean evaluate(Expression expression, Map<String, Boolean> assignment) {
        return Evaluator.evaluate(expression, assignment);
    }

    public TruthTable truthTable(String text) {
        return truthTableEngine.generate(parse(text));
    }

    public TruthTable truthTable(Expression expression) {
        return truthTableEngine.generate(expression);
    }

    public Expression minimize(Expression expression) {
        return minimizer.minimize(expression);
    }

    public Minimization minimize(TruthTable table) {
        return minimizer.minimize(table);
    }

    /**
     * Parses, minimizes and renders an expression. The result parses back to an equivalent
     * expression.
     */
    public String simplify(String text) {
        return minimize(parse(text)).render();
    }

    public boolean equivalent(String a, String b) {
        return truthTableEngine.equivalent(parse(a), parse(b));
    }
}
