package org.dice.logic.minimization;

import org.dice.logic.parsing.ast.Expression;
import org.dice.logic.parsing.ast.Operator;
import org.dice.logic.parsing.ast.operands.Constant;
import org.dice.logic.parsing.ast.operands.Variable;
import org.dice.logic.parsing.ast.operators.BinaryOperator;
import org.dice.logic.parsing.ast.operators.Not;
import org.dice.logic.truthtable.TruthTable;
import org.dice.logic.truthtable.TruthTableEngine;
import org.dice.logic.util.DefaultHashTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Reduces an expression to a small sum of products with the Quine-McCluskey method, using the
 * expression's truth table as ground truth.
 *
 * Essential prime implicants are always chosen. Any minterms they leave uncovered are covered
 * greedily: the prime covering the most uncovered minterms wins, ties go to the prime with fewer
 * literals and then to the one whose lowest uncovered minterm is smallest. The greedy step does
 * not guarantee a globally minimal cover but is deterministic.
 */
public class Minimizer {

    private static final Logger log = LoggerFactory.getLogger(Minimizer.class);

    private static final Comparator<Implicant> PRIME_ORDER = new Comparator<Implicant>() {
        @Override
        public int compare(Implicant a, Implicant b) {
            if (a.getLiteralCount() != b.getLiteralCount()) {
                return Integer.compare(a.getLiteralCount(), b.getLiteralCount());
            }
            if (!a.getMinterms().first().equals(b.getMinterms().first())) {
                return a.getMinterms().first().compareTo(b.getMinterms().first());
            }
            if (a.getMask() != b.getMask()) {
                return Integer.compare(a.getMask(), b.getMask());
            }
            return Integer.compare(a.getValue(), b.getValue());
        }
    };

    private final TruthTableEngine truthTableEngine;

    public Minimizer() {
        this(new TruthTableEngine());
    }

    public Minimizer(TruthTableEngine truthTableEngine) {
        this.truthTableEngine = truthTableEngine;
    }

    /**
     * @return a sum of products equivalent to {@code expression} over all of its variables
     */
    public Expression minimize(Expression expression) {
        return minimize(truthTableEngine.generate(expression)).getExpression();
    }

    public Minimization minimize(TruthTable table) {
        return minimize(table, Collections.<Integer>emptySet());
    }

    /**
     * @param dontCares row indices whose output may be chosen freely; they take precedence over
     *                  the table's recorded output for those rows
     */
    public Minimization minimize(TruthTable table, Collection<Integer> dontCares) {
        final List<String> variables = table.getVariables();
        final int width = variables.size();

        Set<Integer> free = new TreeSet<Integer>(dontCares);
        for (Integer index : free) {
            if (index == null || index < 0 || index >= table.size()) {
                throw new IllegalArgumentException("Don't-care index out of range: " + index);
            }
        }
        List<Integer> minterms = new ArrayList<Integer>(table.getMinterms());
        minterms.removeAll(free);

        if (minterms.isEmpty()) {
            return constant(variables, minterms, false);
        }
        if (minterms.size() + free.size() == table.size()) {
            return constant(variables, minterms, true);
        }

        TreeSet<Integer> terms = new TreeSet<Integer>(minterms);
        terms.addAll(free);
        Set<Integer> care = new HashSet<Integer>(minterms);
        List<Implicant> primes = primeImplicants(terms, width, care);
        DefaultHashTable<Integer, List<Implicant>> coverers = coverers(primes, care);
        List<Implicant> essentials = essentialPrimeImplicants(minterms, coverers);
        List<Implicant> selected = selectCover(primes, essentials, minterms, coverers);

        List<Expression> products = new ArrayList<Expression>(selected.size());
        for (Implicant implicant : selected) {
            products.add(implicant.toExpression(variables));
        }
        Expression result = BinaryOperator.join(Operator.OR, products);

        log.debug("Minimized {} minterms over {}: {} prime implicants, {} essential, {} selected",
                minterms.size(), variables, primes.size(), essentials.size(), selected.size());
        return new Minimization(new ArrayList<String>(variables), minterms, primes, essentials, selected, result);
    }

    /**
     * @return the OR of one full product per true row, or False when no row is true
     */
    public static Expression canonicalSumOfProducts(TruthTable table) {
        List<Expression> products = new ArrayList<Expression>();
        for (Integer minterm : table.getMinterms()) {
            products.add(Implicant.ofMinterm(minterm, table.getVariableCount()).toExpression(table.getVariables()));
        }
        return products.isEmpty() ? Constant.FALSE : BinaryOperator.join(Operator.OR, products);
    }

    /**
     * @return the AND of one full sum per false row, or True when no row is false
     */
    public static Expression canonicalProductOfSums(TruthTable table) {
        final List<String> variables = table.getVariables();
        final int width = variables.size();
        List<Expression> sums = new ArrayList<Expression>();
        for (Integer maxterm : table.getMaxterms()) {
            if (width == 0) {
                // no variables: the only row is false
                sums.add(Constant.FALSE);
                continue;
            }
            List<Expression> literals = new ArrayList<Expression>(width);
            for (int position = 0; position < width; position++) {
                boolean bit = ((maxterm >> (width - 1 - position)) & 1) == 1;
                Expression literal = new Variable(variables.get(position));
                literals.add(bit ? new Not(literal) : literal);
            }
            sums.add(BinaryOperator.join(Operator.OR, literals));
        }
        return sums.isEmpty() ? Constant.TRUE : BinaryOperator.join(Operator.AND, sums);
    }

    /**
     * Merges implicants round by round. Each implicant looks up its neighbours one fixed bit
     * higher by key instead of comparing against a whole group.
     */
    List<Implicant> primeImplicants(Collection<Integer> terms, int width, Set<Integer> care) {
        List<Implicant> current = new ArrayList<Implicant>();
        for (Integer term : terms) {
            current.add(Implicant.ofMinterm(term, width));
        }

        List<Implicant> primes = new ArrayList<Implicant>();
        while (!current.isEmpty()) {
            Map<Long, Implicant> byKey = new HashMap<Long, Implicant>();
            for (Implicant implicant : current) {
                byKey.put(implicant.key(), implicant);
            }

            Set<Implicant> merged = new HashSet<Implicant>();
            Map<Implicant, Implicant> next = new LinkedHashMap<Implicant, Implicant>();
            for (Implicant lower : current) {
                for (int position = 0; position < width; position++) {
                    int bit = 1 << position;
                    if ((lower.getMask() & bit) != 0 || (lower.getValue() & bit) != 0) {
                        continue;
                    }
                    Implicant upper = byKey.get(Implicant.key(lower.getValue() | bit, lower.getMask()));
                    if (upper == null) {
                        continue;
                    }
                    Implicant combined = lower.merge(upper);
                    if (!next.containsKey(combined)) {
                        next.put(combined, combined);
                    }
                    merged.add(lower);
                    merged.add(upper);
                }
            }

            for (Implicant implicant : current) {
                if (!merged.contains(implicant) && firstCovered(implicant, care) != Integer.MAX_VALUE) {
                    primes.add(implicant);
                }
            }
            current = new ArrayList<Implicant>(next.values());
        }

        Collections.sort(primes, PRIME_ORDER);
        return primes;
    }

    /**
     * @return for every care minterm, the primes covering it in prime order
     */
    DefaultHashTable<Integer, List<Implicant>> coverers(List<Implicant> primes, Set<Integer> care) {
        DefaultHashTable<Integer, List<Implicant>> coverers = new DefaultHashTable<Integer, List<Implicant>>(ArrayList::new);
        for (Implicant prime : primes) {
            for (Integer minterm : prime.getMinterms()) {
                if (care.contains(minterm)) {
                    coverers.get(minterm).add(prime);
                }
            }
        }
        return coverers;
    }

    List<Implicant> essentialPrimeImplicants(List<Integer> minterms, DefaultHashTable<Integer, List<Implicant>> coverers) {
        Set<Implicant> essentials = new LinkedHashSet<Implicant>();
        for (Integer minterm : minterms) {
            List<Implicant> covering = coverers.get(minterm);
            if (covering.size() == 1) {
                essentials.add(covering.get(0));
            }
        }
        return new ArrayList<Implicant>(essentials);
    }

    List<Implicant> selectCover(List<Implicant> primes, List<Implicant> essentials, List<Integer> minterms,
                                DefaultHashTable<Integer, List<Implicant>> coverers) {
        Map<Implicant, Integer> remaining = new HashMap<Implicant, Integer>();
        for (Integer minterm : minterms) {
            for (Implicant prime : coverers.get(minterm)) {
                Integer count = remaining.get(prime);
                remaining.put(prime, count == null ? 1 : count + 1);
            }
        }

        Set<Implicant> selected = new LinkedHashSet<Implicant>();
        TreeSet<Integer> uncovered = new TreeSet<Integer>(minterms);
        for (Implicant essential : essentials) {
            select(essential, selected, uncovered, remaining, coverers);
        }

        while (!uncovered.isEmpty()) {
            Implicant best = null;
            int bestCount = 0;
            for (Implicant prime : primes) {
                Integer count = remaining.get(prime);
                if (count == null || count == 0 || selected.contains(prime)) {
                    continue;
                }
                if (best == null || count > bestCount
                        || (count == bestCount && prime.getLiteralCount() < best.getLiteralCount())
                        || (count == bestCount && prime.getLiteralCount() == best.getLiteralCount()
                            && firstCovered(prime, uncovered) < firstCovered(best, uncovered))) {
                    best = prime;
                    bestCount = count;
                }
            }
            if (best == null) {
                throw new IllegalStateException("Prime implicants do not cover minterms " + uncovered);
            }
            select(best, selected, uncovered, remaining, coverers);
        }

        final Map<Implicant, Integer> lowest = new HashMap<Implicant, Integer>();
        Set<Integer> care = new HashSet<Integer>(minterms);
        for (Implicant implicant : selected) {
            lowest.put(implicant, firstCovered(implicant, care));
        }
        List<Implicant> ordered = new ArrayList<Implicant>(selected);
        Collections.sort(ordered, new Comparator<Implicant>() {
            @Override
            public int compare(Implicant a, Implicant b) {
                int order = lowest.get(a).compareTo(lowest.get(b));
                return order != 0 ? order : PRIME_ORDER.compare(a, b);
            }
        });
        return ordered;
    }

    private static void select(Implicant prime, Set<Implicant> selected, Set<Integer> uncovered,
                               Map<Implicant, Integer> remaining, DefaultHashTable<Integer, List<Implicant>> coverers) {
        selected.add(prime);
        for (Integer minterm : prime.getMinterms()) {
            if (uncovered.remove(minterm)) {
                for (Implicant coverer : coverers.get(minterm)) {
                    remaining.put(coverer, remaining.get(coverer) - 1);
                }
            }
        }
    }

    private static Minimization constant(List<String> variables, List<Integer> minterms, boolean value) {
        log.debug("Truth table over {} is constant {}", variables, value);
        List<Implicant> none = Collections.emptyList();
        return new Minimization(new ArrayList<String>(variables), minterms, none, none, none, Constant.of(value));
    }

    /**
     * @return the lowest of the implicant's rows that is in {@code rows}, or Integer.MAX_VALUE
     */
    private static int firstCovered(Implicant implicant, Set<Integer> rows) {
        for (Integer minterm : implicant.getMinterms()) {
            if (rows.contains(minterm)) {
                return minterm;
            }
        }
        return Integer.MAX_VALUE;
    }
}
