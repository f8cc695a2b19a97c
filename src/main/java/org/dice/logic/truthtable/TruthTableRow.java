package org.dice.logic.truthtable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One assignment of a truth table and the expression's value under it. The row index is the
 * assignment read as a binary number, first variable most significant.
 */
public final class TruthTableRow {

    private final int index;
    private final Map<String, Boolean> assignment;
    private final boolean output;

    TruthTableRow(int index, List<String> variables, boolean output) {
        this.index = index;
        this.output = output;
        this.assignment = Collections.unmodifiableMap(assignmentFor(index, variables));
    }

    static Map<String, Boolean> assignmentFor(int index, List<String> variables) {
        final int k = variables.size();
        Map<String, Boolean> values = new LinkedHashMap<String, Boolean>();
        for (int j = 0; j < k; j++) {
            values.put(variables.get(j), ((index >> (k - 1 - j)) & 1) == 1);
        }
        return values;
    }

    public int getIndex() {
        return index;
    }

    /**
     * @return the bindings in table variable order
     */
    public Map<String, Boolean> getAssignment() {
        return assignment;
    }

    public List<Boolean> getValues() {
        return new ArrayList<Boolean>(assignment.values());
    }

    public boolean getValue(String variable) {
        Boolean value = assignment.get(variable);
        if (value == null) {
            throw new IllegalArgumentException("Not a variable of this table: " + variable);
        }
        return value;
    }

    public boolean getOutput() {
        return output;
    }

    @Override
    public String toString() {
        return assignment + " -> " + output;
    }
}
