package org.dice.logic.truthtable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Rows of an expression's truth table in canonical order: variables sorted ascending, rows in
 * binary counting order with the first variable as the most significant bit.
 */
public final class TruthTable {

    private final List<String> variables;
    private final List<TruthTableRow> rows;

    TruthTable(List<String> variables, boolean[] outputs) {
        this.variables = Collections.unmodifiableList(new ArrayList<String>(variables));
        List<TruthTableRow> built = new ArrayList<TruthTableRow>(outputs.length);
        for (int i = 0; i < outputs.length; i++) {
            built.add(new TruthTableRow(i, this.variables, outputs[i]));
        }
        this.rows = Collections.unmodifiableList(built);
    }

    public List<String> getVariables() {
        return variables;
    }

    public int getVariableCount() {
        return variables.size();
    }

    public List<TruthTableRow> getRows() {
        return rows;
    }

    public int size() {
        return rows.size();
    }

    public TruthTableRow getRow(int index) {
        return rows.get(index);
    }

    public boolean getOutput(int index) {
        return rows.get(index).getOutput();
    }

    /**
     * @return indices of the rows whose output is true, ascending
     */
    public List<Integer> getMinterms() {
        return indicesWithOutput(true);
    }

    /**
     * @return indices of the rows whose output is false, ascending
     */
    public List<Integer> getMaxterms() {
        return indicesWithOutput(false);
    }

    public boolean isTautology() {
        return getMaxterms().isEmpty();
    }

    public boolean isContradiction() {
        return getMinterms().isEmpty();
    }

    private List<Integer> indicesWithOutput(boolean output) {
        List<Integer> indices = new ArrayList<Integer>();
        for (TruthTableRow row : rows) {
            if (row.getOutput() == output) {
                indices.add(row.getIndex());
            }
        }
        return indices;
    }

    @Override
    public String toString() {
        return "TruthTable" + variables + rows;
    }
}
