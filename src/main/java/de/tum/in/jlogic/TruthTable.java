/*
 * This file is part of JLogic.
 * Copyright (c) 2026 (See AUTHORS).
 *
 * JLogic is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, version 3.
 *
 * JLogic is distributed in the hope that it will be useful, but
 * WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU
 * General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with JLogic. If not, see <http://www.gnu.org/licenses/>.
 */
package de.tum.in.jlogic;

import java.util.AbstractList;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.BitSet;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * An immutable truth table: a canonically ordered variable list and one {@link Cell} per row.
 *
 * <p>Row {@code i} holds the output for the input vector whose binary value is {@code i}, with the
 * first variable as the most significant bit.</p>
 */
public final class TruthTable {
    // Row indices are ints
    static final int MAXIMUM_VARIABLES = 30;

    private final List<String> variables;
    private final Cell[] cells;

    private TruthTable(List<String> variables, Cell[] cells) {
        this.variables = variables;
        this.cells = cells;
    }

    /**
     * Creates a table from its raw data, e.g. when read by an external serializer.
     *
     * @param variables
     *     the distinct column names in ascending order
     * @param cells
     *     exactly {@code 2^n} cells, indexed by row
     */
    public static TruthTable of(List<String> variables, List<Cell> cells) {
        List<String> copy = List.copyOf(variables);
        Util.checkArgument(copy.size() <= MAXIMUM_VARIABLES, "Too many variables: %d", copy.size());
        for (int i = 1; i < copy.size(); i++) {
            Util.checkArgument(copy.get(i - 1).compareTo(copy.get(i)) < 0,
                "Variables must be distinct and sorted, got %s", copy);
        }
        Util.checkArgument(cells.size() == 1 << copy.size(), "Expected %d cells for %d variables, got %d",
            1 << copy.size(), copy.size(), cells.size());
        Cell[] array = cells.toArray(new Cell[0]);
        for (Cell cell : array) {
            Objects.requireNonNull(cell);
        }
        return new TruthTable(copy, array);
    }

    static TruthTable ofTrusted(List<String> variables, Cell[] cells) {
        assert cells.length == 1 << variables.size();
        return new TruthTable(variables, cells);
    }

    public List<String> variables() {
        return variables;
    }

    public int variableCount() {
        return variables.size();
    }

    public int size() {
        return cells.length;
    }

    public Cell cell(int index) {
        return cells[index];
    }

    public List<Cell> cells() {
        return Collections.unmodifiableList(Arrays.asList(cells));
    }

    public Row row(int index) {
        Objects.checkIndex(index, cells.length);
        return new Row(index, Assignment.ofIndex(variables, index), cells[index]);
    }

    /**
     * Returns all rows in increasing index order. Rows are created lazily.
     */
    public List<Row> rows() {
        return new AbstractList<>() {
            @Override
            public Row get(int index) {
                return row(index);
            }

            @Override
            public int size() {
                return cells.length;
            }
        };
    }

    /**
     * Returns the indices of all rows holding the given value.
     */
    public BitSet indicesOf(Cell cell) {
        BitSet indices = new BitSet(cells.length);
        for (int i = 0; i < cells.length; i++) {
            if (cells[i] == cell) {
                indices.set(i);
            }
        }
        return indices;
    }

    public boolean contains(Cell cell) {
        for (Cell value : cells) {
            if (value == cell) {
                return true;
            }
        }
        return false;
    }

    /**
     * Returns a copy of this table with every {@link Cell#UNSPECIFIED} entry replaced.
     */
    public TruthTable withUnspecifiedAs(Cell replacement) {
        Util.checkArgument(replacement != Cell.UNSPECIFIED, "Replacement must be specified");
        Cell[] replaced = cells.clone();
        for (int i = 0; i < replaced.length; i++) {
            if (replaced[i] == Cell.UNSPECIFIED) {
                replaced[i] = replacement;
            }
        }
        return new TruthTable(variables, replaced);
    }

    /**
     * Returns the rows on which the expression disagrees with a defined ({@link Cell#LOW} or
     * {@link Cell#HIGH}) entry of this table. Don't-care and unspecified rows are always satisfied.
     *
     * @throws UnboundVariableException
     *     if the expression references a variable which is not a column of this table
     */
    public List<Row> violations(Expression expression) {
        for (String variable : expression.variables()) {
            if (!variables.contains(variable)) {
                throw new UnboundVariableException(variable);
            }
        }

        List<Row> violations = new ArrayList<>();
        AssignmentIterator iterator = new AssignmentIterator(variables);
        int index = 0;
        while (iterator.hasNext()) {
            Assignment assignment = iterator.next();
            Cell cell = cells[index];
            if (cell.isDefined() && Cell.of(Evaluator.evaluate(expression, assignment)) != cell) {
                violations.add(new Row(index, assignment, cell));
            }
            index += 1;
        }
        return Collections.unmodifiableList(violations);
    }

    public boolean isSatisfiedBy(Expression expression) {
        return violations(expression).isEmpty();
    }

    @Override
    public boolean equals(Object object) {
        if (this == object) {
            return true;
        }
        if (!(object instanceof TruthTable)) {
            return false;
        }
        TruthTable that = (TruthTable) object;
        return variables.equals(that.variables) && Arrays.equals(cells, that.cells);
    }

    @Override
    public int hashCode() {
        return 31 * variables.hashCode() + Arrays.hashCode(cells);
    }

    /**
     * Renders the table as text, one row per line with the input bits followed by the output.
     */
    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder();
        builder.append(String.join(" ", variables)).append(variables.isEmpty() ? "" : " ").append("| Y\n");
        for (int index = 0; index < cells.length; index++) {
            for (int i = 0; i < variables.size(); i++) {
                String bit = (index & (1 << (variables.size() - 1 - i))) == 0 ? "0" : "1";
                builder.append(bit);
                builder.append(" ".repeat(variables.get(i).length()));
            }
            builder.append("| ").append(cells[index].symbol()).append('\n');
        }
        return builder.toString();
    }

    public static final class Row {
        private final int index;
        private final Assignment assignment;
        private final Cell cell;

        Row(int index, Assignment assignment, Cell cell) {
            this.index = index;
            this.assignment = assignment;
            this.cell = cell;
        }

        public int index() {
            return index;
        }

        public Assignment assignment() {
            return assignment;
        }

        public Cell cell() {
            return cell;
        }

        @Override
        public boolean equals(Object object) {
            if (this == object) {
                return true;
            }
            if (!(object instanceof Row)) {
                return false;
            }
            Row that = (Row) object;
            return index == that.index && cell == that.cell && assignment.equals(that.assignment);
        }

        @Override
        public int hashCode() {
            return Objects.hash(index, assignment, cell);
        }

        @Override
        public String toString() {
            return index + ": " + assignment + " -> " + cell.symbol();
        }
    }
}
