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

import java.util.ArrayList;
import java.util.List;

/**
 * Canonical disjunctive and conjunctive normal forms of truth tables.
 *
 * <p>Terms appear in row order, literals in column order, and both are joined left-nested.</p>
 */
public final class CanonicalForms {
    private CanonicalForms() {}

    /**
     * Returns the OR of the minterms of all {@link Cell#HIGH} rows, or the constant 0 if there are
     * none.
     */
    public static Expression cdnf(TruthTable table) {
        return disjunction(table, Cell.HIGH);
    }

    /**
     * Returns the OR of the minterms of all {@link Cell#DONT_CARE} rows, or the constant 0 if there
     * are none.
     */
    public static Expression dontCareCdnf(TruthTable table) {
        return disjunction(table, Cell.DONT_CARE);
    }

    /**
     * Returns the AND of the parenthesized maxterms of all {@link Cell#LOW} rows, or the constant 1 if
     * there are none.
     */
    public static Expression ccnf(TruthTable table) {
        List<Expression> maxterms = new ArrayList<>();
        for (int index = 0; index < table.size(); index++) {
            if (table.cell(index) == Cell.LOW) {
                Expression maxterm = term(table.variables(), index, false);
                maxterms.add(maxterm.kind() == Expression.Kind.CONSTANT ? maxterm : Expression.group(maxterm));
            }
        }
        return maxterms.isEmpty() ? Expression.constant(true) : Expression.join(Operator.AND, maxterms);
    }

    private static Expression disjunction(TruthTable table, Cell cell) {
        List<Expression> minterms = new ArrayList<>();
        for (int index = 0; index < table.size(); index++) {
            if (table.cell(index) == cell) {
                minterms.add(term(table.variables(), index, true));
            }
        }
        return minterms.isEmpty() ? Expression.constant(false) : Expression.join(Operator.OR, minterms);
    }

    // A minterm is true exactly on the row, a maxterm false exactly on the row.
    private static Expression term(List<String> variables, int index, boolean minterm) {
        int count = variables.size();
        if (count == 0) {
            return Expression.constant(minterm);
        }
        List<Expression> literals = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            boolean bit = (index & (1 << (count - 1 - i))) != 0;
            Expression variable = Expression.variable(variables.get(i));
            literals.add(bit == minterm ? variable : Expression.not(variable));
        }
        return Expression.join(minterm ? Operator.AND : Operator.OR, literals);
    }
}
