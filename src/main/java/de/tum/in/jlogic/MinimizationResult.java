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
import java.util.Collections;
import java.util.List;

/**
 * The outcome of a {@link QuineMcCluskey} run: the prime implicants, the essential ones, and every
 * cover of minimal size found by the search.
 */
public final class MinimizationResult {
    private final NormalForm form;
    private final TruthTable table;
    private final List<Implicant> primeImplicants;
    private final List<Implicant> essentialImplicants;
    private final List<List<Implicant>> solutions;
    private final boolean exact;

    MinimizationResult(NormalForm form, TruthTable table, List<Implicant> primeImplicants,
        List<Implicant> essentialImplicants, List<List<Implicant>> solutions, boolean exact) {
        Util.checkArgument(!solutions.isEmpty(), "No solution");
        this.form = form;
        this.table = table;
        this.primeImplicants = List.copyOf(primeImplicants);
        this.essentialImplicants = List.copyOf(essentialImplicants);
        List<List<Implicant>> copy = new ArrayList<>(solutions.size());
        for (List<Implicant> solution : solutions) {
            copy.add(List.copyOf(solution));
        }
        this.solutions = Collections.unmodifiableList(copy);
        this.exact = exact;
    }

    public NormalForm form() {
        return form;
    }

    public TruthTable table() {
        return table;
    }

    /**
     * All prime implicants which cover at least one required row, in implicant order.
     */
    public List<Implicant> primeImplicants() {
        return primeImplicants;
    }

    public List<Implicant> essentialImplicants() {
        return essentialImplicants;
    }

    /**
     * Every optimal cover, each sorted in implicant order. The first one is the canonical result.
     */
    public List<List<Implicant>> solutions() {
        return solutions;
    }

    /**
     * Whether the covers are guaranteed to be minimal. False if the exact search was abandoned for the
     * greedy cover.
     */
    public boolean isExact() {
        return exact;
    }

    public Expression expression() {
        return render(solutions.get(0));
    }

    public List<Expression> expressions() {
        List<Expression> expressions = new ArrayList<>(solutions.size());
        for (List<Implicant> solution : solutions) {
            expressions.add(render(solution));
        }
        return Collections.unmodifiableList(expressions);
    }

    private Expression render(List<Implicant> solution) {
        boolean dnf = form == NormalForm.DNF;
        if (solution.isEmpty()) {
            return Expression.constant(!dnf);
        }
        List<Expression> terms = new ArrayList<>(solution.size());
        for (Implicant implicant : solution) {
            terms.add(dnf ? implicant.toProduct(table.variables()) : implicant.toSum(table.variables()));
        }
        return Expression.join(dnf ? Operator.OR : Operator.AND, terms);
    }

    @Override
    public String toString() {
        return form + " " + expression() + " (" + solutions.size() + " optimal, "
            + primeImplicants.size() + " prime implicants)";
    }
}
