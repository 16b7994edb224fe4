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
import java.util.BitSet;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.annotation.Nullable;

/**
 * Two-level minimization of truth tables.
 *
 * <p>Prime implicants are computed by repeatedly merging implicants which differ in exactly one
 * fixed bit. Essential primes are always chosen; the remaining rows are covered exactly by
 * Petrick's method, keeping every cover with the fewest implicants and, among those, the fewest
 * literals. If the product expansion grows beyond
 * {@link LogicConfiguration#maximumCoverProducts()}, a greedy cover is used instead.</p>
 */
public final class QuineMcCluskey {
    private static final Logger logger = Logger.getLogger(QuineMcCluskey.class.getName());

    private static final Comparator<List<Implicant>> SOLUTION_ORDER = QuineMcCluskey::compareSolutions;

    private final int maximumVariableCount;
    private final int maximumCoverProducts;

    public QuineMcCluskey(LogicConfiguration configuration) {
        this.maximumVariableCount = configuration.maximumVariableCount();
        this.maximumCoverProducts = configuration.maximumCoverProducts();
    }

    public Expression minimizeDnf(TruthTable table) {
        return minimize(table, NormalForm.DNF).expression();
    }

    public Expression minimizeCnf(TruthTable table) {
        return minimize(table, NormalForm.CNF).expression();
    }

    /**
     * Minimizes the table into the given form.
     *
     * @throws IllegalArgumentException
     *     if the table contains {@link Cell#UNSPECIFIED} entries
     * @throws TooManyVariablesException
     *     if the table has more columns than configured
     */
    public MinimizationResult minimize(TruthTable table, NormalForm form) {
        Util.checkVariableCount(table.variableCount(), maximumVariableCount);
        Util.checkArgument(!table.contains(Cell.UNSPECIFIED),
            "Table contains unspecified cells, resolve them before minimizing");

        int variableCount = table.variableCount();
        BitSet required = table.indicesOf(form.target());
        if (required.isEmpty()) {
            logger.log(Level.FINE, "No {0} rows, {1} is constant", new Object[] {form.target(), form});
            return new MinimizationResult(form, table, List.of(), List.of(), List.of(List.of()), true);
        }

        Set<Implicant> seeds = new LinkedHashSet<>();
        for (int index = 0; index < table.size(); index++) {
            Cell cell = table.cell(index);
            if (cell == form.target() || cell == Cell.DONT_CARE) {
                seeds.add(Implicant.ofRow(variableCount, index));
            }
        }

        List<Implicant> primes = primeImplicants(seeds, variableCount);
        List<Implicant> candidates = new ArrayList<>();
        List<BitSet> coverage = new ArrayList<>();
        for (Implicant prime : primes) {
            if (prime.coveredRows().intersects(required)) {
                candidates.add(prime);
            }
        }
        Collections.sort(candidates);
        for (Implicant candidate : candidates) {
            BitSet rows = candidate.coveredRows();
            rows.and(required);
            coverage.add(rows);
        }
        logger.log(Level.FINE, "Found {0} prime implicants, {1} of which cover required rows",
            new Object[] {primes.size(), candidates.size()});

        // Essential implicants are the only candidate covering some required row
        BitSet essentialPositions = new BitSet(candidates.size());
        for (int row = required.nextSetBit(0); row >= 0; row = required.nextSetBit(row + 1)) {
            int coveringPosition = -1;
            boolean unique = true;
            for (int position = 0; position < candidates.size(); position++) {
                if (coverage.get(position).get(row)) {
                    if (coveringPosition >= 0) {
                        unique = false;
                        break;
                    }
                    coveringPosition = position;
                }
            }
            Util.checkState(coveringPosition >= 0, "Row %d not covered by any prime implicant", row);
            if (unique) {
                essentialPositions.set(coveringPosition);
            }
        }

        List<Implicant> essentials = new ArrayList<>();
        BitSet remainingRows = BitSets.copyOf(required);
        for (int position = essentialPositions.nextSetBit(0); position >= 0;
             position = essentialPositions.nextSetBit(position + 1)) {
            essentials.add(candidates.get(position));
            remainingRows.andNot(coverage.get(position));
        }
        logger.log(Level.FINE, "{0} essential implicants, {1} rows left to cover",
            new Object[] {essentials.size(), remainingRows.cardinality()});

        if (remainingRows.isEmpty()) {
            return new MinimizationResult(form, table, candidates, essentials, List.of(essentials), true);
        }

        List<Implicant> remainingCandidates = new ArrayList<>();
        List<BitSet> remainingCoverage = new ArrayList<>();
        for (int position = 0; position < candidates.size(); position++) {
            if (!essentialPositions.get(position) && coverage.get(position).intersects(remainingRows)) {
                remainingCandidates.add(candidates.get(position));
                remainingCoverage.add(coverage.get(position));
            }
        }

        List<BitSet> covers = petrick(remainingRows, remainingCandidates, remainingCoverage);
        List<List<Implicant>> solutions = new ArrayList<>();
        boolean exact = covers != null;
        if (covers == null) {
            logger.log(Level.WARNING, "Exact cover search exceeded {0} products, falling back to greedy cover",
                maximumCoverProducts);
            covers = List.of(greedyCover(remainingRows, remainingCoverage));
        }

        for (BitSet cover : covers) {
            List<Implicant> solution = new ArrayList<>(essentials);
            for (int position = cover.nextSetBit(0); position >= 0; position = cover.nextSetBit(position + 1)) {
                solution.add(remainingCandidates.get(position));
            }
            Collections.sort(solution);
            solutions.add(solution);
        }
        solutions.sort(SOLUTION_ORDER);
        logger.log(Level.FINE, "Found {0} optimal covers", solutions.size());
        return new MinimizationResult(form, table, candidates, essentials, solutions, exact);
    }

    private static List<Implicant> primeImplicants(Set<Implicant> seeds, int variableCount) {
        List<Implicant> primes = new ArrayList<>();
        Set<Implicant> current = seeds;
        int pass = 0;
        while (!current.isEmpty()) {
            Set<Implicant> next = new LinkedHashSet<>();
            Set<Implicant> merged = new HashSet<>();
            for (Implicant implicant : current) {
                for (int i = 0; i < variableCount; i++) {
                    int bit = 1 << i;
                    if ((implicant.mask() & bit) != 0 || (implicant.value() & bit) != 0) {
                        continue;
                    }
                    Implicant partner = new Implicant(variableCount, implicant.value() | bit, implicant.mask());
                    if (current.contains(partner)) {
                        next.add(implicant.eliminate(bit));
                        merged.add(implicant);
                        merged.add(partner);
                    }
                }
            }
            for (Implicant implicant : current) {
                if (!merged.contains(implicant)) {
                    primes.add(implicant);
                }
            }
            logger.log(Level.FINER, "Merge pass {0}: {1} implicants, {2} merged",
                new Object[] {pass, current.size(), next.size()});
            current = next;
            pass += 1;
        }
        return primes;
    }

    /**
     * Expands the product of sums "for every row, one of the implicants covering it" into a sum of
     * products and returns the cheapest products, or {@code null} if the expansion gets too large.
     */
    @Nullable
    private List<BitSet> petrick(BitSet rows, List<Implicant> implicants, List<BitSet> coverage) {
        List<BitSet> products = List.of(new BitSet());
        for (int row = rows.nextSetBit(0); row >= 0; row = rows.nextSetBit(row + 1)) {
            BitSet clause = new BitSet(coverage.size());
            for (int position = 0; position < coverage.size(); position++) {
                if (coverage.get(position).get(row)) {
                    clause.set(position);
                }
            }

            Set<BitSet> expanded = new LinkedHashSet<>();
            for (BitSet product : products) {
                if (product.intersects(clause)) {
                    expanded.add(product);
                    continue;
                }
                for (int position = clause.nextSetBit(0); position >= 0; position = clause.nextSetBit(position + 1)) {
                    BitSet extended = BitSets.copyOf(product);
                    extended.set(position);
                    expanded.add(extended);
                }
                if (expanded.size() > maximumCoverProducts) {
                    return null;
                }
            }
            products = absorb(expanded);
        }
        logger.log(Level.FINER, "Cover search yielded {0} irredundant covers", products.size());
        return cheapest(products, implicants);
    }

    // Removes every product which is a superset of another one
    private static List<BitSet> absorb(Set<BitSet> products) {
        List<BitSet> sorted = new ArrayList<>(products);
        sorted.sort(Comparator.comparingInt(BitSet::cardinality).thenComparing(BitSets.LEXICOGRAPHIC));
        List<BitSet> minimal = new ArrayList<>();
        for (BitSet product : sorted) {
            boolean absorbed = false;
            for (BitSet kept : minimal) {
                if (BitSets.isSubset(kept, product)) {
                    absorbed = true;
                    break;
                }
            }
            if (!absorbed) {
                minimal.add(product);
            }
        }
        return minimal;
    }

    // Fewest implicants first, then fewest literals; all ties are kept
    private static List<BitSet> cheapest(List<BitSet> products, List<Implicant> implicants) {
        int fewestImplicants = Integer.MAX_VALUE;
        int fewestLiterals = Integer.MAX_VALUE;
        List<BitSet> cheapest = new ArrayList<>();
        for (BitSet product : products) {
            int size = product.cardinality();
            int literals = 0;
            for (int position = product.nextSetBit(0); position >= 0; position = product.nextSetBit(position + 1)) {
                literals += implicants.get(position).literalCount();
            }
            if (size < fewestImplicants || (size == fewestImplicants && literals < fewestLiterals)) {
                fewestImplicants = size;
                fewestLiterals = literals;
                cheapest.clear();
            }
            if (size == fewestImplicants && literals == fewestLiterals) {
                cheapest.add(product);
            }
        }
        return cheapest;
    }

    // Picks the implicant covering most uncovered rows until everything is covered
    private static BitSet greedyCover(BitSet rows, List<BitSet> coverage) {
        BitSet uncovered = BitSets.copyOf(rows);
        BitSet cover = new BitSet(coverage.size());
        while (!uncovered.isEmpty()) {
            int best = -1;
            int bestCount = 0;
            for (int position = 0; position < coverage.size(); position++) {
                BitSet covered = BitSets.copyOf(coverage.get(position));
                covered.and(uncovered);
                if (covered.cardinality() > bestCount) {
                    best = position;
                    bestCount = covered.cardinality();
                }
            }
            Util.checkState(best >= 0);
            cover.set(best);
            uncovered.andNot(coverage.get(best));
        }
        return cover;
    }

    private static int compareSolutions(List<Implicant> first, List<Implicant> second) {
        int size = Math.min(first.size(), second.size());
        for (int i = 0; i < size; i++) {
            int result = first.get(i).compareTo(second.get(i));
            if (result != 0) {
                return result;
            }
        }
        return Integer.compare(first.size(), second.size());
    }
}
