/*
 * This file is part of JCNF.
 * Copyright (c) 2023 Tobias Meggendorfer.
 *
 * JCNF is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, version 3.
 *
 * JCNF is distributed in the hope that it will be useful, but
 * WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU
 * General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with JCNF. If not, see <http://www.gnu.org/licenses/>.
 */
package de.tum.in.jcnf;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * A plain list of clauses. Clauses are stored as given, no sorting or deduplication takes place.
 */
public final class Cnf implements ClauseSink {
    private final List<int[]> clauses = new ArrayList<>();
    private int numberOfVariables = 0;

    public Cnf() {
        // empty
    }

    public Cnf(Iterable<int[]> clauses) {
        extend(clauses);
    }

    @Override
    public void append(int[] clause) {
        int maximalVariable = numberOfVariables;
        for (int literal : clause) {
            if (literal == 0) {
                throw new IllegalArgumentException("Clause " + Arrays.toString(clause) + " contains 0");
            }
            maximalVariable = Math.max(maximalVariable, Math.abs(literal));
        }
        numberOfVariables = maximalVariable;
        clauses.add(clause);
    }

    public List<int[]> clauses() {
        return Collections.unmodifiableList(clauses);
    }

    /**
     * Returns the largest variable id occurring in any clause.
     */
    public int numberOfVariables() {
        return numberOfVariables;
    }

    public int size() {
        return clauses.size();
    }

    static String format(List<int[]> clauses) {
        return clauses.stream().map(Arrays::toString).collect(Collectors.joining(", ", "[", "]"));
    }

    @Override
    public String toString() {
        return String.format("Cnf{variables=%d, clauses=%s}", numberOfVariables, format(clauses));
    }
}
