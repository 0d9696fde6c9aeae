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

import java.util.Collections;
import java.util.List;

/**
 * The result of encoding a formula: a literal representing the truth value of the formula together
 * with the clauses defining it.
 */
public final class Encoding {
    private final int literal;
    private final List<int[]> clauses;

    Encoding(int literal, List<int[]> clauses) {
        assert literal != 0;
        this.literal = literal;
        this.clauses = clauses;
    }

    /**
     * Returns the signed literal which, under the defining clauses, is true iff the encoded formula
     * is.
     */
    public int literal() {
        return literal;
    }

    /**
     * Returns an unmodifiable view of the defining clauses, in the order they were generated.
     */
    public List<int[]> clauses() {
        return Collections.unmodifiableList(clauses);
    }

    @Override
    public String toString() {
        return String.format("Encoding{literal=%d, clauses=%s}", literal, Cnf.format(clauses));
    }
}
