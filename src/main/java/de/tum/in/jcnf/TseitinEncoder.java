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

/**
 * Converts formulas into equisatisfiable sets of clauses by introducing one auxiliary variable per
 * connective (Tseitin transformation).
 *
 * <p>Auxiliary variables are drawn from the {@link IdPool} of the respective formula node. Each
 * connective node gets its variable before its children are visited, and clauses are emitted in
 * post-order from left to right. Thus, the output is fully determined by the formula and the state
 * of the pool. Encoders do not remember previous calls: a sub-formula occurring twice is encoded
 * twice.</p>
 *
 * <p>Implementations are not thread safe.</p>
 */
public interface TseitinEncoder {
    /**
     * Encodes the given formula.
     *
     * @param formula
     *     The formula to encode.
     * @return The literal representing {@code formula} and the clauses defining it.
     */
    Encoding encode(Formula formula);

    /**
     * Encodes the given formula and asserts it, i.e. adds the defining clauses followed by the unit
     * clause of the representing literal to {@code sink}.
     */
    void toCnf(Formula formula, ClauseSink sink);

    /**
     * Returns a set of clauses which is satisfiable iff {@code formula} is.
     */
    default Cnf toCnf(Formula formula) {
        Cnf cnf = new Cnf();
        toCnf(formula, cnf);
        return cnf;
    }

    String statistics();
}
