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

import java.util.List;

final class RecursiveTseitinEncoder extends AbstractTseitinEncoder {
    RecursiveTseitinEncoder(EncoderConfiguration configuration) {
        super(configuration);
    }

    @Override
    protected int encode(Formula formula, List<int[]> clauses) {
        if (formula.isAtomic()) {
            return TseitinDefinitions.atomLiteral(formula);
        }

        int fresh = auxiliaryVariable(formula);
        List<Formula> children = formula.children();
        int[] literals = new int[children.size()];
        for (int i = 0; i < literals.length; i++) {
            literals[i] = encode(children.get(i), clauses);
            TseitinDefinitions.defineChild(formula.kind(), fresh, literals[i], clauses);
        }
        TseitinDefinitions.define(formula.kind(), fresh, literals, clauses);
        return fresh;
    }
}
