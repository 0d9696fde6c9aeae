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
import java.util.List;
import java.util.Random;

/**
 * Generates random formulas. Generation only depends on the random source, hence two factories
 * with pools in the same state receive identical formulas for equal seeds.
 */
final class FormulaGenerator {
    private static final int MAX_MULTARY_CHILDREN = 3;

    private final FormulaFactory factory;
    private final Random random;
    private final int variables;

    FormulaGenerator(FormulaFactory factory, long seed, int variables) {
        this.factory = factory;
        this.random = new Random(seed);
        this.variables = variables;
    }

    Formula atom() {
        if (random.nextInt(8) == 0) {
            return factory.constant(random.nextBoolean());
        }
        return factory.var(1 + random.nextInt(variables));
    }

    Formula formula(int depth) {
        if (depth <= 1 || random.nextInt(5) == 0) {
            return atom();
        }
        switch (random.nextInt(6)) {
            case 0:
                return factory.not(formula(depth - 1));
            case 1:
                return factory.and(children(depth - 1));
            case 2:
                return factory.or(children(depth - 1));
            case 3:
                return factory.implies(formula(depth - 1), formula(depth - 1));
            case 4:
                return factory.equivalence(formula(depth - 1), formula(depth - 1));
            default:
                return factory.xor(formula(depth - 1), formula(depth - 1));
        }
    }

    private Formula[] children(int depth) {
        int count = random.nextInt(MAX_MULTARY_CHILDREN + 1);
        List<Formula> children = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            children.add(formula(depth));
        }
        return children.toArray(new Formula[0]);
    }
}
