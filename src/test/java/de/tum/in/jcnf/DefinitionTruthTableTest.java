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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;

import de.tum.in.jcnf.Formula.Kind;
import java.util.function.IntPredicate;
import java.util.stream.Stream;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

/**
 * Checks the defining clauses of each connective against its truth table.
 */
public class DefinitionTruthTableTest {
    public static Stream<Arguments> connectives() {
        return Stream.of(
                Arguments.of(Kind.NOT, 1),
                Arguments.of(Kind.AND, 0),
                Arguments.of(Kind.AND, 1),
                Arguments.of(Kind.AND, 2),
                Arguments.of(Kind.AND, 3),
                Arguments.of(Kind.OR, 0),
                Arguments.of(Kind.OR, 1),
                Arguments.of(Kind.OR, 2),
                Arguments.of(Kind.OR, 3),
                Arguments.of(Kind.IMPLIES, 2),
                Arguments.of(Kind.EQUALS, 2),
                Arguments.of(Kind.NOT_EQUALS, 2));
    }

    private static Formula build(FormulaFactory factory, Kind kind, Formula[] children) {
        switch (kind) {
            case NOT:
                return factory.not(children[0]);
            case AND:
                return factory.and(children);
            case OR:
                return factory.or(children);
            case IMPLIES:
                return factory.implies(children[0], children[1]);
            case EQUALS:
                return factory.equivalence(children[0], children[1]);
            case NOT_EQUALS:
                return factory.xor(children[0], children[1]);
            default:
                throw new IllegalArgumentException("Unknown type " + kind);
        }
    }

    @ParameterizedTest(name = "{0}/{1}")
    @MethodSource("connectives")
    public void testDefinitionMatchesTruthTable(Kind kind, int arity) {
        for (boolean iterative : new boolean[] {false, true}) {
            FormulaFactory factory = new FormulaFactory(new IdPool());
            Formula[] children = new Formula[arity];
            for (int i = 0; i < arity; i++) {
                children[i] = factory.var(i + 1);
            }
            Formula formula = build(factory, kind, children);
            Encoding encoding = EncoderFactory.buildEncoder(iterative,
                    ImmutableEncoderConfiguration.builder().build()).encode(formula);
            int fresh = encoding.literal();
            assertThat(fresh, is(arity + 1));

            for (long mask = 0; mask < (1L << (arity + 2)); mask += 2) {
                IntPredicate assignment = Clauses.fromMask(mask);
                boolean expected = assignment.test(fresh) == formula.evaluate(assignment);
                assertThat(Clauses.satisfies(encoding.clauses(), assignment), is(expected));
            }
        }
    }

    @ParameterizedTest(name = "{0}/{1}")
    @MethodSource("connectives")
    public void testDefinitionWithConstantChildren(Kind kind, int arity) {
        for (int values = 0; values < (1 << arity); values++) {
            IdPool pool = new IdPool();
            FormulaFactory factory = new FormulaFactory(pool);
            Formula[] children = new Formula[arity];
            for (int i = 0; i < arity; i++) {
                children[i] = factory.constant((values & (1 << i)) != 0);
            }
            Formula formula = build(factory, kind, children);
            Encoding encoding = EncoderFactory.buildEncoder().encode(formula);
            int trueVariable = pool.trueVariable();

            // With the true atom fixed, exactly the correct value of the root satisfies the clauses
            for (boolean value : new boolean[] {false, true}) {
                int fresh = encoding.literal();
                IntPredicate assignment = variable -> variable == trueVariable || (variable == fresh && value);
                boolean expected = value == formula.evaluate(assignment);
                assertThat(Clauses.satisfies(encoding.clauses(), assignment), is(expected));
            }
        }
    }
}
