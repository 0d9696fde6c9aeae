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

import de.tum.in.jcnf.Formula.Kind;
import java.util.List;

/* Clauses defining the auxiliary variable of a connective. For a node with auxiliary variable f
 * and children represented by s_1, ..., s_n, the clauses are satisfied exactly if f equals the
 * connective applied to the s_i. */
final class TseitinDefinitions {
    private TseitinDefinitions() {}

    static int atomLiteral(Formula formula) {
        switch (formula.kind()) {
            case CONST:
                return ((Formula.Const) formula).literal();
            case VAR:
                return ((Formula.Var) formula).id();
            default:
                throw new IllegalArgumentException(formula.kind() + " is not atomic");
        }
    }

    /**
     * Adds the clauses emitted directly after the child represented by {@code child} has been
     * encoded.
     */
    static void defineChild(Kind kind, int fresh, int child, List<int[]> clauses) {
        switch (kind) {
            case AND:
                // f -> s_i
                clauses.add(new int[] {-fresh, child});
                break;
            case OR:
                // s_i -> f
                clauses.add(new int[] {fresh, -child});
                break;
            case NOT:
            case IMPLIES:
            case EQUALS:
            case NOT_EQUALS:
                break;
            default:
                throw new IllegalStateException("Unknown type " + kind);
        }
    }

    /**
     * Adds the clauses emitted after all children have been encoded.
     */
    static void define(Kind kind, int fresh, int[] children, List<int[]> clauses) {
        assert kind.isMultary() || children.length == kind.arity();

        switch (kind) {
            case NOT: {
                int sub = children[0];
                clauses.add(new int[] {fresh, sub});
                clauses.add(new int[] {-fresh, -sub});
                break;
            }
            case AND: {
                // (s_1 & ... & s_n) -> f, just f for n = 0
                int[] clause = new int[children.length + 1];
                clause[0] = fresh;
                for (int i = 0; i < children.length; i++) {
                    clause[i + 1] = -children[i];
                }
                clauses.add(clause);
                break;
            }
            case OR: {
                // f -> (s_1 | ... | s_n), just -f for n = 0
                int[] clause = new int[children.length + 1];
                clause[0] = -fresh;
                System.arraycopy(children, 0, clause, 1, children.length);
                clauses.add(clause);
                break;
            }
            case IMPLIES: {
                int lhs = children[0];
                int rhs = children[1];
                clauses.add(new int[] {fresh, lhs});
                clauses.add(new int[] {fresh, -rhs});
                clauses.add(new int[] {-fresh, -lhs, rhs});
                break;
            }
            case EQUALS: {
                int lhs = children[0];
                int rhs = children[1];
                clauses.add(new int[] {fresh, -lhs, -rhs});
                clauses.add(new int[] {fresh, lhs, rhs});
                clauses.add(new int[] {-fresh, -lhs, rhs});
                clauses.add(new int[] {-fresh, lhs, -rhs});
                break;
            }
            case NOT_EQUALS: {
                int lhs = children[0];
                int rhs = children[1];
                clauses.add(new int[] {fresh, -lhs, rhs});
                clauses.add(new int[] {fresh, lhs, -rhs});
                clauses.add(new int[] {-fresh, -lhs, -rhs});
                clauses.add(new int[] {-fresh, lhs, rhs});
                break;
            }
            default:
                throw new IllegalStateException("Unknown type " + kind);
        }
    }
}
