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

import de.tum.in.jcnf.Formula.Connective;
import de.tum.in.jcnf.Formula.Kind;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import javax.annotation.Nullable;

/**
 * Builds formulas over a fixed {@link IdPool}. All variables and constants created by a factory
 * draw their ids from its pool, and all formulas passed to a factory must have been created with
 * the same pool.
 */
public final class FormulaFactory {
    private final IdPool pool;

    public FormulaFactory(IdPool pool) {
        this.pool = Objects.requireNonNull(pool);
    }

    public IdPool pool() {
        return pool;
    }

    public Formula.Const constant(boolean value) {
        return new Formula.Const(pool, value);
    }

    /**
     * Creates the variable with the given id. If the id is larger than any id handed out by the
     * pool so far, the pool is {@link IdPool#advanceTo(int) advanced} so that it never hands out
     * {@code id} afterwards.
     *
     * @throws IllegalArgumentException
     *     if {@code id} is not positive.
     */
    public Formula.Var var(int id) {
        if (id <= 0) {
            throw new IllegalArgumentException("Variable ids must be positive, got " + id);
        }
        pool.advanceTo(id);
        return new Formula.Var(pool, id, null);
    }

    /**
     * Creates the variable associated with the given label, allocating a new id if the label is
     * not yet known to the pool.
     */
    public Formula.Var var(Object label) {
        return new Formula.Var(pool, pool.allocate(label), label);
    }

    public Formula not(Formula formula) {
        return new Connective(pool, Kind.NOT, List.of(formula));
    }

    /**
     * Creates the conjunction of exactly the given formulas. In particular, the empty conjunction
     * is {@code true}.
     */
    public Formula and(Formula... formulas) {
        return new Connective(pool, Kind.AND, Arrays.asList(formulas));
    }

    /**
     * Creates the disjunction of exactly the given formulas. In particular, the empty disjunction
     * is {@code false}.
     */
    public Formula or(Formula... formulas) {
        return new Connective(pool, Kind.OR, Arrays.asList(formulas));
    }

    /**
     * Creates the conjunction of {@code left} and {@code right}. If both are conjunctions, the
     * result contains the children of both. If only {@code left} is a conjunction, {@code right} is
     * added to its children. Neither argument is modified.
     */
    public Formula and(Formula left, Formula right) {
        return combine(Kind.AND, left, right);
    }

    /**
     * Creates the disjunction of {@code left} and {@code right}, flattening like
     * {@link #and(Formula, Formula)}.
     */
    public Formula or(Formula left, Formula right) {
        return combine(Kind.OR, left, right);
    }

    private Formula combine(Kind kind, Formula left, Formula right) {
        Objects.requireNonNull(left);
        Objects.requireNonNull(right);
        List<Formula> children;
        if (left.kind() == kind) {
            children = new ArrayList<>(left.children());
            if (right.kind() == kind) {
                children.addAll(right.children());
            } else {
                children.add(right);
            }
        } else {
            children = List.of(left, right);
        }
        return new Connective(pool, kind, children);
    }

    /**
     * Adds {@code formula} to the conjunction {@code conjunction} in place. If {@code formula} is a
     * conjunction itself, its children are added individually.
     *
     * <p>The node is modified, not copied: all formulas containing {@code conjunction} observe the
     * change.</p>
     *
     * @return {@code conjunction}
     * @throws FormulaException
     *     if {@code conjunction} is not a conjunction or {@code formula} is {@code null}. The node is
     *     left unchanged in this case.
     */
    public Formula andExtend(Formula conjunction, @Nullable Formula formula) {
        return extend(Kind.AND, conjunction, formula);
    }

    /**
     * Adds {@code formula} to the disjunction {@code disjunction} in place, analogous to
     * {@link #andExtend(Formula, Formula)}.
     */
    public Formula orExtend(Formula disjunction, @Nullable Formula formula) {
        return extend(Kind.OR, disjunction, formula);
    }

    private Formula extend(Kind kind, Formula target, @Nullable Formula formula) {
        if (target.kind() != kind) {
            throw new FormulaException(String.format("Expected %s node, got %s %s", kind, target.kind(), target));
        }
        if (formula == null) {
            throw new FormulaException("Cannot extend " + target + " with null");
        }
        if (target.pool() != pool || formula.pool() != pool) {
            throw new FormulaException("Cannot extend " + target + " with a formula of a different pool");
        }

        Connective connective = (Connective) target;
        if (formula.kind() == kind) {
            connective.appendAll(formula.children());
        } else {
            connective.append(formula);
        }
        return connective;
    }

    public Formula implies(Formula left, Formula right) {
        return new Connective(pool, Kind.IMPLIES, List.of(left, right));
    }

    /**
     * Creates the biconditional of {@code left} and {@code right}. Note that this builds a formula;
     * use {@link Formula#equals(Object)} to compare formulas.
     */
    public Formula equivalence(Formula left, Formula right) {
        return new Connective(pool, Kind.EQUALS, List.of(left, right));
    }

    /**
     * Creates the exclusive disjunction of {@code left} and {@code right}.
     */
    public Formula xor(Formula left, Formula right) {
        return new Connective(pool, Kind.NOT_EQUALS, List.of(left, right));
    }
}
