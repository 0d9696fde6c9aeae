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
import java.util.BitSet;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.IntPredicate;
import java.util.stream.Collectors;
import javax.annotation.Nullable;

/**
 * A propositional formula over integer variables. A formula is either an atom, i.e. a constant
 * ({@link Const}) or a variable ({@link Var}), or a {@link Connective} applied to sub-formulas. The
 * {@link Kind} of a formula determines its connective and arity.
 *
 * <p>Formulas are created through a {@link FormulaFactory} and remember the {@link IdPool} they
 * were built with. All nodes are immutable, except for conjunctions and disjunctions, which can be
 * grown in place by {@link FormulaFactory#andExtend(Formula, Formula)} and
 * {@link FormulaFactory#orExtend(Formula, Formula)}.</p>
 *
 * <p>{@link #equals(Object)} and {@link #hashCode()} compare formulas structurally, independent of
 * the owning pool.</p>
 */
public abstract class Formula {
    /**
     * The different types of formulas.
     */
    public enum Kind {
        CONST("", 0),
        VAR("", 0),
        NOT("~", 1),
        AND("&", -1),
        OR("|", -1),
        IMPLIES("->", 2),
        EQUALS("<->", 2),
        NOT_EQUALS("^", 2);

        private final String symbol;
        private final int arity;

        Kind(String symbol, int arity) {
            this.symbol = symbol;
            this.arity = arity;
        }

        public boolean isAtomic() {
            return this == CONST || this == VAR;
        }

        /**
         * Returns whether formulas of this kind take an arbitrary number of children.
         */
        public boolean isMultary() {
            return arity < 0;
        }

        /**
         * Returns the number of children of this kind, or -1 if it is {@link #isMultary() multary}.
         */
        public int arity() {
            return arity;
        }

        public String symbol() {
            return symbol;
        }
    }

    private final IdPool pool;

    private Formula(IdPool pool) {
        this.pool = Objects.requireNonNull(pool);
    }

    public abstract Kind kind();

    public final IdPool pool() {
        return pool;
    }

    public final boolean isAtomic() {
        return kind().isAtomic();
    }

    /**
     * Returns an unmodifiable view of the direct sub-formulas. The view is empty for atoms.
     */
    public List<Formula> children() {
        return List.of();
    }

    /**
     * Evaluates this formula.
     *
     * @param assignment
     *     Assigns a truth value to each variable id.
     * @return The truth value of the formula under the given assignment.
     */
    public abstract boolean evaluate(IntPredicate assignment);

    /**
     * Returns the ids of all variables occurring in this formula. Constants are not included.
     */
    public BitSet variables() {
        BitSet set = new BitSet();
        gatherVariables(set);
        return set;
    }

    abstract void gatherVariables(BitSet set);

    public abstract int depth();

    private static String parenthesize(Formula formula) {
        return formula.isAtomic() ? formula.toString() : "(" + formula + ")";
    }

    public static final class Const extends Formula {
        private final boolean value;
        private final int literal;

        Const(IdPool pool, boolean value) {
            super(pool);
            this.value = value;
            int trueVariable = pool.trueVariable();
            this.literal = value ? trueVariable : -trueVariable;
        }

        @Override
        public Kind kind() {
            return Kind.CONST;
        }

        public boolean value() {
            return value;
        }

        /**
         * Returns the signed literal of the pool's true atom representing this constant.
         */
        public int literal() {
            return literal;
        }

        @Override
        public boolean evaluate(IntPredicate assignment) {
            return value;
        }

        @Override
        void gatherVariables(BitSet set) {
            // No variables in this leaf
        }

        @Override
        public int depth() {
            return 1;
        }

        @Override
        public boolean equals(Object object) {
            if (this == object) {
                return true;
            }
            if (!(object instanceof Const)) {
                return false;
            }
            Const that = (Const) object;
            return value == that.value;
        }

        @Override
        public int hashCode() {
            return Boolean.hashCode(value);
        }

        @Override
        public String toString() {
            return value ? "True" : "False";
        }
    }

    public static final class Var extends Formula {
        private final int id;
        @Nullable
        private final Object label;

        Var(IdPool pool, int id, @Nullable Object label) {
            super(pool);
            assert id > 0;
            this.id = id;
            this.label = label;
        }

        @Override
        public Kind kind() {
            return Kind.VAR;
        }

        public int id() {
            return id;
        }

        /**
         * Returns the label this variable was created from, or {@code null} if it was created from a
         * numeric id.
         */
        @Nullable
        public Object label() {
            return label;
        }

        @Override
        public boolean evaluate(IntPredicate assignment) {
            return assignment.test(id);
        }

        @Override
        void gatherVariables(BitSet set) {
            set.set(id);
        }

        @Override
        public int depth() {
            return 1;
        }

        @Override
        public boolean equals(Object object) {
            if (this == object) {
                return true;
            }
            if (!(object instanceof Var)) {
                return false;
            }
            Var that = (Var) object;
            return id == that.id;
        }

        @Override
        public int hashCode() {
            return Integer.hashCode(id);
        }

        @Override
        public String toString() {
            return label == null ? "x" + id : "x_" + label;
        }
    }

    /**
     * A connective applied to a list of children. The number of children is fixed by the
     * {@link Kind}, except for conjunctions and disjunctions.
     */
    public static final class Connective extends Formula {
        private final Kind kind;
        private final List<Formula> children;

        Connective(IdPool pool, Kind kind, List<Formula> children) {
            super(pool);
            Util.checkArgument(!kind.isAtomic(), "%s is not a connective", kind);
            Util.checkArgument(kind.isMultary() || children.size() == kind.arity(),
                    "%s expects %d children, got %d", kind, kind.arity(), children.size());
            for (Formula child : children) {
                Objects.requireNonNull(child);
                Util.checkArgument(child.pool() == pool, "Child %s belongs to a different pool", child);
            }
            this.kind = kind;
            this.children = kind.isMultary() ? new ArrayList<>(children) : List.copyOf(children);
        }

        @Override
        public Kind kind() {
            return kind;
        }

        @Override
        public List<Formula> children() {
            return Collections.unmodifiableList(children);
        }

        public Formula child(int index) {
            return children.get(index);
        }

        void appendAll(List<Formula> formulas) {
            assert kind.isMultary();
            children.addAll(formulas);
        }

        void append(Formula formula) {
            assert kind.isMultary();
            children.add(formula);
        }

        @Override
        public boolean evaluate(IntPredicate assignment) {
            switch (kind) {
                case NOT:
                    return !children.get(0).evaluate(assignment);
                case AND:
                    for (Formula child : children) {
                        if (!child.evaluate(assignment)) {
                            return false;
                        }
                    }
                    return true;
                case OR:
                    for (Formula child : children) {
                        if (child.evaluate(assignment)) {
                            return true;
                        }
                    }
                    return false;
                case IMPLIES:
                    return !children.get(0).evaluate(assignment) || children.get(1).evaluate(assignment);
                case EQUALS:
                    return children.get(0).evaluate(assignment) == children.get(1).evaluate(assignment);
                case NOT_EQUALS:
                    return children.get(0).evaluate(assignment) != children.get(1).evaluate(assignment);
                default:
                    throw new IllegalStateException("Unknown type " + kind);
            }
        }

        @Override
        void gatherVariables(BitSet set) {
            for (Formula child : children) {
                child.gatherVariables(set);
            }
        }

        @Override
        public int depth() {
            int depth = 0;
            for (Formula child : children) {
                depth = Math.max(depth, child.depth());
            }
            return depth + 1;
        }

        @Override
        public boolean equals(Object object) {
            if (this == object) {
                return true;
            }
            if (!(object instanceof Connective)) {
                return false;
            }
            Connective that = (Connective) object;
            return kind == that.kind && children.equals(that.children);
        }

        @Override
        public int hashCode() {
            return Objects.hash(kind, children);
        }

        @Override
        public String toString() {
            if (kind == Kind.NOT) {
                return kind.symbol() + parenthesize(children.get(0));
            }
            if (children.isEmpty()) {
                return "(" + kind.symbol() + ")";
            }
            return children.stream()
                    .map(Formula::parenthesize)
                    .collect(Collectors.joining(" " + kind.symbol() + " "));
        }
    }
}
