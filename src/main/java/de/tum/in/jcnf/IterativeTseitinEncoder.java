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
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/* Same traversal as the recursive encoder, with the call stack replaced by a stack of frames. A
 * frame is pushed when a connective is entered, which is also when its auxiliary variable is
 * allocated, so both encoders produce identical numbering. */
final class IterativeTseitinEncoder extends AbstractTseitinEncoder {
    IterativeTseitinEncoder(EncoderConfiguration configuration) {
        super(configuration);
    }

    @Override
    protected int encode(Formula formula, List<int[]> clauses) {
        if (formula.isAtomic()) {
            return TseitinDefinitions.atomLiteral(formula);
        }

        Deque<Frame> stack = new ArrayDeque<>();
        stack.push(new Frame(formula, auxiliaryVariable(formula)));
        while (true) {
            Frame frame = stack.peek();
            if (frame.hasNext()) {
                Formula child = frame.next();
                if (child.isAtomic()) {
                    frame.accept(TseitinDefinitions.atomLiteral(child), clauses);
                } else {
                    stack.push(new Frame(child, auxiliaryVariable(child)));
                }
                continue;
            }

            stack.pop();
            TseitinDefinitions.define(frame.kind, frame.fresh, frame.literals, clauses);
            if (stack.isEmpty()) {
                return frame.fresh;
            }
            stack.peek().accept(frame.fresh, clauses);
        }
    }

    private static final class Frame {
        final Kind kind;
        final int fresh;
        final List<Formula> children;
        final int[] literals;
        int index = 0;

        Frame(Formula formula, int fresh) {
            this.kind = formula.kind();
            this.fresh = fresh;
            this.children = formula.children();
            this.literals = new int[children.size()];
        }

        boolean hasNext() {
            return index < literals.length;
        }

        Formula next() {
            return children.get(index);
        }

        void accept(int literal, List<int[]> clauses) {
            literals[index] = literal;
            index += 1;
            TseitinDefinitions.defineChild(kind, fresh, literal, clauses);
        }
    }
}
