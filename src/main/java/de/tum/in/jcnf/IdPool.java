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
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.annotation.Nullable;

/**
 * Manager of variable ids. Ids are handed out in strictly increasing order, starting from
 * {@code startFrom}, and skip all intervals which have been reserved through
 * {@link #reserve(int, int)} or passed to {@link #restart(int, int[][])}. Arbitrary objects can be
 * used as labels, in which case repeated requests for the same label yield the same id.
 *
 * <p>A pool is the context shared by all formulas built on it: every auxiliary variable introduced
 * during encoding is drawn from the pool the respective formula node was built with. Hence, the
 * final numbering depends on the order in which formulas are constructed and encoded. The class is
 * not thread safe; independent sessions should use independent pools.</p>
 */
public final class IdPool {
    private static final Logger logger = Logger.getLogger(IdPool.class.getName());
    private static final int NO_VARIABLE = 0;

    /**
     * Labels used internally by the pool. They never collide with user supplied labels.
     */
    public enum SpecialLabel {
        TRUE
    }

    private int top;
    /* Pending reserved intervals {start, stop}, sorted by start */
    private final List<int[]> reserved = new ArrayList<>();
    private final Map<Object, Integer> labelToId = new HashMap<>();
    private final Map<Integer, Object> idToLabel = new HashMap<>();
    private int trueVariable = NO_VARIABLE;

    public IdPool() {
        this(1);
    }

    public IdPool(int startFrom) {
        this(startFrom, new int[0][]);
    }

    /**
     * Creates a pool handing out ids from {@code startFrom} on.
     *
     * @param startFrom
     *     The smallest id to hand out, must be positive.
     * @param reserved
     *     Inclusive intervals {@code {start, stop}} which are skipped.
     */
    public IdPool(int startFrom, int[][] reserved) {
        restart(startFrom, reserved);
    }

    /**
     * Resets the pool to the state it would have if freshly created with the given arguments. All
     * labels, pending reservations and the true atom are forgotten.
     *
     * @throws IllegalArgumentException
     *     if {@code startFrom} is not positive or an interval does not consist of exactly two values.
     */
    public void restart(int startFrom, int[][] reserved) {
        if (startFrom <= 0) {
            throw new IllegalArgumentException("Ids must be positive, got start " + startFrom);
        }
        for (int[] interval : reserved) {
            if (interval.length != 2) {
                throw new IllegalArgumentException("Expected interval {start, stop}, got " + interval.length
                        + " values");
            }
        }

        this.top = startFrom - 1;
        this.reserved.clear();
        this.labelToId.clear();
        this.idToLabel.clear();
        this.trueVariable = NO_VARIABLE;
        for (int[] interval : reserved) {
            reserve(interval[0], interval[1]);
        }
    }

    /**
     * Returns a fresh id which is not associated with any label.
     */
    public int allocate() {
        return next();
    }

    /**
     * Returns the id associated with {@code label}. If the label is unknown, a fresh id is created
     * and associated with it.
     *
     * @param label
     *     The label, compared by {@link Object#equals(Object)}.
     * @return The id of the label.
     */
    public int allocate(Object label) {
        Objects.requireNonNull(label);
        Integer id = labelToId.get(label);
        if (id == null) {
            id = next();
            labelToId.put(label, id);
            idToLabel.putIfAbsent(id, label);
        }
        return id;
    }

    /**
     * Returns the label associated with the given {@code id}, or {@code null} if the id was created
     * anonymously or never issued by this pool.
     */
    @Nullable
    public Object lookup(int id) {
        return idToLabel.get(id);
    }

    /**
     * Marks the inclusive interval {@code [start, stop]} as reserved so that future allocations
     * skip it. Empty intervals, i.e. {@code stop < start}, are ignored.
     */
    public void reserve(int start, int stop) {
        if (stop < start) {
            return;
        }
        int index = 0;
        while (index < reserved.size() && reserved.get(index)[0] <= start) {
            index += 1;
        }
        reserved.add(index, new int[] {start, stop});
    }

    /**
     * Advances the pool until {@link #top()} is at least {@code id}. Ids skipped this way are never
     * handed out afterwards, which keeps allocations consistent with ids chosen by the caller.
     */
    public void advanceTo(int id) {
        while (top < id) {
            next();
        }
    }

    /**
     * Returns the id representing the constant {@code true}. The id is allocated on the first call
     * and shared by all constants of this pool.
     */
    public int trueVariable() {
        if (trueVariable == NO_VARIABLE) {
            trueVariable = allocate(SpecialLabel.TRUE);
        }
        return trueVariable;
    }

    /**
     * Returns the largest id handed out so far, or {@code startFrom - 1} if none was.
     */
    public int top() {
        return top;
    }

    private int next() {
        Util.checkState(top < Integer.MAX_VALUE, "Pool %s is exhausted", this);
        top += 1;

        while (!reserved.isEmpty() && reserved.get(0)[0] <= top) {
            int[] interval = reserved.remove(0);
            if (top <= interval[1]) {
                Util.checkState(interval[1] < Integer.MAX_VALUE, "Pool %s is exhausted", this);
                logger.log(Level.FINEST, "Skipping reserved ids [{0}, {1}]", new Object[] {top, interval[1]});
                top = interval[1] + 1;
            }
        }

        assert reserved.isEmpty() || top < reserved.get(0)[0];
        return top;
    }

    @Override
    public String toString() {
        return String.format("IdPool{top=%d, labels=%d, reserved=%d}", top, labelToId.size(), reserved.size());
    }
}
