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

import static de.tum.in.jcnf.Clauses.asLists;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import org.junit.jupiter.api.Test;

public class CnfTest {
    @Test
    public void testClausesAreKeptAsGiven() {
        Cnf cnf = new Cnf();
        cnf.extend(List.of(new int[] {3, -1, 3}, new int[] {-7}));
        cnf.append(new int[] {});
        cnf.append(new int[] {2, 1});

        assertThat(asLists(cnf.clauses()), contains(List.of(3, -1, 3), List.of(-7), List.of(), List.of(2, 1)));
        assertThat(cnf.size(), is(4));
        assertThat(cnf.numberOfVariables(), is(7));
        assertThat(cnf.toString(), is("Cnf{variables=7, clauses=[[3, -1, 3], [-7], [], [2, 1]]}"));
    }

    @Test
    public void testZeroLiteralIsRejected() {
        Cnf cnf = new Cnf();
        assertThrows(IllegalArgumentException.class, () -> cnf.append(new int[] {1, 0}));
        assertThat(cnf.size(), is(0));
    }
}
