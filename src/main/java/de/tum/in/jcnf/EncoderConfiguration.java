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

import org.immutables.value.Value;

@SuppressWarnings("MethodReturnAlwaysConstant")
@Value.Immutable
public class EncoderConfiguration {
    /**
     * Whether to encode with an explicit work stack instead of recursion. The iterative encoder
     * handles formulas of arbitrary depth.
     */
    @Value.Default
    public boolean iterative() {
        return true;
    }

    @Value.Default
    public boolean logStatisticsOnEncode() {
        return false;
    }
}
