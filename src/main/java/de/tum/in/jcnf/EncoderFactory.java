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

public final class EncoderFactory {
    private EncoderFactory() {}

    public static TseitinEncoder buildEncoder() {
        return buildEncoder(ImmutableEncoderConfiguration.builder().build());
    }

    public static TseitinEncoder buildEncoder(EncoderConfiguration configuration) {
        return buildEncoder(configuration.iterative(), configuration);
    }

    public static TseitinEncoder buildEncoderRecursive(EncoderConfiguration configuration) {
        return buildEncoder(false, configuration);
    }

    public static TseitinEncoder buildEncoderIterative(EncoderConfiguration configuration) {
        return buildEncoder(true, configuration);
    }

    public static TseitinEncoder buildEncoder(boolean iterative, EncoderConfiguration configuration) {
        return iterative ? new IterativeTseitinEncoder(configuration) : new RecursiveTseitinEncoder(configuration);
    }
}
