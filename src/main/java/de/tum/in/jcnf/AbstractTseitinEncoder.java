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
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

abstract class AbstractTseitinEncoder implements TseitinEncoder {
    private static final Logger logger = Logger.getLogger(AbstractTseitinEncoder.class.getName());

    private final EncoderConfiguration configuration;

    private long encodedFormulas = 0;
    private long generatedClauses = 0;
    private long auxiliaryVariables = 0;

    AbstractTseitinEncoder(EncoderConfiguration configuration) {
        this.configuration = configuration;
    }

    /**
     * Encodes {@code formula}, adding its defining clauses to {@code clauses}.
     *
     * @return The literal representing the formula.
     */
    protected abstract int encode(Formula formula, List<int[]> clauses);

    protected final int auxiliaryVariable(Formula formula) {
        assert !formula.isAtomic();
        auxiliaryVariables += 1;
        return formula.pool().allocate();
    }

    @Override
    public final Encoding encode(Formula formula) {
        Objects.requireNonNull(formula);
        long auxiliaryBefore = auxiliaryVariables;
        List<int[]> clauses = new ArrayList<>();
        int literal = encode(formula, clauses);

        encodedFormulas += 1;
        generatedClauses += clauses.size();
        logger.log(Level.FINE, "Encoded formula as {0} with {1} clauses and {2} auxiliary variables",
                new Object[] {literal, clauses.size(), auxiliaryVariables - auxiliaryBefore});
        return new Encoding(literal, clauses);
    }

    @Override
    public final void toCnf(Formula formula, ClauseSink sink) {
        Encoding encoding = encode(formula);
        sink.extend(encoding.clauses());
        sink.append(new int[] {encoding.literal()});

        if (configuration.logStatisticsOnEncode()) {
            logger.log(Level.INFO, statistics());
        }
    }

    @Override
    public String statistics() {
        return String.format("Encoder %s: %d formulas, %d clauses, %d auxiliary variables",
                getClass().getSimpleName(), encodedFormulas, generatedClauses, auxiliaryVariables);
    }

    @Override
    public String toString() {
        return String.format("%s{%s}", getClass().getSimpleName(), configuration);
    }
}
