/* Copyright (C) 2024 The AutomataKit Authors
 * This file is part of AutomataKit.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package de.automatakit.algorithm.determinization;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSortedSet;
import de.automatakit.api.Automaton;
import de.automatakit.api.Classification;

/**
 * The DFA produced by {@link SubsetConstruction}, together with the subset of NFA states behind each DFA state and
 * some size metrics.
 */
public final class DeterminizationResult {

    private final Automaton dfa;
    private final ImmutableMap<String, ImmutableSortedSet<String>> subsets;
    private final Classification originalClassification;
    private final int nfaStateCount;

    DeterminizationResult(Automaton dfa,
                          ImmutableMap<String, ImmutableSortedSet<String>> subsets,
                          Classification originalClassification,
                          int nfaStateCount) {
        this.dfa = dfa;
        this.subsets = subsets;
        this.originalClassification = originalClassification;
        this.nfaStateCount = nfaStateCount;
    }

    public Automaton getDfa() {
        return dfa;
    }

    /**
     * Maps each DFA state label ({@code Q0, Q1, ...}) to the set of NFA states it represents.
     *
     * @return the subsets, in discovery order
     */
    public ImmutableMap<String, ImmutableSortedSet<String>> getSubsets() {
        return subsets;
    }

    public Classification getOriginalClassification() {
        return originalClassification;
    }

    public int getNfaStateCount() {
        return nfaStateCount;
    }

    public int getDfaStateCount() {
        return dfa.size();
    }

    /**
     * The theoretical maximum number of DFA states, {@code 2^n} for an NFA with {@code n} states.
     *
     * @return the state bound
     */
    public BigInteger getStateBound() {
        return BigInteger.ONE.shiftLeft(nfaStateCount);
    }

    public int getStateIncrease() {
        return getDfaStateCount() - nfaStateCount;
    }

    /**
     * How far the construction stayed below the {@link #getStateBound() bound}, in percent.
     *
     * @return {@code (bound - actual) / bound * 100}
     */
    public double getEfficiencyPercentage() {
        final BigInteger bound = getStateBound();
        final BigInteger saved = bound.subtract(BigInteger.valueOf(getDfaStateCount()));
        return new BigDecimal(saved).multiply(BigDecimal.valueOf(100))
                                    .divide(new BigDecimal(bound), MathContext.DECIMAL64)
                                    .doubleValue();
    }

    public EfficiencyRating getEfficiencyRating() {
        return EfficiencyRating.of(getEfficiencyPercentage());
    }

    public ConversionComplexity getConversionComplexity() {
        return ConversionComplexity.of(getStateIncrease(), nfaStateCount);
    }

    @Override
    public String toString() {
        return "DeterminizationResult{nfaStates=" + nfaStateCount + ", dfaStates=" + getDfaStateCount() +
               ", subsets=" + subsets + '}';
    }
}
