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
package de.automatakit.analysis;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import de.automatakit.api.Classification;
import de.automatakit.api.Transition;
import net.automatalib.commons.util.Pair;

/**
 * Detailed result of classifying an automaton. Pairs are {@code (state, symbol)} and only range over declared states
 * and symbols.
 */
public final class DeterminismReport {

    private final ImmutableList<Pair<String, String>> missingTransitions;
    private final ImmutableMap<Pair<String, String>, ImmutableSet<String>> nondeterministicChoices;
    private final ImmutableList<Transition> epsilonTransitions;
    private final int presentPairs;
    private final int requiredPairs;

    DeterminismReport(ImmutableList<Pair<String, String>> missingTransitions,
                      ImmutableMap<Pair<String, String>, ImmutableSet<String>> nondeterministicChoices,
                      ImmutableList<Transition> epsilonTransitions,
                      int presentPairs,
                      int requiredPairs) {
        this.missingTransitions = missingTransitions;
        this.nondeterministicChoices = nondeterministicChoices;
        this.epsilonTransitions = epsilonTransitions;
        this.presentPairs = presentPairs;
        this.requiredPairs = requiredPairs;
    }

    /**
     * {@link Classification#DFA} iff every pair has exactly one target, i.e. the automaton is both
     * {@link #isComplete() complete} and {@link #isDeterministic() deterministic}.
     *
     * @return the classification
     */
    public Classification getClassification() {
        return isComplete() && isDeterministic() ? Classification.DFA : Classification.NFA;
    }

    public ImmutableList<Pair<String, String>> getMissingTransitions() {
        return missingTransitions;
    }

    /**
     * Returns every pair with more than one distinct target, together with its targets.
     *
     * @return the nondeterministic choices, in declaration order of states and symbols
     */
    public ImmutableMap<Pair<String, String>, ImmutableSet<String>> getNondeterministicChoices() {
        return nondeterministicChoices;
    }

    /**
     * Transitions labelled with a reserved epsilon token. They are reported only, they do not influence the
     * classification.
     *
     * @return the epsilon transitions
     */
    public ImmutableList<Transition> getEpsilonTransitions() {
        return epsilonTransitions;
    }

    public int getPresentPairs() {
        return presentPairs;
    }

    public int getRequiredPairs() {
        return requiredPairs;
    }

    public double getCompletenessPercentage() {
        if (requiredPairs == 0) {
            return 100.0;
        }
        return presentPairs * 100.0 / requiredPairs;
    }

    public boolean isComplete() {
        return missingTransitions.isEmpty();
    }

    /**
     * Whether no pair has more than one target. Unlike the {@link #getClassification() classification}, this accepts
     * partial automata.
     *
     * @return {@code true} if the automaton has no nondeterministic choice
     */
    public boolean isDeterministic() {
        return nondeterministicChoices.isEmpty();
    }

    public boolean hasEpsilonTransitions() {
        return !epsilonTransitions.isEmpty();
    }

    @Override
    public String toString() {
        return "DeterminismReport{classification=" + getClassification() + ", present=" + presentPairs +
               ", required=" + requiredPairs + ", missing=" + missingTransitions + ", nondeterministic=" +
               nondeterministicChoices + '}';
    }
}
