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
package de.automatakit.algorithm.minimization;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import de.automatakit.api.Automaton;

/**
 * The minimal DFA computed by {@link PartitionRefinementMinimizer} and the equivalence classes it was built from.
 */
public final class MinimizationResult {

    private final Automaton minimized;
    private final ImmutableMap<String, ImmutableSet<String>> equivalenceClasses;
    private final ImmutableMap<String, String> stateMapping;
    private final int originalStateCount;

    MinimizationResult(Automaton minimized,
                       ImmutableMap<String, ImmutableSet<String>> equivalenceClasses,
                       ImmutableMap<String, String> stateMapping,
                       int originalStateCount) {
        this.minimized = minimized;
        this.equivalenceClasses = equivalenceClasses;
        this.stateMapping = stateMapping;
        this.originalStateCount = originalStateCount;
    }

    public Automaton getMinimized() {
        return minimized;
    }

    /**
     * Maps each state of the minimized DFA to the original states it merges, ordered by label.
     *
     * @return the equivalence classes
     */
    public ImmutableMap<String, ImmutableSet<String>> getEquivalenceClasses() {
        return equivalenceClasses;
    }

    /**
     * Maps each original state to the state of the minimized DFA that represents it.
     *
     * @return the state mapping
     */
    public ImmutableMap<String, String> getStateMapping() {
        return stateMapping;
    }

    public int getOriginalStateCount() {
        return originalStateCount;
    }

    public int getStatesReduced() {
        return originalStateCount - minimized.size();
    }

    public double getReductionPercentage() {
        if (originalStateCount == 0) {
            return 0.0;
        }
        return getStatesReduced() * 100.0 / originalStateCount;
    }

    public boolean isAlreadyMinimal() {
        return getStatesReduced() == 0;
    }

    @Override
    public String toString() {
        return "MinimizationResult{original=" + originalStateCount + ", minimized=" + minimized.size() +
               ", classes=" + equivalenceClasses + '}';
    }
}
