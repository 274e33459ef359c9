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

import com.google.common.base.Preconditions;

/**
 * A coarse rating of how much a subset construction grew the automaton, relative to the size of the NFA.
 */
public enum ConversionComplexity {
    /** The DFA has no more states than the NFA. */
    NO_CHANGE,
    /** At most half as many additional states as the NFA had. */
    LOW,
    MODERATE,
    HIGH,
    /** More than three times as many additional states as the NFA had. */
    VERY_HIGH;

    /**
     * Rates a state increase.
     *
     * @param stateIncrease
     *         DFA states minus NFA states, possibly negative
     * @param nfaStateCount
     *         the number of NFA states, must be positive
     *
     * @return the rating
     */
    public static ConversionComplexity of(int stateIncrease, int nfaStateCount) {
        Preconditions.checkArgument(nfaStateCount > 0, "NFA must have at least one state");
        final double ratio = (double) stateIncrease / nfaStateCount;
        if (ratio <= 0) {
            return NO_CHANGE;
        } else if (ratio <= 0.5) {
            return LOW;
        } else if (ratio <= 1.5) {
            return MODERATE;
        } else if (ratio <= 3) {
            return HIGH;
        }
        return VERY_HIGH;
    }
}
