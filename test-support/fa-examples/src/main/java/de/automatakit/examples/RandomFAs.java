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
package de.automatakit.examples;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import com.google.common.base.Preconditions;
import de.automatakit.api.Automaton;

/**
 * Generates random automata for property-style tests. All methods are deterministic for a given {@link Random}
 * seed.
 */
public final class RandomFAs {

    private RandomFAs() {
        // prevent instantiation
    }

    /**
     * Creates a random NFA. Every state/symbol pair gets between zero and {@code maxFanOut} transitions to uniformly
     * chosen targets, every state is final with probability {@code 1/3}.
     *
     * @param random
     *         the source of randomness
     * @param numStates
     *         the number of states, named {@code s0 .. s(n-1)}
     * @param alphabet
     *         the input symbols
     * @param maxFanOut
     *         the maximum number of transitions per state and symbol
     *
     * @return the random automaton
     */
    public static Automaton randomNFA(Random random, int numStates, List<String> alphabet, int maxFanOut) {
        Preconditions.checkArgument(numStates > 0, "at least one state is required");
        final Automaton.Builder builder = Automaton.builder().alphabet(alphabet).states(stateNames(numStates));

        for (int i = 0; i < numStates; i++) {
            for (String symbol : alphabet) {
                final int fanOut = random.nextInt(maxFanOut + 1);
                for (int j = 0; j < fanOut; j++) {
                    builder.transition("s" + i, symbol, "s" + random.nextInt(numStates));
                }
            }
            if (random.nextInt(3) == 0) {
                builder.addFinalState("s" + i);
            }
        }

        return builder.start("s0").build();
    }

    /**
     * Creates a random DFA with {@code numStates} states.
     *
     * @param random
     *         the source of randomness
     * @param numStates
     *         the number of states, named {@code s0 .. s(n-1)}
     * @param alphabet
     *         the input symbols
     * @param complete
     *         whether every state/symbol pair gets a transition; otherwise roughly one in five is left undefined
     *
     * @return the random automaton
     */
    public static Automaton randomDFA(Random random, int numStates, List<String> alphabet, boolean complete) {
        Preconditions.checkArgument(numStates > 0, "at least one state is required");
        final Automaton.Builder builder = Automaton.builder().alphabet(alphabet).states(stateNames(numStates));

        for (int i = 0; i < numStates; i++) {
            for (String symbol : alphabet) {
                if (complete || random.nextInt(5) != 0) {
                    builder.transition("s" + i, symbol, "s" + random.nextInt(numStates));
                }
            }
            if (random.nextBoolean()) {
                builder.addFinalState("s" + i);
            }
        }

        return builder.start("s0").build();
    }

    private static List<String> stateNames(int numStates) {
        final List<String> result = new ArrayList<>(numStates);
        for (int i = 0; i < numStates; i++) {
            result.add("s" + i);
        }
        return result;
    }
}
