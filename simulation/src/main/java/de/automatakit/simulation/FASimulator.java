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
package de.automatakit.simulation;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSet;
import de.automatakit.api.Automaton;
import de.automatakit.exception.SymbolNotInAlphabetException;
import net.automatalib.words.Word;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs DFAs and NFAs on input words by tracking the set of active states.
 * <p>
 * Starting from the start state, each symbol maps the active set to the union of all targets of transitions leaving an
 * active state with that symbol. Once the active set becomes empty, the remaining input is not processed. The word is
 * accepted iff the final active set contains a final state.
 */
public final class FASimulator {

    private static final Logger LOGGER = LoggerFactory.getLogger(FASimulator.class);

    private FASimulator() {
        // prevent instantiation
    }

    /**
     * Simulates the automaton on a string, where each code point is one input symbol.
     *
     * @param automaton
     *         the automaton
     * @param input
     *         the input string, possibly empty
     *
     * @return the simulation result
     *
     * @throws SymbolNotInAlphabetException
     *         if a character of the input is not an alphabet symbol
     */
    public static SimulationResult simulate(Automaton automaton, String input) {
        Preconditions.checkNotNull(input, "input");
        final List<String> symbols = new ArrayList<>(input.length());
        input.codePoints().forEach(cp -> symbols.add(new String(Character.toChars(cp))));
        return simulate(automaton, Word.fromList(symbols));
    }

    /**
     * Simulates the automaton on a word of (possibly multi-character) symbols.
     *
     * @param automaton
     *         the automaton
     * @param input
     *         the input word, possibly empty
     *
     * @return the simulation result
     *
     * @throws SymbolNotInAlphabetException
     *         if the word contains a symbol that is not in the alphabet. The whole word is checked before any symbol
     *         is consumed.
     */
    public static SimulationResult simulate(Automaton automaton, Word<String> input) {
        Preconditions.checkNotNull(automaton, "automaton");
        Preconditions.checkNotNull(input, "input");

        final Set<String> alphabet = new HashSet<>(automaton.getAlphabet());
        for (String symbol : input) {
            if (!alphabet.contains(symbol)) {
                throw new SymbolNotInAlphabetException(symbol);
            }
        }

        final List<TraceStep> steps = new ArrayList<>(input.length() + 1);
        ImmutableSet<String> active = ImmutableSet.of(automaton.getStart());
        steps.add(TraceStep.initial(active));

        for (String symbol : input) {
            if (active.isEmpty()) {
                break;
            }
            final ImmutableSet.Builder<String> next = ImmutableSet.builder();
            for (String state : active) {
                next.addAll(automaton.getSuccessors(state, symbol));
            }
            final ImmutableSet<String> after = next.build();
            steps.add(new TraceStep(steps.size(), symbol, active, after, null));
            active = after;
        }

        boolean accepted = false;
        for (String state : active) {
            if (automaton.isFinal(state)) {
                accepted = true;
                break;
            }
        }

        final int last = steps.size() - 1;
        steps.set(last, steps.get(last).withVerdict(Verdict.of(accepted)));

        final ExecutionTrace trace = new ExecutionTrace(steps, input.length());
        LOGGER.debug("Simulated '{}': {} after {} of {} symbols",
                     input,
                     trace.getVerdict(),
                     trace.getConsumedSymbols(),
                     input.length());

        return new SimulationResult(input, active, trace);
    }
}
