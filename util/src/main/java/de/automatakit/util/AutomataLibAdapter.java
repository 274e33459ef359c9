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
package de.automatakit.util;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

import com.google.common.base.Preconditions;
import de.automatakit.api.Automaton;
import de.automatakit.api.Transition;
import net.automatalib.automata.fsa.DFA;
import net.automatalib.automata.fsa.impl.compact.CompactDFA;
import net.automatalib.automata.fsa.impl.compact.CompactNFA;
import net.automatalib.words.Alphabet;
import net.automatalib.words.impl.Alphabets;

/**
 * Conversions between {@link Automaton} and the AutomataLib automaton implementations.
 */
public final class AutomataLibAdapter {

    private AutomataLibAdapter() {
        // prevent instantiation
    }

    /**
     * Returns the distinct symbols of the given automaton as an AutomataLib alphabet.
     *
     * @param automaton
     *         the automaton
     *
     * @return the input alphabet
     */
    public static Alphabet<String> alphabetOf(Automaton automaton) {
        return Alphabets.fromList(new ArrayList<>(new LinkedHashSet<>(automaton.getAlphabet())));
    }

    public static CompactNFA<String> toCompactNFA(Automaton automaton) {
        return toCompactNFA(automaton, alphabetOf(automaton));
    }

    /**
     * Converts an automaton into a {@link CompactNFA} over the given alphabet. The alphabet may be larger than the
     * automaton's own, e.g. to compare two automata over the union of their alphabets.
     *
     * @param automaton
     *         the automaton to convert
     * @param alphabet
     *         the input alphabet of the result, which must contain every transition symbol
     *
     * @return the converted automaton
     *
     * @throws IllegalArgumentException
     *         if the automaton refers to undeclared states or to symbols outside the alphabet
     */
    public static CompactNFA<String> toCompactNFA(Automaton automaton, Alphabet<String> alphabet) {
        final CompactNFA<String> result = new CompactNFA<>(alphabet);
        final Map<String, Integer> ids = new HashMap<>();

        for (String s : new LinkedHashSet<>(automaton.getStates())) {
            ids.put(s, result.addState(automaton.isFinal(s)));
        }
        result.setInitial(stateId(ids, automaton.getStart()), true);

        for (Transition t : automaton.getTransitions()) {
            Preconditions.checkArgument(alphabet.containsSymbol(t.getSymbol()), "Unknown symbol in %s", t);
            result.addTransition(stateId(ids, t.getFrom()), t.getSymbol(), stateId(ids, t.getTo()));
        }

        return result;
    }

    /**
     * Converts a deterministic automaton into a {@link CompactDFA}. Missing transitions stay undefined.
     *
     * @param automaton
     *         the automaton to convert, which must not contain nondeterministic choices
     *
     * @return the converted automaton
     */
    public static CompactDFA<String> toCompactDFA(Automaton automaton) {
        final CompactDFA<String> result = new CompactDFA<>(alphabetOf(automaton));
        final Map<String, Integer> ids = new HashMap<>();

        for (String s : new LinkedHashSet<>(automaton.getStates())) {
            ids.put(s, result.addState(automaton.isFinal(s)));
        }
        result.setInitial(stateId(ids, automaton.getStart()), true);

        for (Transition t : automaton.getTransitions()) {
            final Integer src = stateId(ids, t.getFrom());
            final Integer tgt = stateId(ids, t.getTo());
            final Integer existing = result.getSuccessor(src, t.getSymbol());
            Preconditions.checkArgument(existing == null || existing.equals(tgt),
                                        "State '%s' has several transitions on '%s'",
                                        t.getFrom(),
                                        t.getSymbol());
            result.setTransition(src, t.getSymbol(), tgt);
        }

        return result;
    }

    /**
     * Converts an AutomataLib DFA back into an {@link Automaton}. Only states reachable from the initial state are
     * converted; they are named {@code q0, q1, ...} in breadth-first order.
     *
     * @param dfa
     *         the DFA to convert
     * @param inputs
     *         the input symbols to consider
     * @param <S>
     *         state type
     *
     * @return the converted automaton
     */
    public static <S> Automaton fromDFA(DFA<S, String> dfa, Collection<String> inputs) {
        final S init = dfa.getInitialState();
        Preconditions.checkArgument(init != null, "DFA has no initial state");

        final Map<S, String> names = new LinkedHashMap<>();
        final Deque<S> queue = new ArrayDeque<>();
        final List<Transition> transitions = new ArrayList<>();
        final List<String> finals = new ArrayList<>();

        names.put(init, "q0");
        queue.add(init);

        while (!queue.isEmpty()) {
            final S current = queue.poll();
            final String name = names.get(current);
            if (dfa.isAccepting(current)) {
                finals.add(name);
            }
            for (String symbol : inputs) {
                final S succ = dfa.getSuccessor(current, symbol);
                if (succ == null) {
                    continue;
                }
                String succName = names.get(succ);
                if (succName == null) {
                    succName = "q" + names.size();
                    names.put(succ, succName);
                    queue.add(succ);
                }
                transitions.add(Transition.of(name, symbol, succName));
            }
        }

        return new Automaton(names.values(), inputs, transitions, "q0", finals);
    }

    public static Automaton fromCompactDFA(CompactDFA<String> dfa) {
        return fromDFA(dfa, dfa.getInputAlphabet());
    }

    private static Integer stateId(Map<String, Integer> ids, String state) {
        final Integer id = ids.get(state);
        Preconditions.checkArgument(id != null, "Undeclared state '%s'", state);
        return id;
    }
}
