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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSortedSet;
import de.automatakit.analysis.FAClassifier;
import de.automatakit.api.Automaton;
import de.automatakit.api.Classification;
import de.automatakit.api.Transition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Determinizes an automaton with the subset (powerset) construction, exploring only subsets reachable from the start
 * state.
 * <p>
 * Subsets are discovered breadth-first and named {@code Q0, Q1, ...} in discovery order, so {@code Q0} is always the
 * start state. Symbols leading to the empty subset get no transition, i.e. the result may be a partial DFA. Epsilon
 * transitions are not resolved: an epsilon token is treated like any other symbol.
 */
public final class SubsetConstruction {

    private static final Logger LOGGER = LoggerFactory.getLogger(SubsetConstruction.class);

    private static final String LABEL_PREFIX = "Q";

    private SubsetConstruction() {
        // prevent instantiation
    }

    public static Automaton determinize(Automaton nfa) {
        return run(nfa).getDfa();
    }

    public static DeterminizationResult run(Automaton nfa) {
        Preconditions.checkNotNull(nfa, "nfa");

        final Set<String> alphabet = new LinkedHashSet<>(nfa.getAlphabet());
        final Map<ImmutableSortedSet<String>, String> labels = new LinkedHashMap<>();
        final Deque<ImmutableSortedSet<String>> queue = new ArrayDeque<>();
        final List<Transition> transitions = new ArrayList<>();
        final List<String> finalStates = new ArrayList<>();

        final ImmutableSortedSet<String> initial = ImmutableSortedSet.of(nfa.getStart());
        final String startLabel = register(nfa, initial, labels, queue, finalStates);

        while (!queue.isEmpty()) {
            final ImmutableSortedSet<String> current = queue.poll();
            final String label = labels.get(current);

            for (String symbol : alphabet) {
                final ImmutableSortedSet.Builder<String> succBuilder = ImmutableSortedSet.naturalOrder();
                for (String s : current) {
                    succBuilder.addAll(nfa.getSuccessors(s, symbol));
                }
                final ImmutableSortedSet<String> succ = succBuilder.build();
                if (succ.isEmpty()) {
                    continue;
                }

                String succLabel = labels.get(succ);
                if (succLabel == null) {
                    succLabel = register(nfa, succ, labels, queue, finalStates);
                }
                transitions.add(Transition.of(label, symbol, succLabel));
            }
        }

        final Automaton dfa = new Automaton(labels.values(), alphabet, transitions, startLabel, finalStates);

        final ImmutableMap.Builder<String, ImmutableSortedSet<String>> subsets = ImmutableMap.builder();
        for (Map.Entry<ImmutableSortedSet<String>, String> e : labels.entrySet()) {
            subsets.put(e.getValue(), e.getKey());
        }

        final Classification original = new FAClassifier().classify(nfa);
        final int nfaStates = new LinkedHashSet<>(nfa.getStates()).size();

        LOGGER.debug("Subset construction: {} NFA states, {} DFA states", nfaStates, dfa.size());

        return new DeterminizationResult(dfa, subsets.build(), original, nfaStates);
    }

    private static String register(Automaton nfa,
                                   ImmutableSortedSet<String> subset,
                                   Map<ImmutableSortedSet<String>, String> labels,
                                   Deque<ImmutableSortedSet<String>> queue,
                                   List<String> finalStates) {
        final String label = LABEL_PREFIX + labels.size();
        labels.put(subset, label);
        queue.add(subset);

        for (String s : subset) {
            if (nfa.isFinal(s)) {
                finalStates.add(label);
                break;
            }
        }
        return label;
    }
}
