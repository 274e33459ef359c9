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

import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import de.automatakit.api.Automaton;
import de.automatakit.api.Classification;
import de.automatakit.api.Transition;
import de.automatakit.setting.AutomataKitProperty;
import de.automatakit.setting.AutomataKitSettings;
import net.automatalib.commons.util.Pair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides whether an automaton is a DFA or an NFA.
 * <p>
 * An automaton is a DFA iff for every declared state and every declared symbol there is exactly one target. Missing
 * transitions and nondeterministic choices both make it an NFA. Duplicate transitions with the same target count once.
 */
public final class FAClassifier {

    /**
     * Symbols that are reported as epsilon transitions unless configured otherwise.
     */
    public static final List<String> DEFAULT_EPSILON_SYMBOLS = Arrays.asList("", "ε", "epsilon");

    private static final Logger LOGGER = LoggerFactory.getLogger(FAClassifier.class);

    private final ImmutableSet<String> epsilonSymbols;

    /**
     * Creates a classifier using the {@link AutomataKitProperty#EPSILON_SYMBOLS configured} epsilon symbols.
     */
    public FAClassifier() {
        this(AutomataKitSettings.getInstance().getList(AutomataKitProperty.EPSILON_SYMBOLS, DEFAULT_EPSILON_SYMBOLS));
    }

    public FAClassifier(Collection<String> epsilonSymbols) {
        this.epsilonSymbols = ImmutableSet.copyOf(Preconditions.checkNotNull(epsilonSymbols));
    }

    public ImmutableSet<String> getEpsilonSymbols() {
        return epsilonSymbols;
    }

    public Classification classify(Automaton automaton) {
        return determinismReport(automaton).getClassification();
    }

    public DeterminismReport determinismReport(Automaton automaton) {
        final Set<String> states = new LinkedHashSet<>(automaton.getStates());
        final Set<String> alphabet = new LinkedHashSet<>(automaton.getAlphabet());

        final ImmutableList.Builder<Pair<String, String>> missing = ImmutableList.builder();
        final ImmutableMap.Builder<Pair<String, String>, ImmutableSet<String>> choices = ImmutableMap.builder();
        int present = 0;

        for (String state : states) {
            for (String symbol : alphabet) {
                final ImmutableSet<String> targets = automaton.getSuccessors(state, symbol);
                if (targets.isEmpty()) {
                    missing.add(Pair.of(state, symbol));
                } else {
                    present++;
                    if (targets.size() > 1) {
                        choices.put(Pair.of(state, symbol), targets);
                    }
                }
            }
        }

        final ImmutableList.Builder<Transition> epsilons = ImmutableList.builder();
        for (Transition t : automaton.getTransitions()) {
            if (epsilonSymbols.contains(t.getSymbol())) {
                epsilons.add(t);
            }
        }

        final DeterminismReport report =
                new DeterminismReport(missing.build(), choices.build(), epsilons.build(), present,
                                      states.size() * alphabet.size());
        LOGGER.debug("Classified automaton with {} states as {}", states.size(), report.getClassification());
        return report;
    }
}
