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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import de.automatakit.analysis.DeterminismReport;
import de.automatakit.analysis.FAClassifier;
import de.automatakit.api.Automaton;
import de.automatakit.api.Transition;
import de.automatakit.datastructure.partition.Block;
import de.automatakit.datastructure.partition.Partition;
import de.automatakit.exception.NotDeterministicException;
import net.automatalib.commons.util.Pair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Minimizes a DFA by partition refinement (Hopcroft style).
 * <p>
 * The initial partition is {@code [final, non-final]}. Splitters are taken from a worklist that initially holds the
 * final block. For each splitter {@code A} and symbol {@code a}, every block {@code Y} is split into the states whose
 * {@code a}-successor lies in {@code A} and the others. If {@code Y} was waiting, both halves replace it in the
 * worklist, otherwise only the smaller half is added.
 * <p>
 * The blocks of the final partition become the states of the result. The block of the start state is named
 * {@code q0}, the other blocks are named {@code q1, q2, ...} in partition order. Unreachable states are kept.
 * <p>
 * Partial DFAs are completed internally with a virtual rejecting sink, so missing transitions are distinguished from
 * transitions into live states. The sink never appears in the result. For partial input, states equivalent to the
 * sink are removed together with the transitions into them (unless the start state is among them), so the result is
 * the minimal partial DFA. Removed states do not appear in the equivalence classes.
 */
public final class PartitionRefinementMinimizer {

    private static final Logger LOGGER = LoggerFactory.getLogger(PartitionRefinementMinimizer.class);

    private static final String LABEL_PREFIX = "q";
    private static final int UNDEFINED = -1;

    private PartitionRefinementMinimizer() {
        // prevent instantiation
    }

    public static Automaton minimize(Automaton dfa) {
        return run(dfa).getMinimized();
    }

    /**
     * Minimizes the given DFA.
     *
     * @param dfa
     *         the automaton to minimize. It may be partial, but must not contain nondeterministic choices.
     *
     * @return the minimal DFA and the equivalence classes
     *
     * @throws NotDeterministicException
     *         if a state has several targets for the same symbol
     * @throws IllegalArgumentException
     *         if the start state or a transition refers to an undeclared state or symbol
     */
    public static MinimizationResult run(Automaton dfa) {
        Preconditions.checkNotNull(dfa, "dfa");

        final List<String> states = new ArrayList<>(new LinkedHashSet<>(dfa.getStates()));
        final List<String> alphabet = new ArrayList<>(new LinkedHashSet<>(dfa.getAlphabet()));
        checkInput(dfa, states, alphabet);

        final DeterminismReport report = new FAClassifier().determinismReport(dfa);
        if (!report.isDeterministic()) {
            final List<String> violations = new ArrayList<>();
            for (Map.Entry<Pair<String, String>, ImmutableSet<String>> e : report.getNondeterministicChoices()
                                                                                 .entrySet()) {
                violations.add(e.getKey().getFirst() + " --" + e.getKey().getSecond() + "--> " + e.getValue());
            }
            throw new NotDeterministicException(violations);
        }

        final Map<String, Integer> index = new HashMap<>();
        for (int i = 0; i < states.size(); i++) {
            index.put(states.get(i), i);
        }

        final boolean partial = !report.isComplete();
        final int numStates = states.size();
        // the virtual sink, if any, gets the index numStates
        final int sink = partial ? numStates : UNDEFINED;
        final int[][] delta = buildTransitionTable(dfa, states, alphabet, index, sink);

        final List<Integer> accepting = new ArrayList<>();
        final List<Integer> rejecting = new ArrayList<>();
        for (int i = 0; i < delta.length; i++) {
            if (i < numStates && dfa.isFinal(states.get(i))) {
                accepting.add(i);
            } else {
                rejecting.add(i);
            }
        }

        final Partition<Integer> partition = refine(accepting, rejecting, delta, alphabet.size());

        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("Final partition of {} states{}: {}", numStates, partial ? " (with sink)" : "", partition);
        }

        return buildResult(dfa, states, alphabet, index, delta, partition, sink);
    }

    private static void checkInput(Automaton dfa, List<String> states, List<String> alphabet) {
        final Set<String> stateSet = new HashSet<>(states);
        final Set<String> symbolSet = new HashSet<>(alphabet);

        Preconditions.checkArgument(stateSet.contains(dfa.getStart()),
                                    "Start state '%s' is not a declared state",
                                    dfa.getStart());
        for (Transition t : dfa.getTransitions()) {
            Preconditions.checkArgument(stateSet.contains(t.getFrom()) && stateSet.contains(t.getTo()),
                                        "Transition %s refers to an undeclared state",
                                        t);
            Preconditions.checkArgument(symbolSet.contains(t.getSymbol()),
                                        "Transition %s uses an undeclared symbol",
                                        t);
        }
    }

    private static int[][] buildTransitionTable(Automaton dfa,
                                                List<String> states,
                                                List<String> alphabet,
                                                Map<String, Integer> index,
                                                int sink) {
        final int size = sink == UNDEFINED ? states.size() : states.size() + 1;
        final int[][] delta = new int[size][alphabet.size()];

        for (int i = 0; i < size; i++) {
            for (int a = 0; a < alphabet.size(); a++) {
                if (i == sink) {
                    delta[i][a] = sink;
                    continue;
                }
                final String succ = dfa.getSuccessor(states.get(i), alphabet.get(a));
                delta[i][a] = succ == null ? sink : index.get(succ);
            }
        }
        return delta;
    }

    private static Partition<Integer> refine(List<Integer> accepting,
                                             List<Integer> rejecting,
                                             int[][] delta,
                                             int numSymbols) {
        final List<List<Integer>> initial = new ArrayList<>(2);
        initial.add(accepting);
        initial.add(rejecting);
        final Partition<Integer> partition = new Partition<>(initial);

        final Deque<Block<Integer>> waiting = new ArrayDeque<>();
        if (!accepting.isEmpty()) {
            waiting.addLast(partition.getBlocks().get(0));
        }

        while (!waiting.isEmpty()) {
            final Block<Integer> splitter = waiting.pollLast();

            for (int a = 0; a < numSymbols; a++) {
                final Set<Integer> preImage = new HashSet<>();
                for (int i = 0; i < delta.length; i++) {
                    if (splitter.contains(delta[i][a])) {
                        preImage.add(i);
                    }
                }
                if (preImage.isEmpty()) {
                    continue;
                }

                for (Block<Integer> block : partition.getBlocks()) {
                    final Pair<Block<Integer>, Block<Integer>> split = partition.split(block, preImage);
                    if (split == null) {
                        continue;
                    }
                    final Block<Integer> in = split.getFirst();
                    final Block<Integer> out = split.getSecond();

                    if (waiting.removeFirstOccurrence(block)) {
                        waiting.addLast(in);
                        waiting.addLast(out);
                    } else if (in.size() <= out.size()) {
                        waiting.addLast(in);
                    } else {
                        waiting.addLast(out);
                    }
                }
            }
        }

        return partition;
    }

    private static MinimizationResult buildResult(Automaton dfa,
                                                  List<String> states,
                                                  List<String> alphabet,
                                                  Map<String, Integer> index,
                                                  int[][] delta,
                                                  Partition<Integer> partition,
                                                  int sink) {
        final Block<Integer> startBlock = partition.getBlock(index.get(dfa.getStart()));

        // states equivalent to the sink are dropped, unless the start state is one of them
        final List<Block<Integer>> blocks = new ArrayList<>();
        for (Block<Integer> b : partition.getBlocks()) {
            if (b == startBlock || !b.contains(sink)) {
                blocks.add(b);
            }
        }

        int startIdx = UNDEFINED;
        for (int i = 0; i < blocks.size(); i++) {
            if (blocks.get(i) == startBlock) {
                startIdx = i;
                break;
            }
        }

        final Map<Block<Integer>, String> labels = new HashMap<>();
        final String[] labelOrder = new String[blocks.size()];
        for (int i = 0; i < blocks.size(); i++) {
            final int number;
            if (i == startIdx) {
                number = 0;
            } else {
                number = i < startIdx ? i + 1 : i;
            }
            final String label = LABEL_PREFIX + number;
            labels.put(blocks.get(i), label);
            labelOrder[number] = label;
        }

        final Set<Transition> transitions = new LinkedHashSet<>();
        final Set<String> finalStates = new LinkedHashSet<>();
        final Map<String, ImmutableSet.Builder<String>> classes = new HashMap<>();
        final ImmutableMap.Builder<String, String> mapping = ImmutableMap.builder();

        for (Block<Integer> b : blocks) {
            final String label = labels.get(b);
            final ImmutableSet.Builder<String> members = ImmutableSet.builder();
            for (int s : b.getMembers()) {
                if (s == sink) {
                    continue;
                }
                final String original = states.get(s);
                members.add(original);
                if (dfa.isFinal(original)) {
                    finalStates.add(label);
                }
                for (int a = 0; a < alphabet.size(); a++) {
                    final int succ = delta[s][a];
                    final String target = succ == sink ? null : labels.get(partition.getBlock(succ));
                    if (target != null) {
                        transitions.add(Transition.of(label, alphabet.get(a), target));
                    }
                }
            }
            classes.put(label, members);
        }

        final Map<String, ImmutableSet<String>> orderedClasses = new LinkedHashMap<>();
        for (String label : labelOrder) {
            final ImmutableSet<String> members = classes.get(label).build();
            orderedClasses.put(label, members);
            for (String m : members) {
                mapping.put(m, label);
            }
        }

        final Automaton minimized = Automaton.builder()
                                             .states(labelOrder)
                                             .alphabet(alphabet)
                                             .transitions(transitions)
                                             .start(LABEL_PREFIX + 0)
                                             .finalStates(finalStates)
                                             .build();

        LOGGER.debug("Minimized {} states to {}", states.size(), minimized.size());

        return new MinimizationResult(minimized,
                                      ImmutableMap.copyOf(orderedClasses),
                                      mapping.build(),
                                      states.size());
    }
}
