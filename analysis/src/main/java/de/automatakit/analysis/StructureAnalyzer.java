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

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

import com.google.common.collect.HashMultimap;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.SetMultimap;
import de.automatakit.api.Automaton;
import de.automatakit.api.Transition;

/**
 * Computes reachability, liveness and a few other graph properties of an automaton. Transition symbols are ignored,
 * the automaton is treated as a directed graph over its states.
 */
public final class StructureAnalyzer {

    private StructureAnalyzer() {
        // prevent instantiation
    }

    public static StructureReport analyze(Automaton automaton) {
        final Set<String> reachable = reachableStates(automaton);
        final Set<String> live = liveStates(automaton);

        final ImmutableList.Builder<String> unreachable = ImmutableList.builder();
        final ImmutableList.Builder<String> dead = ImmutableList.builder();
        for (String s : new LinkedHashSet<>(automaton.getStates())) {
            if (!reachable.contains(s)) {
                unreachable.add(s);
            }
            if (!live.contains(s)) {
                dead.add(s);
            }
        }

        int selfLoops = 0;
        for (Transition t : automaton.getTransitions()) {
            if (t.isSelfLoop()) {
                selfLoops++;
            }
        }

        final int numStates = new LinkedHashSet<>(automaton.getStates()).size();
        final int numSymbols = new LinkedHashSet<>(automaton.getAlphabet()).size();
        final double density =
                numStates * numSymbols == 0 ? 0.0 : automaton.getTransitions().size() * 100.0 / (numStates * numSymbols);

        return new StructureReport(ImmutableList.copyOf(reachable),
                                   unreachable.build(),
                                   dead.build(),
                                   selfLoops,
                                   hasReachableCycle(automaton),
                                   automaton.isFinal(automaton.getStart()),
                                   density);
    }

    private static Set<String> reachableStates(Automaton automaton) {
        final Set<String> visited = new LinkedHashSet<>();
        if (automaton.getStart().isEmpty()) {
            return visited;
        }

        final Deque<String> queue = new ArrayDeque<>();
        visited.add(automaton.getStart());
        queue.add(automaton.getStart());

        while (!queue.isEmpty()) {
            final String current = queue.poll();
            for (Transition t : automaton.getTransitionsFrom(current)) {
                if (visited.add(t.getTo())) {
                    queue.add(t.getTo());
                }
            }
        }
        return visited;
    }

    // backwards search from the final states
    private static Set<String> liveStates(Automaton automaton) {
        final SetMultimap<String, String> predecessors = HashMultimap.create();
        for (Transition t : automaton.getTransitions()) {
            predecessors.put(t.getTo(), t.getFrom());
        }

        final Set<String> visited = new LinkedHashSet<>(automaton.getFinalStates());
        final Deque<String> queue = new ArrayDeque<>(visited);

        while (!queue.isEmpty()) {
            final String current = queue.poll();
            for (String p : predecessors.get(current)) {
                if (visited.add(p)) {
                    queue.add(p);
                }
            }
        }
        return visited;
    }

    private static boolean hasReachableCycle(Automaton automaton) {
        if (automaton.getStart().isEmpty()) {
            return false;
        }

        // iterative DFS, a state maps to TRUE while its successors are being explored
        final Map<String, Boolean> onStack = new HashMap<>();
        final Deque<Frame> stack = new ArrayDeque<>();
        onStack.put(automaton.getStart(), Boolean.TRUE);
        stack.push(new Frame(automaton, automaton.getStart()));

        while (!stack.isEmpty()) {
            final Frame top = stack.peek();
            if (top.next < top.transitions.size()) {
                final String succ = top.transitions.get(top.next++).getTo();
                final Boolean status = onStack.get(succ);
                if (status == null) {
                    onStack.put(succ, Boolean.TRUE);
                    stack.push(new Frame(automaton, succ));
                } else if (status) {
                    return true;
                }
            } else {
                onStack.put(top.state, Boolean.FALSE);
                stack.pop();
            }
        }
        return false;
    }

    private static final class Frame {

        private final String state;
        private final ImmutableList<Transition> transitions;
        private int next;

        Frame(Automaton automaton, String state) {
            this.state = state;
            this.transitions = automaton.getTransitionsFrom(state);
        }
    }
}
