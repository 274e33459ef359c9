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

import java.util.ArrayList;
import java.util.List;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;

/**
 * Graph properties of an automaton, computed by {@link StructureAnalyzer}.
 */
public final class StructureReport {

    private static final Joiner JOINER = Joiner.on(", ");

    private final ImmutableList<String> reachableStates;
    private final ImmutableList<String> unreachableStates;
    private final ImmutableList<String> deadStates;
    private final int selfLoopCount;
    private final boolean hasReachableCycle;
    private final boolean acceptsEmptyWord;
    private final double transitionDensity;

    StructureReport(ImmutableList<String> reachableStates,
                    ImmutableList<String> unreachableStates,
                    ImmutableList<String> deadStates,
                    int selfLoopCount,
                    boolean hasReachableCycle,
                    boolean acceptsEmptyWord,
                    double transitionDensity) {
        this.reachableStates = reachableStates;
        this.unreachableStates = unreachableStates;
        this.deadStates = deadStates;
        this.selfLoopCount = selfLoopCount;
        this.hasReachableCycle = hasReachableCycle;
        this.acceptsEmptyWord = acceptsEmptyWord;
        this.transitionDensity = transitionDensity;
    }

    /**
     * The states reachable from the start state, in breadth-first order.
     *
     * @return the reachable states
     */
    public ImmutableList<String> getReachableStates() {
        return reachableStates;
    }

    public ImmutableList<String> getUnreachableStates() {
        return unreachableStates;
    }

    /**
     * The declared states from which no final state can be reached.
     *
     * @return the dead states, in declaration order
     */
    public ImmutableList<String> getDeadStates() {
        return deadStates;
    }

    public int getSelfLoopCount() {
        return selfLoopCount;
    }

    /**
     * Whether a cycle can be entered from the start state. An automaton without a reachable cycle accepts a finite
     * language.
     *
     * @return {@code true} if a reachable cycle exists
     */
    public boolean hasReachableCycle() {
        return hasReachableCycle;
    }

    public boolean acceptsEmptyWord() {
        return acceptsEmptyWord;
    }

    /**
     * Number of transitions relative to {@code |states| * |alphabet|}, in percent.
     *
     * @return the transition density
     */
    public double getTransitionDensity() {
        return transitionDensity;
    }

    /**
     * Describes unreachable and dead states as human-readable warnings, e.g. for
     * {@link ValidationResult#withWarnings(java.util.Collection)}.
     *
     * @return the warnings, empty if there are neither unreachable nor dead states
     */
    public List<String> warnings() {
        final List<String> result = new ArrayList<>(2);
        if (!unreachableStates.isEmpty()) {
            result.add("States " + JOINER.join(unreachableStates) + " are unreachable from the start state");
        }
        if (!deadStates.isEmpty()) {
            result.add("States " + JOINER.join(deadStates) + " cannot reach any final state");
        }
        return result;
    }

    @Override
    public String toString() {
        return "StructureReport{reachable=" + reachableStates + ", unreachable=" + unreachableStates + ", dead=" +
               deadStates + ", selfLoops=" + selfLoopCount + ", cycle=" + hasReachableCycle + ", acceptsEmpty=" +
               acceptsEmptyWord + ", density=" + transitionDensity + '}';
    }
}
