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

import com.google.common.collect.ImmutableSet;
import net.automatalib.words.Word;

/**
 * The result of {@link FASimulator simulating} an automaton on an input word.
 */
public final class SimulationResult {

    private final Word<String> input;
    private final ImmutableSet<String> finalActiveStates;
    private final ExecutionTrace trace;

    SimulationResult(Word<String> input, ImmutableSet<String> finalActiveStates, ExecutionTrace trace) {
        this.input = input;
        this.finalActiveStates = finalActiveStates;
        this.trace = trace;
    }

    public boolean isAccepted() {
        return trace.getVerdict() == Verdict.ACCEPT;
    }

    public Word<String> getInput() {
        return input;
    }

    /**
     * The states active after the last consumed symbol; empty if the simulation halted early.
     *
     * @return the final active states
     */
    public ImmutableSet<String> getFinalActiveStates() {
        return finalActiveStates;
    }

    public ExecutionTrace getTrace() {
        return trace;
    }

    @Override
    public String toString() {
        return "SimulationResult{input=" + input + ", verdict=" + trace.getVerdict() + ", active=" +
               finalActiveStates + '}';
    }
}
