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

import java.util.List;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The step-by-step record of a simulation. The first step is the initial configuration, each further step consumes
 * one symbol. The last step carries the {@link Verdict}.
 */
public final class ExecutionTrace {

    private final ImmutableList<TraceStep> steps;
    private final int inputLength;

    ExecutionTrace(List<TraceStep> steps, int inputLength) {
        Preconditions.checkArgument(!steps.isEmpty(), "a trace has at least the initial step");
        this.steps = ImmutableList.copyOf(steps);
        this.inputLength = inputLength;
    }

    public ImmutableList<TraceStep> getSteps() {
        return steps;
    }

    public TraceStep getLastStep() {
        return steps.get(steps.size() - 1);
    }

    public Verdict getVerdict() {
        final @Nullable Verdict verdict = getLastStep().getVerdict();
        Preconditions.checkState(verdict != null, "last step has no verdict");
        return verdict;
    }

    public int getConsumedSymbols() {
        return steps.size() - 1;
    }

    public int getInputLength() {
        return inputLength;
    }

    /**
     * Whether the simulation stopped before the end of the input because no state was active anymore.
     *
     * @return {@code true} if part of the input was not consumed
     */
    public boolean haltedEarly() {
        return getConsumedSymbols() < inputLength;
    }

    @Override
    public String toString() {
        final StringBuilder sb = new StringBuilder();
        for (TraceStep step : steps) {
            sb.append(step).append('\n');
        }
        if (haltedEarly()) {
            sb.append("halted after ").append(getConsumedSymbols()).append(" of ").append(inputLength).append(" symbols\n");
        }
        return sb.toString();
    }
}
