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

import java.util.Objects;

import com.google.common.collect.ImmutableSet;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A single step of an {@link ExecutionTrace}.
 */
public final class TraceStep {

    private final int index;
    private final @Nullable String symbol;
    private final ImmutableSet<String> activeBefore;
    private final ImmutableSet<String> activeAfter;
    private final @Nullable Verdict verdict;

    TraceStep(int index,
              @Nullable String symbol,
              ImmutableSet<String> activeBefore,
              ImmutableSet<String> activeAfter,
              @Nullable Verdict verdict) {
        this.index = index;
        this.symbol = symbol;
        this.activeBefore = activeBefore;
        this.activeAfter = activeAfter;
        this.verdict = verdict;
    }

    static TraceStep initial(ImmutableSet<String> active) {
        return new TraceStep(0, null, active, active, null);
    }

    TraceStep withVerdict(Verdict v) {
        return new TraceStep(index, symbol, activeBefore, activeAfter, v);
    }

    public int getIndex() {
        return index;
    }

    public boolean isInitial() {
        return symbol == null;
    }

    /**
     * The symbol consumed in this step.
     *
     * @return the symbol, or {@code null} for the initial step
     */
    public @Nullable String getSymbol() {
        return symbol;
    }

    public ImmutableSet<String> getActiveBefore() {
        return activeBefore;
    }

    public ImmutableSet<String> getActiveAfter() {
        return activeAfter;
    }

    /**
     * The verdict, which is only present on the last step of a trace.
     *
     * @return the verdict, or {@code null} if this is not the last step
     */
    public @Nullable Verdict getVerdict() {
        return verdict;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        TraceStep that = (TraceStep) o;
        return index == that.index && Objects.equals(symbol, that.symbol) && activeBefore.equals(that.activeBefore) &&
               activeAfter.equals(that.activeAfter) && verdict == that.verdict;
    }

    @Override
    public int hashCode() {
        return Objects.hash(index, symbol, activeBefore, activeAfter, verdict);
    }

    @Override
    public String toString() {
        final StringBuilder sb = new StringBuilder();
        sb.append(index).append(": ");
        if (symbol == null) {
            sb.append("start ").append(activeAfter);
        } else {
            sb.append(activeBefore).append(" --").append(symbol).append("--> ").append(activeAfter);
        }
        if (verdict != null) {
            sb.append(' ').append(verdict);
        }
        return sb.toString();
    }
}
