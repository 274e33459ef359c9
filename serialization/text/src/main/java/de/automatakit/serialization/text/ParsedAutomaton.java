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
package de.automatakit.serialization.text;

import com.google.common.collect.ImmutableList;
import de.automatakit.api.Automaton;

/**
 * The result of a detailed parse: the automaton plus the transition lines that were skipped in
 * {@link ParseMode#LENIENT lenient} mode.
 */
public final class ParsedAutomaton {

    private final Automaton automaton;
    private final ImmutableList<String> skippedLines;

    ParsedAutomaton(Automaton automaton, ImmutableList<String> skippedLines) {
        this.automaton = automaton;
        this.skippedLines = skippedLines;
    }

    public Automaton getAutomaton() {
        return automaton;
    }

    public ImmutableList<String> getSkippedLines() {
        return skippedLines;
    }

    public boolean hasSkippedLines() {
        return !skippedLines.isEmpty();
    }
}
