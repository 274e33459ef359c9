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

import java.io.IOException;
import java.io.UncheckedIOException;

import com.google.common.base.Joiner;
import de.automatakit.api.Automaton;
import de.automatakit.api.Transition;

/**
 * Renders an {@link Automaton} in the format read by {@link AutomatonTextParser}. Sections are written in the order
 * {@code States}, {@code Alphabet}, {@code Transitions}, {@code Start}, {@code Final}.
 */
public final class AutomatonTextWriter {

    private static final Joiner LIST_JOINER = Joiner.on(',');

    private AutomatonTextWriter() {
        // prevent instantiation
    }

    public static String write(Automaton automaton) {
        final StringBuilder sb = new StringBuilder();
        try {
            write(automaton, sb);
        } catch (IOException ex) {
            // StringBuilder does not throw
            throw new UncheckedIOException(ex);
        }
        return sb.toString();
    }

    public static void write(Automaton automaton, Appendable out) throws IOException {
        writeList(out, Section.STATES, LIST_JOINER.join(automaton.getStates()));
        writeList(out, Section.ALPHABET, LIST_JOINER.join(automaton.getAlphabet()));
        out.append(Section.TRANSITIONS.getPrefix()).append('\n');
        for (Transition t : automaton.getTransitions()) {
            out.append(t.getFrom()).append(',').append(t.getSymbol()).append(',').append(t.getTo()).append('\n');
        }
        writeList(out, Section.START, automaton.getStart());
        writeList(out, Section.FINAL, LIST_JOINER.join(automaton.getFinalStates()));
    }

    private static void writeList(Appendable out, Section section, String value) throws IOException {
        out.append(section.getPrefix());
        if (!value.isEmpty()) {
            out.append(' ').append(value);
        }
        out.append('\n');
    }
}
