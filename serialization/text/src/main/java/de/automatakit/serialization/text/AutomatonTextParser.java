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

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import com.google.common.base.Preconditions;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import de.automatakit.api.Automaton;
import de.automatakit.api.Transition;
import de.automatakit.exception.AutomatonParseException;
import de.automatakit.setting.AutomataKitProperty;
import de.automatakit.setting.AutomataKitSettings;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses the line-oriented automaton format:
 * <pre>
 * States: q0,q1,q2
 * Alphabet: 0,1
 * Transitions:
 * q0,0,q1
 * q0,1,q0
 * q1,0,q2
 * Start: q0
 * Final: q2
 * </pre>
 * Sections may appear in any order and are recognized by their literal prefix. The {@code Transitions:} section
 * extends up to the next {@code Start:} or {@code Final:} line; each non-blank line in between is one
 * {@code from,symbol,to} triple. Lists are comma-separated, surrounding whitespace is ignored.
 * <p>
 * The parser does not check the automaton for consistency (see the validator for that). Instances are immutable and
 * thread-safe.
 */
public final class AutomatonTextParser {

    private static final Logger LOGGER = LoggerFactory.getLogger(AutomatonTextParser.class);

    private static final Splitter LINE_SPLITTER = Splitter.onPattern("\r?\n");
    private static final Splitter LIST_SPLITTER = Splitter.on(',').trimResults().omitEmptyStrings();
    private static final Splitter TRIPLE_SPLITTER = Splitter.on(',').trimResults();

    private static final String EXPECTED_FORMAT = "Expected format:\n" +
                                                  "States: q0,q1,q2\n" +
                                                  "Alphabet: 0,1\n" +
                                                  "Transitions:\n" +
                                                  "q0,0,q1\n" +
                                                  "q0,1,q0\n" +
                                                  "q1,0,q2\n" +
                                                  "q1,1,q0\n" +
                                                  "Start: q0\n" +
                                                  "Final: q2";

    private final ParseMode mode;

    /**
     * Creates a parser using the configured {@link AutomataKitProperty#PARSER_MODE mode}.
     */
    public AutomatonTextParser() {
        this(defaultMode());
    }

    public AutomatonTextParser(ParseMode mode) {
        this.mode = Preconditions.checkNotNull(mode);
    }

    public static ParseMode defaultMode() {
        return AutomataKitSettings.getInstance()
                                  .getEnumValue(AutomataKitProperty.PARSER_MODE, ParseMode.class, ParseMode.STRICT);
    }

    /**
     * An example of the accepted format, suitable for showing to users after a parse error.
     *
     * @return the example text
     */
    public static String expectedFormat() {
        return EXPECTED_FORMAT;
    }

    public ParseMode getMode() {
        return mode;
    }

    public Automaton parse(String text) throws AutomatonParseException {
        return parseDetailed(text).getAutomaton();
    }

    /**
     * Parses the given text and additionally reports transition lines that were skipped.
     *
     * @param text
     *         the automaton description
     *
     * @return the parsed automaton and the skipped lines (always empty in {@link ParseMode#STRICT strict} mode)
     *
     * @throws AutomatonParseException
     *         in strict mode, if a section is missing or a transition line is malformed
     */
    public ParsedAutomaton parseDetailed(String text) throws AutomatonParseException {
        Preconditions.checkNotNull(text, "text");

        final Set<Section> seen = EnumSet.noneOf(Section.class);
        final List<Transition> transitions = new ArrayList<>();
        final ImmutableList.Builder<String> skipped = ImmutableList.builder();

        List<String> states = Collections.emptyList();
        List<String> alphabet = Collections.emptyList();
        List<String> finalStates = Collections.emptyList();
        String start = "";

        boolean inTransitions = false;
        int lineNumber = 0;

        for (String rawLine : LINE_SPLITTER.split(text)) {
            lineNumber++;
            final String line = rawLine.trim();
            if (line.isEmpty()) {
                continue;
            }

            final Section section = sectionOf(line);
            if (section == null) {
                if (inTransitions) {
                    addTransition(line, lineNumber, transitions, skipped);
                } else {
                    LOGGER.debug("Ignoring line {} outside of any section: '{}'", lineNumber, line);
                }
                continue;
            }

            seen.add(section);
            final String remainder = section.remainder(line).trim();

            switch (section) {
                case STATES:
                    states = LIST_SPLITTER.splitToList(remainder);
                    break;
                case ALPHABET:
                    alphabet = LIST_SPLITTER.splitToList(remainder);
                    break;
                case TRANSITIONS:
                    inTransitions = true;
                    if (!remainder.isEmpty()) {
                        addTransition(remainder, lineNumber, transitions, skipped);
                    }
                    break;
                case START:
                    inTransitions = false;
                    start = remainder;
                    break;
                case FINAL:
                    inTransitions = false;
                    finalStates = LIST_SPLITTER.splitToList(remainder);
                    break;
                default:
                    throw new IllegalStateException("Unhandled section " + section);
            }
        }

        for (Section s : Section.values()) {
            if (!seen.contains(s)) {
                if (mode == ParseMode.STRICT) {
                    throw AutomatonParseException.missingSection(s.getLabel());
                }
                LOGGER.warn("Missing section '{}', using an empty value", s.getPrefix());
            }
        }

        final Automaton automaton = new Automaton(states, alphabet, transitions, start, finalStates);
        return new ParsedAutomaton(automaton, skipped.build());
    }

    private void addTransition(String line,
                               int lineNumber,
                               List<Transition> transitions,
                               ImmutableList.Builder<String> skipped) throws AutomatonParseException {
        final List<String> tokens = TRIPLE_SPLITTER.splitToList(line);
        if (tokens.size() == 3 && !tokens.get(0).isEmpty() && !tokens.get(1).isEmpty() && !tokens.get(2).isEmpty()) {
            transitions.add(new Transition(tokens.get(0), tokens.get(1), tokens.get(2)));
            return;
        }

        if (mode == ParseMode.STRICT) {
            throw AutomatonParseException.malformedTransition(line, lineNumber);
        }
        LOGGER.warn("Skipping malformed transition in line {}: '{}'", lineNumber, line);
        skipped.add(line);
    }

    private static @Nullable Section sectionOf(String line) {
        for (Section s : Section.values()) {
            if (s.introduces(line)) {
                return s;
            }
        }
        return null;
    }
}
