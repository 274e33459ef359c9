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
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import com.google.common.base.Joiner;
import de.automatakit.api.Automaton;
import de.automatakit.api.Transition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Structural checks of an {@link Automaton}. Every check is reported independently, so a single call lists all
 * problems at once. Validation never throws.
 */
public final class AutomatonValidator {

    private static final Logger LOGGER = LoggerFactory.getLogger(AutomatonValidator.class);

    private static final Joiner JOINER = Joiner.on(", ");

    private AutomatonValidator() {
        // prevent instantiation
    }

    public static ValidationResult validate(Automaton automaton) {
        final List<String> errors = new ArrayList<>();

        checkStates(automaton, errors);
        checkAlphabet(automaton, errors);
        checkStart(automaton, errors);
        checkFinalStates(automaton, errors);
        checkTransitions(automaton, errors);

        if (!errors.isEmpty()) {
            LOGGER.debug("Automaton has {} validation error(s): {}", errors.size(), errors);
        }

        return new ValidationResult(errors, new ArrayList<>());
    }

    private static void checkStates(Automaton automaton, List<String> errors) {
        if (automaton.getStates().isEmpty()) {
            errors.add("States must be a non-empty list");
            return;
        }
        final Set<String> duplicates = duplicates(automaton.getStates());
        if (!duplicates.isEmpty()) {
            errors.add("Duplicate states found: " + JOINER.join(duplicates));
        }
    }

    private static void checkAlphabet(Automaton automaton, List<String> errors) {
        if (automaton.getAlphabet().isEmpty()) {
            errors.add("Alphabet must be a non-empty list");
            return;
        }
        final Set<String> duplicates = duplicates(automaton.getAlphabet());
        if (!duplicates.isEmpty()) {
            errors.add("Duplicate symbols in alphabet: " + JOINER.join(duplicates));
        }
    }

    private static void checkStart(Automaton automaton, List<String> errors) {
        final String start = automaton.getStart();
        if (start.isEmpty()) {
            errors.add("Start state is required");
        } else if (!automaton.getStates().contains(start)) {
            errors.add("Start state '" + start + "' must be in the states set");
        }
    }

    private static void checkFinalStates(Automaton automaton, List<String> errors) {
        if (automaton.getFinalStates().isEmpty()) {
            errors.add("Automaton has no final states and rejects every input");
            return;
        }
        for (String f : automaton.getFinalStates()) {
            if (!automaton.getStates().contains(f)) {
                errors.add("Final state '" + f + "' is not in the states set");
            }
        }
    }

    private static void checkTransitions(Automaton automaton, List<String> errors) {
        final Set<String> states = new LinkedHashSet<>(automaton.getStates());
        final Set<String> alphabet = new LinkedHashSet<>(automaton.getAlphabet());

        for (Transition t : automaton.getTransitions()) {
            if (!states.contains(t.getFrom())) {
                errors.add("Transition source state '" + t.getFrom() + "' is not in states set");
            }
            if (!states.contains(t.getTo())) {
                errors.add("Transition target state '" + t.getTo() + "' is not in states set");
            }
            if (!alphabet.contains(t.getSymbol())) {
                errors.add("Transition symbol '" + t.getSymbol() + "' is not in alphabet");
            }
        }
    }

    private static Set<String> duplicates(List<String> values) {
        final Set<String> seen = new LinkedHashSet<>();
        final Set<String> result = new LinkedHashSet<>();
        for (String v : values) {
            if (!seen.add(v)) {
                result.add(v);
            }
        }
        return result;
    }
}
