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
package de.automatakit.util;

import de.automatakit.algorithm.determinization.DeterminizationResult;
import de.automatakit.algorithm.determinization.SubsetConstruction;
import de.automatakit.algorithm.minimization.MinimizationResult;
import de.automatakit.algorithm.minimization.PartitionRefinementMinimizer;
import de.automatakit.analysis.AutomatonValidator;
import de.automatakit.analysis.DeterminismReport;
import de.automatakit.analysis.FAClassifier;
import de.automatakit.analysis.StructureAnalyzer;
import de.automatakit.analysis.StructureReport;
import de.automatakit.analysis.ValidationResult;
import de.automatakit.api.Automaton;
import de.automatakit.api.Classification;
import de.automatakit.exception.AutomatonParseException;
import de.automatakit.serialization.text.AutomatonTextParser;
import de.automatakit.serialization.text.AutomatonTextWriter;
import de.automatakit.simulation.FASimulator;
import de.automatakit.simulation.SimulationResult;
import net.automatalib.words.Word;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Static entry points for the operations of this library, using the configured defaults.
 */
public final class FiniteAutomata {

    private static final Logger LOGGER = LoggerFactory.getLogger(FiniteAutomata.class);

    private FiniteAutomata() {
        // prevent instantiation
    }

    public static Automaton parse(String text) throws AutomatonParseException {
        return new AutomatonTextParser().parse(text);
    }

    public static String write(Automaton automaton) {
        return AutomatonTextWriter.write(automaton);
    }

    /**
     * Validates the automaton. If it is structurally valid, unreachable and dead states are reported as warnings.
     *
     * @param automaton
     *         the automaton to validate
     *
     * @return the validation result
     */
    public static ValidationResult validate(Automaton automaton) {
        final ValidationResult result = AutomatonValidator.validate(automaton);
        if (!result.isValid()) {
            return result;
        }
        return result.withWarnings(StructureAnalyzer.analyze(automaton).warnings());
    }

    public static Classification classify(Automaton automaton) {
        return new FAClassifier().classify(automaton);
    }

    public static DeterminismReport determinismReport(Automaton automaton) {
        return new FAClassifier().determinismReport(automaton);
    }

    public static StructureReport analyzeStructure(Automaton automaton) {
        return StructureAnalyzer.analyze(automaton);
    }

    public static SimulationResult simulate(Automaton automaton, String input) {
        return FASimulator.simulate(automaton, input);
    }

    public static SimulationResult simulate(Automaton automaton, Word<String> input) {
        return FASimulator.simulate(automaton, input);
    }

    public static Automaton toDFA(Automaton nfa) {
        return SubsetConstruction.determinize(nfa);
    }

    public static DeterminizationResult determinize(Automaton nfa) {
        return SubsetConstruction.run(nfa);
    }

    public static Automaton minimize(Automaton dfa) {
        return PartitionRefinementMinimizer.minimize(dfa);
    }

    public static MinimizationResult minimizeDetailed(Automaton dfa) {
        return PartitionRefinementMinimizer.run(dfa);
    }

    /**
     * Computes the minimal DFA of an arbitrary automaton, determinizing it first if it has nondeterministic choices.
     *
     * @param automaton
     *         the DFA or NFA
     *
     * @return the minimal DFA
     */
    public static Automaton toMinimalDFA(Automaton automaton) {
        final Automaton dfa;
        if (determinismReport(automaton).isDeterministic()) {
            dfa = automaton;
        } else {
            LOGGER.debug("Determinizing automaton with {} states before minimization", automaton.size());
            dfa = toDFA(automaton);
        }
        return minimize(dfa);
    }
}
