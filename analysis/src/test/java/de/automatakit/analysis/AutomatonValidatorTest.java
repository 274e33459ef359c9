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

import java.util.Arrays;
import java.util.Collections;

import de.automatakit.api.Automaton;
import de.automatakit.examples.ExampleEvenOnes;
import de.automatakit.examples.ExampleSuffix01;
import org.testng.Assert;
import org.testng.annotations.Test;

public class AutomatonValidatorTest {

    @Test
    public void testValidAutomata() {
        final ValidationResult dfa = AutomatonValidator.validate(ExampleEvenOnes.constructMachine());
        final ValidationResult nfa = AutomatonValidator.validate(ExampleSuffix01.constructMachine());

        Assert.assertTrue(dfa.isValid());
        Assert.assertTrue(dfa.getErrors().isEmpty());
        Assert.assertTrue(dfa.getWarnings().isEmpty());
        Assert.assertTrue(nfa.isValid());
    }

    @Test
    public void testMissingFinalStates() {
        final Automaton a = ExampleEvenOnes.constructMachine().toBuilder().finalStates().build();
        final ValidationResult result = AutomatonValidator.validate(a);

        Assert.assertFalse(result.isValid());
        Assert.assertEquals(result.getErrors(),
                            Collections.singletonList("Automaton has no final states and rejects every input"));
    }

    @Test
    public void testEmptyAutomaton() {
        final ValidationResult result = AutomatonValidator.validate(Automaton.builder().build());

        Assert.assertEquals(result.getErrors(),
                            Arrays.asList("States must be a non-empty list",
                                          "Alphabet must be a non-empty list",
                                          "Start state is required",
                                          "Automaton has no final states and rejects every input"));
    }

    @Test
    public void testUndeclaredReferences() {
        // @formatter:off
        final Automaton a = Automaton.builder()
                                     .states("q0")
                                     .alphabet("a")
                                     .transition("q0", "b", "q9")
                                     .transition("q8", "a", "q0")
                                     .start("q5")
                                     .finalStates("q0", "q7")
                                     .build();
        // @formatter:on

        final ValidationResult result = AutomatonValidator.validate(a);

        Assert.assertEquals(result.getErrors(),
                            Arrays.asList("Start state 'q5' must be in the states set",
                                          "Final state 'q7' is not in the states set",
                                          "Transition target state 'q9' is not in states set",
                                          "Transition symbol 'b' is not in alphabet",
                                          "Transition source state 'q8' is not in states set"));
    }

    @Test
    public void testDuplicates() {
        // @formatter:off
        final Automaton a = Automaton.builder()
                                     .states("q0", "q1", "q0")
                                     .alphabet("a", "a", "b")
                                     .start("q0")
                                     .finalStates("q1")
                                     .build();
        // @formatter:on

        final ValidationResult result = AutomatonValidator.validate(a);

        Assert.assertEquals(result.getErrors(),
                            Arrays.asList("Duplicate states found: q0", "Duplicate symbols in alphabet: a"));
    }

    @Test
    public void testWarningsDoNotAffectValidity() {
        final ValidationResult result = AutomatonValidator.validate(ExampleEvenOnes.constructMachine())
                                                          .withWarnings(Collections.singletonList("careful"));

        Assert.assertTrue(result.isValid());
        Assert.assertEquals(result.getWarnings(), Collections.singletonList("careful"));
    }
}
