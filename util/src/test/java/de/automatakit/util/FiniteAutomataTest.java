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

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import de.automatakit.analysis.DeterminismReport;
import de.automatakit.analysis.ValidationResult;
import de.automatakit.api.Automaton;
import de.automatakit.api.Classification;
import de.automatakit.examples.ExampleContainsAB;
import de.automatakit.examples.ExampleEvenOnes;
import de.automatakit.examples.ExamplePartialDFA;
import de.automatakit.examples.ExampleRedundantDFA;
import de.automatakit.examples.ExampleSuffix01;
import de.automatakit.examples.FAExample;
import de.automatakit.examples.RandomFAs;
import de.automatakit.exception.AutomatonParseException;
import de.automatakit.exception.SymbolNotInAlphabetException;
import de.automatakit.serialization.text.AutomatonTextParser;
import de.automatakit.serialization.text.ParseMode;
import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

public class FiniteAutomataTest {

    private static final List<String> BINARY = Arrays.asList("0", "1");

    private static final String WITHOUT_FINAL = "States: q0,q1\n" +
                                                "Alphabet: 0,1\n" +
                                                "Transitions:\n" +
                                                "q0,0,q0\n" +
                                                "q0,1,q1\n" +
                                                "q1,0,q1\n" +
                                                "q1,1,q0\n" +
                                                "Start: q0\n";

    @DataProvider(name = "examples")
    public Object[][] examples() {
        return new Object[][] {{ExampleEvenOnes.createExample()},
                               {ExampleSuffix01.createExample()},
                               {ExampleRedundantDFA.createExample()},
                               {ExampleContainsAB.createExample()},
                               {ExamplePartialDFA.createExample()}};
    }

    @Test(dataProvider = "examples")
    public void testExamples(FAExample example) {
        final Automaton reference = example.getReferenceAutomaton();
        final Automaton min = FiniteAutomata.toMinimalDFA(reference);

        Assert.assertTrue(FiniteAutomata.validate(reference).isValid(), example.getDescription());
        Assert.assertEquals(min.getAlphabet(), example.getAlphabet());
        Assert.assertTrue(LanguageEquivalence.areEquivalent(reference, min), example.getDescription());
        Assert.assertTrue(min.size() <= FiniteAutomata.toDFA(reference).size());
    }

    @Test
    public void testEvenOnes() throws AutomatonParseException {
        final Automaton a = FiniteAutomata.parse(ExampleEvenOnes.constructText());

        Assert.assertTrue(FiniteAutomata.validate(a).isValid());
        Assert.assertEquals(FiniteAutomata.classify(a), Classification.DFA);
        Assert.assertTrue(FiniteAutomata.simulate(a, "1010").isAccepted());
        Assert.assertFalse(FiniteAutomata.simulate(a, "111").isAccepted());
    }

    @Test
    public void testSuffix01() {
        final Automaton nfa = ExampleSuffix01.constructMachine();
        final Automaton dfa = FiniteAutomata.toDFA(nfa);

        Assert.assertEquals(FiniteAutomata.classify(nfa), Classification.NFA);
        Assert.assertEquals(FiniteAutomata.classify(dfa), Classification.DFA);
        Assert.assertEquals(dfa.size(), 3);
        Assert.assertTrue(LanguageEquivalence.areEquivalent(nfa, dfa));
    }

    @Test
    public void testRedundantDFA() {
        final Automaton min = FiniteAutomata.minimize(ExampleRedundantDFA.constructMachine());

        Assert.assertEquals(min.size(), 4);
        Assert.assertEquals(min.getStart(), "q0");
        Assert.assertTrue(LanguageEquivalence.areEquivalent(min, ExampleRedundantDFA.constructMachine()));
    }

    @Test
    public void testMissingFinalSection() throws AutomatonParseException {
        try {
            FiniteAutomata.parse(WITHOUT_FINAL);
            Assert.fail("expected a parse error");
        } catch (AutomatonParseException ex) {
            Assert.assertEquals(ex.getSection(), "Final");
        }

        final Automaton lenient = new AutomatonTextParser(ParseMode.LENIENT).parse(WITHOUT_FINAL);
        final ValidationResult result = FiniteAutomata.validate(lenient);

        Assert.assertTrue(lenient.getFinalStates().isEmpty());
        Assert.assertFalse(result.isValid());
        Assert.assertEquals(result.getErrors(),
                            Collections.singletonList("Automaton has no final states and rejects every input"));
    }

    @Test
    public void testSymbolNotInAlphabet() {
        try {
            FiniteAutomata.simulate(ExampleEvenOnes.constructMachine(), "102");
            Assert.fail("expected an exception");
        } catch (SymbolNotInAlphabetException ex) {
            Assert.assertEquals(ex.getSymbol(), "2");
        }
    }

    @Test
    public void testStructureWarnings() {
        final Automaton a = ExampleEvenOnes.constructMachine()
                                           .toBuilder()
                                           .addState("trap")
                                           .transition("trap", "0", "trap")
                                           .transition("trap", "1", "trap")
                                           .build();

        final ValidationResult result = FiniteAutomata.validate(a);

        Assert.assertTrue(result.isValid());
        Assert.assertEquals(result.getWarnings(),
                            Arrays.asList("States trap are unreachable from the start state",
                                          "States trap cannot reach any final state"));
    }

    @Test
    public void testToMinimalDFA() {
        final Automaton min = FiniteAutomata.toMinimalDFA(ExampleContainsAB.constructMachine());

        Assert.assertEquals(min.size(), 3);
        Assert.assertEquals(FiniteAutomata.classify(min), Classification.DFA);
        Assert.assertEquals(FiniteAutomata.toMinimalDFA(ExampleRedundantDFA.constructMachine()).size(), 4);
    }

    @Test
    public void testWriteParsesBack() throws AutomatonParseException {
        final Automaton min = FiniteAutomata.toMinimalDFA(ExampleContainsAB.constructMachine());

        Assert.assertEquals(FiniteAutomata.parse(FiniteAutomata.write(min)), min);
    }

    @Test
    public void testRandomAutomata() {
        final Random random = new Random(42);

        for (int i = 0; i < 50; i++) {
            final Automaton nfa = RandomFAs.randomNFA(random, 1 + random.nextInt(5), BINARY, 2);
            final Automaton dfa = FiniteAutomata.toDFA(nfa);
            final DeterminismReport report = FiniteAutomata.determinismReport(dfa);

            Assert.assertTrue(report.isDeterministic());
            if (report.isComplete()) {
                Assert.assertEquals(FiniteAutomata.classify(dfa), Classification.DFA);
            }
            Assert.assertTrue(dfa.size() <= 1 << nfa.size());
            Assert.assertTrue(LanguageEquivalence.areEquivalent(nfa, dfa), nfa.toString());

            final Automaton min = FiniteAutomata.minimize(dfa);
            Assert.assertEquals(min.getStart(), "q0");
            Assert.assertTrue(min.size() <= dfa.size());
            Assert.assertEquals(FiniteAutomata.minimize(min).size(), min.size());
            Assert.assertTrue(LanguageEquivalence.areEquivalent(dfa, min), dfa.toString());
        }
    }
}
