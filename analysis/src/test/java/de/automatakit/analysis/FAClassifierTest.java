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

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import de.automatakit.api.Automaton;
import de.automatakit.api.Classification;
import de.automatakit.api.Transition;
import de.automatakit.examples.ExampleEvenOnes;
import de.automatakit.examples.ExamplePartialDFA;
import de.automatakit.examples.ExampleSuffix01;
import net.automatalib.commons.util.Pair;
import org.testng.Assert;
import org.testng.annotations.Test;

public class FAClassifierTest {

    private final FAClassifier classifier = new FAClassifier(FAClassifier.DEFAULT_EPSILON_SYMBOLS);

    @Test
    public void testCompleteDFA() {
        final DeterminismReport report = classifier.determinismReport(ExampleEvenOnes.constructMachine());

        Assert.assertEquals(report.getClassification(), Classification.DFA);
        Assert.assertTrue(report.isComplete());
        Assert.assertTrue(report.isDeterministic());
        Assert.assertEquals(report.getPresentPairs(), 4);
        Assert.assertEquals(report.getRequiredPairs(), 4);
        Assert.assertEquals(report.getCompletenessPercentage(), 100.0, 1e-9);
    }

    @Test
    public void testNFA() {
        final DeterminismReport report = classifier.determinismReport(ExampleSuffix01.constructMachine());

        Assert.assertEquals(report.getClassification(), Classification.NFA);
        Assert.assertEquals(report.getMissingTransitions(),
                            Arrays.asList(Pair.of("q1", "0"), Pair.of("q2", "0"), Pair.of("q2", "1")));
        Assert.assertEquals(report.getNondeterministicChoices(),
                            ImmutableMap.of(Pair.of("q0", "0"), ImmutableSet.of("q0", "q1")));
        Assert.assertEquals(report.getPresentPairs(), 3);
        Assert.assertEquals(report.getRequiredPairs(), 6);
        Assert.assertEquals(report.getCompletenessPercentage(), 50.0, 1e-9);
        Assert.assertEquals(classifier.classify(ExampleSuffix01.constructMachine()), Classification.NFA);
    }

    @Test
    public void testPartialButDeterministic() {
        final DeterminismReport report = classifier.determinismReport(ExamplePartialDFA.constructMachine());

        Assert.assertEquals(report.getClassification(), Classification.NFA);
        Assert.assertTrue(report.isDeterministic());
        Assert.assertFalse(report.isComplete());
        Assert.assertEquals(report.getPresentPairs(), 4);
        Assert.assertEquals(report.getRequiredPairs(), 12);
    }

    @Test
    public void testDuplicateTransitionIsNotAChoice() {
        // @formatter:off
        final Automaton a = Automaton.builder()
                                     .states("q0")
                                     .alphabet("a")
                                     .transition("q0", "a", "q0")
                                     .transition("q0", "a", "q0")
                                     .start("q0")
                                     .finalStates("q0")
                                     .build();
        // @formatter:on

        Assert.assertEquals(classifier.classify(a), Classification.DFA);
    }

    @Test
    public void testEmptyAutomatonIsVacuouslyDeterministic() {
        final DeterminismReport report = classifier.determinismReport(Automaton.builder().build());

        Assert.assertEquals(report.getClassification(), Classification.DFA);
        Assert.assertEquals(report.getRequiredPairs(), 0);
        Assert.assertEquals(report.getCompletenessPercentage(), 100.0, 1e-9);
    }

    @Test
    public void testEpsilonTransitionsAreReported() {
        // @formatter:off
        final Automaton a = ExampleEvenOnes.constructMachine()
                                           .toBuilder()
                                           .transition("q0", "ε", "q1")
                                           .transition("q1", "λ", "q0")
                                           .build();
        // @formatter:on

        final DeterminismReport report = classifier.determinismReport(a);
        Assert.assertTrue(report.hasEpsilonTransitions());
        Assert.assertEquals(report.getEpsilonTransitions(), Collections.singletonList(Transition.of("q0", "ε", "q1")));
        // epsilon symbols are not part of the alphabet, so the classification is unaffected
        Assert.assertEquals(report.getClassification(), Classification.DFA);

        final FAClassifier lambda = new FAClassifier(Collections.singleton("λ"));
        Assert.assertEquals(lambda.determinismReport(a).getEpsilonTransitions(),
                            Collections.singletonList(Transition.of("q1", "λ", "q0")));
    }

    @Test
    public void testDefaultEpsilonSymbols() {
        Assert.assertEquals(new FAClassifier().getEpsilonSymbols(), ImmutableSet.of("", "ε", "epsilon"));
    }
}
