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
package de.automatakit.algorithm.minimization;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import de.automatakit.analysis.FAClassifier;
import de.automatakit.api.Automaton;
import de.automatakit.api.Classification;
import de.automatakit.api.Transition;
import de.automatakit.examples.ExampleEvenOnes;
import de.automatakit.examples.ExamplePartialDFA;
import de.automatakit.examples.ExampleRedundantDFA;
import de.automatakit.examples.ExampleSuffix01;
import de.automatakit.examples.RandomFAs;
import de.automatakit.examples.Words;
import de.automatakit.exception.NotDeterministicException;
import de.automatakit.simulation.FASimulator;
import net.automatalib.words.Word;
import org.testng.Assert;
import org.testng.annotations.Test;

public class PartitionRefinementMinimizerTest {

    private static final List<String> BINARY = Arrays.asList("0", "1");

    @Test
    public void testRedundantDFA() {
        final MinimizationResult result = PartitionRefinementMinimizer.run(ExampleRedundantDFA.constructMachine());
        final Automaton min = result.getMinimized();

        Assert.assertEquals(min.getStates(), Arrays.asList("q0", "q1", "q2", "q3"));
        Assert.assertEquals(min.getStart(), "q0");
        Assert.assertEquals(min.getFinalStates(), ImmutableSet.of("q1"));
        Assert.assertEquals(min.getTransitions(),
                            Arrays.asList(Transition.of("q1", "0", "q1"),
                                          Transition.of("q1", "1", "q1"),
                                          Transition.of("q2", "0", "q1"),
                                          Transition.of("q2", "1", "q3"),
                                          Transition.of("q3", "0", "q2"),
                                          Transition.of("q3", "1", "q1"),
                                          Transition.of("q0", "0", "q2"),
                                          Transition.of("q0", "1", "q3")));

        Assert.assertEquals(result.getEquivalenceClasses(),
                            ImmutableMap.of("q0", ImmutableSet.of("q0"),
                                            "q1", ImmutableSet.of("q3", "q4"),
                                            "q2", ImmutableSet.of("q1"),
                                            "q3", ImmutableSet.of("q2")));
        Assert.assertEquals(result.getStateMapping().get("q4"), "q1");
        Assert.assertEquals(result.getOriginalStateCount(), 5);
        Assert.assertEquals(result.getStatesReduced(), 1);
        Assert.assertEquals(result.getReductionPercentage(), 20.0, 1e-9);
        Assert.assertFalse(result.isAlreadyMinimal());
        Assert.assertEquals(new FAClassifier().classify(min), Classification.DFA);
    }

    @Test
    public void testAlreadyMinimal() {
        final MinimizationResult result = PartitionRefinementMinimizer.run(ExampleEvenOnes.constructMachine());

        Assert.assertTrue(result.isAlreadyMinimal());
        Assert.assertEquals(result.getMinimized().size(), 2);
        Assert.assertEquals(result.getReductionPercentage(), 0.0, 1e-9);
    }

    @Test
    public void testPartialDFA() {
        final Automaton min = PartitionRefinementMinimizer.minimize(ExamplePartialDFA.constructMachine());

        Assert.assertEquals(min.getStates(), Arrays.asList("q0", "q1", "q2"));
        Assert.assertEquals(min.getFinalStates(), ImmutableSet.of("q1"));
        Assert.assertEquals(min.getTransitions(),
                            Arrays.asList(Transition.of("q2", "b", "q1"),
                                          Transition.of("q0", "a", "q2"),
                                          Transition.of("q0", "c", "q2")));

        // accepts exactly ab and cb
        for (Word<String> w : Words.allWords(Arrays.asList("a", "b", "c"), 4)) {
            final boolean expected = w.size() == 2 && !"b".equals(w.getSymbol(0)) && "b".equals(w.getSymbol(1));
            Assert.assertEquals(FASimulator.simulate(min, w).isAccepted(), expected, w.toString());
        }
    }

    @Test
    public void testPartialStatesAreNotMergedWithLiveOnes() {
        // z1 has an a-transition into the b-accepting states, z2 has none; they must stay apart
        // @formatter:off
        final Automaton dfa = Automaton.builder()
                                       .states("z1", "z2", "d1", "d2", "d3", "f")
                                       .alphabet("a", "b")
                                       .transition("z1", "a", "d1")
                                       .transition("d1", "b", "f")
                                       .transition("d2", "b", "f")
                                       .transition("d3", "b", "f")
                                       .start("z1")
                                       .finalStates("f")
                                       .build();
        // @formatter:on

        final Automaton min = PartitionRefinementMinimizer.minimize(dfa);

        Assert.assertTrue(FASimulator.simulate(min, "ab").isAccepted());
        // z2 behaves like a missing transition and is dropped
        Assert.assertEquals(min.size(), 3);
    }

    @Test
    public void testStatesEquivalentToMissingTransitionsAreDropped() {
        // @formatter:off
        final Automaton dfa = Automaton.builder()
                                       .states("s", "x", "dead")
                                       .alphabet("a", "b")
                                       .transition("s", "a", "x")
                                       .transition("s", "b", "dead")
                                       .transition("dead", "a", "dead")
                                       .start("s")
                                       .finalStates("x")
                                       .build();
        // @formatter:on

        final MinimizationResult result = PartitionRefinementMinimizer.run(dfa);
        final Automaton min = result.getMinimized();

        Assert.assertEquals(min.getStates(), Arrays.asList("q0", "q1"));
        Assert.assertEquals(min.getFinalStates(), ImmutableSet.of("q1"));
        Assert.assertEquals(min.getTransitions(), Collections.singletonList(Transition.of("q0", "a", "q1")));
        Assert.assertEquals(result.getEquivalenceClasses(),
                            ImmutableMap.of("q0", ImmutableSet.of("s"), "q1", ImmutableSet.of("x")));
        Assert.assertFalse(result.getStateMapping().containsKey("dead"));
        Assert.assertEquals(result.getStatesReduced(), 1);
    }

    @Test
    public void testDeadStartStateIsKept() {
        // @formatter:off
        final Automaton dfa = Automaton.builder()
                                       .states("s", "t")
                                       .alphabet("a", "b")
                                       .transition("s", "a", "t")
                                       .start("s")
                                       .finalStates()
                                       .build();
        // @formatter:on

        final Automaton min = PartitionRefinementMinimizer.minimize(dfa);

        Assert.assertEquals(min.getStates(), Collections.singletonList("q0"));
        Assert.assertEquals(min.getTransitions(), Collections.singletonList(Transition.of("q0", "a", "q0")));
    }

    @Test
    public void testWithoutFinalStates() {
        final Automaton dfa = ExampleEvenOnes.constructMachine().toBuilder().finalStates().build();
        final Automaton min = PartitionRefinementMinimizer.minimize(dfa);

        Assert.assertEquals(min.getStates(), Collections.singletonList("q0"));
        Assert.assertTrue(min.getFinalStates().isEmpty());
        Assert.assertEquals(min.getTransitions(),
                            Arrays.asList(Transition.of("q0", "0", "q0"), Transition.of("q0", "1", "q0")));
    }

    @Test
    public void testUnreachableStatesAreKept() {
        // @formatter:off
        final Automaton dfa = ExampleEvenOnes.constructMachine()
                                             .toBuilder()
                                             .addState("trap")
                                             .transition("trap", "0", "trap")
                                             .transition("trap", "1", "trap")
                                             .build();
        // @formatter:on

        Assert.assertEquals(PartitionRefinementMinimizer.minimize(dfa).size(), 3);
    }

    @Test
    public void testNondeterministicInput() {
        try {
            PartitionRefinementMinimizer.minimize(ExampleSuffix01.constructMachine());
            Assert.fail("expected an exception");
        } catch (NotDeterministicException ex) {
            Assert.assertEquals(ex.getViolations(), Collections.singletonList("q0 --0--> [q0, q1]"));
        }
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testUndeclaredStart() {
        PartitionRefinementMinimizer.minimize(ExampleEvenOnes.constructMachine().toBuilder().start("qx").build());
    }

    @Test
    public void testRandomDFAs() {
        final Random random = new Random(42);

        for (int i = 0; i < 100; i++) {
            final boolean complete = i % 2 == 0;
            final Automaton dfa = RandomFAs.randomDFA(random, 1 + random.nextInt(8), BINARY, complete);
            final Automaton min = PartitionRefinementMinimizer.minimize(dfa);

            Assert.assertEquals(min.getStart(), "q0");
            Assert.assertTrue(min.size() <= dfa.size());
            Assert.assertEquals(PartitionRefinementMinimizer.minimize(min).size(), min.size(), "not idempotent");
            if (complete) {
                Assert.assertEquals(new FAClassifier().classify(min), Classification.DFA);
            }

            for (Word<String> w : Words.allWords(BINARY, 6)) {
                Assert.assertEquals(FASimulator.simulate(min, w).isAccepted(),
                                    FASimulator.simulate(dfa, w).isAccepted(),
                                    "Word " + w + " on " + dfa);
            }
        }
    }
}
