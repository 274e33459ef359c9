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
package de.automatakit.examples;

import de.automatakit.api.Automaton;

/**
 * A complete two-state DFA over {@code {0,1}} accepting the words with an even number of {@code 1}s.
 */
public class ExampleEvenOnes extends DefaultFAExample {

    public ExampleEvenOnes() {
        super(constructMachine(), "even number of 1s");
    }

    public static Automaton constructMachine() {
        // @formatter:off
        return Automaton.builder()
                        .states("q0", "q1")
                        .alphabet("0", "1")
                        .transition("q0", "0", "q0")
                        .transition("q0", "1", "q1")
                        .transition("q1", "0", "q1")
                        .transition("q1", "1", "q0")
                        .start("q0")
                        .finalStates("q0")
                        .build();
        // @formatter:on
    }

    public static String constructText() {
        return "States: q0,q1\n" +
               "Alphabet: 0,1\n" +
               "Transitions:\n" +
               "q0,0,q0\n" +
               "q0,1,q1\n" +
               "q1,0,q1\n" +
               "q1,1,q0\n" +
               "Start: q0\n" +
               "Final: q0\n";
    }

    public static ExampleEvenOnes createExample() {
        return new ExampleEvenOnes();
    }
}
