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
 * A complete five-state DFA over {@code {0,1}} accepting the words that contain {@code 00} or {@code 11}. The two
 * accepting sink states {@code q3} and {@code q4} are equivalent, so the minimal DFA has four states.
 */
public class ExampleRedundantDFA extends DefaultFAExample {

    public ExampleRedundantDFA() {
        super(constructMachine(), "words containing 00 or 11");
    }

    public static Automaton constructMachine() {
        // @formatter:off
        return Automaton.builder()
                        .states("q0", "q1", "q2", "q3", "q4")
                        .alphabet("0", "1")
                        .transition("q0", "0", "q1")
                        .transition("q0", "1", "q2")
                        .transition("q1", "0", "q3")
                        .transition("q1", "1", "q2")
                        .transition("q2", "0", "q1")
                        .transition("q2", "1", "q4")
                        .transition("q3", "0", "q3")
                        .transition("q3", "1", "q3")
                        .transition("q4", "0", "q4")
                        .transition("q4", "1", "q4")
                        .start("q0")
                        .finalStates("q3", "q4")
                        .build();
        // @formatter:on
    }

    public static ExampleRedundantDFA createExample() {
        return new ExampleRedundantDFA();
    }
}
