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
 * An NFA over {@code {0,1}} accepting the words that end in {@code 01}. State {@code q0} guesses where the suffix
 * starts, so it has two transitions on {@code 0}, and {@code q1}, {@code q2} lack some transitions.
 */
public class ExampleSuffix01 extends DefaultFAExample {

    public ExampleSuffix01() {
        super(constructMachine(), "words ending in 01");
    }

    public static Automaton constructMachine() {
        // @formatter:off
        return Automaton.builder()
                        .states("q0", "q1", "q2")
                        .alphabet("0", "1")
                        .transition("q0", "0", "q0")
                        .transition("q0", "0", "q1")
                        .transition("q0", "1", "q0")
                        .transition("q1", "1", "q2")
                        .start("q0")
                        .finalStates("q2")
                        .build();
        // @formatter:on
    }

    public static ExampleSuffix01 createExample() {
        return new ExampleSuffix01();
    }
}
