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
 * A partial DFA over {@code {a,b,c}} accepting exactly {@code ab} and {@code cb}. Missing transitions lead to an
 * implicit rejecting sink; {@code p1} and {@code p2} are equivalent.
 */
public class ExamplePartialDFA extends DefaultFAExample {

    public ExamplePartialDFA() {
        super(constructMachine(), "the words ab and cb");
    }

    public static Automaton constructMachine() {
        // @formatter:off
        return Automaton.builder()
                        .states("p0", "p1", "p2", "p3")
                        .alphabet("a", "b", "c")
                        .transition("p0", "a", "p1")
                        .transition("p0", "c", "p2")
                        .transition("p1", "b", "p3")
                        .transition("p2", "b", "p3")
                        .start("p0")
                        .finalStates("p3")
                        .build();
        // @formatter:on
    }

    public static ExamplePartialDFA createExample() {
        return new ExamplePartialDFA();
    }
}
