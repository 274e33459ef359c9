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
 * An NFA over {@code {a,b}} accepting the words that contain {@code ab}. Its subset construction yields a complete
 * DFA with four states, two of which are equivalent.
 */
public class ExampleContainsAB extends DefaultFAExample {

    public ExampleContainsAB() {
        super(constructMachine(), "words containing ab");
    }

    public static Automaton constructMachine() {
        // @formatter:off
        return Automaton.builder()
                        .states("s", "t", "u")
                        .alphabet("a", "b")
                        .transition("s", "a", "s")
                        .transition("s", "a", "t")
                        .transition("s", "b", "s")
                        .transition("t", "b", "u")
                        .transition("u", "a", "u")
                        .transition("u", "b", "u")
                        .start("s")
                        .finalStates("u")
                        .build();
        // @formatter:on
    }

    public static ExampleContainsAB createExample() {
        return new ExampleContainsAB();
    }
}
