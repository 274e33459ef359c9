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
package de.automatakit.api;

/**
 * Classification of an {@link Automaton} value. DFA and NFA are not distinct types: every automaton has the same
 * shape and is classified by inspecting its transition relation.
 */
public enum Classification {
    /**
     * Exactly one transition for every state and every alphabet symbol.
     */
    DFA,
    /**
     * Zero, one or several transitions for some state and symbol.
     */
    NFA
}
