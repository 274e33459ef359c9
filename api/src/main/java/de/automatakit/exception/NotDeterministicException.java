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
package de.automatakit.exception;

import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * Thrown by operations that require a deterministic automaton, e.g. minimization, when the given automaton has a
 * state with several transitions on the same symbol.
 */
public class NotDeterministicException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    private final ImmutableList<String> violations;

    /**
     * Constructor.
     *
     * @param violations
     *         human-readable descriptions of the nondeterministic choices, e.g. {@code "q0 --a--> {q1, q2}"}
     */
    public NotDeterministicException(List<String> violations) {
        super("Automaton is not deterministic: " + String.join("; ", violations));
        this.violations = ImmutableList.copyOf(violations);
    }

    public ImmutableList<String> getViolations() {
        return violations;
    }
}
