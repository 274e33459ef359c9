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
package de.automatakit.serialization.text;

/**
 * The labelled sections of the textual automaton format.
 */
public enum Section {
    STATES("States"),
    ALPHABET("Alphabet"),
    TRANSITIONS("Transitions"),
    START("Start"),
    FINAL("Final");

    private final String label;

    Section(String label) {
        this.label = label;
    }

    /**
     * The section name as used in error messages, e.g. {@code "Final"}.
     *
     * @return the section name
     */
    public String getLabel() {
        return label;
    }

    /**
     * The literal prefix introducing the section, e.g. {@code "Final:"}.
     *
     * @return the line prefix
     */
    public String getPrefix() {
        return label + ':';
    }

    boolean introduces(String line) {
        return line.startsWith(getPrefix());
    }

    String remainder(String line) {
        return line.substring(getPrefix().length());
    }
}
