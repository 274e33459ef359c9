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
package de.automatakit.setting;

/**
 * The configuration keys understood by {@link AutomataKitSettings}. Each key may be set in an
 * {@code automatakit.properties} file on the classpath or as a JVM system property, the latter taking precedence.
 */
public enum AutomataKitProperty {

    /**
     * How the text parser treats missing sections and malformed transition lines: {@code STRICT} or
     * {@code LENIENT}.
     */
    PARSER_MODE("parser.mode"),

    /**
     * Comma-separated list of symbols that denote epsilon transitions. An empty entry stands for the empty symbol.
     */
    EPSILON_SYMBOLS("analysis.epsilon-symbols");

    private static final String PREFIX = "automatakit.";

    private final String key;

    AutomataKitProperty(String key) {
        this.key = PREFIX + key;
    }

    public String getPropertyKey() {
        return key;
    }

    @Override
    public String toString() {
        return key;
    }
}
