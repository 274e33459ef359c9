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
 * Controls how {@link AutomatonTextParser} reacts to incomplete input.
 */
public enum ParseMode {

    /**
     * Missing sections and malformed transition lines are reported as errors.
     */
    STRICT,

    /**
     * Missing sections yield empty fields and malformed transition lines are skipped with a warning. This matches
     * the behavior of older front ends that relied on permissive parsing.
     */
    LENIENT
}
