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

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Thrown when a textual automaton description cannot be turned into an automaton. The {@link #getReason() reason}
 * tells the caller whether a whole section is missing or a single transition line is malformed, so that an
 * actionable message can be shown to the user.
 */
public class AutomatonParseException extends Exception {

    private static final long serialVersionUID = 1L;

    /**
     * The kinds of format errors.
     */
    public enum Reason {
        MISSING_SECTION,
        MALFORMED_TRANSITION
    }

    private final Reason reason;
    private final @Nullable String section;
    private final @Nullable String line;
    private final int lineNumber;

    protected AutomatonParseException(String message,
                                      Reason reason,
                                      @Nullable String section,
                                      @Nullable String line,
                                      int lineNumber) {
        super(message);
        this.reason = reason;
        this.section = section;
        this.line = line;
        this.lineNumber = lineNumber;
    }

    /**
     * Creates an exception for a section that does not occur in the input.
     *
     * @param section
     *         the section name without the trailing colon, e.g. {@code "Final"}
     *
     * @return the exception
     */
    public static AutomatonParseException missingSection(String section) {
        return new AutomatonParseException("Missing required section: " + section + ':',
                                           Reason.MISSING_SECTION,
                                           section,
                                           null,
                                           -1);
    }

    /**
     * Creates an exception for a transition line that does not consist of exactly three non-empty, comma-separated
     * tokens.
     *
     * @param line
     *         the offending line as it appeared in the input
     * @param lineNumber
     *         the 1-based number of the line
     *
     * @return the exception
     */
    public static AutomatonParseException malformedTransition(String line, int lineNumber) {
        return new AutomatonParseException("Malformed transition in line " + lineNumber + ": '" + line +
                                           "' (expected <from>,<symbol>,<to>)",
                                           Reason.MALFORMED_TRANSITION,
                                           "Transitions",
                                           line,
                                           lineNumber);
    }

    public Reason getReason() {
        return reason;
    }

    /**
     * The section the problem was found in.
     *
     * @return the section name, without the trailing colon
     */
    public @Nullable String getSection() {
        return section;
    }

    /**
     * The offending input line, only set for {@link Reason#MALFORMED_TRANSITION}.
     *
     * @return the offending line
     */
    public @Nullable String getLine() {
        return line;
    }

    /**
     * The 1-based line number of the offending line, or {@code -1} if the problem is not tied to a line.
     *
     * @return the line number
     */
    public int getLineNumber() {
        return lineNumber;
    }
}
