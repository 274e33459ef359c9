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
package de.automatakit.analysis;

import java.util.Collection;
import java.util.Objects;

import com.google.common.collect.ImmutableList;

/**
 * The outcome of validating an automaton. The automaton is valid iff there are no errors; warnings never affect
 * validity.
 */
public final class ValidationResult {

    private final ImmutableList<String> errors;
    private final ImmutableList<String> warnings;

    public ValidationResult(Collection<String> errors, Collection<String> warnings) {
        this.errors = ImmutableList.copyOf(errors);
        this.warnings = ImmutableList.copyOf(warnings);
    }

    public boolean isValid() {
        return errors.isEmpty();
    }

    public ImmutableList<String> getErrors() {
        return errors;
    }

    public ImmutableList<String> getWarnings() {
        return warnings;
    }

    /**
     * Returns a copy of this result with additional warnings appended.
     *
     * @param additionalWarnings
     *         the warnings to add
     *
     * @return the extended result
     */
    public ValidationResult withWarnings(Collection<String> additionalWarnings) {
        return new ValidationResult(errors,
                                    ImmutableList.<String>builder()
                                                 .addAll(warnings)
                                                 .addAll(additionalWarnings)
                                                 .build());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        ValidationResult that = (ValidationResult) o;
        return errors.equals(that.errors) && warnings.equals(that.warnings);
    }

    @Override
    public int hashCode() {
        return Objects.hash(errors, warnings);
    }

    @Override
    public String toString() {
        return "ValidationResult{valid=" + isValid() + ", errors=" + errors + ", warnings=" + warnings + '}';
    }
}
