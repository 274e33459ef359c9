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
package de.automatakit.algorithm.determinization;

/**
 * Rates how far a subset construction stayed below the {@code 2^n} state bound.
 *
 * @see DeterminizationResult#getEfficiencyPercentage()
 */
public enum EfficiencyRating {
    EXCELLENT,
    GOOD,
    FAIR,
    POOR;

    /**
     * Rates an efficiency percentage. The percentage is rounded to one decimal before the thresholds (80, 60 and 40
     * percent, exclusive) are applied.
     *
     * @param percentage
     *         the efficiency in percent
     *
     * @return the rating
     */
    public static EfficiencyRating of(double percentage) {
        final double rounded = Math.round(percentage * 10) / 10.0;
        if (rounded > 80) {
            return EXCELLENT;
        } else if (rounded > 60) {
            return GOOD;
        } else if (rounded > 40) {
            return FAIR;
        }
        return POOR;
    }
}
