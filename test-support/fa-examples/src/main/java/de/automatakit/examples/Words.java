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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import net.automatalib.words.Word;

/**
 * Enumerates input words for exhaustive language comparisons.
 */
public final class Words {

    private Words() {
        // prevent instantiation
    }

    /**
     * Lists all words over the given symbols up to (and including) the given length, shortest first.
     *
     * @param alphabet
     *         the input symbols
     * @param maxLength
     *         the maximal word length
     *
     * @return all words of length {@code 0 .. maxLength}
     */
    public static List<Word<String>> allWords(List<String> alphabet, int maxLength) {
        final List<Word<String>> result = new ArrayList<>();
        List<Word<String>> layer = Collections.singletonList(Word.epsilon());
        result.addAll(layer);

        for (int len = 1; len <= maxLength; len++) {
            final List<Word<String>> next = new ArrayList<>(layer.size() * alphabet.size());
            for (Word<String> w : layer) {
                for (String symbol : alphabet) {
                    next.add(w.append(symbol));
                }
            }
            result.addAll(next);
            layer = next;
        }

        return result;
    }
}
