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
package de.automatakit.util;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.Set;

import de.automatakit.api.Automaton;
import net.automatalib.automata.fsa.impl.compact.CompactDFA;
import net.automatalib.util.automata.Automata;
import net.automatalib.util.automata.fsa.NFAs;
import net.automatalib.words.Alphabet;
import net.automatalib.words.Word;
import net.automatalib.words.impl.Alphabets;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Compares the languages of two automata. Both automata are converted to AutomataLib NFAs over the union of their
 * alphabets and determinized there, independently of the algorithms of this library.
 */
public final class LanguageEquivalence {

    private LanguageEquivalence() {
        // prevent instantiation
    }

    public static boolean areEquivalent(Automaton a, Automaton b) {
        return findSeparatingWord(a, b) == null;
    }

    /**
     * Finds a word accepted by exactly one of the two automata.
     *
     * @param a
     *         the first automaton
     * @param b
     *         the second automaton
     *
     * @return a separating word, or {@code null} if both automata accept the same language
     */
    public static @Nullable Word<String> findSeparatingWord(Automaton a, Automaton b) {
        final Set<String> symbols = new LinkedHashSet<>(a.getAlphabet());
        symbols.addAll(b.getAlphabet());
        final Alphabet<String> alphabet = Alphabets.fromList(new ArrayList<>(symbols));

        final CompactDFA<String> dfaA = NFAs.determinize(AutomataLibAdapter.toCompactNFA(a, alphabet), alphabet);
        final CompactDFA<String> dfaB = NFAs.determinize(AutomataLibAdapter.toCompactNFA(b, alphabet), alphabet);

        return Automata.findSeparatingWord(dfaA, dfaB, alphabet);
    }
}
