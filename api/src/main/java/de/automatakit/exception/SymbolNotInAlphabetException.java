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

/**
 * Thrown when an input word contains a symbol that is not part of the automaton's alphabet. Such a symbol is a
 * caller error and is not silently treated as a missing transition.
 */
public class SymbolNotInAlphabetException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    private final String symbol;

    public SymbolNotInAlphabetException(String symbol) {
        super("Symbol '" + symbol + "' is not in the alphabet");
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }
}
