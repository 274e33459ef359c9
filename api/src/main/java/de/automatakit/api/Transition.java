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
package de.automatakit.api;

import java.util.Objects;

import com.google.common.base.Preconditions;

/**
 * A single labelled edge {@code (from, symbol, to)} of a finite automaton.
 * <p>
 * Epsilon moves are not a distinct kind of transition; they are ordinary transitions whose symbol is one of the
 * reserved epsilon tokens.
 */
public final class Transition {

    private final String from;
    private final String symbol;
    private final String to;

    public Transition(String from, String symbol, String to) {
        this.from = Preconditions.checkNotNull(from, "from");
        this.symbol = Preconditions.checkNotNull(symbol, "symbol");
        this.to = Preconditions.checkNotNull(to, "to");
    }

    public static Transition of(String from, String symbol, String to) {
        return new Transition(from, symbol, to);
    }

    public String getFrom() {
        return from;
    }

    public String getSymbol() {
        return symbol;
    }

    public String getTo() {
        return to;
    }

    public boolean isSelfLoop() {
        return from.equals(to);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Transition that = (Transition) o;
        return from.equals(that.from) && symbol.equals(that.symbol) && to.equals(that.to);
    }

    @Override
    public int hashCode() {
        return Objects.hash(from, symbol, to);
    }

    @Override
    public String toString() {
        return from + "," + symbol + "," + to;
    }
}
