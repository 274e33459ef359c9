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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableTable;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * An immutable finite automaton over string-labelled states and symbols.
 * <p>
 * The same type describes deterministic and nondeterministic automata; whether a given value is a DFA is decided by
 * classification, not by its type. The order of {@link #getStates() states} and {@link #getAlphabet() symbols} is
 * preserved and used wherever algorithms need a reproducible iteration order.
 * <p>
 * Instances are not checked for structural consistency on construction: a parsed automaton may reference states
 * that are not declared, contain duplicate states, and so on. Such problems are reported by the validator. Every
 * transformation produces a new value, instances are never modified.
 */
public final class Automaton {

    private final ImmutableList<String> states;
    private final ImmutableList<String> alphabet;
    private final ImmutableList<Transition> transitions;
    private final String start;
    private final ImmutableSet<String> finalStates;

    private final ImmutableListMultimap<String, Transition> outgoing;
    private final ImmutableTable<String, String, ImmutableSet<String>> successors;

    public Automaton(Collection<String> states,
                     Collection<String> alphabet,
                     Collection<Transition> transitions,
                     String start,
                     Collection<String> finalStates) {
        this.states = ImmutableList.copyOf(states);
        this.alphabet = ImmutableList.copyOf(alphabet);
        this.transitions = ImmutableList.copyOf(transitions);
        this.start = Preconditions.checkNotNull(start, "start");
        this.finalStates = ImmutableSet.copyOf(finalStates);

        ImmutableListMultimap.Builder<String, Transition> outgoingBuilder = ImmutableListMultimap.builder();
        Map<String, Map<String, Set<String>>> index = new LinkedHashMap<>();
        for (Transition t : this.transitions) {
            outgoingBuilder.put(t.getFrom(), t);
            index.computeIfAbsent(t.getFrom(), k -> new LinkedHashMap<>())
                 .computeIfAbsent(t.getSymbol(), k -> new LinkedHashSet<>())
                 .add(t.getTo());
        }
        this.outgoing = outgoingBuilder.build();

        ImmutableTable.Builder<String, String, ImmutableSet<String>> successorsBuilder = ImmutableTable.builder();
        for (Map.Entry<String, Map<String, Set<String>>> e : index.entrySet()) {
            for (Map.Entry<String, Set<String>> bySymbol : e.getValue().entrySet()) {
                successorsBuilder.put(e.getKey(), bySymbol.getKey(), ImmutableSet.copyOf(bySymbol.getValue()));
            }
        }
        this.successors = successorsBuilder.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder().states(states)
                            .alphabet(alphabet)
                            .transitions(transitions)
                            .start(start)
                            .finalStates(finalStates);
    }

    /**
     * Returns the declared states in declaration order. May contain duplicates if the source did.
     *
     * @return the declared states
     */
    public ImmutableList<String> getStates() {
        return states;
    }

    /**
     * Returns the declared input symbols in declaration order. May contain duplicates if the source did.
     *
     * @return the input alphabet
     */
    public ImmutableList<String> getAlphabet() {
        return alphabet;
    }

    public ImmutableList<Transition> getTransitions() {
        return transitions;
    }

    /**
     * Returns the start state, or the empty string if none was given.
     *
     * @return the start state
     */
    public String getStart() {
        return start;
    }

    public ImmutableSet<String> getFinalStates() {
        return finalStates;
    }

    public boolean isFinal(String state) {
        return finalStates.contains(state);
    }

    public int size() {
        return states.size();
    }

    /**
     * Retrieves all transitions leaving the given state, in declaration order.
     *
     * @param state
     *         the source state
     *
     * @return the outgoing transitions, possibly empty
     */
    public ImmutableList<Transition> getTransitionsFrom(String state) {
        return outgoing.get(state);
    }

    /**
     * Retrieves the distinct targets of all transitions from {@code state} on {@code symbol}, in the order of their
     * first declaration.
     *
     * @param state
     *         the source state
     * @param symbol
     *         the input symbol
     *
     * @return the successor states, empty if there is no such transition
     */
    public ImmutableSet<String> getSuccessors(String state, String symbol) {
        final @Nullable ImmutableSet<String> result = successors.get(state, symbol);
        return result == null ? ImmutableSet.of() : result;
    }

    /**
     * Retrieves the successor of a deterministic transition.
     *
     * @param state
     *         the source state
     * @param symbol
     *         the input symbol
     *
     * @return the single successor, or {@code null} if there is no transition for the given pair
     *
     * @throws IllegalStateException
     *         if the pair has more than one successor
     */
    public @Nullable String getSuccessor(String state, String symbol) {
        final ImmutableSet<String> targets = getSuccessors(state, symbol);
        if (targets.isEmpty()) {
            return null;
        }
        Preconditions.checkState(targets.size() == 1,
                                 "State '%s' has %s transitions on symbol '%s'",
                                 state,
                                 targets.size(),
                                 symbol);
        return targets.iterator().next();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Automaton that = (Automaton) o;
        return states.equals(that.states) && alphabet.equals(that.alphabet) &&
               transitions.equals(that.transitions) && start.equals(that.start) &&
               finalStates.equals(that.finalStates);
    }

    @Override
    public int hashCode() {
        return Objects.hash(states, alphabet, transitions, start, finalStates);
    }

    @Override
    public String toString() {
        return "Automaton{states=" + states + ", alphabet=" + alphabet + ", transitions=" + transitions + ", start=" +
               start + ", final=" + finalStates + '}';
    }

    public static final class Builder {

        private final List<String> states = new ArrayList<>();
        private final List<String> alphabet = new ArrayList<>();
        private final List<Transition> transitions = new ArrayList<>();
        private final Set<String> finalStates = new LinkedHashSet<>();
        private String start = "";

        Builder() {
            // use Automaton#builder()
        }

        public Builder states(Collection<String> states) {
            this.states.clear();
            this.states.addAll(states);
            return this;
        }

        public Builder states(String... states) {
            return states(Arrays.asList(states));
        }

        public Builder addState(String state) {
            this.states.add(state);
            return this;
        }

        public Builder alphabet(Collection<String> alphabet) {
            this.alphabet.clear();
            this.alphabet.addAll(alphabet);
            return this;
        }

        public Builder alphabet(String... symbols) {
            return alphabet(Arrays.asList(symbols));
        }

        public Builder transitions(Collection<Transition> transitions) {
            this.transitions.clear();
            this.transitions.addAll(transitions);
            return this;
        }

        public Builder transition(String from, String symbol, String to) {
            this.transitions.add(new Transition(from, symbol, to));
            return this;
        }

        public Builder start(String start) {
            this.start = start;
            return this;
        }

        public Builder finalStates(Collection<String> finalStates) {
            this.finalStates.clear();
            this.finalStates.addAll(finalStates);
            return this;
        }

        public Builder finalStates(String... finalStates) {
            return finalStates(Arrays.asList(finalStates));
        }

        public Builder addFinalState(String state) {
            this.finalStates.add(state);
            return this;
        }

        public Automaton build() {
            return new Automaton(states, alphabet, transitions, start, finalStates);
        }
    }
}
