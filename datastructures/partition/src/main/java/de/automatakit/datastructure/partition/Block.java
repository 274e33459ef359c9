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
package de.automatakit.datastructure.partition;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * A block of a {@link Partition}. Blocks are compared by identity: two blocks with the same members are still
 * distinct blocks. The members keep their insertion order.
 *
 * @param <S>
 *         element type
 */
public final class Block<S> {

    private final int id;
    private final Set<S> members;

    Block(int id, Collection<? extends S> members) {
        this.id = id;
        this.members = new LinkedHashSet<>(members);
    }

    /**
     * Returns an identifier that is unique within the owning partition. Identifiers are assigned in creation order and
     * are not reused after a block has been split.
     *
     * @return the block identifier
     */
    public int getId() {
        return id;
    }

    public Set<S> getMembers() {
        return Collections.unmodifiableSet(members);
    }

    public boolean contains(S element) {
        return members.contains(element);
    }

    public int size() {
        return members.size();
    }

    @Override
    public String toString() {
        return "B" + id + members;
    }
}
