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

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import net.automatalib.commons.util.Pair;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * An ordered partition of a finite set, refined by splitting blocks.
 * <p>
 * Block order is significant: the initial blocks are kept in the order they were given, and the two halves of a split
 * block are appended at the end (intersection first). Algorithms that number blocks in partition order therefore yield
 * reproducible results.
 * <p>
 * This class is <b>not</b> thread-safe.
 *
 * @param <S>
 *         element type
 */
public class Partition<S> {

    private final List<Block<S>> blocks = new ArrayList<>();
    private final Map<S, Block<S>> blockMap = new HashMap<>();
    private int nextId;

    /**
     * Constructor.
     *
     * @param initialBlocks
     *         the initial blocks, which must be pairwise disjoint. Empty collections are skipped.
     */
    public Partition(Collection<? extends Collection<? extends S>> initialBlocks) {
        for (Collection<? extends S> members : initialBlocks) {
            if (!members.isEmpty()) {
                append(members);
            }
        }
    }

    public ImmutableList<Block<S>> getBlocks() {
        return ImmutableList.copyOf(blocks);
    }

    public int size() {
        return blocks.size();
    }

    public @Nullable Block<S> getBlock(S element) {
        return blockMap.get(element);
    }

    public boolean contains(Block<S> block) {
        for (Block<S> b : blocks) {
            if (b == block) {
                return true;
            }
        }
        return false;
    }

    /**
     * Splits a block by a splitter set. If both the intersection {@code I = Y ∩ X} and the difference
     * {@code D = Y \ X} are non-empty, {@code Y} is removed from this partition and {@code I}, {@code D} are appended
     * at the end, in this order. Otherwise the partition is left unchanged.
     *
     * @param block
     *         the block {@code Y} to split, which must belong to this partition
     * @param splitter
     *         the splitter set {@code X}
     *
     * @return the pair {@code (I, D)}, or {@code null} if the block was not split
     */
    public @Nullable Pair<Block<S>, Block<S>> split(Block<S> block, Set<? extends S> splitter) {
        Preconditions.checkArgument(contains(block), "Block %s is not part of this partition", block);

        final List<S> inside = new ArrayList<>();
        final List<S> outside = new ArrayList<>();
        for (S s : block.getMembers()) {
            if (splitter.contains(s)) {
                inside.add(s);
            } else {
                outside.add(s);
            }
        }

        if (inside.isEmpty() || outside.isEmpty()) {
            return null;
        }

        removeIdentical(block);
        final Block<S> i = append(inside);
        final Block<S> d = append(outside);
        return Pair.of(i, d);
    }

    private Block<S> append(Collection<? extends S> members) {
        final Block<S> block = new Block<>(nextId++, members);
        blocks.add(block);
        for (S s : block.getMembers()) {
            final Block<S> previous = blockMap.put(s, block);
            // a previous block is only allowed if it has just been split
            Preconditions.checkArgument(previous == null || !contains(previous),
                                        "Element %s occurs in more than one block",
                                        s);
        }
        return block;
    }

    private void removeIdentical(Block<S> block) {
        for (int i = 0; i < blocks.size(); i++) {
            if (blocks.get(i) == block) {
                blocks.remove(i);
                return;
            }
        }
    }

    @Override
    public String toString() {
        return blocks.toString();
    }
}
