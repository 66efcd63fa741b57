package com.deepansh.memory.store;

import com.deepansh.memory.exception.InvariantViolationException;
import com.deepansh.memory.model.MemoryRecord;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Reconstructs a version chain from any member: back along supersedesId to the
 * root, then forward along supersededById to the head. Consolidation links
 * (archived duplicates pointing at their keeper) are followed forward too.
 */
final class ChainWalker {

    private ChainWalker() {}

    static List<MemoryRecord> walk(String id, Function<String, Optional<MemoryRecord>> lookup) {
        Optional<MemoryRecord> start = lookup.apply(id);
        if (start.isEmpty()) return List.of();

        Set<String> seen = new HashSet<>();
        Deque<MemoryRecord> chain = new ArrayDeque<>();

        MemoryRecord current = start.get();
        while (current != null) {
            if (!seen.add(current.getId())) {
                throw new InvariantViolationException("Cycle in version chain at record " + current.getId());
            }
            chain.addFirst(current);
            String prev = current.getSupersedesId();
            current = prev == null ? null : lookup.apply(prev).orElse(null);
        }

        String next = start.get().getSupersededById();
        while (next != null) {
            MemoryRecord successor = lookup.apply(next).orElse(null);
            if (successor == null) break;
            if (!seen.add(successor.getId())) {
                throw new InvariantViolationException("Cycle in version chain at record " + successor.getId());
            }
            chain.addLast(successor);
            next = successor.getSupersededById();
        }
        return new ArrayList<>(chain);
    }
}
