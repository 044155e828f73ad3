package com.raditha.copycheck.shingle;

import com.raditha.copycheck.model.Digest;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Digest to window-start positions for one document.
 * Digests iterate in first-seen order and each position list is ascending.
 */
public final class ShingleIndex {

    private static final ShingleIndex EMPTY = new ShingleIndex(Map.of());

    private final Map<Digest, List<Integer>> positions;

    public ShingleIndex(Map<Digest, List<Integer>> positions) {
        Map<Digest, List<Integer>> copy = new LinkedHashMap<>();
        positions.forEach((digest, starts) -> copy.put(digest, List.copyOf(starts)));
        this.positions = Collections.unmodifiableMap(copy);
    }

    public static ShingleIndex empty() {
        return EMPTY;
    }

    public Set<Digest> digests() {
        return positions.keySet();
    }

    public boolean contains(Digest digest) {
        return positions.containsKey(digest);
    }

    /**
     * Window starts that produced the digest, or an empty list.
     */
    public List<Integer> positionsOf(Digest digest) {
        return positions.getOrDefault(digest, List.of());
    }

    /**
     * Number of distinct digests.
     */
    public int size() {
        return positions.size();
    }

    public boolean isEmpty() {
        return positions.isEmpty();
    }

    /**
     * Total number of windows indexed, counting repeats.
     */
    public int windowCount() {
        return positions.values().stream().mapToInt(List::size).sum();
    }
}
