package com.causal.cfpg.node;

import java.util.Arrays;

/**
 * Immutable set of node keys describing the upstream history a split node is
 * compatible with.
 *
 * <p>
 * Keys are layer-qualified node keys,
 * {@code (layer * nodeCount + nodeIndex) * 2 + polarity}, so histories built
 * for different path lengths over the same input graph can be compared
 * directly.
 * The keys are kept as a sorted primitive array: subset and intersection tests
 * are linear merges without boxing.
 */
public final class History {
    public static final History EMPTY = new History(new int[0]);

    private final int[] keys;
    private final int hash;

    private History(int[] sortedKeys) {
        this.keys = sortedKeys;
        this.hash = Arrays.hashCode(sortedKeys);
    }

    /** Builds a history from arbitrary keys (duplicates are dropped). */
    public static History of(int... keys) {
        int[] sorted = keys.clone();
        Arrays.sort(sorted);
        int n = 0;
        for (int i = 0; i < sorted.length; i++)
            if (n == 0 || sorted[n - 1] != sorted[i])
                sorted[n++] = sorted[i];
        return n == 0 ? EMPTY : new History(Arrays.copyOf(sorted, n));
    }

    public int size() {
        return keys.length;
    }

    public boolean isEmpty() {
        return keys.length == 0;
    }

    public boolean contains(int key) {
        return Arrays.binarySearch(keys, key) >= 0;
    }

    /** Returns the i-th smallest key. */
    public int keyAt(int i) {
        return keys[i];
    }

    /** True if every key of this history is also a key of {@code other}. */
    public boolean isSubsetOf(History other) {
        if (keys.length > other.keys.length)
            return false;
        int j = 0;
        for (int key : keys) {
            while (j < other.keys.length && other.keys[j] < key)
                j++;
            if (j == other.keys.length || other.keys[j] != key)
                return false;
            j++;
        }
        return true;
    }

    public History intersect(History other) {
        int[] out = new int[Math.min(keys.length, other.keys.length)];
        int i = 0, j = 0, n = 0;
        while (i < keys.length && j < other.keys.length) {
            if (keys[i] < other.keys[j])
                i++;
            else if (keys[i] > other.keys[j])
                j++;
            else {
                out[n++] = keys[i];
                i++;
                j++;
            }
        }
        return n == 0 ? EMPTY : new History(Arrays.copyOf(out, n));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof History))
            return false;
        History other = (History) o;
        return hash == other.hash && Arrays.equals(keys, other.keys);
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public String toString() {
        return Arrays.toString(keys);
    }
}
