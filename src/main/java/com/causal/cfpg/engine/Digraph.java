package com.causal.cfpg.engine;

import java.util.*;

/**
 * Digraph -- CSR-encoded directed input graph with optional edge signs.
 *
 * Nodes are referenced by dense integer indices assigned in insertion order;
 * the caller-facing identifiers are only used at the boundary.
 *
 * Data layout (both directions are stored so reachability can run backward):
 * - outOffset / outTarget / outSign: the out-edges of node i are
 * outTarget[outOffset[i]] .. outTarget[outOffset[i+1] - 1], with the sign of
 * each edge at the same flat position in outSign.
 * - inOffset / inSource / inSign: the mirror image for in-edges.
 *
 * A sign is 0 (activating), 1 (inhibiting) or {@link #UNSIGNED}. Parallel edges
 * are allowed when their signs differ; an exact duplicate is stored once.
 * Self-loops are kept, they are ordinary cycles.
 *
 * @param <N> Type of the node identifiers.
 */
public final class Digraph<N> {
    /** Sign value of an edge that carries no sign. */
    public static final int UNSIGNED = -1;

    private final List<N> names;
    private final Map<N, Integer> nameToIndex;

    private final int[] outOffset, outTarget, outSign;
    private final int[] inOffset, inSource, inSign;
    private final boolean oppositeSigns;

    private Digraph(List<N> names, Map<N, Integer> nameToIndex, int[] outOffset, int[] outTarget, int[] outSign,
            int[] inOffset, int[] inSource, int[] inSign, boolean oppositeSigns) {
        this.names = names;
        this.nameToIndex = nameToIndex;
        this.outOffset = outOffset;
        this.outTarget = outTarget;
        this.outSign = outSign;
        this.inOffset = inOffset;
        this.inSource = inSource;
        this.inSign = inSign;
        this.oppositeSigns = oppositeSigns;
    }

    public int nodeCount() {
        return names.size();
    }

    public int edgeCount() {
        return outTarget.length;
    }

    public N name(int i) {
        return names.get(i);
    }

    /** Node identifiers in index order. */
    public List<N> nodes() {
        return names;
    }

    public boolean containsNode(N name) {
        return nameToIndex.containsKey(name);
    }

    /** Resolves a node identifier to its index. */
    public int indexOf(N name) {
        Integer idx = nameToIndex.get(name);
        if (idx == null)
            throw new IllegalArgumentException("Unknown node: " + name);
        return idx;
    }

    public int outStart(int i) {
        return outOffset[i];
    }

    public int outEnd(int i) {
        return outOffset[i + 1];
    }

    public int outTargetAt(int flatIndex) {
        return outTarget[flatIndex];
    }

    public int outSignAt(int flatIndex) {
        return outSign[flatIndex];
    }

    public int inStart(int i) {
        return inOffset[i];
    }

    public int inEnd(int i) {
        return inOffset[i + 1];
    }

    public int inSourceAt(int flatIndex) {
        return inSource[flatIndex];
    }

    public int inSignAt(int flatIndex) {
        return inSign[flatIndex];
    }

    public int outDegree(int i) {
        return outOffset[i + 1] - outOffset[i];
    }

    public int inDegree(int i) {
        return inOffset[i + 1] - inOffset[i];
    }

    /** True if at least one edge from -> to exists, whatever its sign. */
    public boolean hasEdge(N from, N to) {
        int u = indexOf(from), v = indexOf(to);
        for (int e = outOffset[u]; e < outOffset[u + 1]; e++)
            if (outTarget[e] == v)
                return true;
        return false;
    }

    /** True if an edge from -> to with exactly this sign exists. */
    public boolean hasEdge(N from, N to, int sign) {
        int u = indexOf(from), v = indexOf(to);
        for (int e = outOffset[u]; e < outOffset[u + 1]; e++)
            if (outTarget[e] == v && outSign[e] == sign)
                return true;
        return false;
    }

    /** True if some pair of nodes is joined by both an activating and an inhibiting edge. */
    public boolean hasOppositeSigns() {
        return oppositeSigns;
    }

    public static <N> Builder<N> builder() {
        return new Builder<>();
    }

    /**
     * Builder for the Digraph. Nodes referenced by an edge are added
     * implicitly.
     */
    public static final class Builder<N> {
        private final List<N> names = new ArrayList<>();
        private final Map<N, Integer> nameToIdx = new HashMap<>();
        private final List<int[]> edges = new ArrayList<>();
        private final Set<Long> seen = new HashSet<>();
        private boolean oppositeSigns;

        public Builder<N> addNode(N name) {
            indexFor(name);
            return this;
        }

        public Builder<N> addEdge(N from, N to) {
            return addEdge(from, to, UNSIGNED);
        }

        public Builder<N> addEdge(N from, N to, int sign) {
            if (sign != 0 && sign != 1 && sign != UNSIGNED)
                throw new IllegalArgumentException("Edge sign must be 0, 1 or unsigned, got " + sign + " on "
                        + from + " -> " + to);
            int u = indexFor(from), v = indexFor(to);
            // (u, v, sign) packed; sign + 1 fits in two bits
            long key = (((long) u << 31 | v) << 2) | (sign + 1);
            if (seen.add(key)) {
                edges.add(new int[] { u, v, sign });
                if (sign != UNSIGNED && seen.contains(key ^ 3))
                    oppositeSigns = true;
            }
            return this;
        }

        private int indexFor(N name) {
            Objects.requireNonNull(name, "node name");
            Integer idx = nameToIdx.get(name);
            if (idx != null)
                return idx;
            int i = names.size();
            names.add(name);
            nameToIdx.put(name, i);
            return i;
        }

        public Digraph<N> build() {
            int n = names.size(), m = edges.size();
            int[] outOffset = new int[n + 1], inOffset = new int[n + 1];
            for (int[] e : edges) {
                outOffset[e[0] + 1]++;
                inOffset[e[1] + 1]++;
            }
            for (int i = 0; i < n; i++) {
                outOffset[i + 1] += outOffset[i];
                inOffset[i + 1] += inOffset[i];
            }
            int[] outTarget = new int[m], outSign = new int[m];
            int[] inSource = new int[m], inSign = new int[m];
            int[] outFill = Arrays.copyOf(outOffset, n), inFill = Arrays.copyOf(inOffset, n);
            // Insertion order is preserved within each adjacency row
            for (int[] e : edges) {
                int o = outFill[e[0]]++;
                outTarget[o] = e[1];
                outSign[o] = e[2];
                int p = inFill[e[1]]++;
                inSource[p] = e[0];
                inSign[p] = e[2];
            }
            return new Digraph<>(Collections.unmodifiableList(new ArrayList<>(names)), new HashMap<>(nameToIdx),
                    outOffset, outTarget, outSign, inOffset, inSource, inSign, oppositeSigns);
        }
    }
}
