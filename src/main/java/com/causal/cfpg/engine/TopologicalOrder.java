package com.causal.cfpg.engine;

import com.causal.cfpg.node.PgNode;

import java.util.*;

import lombok.extern.log4j.Log4j2;

/**
 * Topology -- CSR-encoded compiled paths structure.
 *
 * Every paths structure (raw paths graph, pre-CFPG, cycle-free paths graph,
 * combinations) is compiled into this form before it is walked. Nodes are
 * sorted topologically so a reverse scan of the arrays visits every child
 * before its parents, which is what path counting needs.
 *
 * Data layout:
 * - topoOrder: the nodes in topological order.
 * - childrenOffset / childrenList: children of node i are
 * childrenList[childrenOffset[i]] .. childrenList[childrenOffset[i+1] - 1].
 * - weights: sampling weight of each edge, at the same flat index as the child
 * in childrenList. Weights are the only mutable part of the structure.
 * - targetWords: bitset of terminal nodes, 64 flags per long. Walks end at the
 * first terminal node they reach.
 *
 * @param <N> Type of the node identifiers of the input graph.
 */
@Log4j2
public final class TopologicalOrder<N> {
    private final List<PgNode<N>> topoOrder;
    private final int[] childrenOffset;
    private final int[] childrenList;
    private final double[] weights;
    private final int[] parentCount;
    private final Map<PgNode<N>, Integer> nodeToIndex;
    private final int source;
    private final long[] targetWords;

    private TopologicalOrder(List<PgNode<N>> topoOrder, int[] childrenOffset, int[] childrenList, double[] weights,
            int[] parentCount, Map<PgNode<N>, Integer> nodeToIndex, int source, long[] targetWords) {
        this.topoOrder = topoOrder;
        this.childrenOffset = childrenOffset;
        this.childrenList = childrenList;
        this.weights = weights;
        this.parentCount = parentCount;
        this.nodeToIndex = nodeToIndex;
        this.source = source;
        this.targetWords = targetWords;
    }

    public int nodeCount() {
        return topoOrder.size();
    }

    public int edgeCount() {
        return childrenList.length;
    }

    public PgNode<N> node(int ti) {
        return topoOrder.get(ti);
    }

    /** Nodes in topological order. */
    public List<PgNode<N>> nodes() {
        return topoOrder;
    }

    public int topoIndex(PgNode<N> node) {
        Integer idx = nodeToIndex.get(node);
        if (idx == null)
            throw new IllegalArgumentException("Unknown node: " + node);
        return idx;
    }

    public boolean contains(PgNode<N> node) {
        return nodeToIndex.containsKey(node);
    }

    /** Topological index of the source, or -1 for an empty structure. */
    public int source() {
        return source;
    }

    public boolean isTarget(int ti) {
        return (targetWords[ti >> 6] & (1L << ti)) != 0;
    }

    public int childCount(int ti) {
        return childrenOffset[ti + 1] - childrenOffset[ti];
    }

    public int child(int ti, int i) {
        return childrenList[childrenOffset[ti] + i];
    }

    public int childrenStart(int ti) {
        return childrenOffset[ti];
    }

    public int childrenEnd(int ti) {
        return childrenOffset[ti + 1];
    }

    public int childAt(int flatIndex) {
        return childrenList[flatIndex];
    }

    public double weightAt(int flatIndex) {
        return weights[flatIndex];
    }

    void setWeightAt(int flatIndex, double weight) {
        weights[flatIndex] = weight;
    }

    /** Weight of the edge from -> to. */
    public double weight(PgNode<N> from, PgNode<N> to) {
        int u = topoIndex(from), v = topoIndex(to);
        for (int e = childrenOffset[u]; e < childrenOffset[u + 1]; e++)
            if (childrenList[e] == v)
                return weights[e];
        throw new IllegalArgumentException("No edge " + from + " -> " + to);
    }

    public int parentCount(int ti) {
        return parentCount[ti];
    }

    public static <N> Builder<N> builder() {
        return new Builder<>();
    }

    /**
     * Builder for constructing the TopologicalOrder.
     * Handles cycle detection and topological sorting.
     */
    public static final class Builder<N> {
        private final List<PgNode<N>> nodes = new ArrayList<>();
        private final Map<PgNode<N>, Integer> nodeToIdx = new HashMap<>();
        private final List<List<Integer>> forwardEdges = new ArrayList<>();
        private final List<List<Double>> forwardWeights = new ArrayList<>();
        private final Set<Integer> targetIndices = new HashSet<>();
        private int sourceIndex = -1;

        public Builder<N> addNode(PgNode<N> node) {
            if (nodeToIdx.containsKey(node))
                throw new IllegalArgumentException("Duplicate node: " + node);
            nodeToIdx.put(node, nodes.size());
            nodes.add(node);
            forwardEdges.add(new ArrayList<>());
            forwardWeights.add(new ArrayList<>());
            return this;
        }

        public boolean hasNode(PgNode<N> node) {
            return nodeToIdx.containsKey(node);
        }

        public Builder<N> addEdge(PgNode<N> from, PgNode<N> to) {
            return addEdge(from, to, 1.0);
        }

        /** Adds an edge; a repeated edge keeps its first weight. */
        public Builder<N> addEdge(PgNode<N> from, PgNode<N> to, double weight) {
            if (from.equals(to))
                throw new IllegalArgumentException("Self-edge not allowed: " + from);
            int u = requireIndex(from), v = requireIndex(to);
            List<Integer> children = forwardEdges.get(u);
            if (!children.contains(v)) {
                children.add(v);
                forwardWeights.get(u).add(weight);
            }
            return this;
        }

        public Builder<N> markSource(PgNode<N> node) {
            sourceIndex = requireIndex(node);
            return this;
        }

        public Builder<N> markTarget(PgNode<N> node) {
            targetIndices.add(requireIndex(node));
            return this;
        }

        private int requireIndex(PgNode<N> node) {
            Integer idx = nodeToIdx.get(node);
            if (idx == null)
                throw new IllegalArgumentException("Unknown node: " + node);
            return idx;
        }

        /**
         * Compiles the structure.
         * <p>
         * Performs Kahn's algorithm for topological sorting and cycle detection.
         * Ties are broken by insertion order, so equal inputs compile to equal
         * layouts.
         */
        public TopologicalOrder<N> build() {
            int n = nodes.size();
            if (n > 0 && sourceIndex < 0)
                throw new IllegalStateException("No source node marked");
            int[] inDegree = new int[n];

            // 1. Calculate in-degrees
            for (List<Integer> children : forwardEdges)
                for (int child : children)
                    inDegree[child]++;

            // 2. Initialize queue with nodes having in-degree 0
            int[] queue = new int[n];
            int head = 0, tail = 0;
            for (int i = 0; i < n; i++)
                if (inDegree[i] == 0)
                    queue[tail++] = i;

            // 3. Process queue (Kahn's algorithm)
            int[] topoMap = new int[n], reverseMap = new int[n];
            int topoIdx = 0;
            while (head < tail) {
                int curr = queue[head++];
                topoMap[curr] = topoIdx;
                reverseMap[topoIdx] = curr;
                topoIdx++;
                for (int child : forwardEdges.get(curr))
                    if (--inDegree[child] == 0)
                        queue[tail++] = child;
            }
            if (topoIdx != n)
                throw new IllegalStateException("Cycle detected! Processed " + topoIdx + " of " + n);

            // 4. Construct compact arrays
            List<PgNode<N>> ordered = new ArrayList<>(n);
            long[] tgtWords = new long[(n + 63) / 64];
            int[] parentCounts = new int[n];
            Map<PgNode<N>, Integer> newIndex = new HashMap<>(n * 2);
            for (int ti = 0; ti < n; ti++) {
                int origIdx = reverseMap[ti];
                ordered.add(nodes.get(origIdx));
                if (targetIndices.contains(origIdx))
                    tgtWords[ti >> 6] |= (1L << ti);
                newIndex.put(ordered.get(ti), ti);
            }

            // 5. Build CSR structure
            int[] offsets = new int[n + 1];
            for (int ti = 0; ti < n; ti++)
                offsets[ti + 1] = offsets[ti] + forwardEdges.get(reverseMap[ti]).size();

            int[] flatChildren = new int[offsets[n]];
            double[] flatWeights = new double[offsets[n]];
            for (int ti = 0; ti < n; ti++) {
                List<Integer> children = forwardEdges.get(reverseMap[ti]);
                List<Double> w = forwardWeights.get(reverseMap[ti]);
                int base = offsets[ti];
                for (int j = 0; j < children.size(); j++) {
                    int childTi = topoMap[children.get(j)];
                    flatChildren[base + j] = childTi;
                    flatWeights[base + j] = w.get(j);
                    parentCounts[childTi]++;
                }
            }
            log.trace("Compiled {} nodes, {} edges", n, flatChildren.length);
            return new TopologicalOrder<>(Collections.unmodifiableList(ordered), offsets, flatChildren, flatWeights,
                    parentCounts, newIndex, sourceIndex < 0 ? -1 : topoMap[sourceIndex], tgtWords);
        }
    }
}
