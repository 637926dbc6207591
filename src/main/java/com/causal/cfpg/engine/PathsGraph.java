package com.causal.cfpg.engine;

import com.causal.cfpg.api.PathSampler;
import com.causal.cfpg.node.PgNode;

import java.util.*;

import lombok.extern.log4j.Log4j2;

/**
 * Layered paths graph of one exact length.
 *
 * <p>
 * Layer k holds the (name, polarity) pairs that are reachable from the source
 * in exactly k steps and reach the target in exactly length - k steps with a
 * compatible sign; an edge joins two adjacent layers wherever the input graph
 * has a matching edge. After pruning, every node lies on a source-to-target
 * walk of the requested length. Walks through this graph may still revisit a
 * node name: it is the cyclic starting point of the pre-CFPG and CFPG.
 *
 * <p>
 * In signed mode the source sits at polarity 0 and the target at the
 * requested target polarity, so only walks with that net sign are kept. When
 * the input joins a pair of nodes by edges of both signs, nodes reached by the
 * same names are merged so that each name sequence is sampled, enumerated and
 * counted once.
 *
 * @param <N> Type of the node identifiers of the input graph.
 */
@Log4j2
public final class PathsGraph<N> implements PathSampler<N> {
    private final Digraph<N> graph;
    private final N source, target;
    private final int length;
    private final boolean signed;
    private final int targetPolarity;
    private final LayeredGraph<N> arena;
    private final BitSet edges;
    private final int sourceNode, targetNode;
    private final TopologicalOrder<N> compiled;
    private final PathWalker<N> walker;

    private PathsGraph(Digraph<N> graph, N source, N target, int length, boolean signed, int targetPolarity,
            LayeredGraph<N> arena, BitSet edges, int sourceNode, int targetNode) {
        this.graph = graph;
        this.source = source;
        this.target = target;
        this.length = length;
        this.signed = signed;
        this.targetPolarity = targetPolarity;
        this.arena = arena;
        this.edges = edges;
        this.sourceNode = sourceNode;
        this.targetNode = targetNode;
        this.compiled = arena == null || edges.isEmpty()
                ? TopologicalOrder.<N>builder().build()
                : arena.compile(edges, sourceNode, targetNode);
        // Opposite-sign parallel edges give one name sequence several signed walks
        this.walker = new PathWalker<>(signed && graph.hasOppositeSigns() ? NameMerge.byName(compiled) : compiled);
    }

    /**
     * Builds the paths graph straight from the input graph, computing the
     * reachable sets to exactly {@code length}.
     */
    public static <N> PathsGraph<N> build(Digraph<N> graph, N source, N target, int length, boolean signed,
            Integer targetPolarity) {
        if (length < 1)
            throw new IllegalArgumentException("length must be at least 1, got " + length);
        return build(ReachabilitySets.compute(graph, source, target, length, signed), length, targetPolarity);
    }

    /**
     * Builds the paths graph of one length from precomputed reachable sets.
     *
     * @param targetPolarity Required net sign in signed mode; null means 0.
     *                       Ignored in unsigned mode.
     * @throws IllegalArgumentException if length is below 1 or deeper than the
     *                                  reachable sets, or the polarity is not 0
     *                                  or 1.
     */
    public static <N> PathsGraph<N> build(ReachableLevels<N> levels, int length, Integer targetPolarity) {
        if (length < 1)
            throw new IllegalArgumentException("length must be at least 1, got " + length);
        if (length > levels.maxDepth())
            throw new IllegalArgumentException(
                    "length " + length + " exceeds the depth of the reachable sets (" + levels.maxDepth() + ")");
        int t = 0;
        if (levels.signed()) {
            t = targetPolarity == null ? 0 : targetPolarity;
            if (t != 0 && t != 1)
                throw new IllegalArgumentException("Target polarity must be 0 or 1, got " + targetPolarity);
        }

        Digraph<N> graph = levels.graph();
        int src = levels.sourceIndex(), tgt = levels.targetIndex();
        if (levels.isEmpty())
            return empty(levels, length, t);

        // Nodes, layer by layer
        IntList layer = new IntList(), name = new IntList(), pol = new IntList();
        List<Map<Integer, Integer>> byKey = new ArrayList<>(length + 1);
        for (int k = 0; k <= length; k++) {
            Map<Integer, Integer> index = new HashMap<>();
            byKey.add(index);
            BitSet fwd = levels.forwardBits(k), bwd = levels.backwardBits(length - k);
            for (int key = fwd.nextSetBit(0); key >= 0; key = fwd.nextSetBit(key + 1)) {
                int n = key >> 1, q = key & 1;
                if (k == 0 && n != src)
                    continue;
                if (k == length && (n != tgt || q != t))
                    continue;
                if (!bwd.get(n << 1 | (q ^ t)))
                    continue;
                index.put(key, layer.size());
                layer.add(k);
                name.add(n);
                pol.add(q);
            }
            if (index.isEmpty())
                return empty(levels, length, t);
        }

        // Edges between adjacent layers
        IntList from = new IntList(), to = new IntList();
        int node = 0;
        for (int k = 0; k < length; k++) {
            Map<Integer, Integer> next = byKey.get(k + 1);
            int layerSize = byKey.get(k).size();
            for (int j = 0; j < layerSize; j++, node++) {
                int u = name.get(node), q = pol.get(node);
                Set<Integer> seen = new HashSet<>();
                for (int e = graph.outStart(u); e < graph.outEnd(u); e++) {
                    int sign = graph.outSignAt(e);
                    if (levels.signed() && sign == Digraph.UNSIGNED)
                        continue;
                    int q2 = levels.signed() ? q ^ sign : 0;
                    Integer v = next.get(graph.outTargetAt(e) << 1 | q2);
                    if (v != null && seen.add(v)) {
                        from.add(node);
                        to.add(v);
                    }
                }
            }
        }

        LayeredGraph<N> arena = new LayeredGraph<>(graph, length, layer.toArray(), name.toArray(), pol.toArray(),
                from.toArray(), to.toArray());
        int sourceNode = 0, targetNode = arena.nodeCount() - 1;
        BitSet kept = arena.prune(arena.allEdges(), sourceNode, targetNode);
        log.debug("Paths graph {} -> {} length {}: {} candidate nodes, {} of {} edges kept", levels.source(),
                levels.target(), length, arena.nodeCount(), kept.cardinality(), arena.edgeCount());
        return new PathsGraph<>(graph, levels.source(), levels.target(), length, levels.signed(), t, arena, kept,
                sourceNode, targetNode);
    }

    private static <N> PathsGraph<N> empty(ReachableLevels<N> levels, int length, int t) {
        log.debug("Paths graph {} -> {} length {} is empty", levels.source(), levels.target(), length);
        return new PathsGraph<>(levels.graph(), levels.source(), levels.target(), length, levels.signed(), t, null,
                new BitSet(), -1, -1);
    }

    public Digraph<N> graph() {
        return graph;
    }

    public N source() {
        return source;
    }

    public N target() {
        return target;
    }

    public int length() {
        return length;
    }

    public boolean signed() {
        return signed;
    }

    public int targetPolarity() {
        return targetPolarity;
    }

    LayeredGraph<N> arena() {
        return arena;
    }

    /** Kept edge ids over the arena; callers must not mutate. */
    BitSet edgeSet() {
        return edges;
    }

    int sourceNode() {
        return sourceNode;
    }

    int targetNode() {
        return targetNode;
    }

    /** One node per (layer, name, polarity), before any merge by name. */
    TopologicalOrder<N> compiled() {
        return compiled;
    }

    public TopologicalOrder<N> topology() {
        return walker.topology();
    }

    public List<PgNode<N>> nodes() {
        return walker.topology().nodes();
    }

    public int nodeCount() {
        return walker.topology().nodeCount();
    }

    public int edgeCount() {
        return edges.cardinality();
    }

    /** Successors of a node, in storage order. */
    public List<PgNode<N>> successors(PgNode<N> node) {
        TopologicalOrder<N> topo = walker.topology();
        int ti = topo.topoIndex(node);
        List<PgNode<N>> out = new ArrayList<>(topo.childCount(ti));
        for (int i = 0; i < topo.childCount(ti); i++)
            out.add(topo.node(topo.child(ti, i)));
        return out;
    }

    @Override
    public boolean isEmpty() {
        return edges.isEmpty();
    }

    @Override
    public List<List<N>> samplePaths(int numPaths, Random rng) {
        return walker.samplePaths(numPaths, rng);
    }

    @Override
    public List<List<N>> enumeratePaths() {
        return walker.enumeratePaths();
    }

    @Override
    public long countPaths() {
        return walker.countPaths();
    }

    public void setUniformPathDistribution() {
        walker.setUniformPathDistribution();
    }

    @Override
    public String toString() {
        return "PathsGraph[" + source + " -> " + target + ", length " + length + ", " + nodeCount() + " nodes, "
                + edgeCount() + " edges]";
    }

    /** Growable int array. */
    static final class IntList {
        private int[] data = new int[16];
        private int size;

        void add(int v) {
            if (size == data.length)
                data = Arrays.copyOf(data, size * 2);
            data[size++] = v;
        }

        int get(int i) {
            return data[i];
        }

        int size() {
            return size;
        }

        int[] toArray() {
            return Arrays.copyOf(data, size);
        }
    }
}
