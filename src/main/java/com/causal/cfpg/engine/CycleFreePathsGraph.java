package com.causal.cfpg.engine;

import com.causal.cfpg.api.BuildListener;
import com.causal.cfpg.api.PathSampler;
import com.causal.cfpg.node.History;
import com.causal.cfpg.node.PgNode;

import java.util.*;

import lombok.extern.log4j.Log4j2;

/**
 * Cycle-free paths graph: a pre-CFPG whose nodes are split by history so that
 * plain memoryless walks only produce cycle-free paths.
 *
 * <p>
 * The split runs from the target back to the source. Each copy of a node x
 * carries a history: the nodes of the pre-CFPG that can precede it on a
 * cycle-free path consistent with the copies downstream of it. For every copy
 * w of the next layer that lists x as a predecessor, the history of w is
 * intersected with the tags of x, restricted to walks from the source to x
 * and, if such walks exist, recorded as the history x needs to continue into
 * w. Copies of x are then created, one per distinct history, each leading to
 * the copies w that produced it.
 *
 * <p>
 * In signed mode, a pair of input nodes joined by edges of both signs lets two
 * copies spell the same names with different polarities. Such copies are
 * merged by name after the split, so every path is produced once.
 *
 * @param <N> Type of the node identifiers of the input graph.
 */
@Log4j2
public final class CycleFreePathsGraph<N> implements PathSampler<N> {
    private final Digraph<N> graph;
    private final N source, target;
    private final int length;
    private final boolean signed;
    private final int targetPolarity;
    private final TopologicalOrder<N> compiled;
    private final PathWalker<N> walker;

    private CycleFreePathsGraph(PreCfpg<N> pre, TopologicalOrder<N> topology) {
        PathsGraph<N> pg = pre.pathsGraph();
        this.graph = pg.graph();
        this.source = pg.source();
        this.target = pg.target();
        this.length = pg.length();
        this.signed = pg.signed();
        this.targetPolarity = pg.targetPolarity();
        this.compiled = topology;
        this.walker = new PathWalker<>(signed && graph.hasOppositeSigns() ? NameMerge.byName(topology) : topology);
    }

    /** Builds the paths graph's pre-CFPG and splits it. */
    public static <N> CycleFreePathsGraph<N> build(PathsGraph<N> pg) {
        return build(PreCfpg.build(pg), null);
    }

    public static <N> CycleFreePathsGraph<N> build(PreCfpg<N> pre) {
        return build(pre, null);
    }

    /**
     * Splits a pre-CFPG into a cycle-free paths graph.
     *
     * @param listener Optional observer of the per-layer split, may be null.
     */
    public static <N> CycleFreePathsGraph<N> build(PreCfpg<N> pre, BuildListener listener) {
        if (pre.isEmpty())
            return new CycleFreePathsGraph<>(pre, TopologicalOrder.<N>builder().build());

        LayeredGraph<N> arena = pre.arena();
        PathsGraph<N> pg = pre.pathsGraph();
        BitSet g0 = pre.edgeSet();
        final int src = pg.sourceNode(), tgt = pg.targetNode();
        final int length = pg.length();

        List<List<Copy>> levels = new ArrayList<>(Collections.nCopies(length + 1, null));
        Copy targetCopy = new Copy(tgt, pre.tagsOf(tgt), Collections.emptyList(), arena.predecessors(g0, tgt));
        levels.set(length, List.of(targetCopy));

        for (int i = length - 1; i >= 1; i--) {
            List<Copy> above = levels.get(i + 1);
            BitSet current = new BitSet(arena.nodeCount());
            for (Copy w : above)
                current.or(w.preds);

            List<Copy> copies = new ArrayList<>();
            for (int x = current.nextSetBit(0); x >= 0; x = current.nextSetBit(x + 1)) {
                BitSet xPreds = arena.predecessors(g0, x);
                // history -> copies of the next layer reachable with it
                Map<BitSet, List<Copy>> byHistory = new LinkedHashMap<>();
                for (Copy w : above) {
                    if (!w.preds.get(x))
                        continue;
                    BitSet allowed = (BitSet) w.history.clone();
                    allowed.and(pre.tagsOf(x));
                    BitSet sub = arena.prune(arena.induced(g0, allowed), src, x);
                    if (sub.isEmpty())
                        continue;
                    byHistory.computeIfAbsent(arena.nodesOf(sub), r -> new ArrayList<>()).add(w);
                }
                for (var entry : byHistory.entrySet()) {
                    BitSet preds = (BitSet) xPreds.clone();
                    preds.and(entry.getKey());
                    copies.add(new Copy(x, entry.getKey(), entry.getValue(), preds));
                }
            }
            levels.set(i, copies);
            if (listener != null)
                listener.onLayerSplit(length, i, current.cardinality(), copies.size());
            log.trace("Length {} layer {}: {} nodes split into {} copies", length, i, current.cardinality(),
                    copies.size());
        }

        BitSet sourceHistory = new BitSet(arena.nodeCount());
        sourceHistory.set(src);
        Copy sourceCopy = new Copy(src, sourceHistory, levels.get(1), new BitSet());
        levels.set(0, List.of(sourceCopy));

        TopologicalOrder<N> topology = compile(arena, levels, sourceCopy, targetCopy);
        if (listener != null)
            listener.onCfpgBuilt(length, topology.nodeCount(), topology.edgeCount());
        log.debug("CFPG {} -> {} length {}: {} nodes, {} edges (pre-CFPG {} nodes)", pg.source(), pg.target(),
                length, topology.nodeCount(), topology.edgeCount(), pre.nodeCount());
        return new CycleFreePathsGraph<>(pre, topology);
    }

    // Keeps copies on source-to-target walks and compiles them
    private static <N> TopologicalOrder<N> compile(LayeredGraph<N> arena, List<List<Copy>> levels, Copy sourceCopy,
            Copy targetCopy) {
        Set<Copy> reachable = new HashSet<>();
        reachable.add(sourceCopy);
        for (List<Copy> level : levels)
            for (Copy c : level)
                if (reachable.contains(c))
                    reachable.addAll(c.next);
        if (!reachable.contains(targetCopy))
            return TopologicalOrder.<N>builder().build();

        // Every copy's next list is non-empty and ends at the target, so reachable copies are live
        TopologicalOrder.Builder<N> builder = TopologicalOrder.builder();
        Map<Copy, PgNode<N>> nodes = new HashMap<>();
        for (List<Copy> level : levels)
            for (Copy c : level)
                if (reachable.contains(c)) {
                    PgNode<N> node = toPgNode(arena, c);
                    nodes.put(c, node);
                    builder.addNode(node);
                }
        for (List<Copy> level : levels)
            for (Copy c : level)
                if (reachable.contains(c))
                    for (Copy w : c.next)
                        builder.addEdge(nodes.get(c), nodes.get(w));
        return builder.markSource(nodes.get(sourceCopy)).markTarget(nodes.get(targetCopy)).build();
    }

    private static <N> PgNode<N> toPgNode(LayeredGraph<N> arena, Copy c) {
        int[] keys = new int[c.history.cardinality()];
        int j = 0;
        for (int i = c.history.nextSetBit(0); i >= 0; i = c.history.nextSetBit(i + 1))
            keys[j++] = arena.key(i);
        PgNode<N> base = arena.pgNode(c.node);
        return new PgNode<>(base.layer(), base.name(), base.polarity(), History.of(keys));
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

    public TopologicalOrder<N> topology() {
        return walker.topology();
    }

    /** The split copies with their histories, before any merge by name. */
    TopologicalOrder<N> compiled() {
        return compiled;
    }

    public List<PgNode<N>> nodes() {
        return walker.topology().nodes();
    }

    public int nodeCount() {
        return walker.topology().nodeCount();
    }

    public int edgeCount() {
        return walker.topology().edgeCount();
    }

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
        return walker.isEmpty();
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

    /**
     * Divides the weight of each edge by the number of sibling edges leading to
     * copies of the same node, so a node split into several copies is not
     * favoured over an unsplit sibling.
     */
    public void correctEdgeMultiplicities() {
        TopologicalOrder<N> topo = walker.topology();
        for (int ti = 0; ti < topo.nodeCount(); ti++) {
            int start = topo.childrenStart(ti), end = topo.childrenEnd(ti);
            Map<PgNode<N>, Integer> multiplicity = new HashMap<>();
            for (int e = start; e < end; e++)
                multiplicity.merge(topo.node(topo.childAt(e)).unsplit(), 1, Integer::sum);
            for (int e = start; e < end; e++)
                topo.setWeightAt(e, topo.weightAt(e) / multiplicity.get(topo.node(topo.childAt(e)).unsplit()));
        }
    }

    @Override
    public String toString() {
        return "CycleFreePathsGraph[" + source + " -> " + target + ", length " + length + ", " + nodeCount()
                + " nodes, " + edgeCount() + " edges]";
    }

    /** A split copy under construction. */
    private static final class Copy {
        final int node;
        final BitSet history;
        final List<Copy> next;
        final BitSet preds;

        Copy(int node, BitSet history, List<Copy> next, BitSet preds) {
            this.node = node;
            this.history = history;
            this.next = next;
            this.preds = preds;
        }
    }
}
