package com.causal.cfpg.engine;

import com.causal.cfpg.api.PathSampler;
import com.causal.cfpg.node.PgNode;

import java.util.*;

import lombok.extern.log4j.Log4j2;

/**
 * Union of paths structures built for several lengths between the same source
 * and target.
 *
 * <p>
 * The combination has one source node and one terminal node per combined
 * length; walks end at the first terminal node they reach, so a single walk
 * yields a path of one of the combined lengths. Raw paths graphs are combined
 * by plain union. Cycle-free paths graphs are combined by union followed by a
 * cross-linking pass: within a layer, a copy whose history is contained in
 * the history of a copy from other lengths may continue wherever that other
 * copy continues.
 *
 * <p>
 * The union is finally merged by name, so that sampling, enumeration, counting
 * and uniform weights all range over distinct paths rather than over walks.
 *
 * @param <N> Type of the node identifiers of the input graph.
 */
@Log4j2
public final class CombinedPathsGraph<N> implements PathSampler<N> {
    private final N source, target;
    private final SortedSet<Integer> lengths;
    private final PathWalker<N> walker;

    private CombinedPathsGraph(N source, N target, SortedSet<Integer> lengths, TopologicalOrder<N> topology) {
        this.source = source;
        this.target = target;
        this.lengths = Collections.unmodifiableSortedSet(lengths);
        this.walker = new PathWalker<>(topology);
    }

    /** A combination with no paths. */
    public static <N> CombinedPathsGraph<N> empty(N source, N target) {
        return new CombinedPathsGraph<>(source, target, new TreeSet<>(), TopologicalOrder.<N>builder().build());
    }

    /**
     * Combines raw paths graphs keyed by their length.
     *
     * @throws IllegalArgumentException if the map is empty, a key differs from
     *                                  its graph's length, or the graphs were
     *                                  built over different graphs, endpoints
     *                                  or sign settings.
     */
    public static <N> CombinedPathsGraph<N> combinePathsGraphs(Map<Integer, PathsGraph<N>> graphs) {
        Parts<N> parts = new Parts<>();
        for (var entry : new TreeMap<>(graphs).entrySet()) {
            PathsGraph<N> pg = entry.getValue();
            parts.check(entry.getKey(), pg.length(), pg.graph(), pg.source(), pg.target(), pg.signed(),
                    pg.targetPolarity());
            parts.absorb(pg.compiled(), pg.length());
        }
        return parts.finish(false);
    }

    /**
     * Combines cycle-free paths graphs keyed by their length, cross-linking
     * copies whose histories are nested.
     *
     * @throws IllegalArgumentException under the same conditions as
     *                                  {@link #combinePathsGraphs(Map)}.
     */
    public static <N> CombinedPathsGraph<N> combineCfpgs(Map<Integer, CycleFreePathsGraph<N>> cfpgs) {
        Parts<N> parts = new Parts<>();
        for (var entry : new TreeMap<>(cfpgs).entrySet()) {
            CycleFreePathsGraph<N> cfpg = entry.getValue();
            parts.check(entry.getKey(), cfpg.length(), cfpg.graph(), cfpg.source(), cfpg.target(), cfpg.signed(),
                    cfpg.targetPolarity());
            parts.absorb(cfpg.compiled(), cfpg.length());
        }
        return parts.finish(true);
    }

    /** Accumulates the union while checking the inputs agree. */
    private static final class Parts<N> {
        private final Map<PgNode<N>, Set<PgNode<N>>> successors = new LinkedHashMap<>();
        private final Set<PgNode<N>> targets = new LinkedHashSet<>();
        // Member lengths each node was absorbed from
        private final Map<PgNode<N>, BitSet> origins = new HashMap<>();
        private final SortedSet<Integer> lengths = new TreeSet<>();
        private PgNode<N> sourceNode;
        private Digraph<N> graph;
        private N source, target;
        private boolean signed;
        private int targetPolarity;
        private boolean first = true;

        void check(Integer key, int length, Digraph<N> g, N src, N tgt, boolean sgn, int polarity) {
            if (key == null || key != length)
                throw new IllegalArgumentException("Key " + key + " does not match structure length " + length);
            if (first) {
                graph = g;
                source = src;
                target = tgt;
                signed = sgn;
                targetPolarity = polarity;
                first = false;
                return;
            }
            if (g != graph)
                throw new IllegalArgumentException("Structures were built over different graphs");
            if (!src.equals(source) || !tgt.equals(target))
                throw new IllegalArgumentException(
                        "Endpoints differ: " + src + " -> " + tgt + " vs " + source + " -> " + target);
            if (sgn != signed || polarity != targetPolarity)
                throw new IllegalArgumentException("Structures differ in signed mode or target polarity");
        }

        void absorb(TopologicalOrder<N> topo, int length) {
            if (topo.nodeCount() == 0)
                return;
            PgNode<N> src = topo.node(topo.source());
            if (sourceNode == null)
                sourceNode = src;
            else if (!sourceNode.equals(src))
                throw new IllegalStateException("Source nodes differ: " + sourceNode + " vs " + src);
            for (int ti = 0; ti < topo.nodeCount(); ti++) {
                origins.computeIfAbsent(topo.node(ti), k -> new BitSet()).set(length);
                Set<PgNode<N>> succ = successors.computeIfAbsent(topo.node(ti), k -> new LinkedHashSet<>());
                for (int i = 0; i < topo.childCount(ti); i++)
                    succ.add(topo.node(topo.child(ti, i)));
                if (topo.isTarget(ti)) {
                    targets.add(topo.node(ti));
                    lengths.add(topo.node(ti).layer());
                }
            }
        }

        CombinedPathsGraph<N> finish(boolean crossLink) {
            if (first)
                throw new IllegalArgumentException("Nothing to combine");
            if (sourceNode == null)
                return new CombinedPathsGraph<>(source, target, lengths, TopologicalOrder.<N>builder().build());
            if (crossLink)
                crossLink();

            // Walks stop at terminal nodes; keep what the source reaches without passing one
            Set<PgNode<N>> reachable = new LinkedHashSet<>();
            Deque<PgNode<N>> queue = new ArrayDeque<>();
            reachable.add(sourceNode);
            queue.add(sourceNode);
            while (!queue.isEmpty()) {
                PgNode<N> u = queue.poll();
                if (targets.contains(u))
                    continue;
                for (PgNode<N> v : successors.get(u))
                    if (reachable.add(v))
                        queue.add(v);
            }

            TopologicalOrder.Builder<N> builder = TopologicalOrder.builder();
            for (PgNode<N> node : successors.keySet())
                if (reachable.contains(node))
                    builder.addNode(node);
            for (var entry : successors.entrySet()) {
                if (!reachable.contains(entry.getKey()) || targets.contains(entry.getKey()))
                    continue;
                for (PgNode<N> v : entry.getValue())
                    builder.addEdge(entry.getKey(), v);
            }
            builder.markSource(sourceNode);
            for (PgNode<N> t : targets)
                if (reachable.contains(t))
                    builder.markTarget(t);
            TopologicalOrder<N> topology = NameMerge.byName(builder.build());
            log.debug("Combined {} -> {} over lengths {}: {} nodes, {} edges", source, target, lengths,
                    topology.nodeCount(), topology.edgeCount());
            return new CombinedPathsGraph<>(source, target, lengths, topology);
        }

        private void crossLink() {
            Map<Integer, List<PgNode<N>>> byLayer = new TreeMap<>();
            for (PgNode<N> node : successors.keySet())
                if (!targets.contains(node))
                    byLayer.computeIfAbsent(node.layer(), k -> new ArrayList<>()).add(node);
            int added = 0;
            for (List<PgNode<N>> layer : byLayer.values()) {
                Map<PgNode<N>, List<PgNode<N>>> snapshot = new HashMap<>();
                for (PgNode<N> node : layer)
                    snapshot.put(node, new ArrayList<>(successors.get(node)));
                for (PgNode<N> u : layer)
                    for (PgNode<N> v : layer) {
                        if (u == v || origins.get(u).intersects(origins.get(v))
                                || !u.history().isSubsetOf(v.history()))
                            continue;
                        for (PgNode<N> w : snapshot.get(v))
                            if (successors.get(u).add(w))
                                added++;
                    }
            }
            log.trace("Cross-linking added {} edges", added);
        }
    }

    public N source() {
        return source;
    }

    public N target() {
        return target;
    }

    /** Lengths that contributed at least one path. */
    public SortedSet<Integer> lengths() {
        return lengths;
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
        return walker.topology().edgeCount();
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

    @Override
    public String toString() {
        return "CombinedPathsGraph[" + source + " -> " + target + ", lengths " + lengths + ", " + nodeCount()
                + " nodes, " + edgeCount() + " edges]";
    }
}
