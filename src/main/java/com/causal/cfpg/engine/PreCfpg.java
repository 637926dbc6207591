package com.causal.cfpg.engine;

import com.causal.cfpg.api.BuildListener;
import com.causal.cfpg.api.PathSampler;
import com.causal.cfpg.node.PgNode;

import java.util.*;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Pre cycle-free paths graph: a paths graph whose nodes carry tags.
 *
 * <p>
 * The tag set of a node lists the upstream nodes that may precede it on a
 * cycle-free path. A walk is admissible when, at every step, all nodes visited
 * so far are in the tags of the next node. The graph itself can still contain
 * cycles in name space; the tags are what rule them out, so sampling here
 * needs the path so far. {@link CycleFreePathsGraph} removes that need by
 * splitting nodes.
 *
 * <p>
 * Construction is a fixed-point iteration. Each round starts from the current
 * edge set with every node tagged by the source, then visits layers 1 to
 * length - 1. For each node x of a layer it takes the walks through x, drops
 * the downstream nodes sharing x's name, prunes the result to source-to-target
 * walks and, if anything is left, tags the nodes at or after x's layer with x.
 * The union of these per-node graphs becomes the edge set for the next layer.
 * The iteration stops once a round changes neither the edges nor the tags.
 *
 * @param <N> Type of the node identifiers of the input graph.
 */
public final class PreCfpg<N> implements PathSampler<N> {
    private static final Logger log = LogManager.getLogger(PreCfpg.class);

    // Restarts allowed per sampled path before sampling gives up
    static final int MAX_RESTARTS_PER_PATH = 1000;

    private final PathsGraph<N> pathsGraph;
    private final BitSet edges;
    private final BitSet[] tags;
    private final int rounds;
    private final TopologicalOrder<N> topology;
    // tags re-indexed by topological index
    private final BitSet[] topoTags;

    private PreCfpg(PathsGraph<N> pathsGraph, BitSet edges, BitSet[] tags, int rounds) {
        this.pathsGraph = pathsGraph;
        this.edges = edges;
        this.tags = tags;
        this.rounds = rounds;
        LayeredGraph<N> arena = pathsGraph.arena();
        if (edges.isEmpty()) {
            this.topology = TopologicalOrder.<N>builder().build();
            this.topoTags = new BitSet[0];
            return;
        }
        this.topology = arena.compile(edges, pathsGraph.sourceNode(), pathsGraph.targetNode());
        this.topoTags = new BitSet[topology.nodeCount()];
        int[] toTopo = new int[arena.nodeCount()];
        Arrays.fill(toTopo, -1);
        for (int i = 0; i < arena.nodeCount(); i++)
            if (topology.contains(arena.pgNode(i)))
                toTopo[i] = topology.topoIndex(arena.pgNode(i));
        for (int i = 0; i < arena.nodeCount(); i++) {
            if (toTopo[i] < 0)
                continue;
            BitSet t = new BitSet(topology.nodeCount());
            for (int x = tags[i].nextSetBit(0); x >= 0; x = tags[i].nextSetBit(x + 1))
                if (toTopo[x] >= 0)
                    t.set(toTopo[x]);
            topoTags[toTopo[i]] = t;
        }
    }

    public static <N> PreCfpg<N> build(PathsGraph<N> pg) {
        return build(pg, null);
    }

    /**
     * Refines a paths graph into a pre-CFPG.
     *
     * @param listener Optional observer of the refinement rounds, may be null.
     * @throws IllegalStateException if the iteration fails to converge within
     *                               its round cap.
     */
    public static <N> PreCfpg<N> build(PathsGraph<N> pg, BuildListener listener) {
        LayeredGraph<N> arena = pg.arena();
        if (pg.isEmpty())
            return new PreCfpg<>(pg, new BitSet(), new BitSet[0], 0);

        final int src = pg.sourceNode(), tgt = pg.targetNode();
        final int length = pg.length();
        final boolean hasListener = listener != null;

        // Intermediate nodes named like the source or target can only close a cycle
        BitSet endpointNames = new BitSet(arena.nodeCount());
        for (int i = 0; i < arena.nodeCount(); i++)
            if (i != src && i != tgt && (arena.name(i) == arena.name(src) || arena.name(i) == arena.name(tgt)))
                endpointNames.set(i);
        BitSet h = arena.prune(arena.without(pg.edgeSet(), endpointNames), src, tgt);

        final int maxRounds = Math.max(arena.nodeCount(), arena.edgeCount()) + 2;
        BitSet[] prevTags = null;
        BitSet[] roundTags = new BitSet[arena.nodeCount()];
        int round = 0;
        while (!h.isEmpty()) {
            if (++round > maxRounds)
                throw new IllegalStateException(
                        "Pre-CFPG refinement did not converge after " + maxRounds + " rounds (length " + length + ")");
            if (hasListener)
                listener.onRoundStart(length, round, h.cardinality());
            BitSet start = h;
            roundTags = new BitSet[arena.nodeCount()];
            BitSet startNodes = arena.nodesOf(h);
            for (int i = startNodes.nextSetBit(0); i >= 0; i = startNodes.nextSetBit(i + 1)) {
                roundTags[i] = new BitSet(arena.nodeCount());
                roundTags[i].set(src);
            }

            for (int k = 1; k < length && !h.isEmpty(); k++) {
                BitSet next = new BitSet(arena.edgeCount());
                BitSet present = arena.nodesOf(h);
                for (int x = present.nextSetBit(arena.layerStart(k)); x >= 0
                        && x < arena.layerEnd(k); x = present.nextSetBit(x + 1)) {
                    BitSet gx = refineThrough(arena, h, x, src, tgt);
                    if (gx.isEmpty())
                        continue;
                    BitSet tagged = arena.nodesOf(gx);
                    for (int v = tagged.nextSetBit(arena.layerStart(k)); v >= 0; v = tagged.nextSetBit(v + 1))
                        roundTags[v].set(x);
                    next.or(gx);
                }
                h = next;
                if (hasListener)
                    listener.onLayerRefined(length, round, k, h.cardinality());
                if (log.isTraceEnabled())
                    log.trace("Length {} round {} layer {}: {} edges", length, round, k, h.cardinality());
            }

            // Tags of nodes dropped during the round are meaningless
            BitSet endNodes = arena.nodesOf(h);
            for (int i = 0; i < roundTags.length; i++)
                if (!endNodes.get(i))
                    roundTags[i] = null;

            boolean converged = h.equals(start) && Arrays.equals(roundTags, prevTags);
            if (hasListener)
                listener.onRoundEnd(length, round, h.cardinality(), converged || h.isEmpty());
            if (converged)
                break;
            prevTags = roundTags;
        }

        log.debug("Pre-CFPG {} -> {} length {}: {} rounds, {} of {} edges kept", pg.source(), pg.target(), length,
                round, h.cardinality(), pg.edgeCount());
        return new PreCfpg<>(pg, h, h.isEmpty() ? new BitSet[0] : roundTags, round);
    }

    // Walks through x, without downstream nodes repeating x's name, pruned to source-target
    private static <N> BitSet refineThrough(LayeredGraph<N> arena, BitSet h, int x, int src, int tgt) {
        BitSet fwd = arena.forwardEdges(h, x);
        BitSet repeats = new BitSet(arena.nodeCount());
        BitSet downstream = arena.nodesOf(fwd);
        for (int v = downstream.nextSetBit(x + 1); v >= 0; v = downstream.nextSetBit(v + 1))
            if (arena.name(v) == arena.name(x))
                repeats.set(v);
        BitSet gx = arena.without(fwd, repeats);
        gx.or(arena.backwardEdges(h, x));
        return arena.prune(gx, src, tgt);
    }

    public PathsGraph<N> pathsGraph() {
        return pathsGraph;
    }

    public int length() {
        return pathsGraph.length();
    }

    /** Number of refinement rounds run, the confirming round included. */
    public int rounds() {
        return rounds;
    }

    LayeredGraph<N> arena() {
        return pathsGraph.arena();
    }

    BitSet edgeSet() {
        return edges;
    }

    BitSet tagsOf(int arenaNode) {
        return tags[arenaNode];
    }

    public TopologicalOrder<N> topology() {
        return topology;
    }

    public List<PgNode<N>> nodes() {
        return topology.nodes();
    }

    public int nodeCount() {
        return topology.nodeCount();
    }

    public int edgeCount() {
        return edges.cardinality();
    }

    /** Tags of a node, in topological order. */
    public Set<PgNode<N>> tags(PgNode<N> node) {
        BitSet t = topoTags[topology.topoIndex(node)];
        Set<PgNode<N>> out = new LinkedHashSet<>();
        for (int i = t.nextSetBit(0); i >= 0; i = t.nextSetBit(i + 1))
            out.add(topology.node(i));
        return out;
    }

    @Override
    public boolean isEmpty() {
        return edges.isEmpty();
    }

    /**
     * Samples by walking with memory: a child is a candidate only if the whole
     * path so far is in its tags. A walk that runs out of candidates restarts
     * from the source.
     */
    @Override
    public List<List<N>> samplePaths(int numPaths, Random rng) {
        if (numPaths < 0)
            throw new IllegalArgumentException("numPaths must be >= 0, got " + numPaths);
        if (isEmpty() || numPaths == 0)
            return Collections.emptyList();
        List<List<N>> paths = new ArrayList<>(numPaths);
        int[] path = new int[topology.nodeCount()];
        int[] candidates = new int[topology.nodeCount()];
        for (int i = 0; i < numPaths; i++) {
            List<N> sampled = sampleOne(rng, path, candidates);
            if (sampled == null) {
                log.warn("Gave up sampling after {} restarts; returning {} of {} paths", MAX_RESTARTS_PER_PATH,
                        paths.size(), numPaths);
                break;
            }
            paths.add(sampled);
        }
        return paths;
    }

    private List<N> sampleOne(Random rng, int[] path, int[] candidates) {
        for (int attempt = 0; attempt <= MAX_RESTARTS_PER_PATH; attempt++) {
            int len = 1;
            path[0] = topology.source();
            while (!topology.isTarget(path[len - 1])) {
                int current = path[len - 1];
                int n = 0;
                for (int e = topology.childrenStart(current); e < topology.childrenEnd(current); e++)
                    if (admissible(path, len, topology.childAt(e)))
                        candidates[n++] = topology.childAt(e);
                if (n == 0)
                    break;
                path[len++] = candidates[rng.nextInt(n)];
            }
            if (topology.isTarget(path[len - 1])) {
                List<N> names = new ArrayList<>(len);
                for (int i = 0; i < len; i++)
                    names.add(topology.node(path[i]).name());
                return names;
            }
        }
        return null;
    }

    private boolean admissible(int[] path, int len, int next) {
        BitSet t = topoTags[next];
        for (int i = 0; i < len; i++)
            if (!t.get(path[i]))
                return false;
        return true;
    }

    /** Distinct admissible paths, in depth-first order of first discovery. */
    @Override
    public List<List<N>> enumeratePaths() {
        if (isEmpty())
            return Collections.emptyList();
        // Opposite-sign parallel edges reach one name sequence along several walks
        Set<List<N>> paths = new LinkedHashSet<>();
        int n = topology.nodeCount();
        int[] path = new int[n], cursor = new int[n];
        int len = 1;
        path[0] = topology.source();
        cursor[0] = topology.childrenStart(path[0]);
        while (len > 0) {
            int node = path[len - 1];
            if (cursor[len - 1] == topology.childrenEnd(node)) {
                len--;
                continue;
            }
            int child = topology.childAt(cursor[len - 1]++);
            if (!admissible(path, len, child))
                continue;
            path[len] = child;
            if (topology.isTarget(child)) {
                List<N> names = new ArrayList<>(len + 1);
                for (int i = 0; i <= len; i++)
                    names.add(topology.node(path[i]).name());
                paths.add(names);
            } else {
                cursor[len] = topology.childrenStart(child);
                len++;
            }
        }
        return new ArrayList<>(paths);
    }

    /**
     * Counts the paths by enumerating them, which is exponential in the worst
     * case. The split graph counts the same paths in linear time, see
     * {@link CycleFreePathsGraph#countPaths()}.
     */
    @Override
    public long countPaths() {
        return enumeratePaths().size();
    }

    @Override
    public String toString() {
        return "PreCfpg[" + pathsGraph.source() + " -> " + pathsGraph.target() + ", length " + length() + ", "
                + nodeCount() + " nodes, " + edgeCount() + " edges, " + rounds + " rounds]";
    }
}
