package com.causal.cfpg;

import com.causal.cfpg.api.*;
import com.causal.cfpg.dsl.GraphBuilder;
import com.causal.cfpg.engine.*;
import com.causal.cfpg.io.PathOptions;
import com.causal.cfpg.io.PathOptionsLoader;

import java.util.*;

import lombok.extern.log4j.Log4j2;

/**
 * Cycle-free paths between a source and a target of a directed graph.
 *
 * <h2>Overview</h2>
 * <p>
 * Finding every simple path of a given length is exponential in general. This
 * library instead builds, per length, a compact layered graph in which plain
 * random walks from the source produce exactly the cycle-free paths of that
 * length:
 * <ul>
 * <li><b>Reachability:</b> exact-depth forward and backward reachable sets
 * ({@link ReachabilitySets}).</li>
 * <li><b>Paths graph:</b> the layered graph of all walks of one length
 * ({@link PathsGraph}), cycles included.</li>
 * <li><b>Pre-CFPG:</b> tags recording which upstream nodes may precede each
 * node on a cycle-free path ({@link PreCfpg}).</li>
 * <li><b>CFPG:</b> nodes split by history so walks need no memory
 * ({@link CycleFreePathsGraph}).</li>
 * </ul>
 * Every structure implements {@link PathSampler}. Edges may carry signs
 * (activation 0, inhibition 1), in which case paths can be restricted to a net
 * sign.
 *
 * <p>
 * The static helpers here run the pipeline for every length from 1 to the
 * configured maximum depth, computing the reachable sets once.
 */
@Log4j2
public final class Cfpg {

    private Cfpg() {
        // Prevent instantiation of utility class
    }

    /**
     * Entry point: create a new input graph builder.
     *
     * @param graphName A descriptive name for the graph.
     */
    public static <N> GraphBuilder<N> builder(String graphName) {
        return GraphBuilder.create(graphName);
    }

    /**
     * Builds one sampler per path length that has at least one path.
     *
     * @param listener Optional construction observer, may be null.
     * @return Samplers keyed by length, in increasing length order.
     * @throws IllegalArgumentException on invalid endpoints or options.
     */
    public static <N> SortedMap<Integer, PathSampler<N>> samplersByDepth(Digraph<N> graph, N source, N target,
            PathOptions options, BuildListener listener) {
        PathOptionsLoader.validate(options);
        int maxDepth = options.getMaxDepth() != null ? options.getMaxDepth() : graph.nodeCount();
        ReachableLevels<N> levels = ReachabilitySets.compute(graph, source, target, maxDepth, options.isSigned());
        SortedMap<Integer, PathSampler<N>> samplers = new TreeMap<>();
        if (levels.isEmpty()) {
            log.info("{} -> {}: target not reachable within {} steps", source, target, maxDepth);
            return samplers;
        }
        for (int length = 1; length <= maxDepth; length++) {
            PathsGraph<N> pg = PathsGraph.build(levels, length, options.getTargetPolarity());
            if (pg.isEmpty())
                continue;
            if (options.isCycleFree()) {
                CycleFreePathsGraph<N> cfpg = CycleFreePathsGraph.build(PreCfpg.build(pg, listener), listener);
                if (cfpg.isEmpty())
                    continue;
                if (options.isUniform())
                    cfpg.setUniformPathDistribution();
                samplers.put(length, cfpg);
            } else {
                if (options.isUniform())
                    pg.setUniformPathDistribution();
                samplers.put(length, pg);
            }
        }
        log.info("{} -> {}: paths found at lengths {} (max depth {}, cycleFree={}, signed={})", source, target,
                samplers.keySet(), maxDepth, options.isCycleFree(), options.isSigned());
        return samplers;
    }

    public static <N> List<List<N>> samplePaths(Digraph<N> graph, N source, N target, PathOptions options) {
        return samplePaths(graph, source, target, options, null);
    }

    /**
     * Draws {@code numSamples} paths from every length that has paths and
     * returns them shortest length first.
     */
    public static <N> List<List<N>> samplePaths(Digraph<N> graph, N source, N target, PathOptions options,
            BuildListener listener) {
        var samplers = samplersByDepth(graph, source, target, options, listener);
        Random rng = options.getSeed() != null ? new Random(options.getSeed()) : new Random();
        List<List<N>> paths = new ArrayList<>();
        for (PathSampler<N> sampler : samplers.values())
            paths.addAll(sampler.samplePaths(options.getNumSamples(), rng));
        return paths;
    }

    public static <N> List<List<N>> enumeratePaths(Digraph<N> graph, N source, N target, PathOptions options) {
        List<List<N>> paths = new ArrayList<>();
        for (PathSampler<N> sampler : samplersByDepth(graph, source, target, options, null).values())
            paths.addAll(sampler.enumeratePaths());
        return paths;
    }

    public static <N> long countPaths(Digraph<N> graph, N source, N target, PathOptions options) {
        long total = 0;
        for (PathSampler<N> sampler : samplersByDepth(graph, source, target, options, null).values())
            total = Math.addExact(total, sampler.countPaths());
        return total;
    }

    /**
     * Builds every length up to the maximum depth and combines them into one
     * structure whose walks end at the target at any of those lengths.
     */
    @SuppressWarnings("unchecked")
    public static <N> CombinedPathsGraph<N> combinedByDepth(Digraph<N> graph, N source, N target,
            PathOptions options) {
        var samplers = samplersByDepth(graph, source, target, options, null);
        if (options.isCycleFree()) {
            Map<Integer, CycleFreePathsGraph<N>> cfpgs = new TreeMap<>();
            samplers.forEach((length, s) -> cfpgs.put(length, (CycleFreePathsGraph<N>) s));
            return cfpgs.isEmpty() ? CombinedPathsGraph.empty(source, target) : CombinedPathsGraph.combineCfpgs(cfpgs);
        }
        Map<Integer, PathsGraph<N>> pgs = new TreeMap<>();
        samplers.forEach((length, s) -> pgs.put(length, (PathsGraph<N>) s));
        return pgs.isEmpty() ? CombinedPathsGraph.empty(source, target) : CombinedPathsGraph.combinePathsGraphs(pgs);
    }
}
