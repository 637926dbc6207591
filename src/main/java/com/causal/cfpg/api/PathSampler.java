package com.causal.cfpg.api;

import java.util.List;
import java.util.Random;

/**
 * Sampling, enumeration and counting of source-to-target paths.
 *
 * <p>
 * Implemented by every paths structure: the raw paths graph (cycles allowed),
 * the tag-based pre-CFPG, the split cycle-free paths graph and combinations of
 * them. Callers pick the structure explicitly; the operations behave the same
 * on each.
 *
 * <p>
 * A path is returned as the list of node names from source to target. An
 * empty structure yields empty lists and a zero count, never an exception.
 *
 * @param <N> Type of the node identifiers of the input graph.
 */
public interface PathSampler<N> {

    /**
     * Draws {@code numPaths} paths by random walks from the source.
     *
     * @param numPaths Number of paths to draw, at least 0.
     * @param rng      Random source. Passing generators with equal seeds yields
     *                 identical samples.
     * @return The sampled paths, in draw order; empty if the structure is empty.
     */
    List<List<N>> samplePaths(int numPaths, Random rng);

    /**
     * Lists every path of the structure once per walk through it, in a
     * deterministic order.
     */
    List<List<N>> enumeratePaths();

    /**
     * Number of paths {@link #enumeratePaths()} would return.
     *
     * @throws ArithmeticException if the count does not fit in a long.
     */
    long countPaths();

    boolean isEmpty();
}
