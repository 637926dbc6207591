package com.causal.cfpg.engine;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collections;
import java.util.List;

import lombok.extern.log4j.Log4j2;

/**
 * Exact-depth reachability between a source and a target.
 *
 * Both directions are breadth-first expansions over the CSR arrays of the
 * {@link Digraph}, one level per edge, so a node reappears at every depth a
 * cycle lets it be reached again. Expansion in a direction stops at the first
 * empty level.
 *
 * In signed mode a state is a (node, polarity) pair: crossing an edge of sign
 * s from polarity p gives polarity p ^ s, and unsigned edges are skipped.
 */
@Log4j2
public final class ReachabilitySets {

    private ReachabilitySets() {
    }

    /**
     * Computes forward levels from {@code source} and backward levels from
     * {@code target}, each up to {@code maxDepth} edges.
     *
     * @throws IllegalArgumentException if either endpoint is not in the graph,
     *                                  they are equal, or maxDepth is below 1.
     */
    public static <N> ReachableLevels<N> compute(Digraph<N> graph, N source, N target, int maxDepth,
            boolean signed) {
        int src = graph.indexOf(source);
        int tgt = graph.indexOf(target);
        if (src == tgt)
            throw new IllegalArgumentException("Source and target must differ: " + source);
        if (maxDepth < 1)
            throw new IllegalArgumentException("maxDepth must be at least 1, got " + maxDepth);

        List<BitSet> fwd = expand(graph, src, maxDepth, signed, true);
        List<BitSet> bwd = expand(graph, tgt, maxDepth, signed, false);

        boolean targetReached = reaches(fwd, tgt), sourceReached = reaches(bwd, src);
        if (!targetReached || !sourceReached) {
            log.debug("No walk from {} to {} within {} steps", source, target, maxDepth);
            return new ReachableLevels<>(graph, src, tgt, maxDepth, signed, Collections.emptyList(),
                    Collections.emptyList());
        }
        log.debug("Reachable sets {} -> {}: {} forward levels, {} backward levels", source, target, fwd.size(),
                bwd.size());
        return new ReachableLevels<>(graph, src, tgt, maxDepth, signed, fwd, bwd);
    }

    private static <N> List<BitSet> expand(Digraph<N> graph, int start, int maxDepth, boolean signed,
            boolean forward) {
        List<BitSet> levels = new ArrayList<>();
        BitSet current = new BitSet();
        current.set(start << 1);
        levels.add(current);
        for (int depth = 1; depth <= maxDepth; depth++) {
            BitSet next = new BitSet();
            for (int k = current.nextSetBit(0); k >= 0; k = current.nextSetBit(k + 1)) {
                int node = k >> 1, pol = k & 1;
                int begin = forward ? graph.outStart(node) : graph.inStart(node);
                int end = forward ? graph.outEnd(node) : graph.inEnd(node);
                for (int e = begin; e < end; e++) {
                    int sign = forward ? graph.outSignAt(e) : graph.inSignAt(e);
                    int other = forward ? graph.outTargetAt(e) : graph.inSourceAt(e);
                    if (!signed) {
                        next.set(other << 1);
                    } else if (sign != Digraph.UNSIGNED) {
                        next.set(other << 1 | (pol ^ sign));
                    }
                }
            }
            if (next.isEmpty())
                break;
            levels.add(next);
            current = next;
        }
        return levels;
    }

    // Checks depths >= 1 only: level 0 holds the start node itself
    private static boolean reaches(List<BitSet> levels, int node) {
        for (int d = 1; d < levels.size(); d++) {
            BitSet level = levels.get(d);
            if (level.get(node << 1) || level.get(node << 1 | 1))
                return true;
        }
        return false;
    }
}
