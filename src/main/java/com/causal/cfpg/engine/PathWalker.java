package com.causal.cfpg.engine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * The runtime that walks a compiled {@link TopologicalOrder}.
 *
 * Walks are memoryless: the next node depends only on the current node and the
 * outgoing edge weights. Every operation starts at the source and stops at the
 * first terminal node.
 *
 * Algorithm Details:
 *
 * 1. Sample: at each node the child is drawn with probability proportional to
 * the weight of its edge, using the caller's Random.
 *
 * 2. Enumerate: iterative depth-first search over the CSR children, children
 * visited in storage order.
 *
 * 3. Count: a single reverse scan of the topological order. A terminal node
 * counts 1, any other node the sum over its children. Because parents come
 * before children in the order, each node is finished before its parents are
 * visited.
 *
 * 4. Uniform weights: the same scan in floating point; the edge u -> v then
 * gets weight paths(v) / paths(u), which makes every complete walk equally
 * likely.
 *
 * Walks and paths coincide only when no node has two children of the same name;
 * the owners of a walker merge by name before handing it a topology.
 */
public final class PathWalker<N> {
    private static final Logger log = LogManager.getLogger(PathWalker.class);

    private final TopologicalOrder<N> topology;

    public PathWalker(TopologicalOrder<N> topology) {
        this.topology = topology;
    }

    public TopologicalOrder<N> topology() {
        return topology;
    }

    public boolean isEmpty() {
        return topology.nodeCount() == 0;
    }

    public List<List<N>> samplePaths(int numPaths, Random rng) {
        if (numPaths < 0)
            throw new IllegalArgumentException("numPaths must be >= 0, got " + numPaths);
        if (isEmpty() || numPaths == 0)
            return Collections.emptyList();
        List<List<N>> paths = new ArrayList<>(numPaths);
        for (int i = 0; i < numPaths; i++)
            paths.add(sampleOne(rng));
        return paths;
    }

    private List<N> sampleOne(Random rng) {
        List<N> path = new ArrayList<>();
        int current = topology.source();
        path.add(topology.node(current).name());
        while (!topology.isTarget(current)) {
            current = pickChild(current, rng);
            path.add(topology.node(current).name());
        }
        return path;
    }

    private int pickChild(int ti, Random rng) {
        final int start = topology.childrenStart(ti);
        final int end = topology.childrenEnd(ti);
        if (start == end)
            throw new IllegalStateException("Walk stuck at non-terminal node " + topology.node(ti));
        double total = 0;
        for (int e = start; e < end; e++)
            total += topology.weightAt(e);
        double r = rng.nextDouble() * total;
        for (int e = start; e < end; e++) {
            r -= topology.weightAt(e);
            if (r < 0)
                return topology.childAt(e);
        }
        // Rounding left r at or just above zero: take the last child with weight
        for (int e = end - 1; e >= start; e--)
            if (topology.weightAt(e) > 0)
                return topology.childAt(e);
        return topology.childAt(end - 1);
    }

    public List<List<N>> enumeratePaths() {
        if (isEmpty())
            return Collections.emptyList();
        List<List<N>> paths = new ArrayList<>();
        int n = topology.nodeCount();
        int[] stack = new int[n];
        int[] cursor = new int[n];
        int depth = 0;
        stack[0] = topology.source();
        cursor[0] = topology.childrenStart(stack[0]);
        if (topology.isTarget(stack[0])) {
            paths.add(namesOf(stack, 1));
            return paths;
        }
        while (depth >= 0) {
            int node = stack[depth];
            if (cursor[depth] == topology.childrenEnd(node)) {
                depth--;
                continue;
            }
            int child = topology.childAt(cursor[depth]++);
            if (topology.isTarget(child)) {
                stack[depth + 1] = child;
                paths.add(namesOf(stack, depth + 2));
            } else {
                depth++;
                stack[depth] = child;
                cursor[depth] = topology.childrenStart(child);
            }
        }
        return paths;
    }

    private List<N> namesOf(int[] stack, int len) {
        List<N> path = new ArrayList<>(len);
        for (int i = 0; i < len; i++)
            path.add(topology.node(stack[i]).name());
        return path;
    }

    public long countPaths() {
        if (isEmpty())
            return 0;
        int n = topology.nodeCount();
        long[] counts = new long[n];
        for (int ti = n - 1; ti >= 0; ti--) {
            if (topology.isTarget(ti)) {
                counts[ti] = 1;
                continue;
            }
            long c = 0;
            for (int e = topology.childrenStart(ti); e < topology.childrenEnd(ti); e++)
                c = Math.addExact(c, counts[topology.childAt(e)]);
            counts[ti] = c;
        }
        return counts[topology.source()];
    }

    /** Floating-point number of terminal walks starting at each node. */
    double[] pathsToTarget() {
        int n = topology.nodeCount();
        double[] counts = new double[n];
        for (int ti = n - 1; ti >= 0; ti--) {
            if (topology.isTarget(ti)) {
                counts[ti] = 1;
                continue;
            }
            double c = 0;
            for (int e = topology.childrenStart(ti); e < topology.childrenEnd(ti); e++)
                c += counts[topology.childAt(e)];
            counts[ti] = c;
        }
        return counts;
    }

    /**
     * Reweights every edge so that each complete walk is drawn with equal
     * probability.
     */
    public void setUniformPathDistribution() {
        if (isEmpty())
            return;
        double[] counts = pathsToTarget();
        for (int ti = 0; ti < topology.nodeCount(); ti++) {
            if (counts[ti] == 0)
                continue;
            for (int e = topology.childrenStart(ti); e < topology.childrenEnd(ti); e++)
                topology.setWeightAt(e, counts[topology.childAt(e)] / counts[ti]);
        }
        log.trace("Uniform weights set over {} walks", counts[topology.source()]);
    }
}
