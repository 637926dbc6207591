package com.causal.cfpg.engine;

import com.causal.cfpg.node.PgNode;

import java.util.*;

/**
 * Arena of the candidate nodes and edges of a paths graph of one length.
 *
 * <p>
 * Nodes are dense ids assigned layer by layer, so ids grow with the layer and
 * every edge goes from layer k to layer k + 1. The arena itself never changes:
 * the raw paths graph, the pre-CFPG refinement and the CFPG split all describe
 * their graphs as {@link BitSet}s of edge ids over it. Because of the layer
 * ordering a single ascending (or descending) pass over node ids is enough
 * for reachability.
 */
final class LayeredGraph<N> {
    private final Digraph<N> graph;
    private final int length;
    private final int[] layer, name, polarity;
    private final int[] layerStart;
    private final int[] edgeFrom, edgeTo;
    private final int[] outOffset, outEdges, inOffset, inEdges;
    private final List<PgNode<N>> pgNodes;

    LayeredGraph(Digraph<N> graph, int length, int[] layer, int[] name, int[] polarity, int[] edgeFrom,
            int[] edgeTo) {
        this.graph = graph;
        this.length = length;
        this.layer = layer;
        this.name = name;
        this.polarity = polarity;
        this.edgeFrom = edgeFrom;
        this.edgeTo = edgeTo;
        int n = layer.length, m = edgeFrom.length;

        layerStart = new int[length + 2];
        for (int i = 0; i < n; i++)
            layerStart[layer[i] + 1]++;
        for (int k = 0; k <= length; k++)
            layerStart[k + 1] += layerStart[k];

        outOffset = new int[n + 1];
        inOffset = new int[n + 1];
        for (int e = 0; e < m; e++) {
            if (layer[edgeTo[e]] != layer[edgeFrom[e]] + 1)
                throw new IllegalArgumentException("Edge " + e + " does not connect adjacent layers");
            outOffset[edgeFrom[e] + 1]++;
            inOffset[edgeTo[e] + 1]++;
        }
        for (int i = 0; i < n; i++) {
            outOffset[i + 1] += outOffset[i];
            inOffset[i + 1] += inOffset[i];
        }
        outEdges = new int[m];
        inEdges = new int[m];
        int[] outFill = Arrays.copyOf(outOffset, n), inFill = Arrays.copyOf(inOffset, n);
        for (int e = 0; e < m; e++) {
            outEdges[outFill[edgeFrom[e]]++] = e;
            inEdges[inFill[edgeTo[e]]++] = e;
        }

        List<PgNode<N>> nodes = new ArrayList<>(n);
        for (int i = 0; i < n; i++)
            nodes.add(new PgNode<>(layer[i], graph.name(name[i]), polarity[i]));
        this.pgNodes = Collections.unmodifiableList(nodes);
    }

    Digraph<N> graph() {
        return graph;
    }

    int length() {
        return length;
    }

    int nodeCount() {
        return layer.length;
    }

    int edgeCount() {
        return edgeFrom.length;
    }

    int layer(int node) {
        return layer[node];
    }

    int name(int node) {
        return name[node];
    }

    int polarity(int node) {
        return polarity[node];
    }

    int from(int edge) {
        return edgeFrom[edge];
    }

    int to(int edge) {
        return edgeTo[edge];
    }

    PgNode<N> pgNode(int node) {
        return pgNodes.get(node);
    }

    int layerStart(int k) {
        return layerStart[k];
    }

    int layerEnd(int k) {
        return layerStart[k + 1];
    }

    /**
     * Layer-qualified key of a node, unique across arenas built from the same
     * input graph whatever their length.
     */
    int key(int node) {
        int k = Math.addExact(Math.multiplyExact(layer[node], graph.nodeCount()), name[node]);
        return Math.addExact(Math.multiplyExact(k, 2), polarity[node]);
    }

    BitSet allEdges() {
        BitSet all = new BitSet(edgeFrom.length);
        all.set(0, edgeFrom.length);
        return all;
    }

    /** Nodes reachable from {@code start} over the given edges, start included. */
    BitSet reachableFrom(BitSet edges, int start) {
        BitSet reach = new BitSet(layer.length);
        reach.set(start);
        for (int u = start; u >= 0; u = reach.nextSetBit(u + 1))
            for (int i = outOffset[u]; i < outOffset[u + 1]; i++)
                if (edges.get(outEdges[i]))
                    reach.set(edgeTo[outEdges[i]]);
        return reach;
    }

    /** Nodes that reach {@code end} over the given edges, end included. */
    BitSet coReachableTo(BitSet edges, int end) {
        BitSet co = new BitSet(layer.length);
        co.set(end);
        for (int v = end; v >= 0; v = co.previousSetBit(v - 1))
            for (int i = inOffset[v]; i < inOffset[v + 1]; i++)
                if (edges.get(inEdges[i]))
                    co.set(edgeFrom[inEdges[i]]);
        return co;
    }

    /**
     * Keeps the edges lying on some start-to-end path. Empty if end is not
     * reachable from start.
     */
    BitSet prune(BitSet edges, int start, int end) {
        BitSet reach = reachableFrom(edges, start);
        BitSet kept = new BitSet(edgeFrom.length);
        if (!reach.get(end) || start == end)
            return kept;
        BitSet co = coReachableTo(edges, end);
        for (int e = edges.nextSetBit(0); e >= 0; e = edges.nextSetBit(e + 1))
            if (reach.get(edgeFrom[e]) && co.get(edgeTo[e]))
                kept.set(e);
        return kept;
    }

    /** Edges on walks leaving {@code node}. */
    BitSet forwardEdges(BitSet edges, int node) {
        BitSet reach = reachableFrom(edges, node);
        BitSet out = new BitSet(edgeFrom.length);
        for (int e = edges.nextSetBit(0); e >= 0; e = edges.nextSetBit(e + 1))
            if (reach.get(edgeFrom[e]))
                out.set(e);
        return out;
    }

    /** Edges on walks entering {@code node}. */
    BitSet backwardEdges(BitSet edges, int node) {
        BitSet co = coReachableTo(edges, node);
        BitSet out = new BitSet(edgeFrom.length);
        for (int e = edges.nextSetBit(0); e >= 0; e = edges.nextSetBit(e + 1))
            if (co.get(edgeTo[e]))
                out.set(e);
        return out;
    }

    BitSet nodesOf(BitSet edges) {
        BitSet nodes = new BitSet(layer.length);
        for (int e = edges.nextSetBit(0); e >= 0; e = edges.nextSetBit(e + 1)) {
            nodes.set(edgeFrom[e]);
            nodes.set(edgeTo[e]);
        }
        return nodes;
    }

    /** Edges with both endpoints in {@code nodes}. */
    BitSet induced(BitSet edges, BitSet nodes) {
        BitSet out = new BitSet(edgeFrom.length);
        for (int e = edges.nextSetBit(0); e >= 0; e = edges.nextSetBit(e + 1))
            if (nodes.get(edgeFrom[e]) && nodes.get(edgeTo[e]))
                out.set(e);
        return out;
    }

    /** Edges with neither endpoint in {@code nodes}. */
    BitSet without(BitSet edges, BitSet nodes) {
        BitSet out = new BitSet(edgeFrom.length);
        for (int e = edges.nextSetBit(0); e >= 0; e = edges.nextSetBit(e + 1))
            if (!nodes.get(edgeFrom[e]) && !nodes.get(edgeTo[e]))
                out.set(e);
        return out;
    }

    /** Predecessors of {@code node} over the given edges. */
    BitSet predecessors(BitSet edges, int node) {
        BitSet preds = new BitSet(layer.length);
        for (int i = inOffset[node]; i < inOffset[node + 1]; i++)
            if (edges.get(inEdges[i]))
                preds.set(edgeFrom[inEdges[i]]);
        return preds;
    }

    /**
     * Compiles the given edges into a walkable structure with unit weights.
     */
    TopologicalOrder<N> compile(BitSet edges, int source, int target) {
        TopologicalOrder.Builder<N> builder = TopologicalOrder.builder();
        if (edges.isEmpty())
            return builder.build();
        BitSet nodes = nodesOf(edges);
        for (int i = nodes.nextSetBit(0); i >= 0; i = nodes.nextSetBit(i + 1))
            builder.addNode(pgNodes.get(i));
        for (int e = edges.nextSetBit(0); e >= 0; e = edges.nextSetBit(e + 1))
            builder.addEdge(pgNodes.get(edgeFrom[e]), pgNodes.get(edgeTo[e]));
        return builder.markSource(pgNodes.get(source)).markTarget(pgNodes.get(target)).build();
    }
}
