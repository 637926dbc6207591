package com.causal.cfpg.engine;

import com.causal.cfpg.node.SignedNode;

import java.util.*;

/**
 * Per-depth forward and backward reachable sets between a source and a target.
 *
 * <p>
 * {@code forward(k)} holds the (name, polarity) pairs reachable from the source
 * by a walk of exactly {@code k} edges; {@code backward(k)} holds the pairs
 * that reach the target by a walk of exactly {@code k} edges, where the
 * polarity is the net sign of that walk. In unsigned mode every polarity is 0.
 *
 * <p>
 * Levels are stored as bitsets over {@code nodeIndex * 2 + polarity}. Levels
 * past the last non-empty one, up to {@link #maxDepth()}, are empty. When the
 * target is never reached forward, or the source never backward, both
 * directions are empty and {@link #isEmpty()} is true.
 *
 * @param <N> Type of the node identifiers of the input graph.
 */
public final class ReachableLevels<N> {
    private static final BitSet NONE = new BitSet();

    private final Digraph<N> graph;
    private final int source, target;
    private final int maxDepth;
    private final boolean signed;
    private final List<BitSet> forward, backward;

    ReachableLevels(Digraph<N> graph, int source, int target, int maxDepth, boolean signed,
            List<BitSet> forward, List<BitSet> backward) {
        this.graph = graph;
        this.source = source;
        this.target = target;
        this.maxDepth = maxDepth;
        this.signed = signed;
        this.forward = forward;
        this.backward = backward;
    }

    public Digraph<N> graph() {
        return graph;
    }

    public N source() {
        return graph.name(source);
    }

    public N target() {
        return graph.name(target);
    }

    int sourceIndex() {
        return source;
    }

    int targetIndex() {
        return target;
    }

    public int maxDepth() {
        return maxDepth;
    }

    public boolean signed() {
        return signed;
    }

    /** True if no source-to-target walk of any depth up to maxDepth exists. */
    public boolean isEmpty() {
        return forward.isEmpty();
    }

    /** Number of non-empty forward levels, level 0 included. */
    public int forwardDepth() {
        return forward.size();
    }

    public int backwardDepth() {
        return backward.size();
    }

    public Set<SignedNode<N>> forward(int depth) {
        return decode(forwardBits(depth));
    }

    public Set<SignedNode<N>> backward(int depth) {
        return decode(backwardBits(depth));
    }

    BitSet forwardBits(int depth) {
        return depth < forward.size() ? forward.get(depth) : NONE;
    }

    BitSet backwardBits(int depth) {
        return depth < backward.size() ? backward.get(depth) : NONE;
    }

    private Set<SignedNode<N>> decode(BitSet level) {
        Set<SignedNode<N>> out = new LinkedHashSet<>();
        for (int k = level.nextSetBit(0); k >= 0; k = level.nextSetBit(k + 1))
            out.add(new SignedNode<>(graph.name(k >> 1), k & 1));
        return Collections.unmodifiableSet(out);
    }
}
