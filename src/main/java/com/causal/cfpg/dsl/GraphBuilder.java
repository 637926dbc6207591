package com.causal.cfpg.dsl;

import com.causal.cfpg.engine.Digraph;

/**
 * Graph Builder -- fluent API for the input graph.
 *
 * Usage Pattern:
 * 1. Create a builder: GraphBuilder&lt;String&gt; g = GraphBuilder.create("egfr");
 * 2. Add edges: g.activates("EGF", "EGFR").inhibits("EGFR", "GRB2");
 * 3. Build: Digraph&lt;String&gt; graph = g.build();
 *
 * Activation is sign 0 and inhibition sign 1. Plain {@link #edge} calls add
 * unsigned edges, which signed searches ignore. The same pair may be joined by
 * both an activating and an inhibiting edge.
 *
 * @param <N> Type of the node identifiers.
 */
public final class GraphBuilder<N> {
    private final String graphName;
    private final Digraph.Builder<N> builder = Digraph.builder();

    // Flag to prevent modification after building
    private boolean built;

    private GraphBuilder(String graphName) {
        this.graphName = graphName;
    }

    public static <N> GraphBuilder<N> create(String graphName) {
        return new GraphBuilder<>(graphName);
    }

    public String name() {
        return graphName;
    }

    /** Adds an isolated node, or does nothing if it exists. */
    public GraphBuilder<N> node(N name) {
        checkNotBuilt();
        builder.addNode(name);
        return this;
    }

    public GraphBuilder<N> edge(N from, N to) {
        checkNotBuilt();
        builder.addEdge(from, to);
        return this;
    }

    /**
     * Adds a signed edge.
     *
     * @param sign 0 for activation, 1 for inhibition.
     */
    public GraphBuilder<N> edge(N from, N to, int sign) {
        checkNotBuilt();
        builder.addEdge(from, to, sign);
        return this;
    }

    public GraphBuilder<N> activates(N from, N to) {
        return edge(from, to, 0);
    }

    public GraphBuilder<N> inhibits(N from, N to) {
        return edge(from, to, 1);
    }

    /** Adds unsigned edges along a chain of nodes. */
    @SafeVarargs
    public final GraphBuilder<N> chain(N... nodes) {
        for (int i = 0; i + 1 < nodes.length; i++)
            edge(nodes[i], nodes[i + 1]);
        return this;
    }

    public Digraph<N> build() {
        checkNotBuilt();
        built = true;
        return builder.build();
    }

    private void checkNotBuilt() {
        if (built)
            throw new IllegalStateException("Graph '" + graphName + "' already built");
    }
}
