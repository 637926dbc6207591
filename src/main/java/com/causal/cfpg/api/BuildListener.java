package com.causal.cfpg.api;

/**
 * Observability interface for the construction of cycle-free paths graphs.
 *
 * Implementations can be passed to the pre-CFPG and CFPG builders to receive
 * callbacks while the structure is refined. This is the mechanism for:
 *
 * - Profiling: measuring how long each refinement round takes.
 * - Debugging: tracing how many edges survive each level of a round.
 * - Metrics: counting rounds and node splits per path length.
 *
 * Callbacks run inside the build loop; keep them light.
 */
public interface BuildListener {

    /**
     * Called before a pre-CFPG refinement round starts.
     *
     * @param length Path length of the structure being refined.
     * @param round  1-based round number.
     * @param edges  Number of edges entering the round.
     */
    void onRoundStart(int length, int round, int edges);

    /**
     * Called after one layer of a round has been refined.
     *
     * @param layer Layer whose nodes were just processed.
     * @param edges Number of edges left after processing the layer.
     */
    void onLayerRefined(int length, int round, int layer, int edges);

    /**
     * Called when a refinement round is complete.
     *
     * @param converged true if this round left both edges and tags unchanged.
     */
    void onRoundEnd(int length, int round, int edges, boolean converged);

    /**
     * Called after the nodes of one layer have been split into history copies.
     *
     * @param layer    Layer that was split.
     * @param original Number of distinct pre-CFPG nodes at the layer.
     * @param copies   Number of copies created for them.
     */
    void onLayerSplit(int length, int layer, int original, int copies);

    /**
     * Called once a cycle-free paths graph is complete.
     */
    void onCfpgBuilt(int length, int nodes, int edges);
}
