package com.causal.cfpg.util;

import com.causal.cfpg.api.BuildListener;

/**
 * A listener that logs construction progress and tracks its cost.
 *
 * <p>
 * Captures:
 * <ul>
 * <li><b>Rounds:</b> total refinement rounds and the duration of the last one
 * (in nanoseconds).</li>
 * <li><b>Splits:</b> how many extra copies node splitting created.</li>
 * <li><b>Output:</b> node and edge counts of the last cycle-free paths
 * graph.</li>
 * </ul>
 *
 * <p>
 * Round summaries go to DEBUG, per-layer detail to TRACE.
 */
public final class LoggingBuildListener implements BuildListener {
    private static final org.apache.logging.log4j.Logger log = org.apache.logging.log4j.LogManager
            .getLogger(LoggingBuildListener.class);

    private long roundStartNanos, lastRoundNanos, totalRoundNanos;
    private int totalRounds, extraCopies;
    private int lastCfpgNodes, lastCfpgEdges;

    @Override
    public void onRoundStart(int length, int round, int edges) {
        roundStartNanos = System.nanoTime();
    }

    @Override
    public void onLayerRefined(int length, int round, int layer, int edges) {
        log.trace("length={} round={} layer={} edges={}", length, round, layer, edges);
    }

    @Override
    public void onRoundEnd(int length, int round, int edges, boolean converged) {
        lastRoundNanos = System.nanoTime() - roundStartNanos;
        totalRoundNanos += lastRoundNanos;
        totalRounds++;
        log.debug("length={} round={} edges={} converged={} took {} us", length, round, edges, converged,
                lastRoundNanos / 1000);
    }

    @Override
    public void onLayerSplit(int length, int layer, int original, int copies) {
        extraCopies += copies - original;
        log.trace("length={} layer={} split {} nodes into {} copies", length, layer, original, copies);
    }

    @Override
    public void onCfpgBuilt(int length, int nodes, int edges) {
        lastCfpgNodes = nodes;
        lastCfpgEdges = edges;
        log.debug("length={} CFPG built: {} nodes, {} edges", length, nodes, edges);
    }

    public int totalRounds() {
        return totalRounds;
    }

    public long lastRoundNanos() {
        return lastRoundNanos;
    }

    public double avgRoundMicros() {
        return totalRounds > 0 ? totalRoundNanos / 1000.0 / totalRounds : 0;
    }

    /** Copies created beyond one per pre-CFPG node; negative if nodes were dropped. */
    public int extraCopies() {
        return extraCopies;
    }

    public int lastCfpgNodes() {
        return lastCfpgNodes;
    }

    public int lastCfpgEdges() {
        return lastCfpgEdges;
    }

    public void reset() {
        totalRounds = 0;
        totalRoundNanos = 0;
        lastRoundNanos = 0;
        extraCopies = 0;
        lastCfpgNodes = 0;
        lastCfpgEdges = 0;
    }
}
