package com.causal.cfpg.util;

import com.causal.cfpg.api.BuildListener;
import java.util.Arrays;

/**
 * Aggregates multiple {@link BuildListener} instances.
 */
public class CompositeBuildListener implements BuildListener {
    private BuildListener[] listeners = new BuildListener[0];

    public CompositeBuildListener add(BuildListener listener) {
        BuildListener[] old = listeners;
        BuildListener[] next = Arrays.copyOf(old, old.length + 1);
        next[old.length] = listener;
        listeners = next;
        return this;
    }

    public int size() {
        return listeners.length;
    }

    @Override
    public void onRoundStart(int length, int round, int edges) {
        for (BuildListener l : listeners)
            l.onRoundStart(length, round, edges);
    }

    @Override
    public void onLayerRefined(int length, int round, int layer, int edges) {
        for (BuildListener l : listeners)
            l.onLayerRefined(length, round, layer, edges);
    }

    @Override
    public void onRoundEnd(int length, int round, int edges, boolean converged) {
        for (BuildListener l : listeners)
            l.onRoundEnd(length, round, edges, converged);
    }

    @Override
    public void onLayerSplit(int length, int layer, int original, int copies) {
        for (BuildListener l : listeners)
            l.onLayerSplit(length, layer, original, copies);
    }

    @Override
    public void onCfpgBuilt(int length, int nodes, int edges) {
        for (BuildListener l : listeners)
            l.onCfpgBuilt(length, nodes, edges);
    }
}
