package com.causal.cfpg.util;

import com.causal.cfpg.engine.TopologicalOrder;
import com.causal.cfpg.node.PgNode;

import java.util.Locale;

/**
 * Diagnostic utility for inspecting compiled paths structures.
 *
 * <p>
 * This class generates human-readable string representations of any
 * {@link TopologicalOrder}: raw paths graphs, pre-CFPGs, cycle-free paths
 * graphs and their combinations.
 *
 * <p>
 * <b>Usage:</b> Intended for debugging sessions and trace logging. Do
 * <b>not</b> use inside sampling loops (allocates strings, iterates
 * collections).
 */
public final class GraphExplain<N> {
    private final TopologicalOrder<N> topology;

    public GraphExplain(TopologicalOrder<N> topology) {
        this.topology = topology;
    }

    /**
     * Dumps detailed state of a single node.
     */
    public String explainNode(PgNode<N> node) {
        int idx = topology.topoIndex(node);
        StringBuilder sb = new StringBuilder(256);
        sb.append("Node: ").append(label(node)).append('\n')
                .append("  Topo index: ").append(idx).append('\n')
                .append("  Layer: ").append(node.layer()).append('\n')
                .append("  Polarity: ").append(node.polarity()).append('\n')
                .append("  History: ").append(node.isSplit() ? node.history() : "-").append('\n')
                .append("  Is source: ").append(topology.source() == idx).append('\n')
                .append("  Is target: ").append(topology.isTarget(idx)).append('\n')
                .append("  Parents: ").append(topology.parentCount(idx)).append('\n');
        int cc = topology.childCount(idx);
        sb.append("  Children (").append(cc).append("): ");
        for (int i = 0; i < cc; i++) {
            int flat = topology.childrenStart(idx) + i;
            sb.append(label(topology.node(topology.childAt(flat))))
                    .append(String.format(Locale.ROOT, " [w=%.4f]", topology.weightAt(flat)));
            if (i < cc - 1)
                sb.append(", ");
        }
        return sb.append('\n').toString();
    }

    /**
     * Dumps the entire structure in dot-like text format, one node per line.
     */
    public String dumpTopology() {
        StringBuilder sb = new StringBuilder(1024);
        sb.append("Graph (").append(topology.nodeCount()).append(" nodes, ").append(topology.edgeCount())
                .append(" edges):\n");
        for (int i = 0; i < topology.nodeCount(); i++) {
            sb.append("  [").append(i).append("] ").append(label(topology.node(i)));
            if (topology.source() == i)
                sb.append(" (SRC)");
            if (topology.isTarget(i))
                sb.append(" (TGT)");
            int cc = topology.childCount(i);
            if (cc > 0) {
                sb.append(" -> ");
                for (int j = 0; j < cc; j++) {
                    sb.append(label(topology.node(topology.child(i, j))));
                    if (j < cc - 1)
                        sb.append(", ");
                }
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    /**
     * Generates a Mermaid JS graph diagram, left to right by layer.
     */
    public String toMermaid() {
        StringBuilder sb = new StringBuilder(4096);
        sb.append("graph LR;\n");
        for (int i = 0; i < topology.nodeCount(); i++) {
            PgNode<N> node = topology.node(i);
            sb.append("  n").append(i).append("[\"").append(escape(label(node))).append("\"];\n");
        }
        for (int i = 0; i < topology.nodeCount(); i++) {
            for (int e = topology.childrenStart(i); e < topology.childrenEnd(i); e++) {
                double w = topology.weightAt(e);
                sb.append("  n").append(i);
                if (w != 1.0)
                    sb.append(" -- \"").append(String.format(Locale.ROOT, "%.3f", w)).append("\" -->");
                else
                    sb.append(" -->");
                sb.append(" n").append(topology.childAt(e)).append(";\n");
            }
        }
        return sb.toString();
    }

    private static String label(PgNode<?> node) {
        StringBuilder sb = new StringBuilder();
        sb.append(node.layer()).append(':').append(node.name());
        if (node.polarity() == 1)
            sb.append('-');
        if (node.isSplit())
            sb.append(' ').append(node.history());
        return sb.toString();
    }

    private static String escape(String s) {
        return s.replace("\"", "#quot;");
    }
}
