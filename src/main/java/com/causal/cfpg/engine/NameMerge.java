package com.causal.cfpg.engine;

import com.causal.cfpg.node.History;
import com.causal.cfpg.node.PgNode;

import java.util.*;

import lombok.extern.log4j.Log4j2;

/**
 * Merges the nodes of a compiled paths structure so that distinct
 * source-to-target walks spell distinct name sequences.
 *
 * <p>
 * Subset construction, layer by layer: a merged node stands for every node
 * reached from the source by one name sequence, and its children are grouped
 * by name and by whether they are terminal. Counting, enumeration and uniform
 * weights over the result are then over distinct paths. The weight of a merged
 * edge is the sum of the weights it replaces.
 *
 * <p>
 * A merged node keeps the layer and name of the nodes it stands for, the
 * polarity of the first of them, and the topological indices of all of them as
 * its history.
 */
@Log4j2
final class NameMerge {

    private NameMerge() {
    }

    /** True if some node has two children with the same name and terminal flag. */
    static <N> boolean isAmbiguous(TopologicalOrder<N> topo) {
        for (int ti = 0; ti < topo.nodeCount(); ti++) {
            if (topo.childCount(ti) < 2)
                continue;
            Set<Label<N>> seen = new HashSet<>();
            for (int i = 0; i < topo.childCount(ti); i++)
                if (!seen.add(labelOf(topo, topo.child(ti, i))))
                    return true;
        }
        return false;
    }

    /**
     * Returns a structure whose walks are in one-to-one correspondence with the
     * distinct name sequences of {@code topo}; {@code topo} itself if it
     * already is one.
     */
    static <N> TopologicalOrder<N> byName(TopologicalOrder<N> topo) {
        if (topo.nodeCount() == 0 || !isAmbiguous(topo))
            return topo;

        TopologicalOrder.Builder<N> builder = TopologicalOrder.builder();
        Map<BitSet, PgNode<N>> merged = new HashMap<>();
        Deque<BitSet> queue = new ArrayDeque<>();
        BitSet start = new BitSet(topo.nodeCount());
        start.set(topo.source());
        PgNode<N> sourceNode = mergedNode(topo, start);
        merged.put(start, sourceNode);
        builder.addNode(sourceNode).markSource(sourceNode);
        queue.add(start);

        while (!queue.isEmpty()) {
            BitSet state = queue.poll();
            PgNode<N> from = merged.get(state);
            Map<Label<N>, BitSet> groups = new LinkedHashMap<>();
            Map<Label<N>, Double> weights = new HashMap<>();
            for (int ti = state.nextSetBit(0); ti >= 0; ti = state.nextSetBit(ti + 1)) {
                for (int e = topo.childrenStart(ti); e < topo.childrenEnd(ti); e++) {
                    int child = topo.childAt(e);
                    Label<N> label = labelOf(topo, child);
                    groups.computeIfAbsent(label, k -> new BitSet(topo.nodeCount())).set(child);
                    weights.merge(label, topo.weightAt(e), Double::sum);
                }
            }
            for (var entry : groups.entrySet()) {
                BitSet members = entry.getValue();
                PgNode<N> to = merged.get(members);
                if (to == null) {
                    to = mergedNode(topo, members);
                    merged.put(members, to);
                    builder.addNode(to);
                    if (entry.getKey().terminal)
                        builder.markTarget(to);
                    else
                        queue.add(members);
                }
                builder.addEdge(from, to, weights.get(entry.getKey()));
            }
        }

        TopologicalOrder<N> result = builder.build();
        log.debug("Merged {} nodes / {} edges into {} nodes / {} edges by name", topo.nodeCount(), topo.edgeCount(),
                result.nodeCount(), result.edgeCount());
        return result;
    }

    private static <N> PgNode<N> mergedNode(TopologicalOrder<N> topo, BitSet members) {
        PgNode<N> first = topo.node(members.nextSetBit(0));
        return new PgNode<>(first.layer(), first.name(), first.polarity(), History.of(members.stream().toArray()));
    }

    private static <N> Label<N> labelOf(TopologicalOrder<N> topo, int ti) {
        return new Label<>(topo.node(ti).name(), topo.isTarget(ti));
    }

    private static final class Label<N> {
        final N name;
        final boolean terminal;

        Label(N name, boolean terminal) {
            this.name = name;
            this.terminal = terminal;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o)
                return true;
            if (!(o instanceof Label<?> other))
                return false;
            return terminal == other.terminal && name.equals(other.name);
        }

        @Override
        public int hashCode() {
            return name.hashCode() * 31 + (terminal ? 1 : 0);
        }
    }
}
