package com.causal.cfpg.engine;

import com.causal.cfpg.node.PgNode;

import org.junit.Test;

import java.util.*;

import static org.junit.Assert.*;

public class NameMergeTest {

    private static final PgNode<String> S = new PgNode<>(0, "S", 0);
    private static final PgNode<String> X0 = new PgNode<>(1, "X", 0), X1 = new PgNode<>(1, "X", 1);
    private static final PgNode<String> Y0 = new PgNode<>(2, "Y", 0), Y1 = new PgNode<>(2, "Y", 1);
    private static final PgNode<String> T = new PgNode<>(3, "T", 0);

    /** S X Y T spelled along four signed walks, plus S X T ending early. */
    private static TopologicalOrder<String> twoWalksPerName() {
        return TopologicalOrder.<String>builder()
                .addNode(S).addNode(X0).addNode(X1).addNode(Y0).addNode(Y1).addNode(T)
                .addEdge(S, X0, 1.0).addEdge(S, X1, 2.0)
                .addEdge(X0, Y0).addEdge(X0, Y1).addEdge(X1, Y0)
                .addEdge(Y0, T).addEdge(Y1, T)
                .markSource(S).markTarget(T)
                .build();
    }

    @Test
    public void testUnambiguousTopologyIsReturnedAsIs() {
        TopologicalOrder<String> topo = TopologicalOrder.<String>builder()
                .addNode(S).addNode(X0).addNode(T)
                .addEdge(S, X0).addEdge(X0, T)
                .markSource(S).markTarget(T)
                .build();
        assertFalse(NameMerge.isAmbiguous(topo));
        assertSame(topo, NameMerge.byName(topo));
    }

    @Test
    public void testMergesNodesSpellingTheSameNames() {
        TopologicalOrder<String> topo = twoWalksPerName();
        assertTrue(NameMerge.isAmbiguous(topo));
        assertEquals(3, new PathWalker<>(topo).countPaths());

        TopologicalOrder<String> merged = NameMerge.byName(topo);
        assertFalse(NameMerge.isAmbiguous(merged));
        assertEquals(4, merged.nodeCount());
        PathWalker<String> walker = new PathWalker<>(merged);
        assertEquals(1, walker.countPaths());
        assertEquals(List.of(List.of("S", "X", "Y", "T")), walker.enumeratePaths());
    }

    @Test
    public void testMergedEdgesSumTheirWeights() {
        TopologicalOrder<String> merged = NameMerge.byName(twoWalksPerName());
        int source = merged.source();
        assertEquals(1, merged.childCount(source));
        assertEquals(3.0, merged.weightAt(merged.childrenStart(source)), 0.0);
        PgNode<String> x = merged.node(merged.child(source, 0));
        assertEquals("X", x.name());
        assertEquals(1, x.layer());
        assertEquals(2, x.history().size());
    }

    @Test
    public void testTerminalAndInnerNodesOfOneNameStayApart() {
        PgNode<String> t1 = new PgNode<>(1, "T", 0), a1 = new PgNode<>(1, "A", 0), a1b = new PgNode<>(1, "A", 1);
        PgNode<String> t2 = new PgNode<>(2, "T", 0);
        TopologicalOrder<String> topo = TopologicalOrder.<String>builder()
                .addNode(S).addNode(t1).addNode(a1).addNode(a1b).addNode(t2)
                .addEdge(S, t1).addEdge(S, a1).addEdge(S, a1b)
                .addEdge(a1, t2).addEdge(a1b, t2)
                .markSource(S).markTarget(t1).markTarget(t2)
                .build();
        PathWalker<String> walker = new PathWalker<>(NameMerge.byName(topo));
        assertEquals(2, walker.countPaths());
        assertEquals(Set.of(List.of("S", "T"), List.of("S", "A", "T")), new HashSet<>(walker.enumeratePaths()));
    }
}
