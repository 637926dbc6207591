package com.causal.cfpg.engine;

import org.junit.Test;

import java.util.Arrays;

import static org.junit.Assert.*;

public class DigraphTest {

    @Test
    public void testEmptyGraph() {
        Digraph<String> g = Digraph.<String>builder().build();
        assertEquals(0, g.nodeCount());
        assertEquals(0, g.edgeCount());
    }

    @Test
    public void testCsrAdjacency() {
        Digraph<String> g = Graphs.diamond();
        assertEquals(4, g.nodeCount());
        assertEquals(4, g.edgeCount());
        assertEquals(Arrays.asList("A", "B", "D", "C"), g.nodes());

        int a = g.indexOf("A");
        assertEquals(2, g.outDegree(a));
        assertEquals(0, g.inDegree(a));
        assertEquals("B", g.name(g.outTargetAt(g.outStart(a))));
        assertEquals("C", g.name(g.outTargetAt(g.outStart(a) + 1)));

        int d = g.indexOf("D");
        assertEquals(0, g.outDegree(d));
        assertEquals(2, g.inDegree(d));
        assertEquals(Digraph.UNSIGNED, g.inSignAt(g.inStart(d)));
        assertTrue(g.hasEdge("A", "B"));
        assertFalse(g.hasEdge("B", "A"));
    }

    @Test
    public void testParallelEdgesWithDifferentSigns() {
        Digraph<String> g = Digraph.<String>builder()
                .addEdge("A", "B", 0)
                .addEdge("A", "B", 1)
                .addEdge("A", "B", 0) // exact duplicate, dropped
                .build();
        assertEquals(2, g.edgeCount());
        int a = g.indexOf("A");
        assertEquals(0, g.outSignAt(g.outStart(a)));
        assertEquals(1, g.outSignAt(g.outStart(a) + 1));
        assertTrue(g.hasOppositeSigns());
    }

    @Test
    public void testOppositeSignsNeedTheSameDirection() {
        Digraph<String> g = Digraph.<String>builder()
                .addEdge("A", "B", 0).addEdge("B", "A", 1)
                .addEdge("A", "B")
                .build();
        assertFalse(g.hasOppositeSigns());
        assertFalse(Graphs.diamond().hasOppositeSigns());
    }

    @Test
    public void testSelfLoopIsKept() {
        Digraph<String> g = Digraph.<String>builder().addEdge("C", "C").build();
        assertEquals(1, g.nodeCount());
        assertTrue(g.hasEdge("C", "C"));
    }

    @Test
    public void testIsolatedNode() {
        Digraph<String> g = Digraph.<String>builder().addNode("X").addEdge("A", "B").build();
        assertTrue(g.containsNode("X"));
        assertEquals(0, g.outDegree(g.indexOf("X")));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testInvalidSign() {
        Digraph.<String>builder().addEdge("A", "B", 2);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnknownNode() {
        Graphs.diamond().indexOf("Z");
    }
}
