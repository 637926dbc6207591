package com.causal.cfpg.dsl;

import com.causal.cfpg.engine.Digraph;

import org.junit.Test;

import java.util.List;

import static org.junit.Assert.*;

public class GraphBuilderTest {

    @Test
    public void testSignedEdges() {
        GraphBuilder<String> g = GraphBuilder.create("egfr");
        assertEquals("egfr", g.name());
        Digraph<String> graph = g.activates("EGF", "EGFR")
                .inhibits("EGFR", "GRB2")
                .activates("EGFR", "GRB2")
                .build();
        assertEquals(List.of("EGF", "EGFR", "GRB2"), graph.nodes());
        assertEquals(3, graph.edgeCount());
        assertTrue(graph.hasEdge("EGFR", "GRB2", 0));
        assertTrue(graph.hasEdge("EGFR", "GRB2", 1));
        assertFalse(graph.hasEdge("EGF", "EGFR", 1));
    }

    @Test
    public void testChainAndIsolatedNode() {
        Digraph<Integer> graph = GraphBuilder.<Integer>create("chain")
                .chain(1, 2, 3, 4)
                .node(9)
                .build();
        assertEquals(5, graph.nodeCount());
        assertEquals(3, graph.edgeCount());
        assertTrue(graph.hasEdge(2, 3, Digraph.UNSIGNED));
        assertEquals(0, graph.outDegree(graph.indexOf(9)));
    }

    @Test
    public void testDuplicateEdgeIgnored() {
        Digraph<String> graph = GraphBuilder.<String>create("dup")
                .edge("A", "B").edge("A", "B")
                .build();
        assertEquals(1, graph.edgeCount());
    }

    @Test(expected = IllegalStateException.class)
    public void testNoChangesAfterBuild() {
        GraphBuilder<String> g = GraphBuilder.create("done");
        g.edge("A", "B").build();
        g.edge("B", "C");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testInvalidSign() {
        GraphBuilder.<String>create("bad").edge("A", "B", 3);
    }
}
