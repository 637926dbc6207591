package com.causal.cfpg.engine;

import com.causal.cfpg.node.SignedNode;

import org.junit.Test;

import java.util.HashSet;
import java.util.Set;

import static org.junit.Assert.*;

public class ReachabilitySetsTest {

    private static Set<SignedNode<String>> unsigned(String... names) {
        Set<SignedNode<String>> out = new HashSet<>();
        for (String n : names)
            out.add(new SignedNode<>(n, 0));
        return out;
    }

    @Test
    public void testForwardAndBackwardLevels() {
        ReachableLevels<String> levels = ReachabilitySets.compute(Graphs.diamond(), "A", "D", 5, false);
        assertFalse(levels.isEmpty());
        assertEquals(unsigned("A"), levels.forward(0));
        assertEquals(unsigned("B", "C"), levels.forward(1));
        assertEquals(unsigned("D"), levels.forward(2));
        // D has no successors: forward expansion stops
        assertEquals(3, levels.forwardDepth());
        assertTrue(levels.forward(3).isEmpty());

        assertEquals(unsigned("D"), levels.backward(0));
        assertEquals(unsigned("B", "C"), levels.backward(1));
        assertEquals(unsigned("A"), levels.backward(2));
        assertEquals(5, levels.maxDepth());
    }

    @Test
    public void testCyclesRepeatAcrossLevels() {
        ReachableLevels<String> levels = ReachabilitySets.compute(Graphs.crossed(), "A", "E", 4, false);
        assertEquals(unsigned("D", "E"), levels.forward(2));
        assertEquals(unsigned("B", "C"), levels.forward(3));
        assertEquals(unsigned("D", "E"), levels.forward(4));
        assertEquals(unsigned("A", "D"), levels.backward(2));
    }

    @Test
    public void testUnreachableTargetGivesEmptyLevels() {
        Digraph<String> g = Digraph.<String>builder()
                .addEdge("A", "B").addEdge("C", "A").addEdge("C", "D")
                .build();
        ReachableLevels<String> levels = ReachabilitySets.compute(g, "A", "D", 3, false);
        assertTrue(levels.isEmpty());
        assertTrue(levels.forward(0).isEmpty());
        assertTrue(levels.backward(1).isEmpty());
    }

    @Test
    public void testSignedPolarityPropagation() {
        Digraph<String> g = Digraph.<String>builder()
                .addEdge("A", "B", 1)
                .addEdge("B", "C", 1)
                .addEdge("A", "C", 0)
                .addEdge("A", "X") // unsigned: ignored in signed mode
                .addEdge("X", "C")
                .build();
        ReachableLevels<String> levels = ReachabilitySets.compute(g, "A", "C", 2, true);
        assertEquals(Set.of(new SignedNode<>("B", 1), new SignedNode<>("C", 0)), levels.forward(1));
        assertEquals(Set.of(new SignedNode<>("C", 0)), levels.forward(2));
        // B reaches C through an inhibiting edge
        assertEquals(Set.of(new SignedNode<>("B", 1), new SignedNode<>("A", 0)), levels.backward(1));
        assertEquals(Set.of(new SignedNode<>("A", 0)), levels.backward(2));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testSourceEqualsTarget() {
        ReachabilitySets.compute(Graphs.diamond(), "A", "A", 3, false);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnknownSource() {
        ReachabilitySets.compute(Graphs.diamond(), "Z", "D", 3, false);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testZeroDepth() {
        ReachabilitySets.compute(Graphs.diamond(), "A", "D", 0, false);
    }
}
