package com.causal.cfpg.engine;

import com.causal.cfpg.api.BuildListener;
import com.causal.cfpg.node.PgNode;

import org.junit.Test;

import java.util.*;

import static org.junit.Assert.*;

public class PreCfpgTest {

    @Test
    public void testTagsOfCrossedGraph() {
        PreCfpg<String> pre = PreCfpg.build(PathsGraph.build(Graphs.crossed(), "A", "E", 4, false, null));
        assertEquals(7, pre.nodeCount());
        assertEquals(8, pre.edgeCount());
        // One round to refine, one to confirm
        assertEquals(2, pre.rounds());

        PgNode<String> a = new PgNode<>(0, "A", 0);
        PgNode<String> b1 = new PgNode<>(1, "B", 0), c1 = new PgNode<>(1, "C", 0);
        PgNode<String> d2 = new PgNode<>(2, "D", 0);
        PgNode<String> b3 = new PgNode<>(3, "B", 0), c3 = new PgNode<>(3, "C", 0);
        assertEquals(Set.of(a, b1), pre.tags(b1));
        assertEquals(Set.of(a, b1, c1, d2), pre.tags(d2));
        // B at layer 3 may only follow the C branch
        assertEquals(Set.of(a, c1, d2, b3), pre.tags(b3));
        assertEquals(Set.of(a, b1, d2, c3), pre.tags(c3));
    }

    @Test
    public void testEnumerationIsCycleFree() {
        PreCfpg<String> pre = PreCfpg.build(PathsGraph.build(Graphs.crossed(), "A", "E", 4, false, null));
        assertEquals(Set.of(List.of("A", "B", "D", "C", "E"), List.of("A", "C", "D", "B", "E")),
                new HashSet<>(pre.enumeratePaths()));
        assertEquals(2, pre.countPaths());
    }

    @Test
    public void testSamplingWithMemory() {
        PreCfpg<String> pre = PreCfpg.build(PathsGraph.build(Graphs.crossed(), "A", "E", 4, false, null));
        List<List<String>> samples = pre.samplePaths(500, new Random(3));
        assertEquals(500, samples.size());
        for (List<String> path : samples) {
            assertTrue(Graphs.isSimple(path));
            assertEquals(5, path.size());
        }
        assertEquals(samples, pre.samplePaths(500, new Random(3)));
    }

    @Test
    public void testMultiRoundConvergence() {
        PathsGraph<String> pg = PathsGraph.build(Graphs.multiRound(), "S", "T", 5, false, null);
        assertEquals(10, pg.edgeCount());
        assertEquals(4, pg.countPaths());

        List<Integer> roundEdges = new ArrayList<>();
        PreCfpg<String> pre = PreCfpg.build(pg, new RecordingListener(roundEdges));
        // Round 1 drops the C self-loop walks, round 2 drops A at layer 1, round 3 confirms
        assertEquals(3, pre.rounds());
        assertEquals(List.of(7, 5, 5), roundEdges);
        assertEquals(5, pre.edgeCount());
        assertFalse(pre.nodes().contains(new PgNode<>(1, "A", 0)));
        assertEquals(List.of(List.of("S", "X", "B", "A", "D", "T")), pre.enumeratePaths());
    }

    @Test
    public void testEmptyPathsGraphGivesEmptyPreCfpg() {
        PreCfpg<String> pre = PreCfpg.build(PathsGraph.build(Graphs.diamond(), "A", "D", 3, false, null));
        assertTrue(pre.isEmpty());
        assertEquals(0, pre.rounds());
        assertEquals(0, pre.countPaths());
        assertTrue(pre.samplePaths(3, new Random(1)).isEmpty());
    }

    @Test
    public void testOnlyCyclicWalksGivesEmptyPreCfpg() {
        // A -> B -> A -> C: the only length 3 walk revisits A
        Digraph<String> g = Digraph.<String>builder()
                .addEdge("A", "B").addEdge("B", "A").addEdge("A", "C")
                .build();
        PathsGraph<String> pg = PathsGraph.build(g, "A", "C", 3, false, null);
        assertEquals(1, pg.countPaths());
        PreCfpg<String> pre = PreCfpg.build(pg);
        assertTrue(pre.isEmpty());
        assertTrue(pre.enumeratePaths().isEmpty());
    }

    @Test
    public void testMatchesBruteForceOnRandomGraphs() {
        for (long seed = 1; seed <= 25; seed++) {
            Digraph<Integer> g = Graphs.random(seed, 7, 0.3);
            for (int length = 1; length <= 6; length++) {
                Set<List<Integer>> expected = Graphs.simplePaths(g, 0, 6, length);
                PreCfpg<Integer> pre = PreCfpg.build(PathsGraph.build(g, 0, 6, length, false, null));
                List<List<Integer>> actual = pre.enumeratePaths();
                assertEquals("seed " + seed + " length " + length, expected, new HashSet<>(actual));
                assertEquals("duplicates, seed " + seed + " length " + length, expected.size(), actual.size());
            }
        }
    }

    @Test
    public void testMemorySamplingAgreesWithSplitGraph() {
        for (long seed = 1; seed <= 15; seed++) {
            Digraph<Integer> g = Graphs.random(seed, 6, 0.4);
            for (int length = 1; length <= 4; length++) {
                PreCfpg<Integer> pre = PreCfpg.build(PathsGraph.build(g, 0, 5, length, false, null));
                Set<List<Integer>> split = new HashSet<>(CycleFreePathsGraph.build(pre).enumeratePaths());
                Set<List<Integer>> sampled = new HashSet<>(pre.samplePaths(3000, new Random(seed * 31 + length)));
                String ctx = "seed " + seed + " length " + length;
                // Every path is drawn with probability at least 1/125 here
                assertEquals(ctx, split, sampled);
                assertEquals(ctx, split, new HashSet<>(pre.enumeratePaths()));
            }
        }
    }

    @Test
    public void testSignedEnumerationHasNoDuplicates() {
        for (long seed = 1; seed <= 15; seed++) {
            Digraph<Integer> g = Graphs.randomSigned(seed, 6, 0.25);
            for (int length = 1; length <= 4; length++) {
                PreCfpg<Integer> pre = PreCfpg.build(PathsGraph.build(g, 0, 5, length, true, 0));
                Set<List<Integer>> split = new HashSet<>(CycleFreePathsGraph.build(pre).enumeratePaths());
                List<List<Integer>> listed = pre.enumeratePaths();
                String ctx = "seed " + seed + " length " + length;
                assertEquals(ctx, split, new HashSet<>(listed));
                assertEquals(ctx, split.size(), listed.size());
                assertEquals(ctx, split.size(), pre.countPaths());
                for (List<Integer> path : pre.samplePaths(200, new Random(seed)))
                    assertTrue(ctx + " " + path, split.contains(path));
            }
        }
    }

    /** Records the edge count at the end of every round. */
    private static final class RecordingListener implements BuildListener {
        private final List<Integer> roundEdges;

        RecordingListener(List<Integer> roundEdges) {
            this.roundEdges = roundEdges;
        }

        @Override
        public void onRoundStart(int length, int round, int edges) {
        }

        @Override
        public void onLayerRefined(int length, int round, int layer, int edges) {
        }

        @Override
        public void onRoundEnd(int length, int round, int edges, boolean converged) {
            roundEdges.add(edges);
        }

        @Override
        public void onLayerSplit(int length, int layer, int original, int copies) {
        }

        @Override
        public void onCfpgBuilt(int length, int nodes, int edges) {
        }
    }
}
