package com.causal.cfpg.engine;

import java.util.*;

/**
 * Shared input graphs and a brute-force simple path oracle for the engine tests.
 */
public final class Graphs {

    private Graphs() {
    }

    /** A->B->D, A->C->D. */
    public static Digraph<String> diamond() {
        return Digraph.<String>builder()
                .addEdge("A", "B").addEdge("B", "D")
                .addEdge("A", "C").addEdge("C", "D")
                .build();
    }

    /** B and C both reach D, and D leads back to both: length 4 needs a split of D. */
    public static Digraph<String> crossed() {
        return Digraph.<String>builder()
                .addEdge("A", "B").addEdge("A", "C")
                .addEdge("C", "D").addEdge("B", "D")
                .addEdge("D", "B").addEdge("D", "C")
                .addEdge("B", "E").addEdge("C", "E")
                .build();
    }

    /** S->A1 (one choice) vs S->A2 (four choices), all joining at T. */
    public static Digraph<String> skewed() {
        Digraph.Builder<String> b = Digraph.<String>builder()
                .addEdge("S", "A1").addEdge("S", "A2")
                .addEdge("A1", "B1");
        for (int i = 2; i <= 5; i++)
            b.addEdge("A2", "B" + i);
        for (int i = 1; i <= 5; i++)
            b.addEdge("B" + i, "T");
        return b.build();
    }

    /** Needs three refinement rounds at length 5. */
    public static Digraph<String> multiRound() {
        return Digraph.<String>builder()
                .addEdge("S", "A").addEdge("S", "X")
                .addEdge("A", "B").addEdge("X", "B")
                .addEdge("B", "A").addEdge("B", "C")
                .addEdge("C", "C").addEdge("C", "T")
                .addEdge("A", "D").addEdge("D", "T")
                .build();
    }

    /** Random digraph over nodes 0..n-1, self-loops included. */
    public static Digraph<Integer> random(long seed, int n, double density) {
        Random rng = new Random(seed);
        Digraph.Builder<Integer> b = Digraph.builder();
        for (int i = 0; i < n; i++)
            b.addNode(i);
        for (int u = 0; u < n; u++)
            for (int v = 0; v < n; v++)
                if (rng.nextDouble() < density)
                    b.addEdge(u, v);
        return b.build();
    }

    /** Random signed graph; each ordered pair gets each sign independently, so parallel edges of both signs occur. */
    public static Digraph<Integer> randomSigned(long seed, int n, double density) {
        Random rng = new Random(seed);
        Digraph.Builder<Integer> b = Digraph.builder();
        for (int i = 0; i < n; i++)
            b.addNode(i);
        for (int u = 0; u < n; u++)
            for (int v = 0; v < n; v++)
                for (int sign = 0; sign <= 1; sign++)
                    if (rng.nextDouble() < density)
                        b.addEdge(u, v, sign);
        return b.build();
    }

    /** Distinct simple name sequences of {@code length} edges with some signed walk of the given net sign. */
    public static <N> Set<List<N>> signedSimplePaths(Digraph<N> g, N source, N target, int length, int polarity) {
        Set<List<N>> out = new HashSet<>();
        List<N> path = new ArrayList<>();
        path.add(source);
        signedDfs(g, target, length, polarity, 0, path, out);
        return out;
    }

    private static <N> void signedDfs(Digraph<N> g, N target, int length, int polarity, int sign, List<N> path,
            Set<List<N>> out) {
        N last = path.get(path.size() - 1);
        if (path.size() == length + 1) {
            if (last.equals(target) && sign == polarity)
                out.add(new ArrayList<>(path));
            return;
        }
        if (last.equals(target))
            return;
        int u = g.indexOf(last);
        for (int e = g.outStart(u); e < g.outEnd(u); e++) {
            N next = g.name(g.outTargetAt(e));
            if (g.outSignAt(e) == Digraph.UNSIGNED || path.contains(next))
                continue;
            path.add(next);
            signedDfs(g, target, length, polarity, sign ^ g.outSignAt(e), path, out);
            path.remove(path.size() - 1);
        }
    }

    /** All simple paths of exactly {@code length} edges, by depth-first search. */
    public static <N> Set<List<N>> simplePaths(Digraph<N> g, N source, N target, int length) {
        Set<List<N>> out = new HashSet<>();
        List<N> path = new ArrayList<>();
        path.add(source);
        dfs(g, target, length, path, out);
        return out;
    }

    private static <N> void dfs(Digraph<N> g, N target, int length, List<N> path, Set<List<N>> out) {
        N last = path.get(path.size() - 1);
        if (path.size() == length + 1) {
            if (last.equals(target))
                out.add(new ArrayList<>(path));
            return;
        }
        if (last.equals(target))
            return;
        int u = g.indexOf(last);
        for (int e = g.outStart(u); e < g.outEnd(u); e++) {
            N next = g.name(g.outTargetAt(e));
            if (path.contains(next))
                continue;
            path.add(next);
            dfs(g, target, length, path, out);
            path.remove(path.size() - 1);
        }
    }

    public static <N> boolean isSimple(List<N> path) {
        return new HashSet<>(path).size() == path.size();
    }

    public static <N> boolean isWalk(Digraph<N> g, List<N> path) {
        for (int i = 0; i + 1 < path.size(); i++)
            if (!g.hasEdge(path.get(i), path.get(i + 1)))
                return false;
        return true;
    }
}
