package com.pyscope.analyzer.graph;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;
import java.util.NavigableSet;
import java.util.Set;
import java.util.TreeSet;

import static org.junit.jupiter.api.Assertions.*;

class DependencyGraphTest {

    private static final Path A = Path.of("/p/a.py");
    private static final Path B = Path.of("/p/b.py");
    private static final Path C = Path.of("/p/c.py");
    private static final Path D = Path.of("/p/d.py");

    @Test
    void testEdgesAreIdempotent() {
        DependencyGraph graph = new DependencyGraph();
        assertTrue(graph.addEdge(A, B));
        assertFalse(graph.addEdge(A, B));

        assertEquals(1, graph.edgeCount());
        assertEquals(1, graph.outDegree(A));
        assertEquals(1, graph.inDegree(B));
        assertEquals(Set.of(A), graph.predecessors(B));
    }

    @Test
    void testIsolatedNodeIsKept() {
        DependencyGraph graph = new DependencyGraph();
        graph.addNode(C);

        assertTrue(graph.contains(C));
        assertEquals(0, graph.outDegree(C));
        assertTrue(graph.findCycles().isEmpty());
    }

    @Test
    void testMutualImportIsOneCycle() {
        DependencyGraph graph = new DependencyGraph();
        graph.addEdge(A, B);
        graph.addEdge(B, A);

        List<Cycle> cycles = graph.findCycles();

        assertEquals(1, cycles.size());
        assertEquals(List.of(A, B, A), cycles.get(0).path());
        assertEquals(Set.of(A, B), cycles.get(0).members());
    }

    @Test
    void testCyclesAreDeduplicatedByMemberSet() {
        DependencyGraph graph = new DependencyGraph();
        // a -> b -> c -> a, and the same loop entered again from d
        graph.addEdge(A, B);
        graph.addEdge(B, C);
        graph.addEdge(C, A);
        graph.addEdge(D, B);

        List<Cycle> cycles = graph.findCycles();

        assertEquals(1, cycles.size());
        assertEquals(Set.of(A, B, C), cycles.get(0).members());
        assertEquals(3, cycles.get(0).size());
    }

    @Test
    void testAcyclicGraphHasNoCycles() {
        DependencyGraph graph = new DependencyGraph();
        graph.addEdge(A, B);
        graph.addEdge(B, C);
        graph.addEdge(A, C);

        assertTrue(graph.findCycles().isEmpty());
        assertTrue(graph.findElementaryCycles(10).cycles().isEmpty());
    }

    @Test
    void testEveryMultiNodeComponentHasACycle() {
        DependencyGraph graph = new DependencyGraph();
        graph.addEdge(A, B);
        graph.addEdge(B, A);
        graph.addEdge(C, D);
        graph.addEdge(D, C);
        graph.addEdge(B, C);

        List<Cycle> cycles = graph.findCycles();

        for (NavigableSet<Path> component : graph.stronglyConnectedComponents()) {
            if (component.size() > 1) {
                assertTrue(cycles.stream().anyMatch(c -> c.members().equals(component)),
                        "missing cycle for " + component);
            }
        }
    }

    @Test
    void testStronglyConnectedComponents() {
        DependencyGraph graph = new DependencyGraph();
        graph.addEdge(A, B);
        graph.addEdge(B, A);
        graph.addEdge(B, C);

        List<NavigableSet<Path>> components = graph.stronglyConnectedComponents();

        assertEquals(2, components.size());
        assertTrue(components.contains(new TreeSet<>(Set.of(A, B))));
        assertTrue(components.contains(new TreeSet<>(Set.of(C))));
    }

    @Test
    void testElementaryCyclesFindOverlappingLoops() {
        DependencyGraph graph = new DependencyGraph();
        // two loops sharing a: a <-> b and a <-> c
        graph.addEdge(A, B);
        graph.addEdge(B, A);
        graph.addEdge(A, C);
        graph.addEdge(C, A);

        CycleSearch search = graph.findElementaryCycles(100);
        List<Cycle> elementary = search.cycles();

        assertFalse(search.truncated());

        assertEquals(2, elementary.size());
        assertTrue(elementary.stream().anyMatch(c -> c.members().equals(Set.of(A, B))));
        assertTrue(elementary.stream().anyMatch(c -> c.members().equals(Set.of(A, C))));
    }

    @Test
    void testElementaryCyclesStopAtLimit() {
        DependencyGraph graph = new DependencyGraph();
        graph.addEdge(A, B);
        graph.addEdge(B, A);
        graph.addEdge(A, C);
        graph.addEdge(C, A);
        graph.addEdge(A, D);
        graph.addEdge(D, A);

        CycleSearch search = graph.findElementaryCycles(2);
        assertEquals(2, search.cycles().size());
        assertTrue(search.truncated());
        assertThrows(IllegalArgumentException.class, () -> graph.findElementaryCycles(0));
    }

    @Test
    void testElementaryCyclesExactlyAtLimitAreNotTruncated() {
        DependencyGraph graph = new DependencyGraph();
        graph.addEdge(A, B);
        graph.addEdge(B, A);
        graph.addEdge(A, C);
        graph.addEdge(C, A);

        CycleSearch search = graph.findElementaryCycles(2);

        assertEquals(2, search.cycles().size());
        assertFalse(search.truncated());
    }

    @Test
    void testCycleValidatesClosingRepeat() {
        assertThrows(IllegalArgumentException.class, () -> new Cycle(List.of(A, B)));
        assertThrows(IllegalArgumentException.class, () -> new Cycle(List.of(A)));

        Cycle cycle = new Cycle(List.of(A, B, A));
        assertEquals(List.of(List.of(A, B), List.of(B, A)), cycle.edges());
    }
}
