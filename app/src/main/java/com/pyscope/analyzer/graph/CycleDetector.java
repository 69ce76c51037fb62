package com.pyscope.analyzer.graph;

import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Depth-first cycle search with an explicit frame stack.
 *
 * <p>Starts a search from every unvisited node in path order. Whenever a
 * neighbour is already on the current path, the path slice from that
 * neighbour to the current node, closed by the neighbour, is a cycle.
 * Cycles are deduplicated by member set; the first one found wins.</p>
 */
class CycleDetector {

    private record Frame(Path node, Iterator<Path> neighbours) {
    }

    List<Cycle> findCycles(DependencyGraph graph) {
        Set<Path> visited = new HashSet<>();
        List<Path> path = new ArrayList<>();
        Map<Path, Integer> positions = new HashMap<>();
        Deque<Frame> stack = new ArrayDeque<>();
        CycleSet cycles = new CycleSet();

        for (Path start : graph.nodes()) {
            if (visited.contains(start)) {
                continue;
            }
            enter(start, graph, visited, path, positions, stack);

            while (!stack.isEmpty()) {
                Frame top = stack.peek();
                if (top.neighbours().hasNext()) {
                    Path next = top.neighbours().next();
                    Integer onPath = positions.get(next);
                    if (onPath != null) {
                        List<Path> loop = new ArrayList<>(path.subList(onPath, path.size()));
                        loop.add(next);
                        cycles.add(new Cycle(loop));
                    } else if (!visited.contains(next)) {
                        enter(next, graph, visited, path, positions, stack);
                    }
                } else {
                    stack.pop();
                    positions.remove(path.remove(path.size() - 1));
                }
            }
        }
        return cycles.toList();
    }

    private static void enter(Path node, DependencyGraph graph, Set<Path> visited, List<Path> path,
            Map<Path, Integer> positions, Deque<Frame> stack) {
        visited.add(node);
        positions.put(node, path.size());
        path.add(node);
        stack.push(new Frame(node, graph.successors(node).iterator()));
    }

    /**
     * Keeps the first cycle per distinct member set.
     */
    static final class CycleSet {
        private final Set<Set<Path>> seen = new HashSet<>();
        private final List<Cycle> cycles = new ArrayList<>();

        boolean add(Cycle cycle) {
            if (seen.add(new LinkedHashSet<>(cycle.members()))) {
                cycles.add(cycle);
                return true;
            }
            return false;
        }

        int size() {
            return cycles.size();
        }

        List<Cycle> toList() {
            return List.copyOf(cycles);
        }
    }
}
