package com.pyscope.analyzer.graph;

import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NavigableSet;
import java.util.Set;
import java.util.TreeSet;

/**
 * Johnson's elementary-cycle enumeration, run per strongly connected
 * component with explicit stacks.
 *
 * <p>For each start node {@code s} in path order, only nodes ordered at or
 * after {@code s} inside its component are explored, so each elementary cycle
 * is produced once, from its smallest member. Results go through the same
 * member-set deduplication as {@link CycleDetector}. The search runs one cycle
 * past the limit so it can tell a cut-off result from one that is exactly
 * the limit long.</p>
 */
class ElementaryCycleFinder {

    private final int limit;

    ElementaryCycleFinder(int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("Cycle limit must be positive: " + limit);
        }
        this.limit = limit;
    }

    private static final class Frame {
        final Path node;
        final Iterator<Path> neighbours;
        boolean closedCycle;

        Frame(Path node, Iterator<Path> neighbours) {
            this.node = node;
            this.neighbours = neighbours;
        }
    }

    CycleSearch findCycles(DependencyGraph graph) {
        CycleDetector.CycleSet cycles = new CycleDetector.CycleSet();
        Map<Path, NavigableSet<Path>> componentOf = new HashMap<>();
        for (NavigableSet<Path> component : graph.stronglyConnectedComponents()) {
            for (Path member : component) {
                componentOf.put(member, component);
            }
        }

        for (Path start : graph.nodes()) {
            NavigableSet<Path> component = componentOf.get(start);
            if (component.size() == 1 && !graph.hasEdge(start, start)) {
                continue;
            }
            // nodes before start were already used as starts
            Set<Path> allowed = component.tailSet(start, true);
            if (circuitsFrom(start, allowed, graph, cycles)) {
                break;
            }
        }
        List<Cycle> found = cycles.toList();
        if (found.size() > limit) {
            return new CycleSearch(found.subList(0, limit), true);
        }
        return new CycleSearch(found, false);
    }

    /**
     * @return true once one cycle more than the limit is found
     */
    private boolean circuitsFrom(Path start, Set<Path> allowed, DependencyGraph graph, CycleDetector.CycleSet cycles) {
        Set<Path> blocked = new HashSet<>();
        Map<Path, Set<Path>> blockedBy = new HashMap<>();
        List<Path> path = new ArrayList<>();
        Deque<Frame> stack = new ArrayDeque<>();

        path.add(start);
        blocked.add(start);
        stack.push(new Frame(start, neighbours(start, allowed, graph).iterator()));

        while (!stack.isEmpty()) {
            Frame frame = stack.peek();
            if (frame.neighbours.hasNext()) {
                Path next = frame.neighbours.next();
                if (next.equals(start)) {
                    List<Path> loop = new ArrayList<>(path);
                    loop.add(start);
                    cycles.add(new Cycle(loop));
                    frame.closedCycle = true;
                    if (cycles.size() > limit) {
                        return true;
                    }
                } else if (!blocked.contains(next)) {
                    path.add(next);
                    blocked.add(next);
                    stack.push(new Frame(next, neighbours(next, allowed, graph).iterator()));
                }
                continue;
            }

            stack.pop();
            path.remove(path.size() - 1);
            if (frame.closedCycle) {
                unblock(frame.node, blocked, blockedBy);
            } else {
                for (Path next : neighbours(frame.node, allowed, graph)) {
                    blockedBy.computeIfAbsent(next, k -> new HashSet<>()).add(frame.node);
                }
            }
            if (frame.closedCycle && !stack.isEmpty()) {
                stack.peek().closedCycle = true;
            }
        }
        return false;
    }

    private static List<Path> neighbours(Path node, Set<Path> allowed, DependencyGraph graph) {
        List<Path> result = new ArrayList<>();
        for (Path next : graph.successors(node)) {
            if (allowed.contains(next)) {
                result.add(next);
            }
        }
        return result;
    }

    private static void unblock(Path node, Set<Path> blocked, Map<Path, Set<Path>> blockedBy) {
        Deque<Path> work = new ArrayDeque<>();
        work.push(node);
        while (!work.isEmpty()) {
            Path current = work.pop();
            if (!blocked.remove(current)) {
                continue;
            }
            Set<Path> waiting = blockedBy.remove(current);
            if (waiting != null) {
                for (Path w : new TreeSet<>(waiting)) {
                    work.push(w);
                }
            }
        }
    }
}
