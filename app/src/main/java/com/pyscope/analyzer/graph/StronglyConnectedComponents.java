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
 * Tarjan's strongly connected components, iterative so deep import chains do
 * not hit the call-stack limit.
 */
final class StronglyConnectedComponents {

    private StronglyConnectedComponents() {
    }

    private static final class Frame {
        final Path node;
        final Iterator<Path> neighbours;

        Frame(Path node, Iterator<Path> neighbours) {
            this.node = node;
            this.neighbours = neighbours;
        }
    }

    /**
     * Components in the order Tarjan completes them (reverse topological).
     */
    static List<NavigableSet<Path>> of(DependencyGraph graph) {
        Map<Path, Integer> index = new HashMap<>();
        Map<Path, Integer> lowLink = new HashMap<>();
        Deque<Path> componentStack = new ArrayDeque<>();
        Set<Path> onStack = new HashSet<>();
        List<NavigableSet<Path>> components = new ArrayList<>();
        int counter = 0;

        for (Path root : graph.nodes()) {
            if (index.containsKey(root)) {
                continue;
            }
            Deque<Frame> calls = new ArrayDeque<>();
            index.put(root, counter);
            lowLink.put(root, counter);
            counter++;
            componentStack.push(root);
            onStack.add(root);
            calls.push(new Frame(root, graph.successors(root).iterator()));

            while (!calls.isEmpty()) {
                Frame frame = calls.peek();
                if (frame.neighbours.hasNext()) {
                    Path next = frame.neighbours.next();
                    if (!index.containsKey(next)) {
                        index.put(next, counter);
                        lowLink.put(next, counter);
                        counter++;
                        componentStack.push(next);
                        onStack.add(next);
                        calls.push(new Frame(next, graph.successors(next).iterator()));
                    } else if (onStack.contains(next)) {
                        lowLink.put(frame.node, Math.min(lowLink.get(frame.node), index.get(next)));
                    }
                    continue;
                }

                calls.pop();
                if (!calls.isEmpty()) {
                    Path parent = calls.peek().node;
                    lowLink.put(parent, Math.min(lowLink.get(parent), lowLink.get(frame.node)));
                }
                if (lowLink.get(frame.node).equals(index.get(frame.node))) {
                    NavigableSet<Path> component = new TreeSet<>();
                    Path member;
                    do {
                        member = componentStack.pop();
                        onStack.remove(member);
                        component.add(member);
                    } while (!member.equals(frame.node));
                    components.add(component);
                }
            }
        }
        return components;
    }
}
