package com.pyscope.analyzer.graph;

import java.nio.file.Path;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.NavigableSet;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Directed import graph over canonical file paths.
 *
 * <p>Nodes and neighbours are kept in lexicographic path order so every
 * traversal is deterministic. Edges are idempotent: recording the same pair
 * twice leaves one edge.</p>
 */
public class DependencyGraph {

    private final TreeMap<Path, TreeSet<Path>> successors = new TreeMap<>();
    private final TreeMap<Path, TreeSet<Path>> predecessors = new TreeMap<>();

    /**
     * Registers a file even if it imports nothing and nothing imports it.
     */
    public void addNode(Path file) {
        successors.computeIfAbsent(file, k -> new TreeSet<>());
        predecessors.computeIfAbsent(file, k -> new TreeSet<>());
    }

    /**
     * Records that {@code from} imports {@code to}.
     *
     * @return true if the edge was new
     */
    public boolean addEdge(Path from, Path to) {
        addNode(from);
        addNode(to);
        boolean added = successors.get(from).add(to);
        predecessors.get(to).add(from);
        return added;
    }

    public SortedSet<Path> nodes() {
        return Collections.unmodifiableSortedSet(successors.navigableKeySet());
    }

    public boolean contains(Path file) {
        return successors.containsKey(file);
    }

    /**
     * Files imported by {@code file}, in path order.
     */
    public NavigableSet<Path> successors(Path file) {
        TreeSet<Path> out = successors.get(file);
        return out == null ? Collections.emptyNavigableSet() : Collections.unmodifiableNavigableSet(out);
    }

    /**
     * Files importing {@code file}, in path order.
     */
    public NavigableSet<Path> predecessors(Path file) {
        TreeSet<Path> in = predecessors.get(file);
        return in == null ? Collections.emptyNavigableSet() : Collections.unmodifiableNavigableSet(in);
    }

    public boolean hasEdge(Path from, Path to) {
        return successors(from).contains(to);
    }

    public int outDegree(Path file) {
        return successors(file).size();
    }

    public int inDegree(Path file) {
        return predecessors(file).size();
    }

    public int edgeCount() {
        return successors.values().stream().mapToInt(TreeSet::size).sum();
    }

    /**
     * Read-only adjacency view: file to the files it imports.
     */
    public Map<Path, NavigableSet<Path>> adjacency() {
        Map<Path, NavigableSet<Path>> view = new TreeMap<>();
        successors.forEach((file, out) -> view.put(file, Collections.unmodifiableNavigableSet(out)));
        return Collections.unmodifiableMap(view);
    }

    /**
     * Cycles found by one depth-first pass, at least one per strongly
     * connected cluster of more than one file.
     */
    public List<Cycle> findCycles() {
        return new CycleDetector().findCycles(this);
    }

    /**
     * Every elementary cycle, up to {@code limit} distinct member sets.
     */
    public CycleSearch findElementaryCycles(int limit) {
        return new ElementaryCycleFinder(limit).findCycles(this);
    }

    public List<NavigableSet<Path>> stronglyConnectedComponents() {
        return StronglyConnectedComponents.of(this);
    }
}
