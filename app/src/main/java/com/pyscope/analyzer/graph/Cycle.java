package com.pyscope.analyzer.graph;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A closed import loop. The first file is repeated at the end.
 *
 * @param path files in traversal order, closing repeat included
 */
public record Cycle(List<Path> path) {

    public Cycle {
        if (path == null || path.size() < 2) {
            throw new IllegalArgumentException("A cycle needs at least two entries");
        }
        if (!path.get(0).equals(path.get(path.size() - 1))) {
            throw new IllegalArgumentException("A cycle must end where it starts: " + path);
        }
        path = List.copyOf(path);
    }

    /**
     * Distinct member files, closing repeat dropped.
     */
    public Set<Path> members() {
        return new LinkedHashSet<>(path.subList(0, path.size() - 1));
    }

    public int size() {
        return path.size() - 1;
    }

    public boolean contains(Path file) {
        return path.contains(file);
    }

    /**
     * Consecutive (from, to) pairs along the loop.
     */
    public List<List<Path>> edges() {
        List<List<Path>> edges = new ArrayList<>();
        for (int i = 0; i < path.size() - 1; i++) {
            edges.add(List.of(path.get(i), path.get(i + 1)));
        }
        return edges;
    }
}
