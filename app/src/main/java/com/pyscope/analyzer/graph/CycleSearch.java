package com.pyscope.analyzer.graph;

import java.util.List;

/**
 * Cycles returned by a bounded search.
 *
 * @param cycles    distinct cycles in discovery order, at most the limit
 * @param truncated true when more distinct cycles exist beyond the limit
 */
public record CycleSearch(List<Cycle> cycles, boolean truncated) {

    public CycleSearch {
        cycles = List.copyOf(cycles);
    }
}
