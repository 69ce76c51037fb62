package com.pyscope.analyzer.metrics;

import com.pyscope.analyzer.graph.DependencyGraph;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Computes afferent/efferent coupling and instability for every file in a
 * finished dependency graph.
 */
public class CouplingCalculator {

    /** Descending instability, then path, as reports list them. */
    public static final Comparator<CouplingMetric> BY_INSTABILITY = Comparator
            .comparingDouble(CouplingMetric::instability).reversed()
            .thenComparing(CouplingMetric::file);

    /**
     * One metric per graph node, keyed by file in path order. Isolated files
     * are included with instability 0.0.
     */
    public Map<Path, CouplingMetric> calculate(DependencyGraph graph) {
        Map<Path, CouplingMetric> metrics = new LinkedHashMap<>();
        for (Path file : graph.nodes()) {
            metrics.put(file, CouplingMetric.of(file, graph.inDegree(file), graph.outDegree(file)));
        }
        return metrics;
    }

    public static List<CouplingMetric> sortedByInstability(Collection<CouplingMetric> metrics) {
        List<CouplingMetric> sorted = new ArrayList<>(metrics);
        sorted.sort(BY_INSTABILITY);
        return sorted;
    }
}
