package com.pyscope.analyzer.metrics;

import com.pyscope.analyzer.graph.DependencyGraph;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CouplingCalculatorTest {

    private static final Path APP = Path.of("/p/app.py");
    private static final Path SERVICE = Path.of("/p/service.py");
    private static final Path UTIL = Path.of("/p/util.py");
    private static final Path LONELY = Path.of("/p/lonely.py");

    @Test
    void testCountsAndInstability() {
        DependencyGraph graph = new DependencyGraph();
        graph.addEdge(APP, SERVICE);
        graph.addEdge(APP, UTIL);
        graph.addEdge(SERVICE, UTIL);

        Map<Path, CouplingMetric> metrics = new CouplingCalculator().calculate(graph);

        CouplingMetric app = metrics.get(APP);
        assertEquals(0, app.afferent());
        assertEquals(2, app.efferent());
        assertEquals(1.0, app.instability(), 1e-9);

        CouplingMetric service = metrics.get(SERVICE);
        assertEquals(1, service.afferent());
        assertEquals(1, service.efferent());
        assertEquals(0.5, service.instability(), 1e-9);

        CouplingMetric util = metrics.get(UTIL);
        assertEquals(2, util.afferent());
        assertEquals(0, util.efferent());
        assertEquals(0.0, util.instability(), 1e-9);
    }

    @Test
    void testIsolatedFileIsStableNotNaN() {
        DependencyGraph graph = new DependencyGraph();
        graph.addNode(LONELY);

        CouplingMetric metric = new CouplingCalculator().calculate(graph).get(LONELY);

        assertNotNull(metric, "isolated files must have a metric");
        assertTrue(metric.isIsolated());
        assertEquals(0.0, metric.instability());
        assertFalse(Double.isNaN(metric.instability()));
    }

    @Test
    void testSortedByDescendingInstability() {
        List<CouplingMetric> sorted = CouplingCalculator.sortedByInstability(List.of(
                CouplingMetric.of(UTIL, 2, 0),
                CouplingMetric.of(APP, 0, 2),
                CouplingMetric.of(SERVICE, 1, 1)));

        assertEquals(List.of(APP, SERVICE, UTIL), sorted.stream().map(CouplingMetric::file).toList());
    }
}
