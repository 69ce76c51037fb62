package com.pyscope.analyzer.core;

import com.pyscope.analyzer.graph.Cycle;
import com.pyscope.analyzer.metrics.CouplingCalculator;
import com.pyscope.analyzer.metrics.CouplingMetric;

import java.nio.file.Path;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Immutable result of one project analysis, consumed by the report sinks.
 */
public record AnalysisReport(
        /** Canonical project root; report paths are relative to it */
        Path projectRoot,

        /** Sorted by file, line, name */
        List<UndefinedSymbol> undefinedSymbols,

        /** Sorted by file, line, name */
        List<UnusedSymbol> unusedSymbols,

        /** Cycles in discovery order */
        List<Cycle> cycles,

        /** One entry per graph node, in path order */
        Map<Path, CouplingMetric> couplingMetrics,

        /** Resolved import edges: file to the files it imports */
        Map<Path, List<Path>> dependencies,

        /** Sorted by file, line */
        List<Diagnostic> diagnostics,

        /** Module-level name to the files defining it */
        Map<String, List<Path>> projectSymbols,

        int filesAnalyzed,

        int filesSkipped,

        /** File counts, largest, test, entry and config files */
        ProjectSummary summary) {

    public AnalysisReport {
        Objects.requireNonNull(summary, "summary");
        undefinedSymbols = List.copyOf(undefinedSymbols);
        unusedSymbols = List.copyOf(unusedSymbols);
        cycles = List.copyOf(cycles);
        couplingMetrics = Collections.unmodifiableMap(new TreeMap<>(couplingMetrics));
        TreeMap<Path, List<Path>> deps = new TreeMap<>();
        dependencies.forEach((file, targets) -> deps.put(file, List.copyOf(targets)));
        dependencies = Collections.unmodifiableMap(deps);
        diagnostics = List.copyOf(diagnostics);
        TreeMap<String, List<Path>> symbols = new TreeMap<>();
        projectSymbols.forEach((name, files) -> symbols.put(name, List.copyOf(files)));
        projectSymbols = Collections.unmodifiableMap(symbols);
    }

    /**
     * True when the run found undefined symbols or import cycles.
     */
    public boolean hasFindings() {
        return !undefinedSymbols.isEmpty() || !cycles.isEmpty();
    }

    public List<CouplingMetric> metricsByInstability() {
        return CouplingCalculator.sortedByInstability(couplingMetrics.values());
    }

    /**
     * Path relative to the project root with {@code /} separators.
     */
    public String relativize(Path file) {
        Path rel = file.startsWith(projectRoot) ? projectRoot.relativize(file) : file;
        return rel.toString().replace('\\', '/');
    }
}
