package com.pyscope.analyzer.metrics;

import java.nio.file.Path;

/**
 * Coupling summary of one file in the import graph.
 */
public record CouplingMetric(
        /** Canonical path of the file */
        Path file,

        /** Afferent coupling (Ca): distinct files importing this file */
        int afferent,

        /** Efferent coupling (Ce): distinct files this file imports */
        int efferent,

        /** Ce / (Ce + Ca), 0.0 for an isolated file */
        double instability) {

    /**
     * Builds the metric from raw counts.
     */
    public static CouplingMetric of(Path file, int afferent, int efferent) {
        int total = afferent + efferent;
        double instability = total == 0 ? 0.0 : (double) efferent / total;
        return new CouplingMetric(file, afferent, efferent, instability);
    }

    public boolean isIsolated() {
        return afferent == 0 && efferent == 0;
    }
}
