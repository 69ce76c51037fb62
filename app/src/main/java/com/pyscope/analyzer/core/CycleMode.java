package com.pyscope.analyzer.core;

/**
 * Cycle search used for the report.
 */
public enum CycleMode {
    /** One depth-first pass, at least one cycle per cluster. */
    REPRESENTATIVE,
    /** Every elementary cycle, up to the configured cap. */
    ELEMENTARY
}
