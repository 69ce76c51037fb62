package com.pyscope.analyzer.core;

import java.nio.file.Path;
import java.util.List;

/**
 * High-level shape of the analyzed project, independent of any finding.
 */
public record ProjectSummary(
        /** Python files found under the root */
        int totalFiles,

        /** Lines across those files */
        long totalLines,

        /** Up to five biggest Python files, biggest first */
        List<FileSize> largestFiles,

        /** Python files whose root-relative path mentions "test" */
        List<Path> testFiles,

        /** main.py, app.py, __main__.py and run.py outside test paths */
        List<Path> entryModules,

        /** ini, cfg, conf, yaml, yml, json and toml files */
        List<Path> configFiles) {

    public record FileSize(Path file, long bytes) {
    }

    public ProjectSummary {
        largestFiles = List.copyOf(largestFiles);
        testFiles = List.copyOf(testFiles);
        entryModules = List.copyOf(entryModules);
        configFiles = List.copyOf(configFiles);
    }

    /** Summary of a run that did not survey the file system. */
    public static ProjectSummary empty() {
        return new ProjectSummary(0, 0, List.of(), List.of(), List.of(), List.of());
    }
}
