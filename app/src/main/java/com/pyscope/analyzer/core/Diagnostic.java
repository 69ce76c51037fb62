package com.pyscope.analyzer.core;

import java.nio.file.Path;

/**
 * A non-finding note about the run, such as a skipped file.
 */
public record Diagnostic(Kind kind, Path file, int line, String message) {

    public enum Kind {
        FILE_SKIPPED("file-skipped"),
        WILDCARD_IMPORT("wildcard-import");

        private final String label;

        Kind(String label) {
            this.label = label;
        }

        public String label() {
            return label;
        }
    }

    public static Diagnostic fileSkipped(Path file, int line, String reason) {
        return new Diagnostic(Kind.FILE_SKIPPED, file, line, reason);
    }

    public static Diagnostic wildcardImport(Path file, int line, String module) {
        return new Diagnostic(Kind.WILDCARD_IMPORT, file, line, "from " + module + " import * cannot be resolved to names");
    }
}
