package com.pyscope.analyzer.report;

import java.io.IOException;
import java.nio.file.Path;

/**
 * A report could not be written. Any earlier file at the target is left as
 * it was.
 */
public class ReportWriteException extends IOException {

    private final Path target;

    public ReportWriteException(Path target, Throwable cause) {
        super("Could not write report " + target + ": " + cause.getMessage(), cause);
        this.target = target;
    }

    public Path getTarget() {
        return target;
    }
}
