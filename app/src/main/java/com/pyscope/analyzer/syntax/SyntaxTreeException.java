package com.pyscope.analyzer.syntax;

import java.io.IOException;

/**
 * A source file could not be turned into a syntax tree.
 */
public class SyntaxTreeException extends IOException {

    private final int line;

    public SyntaxTreeException(String message, int line) {
        super(message);
        this.line = line;
    }

    public SyntaxTreeException(String message, Throwable cause) {
        super(message, cause);
        this.line = 0;
    }

    /**
     * Line the failure points at, 0 when unknown.
     */
    public int getLine() {
        return line;
    }
}
