package com.pyscope.analyzer.core;

import com.pyscope.analyzer.syntax.SyntaxNode;

import java.nio.file.Path;
import java.util.Objects;

/**
 * One project file handed over by the front-end, either with its syntax tree
 * or with the reason it could not be parsed.
 */
public record SourceUnit(
        /** Canonical absolute path */
        Path file,

        /** MODULE tree, null when the file was not parsed */
        SyntaxNode tree,

        /** Why the file was not parsed, null when it was */
        String error,

        /** Line the error points at, 0 when unknown */
        int errorLine) {

    public SourceUnit {
        Objects.requireNonNull(file, "file");
        if ((tree == null) == (error == null)) {
            throw new IllegalArgumentException("A source unit has either a tree or an error: " + file);
        }
    }

    public static SourceUnit parsed(Path file, SyntaxNode tree) {
        return new SourceUnit(file, Objects.requireNonNull(tree, "tree"), null, 0);
    }

    public static SourceUnit unparseable(Path file, String error, int errorLine) {
        return new SourceUnit(file, null, Objects.requireNonNull(error, "error"), errorLine);
    }

    public boolean isParsed() {
        return tree != null;
    }
}
