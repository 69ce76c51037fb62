package com.pyscope.analyzer.analyzers;

import com.pyscope.analyzer.core.SourceUnit;

import java.nio.file.Path;
import java.util.List;
import java.util.Set;

/**
 * Front-end that turns source files into syntax trees.
 */
public interface SourceParser {

    /**
     * Unique identifier for the source language (e.g., "python").
     */
    String getLanguageId();

    /**
     * File extensions this parser handles, with the leading dot.
     */
    Set<String> getSupportedExtensions();

    /**
     * Check if this parser can run here, e.g. whether the interpreter it
     * shells out to is installed.
     */
    boolean isAvailable();

    /**
     * Parse a single file. Never throws for a bad file: the failure is
     * carried by an unparseable {@link SourceUnit}.
     *
     * @param sourceFile canonical path of the file
     */
    SourceUnit parse(Path sourceFile);

    /**
     * Parse several files, one unit per input in input order.
     * Default implementation calls parse() for each file.
     */
    default List<SourceUnit> parseBatch(List<Path> files) {
        return files.stream()
                .map(this::parse)
                .toList();
    }
}
